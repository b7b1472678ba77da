package projectsonde.physics.curve;

import lombok.extern.slf4j.Slf4j;
import projectsonde.domain.curve.AdiabatCurve;
import projectsonde.physics.i.ICurveGenerator;
import projectsonde.physics.solver.impl.CurvePointSolver;

import java.util.Objects;

/**
 * Generador de curvas que requieren una bisección por nivel de presión.
 */
@Slf4j
public abstract class IterativeCurveGenerator implements ICurveGenerator {

    private final CurvePointSolver pointSolver;
    private final CurveBatchProcessor batchProcessor;

    protected IterativeCurveGenerator(CurvePointSolver pointSolver, CurveBatchProcessor batchProcessor) {
        this.pointSolver = Objects.requireNonNull(pointSolver, "El solver de punto no puede ser nulo.");
        this.batchProcessor = Objects.requireNonNull(batchProcessor, "El procesador de lotes no puede ser nulo.");
    }

    @Override
    public double temperatureAt(double level, double pressure) {
        return pointSolver.solve(level, pressure);
    }

    @Override
    public AdiabatCurve generate(double level, double[] pressures) {
        Objects.requireNonNull(pressures, "El array de presiones no puede ser nulo.");
        long startTime = System.currentTimeMillis();
        double[] temperatures = batchProcessor.sample(pressures, pressure -> pointSolver.solve(level, pressure));
        AdiabatCurve curve = new AdiabatCurve(getCurveType(), level, pressures, temperatures);
        log.debug("{} generada: {} niveles en {} ms", getName(), pressures.length, System.currentTimeMillis() - startTime);
        return curve;
    }
}
