package projectsonde.physics.curve;

import projectsonde.domain.curve.AdiabatCurve;
import projectsonde.domain.curve.CurveType;
import projectsonde.physics.i.ICurveGenerator;
import projectsonde.physics.model.StateEquations;

import java.util.Objects;

/**
 * Adiabática seca (θ constante) en forma cerrada mediante las relaciones de Poisson.
 */
public class DryAdiabatGenerator implements ICurveGenerator {

    private final StateEquations equations;

    public DryAdiabatGenerator(StateEquations equations) {
        this.equations = Objects.requireNonNull(equations, "Las ecuaciones de estado no pueden ser nulas.");
    }

    @Override
    public String getName() {
        return "DryAdiabat";
    }

    @Override
    public String getDescription() {
        return "T = θ (P / P_ref)^(Rd/cp), sin iteraciones";
    }

    @Override
    public CurveType getCurveType() {
        return CurveType.DRY_ADIABAT;
    }

    @Override
    public double temperatureAt(double theta, double pressure) {
        return equations.dryAdiabatTemperature(theta, pressure);
    }

    @Override
    public AdiabatCurve generate(double theta, double[] pressures) {
        Objects.requireNonNull(pressures, "El array de presiones no puede ser nulo.");
        double[] temperatures = new double[pressures.length];
        for (int i = 0; i < pressures.length; i++) {
            temperatures[i] = equations.dryAdiabatTemperature(theta, pressures[i]);
        }
        return new AdiabatCurve(CurveType.DRY_ADIABAT, theta, pressures, temperatures);
    }
}
