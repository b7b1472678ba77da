package projectsonde.physics.curve;

import projectsonde.domain.curve.CurveType;
import projectsonde.physics.solver.impl.MoistAdiabatSolver;

/**
 * Adiabática húmeda (θe constante), resuelta nivel a nivel.
 */
public class MoistAdiabatGenerator extends IterativeCurveGenerator {

    public MoistAdiabatGenerator(MoistAdiabatSolver solver, CurveBatchProcessor batchProcessor) {
        super(solver, batchProcessor);
    }

    @Override
    public String getName() {
        return "MoistAdiabat";
    }

    @Override
    public String getDescription() {
        return "Adiabática húmeda por bisección de θes en cada nivel";
    }

    @Override
    public CurveType getCurveType() {
        return CurveType.MOIST_ADIABAT;
    }
}
