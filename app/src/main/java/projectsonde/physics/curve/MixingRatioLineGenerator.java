package projectsonde.physics.curve;

import projectsonde.domain.curve.CurveType;
import projectsonde.physics.solver.impl.MixingRatioIsoplethSolver;

/**
 * Línea de razón de mezcla de saturación constante.
 */
public class MixingRatioLineGenerator extends IterativeCurveGenerator {

    public MixingRatioLineGenerator(MixingRatioIsoplethSolver solver, CurveBatchProcessor batchProcessor) {
        super(solver, batchProcessor);
    }

    @Override
    public String getName() {
        return "MixingRatioLine";
    }

    @Override
    public CurveType getCurveType() {
        return CurveType.MIXING_RATIO_LINE;
    }
}
