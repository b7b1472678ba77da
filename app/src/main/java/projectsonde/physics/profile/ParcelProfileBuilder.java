package projectsonde.physics.profile;

import lombok.extern.slf4j.Slf4j;
import projectsonde.domain.profile.ParcelProfile;
import projectsonde.domain.profile.ProfileMode;
import projectsonde.domain.sounding.Sounding;
import projectsonde.domain.thermo.CondensationLevel;
import projectsonde.domain.thermo.ThermodynamicState;
import projectsonde.physics.i.ICurveGenerator;
import projectsonde.physics.impl.MoistThermodynamics;
import projectsonde.physics.model.StateEquations;
import projectsonde.utils.LogPressureInterpolation;
import projectsonde.utils.PressureGrid;

import java.util.Arrays;
import java.util.Objects;

/**
 * Construye la trayectoria de una parcela que asciende desde un nivel del sondeo.
 * <p>
 * Hasta el LCL (niveles con presión ≥ presión del LCL) la temperatura sigue la adiabática
 * seca y el punto de rocío la línea de razón de mezcla de origen. Por encima, ambos siguen
 * la adiabática húmeda de la θe de origen.
 */
@Slf4j
public class ParcelProfileBuilder {

    private final MoistThermodynamics moist;
    private final StateEquations equations;
    private final ICurveGenerator dryAdiabat;
    private final ICurveGenerator mixingRatioLine;
    private final ICurveGenerator moistAdiabat;

    public ParcelProfileBuilder(MoistThermodynamics moist,
                                ICurveGenerator dryAdiabat,
                                ICurveGenerator mixingRatioLine,
                                ICurveGenerator moistAdiabat) {
        this.moist = Objects.requireNonNull(moist, "La termodinámica húmeda no puede ser nula.");
        this.dryAdiabat = Objects.requireNonNull(dryAdiabat, "El generador de adiabática seca no puede ser nulo.");
        this.mixingRatioLine = Objects.requireNonNull(mixingRatioLine, "El generador de razón de mezcla no puede ser nulo.");
        this.moistAdiabat = Objects.requireNonNull(moistAdiabat, "El generador de adiabática húmeda no puede ser nulo.");
        this.equations = moist.getEquations();
    }

    /**
     * Perfil de parcela sobre los mismos niveles de presión del sondeo.
     */
    public ParcelProfile build(double originPressure, Sounding sounding) {
        return build(originPressure, sounding, ProfileMode.SAME_LEVELS, Double.NaN, Double.NaN, Double.NaN);
    }

    /**
     * Perfil de parcela.
     *
     * @param originPressure Presión donde se origina la parcela [Pa].
     * @param sounding       Sondeo del entorno.
     * @param mode           Niveles del sondeo o rejilla nueva.
     * @param p1             Cota inferior (presión mayor) de la rejilla [Pa]. Solo en {@link ProfileMode#STEPPED}.
     * @param p2             Cota superior (presión menor) de la rejilla [Pa]. Solo en {@link ProfileMode#STEPPED}.
     * @param step           Paso de la rejilla [Pa]. Solo en {@link ProfileMode#STEPPED}.
     * @throws IllegalArgumentException si el origen cae fuera del rango del sondeo.
     */
    public ParcelProfile build(double originPressure, Sounding sounding, ProfileMode mode,
                               double p1, double p2, double step) {
        Objects.requireNonNull(sounding, "El sondeo no puede ser nulo.");
        Objects.requireNonNull(mode, "El modo de perfil no puede ser nulo.");

        ThermodynamicState origin = originState(originPressure, sounding);
        double[] pressures = pressureLevels(sounding, mode, p1, p2, step);

        CondensationLevel lcl = moist.getLclSolver().solve(origin);
        double theta = equations.potentialTemperature(origin.temperature(), origin.pressure());
        double thetaE = moist.equivalentPotentialTemperature(lcl);
        double mixingRatio = equations.mixingRatio(origin.dewPoint(), origin.pressure());

        int lclIndex = lastIndexAtOrBelow(pressures, lcl.pressure());
        double[] temperature = new double[pressures.length];
        double[] dewPoint = new double[pressures.length];

        if (lclIndex >= 0) {
            double[] drySegment = Arrays.copyOfRange(pressures, 0, lclIndex + 1);
            System.arraycopy(dryAdiabat.generate(theta, drySegment).temperature(), 0, temperature, 0, drySegment.length);
            System.arraycopy(mixingRatioLine.generate(mixingRatio, drySegment).temperature(), 0, dewPoint, 0, drySegment.length);
        }
        if (lclIndex < pressures.length - 1) {
            double[] moistSegment = Arrays.copyOfRange(pressures, lclIndex + 1, pressures.length);
            double[] saturated = moistAdiabat.generate(thetaE, moistSegment).temperature();
            System.arraycopy(saturated, 0, temperature, lclIndex + 1, saturated.length);
            System.arraycopy(saturated, 0, dewPoint, lclIndex + 1, saturated.length);
        }

        log.debug("Perfil de parcela desde {} Pa: {} niveles, LCL en {} Pa (índice {})",
                origin.pressure(), pressures.length, lcl.pressure(), lclIndex);
        return new ParcelProfile(pressures, temperature, dewPoint, origin, lcl, lclIndex);
    }

    /**
     * Estado de la parcela en su origen: nivel exacto del sondeo o interpolación en log-presión.
     */
    public ThermodynamicState originState(double originPressure, Sounding sounding) {
        StateEquations.requirePressure(originPressure);
        if (!sounding.spans(originPressure)) {
            throw new IllegalArgumentException(String.format(
                    "El origen de la parcela (%.2f Pa) está fuera del sondeo [%.2f, %.2f] Pa.",
                    originPressure, sounding.topPressure(), sounding.surfacePressure()));
        }
        double temperature = LogPressureInterpolation.temperatureAt(sounding, originPressure);
        double dewPoint = LogPressureInterpolation.dewPointAt(sounding, originPressure);
        return new ThermodynamicState(originPressure, temperature, dewPoint);
    }

    private static double[] pressureLevels(Sounding sounding, ProfileMode mode, double p1, double p2, double step) {
        if (mode == ProfileMode.SAME_LEVELS) {
            return sounding.pressure();
        }
        if (!(p1 > p2)) {
            throw new IllegalArgumentException(String.format(
                    "La rejilla debe ir de la superficie al espacio: p1 (%.2f Pa) debe ser mayor que p2 (%.2f Pa).", p1, p2));
        }
        return PressureGrid.stepped(p1, p2, step);
    }

    // Último índice con presión ≥ presión del LCL; las presiones decrecen con el índice.
    static int lastIndexAtOrBelow(double[] pressures, double lclPressure) {
        int index = -1;
        for (int i = 0; i < pressures.length && pressures[i] >= lclPressure; i++) {
            index = i;
        }
        return index;
    }
}
