package projectsonde.physics.profile;

import lombok.extern.slf4j.Slf4j;
import projectsonde.domain.profile.EnvironmentalProfile;
import projectsonde.domain.sounding.Sounding;
import projectsonde.physics.i.ICurveGenerator;
import projectsonde.physics.model.StateEquations;
import projectsonde.utils.LogPressureInterpolation;
import projectsonde.utils.PressureGrid;

import java.util.Objects;

/**
 * Remuestrea un sondeo sobre una rejilla de presiones equiespaciada.
 * <p>
 * Dentro del rango observado interpola en log10(P) entre los niveles que encierran cada
 * presión. Fuera de él extrapola tomando el nivel frontera como origen de una adiabática
 * seca (temperatura) y de una línea de razón de mezcla (punto de rocío).
 */
@Slf4j
public class EnvironmentalProfileBuilder {

    private final StateEquations equations;
    private final ICurveGenerator dryAdiabat;
    private final ICurveGenerator mixingRatioLine;

    public EnvironmentalProfileBuilder(StateEquations equations, ICurveGenerator dryAdiabat, ICurveGenerator mixingRatioLine) {
        this.equations = Objects.requireNonNull(equations, "Las ecuaciones de estado no pueden ser nulas.");
        this.dryAdiabat = Objects.requireNonNull(dryAdiabat, "El generador de adiabática seca no puede ser nulo.");
        this.mixingRatioLine = Objects.requireNonNull(mixingRatioLine, "El generador de razón de mezcla no puede ser nulo.");
    }

    /**
     * @param sounding Sondeo observado, de la superficie al espacio.
     * @param p1       Presión inicial de la rejilla [Pa] (la mayor).
     * @param p2       Presión final de la rejilla [Pa] (la menor).
     * @param step     Paso [Pa].
     */
    public EnvironmentalProfile build(Sounding sounding, double p1, double p2, double step) {
        Objects.requireNonNull(sounding, "El sondeo no puede ser nulo.");
        if (!(p1 > p2)) {
            throw new IllegalArgumentException(String.format(
                    "La rejilla debe ir de la superficie al espacio: p1 (%.2f Pa) debe ser mayor que p2 (%.2f Pa).", p1, p2));
        }
        double[] pressures = PressureGrid.stepped(p1, p2, step);
        double[] temperature = new double[pressures.length];
        double[] dewPoint = new double[pressures.length];

        int surface = 0;
        int top = sounding.levelCount() - 1;
        int extrapolated = 0;

        for (int i = 0; i < pressures.length; i++) {
            double p = pressures[i];
            if (sounding.spans(p)) {
                temperature[i] = LogPressureInterpolation.temperatureAt(sounding, p);
                dewPoint[i] = LogPressureInterpolation.dewPointAt(sounding, p);
            } else {
                int boundary = p > sounding.surfacePressure() ? surface : top;
                temperature[i] = extrapolateTemperature(sounding, boundary, p);
                dewPoint[i] = extrapolateDewPoint(sounding, boundary, p);
                extrapolated++;
            }
        }

        if (extrapolated > 0) {
            log.debug("Perfil de entorno: {} de {} niveles extrapolados fuera del sondeo [{}, {}] Pa",
                    extrapolated, pressures.length, sounding.topPressure(), sounding.surfacePressure());
        }
        return new EnvironmentalProfile(pressures, temperature, dewPoint);
    }

    private double extrapolateTemperature(Sounding sounding, int boundary, double pressure) {
        double theta = equations.potentialTemperature(sounding.getTemperatureAt(boundary), sounding.getPressureAt(boundary));
        return dryAdiabat.temperatureAt(theta, pressure);
    }

    private double extrapolateDewPoint(Sounding sounding, int boundary, double pressure) {
        double mixingRatio = equations.mixingRatio(sounding.getDewPointAt(boundary), sounding.getPressureAt(boundary));
        return mixingRatioLine.temperatureAt(mixingRatio, pressure);
    }
}
