package projectsonde.utils;

import projectsonde.domain.sounding.Sounding;

/**
 * Interpolación lineal en el espacio del logaritmo decimal de la presión.
 * <p>
 * Se asume que la temperatura y el punto de rocío varían linealmente con log10(P)
 * entre cada par de niveles consecutivos del sondeo.
 */
public final class LogPressureInterpolation {

    private LogPressureInterpolation() {
    }

    /**
     * Recta entre (x1, y1) y (x2, y2) evaluada en x.
     */
    public static double linear(double x, double x1, double y1, double x2, double y2) {
        double slope = (y2 - y1) / (x2 - x1);
        return slope * (x - x1) + y1;
    }

    /**
     * Interpola en log10(P) el valor en {@code pressure} entre dos niveles de presión.
     */
    public static double interpolate(double pressure, double p1, double y1, double p2, double y2) {
        return linear(Math.log10(pressure), Math.log10(p1), y1, Math.log10(p2), y2);
    }

    /**
     * Índice del nivel del sondeo inmediatamente por debajo (presión mayor) de {@code pressure}.
     * El nivel {@code índice + 1} queda inmediatamente por encima.
     *
     * @throws IllegalArgumentException si la presión no cae estrictamente dentro del sondeo.
     */
    public static int bracketingIndex(Sounding sounding, double pressure) {
        if (!(pressure < sounding.surfacePressure() && pressure > sounding.topPressure())) {
            throw new IllegalArgumentException(String.format(
                    "La presión %.2f Pa no está estrictamente dentro del sondeo [%.2f, %.2f] Pa.",
                    pressure, sounding.topPressure(), sounding.surfacePressure()));
        }
        int index = 0;
        while (sounding.getPressureAt(index + 1) > pressure) {
            index++;
        }
        return index;
    }

    /**
     * Temperatura del sondeo en {@code pressure}: valor exacto si el nivel existe,
     * interpolado en log-presión si cae entre dos niveles.
     */
    public static double temperatureAt(Sounding sounding, double pressure) {
        int exact = sounding.indexOf(pressure);
        if (exact >= 0) {
            return sounding.getTemperatureAt(exact);
        }
        int below = bracketingIndex(sounding, pressure);
        return interpolate(pressure,
                sounding.getPressureAt(below), sounding.getTemperatureAt(below),
                sounding.getPressureAt(below + 1), sounding.getTemperatureAt(below + 1));
    }

    /**
     * Punto de rocío del sondeo en {@code pressure}, con el mismo criterio que {@link #temperatureAt}.
     */
    public static double dewPointAt(Sounding sounding, double pressure) {
        int exact = sounding.indexOf(pressure);
        if (exact >= 0) {
            return sounding.getDewPointAt(exact);
        }
        int below = bracketingIndex(sounding, pressure);
        return interpolate(pressure,
                sounding.getPressureAt(below), sounding.getDewPointAt(below),
                sounding.getPressureAt(below + 1), sounding.getDewPointAt(below + 1));
    }
}
