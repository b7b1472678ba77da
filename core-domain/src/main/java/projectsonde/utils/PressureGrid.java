package projectsonde.utils;

/**
 * Construcción de rejillas de presión equiespaciadas.
 */
public final class PressureGrid {

    // Holgura frente a errores de redondeo al contar muestras (p1 - p2) / paso.
    private static final double COUNT_EPSILON = 1e-9;

    private PressureGrid() {
    }

    /**
     * Número de muestras entre p1 y p2 con el paso dado, ambos extremos incluidos
     * cuando caen sobre la rejilla: floor(|p1 - p2| / paso) + 1.
     */
    public static int sampleCount(double p1, double p2, double step) {
        validate(p1, p2, step);
        return (int) Math.floor(Math.abs(p1 - p2) / step + COUNT_EPSILON) + 1;
    }

    /**
     * Rejilla que parte de p1 y avanza hacia p2 con el paso dado. El sentido lo
     * determina el signo de (p1 - p2): decreciente si p1 > p2.
     */
    public static double[] stepped(double p1, double p2, double step) {
        int count = sampleCount(p1, p2, step);
        double direction = p1 >= p2 ? -1.0 : 1.0;
        double[] grid = new double[count];
        for (int i = 0; i < count; i++) {
            grid[i] = p1 + direction * step * i;
        }
        return grid;
    }

    private static void validate(double p1, double p2, double step) {
        if (!Double.isFinite(step) || step <= 0) {
            throw new IllegalArgumentException("El paso de presión debe ser finito y positivo, recibido: " + step);
        }
        if (!Double.isFinite(p1) || !Double.isFinite(p2) || p1 <= 0 || p2 <= 0) {
            throw new IllegalArgumentException(String.format("Las cotas de presión deben ser finitas y positivas: p1=%.3f, p2=%.3f", p1, p2));
        }
    }
}
