package projectsonde.domain.sounding;

import lombok.Builder;
import projectsonde.domain.thermo.ThermodynamicState;
import projectsonde.physics.model.StateEquations;

import java.util.Arrays;
import java.util.Objects;

/**
 * Sondeo atmosférico observado: tres arrays co-indexados de presión, temperatura y
 * punto de rocío, ordenados de la superficie (presión máxima) hacia el espacio.
 * <p>
 * El constructor canónico valida el contrato de entrada y crea copias defensivas,
 * de modo que el sondeo es inmutable una vez construido.
 *
 * @param pressure    Presiones [Pa], estrictamente decrecientes.
 * @param temperature Temperaturas [K].
 * @param dewPoint    Puntos de rocío [K], cada uno no superior a su temperatura.
 */
@Builder
public record Sounding(double[] pressure, double[] temperature, double[] dewPoint) {

    public Sounding {
        Objects.requireNonNull(pressure, "El array de presiones no puede ser nulo.");
        Objects.requireNonNull(temperature, "El array de temperaturas no puede ser nulo.");
        Objects.requireNonNull(dewPoint, "El array de puntos de rocío no puede ser nulo.");

        int length = pressure.length;
        if (temperature.length != length || dewPoint.length != length) {
            throw new IllegalArgumentException("Los arrays del sondeo deben tener la misma longitud.");
        }
        if (length < 2) {
            throw new IllegalArgumentException("Un sondeo necesita al menos dos niveles.");
        }

        for (int i = 0; i < length; i++) {
            StateEquations.requirePressure(pressure[i]);
            StateEquations.requireDewPoint(temperature[i], dewPoint[i]);
            if (i > 0 && pressure[i] >= pressure[i - 1]) {
                throw new IllegalArgumentException(String.format(
                        "El sondeo debe ir de la superficie al espacio: la presión no decrece del nivel %d (%.2f Pa) al nivel %d (%.2f Pa).",
                        i - 1, pressure[i - 1], i, pressure[i]));
            }
        }

        pressure = pressure.clone();
        temperature = temperature.clone();
        dewPoint = dewPoint.clone();
    }

    private void validateLevelIndex(int levelIndex) {
        if (levelIndex < 0 || levelIndex >= pressure.length) {
            throw new IndexOutOfBoundsException("El índice de nivel " + levelIndex + " está fuera de los límites [0, " + (pressure.length - 1) + "].");
        }
    }

    public int levelCount() {
        return pressure.length;
    }

    public double getPressureAt(int levelIndex) {
        validateLevelIndex(levelIndex);
        return pressure[levelIndex];
    }

    public double getTemperatureAt(int levelIndex) {
        validateLevelIndex(levelIndex);
        return temperature[levelIndex];
    }

    public double getDewPointAt(int levelIndex) {
        validateLevelIndex(levelIndex);
        return dewPoint[levelIndex];
    }

    public ThermodynamicState getStateAt(int levelIndex) {
        validateLevelIndex(levelIndex);
        return new ThermodynamicState(pressure[levelIndex], temperature[levelIndex], dewPoint[levelIndex]);
    }

    /**
     * Presión del nivel más bajo (superficie).
     */
    public double surfacePressure() {
        return pressure[0];
    }

    /**
     * Presión del nivel más alto observado.
     */
    public double topPressure() {
        return pressure[pressure.length - 1];
    }

    /**
     * Indica si la presión cae dentro del rango observado, extremos incluidos.
     */
    public boolean spans(double p) {
        return p <= surfacePressure() && p >= topPressure();
    }

    /**
     * Índice del nivel cuya presión coincide exactamente con {@code p}, o -1 si no existe.
     */
    public int indexOf(double p) {
        for (int i = 0; i < pressure.length; i++) {
            if (pressure[i] == p) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public double[] pressure() {
        return pressure.clone();
    }

    @Override
    public double[] temperature() {
        return temperature.clone();
    }

    @Override
    public double[] dewPoint() {
        return dewPoint.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Sounding that = (Sounding) o;
        return Arrays.equals(pressure, that.pressure) &&
                Arrays.equals(temperature, that.temperature) &&
                Arrays.equals(dewPoint, that.dewPoint);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(pressure);
        result = 31 * result + Arrays.hashCode(temperature);
        result = 31 * result + Arrays.hashCode(dewPoint);
        return result;
    }

    @Override
    public String toString() {
        return String.format("Sounding[%d niveles, %.1f Pa -> %.1f Pa]", pressure.length, surfacePressure(), topPressure());
    }
}
