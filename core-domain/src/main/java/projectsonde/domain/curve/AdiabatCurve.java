package projectsonde.domain.curve;

import projectsonde.physics.model.StateEquations;

import java.util.Arrays;
import java.util.Objects;

/**
 * Secuencia ordenada de pares (presión, temperatura) a lo largo de una adiabática
 * o de una línea de razón de mezcla constante.
 * <p>
 * La presión es estrictamente monótona; el sentido lo fija quien genera la curva.
 *
 * @param type        Familia de la curva.
 * @param level       Valor conservado a lo largo de la curva (θ, w o θe).
 * @param pressure    Presiones de cada muestra [Pa].
 * @param temperature Temperaturas de cada muestra [K].
 */
public record AdiabatCurve(CurveType type, double level, double[] pressure, double[] temperature) {

    public AdiabatCurve {
        Objects.requireNonNull(type, "El tipo de curva no puede ser nulo.");
        Objects.requireNonNull(pressure, "El array de presiones no puede ser nulo.");
        Objects.requireNonNull(temperature, "El array de temperaturas no puede ser nulo.");
        if (pressure.length != temperature.length) {
            throw new IllegalArgumentException("Presiones y temperaturas de la curva deben tener la misma longitud.");
        }
        if (pressure.length == 0) {
            throw new IllegalArgumentException("Una curva necesita al menos una muestra.");
        }
        for (double p : pressure) {
            StateEquations.requirePressure(p);
        }
        if (pressure.length > 1) {
            double direction = Math.signum(pressure[1] - pressure[0]);
            for (int i = 1; i < pressure.length; i++) {
                if (direction == 0 || Math.signum(pressure[i] - pressure[i - 1]) != direction) {
                    throw new IllegalArgumentException("La presión de la curva debe ser estrictamente monótona (muestra " + i + ").");
                }
            }
        }
        pressure = pressure.clone();
        temperature = temperature.clone();
    }

    public int size() {
        return pressure.length;
    }

    public double getPressureAt(int index) {
        return pressure[index];
    }

    public double getTemperatureAt(int index) {
        return temperature[index];
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
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AdiabatCurve that = (AdiabatCurve) o;
        return type == that.type &&
                Double.compare(level, that.level) == 0 &&
                Arrays.equals(pressure, that.pressure) &&
                Arrays.equals(temperature, that.temperature);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(type, level);
        result = 31 * result + Arrays.hashCode(pressure);
        result = 31 * result + Arrays.hashCode(temperature);
        return result;
    }

    @Override
    public String toString() {
        return String.format("AdiabatCurve[%s, nivel=%.6f, %d muestras]", type, level, pressure.length);
    }
}
