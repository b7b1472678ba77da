package projectsonde.domain.profile;

import projectsonde.domain.thermo.CondensationLevel;
import projectsonde.domain.thermo.ThermodynamicState;

import java.util.Arrays;
import java.util.Objects;

/**
 * Trayectoria de una parcela en toda la columna: presión, temperatura y punto de rocío
 * co-indexados, de la superficie al espacio.
 * <p>
 * Los niveles {@code 0..lclIndex} (presión ≥ presión del LCL) siguen la adiabática seca y la
 * línea de razón de mezcla; el resto sigue la adiabática húmeda.
 *
 * @param pressure          Presiones [Pa], estrictamente decrecientes.
 * @param temperature       Temperaturas de la parcela [K].
 * @param dewPoint          Puntos de rocío de la parcela [K].
 * @param origin            Estado de la parcela en su nivel de origen.
 * @param condensationLevel LCL de la parcela.
 * @param lclIndex          Último índice con presión ≥ presión del LCL, o -1 si ninguno.
 */
public record ParcelProfile(
        double[] pressure,
        double[] temperature,
        double[] dewPoint,
        ThermodynamicState origin,
        CondensationLevel condensationLevel,
        int lclIndex
) {

    public ParcelProfile {
        ProfileArrays.requireColumn(pressure, temperature, dewPoint);
        Objects.requireNonNull(origin, "El estado de origen no puede ser nulo.");
        Objects.requireNonNull(condensationLevel, "El LCL no puede ser nulo.");
        if (lclIndex < -1 || lclIndex >= pressure.length) {
            throw new IllegalArgumentException("Índice de LCL fuera de rango: " + lclIndex);
        }
        pressure = pressure.clone();
        temperature = temperature.clone();
        dewPoint = dewPoint.clone();
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

    public double getDewPointAt(int index) {
        return dewPoint[index];
    }

    /**
     * Indica si el nivel pertenece al tramo saturado (adiabática húmeda).
     */
    public boolean isSaturatedAt(int index) {
        return index > lclIndex;
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
        ParcelProfile that = (ParcelProfile) o;
        return lclIndex == that.lclIndex &&
                origin.equals(that.origin) &&
                condensationLevel.equals(that.condensationLevel) &&
                Arrays.equals(pressure, that.pressure) &&
                Arrays.equals(temperature, that.temperature) &&
                Arrays.equals(dewPoint, that.dewPoint);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(origin, condensationLevel, lclIndex);
        result = 31 * result + Arrays.hashCode(pressure);
        result = 31 * result + Arrays.hashCode(temperature);
        result = 31 * result + Arrays.hashCode(dewPoint);
        return result;
    }

    @Override
    public String toString() {
        return String.format("ParcelProfile[%d niveles, origen=%.1f Pa, LCL=%.1f Pa]",
                pressure.length, origin.pressure(), condensationLevel.pressure());
    }
}
