package projectsonde.domain.profile;

import java.util.Arrays;

/**
 * Sondeo remuestreado sobre una rejilla fija de presiones, de la superficie al espacio.
 *
 * @param pressure    Presiones [Pa], estrictamente decrecientes.
 * @param temperature Temperaturas del entorno [K].
 * @param dewPoint    Puntos de rocío del entorno [K].
 */
public record EnvironmentalProfile(double[] pressure, double[] temperature, double[] dewPoint) {

    public EnvironmentalProfile {
        ProfileArrays.requireColumn(pressure, temperature, dewPoint);
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
        EnvironmentalProfile that = (EnvironmentalProfile) o;
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
        return String.format("EnvironmentalProfile[%d niveles]", pressure.length);
    }
}
