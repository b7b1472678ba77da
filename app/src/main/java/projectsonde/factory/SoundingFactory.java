package projectsonde.factory;

import lombok.extern.slf4j.Slf4j;
import projectsonde.domain.sounding.Sounding;
import projectsonde.physics.model.StateEquations;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Construcción de sondeos a partir de observaciones en bruto.
 */
@Slf4j
public class SoundingFactory {

    private final StateEquations equations;

    public SoundingFactory(StateEquations equations) {
        this.equations = Objects.requireNonNull(equations, "Las ecuaciones de estado no pueden ser nulas.");
    }

    /**
     * Crea un sondeo a partir de niveles en cualquier orden, ordenándolos de la superficie
     * al espacio (presión decreciente).
     *
     * @throws IllegalArgumentException si hay presiones repetidas o los arrays no son co-indexados.
     */
    public Sounding fromLevels(double[] pressure, double[] temperature, double[] dewPoint) {
        Objects.requireNonNull(pressure, "El array de presiones no puede ser nulo.");
        Objects.requireNonNull(temperature, "El array de temperaturas no puede ser nulo.");
        Objects.requireNonNull(dewPoint, "El array de puntos de rocío no puede ser nulo.");
        if (temperature.length != pressure.length || dewPoint.length != pressure.length) {
            throw new IllegalArgumentException("Los arrays del sondeo deben tener la misma longitud.");
        }

        Integer[] order = IntStream.range(0, pressure.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> pressure[i]).reversed());

        double[] sortedPressure = new double[pressure.length];
        double[] sortedTemperature = new double[pressure.length];
        double[] sortedDewPoint = new double[pressure.length];
        for (int k = 0; k < order.length; k++) {
            int i = order[k];
            sortedPressure[k] = pressure[i];
            sortedTemperature[k] = temperature[i];
            sortedDewPoint[k] = dewPoint[i];
            if (k > 0 && sortedPressure[k] == sortedPressure[k - 1]) {
                throw new IllegalArgumentException("Presión repetida en el sondeo: " + sortedPressure[k] + " Pa");
            }
        }

        Sounding sounding = new Sounding(sortedPressure, sortedTemperature, sortedDewPoint);
        log.debug("Sondeo creado: {}", sounding);
        return sounding;
    }

    /**
     * Crea un sondeo derivando el punto de rocío de la humedad relativa de cada nivel.
     *
     * @param relativeHumidity Humedad relativa en tanto por uno, (0, 1].
     */
    public Sounding fromRelativeHumidity(double[] pressure, double[] temperature, double[] relativeHumidity) {
        Objects.requireNonNull(temperature, "El array de temperaturas no puede ser nulo.");
        Objects.requireNonNull(relativeHumidity, "El array de humedades relativas no puede ser nulo.");
        if (relativeHumidity.length != temperature.length) {
            throw new IllegalArgumentException("Temperaturas y humedades relativas deben tener la misma longitud.");
        }
        double[] dewPoint = new double[temperature.length];
        for (int i = 0; i < temperature.length; i++) {
            // Con HR = 1 el redondeo puede dejar Td un ulp por encima de T.
            dewPoint[i] = Math.min(equations.dewPointFromRelativeHumidity(temperature[i], relativeHumidity[i]), temperature[i]);
        }
        return fromLevels(pressure, temperature, dewPoint);
    }
}
