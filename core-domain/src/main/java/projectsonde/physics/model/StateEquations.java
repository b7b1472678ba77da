package projectsonde.physics.model;

import projectsonde.config.ThermoConfig;

import java.util.Objects;

/**
 * Ecuaciones de estado analíticas: funciones puras que transforman un estado
 * termodinámico en una magnitud derivada, sin iteraciones.
 * <p>
 * Todas las temperaturas son absolutas [K] y las presiones en pascales [Pa].
 * Es thread safe: no guarda estado mutable, solo la configuración inmutable.
 *
 * @version 0.1
 * @since 2025-11-02
 */
public class StateEquations {

    private final ThermoConfig config;
    private final double kappa;
    private final double inverseKappa;
    private final double inverseReferenceTemperature;
    private final double vaporSlope;

    public StateEquations(ThermoConfig config) {
        this.config = Objects.requireNonNull(config, "La configuración termodinámica no puede ser nula.");
        this.kappa = config.kappa();
        this.inverseKappa = config.dryAirSpecificHeat() / config.dryAirGasConstant();
        this.inverseReferenceTemperature = 1.0 / config.referenceTemperature();
        this.vaporSlope = config.clausiusClapeyronSlope();
    }

    public ThermoConfig getConfig() {
        return config;
    }

    /**
     * Presión de vapor de equilibrio según Clausius-Clapeyron.
     *
     * @param temperature Temperatura [K].
     * @return Presión de vapor de saturación [Pa].
     */
    public double saturationVaporPressure(double temperature) {
        requireTemperature(temperature, "temperatura");
        return config.referenceVaporPressure() * Math.exp(vaporSlope * (inverseReferenceTemperature - 1.0 / temperature));
    }

    /**
     * Inversa analítica de {@link #saturationVaporPressure(double)}: temperatura a la que
     * la presión de vapor de saturación vale {@code vaporPressure}.
     */
    public double temperatureAtVaporPressure(double vaporPressure) {
        if (!Double.isFinite(vaporPressure) || vaporPressure <= 0) {
            throw new IllegalArgumentException("La presión de vapor debe ser finita y positiva, recibido: " + vaporPressure);
        }
        return 1.0 / (inverseReferenceTemperature - Math.log(vaporPressure / config.referenceVaporPressure()) / vaporSlope);
    }

    /**
     * Razón de mezcla a partir del punto de rocío y la presión (Bohren, ec. 5.14).
     *
     * @param dewPoint Punto de rocío [K].
     * @param pressure Presión [Pa].
     * @return Razón de mezcla [kg/kg].
     * @throws IllegalArgumentException si P - e_s(Td) cae por debajo de la presión mínima de aire seco.
     */
    public double mixingRatio(double dewPoint, double pressure) {
        requirePressure(pressure);
        double vaporPressure = saturationVaporPressure(dewPoint);
        return config.epsilon() * (vaporPressure / dryAirPressure(pressure, vaporPressure));
    }

    /**
     * Presión parcial del aire seco P - e, validando que no se aproxima a la singularidad.
     */
    public double dryAirPressure(double pressure, double vaporPressure) {
        double dry = pressure - vaporPressure;
        if (!(dry >= config.minimumDryAirPressure())) {
            throw new IllegalArgumentException(String.format(
                    "Evaluación singular: la presión de vapor (%.3f Pa) es prácticamente igual o mayor que la presión ambiente (%.3f Pa).",
                    vaporPressure, pressure));
        }
        return dry;
    }

    /**
     * Temperatura potencial mediante las relaciones de Poisson.
     */
    public double potentialTemperature(double temperature, double pressure) {
        requireTemperature(temperature, "temperatura");
        requirePressure(pressure);
        return temperature * Math.pow(config.referencePressure() / pressure, kappa);
    }

    /**
     * Temperatura sobre la adiabática seca de temperatura potencial {@code theta} a la presión dada.
     */
    public double dryAdiabatTemperature(double theta, double pressure) {
        requireTemperature(theta, "temperatura potencial");
        requirePressure(pressure);
        return theta * Math.pow(pressure / config.referencePressure(), kappa);
    }

    /**
     * Presión que alcanza una parcela que parte de (T0, P0) al llegar a la temperatura T
     * siguiendo una adiabática seca: P = P0 · (T / T0)^(cp/Rd).
     */
    public double poissonPressure(double temperature, double originTemperature, double originPressure) {
        return originPressure * Math.pow(temperature / originTemperature, inverseKappa);
    }

    /**
     * Temperatura virtual Tv = T(1 + 0.61 w).
     */
    public double virtualTemperature(double temperature, double mixingRatio) {
        requireTemperature(temperature, "temperatura");
        if (!Double.isFinite(mixingRatio) || mixingRatio < 0) {
            throw new IllegalArgumentException("La razón de mezcla debe ser finita y no negativa, recibido: " + mixingRatio);
        }
        return temperature * (1.0 + config.virtualTemperatureFactor() * mixingRatio);
    }

    /**
     * Punto de rocío a partir de la temperatura y la humedad relativa.
     *
     * @param temperature      Temperatura [K].
     * @param relativeHumidity Humedad relativa en tanto por uno, (0, 1].
     */
    public double dewPointFromRelativeHumidity(double temperature, double relativeHumidity) {
        if (!Double.isFinite(relativeHumidity) || relativeHumidity <= 0 || relativeHumidity > 1.0) {
            throw new IllegalArgumentException("La humedad relativa debe estar en (0, 1], recibido: " + relativeHumidity);
        }
        double vaporPressure = relativeHumidity * saturationVaporPressure(temperature);
        return temperatureAtVaporPressure(vaporPressure);
    }

    /**
     * Temperatura equivalente (Bohren, ec. 6.74): T + Lv·w / (cp + w·cw).
     */
    public double equivalentTemperature(double temperature, double pressure, double dewPoint) {
        requireDewPoint(temperature, dewPoint);
        double w = mixingRatio(dewPoint, pressure);
        return temperature + (config.latentHeatOfVaporization() * w)
                / (config.dryAirSpecificHeat() + w * config.liquidWaterSpecificHeat());
    }

    // --- VALIDACIONES DE DOMINIO ---

    public static void requireTemperature(double temperature, String name) {
        if (!Double.isFinite(temperature) || temperature <= 0) {
            throw new IllegalArgumentException("La " + name + " debe ser finita y positiva (absoluta), recibido: " + temperature);
        }
    }

    public static void requirePressure(double pressure) {
        if (!Double.isFinite(pressure) || pressure <= 0) {
            throw new IllegalArgumentException("La presión debe ser finita y positiva, recibido: " + pressure);
        }
    }

    public static void requireDewPoint(double temperature, double dewPoint) {
        requireTemperature(temperature, "temperatura");
        requireTemperature(dewPoint, "temperatura de rocío");
        if (dewPoint > temperature) {
            throw new IllegalArgumentException(String.format(
                    "El punto de rocío (%.3f K) no puede superar la temperatura (%.3f K).", dewPoint, temperature));
        }
    }
}
