package projectsonde.config;

import lombok.Builder;
import lombok.With;

/**
 * Objeto de valor inmutable con todas las constantes físicas que comparten
 * las ecuaciones de estado, los solvers de equilibrio y los generadores de curvas.
 * <p>
 * Se crea una única vez y se pasa por referencia a cada componente, de modo que
 * ninguna clase redeclara sus propias constantes termodinámicas.
 *
 * @param dryAirGasConstant          Constante de los gases para aire seco, Rd [J/(kg·K)].
 * @param dryAirSpecificHeat         Calor específico del aire seco a presión constante, cp [J/(kg·K)].
 * @param latentHeatOfVaporization   Entalpía de vaporización, Lv [J/kg].
 * @param vaporGasConstant           Constante de los gases para el vapor de agua, Rv [J/(kg·K)].
 * @param epsilon                    Cociente de masas molares vapor / aire seco (adimensional).
 * @param referenceVaporPressure     Presión de vapor de saturación en el punto triple, e0 [Pa].
 * @param referenceTemperature       Temperatura de referencia de Clausius-Clapeyron, T0 [K].
 * @param liquidWaterSpecificHeat    Calor específico del agua líquida, cw [J/(kg·K)].
 * @param referencePressure          Presión de referencia para temperaturas potenciales [Pa].
 * @param virtualTemperatureFactor   Factor de la temperatura virtual Tv = T(1 + f·w).
 * @param minimumDryAirPressure      Presión parcial mínima de aire seco (P - e) aceptada antes de
 *                                   declarar singular la razón de mezcla [Pa].
 */
@Builder
@With
public record ThermoConfig(
        double dryAirGasConstant,
        double dryAirSpecificHeat,
        double latentHeatOfVaporization,
        double vaporGasConstant,
        double epsilon,
        double referenceVaporPressure,
        double referenceTemperature,
        double liquidWaterSpecificHeat,
        double referencePressure,
        double virtualTemperatureFactor,
        double minimumDryAirPressure
) {

    public ThermoConfig {
        requirePositive(dryAirGasConstant, "dryAirGasConstant");
        requirePositive(dryAirSpecificHeat, "dryAirSpecificHeat");
        requirePositive(latentHeatOfVaporization, "latentHeatOfVaporization");
        requirePositive(vaporGasConstant, "vaporGasConstant");
        requirePositive(epsilon, "epsilon");
        requirePositive(referenceVaporPressure, "referenceVaporPressure");
        requirePositive(referenceTemperature, "referenceTemperature");
        requirePositive(liquidWaterSpecificHeat, "liquidWaterSpecificHeat");
        requirePositive(referencePressure, "referencePressure");
        if (!Double.isFinite(virtualTemperatureFactor) || virtualTemperatureFactor < 0) {
            throw new IllegalArgumentException("El factor de temperatura virtual debe ser finito y no negativo.");
        }
        requirePositive(minimumDryAirPressure, "minimumDryAirPressure");
    }

    private static void requirePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new IllegalArgumentException("La constante '" + name + "' debe ser finita y positiva, recibido: " + value);
        }
    }

    /**
     * Exponente de Poisson κ = Rd / cp.
     */
    public double kappa() {
        return dryAirGasConstant / dryAirSpecificHeat;
    }

    /**
     * Cociente Lv / Rv que aparece en la ecuación de Clausius-Clapeyron.
     */
    public double clausiusClapeyronSlope() {
        return latentHeatOfVaporization / vaporGasConstant;
    }

    /**
     * Constantes de la atmósfera terrestre usadas como referencia por todo el proyecto.
     */
    public static ThermoConfig standardAtmosphere() {
        return ThermoConfig.builder()
                .dryAirGasConstant(287.04)
                .dryAirSpecificHeat(1005.0)
                .latentHeatOfVaporization(2.5e6)
                .vaporGasConstant(461.5)
                .epsilon(0.622)
                .referenceVaporPressure(611.0)
                .referenceTemperature(273.15)
                .liquidWaterSpecificHeat(4218.0)
                .referencePressure(100000.0)
                .virtualTemperatureFactor(0.61)
                .minimumDryAirPressure(1.0)
                .build();
    }
}
