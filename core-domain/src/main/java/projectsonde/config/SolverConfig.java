package projectsonde.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Contenedor de los parámetros numéricos de los solvers por bisección,
 * de los generadores de curvas y de la búsqueda de niveles convectivos.
 * <p>
 * Los valores por defecto reproducen los límites y tolerancias del
 * calculador termodinámico de referencia.
 */
@Value
@Builder
@With
public class SolverConfig {

    /**
     * Número máximo de evaluaciones del punto medio antes de declarar no convergencia.
     */
    @Builder.Default
    int maxIterations = 200;

    /**
     * Tolerancia sobre los residuos para los solvers de LCL y temperatura potencial del termómetro húmedo.
     */
    @Builder.Default
    double residualTolerance = 1e-6;

    /**
     * Tolerancia sobre la anchura del intervalo de temperatura [K] para los puntos de curva.
     */
    @Builder.Default
    double curveTolerance = 0.01;

    /**
     * Cota inferior del intervalo de búsqueda de la temperatura del LCL [K].
     */
    @Builder.Default
    double lclFloorTemperature = 150.0;

    /**
     * Cota inferior del intervalo de búsqueda de las líneas de razón de mezcla [K].
     */
    @Builder.Default
    double isoplethFloorTemperature = 150.0;

    /**
     * Cota inferior del intervalo de búsqueda de la adiabática húmeda [K].
     */
    @Builder.Default
    double moistAdiabatFloorTemperature = 100.0;

    /**
     * Extremo "superior" (el ancla cuyo signo se compara) de la búsqueda de θw [K].
     */
    @Builder.Default
    double wetBulbAnchorTemperature = 100.0;

    /**
     * Margen [Pa] entre la presión ambiente y la presión de vapor que define el techo analítico
     * de temperatura, lejos de la singularidad P - e_s(T) → 0.
     */
    @Builder.Default
    double singularityMargin = 5000.0;

    /**
     * Criterio de convergencia de los solvers de equilibrio (LCL y θw).
     */
    @Builder.Default
    ConvergenceCriterion equilibriumCriterion = ConvergenceCriterion.RESIDUAL_MAGNITUDE;

    /**
     * Número de hilos para generar curvas nivel a nivel. Con 1 el cálculo es secuencial.
     */
    @Builder.Default
    int cpuProcessorCount = 1;

    /**
     * Precisión por defecto [Pa] de la búsqueda de EL / LFC. El paso de los perfiles es el doble.
     */
    @Builder.Default
    double defaultBuoyancyAccuracy = 50.0;

    public static SolverConfig defaults() {
        return SolverConfig.builder().build();
    }

    /**
     * Criterios de parada disponibles para la bisección.
     */
    public enum ConvergenceCriterion {
        /**
         * Para cuando | |f(superior)| - |f(inferior)| | ≤ tolerancia. Es el criterio del
         * calculador de referencia y se conserva por compatibilidad numérica.
         */
        RESIDUAL_MAGNITUDE,
        /**
         * Para cuando la anchura del intervalo |superior - inferior| ≤ tolerancia.
         */
        BRACKET_WIDTH,
        /**
         * Para cuando el residuo en el punto medio |f(medio)| < tolerancia.
         */
        MIDPOINT_RESIDUAL
    }
}
