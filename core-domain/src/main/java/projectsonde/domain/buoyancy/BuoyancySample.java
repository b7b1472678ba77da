package projectsonde.domain.buoyancy;

/**
 * Muestra co-indexada del perfil de flotabilidad: presión y temperaturas virtuales
 * de la parcela y del entorno en ese nivel.
 *
 * @param pressure                      Presión del nivel [Pa].
 * @param parcelVirtualTemperature      Temperatura virtual de la parcela [K].
 * @param environmentVirtualTemperature Temperatura virtual del entorno [K].
 */
public record BuoyancySample(double pressure, double parcelVirtualTemperature, double environmentVirtualTemperature) {

    /**
     * Exceso de temperatura virtual de la parcela sobre el entorno [K].
     */
    public double buoyancy() {
        return parcelVirtualTemperature - environmentVirtualTemperature;
    }

    public boolean isNeutral() {
        return parcelVirtualTemperature == environmentVirtualTemperature;
    }

    /**
     * La parcela es más cálida (menos densa) que el entorno.
     */
    public boolean isPositive() {
        return parcelVirtualTemperature > environmentVirtualTemperature;
    }

    /**
     * La parcela es más fría (más densa) que el entorno.
     */
    public boolean isNegative() {
        return parcelVirtualTemperature < environmentVirtualTemperature;
    }
}
