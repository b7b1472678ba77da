package projectsonde.domain.thermo;

/**
 * Intervalo de búsqueda de una bisección junto con el residuo en cada extremo.
 * <p>
 * El extremo {@code upper} es el ancla cuyo signo se compara con el del punto medio;
 * no tiene por qué ser numéricamente mayor que {@code lower}.
 *
 * @param upper         Extremo ancla.
 * @param lower         Extremo opuesto.
 * @param upperResidual f(upper).
 * @param lowerResidual f(lower).
 */
public record SearchBracket(double upper, double lower, double upperResidual, double lowerResidual) {

    public double width() {
        return Math.abs(upper - lower);
    }

    /**
     * Punto medio del intervalo, valor que devuelve la bisección al converger.
     */
    public double midpoint() {
        return 0.5 * (upper + lower);
    }

    /**
     * Diferencia de los valores absolutos de los residuos, | |f(upper)| - |f(lower)| |.
     */
    public double residualMagnitudeGap() {
        return Math.abs(Math.abs(upperResidual) - Math.abs(lowerResidual));
    }

    public SearchBracket withUpper(double newUpper, double newUpperResidual) {
        return new SearchBracket(newUpper, lower, newUpperResidual, lowerResidual);
    }

    public SearchBracket withLower(double newLower, double newLowerResidual) {
        return new SearchBracket(upper, newLower, upperResidual, newLowerResidual);
    }

    @Override
    public String toString() {
        return String.format("[upper=%.9f (f=%.3e), lower=%.9f (f=%.3e)]", upper, upperResidual, lower, lowerResidual);
    }
}
