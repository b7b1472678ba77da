package projectsonde.domain.exception;

import lombok.Getter;
import projectsonde.domain.thermo.SearchBracket;

/**
 * Se lanza cuando una bisección agota el número máximo de iteraciones sin cumplir
 * su criterio de convergencia. Conserva el mejor intervalo alcanzado.
 */
@Getter
public class ConvergenceException extends RuntimeException {

    private final String solverName;
    private final int iterations;
    private final SearchBracket bestBracket;

    public ConvergenceException(String solverName, int iterations, SearchBracket bestBracket) {
        super(String.format("El solver '%s' no convergió tras %d iteraciones. Mejor intervalo: %s",
                solverName, iterations, bestBracket));
        this.solverName = solverName;
        this.iterations = iterations;
        this.bestBracket = bestBracket;
    }
}
