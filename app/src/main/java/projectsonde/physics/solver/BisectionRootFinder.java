package projectsonde.physics.solver;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projectsonde.config.SolverConfig.ConvergenceCriterion;
import projectsonde.domain.exception.ConvergenceException;
import projectsonde.domain.thermo.SearchBracket;
import projectsonde.physics.i.IRootFinder;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Método de bisección acotado, compartido por todos los solvers de equilibrio.
 * <p>
 * En cada paso evalúa la función en el punto medio y sustituye el extremo cuyo residuo
 * tiene el mismo signo que el del punto medio. Si el signo del punto medio es
 * estrictamente opuesto al del extremo ancla ({@code upper}) se mueve {@code lower};
 * en cualquier otro caso, incluido el empate, se mueve {@code upper}.
 * <p>
 * El valor devuelto es el punto medio del intervalo final, no el último punto evaluado.
 * Esta clase es thread safe.
 */
@Slf4j
public class BisectionRootFinder implements IRootFinder {

    @Getter
    private final int maxIterations;

    public BisectionRootFinder(int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("El número máximo de iteraciones debe ser positivo.");
        }
        this.maxIterations = maxIterations;
    }

    @Override
    public String getName() {
        return "Bisection";
    }

    @Override
    public String getDescription() {
        return "Bisección con criterio de parada configurable y tope de " + maxIterations + " iteraciones";
    }

    @Override
    public SearchBracket bracket(DoubleUnaryOperator function, double upper, double lower,
                                 ConvergenceCriterion criterion, double tolerance) {
        Objects.requireNonNull(function, "La función no puede ser nula.");
        Objects.requireNonNull(criterion, "El criterio de convergencia no puede ser nulo.");
        if (!Double.isFinite(upper) || !Double.isFinite(lower)) {
            throw new IllegalArgumentException(String.format("Los extremos del intervalo deben ser finitos: upper=%s, lower=%s", upper, lower));
        }
        if (!Double.isFinite(tolerance) || tolerance <= 0) {
            throw new IllegalArgumentException("La tolerancia debe ser finita y positiva, recibido: " + tolerance);
        }

        SearchBracket current = new SearchBracket(upper, lower, evaluate(function, upper), evaluate(function, lower));
        int iteration = 0;

        while (!isConverged(current, criterion, tolerance)) {
            if (iteration >= maxIterations) {
                throw new ConvergenceException(getName(), iteration, current);
            }

            double mid = current.midpoint();
            if (mid == current.upper() || mid == current.lower()) {
                // El intervalo ya no puede estrecharse en aritmética de doble precisión.
                throw new ConvergenceException(getName(), iteration, current);
            }
            double fMid = evaluate(function, mid);
            iteration++;

            if (criterion == ConvergenceCriterion.MIDPOINT_RESIDUAL && Math.abs(fMid) < tolerance) {
                log.debug("Bisección convergida por residuo en el punto medio tras {} iteraciones: {}", iteration, current);
                return current;
            }

            double fUpper = current.upperResidual();
            if ((fUpper > 0 && fMid < 0) || (fUpper < 0 && fMid > 0)) {
                current = current.withLower(mid, fMid);
            } else {
                current = current.withUpper(mid, fMid);
            }
            log.trace("Iteración {}: {}", iteration, current);
        }

        log.debug("Bisección convergida ({}) tras {} iteraciones: {}", criterion, iteration, current);
        return current;
    }

    private static boolean isConverged(SearchBracket bracket, ConvergenceCriterion criterion, double tolerance) {
        switch (criterion) {
            case RESIDUAL_MAGNITUDE:
                return bracket.residualMagnitudeGap() <= tolerance;
            case BRACKET_WIDTH:
                return bracket.width() <= tolerance;
            case MIDPOINT_RESIDUAL:
            default:
                // Se decide tras evaluar el punto medio.
                return false;
        }
    }

    private static double evaluate(DoubleUnaryOperator function, double x) {
        double value = function.applyAsDouble(x);
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("La función devolvió un residuo no finito en x = " + x);
        }
        return value;
    }
}
