package projectsonde.physics.solver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectsonde.config.SolverConfig.ConvergenceCriterion;
import projectsonde.domain.exception.ConvergenceException;
import projectsonde.domain.thermo.SearchBracket;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test unitario del método de bisección: criterios de parada, regla de signos
 * y rutas de fallo.
 */
class BisectionRootFinderTest {

    private BisectionRootFinder finder;

    @BeforeEach
    void setUp() {
        finder = new BisectionRootFinder(200);
    }

    // --------------------------------------------------------------------------
    // Criterios de convergencia
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Anchura de intervalo: localiza √2 en [0, 2]")
    void bracketWidth_findsSquareRoot() {
        double root = finder.findRoot(x -> x * x - 2.0, 2.0, 0.0, ConvergenceCriterion.BRACKET_WIDTH, 1e-10);
        assertEquals(Math.sqrt(2.0), root, 1e-9);
    }

    @Test
    @DisplayName("Anchura de intervalo: el intervalo final es más estrecho que la tolerancia")
    void bracketWidth_finalBracketWidth() {
        SearchBracket bracket = finder.bracket(x -> x - 0.3, 1.0, 0.0, ConvergenceCriterion.BRACKET_WIDTH, 0.01);
        assertTrue(bracket.width() <= 0.01);
        assertTrue(bracket.lower() <= 0.3 && 0.3 <= bracket.upper());
    }

    @Test
    @DisplayName("Magnitud de residuos: converge cuando |f(upper)| y |f(lower)| se igualan")
    void residualMagnitude_converges() {
        double root = finder.findRoot(x -> 2.0 * x - 1.0, 3.0, 0.0, ConvergenceCriterion.RESIDUAL_MAGNITUDE, 1e-8);
        assertEquals(0.5, root, 1e-7);
    }

    @Test
    @DisplayName("Residuo en el punto medio: se detiene en cuanto |f(mid)| < tolerancia")
    void midpointResidual_converges() {
        double root = finder.findRoot(x -> x * x * x - 8.0, 5.0, 0.0, ConvergenceCriterion.MIDPOINT_RESIDUAL, 1e-6);
        assertEquals(2.0, root, 1e-3);
    }

    @Test
    @DisplayName("Se devuelve el punto medio del intervalo final")
    void returnsMidpointOfFinalBracket() {
        SearchBracket bracket = finder.bracket(x -> x - 1.0, 3.0, 0.0, ConvergenceCriterion.BRACKET_WIDTH, 0.5);
        assertEquals(bracket.midpoint(), finder.findRoot(x -> x - 1.0, 3.0, 0.0, ConvergenceCriterion.BRACKET_WIDTH, 0.5), 0.0);
    }

    // --------------------------------------------------------------------------
    // Regla de signos
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Signo opuesto al ancla: se mueve lower; mismo signo: se mueve upper")
    void signRule_movesExpectedBound() {
        BisectionRootFinder oneStep = new BisectionRootFinder(1);

        // f(1.5) = 0.5 tiene el mismo signo que f(3) = 2 -> upper = 1.5
        ConvergenceException sameSign = assertThrows(ConvergenceException.class,
                () -> oneStep.bracket(x -> x - 1.0, 3.0, 0.0, ConvergenceCriterion.BRACKET_WIDTH, 1e-9));
        assertEquals(1.5, sameSign.getBestBracket().upper(), 0.0);
        assertEquals(0.0, sameSign.getBestBracket().lower(), 0.0);

        // f(1.5) = -0.5 tiene signo opuesto a f(3) = 1 -> lower = 1.5
        ConvergenceException opposite = assertThrows(ConvergenceException.class,
                () -> oneStep.bracket(x -> x - 2.0, 3.0, 0.0, ConvergenceCriterion.BRACKET_WIDTH, 1e-9));
        assertEquals(3.0, opposite.getBestBracket().upper(), 0.0);
        assertEquals(1.5, opposite.getBestBracket().lower(), 0.0);
    }

    @Test
    @DisplayName("Empate (f(mid) = 0): se mueve upper")
    void signRule_tieMovesUpper() {
        BisectionRootFinder oneStep = new BisectionRootFinder(1);
        ConvergenceException e = assertThrows(ConvergenceException.class,
                () -> oneStep.bracket(x -> x - 1.5, 3.0, 0.0, ConvergenceCriterion.BRACKET_WIDTH, 1e-9));
        assertEquals(1.5, e.getBestBracket().upper(), 0.0);
    }

    // --------------------------------------------------------------------------
    // Rutas de fallo
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Tope de iteraciones: ConvergenceException con el mejor intervalo")
    void iterationCap_throwsConvergenceException() {
        BisectionRootFinder capped = new BisectionRootFinder(5);

        ConvergenceException e = assertThrows(ConvergenceException.class,
                () -> capped.findRoot(x -> x - 0.7, 2.0, 0.0, ConvergenceCriterion.BRACKET_WIDTH, 1e-12));

        assertEquals(5, e.getIterations());
        assertEquals("Bisection", e.getSolverName());
        assertEquals(2.0 / 32.0, e.getBestBracket().width(), 1e-15);
    }

    @Test
    @DisplayName("Intervalo sin raíz con tolerancia inalcanzable: error en lugar de bucle infinito")
    void illPosedBracket_fails() {
        assertThrows(ConvergenceException.class,
                () -> finder.findRoot(x -> x, 2.0, 1.0, ConvergenceCriterion.RESIDUAL_MAGNITUDE, 1e-300));
    }

    @Test
    @DisplayName("Residuo no finito o argumentos inválidos: IllegalArgumentException")
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> finder.findRoot(x -> Double.NaN, 2.0, 0.0, ConvergenceCriterion.BRACKET_WIDTH, 0.1));
        assertThrows(IllegalArgumentException.class,
                () -> finder.findRoot(x -> x, Double.POSITIVE_INFINITY, 0.0, ConvergenceCriterion.BRACKET_WIDTH, 0.1));
        assertThrows(IllegalArgumentException.class,
                () -> finder.findRoot(x -> x, 2.0, 0.0, ConvergenceCriterion.BRACKET_WIDTH, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new BisectionRootFinder(0));
    }
}
