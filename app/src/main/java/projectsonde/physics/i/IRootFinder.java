package projectsonde.physics.i;

import projectsonde.config.SolverConfig.ConvergenceCriterion;
import projectsonde.domain.thermo.SearchBracket;

import java.util.function.DoubleUnaryOperator;

/**
 * Buscador de raíces de una función escalar sobre un intervalo que encierra un cambio de signo.
 */
public interface IRootFinder extends ISolverComponent {

    /**
     * Estrecha el intervalo [upper, lower] hasta cumplir el criterio de convergencia.
     *
     * @param function  Función cuyo cero se busca.
     * @param upper     Extremo ancla: el signo de su residuo decide qué extremo se desplaza.
     * @param lower     Extremo opuesto.
     * @param criterion Criterio de parada.
     * @param tolerance Tolerancia del criterio.
     * @return El intervalo final.
     */
    SearchBracket bracket(DoubleUnaryOperator function, double upper, double lower,
                          ConvergenceCriterion criterion, double tolerance);

    /**
     * Raíz aproximada: el punto medio del intervalo final.
     */
    default double findRoot(DoubleUnaryOperator function, double upper, double lower,
                            ConvergenceCriterion criterion, double tolerance) {
        return bracket(function, upper, lower, criterion, tolerance).midpoint();
    }
}
