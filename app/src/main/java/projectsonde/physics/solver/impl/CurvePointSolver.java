package projectsonde.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import projectsonde.config.SolverConfig;
import projectsonde.config.SolverConfig.ConvergenceCriterion;
import projectsonde.physics.i.IRootFinder;
import projectsonde.physics.i.ISolverComponent;
import projectsonde.physics.model.StateEquations;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Base de los solvers que obtienen la temperatura de una curva en un nivel de presión.
 * <p>
 * El extremo superior del intervalo es el techo analítico en el que la presión de vapor
 * de saturación vale P - margen; así el denominador P - e_s(T) de la razón de mezcla
 * nunca se acerca a cero. La convergencia se mide sobre la anchura del intervalo de
 * temperatura, un criterio más laxo pensado para muestrear muchos niveles.
 */
@Slf4j
public abstract class CurvePointSolver implements ISolverComponent {

    protected final StateEquations equations;
    protected final IRootFinder rootFinder;
    protected final SolverConfig config;

    protected CurvePointSolver(StateEquations equations, IRootFinder rootFinder, SolverConfig config) {
        this.equations = Objects.requireNonNull(equations, "Las ecuaciones de estado no pueden ser nulas.");
        this.rootFinder = Objects.requireNonNull(rootFinder, "El buscador de raíces no puede ser nulo.");
        this.config = Objects.requireNonNull(config, "La configuración del solver no puede ser nula.");
    }

    /**
     * Temperatura de la curva de nivel {@code level} a la presión dada [K].
     */
    public double solve(double level, double pressure) {
        StateEquations.requirePressure(pressure);
        double ceiling = temperatureCeiling(pressure);
        double floor = floorTemperature();
        if (ceiling <= floor) {
            throw new IllegalArgumentException(String.format(
                    "Presión %.2f Pa demasiado baja: el techo analítico (%.3f K) no supera la cota inferior (%.3f K).",
                    pressure, ceiling, floor));
        }

        double temperature = rootFinder.findRoot(
                residual(level, pressure),
                ceiling,
                floor,
                ConvergenceCriterion.BRACKET_WIDTH,
                config.getCurveTolerance()
        );
        log.trace("{}: nivel={} P={} Pa -> T={} K", getName(), level, pressure, temperature);
        return temperature;
    }

    /**
     * Techo analítico: temperatura a la que e_s(T) = P - margen de singularidad.
     */
    public double temperatureCeiling(double pressure) {
        double vaporPressure = pressure - config.getSingularityMargin();
        if (!(vaporPressure > 0)) {
            throw new IllegalArgumentException(String.format(
                    "La presión %.2f Pa no supera el margen de singularidad de %.2f Pa.", pressure, config.getSingularityMargin()));
        }
        return equations.temperatureAtVaporPressure(vaporPressure);
    }

    /**
     * Cota inferior fija del intervalo de búsqueda [K].
     */
    protected abstract double floorTemperature();

    /**
     * Función cuyo cero es la temperatura buscada.
     */
    protected abstract DoubleUnaryOperator residual(double level, double pressure);
}
