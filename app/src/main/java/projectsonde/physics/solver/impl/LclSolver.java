package projectsonde.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import projectsonde.config.SolverConfig;
import projectsonde.domain.thermo.CondensationLevel;
import projectsonde.domain.thermo.ThermodynamicState;
import projectsonde.physics.i.IRootFinder;
import projectsonde.physics.i.ISolverComponent;
import projectsonde.physics.model.StateEquations;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Calcula la temperatura y la presión del nivel de condensación por ascenso (LCL).
 * <p>
 * Por debajo del LCL se conservan la razón de mezcla y la temperatura potencial, así que se
 * busca la temperatura T_lcl que anula w_sfc - w_s(T_lcl, P_lcl(T_lcl)), donde P_lcl(T_lcl)
 * se obtiene con las relaciones de Poisson ancladas en el estado de superficie.
 * Esta clase es thread safe.
 */
@Slf4j
public class LclSolver implements ISolverComponent {

    private final StateEquations equations;
    private final IRootFinder rootFinder;
    private final SolverConfig config;

    public LclSolver(StateEquations equations, IRootFinder rootFinder, SolverConfig config) {
        this.equations = Objects.requireNonNull(equations, "Las ecuaciones de estado no pueden ser nulas.");
        this.rootFinder = Objects.requireNonNull(rootFinder, "El buscador de raíces no puede ser nulo.");
        this.config = Objects.requireNonNull(config, "La configuración del solver no puede ser nula.");
    }

    @Override
    public String getName() {
        return "LCL";
    }

    @Override
    public String getDescription() {
        return "Bisección sobre w_sfc - w_s(T_lcl) = 0 con P_lcl por relaciones de Poisson";
    }

    public CondensationLevel solve(ThermodynamicState state) {
        return solve(state.temperature(), state.pressure(), state.dewPoint());
    }

    /**
     * @param temperature Temperatura de superficie [K].
     * @param pressure    Presión de superficie [Pa].
     * @param dewPoint    Punto de rocío de superficie [K].
     * @return Temperatura y presión del LCL.
     */
    public CondensationLevel solve(double temperature, double pressure, double dewPoint) {
        StateEquations.requirePressure(pressure);
        StateEquations.requireDewPoint(temperature, dewPoint);

        // Parcela ya saturada: el LCL es el propio estado de superficie.
        if (temperature == dewPoint) {
            return new CondensationLevel(temperature, pressure);
        }

        final double surfaceMixingRatio = equations.mixingRatio(dewPoint, pressure);
        DoubleUnaryOperator residual = lclTemperature -> {
            double lclPressure = equations.poissonPressure(lclTemperature, temperature, pressure);
            return surfaceMixingRatio - equations.mixingRatio(lclTemperature, lclPressure);
        };

        double lclTemperature = rootFinder.findRoot(
                residual,
                temperature,
                config.getLclFloorTemperature(),
                config.getEquilibriumCriterion(),
                config.getResidualTolerance()
        );
        double lclPressure = equations.poissonPressure(lclTemperature, temperature, pressure);

        log.debug("LCL para (T={}, P={}, Td={}): T_lcl={} K, P_lcl={} Pa", temperature, pressure, dewPoint, lclTemperature, lclPressure);
        return new CondensationLevel(lclTemperature, lclPressure);
    }
}
