package projectsonde.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import projectsonde.config.SolverConfig;
import projectsonde.config.ThermoConfig;
import projectsonde.domain.thermo.CondensationLevel;
import projectsonde.domain.thermo.ThermodynamicState;
import projectsonde.physics.i.IRootFinder;
import projectsonde.physics.i.ISolverComponent;
import projectsonde.physics.impl.MoistThermodynamics;
import projectsonde.physics.model.StateEquations;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Temperatura potencial del termómetro húmedo θw (Bohren, ec. 6.142).
 * <p>
 * Resuelve por bisección el residuo de punto fijo
 * f(θw) = θd · exp[(Lv/cp)(w/T_lcl - w_s(θw, P_ref)/θw)] - θw,
 * evaluado a la presión de referencia (100000 Pa).
 */
@Slf4j
public class WetBulbPotentialTemperatureSolver implements ISolverComponent {

    private final MoistThermodynamics moist;
    private final StateEquations equations;
    private final IRootFinder rootFinder;
    private final SolverConfig config;
    private final ThermoConfig constants;

    public WetBulbPotentialTemperatureSolver(MoistThermodynamics moist, IRootFinder rootFinder, SolverConfig config) {
        this.moist = Objects.requireNonNull(moist, "La termodinámica húmeda no puede ser nula.");
        this.rootFinder = Objects.requireNonNull(rootFinder, "El buscador de raíces no puede ser nulo.");
        this.config = Objects.requireNonNull(config, "La configuración del solver no puede ser nula.");
        this.equations = moist.getEquations();
        this.constants = equations.getConfig();
    }

    @Override
    public String getName() {
        return "WetBulbPotentialTemperature";
    }

    @Override
    public String getDescription() {
        return "Bisección sobre el residuo de punto fijo de θw a la presión de referencia";
    }

    public double solve(ThermodynamicState state) {
        return solve(state.temperature(), state.pressure(), state.dewPoint());
    }

    public double solve(double temperature, double pressure, double dewPoint) {
        return solve(moist.getLclSolver().solve(temperature, pressure, dewPoint));
    }

    /**
     * θw de la parcela cuyo LCL ya se conoce.
     *
     * @throws IllegalArgumentException si θd en el LCL supera el punto de ebullición a la
     *                                  presión de referencia (razón de mezcla singular).
     */
    public double solve(CondensationLevel lcl) {
        Objects.requireNonNull(lcl, "El LCL no puede ser nulo.");
        final double lclMixingRatio = equations.mixingRatio(lcl.temperature(), lcl.pressure());
        final double thetaDry = moist.dryPotentialTemperatureAt(lcl);
        final double latentOverCp = constants.latentHeatOfVaporization() / constants.dryAirSpecificHeat();
        final double referencePressure = constants.referencePressure();
        final double lclTerm = lclMixingRatio / lcl.temperature();

        DoubleUnaryOperator residual = thetaWb -> {
            double saturationMixingRatio = equations.mixingRatio(thetaWb, referencePressure);
            return thetaDry * Math.exp(latentOverCp * (lclTerm - saturationMixingRatio / thetaWb)) - thetaWb;
        };

        // El ancla (extremo "superior" del algoritmo de referencia) es la cota fría de 100 K.
        double thetaWb = rootFinder.findRoot(
                residual,
                config.getWetBulbAnchorTemperature(),
                thetaDry,
                config.getEquilibriumCriterion(),
                config.getResidualTolerance()
        );

        log.debug("θw para LCL (T={}, P={}): {} K", lcl.temperature(), lcl.pressure(), thetaWb);
        return thetaWb;
    }
}
