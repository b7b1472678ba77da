package projectsonde.physics.impl;

import projectsonde.config.ThermoConfig;
import projectsonde.domain.thermo.CondensationLevel;
import projectsonde.physics.model.StateEquations;
import projectsonde.physics.solver.impl.LclSolver;

import java.util.Objects;

/**
 * Temperaturas potenciales de aire húmedo que dependen del LCL.
 * <p>
 * La temperatura potencial equivalente sigue la ecuación 6.121 de Bohren
 * ("Atmospheric Thermodynamics"): se eleva la parcela hasta su LCL, se calcula allí
 * la temperatura potencial del aire seco y se le suma el calor latente de todo su vapor.
 */
public class MoistThermodynamics {

    private final StateEquations equations;
    private final LclSolver lclSolver;
    private final ThermoConfig config;

    public MoistThermodynamics(StateEquations equations, LclSolver lclSolver) {
        this.equations = Objects.requireNonNull(equations, "Las ecuaciones de estado no pueden ser nulas.");
        this.lclSolver = Objects.requireNonNull(lclSolver, "El solver de LCL no puede ser nulo.");
        this.config = equations.getConfig();
    }

    public StateEquations getEquations() {
        return equations;
    }

    public LclSolver getLclSolver() {
        return lclSolver;
    }

    /**
     * Temperatura potencial equivalente θe [K].
     *
     * @param temperature Temperatura inicial de la parcela [K].
     * @param pressure    Presión inicial de la parcela [Pa].
     * @param dewPoint    Punto de rocío inicial de la parcela [K].
     */
    public double equivalentPotentialTemperature(double temperature, double pressure, double dewPoint) {
        return equivalentPotentialTemperature(lclSolver.solve(temperature, pressure, dewPoint));
    }

    /**
     * θe a partir de un LCL ya resuelto.
     */
    public double equivalentPotentialTemperature(CondensationLevel lcl) {
        Objects.requireNonNull(lcl, "El LCL no puede ser nulo.");
        double saturationMixingRatio = equations.mixingRatio(lcl.temperature(), lcl.pressure());
        double thetaDry = dryPotentialTemperatureAt(lcl);
        return thetaDry * Math.exp((config.latentHeatOfVaporization() * saturationMixingRatio)
                / (config.dryAirSpecificHeat() * lcl.temperature()));
    }

    /**
     * Temperatura potencial equivalente saturada θes: θe suponiendo que el punto de rocío
     * coincide con la temperatura.
     */
    public double saturatedEquivalentPotentialTemperature(double temperature, double pressure) {
        return equivalentPotentialTemperature(temperature, pressure, temperature);
    }

    /**
     * Temperatura potencial del aire seco en el LCL, usando la presión parcial del aire seco.
     */
    public double dryPotentialTemperatureAt(CondensationLevel lcl) {
        double vaporPressure = equations.saturationVaporPressure(lcl.temperature());
        double dryAirPressure = equations.dryAirPressure(lcl.pressure(), vaporPressure);
        return lcl.temperature() * Math.pow(config.referencePressure() / dryAirPressure, config.kappa());
    }

    /**
     * Temperatura equivalente [K] (Bohren, ec. 6.74).
     */
    public double equivalentTemperature(double temperature, double pressure, double dewPoint) {
        return equations.equivalentTemperature(temperature, pressure, dewPoint);
    }
}
