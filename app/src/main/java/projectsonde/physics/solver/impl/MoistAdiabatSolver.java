package projectsonde.physics.solver.impl;

import projectsonde.config.SolverConfig;
import projectsonde.physics.i.IRootFinder;
import projectsonde.physics.impl.MoistThermodynamics;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Temperatura de una adiabática húmeda (θe constante) a una presión dada.
 * <p>
 * Anula f(T) = θe(T, P, T) - θe0 suponiendo saturación. Cada evaluación pasa por el
 * solver de LCL a través de θe, por lo que es el solver más costoso del sistema.
 */
public class MoistAdiabatSolver extends CurvePointSolver {

    private final MoistThermodynamics moist;

    public MoistAdiabatSolver(MoistThermodynamics moist, IRootFinder rootFinder, SolverConfig config) {
        super(Objects.requireNonNull(moist, "La termodinámica húmeda no puede ser nula.").getEquations(), rootFinder, config);
        this.moist = moist;
    }

    @Override
    public String getName() {
        return "MoistAdiabat";
    }

    @Override
    public String getDescription() {
        return "Bisección sobre θes(T, P) - θe0 con LCL anidado";
    }

    @Override
    public double solve(double equivalentPotentialTemperature, double pressure) {
        if (!Double.isFinite(equivalentPotentialTemperature) || equivalentPotentialTemperature <= 0) {
            throw new IllegalArgumentException("θe debe ser finita y positiva, recibido: " + equivalentPotentialTemperature);
        }
        return super.solve(equivalentPotentialTemperature, pressure);
    }

    @Override
    protected double floorTemperature() {
        return config.getMoistAdiabatFloorTemperature();
    }

    @Override
    protected DoubleUnaryOperator residual(double equivalentPotentialTemperature, double pressure) {
        return temperature -> moist.saturatedEquivalentPotentialTemperature(temperature, pressure) - equivalentPotentialTemperature;
    }
}
