package projectsonde.physics.solver.impl;

import projectsonde.config.SolverConfig;
import projectsonde.physics.i.IRootFinder;
import projectsonde.physics.model.StateEquations;

import java.util.function.DoubleUnaryOperator;

/**
 * Temperatura de una línea de razón de mezcla de saturación constante a una presión dada,
 * suponiendo T = Td: se anula f(T) = w(T, P) - w.
 */
public class MixingRatioIsoplethSolver extends CurvePointSolver {

    public MixingRatioIsoplethSolver(StateEquations equations, IRootFinder rootFinder, SolverConfig config) {
        super(equations, rootFinder, config);
    }

    @Override
    public String getName() {
        return "MixingRatioIsopleth";
    }

    @Override
    public String getDescription() {
        return "Bisección sobre w(T, P) - w con criterio de anchura de intervalo";
    }

    @Override
    public double solve(double mixingRatio, double pressure) {
        if (!Double.isFinite(mixingRatio) || mixingRatio < 0) {
            throw new IllegalArgumentException("La razón de mezcla debe ser finita y no negativa, recibido: " + mixingRatio);
        }
        return super.solve(mixingRatio, pressure);
    }

    @Override
    protected double floorTemperature() {
        return config.getIsoplethFloorTemperature();
    }

    @Override
    protected DoubleUnaryOperator residual(double mixingRatio, double pressure) {
        return temperature -> equations.mixingRatio(temperature, pressure) - mixingRatio;
    }
}
