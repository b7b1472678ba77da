package projectsonde.physics.impl;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.Callable;
import java.util.function.DoubleUnaryOperator;

/**
 * Tarea que resuelve la temperatura de una curva en un único nivel de presión.
 * Cada tarea es independiente y no comparte estado mutable, así que puede
 * ejecutarse en un pool de hilos en cualquier orden.
 */
@Getter
@RequiredArgsConstructor
public class PressureLevelTask implements Callable<PressureLevelTask> {

    // --- Entradas para la tarea ---
    private final int levelIndex;
    private final double pressure;
    private final DoubleUnaryOperator levelSolver;

    // --- Resultado de la tarea ---
    private double temperature = Double.NaN;

    @Override
    public PressureLevelTask call() {
        this.temperature = levelSolver.applyAsDouble(pressure);
        return this;
    }
}
