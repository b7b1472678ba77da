package projectsonde.physics.curve;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projectsonde.config.SolverConfig;
import projectsonde.physics.impl.PressureLevelTask;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.DoubleUnaryOperator;

/**
 * Orquestador del muestreo nivel a nivel de las curvas iterativas.
 * <p>
 * Con un único procesador resuelve los niveles en orden en el hilo llamante. Con más,
 * lanza una {@link PressureLevelTask} por nivel sobre un pool fijo y recompone el
 * resultado en el orden de las presiones.
 */
@Slf4j
public class CurveBatchProcessor implements AutoCloseable {

    @Getter
    private final int processorCount;
    private final ExecutorService threadPool;

    public CurveBatchProcessor(SolverConfig config) {
        this(Objects.requireNonNull(config, "La configuración del solver no puede ser nula.").getCpuProcessorCount());
    }

    public CurveBatchProcessor(int processorCount) {
        this.processorCount = Math.max(processorCount, 1);
        this.threadPool = this.processorCount > 1 ? Executors.newFixedThreadPool(this.processorCount) : null;
        log.info("CurveBatchProcessor inicializado. (Hilos: {})", this.processorCount);
    }

    public boolean isParallel() {
        return threadPool != null;
    }

    /**
     * Resuelve la temperatura en cada presión con {@code levelSolver}.
     *
     * @return Temperaturas co-indexadas con {@code pressures}.
     */
    public double[] sample(double[] pressures, DoubleUnaryOperator levelSolver) {
        Objects.requireNonNull(pressures, "El array de presiones no puede ser nulo.");
        Objects.requireNonNull(levelSolver, "El solver de nivel no puede ser nulo.");

        if (!isParallel() || pressures.length < 2) {
            double[] temperatures = new double[pressures.length];
            for (int i = 0; i < pressures.length; i++) {
                temperatures[i] = levelSolver.applyAsDouble(pressures[i]);
            }
            return temperatures;
        }
        return sampleInPool(pressures, levelSolver);
    }

    private double[] sampleInPool(double[] pressures, DoubleUnaryOperator levelSolver) {
        List<PressureLevelTask> tasks = new ArrayList<>(pressures.length);
        for (int i = 0; i < pressures.length; i++) {
            tasks.add(new PressureLevelTask(i, pressures[i], levelSolver));
        }

        List<Future<PressureLevelTask>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Generación de curva interrumpida.", e);
        }

        double[] temperatures = new double[pressures.length];
        for (Future<PressureLevelTask> future : futures) {
            PressureLevelTask task;
            try {
                task = future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Generación de curva interrumpida.", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException("Error resolviendo un nivel de la curva.", cause);
            }
            temperatures[task.getLevelIndex()] = task.getTemperature();
        }
        return temperatures;
    }

    @Override
    public void close() {
        if (threadPool != null) {
            threadPool.shutdownNow();
            log.info("CurveBatchProcessor cerrado.");
        }
    }
}
