package projectsonde.physics.i;

/**
 * Identificación de los solvers termodinámicos (bisección, LCL, θw, puntos de curva)
 * y de los generadores de curvas. Los mensajes de log y las {@code ConvergenceException}
 * citan este nombre.
 */
public interface ISolverComponent {

    /**
     * Identificador corto, en CamelCase (ej: "LCL", "MoistAdiabat").
     */
    String getName();

    /**
     * Qué ecuación resuelve y con qué criterio de parada. Opcional.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
