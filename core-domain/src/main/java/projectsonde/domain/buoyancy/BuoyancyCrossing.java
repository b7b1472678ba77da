package projectsonde.domain.buoyancy;

/**
 * Resultado de la búsqueda de un nivel convectivo.
 *
 * @param pressure Presión del nivel [Pa].
 * @param kind     Nivel localizado.
 * @param exact    {@code true} si una muestra tenía flotabilidad exactamente nula; en caso
 *                 contrario la presión es el punto medio de las dos muestras que encierran el cruce.
 */
public record BuoyancyCrossing(double pressure, LevelKind kind, boolean exact) {
}
