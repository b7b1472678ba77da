package projectsonde.domain.profile;

/**
 * Forma de elegir los niveles de presión de un perfil de parcela.
 */
public enum ProfileMode {
    /**
     * Reutiliza los niveles de presión del propio sondeo.
     */
    SAME_LEVELS,
    /**
     * Genera una rejilla nueva de presiones equiespaciadas entre dos cotas.
     */
    STEPPED
}
