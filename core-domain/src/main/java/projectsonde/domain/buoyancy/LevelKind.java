package projectsonde.domain.buoyancy;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Niveles convectivos que se localizan por cambio de signo de la flotabilidad.
 */
@Getter
@RequiredArgsConstructor
public enum LevelKind {
    EQUILIBRIUM_LEVEL("EL", "nivel de equilibrio"),
    LEVEL_OF_FREE_CONVECTION("LFC", "nivel de convección libre");

    private final String abbreviation;
    private final String description;
}
