package projectsonde.domain.exception;

import lombok.Getter;
import projectsonde.domain.buoyancy.LevelKind;

/**
 * Se lanza cuando el perfil de flotabilidad no presenta el cambio de signo que define
 * el nivel buscado (EL o LFC) dentro del rango de presiones analizado.
 */
@Getter
public class NoBuoyancyCrossingException extends RuntimeException {

    private final LevelKind levelKind;
    private final double bottomPressure;
    private final double topPressure;

    public NoBuoyancyCrossingException(LevelKind levelKind, double bottomPressure, double topPressure) {
        super(String.format("No existe %s entre %.1f Pa y %.1f Pa.", levelKind.getDescription(), bottomPressure, topPressure));
        this.levelKind = levelKind;
        this.bottomPressure = bottomPressure;
        this.topPressure = topPressure;
    }
}
