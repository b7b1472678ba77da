package projectsonde.domain.curve;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Familias de curvas de un diagrama termodinámico y la magnitud que conservan.
 */
@Getter
@RequiredArgsConstructor
public enum CurveType {
    DRY_ADIABAT("Adiabática seca", "θ [K]"),
    MIXING_RATIO_LINE("Línea de razón de mezcla", "w [kg/kg]"),
    MOIST_ADIABAT("Adiabática húmeda", "θe [K]");

    private final String description;
    private final String conservedQuantity;
}
