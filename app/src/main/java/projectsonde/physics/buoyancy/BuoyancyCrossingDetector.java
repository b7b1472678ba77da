package projectsonde.physics.buoyancy;

import lombok.extern.slf4j.Slf4j;
import projectsonde.domain.buoyancy.BuoyancyCrossing;
import projectsonde.domain.buoyancy.BuoyancySample;
import projectsonde.domain.buoyancy.LevelKind;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;

/**
 * Detector de cambios de signo de la flotabilidad sobre pares consecutivos de muestras,
 * recorridas del tope hacia la superficie.
 * <ul>
 *     <li>EL: la parcela pasa de más fría (o igual) a más cálida que el entorno.</li>
 *     <li>LFC: la parcela pasa de más cálida (o igual) a más fría que el entorno.</li>
 * </ul>
 * Una muestra con flotabilidad exactamente nula se devuelve tal cual. En otro caso la presión
 * del cruce es el punto medio de las dos muestras que lo encierran. La primera muestra no tiene
 * predecesora y nunca cierra un cruce por sí sola.
 */
@Slf4j
public class BuoyancyCrossingDetector {

    public Optional<BuoyancyCrossing> detect(Iterable<BuoyancySample> topDown, LevelKind kind) {
        Objects.requireNonNull(topDown, "Las muestras no pueden ser nulas.");
        Objects.requireNonNull(kind, "El tipo de nivel no puede ser nulo.");

        BuoyancySample previous = null;
        Iterator<BuoyancySample> iterator = topDown.iterator();
        while (iterator.hasNext()) {
            BuoyancySample current = iterator.next();
            if (current.isNeutral()) {
                return Optional.of(new BuoyancyCrossing(current.pressure(), kind, true));
            }
            if (previous != null && isCrossing(previous, current, kind)) {
                double pressure = 0.5 * (current.pressure() + previous.pressure());
                log.debug("{} entre {} Pa y {} Pa: {} Pa", kind.getAbbreviation(), previous.pressure(), current.pressure(), pressure);
                return Optional.of(new BuoyancyCrossing(pressure, kind, false));
            }
            previous = current;
        }
        return Optional.empty();
    }

    static boolean isCrossing(BuoyancySample above, BuoyancySample below, LevelKind kind) {
        switch (kind) {
            case EQUILIBRIUM_LEVEL:
                return !above.isPositive() && below.isPositive();
            case LEVEL_OF_FREE_CONVECTION:
                return !above.isNegative() && below.isNegative();
            default:
                throw new IllegalArgumentException("Tipo de nivel no soportado: " + kind);
        }
    }
}
