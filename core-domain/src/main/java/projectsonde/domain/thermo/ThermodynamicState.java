package projectsonde.domain.thermo;

import lombok.Builder;
import lombok.With;
import projectsonde.physics.model.StateEquations;

/**
 * Estado termodinámico inmutable de una parcela: presión, temperatura y punto de rocío.
 * <p>
 * Se crea de nuevo en cada punto de evaluación y nunca se modifica. El constructor
 * canónico rechaza cualquier estado físicamente imposible.
 *
 * @param pressure    Presión [Pa], mayor que cero.
 * @param temperature Temperatura absoluta [K], mayor que cero.
 * @param dewPoint    Punto de rocío [K], no superior a la temperatura.
 */
@Builder
@With
public record ThermodynamicState(double pressure, double temperature, double dewPoint) {

    public ThermodynamicState {
        StateEquations.requirePressure(pressure);
        StateEquations.requireDewPoint(temperature, dewPoint);
    }

    /**
     * Estado saturado: el punto de rocío coincide con la temperatura.
     */
    public static ThermodynamicState saturated(double pressure, double temperature) {
        return new ThermodynamicState(pressure, temperature, temperature);
    }

    public boolean isSaturated() {
        return temperature == dewPoint;
    }

    public double dewPointDepression() {
        return temperature - dewPoint;
    }
}
