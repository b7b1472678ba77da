package projectsonde.physics.buoyancy;

import projectsonde.domain.buoyancy.BuoyancySample;
import projectsonde.domain.profile.EnvironmentalProfile;
import projectsonde.domain.profile.ParcelProfile;
import projectsonde.physics.model.StateEquations;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Secuencia de muestras de flotabilidad ordenada del tope del perfil hacia la superficie.
 * <p>
 * Parcela y entorno se convierten a temperatura virtual usando en cada nivel la razón de
 * mezcla de su propio punto de rocío.
 */
public final class BuoyancyProfile implements Iterable<BuoyancySample> {

    private final List<BuoyancySample> topDown;

    private BuoyancyProfile(List<BuoyancySample> topDown) {
        this.topDown = Collections.unmodifiableList(topDown);
    }

    /**
     * @throws IllegalArgumentException si los perfiles no comparten los mismos niveles de presión.
     */
    public static BuoyancyProfile of(ParcelProfile parcel, EnvironmentalProfile environment, StateEquations equations) {
        Objects.requireNonNull(parcel, "El perfil de parcela no puede ser nulo.");
        Objects.requireNonNull(environment, "El perfil de entorno no puede ser nulo.");
        Objects.requireNonNull(equations, "Las ecuaciones de estado no pueden ser nulas.");
        if (parcel.size() != environment.size()) {
            throw new IllegalArgumentException(String.format(
                    "Perfiles no co-indexados: parcela con %d niveles, entorno con %d.", parcel.size(), environment.size()));
        }

        List<BuoyancySample> samples = new ArrayList<>(parcel.size());
        for (int i = parcel.size() - 1; i >= 0; i--) {
            double pressure = parcel.getPressureAt(i);
            if (pressure != environment.getPressureAt(i)) {
                throw new IllegalArgumentException(String.format(
                        "Perfiles no co-indexados en el nivel %d: %.3f Pa frente a %.3f Pa.", i, pressure, environment.getPressureAt(i)));
            }
            double parcelTv = equations.virtualTemperature(parcel.getTemperatureAt(i),
                    equations.mixingRatio(parcel.getDewPointAt(i), pressure));
            double environmentTv = equations.virtualTemperature(environment.getTemperatureAt(i),
                    equations.mixingRatio(environment.getDewPointAt(i), pressure));
            samples.add(new BuoyancySample(pressure, parcelTv, environmentTv));
        }
        return new BuoyancyProfile(samples);
    }

    public static BuoyancyProfile ofSamples(List<BuoyancySample> topDown) {
        return new BuoyancyProfile(new ArrayList<>(Objects.requireNonNull(topDown, "Las muestras no pueden ser nulas.")));
    }

    public List<BuoyancySample> topDown() {
        return topDown;
    }

    public int size() {
        return topDown.size();
    }

    @Override
    public Iterator<BuoyancySample> iterator() {
        return topDown.iterator();
    }
}
