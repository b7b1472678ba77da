package projectsonde.physics.buoyancy;

import lombok.extern.slf4j.Slf4j;
import projectsonde.domain.buoyancy.BuoyancyCrossing;
import projectsonde.domain.buoyancy.LevelKind;
import projectsonde.domain.profile.EnvironmentalProfile;
import projectsonde.domain.profile.ParcelProfile;
import projectsonde.domain.profile.ProfileMode;
import projectsonde.domain.sounding.Sounding;
import projectsonde.physics.model.StateEquations;
import projectsonde.physics.profile.EnvironmentalProfileBuilder;
import projectsonde.physics.profile.ParcelProfileBuilder;

import java.util.Objects;
import java.util.Optional;

/**
 * Búsqueda del nivel de equilibrio (EL) y del nivel de convección libre (LFC).
 * <p>
 * Ambos perfiles se construyen sobre la misma rejilla con paso 2 · precisión, desde la
 * superficie del sondeo hasta su tope (EL) o hasta el EL (LFC).
 */
@Slf4j
public class BuoyancyLevelSearch {

    private final ParcelProfileBuilder parcelBuilder;
    private final EnvironmentalProfileBuilder environmentBuilder;
    private final StateEquations equations;
    private final BuoyancyCrossingDetector detector;

    public BuoyancyLevelSearch(ParcelProfileBuilder parcelBuilder,
                               EnvironmentalProfileBuilder environmentBuilder,
                               StateEquations equations,
                               BuoyancyCrossingDetector detector) {
        this.parcelBuilder = Objects.requireNonNull(parcelBuilder, "El constructor de perfiles de parcela no puede ser nulo.");
        this.environmentBuilder = Objects.requireNonNull(environmentBuilder, "El constructor de perfiles de entorno no puede ser nulo.");
        this.equations = Objects.requireNonNull(equations, "Las ecuaciones de estado no pueden ser nulas.");
        this.detector = Objects.requireNonNull(detector, "El detector de cruces no puede ser nulo.");
    }

    /**
     * @param originPressure Presión de origen de la parcela [Pa].
     * @param accuracy       Semiancho de la resolución en presión [Pa]; debe ser positivo.
     */
    public Optional<BuoyancyCrossing> findEquilibriumLevel(Sounding sounding, double originPressure, double accuracy) {
        Objects.requireNonNull(sounding, "El sondeo no puede ser nulo.");
        return search(sounding, originPressure, accuracy, sounding.topPressure(), LevelKind.EQUILIBRIUM_LEVEL);
    }

    /**
     * Localiza primero el EL y después el LFC entre la superficie y ese EL. Vacío si no
     * existe EL en el sondeo.
     */
    public Optional<BuoyancyCrossing> findLevelOfFreeConvection(Sounding sounding, double originPressure, double accuracy) {
        Optional<BuoyancyCrossing> equilibrium = findEquilibriumLevel(sounding, originPressure, accuracy);
        if (equilibrium.isEmpty()) {
            log.debug("Sin EL en el sondeo; no se busca LFC.");
            return Optional.empty();
        }
        return findLevelOfFreeConvectionBelow(sounding, originPressure, accuracy, equilibrium.get());
    }

    /**
     * LFC entre la superficie y un EL ya conocido.
     */
    public Optional<BuoyancyCrossing> findLevelOfFreeConvectionBelow(Sounding sounding, double originPressure,
                                                                     double accuracy, BuoyancyCrossing equilibrium) {
        Objects.requireNonNull(sounding, "El sondeo no puede ser nulo.");
        Objects.requireNonNull(equilibrium, "El EL no puede ser nulo.");
        requireAccuracy(accuracy);
        double topPressure = lfcScanTop(equilibrium, accuracy);
        if (!(topPressure < sounding.surfacePressure())) {
            return Optional.empty();
        }
        return search(sounding, originPressure, accuracy, topPressure, LevelKind.LEVEL_OF_FREE_CONVECTION);
    }

    /**
     * Tope de la rejilla del LFC. Un EL exacto cae sobre una muestra neutra de la rejilla;
     * el barrido se detiene un paso por debajo para no devolver el propio EL como LFC.
     */
    public static double lfcScanTop(BuoyancyCrossing equilibrium, double accuracy) {
        return equilibrium.exact() ? equilibrium.pressure() + 2.0 * accuracy : equilibrium.pressure();
    }

    private Optional<BuoyancyCrossing> search(Sounding sounding, double originPressure, double accuracy,
                                              double topPressure, LevelKind kind) {
        requireAccuracy(accuracy);
        double step = 2.0 * accuracy;
        double surface = sounding.surfacePressure();

        EnvironmentalProfile environment = environmentBuilder.build(sounding, surface, topPressure, step);
        ParcelProfile parcel = parcelBuilder.build(originPressure, sounding, ProfileMode.STEPPED, surface, topPressure, step);
        BuoyancyProfile profile = BuoyancyProfile.of(parcel, environment, equations);

        Optional<BuoyancyCrossing> crossing = detector.detect(profile, kind);
        if (crossing.isPresent()) {
            log.info("{} localizado en {} Pa (origen {} Pa, precisión {} Pa)",
                    kind.getAbbreviation(), crossing.get().pressure(), originPressure, accuracy);
        } else {
            log.info("Sin {} entre {} Pa y {} Pa", kind.getAbbreviation(), surface, topPressure);
        }
        return crossing;
    }

    private static void requireAccuracy(double accuracy) {
        if (!Double.isFinite(accuracy) || accuracy <= 0) {
            throw new IllegalArgumentException("La precisión debe ser finita y positiva, recibido: " + accuracy);
        }
    }
}
