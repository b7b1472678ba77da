package projectsonde.domain.analysis;

import lombok.Builder;
import lombok.Value;
import projectsonde.domain.buoyancy.BuoyancyCrossing;
import projectsonde.domain.thermo.CondensationLevel;
import projectsonde.domain.thermo.ThermodynamicState;

import java.util.Optional;

/**
 * Resumen termodinámico de una parcela que parte de un nivel del sondeo.
 */
@Value
@Builder
public class SoundingAnalysis {

    ThermodynamicState origin;
    CondensationLevel condensationLevel;

    /**
     * Razón de mezcla de la parcela en su origen [kg/kg].
     */
    double mixingRatio;
    double potentialTemperature;
    double equivalentPotentialTemperature;
    double saturatedEquivalentPotentialTemperature;
    double wetBulbPotentialTemperature;
    double equivalentTemperature;

    BuoyancyCrossing equilibriumLevel;
    BuoyancyCrossing levelOfFreeConvection;

    public Optional<BuoyancyCrossing> getEquilibriumLevel() {
        return Optional.ofNullable(equilibriumLevel);
    }

    public Optional<BuoyancyCrossing> getLevelOfFreeConvection() {
        return Optional.ofNullable(levelOfFreeConvection);
    }
}
