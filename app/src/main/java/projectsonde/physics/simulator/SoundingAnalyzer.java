package projectsonde.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projectsonde.config.SolverConfig;
import projectsonde.config.ThermoConfig;
import projectsonde.domain.analysis.SoundingAnalysis;
import projectsonde.domain.buoyancy.BuoyancyCrossing;
import projectsonde.domain.buoyancy.LevelKind;
import projectsonde.domain.curve.AdiabatCurve;
import projectsonde.domain.exception.NoBuoyancyCrossingException;
import projectsonde.domain.profile.EnvironmentalProfile;
import projectsonde.domain.profile.ParcelProfile;
import projectsonde.domain.profile.ProfileMode;
import projectsonde.domain.sounding.Sounding;
import projectsonde.domain.thermo.CondensationLevel;
import projectsonde.domain.thermo.ThermodynamicState;
import projectsonde.physics.buoyancy.BuoyancyCrossingDetector;
import projectsonde.physics.buoyancy.BuoyancyLevelSearch;
import projectsonde.physics.curve.CurveBatchProcessor;
import projectsonde.physics.curve.DryAdiabatGenerator;
import projectsonde.physics.curve.MixingRatioLineGenerator;
import projectsonde.physics.curve.MoistAdiabatGenerator;
import projectsonde.physics.impl.MoistThermodynamics;
import projectsonde.physics.model.StateEquations;
import projectsonde.physics.profile.EnvironmentalProfileBuilder;
import projectsonde.physics.profile.ParcelProfileBuilder;
import projectsonde.physics.solver.BisectionRootFinder;
import projectsonde.physics.solver.impl.LclSolver;
import projectsonde.physics.solver.impl.MixingRatioIsoplethSolver;
import projectsonde.physics.solver.impl.MoistAdiabatSolver;
import projectsonde.physics.solver.impl.WetBulbPotentialTemperatureSolver;

import java.util.Objects;
import java.util.Optional;

/**
 * Punto de entrada del motor termodinámico.
 * Facade de alto nivel que cablea ecuaciones de estado, solvers, generadores de curvas,
 * constructores de perfiles y búsqueda de niveles convectivos a partir de la configuración.
 */
@Slf4j
@Getter
public class SoundingAnalyzer implements AutoCloseable {

    private final ThermoConfig thermoConfig;
    private final SolverConfig solverConfig;

    private final StateEquations equations;
    private final BisectionRootFinder rootFinder;
    private final LclSolver lclSolver;
    private final MoistThermodynamics moistThermodynamics;
    private final WetBulbPotentialTemperatureSolver wetBulbSolver;
    private final MixingRatioIsoplethSolver isoplethSolver;
    private final MoistAdiabatSolver moistAdiabatSolver;

    private final CurveBatchProcessor batchProcessor;
    private final DryAdiabatGenerator dryAdiabatGenerator;
    private final MixingRatioLineGenerator mixingRatioLineGenerator;
    private final MoistAdiabatGenerator moistAdiabatGenerator;

    private final ParcelProfileBuilder parcelProfileBuilder;
    private final EnvironmentalProfileBuilder environmentalProfileBuilder;
    private final BuoyancyLevelSearch buoyancyLevelSearch;

    public SoundingAnalyzer() {
        this(ThermoConfig.standardAtmosphere(), SolverConfig.defaults());
    }

    public SoundingAnalyzer(ThermoConfig thermoConfig, SolverConfig solverConfig) {
        this.thermoConfig = Objects.requireNonNull(thermoConfig, "La configuración termodinámica no puede ser nula.");
        this.solverConfig = Objects.requireNonNull(solverConfig, "La configuración del solver no puede ser nula.");

        this.equations = new StateEquations(thermoConfig);
        this.rootFinder = new BisectionRootFinder(solverConfig.getMaxIterations());
        this.lclSolver = new LclSolver(equations, rootFinder, solverConfig);
        this.moistThermodynamics = new MoistThermodynamics(equations, lclSolver);
        this.wetBulbSolver = new WetBulbPotentialTemperatureSolver(moistThermodynamics, rootFinder, solverConfig);
        this.isoplethSolver = new MixingRatioIsoplethSolver(equations, rootFinder, solverConfig);
        this.moistAdiabatSolver = new MoistAdiabatSolver(moistThermodynamics, rootFinder, solverConfig);

        this.batchProcessor = new CurveBatchProcessor(solverConfig);
        this.dryAdiabatGenerator = new DryAdiabatGenerator(equations);
        this.mixingRatioLineGenerator = new MixingRatioLineGenerator(isoplethSolver, batchProcessor);
        this.moistAdiabatGenerator = new MoistAdiabatGenerator(moistAdiabatSolver, batchProcessor);

        this.parcelProfileBuilder = new ParcelProfileBuilder(moistThermodynamics,
                dryAdiabatGenerator, mixingRatioLineGenerator, moistAdiabatGenerator);
        this.environmentalProfileBuilder = new EnvironmentalProfileBuilder(equations,
                dryAdiabatGenerator, mixingRatioLineGenerator);
        this.buoyancyLevelSearch = new BuoyancyLevelSearch(parcelProfileBuilder, environmentalProfileBuilder,
                equations, new BuoyancyCrossingDetector());

        log.info("SoundingAnalyzer inicializado. Criterio={}, MaxIter={}, Hilos={}",
                solverConfig.getEquilibriumCriterion(), solverConfig.getMaxIterations(), batchProcessor.getProcessorCount());
    }

    // --- MAGNITUDES PUNTUALES ---

    public CondensationLevel liftingCondensationLevel(double temperature, double pressure, double dewPoint) {
        return lclSolver.solve(temperature, pressure, dewPoint);
    }

    public CondensationLevel liftingCondensationLevel(ThermodynamicState state) {
        return lclSolver.solve(state);
    }

    public double wetBulbPotentialTemperature(double temperature, double pressure, double dewPoint) {
        return wetBulbSolver.solve(temperature, pressure, dewPoint);
    }

    public double equivalentPotentialTemperature(double temperature, double pressure, double dewPoint) {
        return moistThermodynamics.equivalentPotentialTemperature(temperature, pressure, dewPoint);
    }

    public double saturatedEquivalentPotentialTemperature(double temperature, double pressure) {
        return moistThermodynamics.saturatedEquivalentPotentialTemperature(temperature, pressure);
    }

    /**
     * Temperatura a la que la razón de mezcla de saturación vale {@code mixingRatio} en {@code pressure}.
     */
    public double isoplethTemperature(double mixingRatio, double pressure) {
        return isoplethSolver.solve(mixingRatio, pressure);
    }

    /**
     * Temperatura sobre la adiabática húmeda de θe = {@code thetaE} en {@code pressure}.
     */
    public double moistAdiabatTemperature(double thetaE, double pressure) {
        return moistAdiabatSolver.solve(thetaE, pressure);
    }

    // --- CURVAS ---

    public AdiabatCurve dryAdiabat(double theta, double p1, double p2, double step) {
        return dryAdiabatGenerator.generate(theta, p1, p2, step);
    }

    public AdiabatCurve mixingRatioLine(double mixingRatio, double p1, double p2, double step) {
        return mixingRatioLineGenerator.generate(mixingRatio, p1, p2, step);
    }

    public AdiabatCurve moistAdiabat(double thetaE, double p1, double p2, double step) {
        return moistAdiabatGenerator.generate(thetaE, p1, p2, step);
    }

    // --- PERFILES ---

    public ParcelProfile parcelProfile(double originPressure, Sounding sounding) {
        return parcelProfileBuilder.build(originPressure, sounding);
    }

    public ParcelProfile parcelProfile(double originPressure, Sounding sounding, double p1, double p2, double step) {
        return parcelProfileBuilder.build(originPressure, sounding, ProfileMode.STEPPED, p1, p2, step);
    }

    public EnvironmentalProfile environmentalProfile(Sounding sounding, double p1, double p2, double step) {
        return environmentalProfileBuilder.build(sounding, p1, p2, step);
    }

    // --- NIVELES CONVECTIVOS ---

    public Optional<BuoyancyCrossing> findEquilibriumLevel(Sounding sounding, double originPressure, double accuracy) {
        return buoyancyLevelSearch.findEquilibriumLevel(sounding, originPressure, accuracy);
    }

    public Optional<BuoyancyCrossing> findLevelOfFreeConvection(Sounding sounding, double originPressure, double accuracy) {
        return buoyancyLevelSearch.findLevelOfFreeConvection(sounding, originPressure, accuracy);
    }

    /**
     * Nivel de equilibrio de una parcela de superficie con la precisión por defecto.
     *
     * @throws NoBuoyancyCrossingException si no hay EL en el sondeo.
     */
    public double equilibriumLevel(Sounding sounding) {
        return equilibriumLevel(sounding, sounding.surfacePressure(), solverConfig.getDefaultBuoyancyAccuracy());
    }

    /**
     * @throws NoBuoyancyCrossingException con el rango barrido: de la superficie al tope del sondeo.
     */
    public double equilibriumLevel(Sounding sounding, double originPressure, double accuracy) {
        return findEquilibriumLevel(sounding, originPressure, accuracy)
                .map(BuoyancyCrossing::pressure)
                .orElseThrow(() -> new NoBuoyancyCrossingException(
                        LevelKind.EQUILIBRIUM_LEVEL, sounding.surfacePressure(), sounding.topPressure()));
    }

    public double levelOfFreeConvection(Sounding sounding) {
        return levelOfFreeConvection(sounding, sounding.surfacePressure(), solverConfig.getDefaultBuoyancyAccuracy());
    }

    /**
     * @throws NoBuoyancyCrossingException con el rango barrido: de la superficie al EL, o al
     *                                     tope del sondeo si no hay EL.
     */
    public double levelOfFreeConvection(Sounding sounding, double originPressure, double accuracy) {
        Optional<BuoyancyCrossing> equilibrium = findEquilibriumLevel(sounding, originPressure, accuracy);
        double scanTop = equilibrium
                .map(el -> BuoyancyLevelSearch.lfcScanTop(el, accuracy))
                .orElse(sounding.topPressure());
        return equilibrium
                .flatMap(el -> buoyancyLevelSearch.findLevelOfFreeConvectionBelow(sounding, originPressure, accuracy, el))
                .map(BuoyancyCrossing::pressure)
                .orElseThrow(() -> new NoBuoyancyCrossingException(
                        LevelKind.LEVEL_OF_FREE_CONVECTION, sounding.surfacePressure(), scanTop));
    }

    // --- RESUMEN ---

    /**
     * Resumen termodinámico de la parcela que parte de {@code originPressure}.
     * EL y LFC se omiten del resumen cuando el sondeo no los contiene.
     */
    public SoundingAnalysis analyze(Sounding sounding, double originPressure) {
        Objects.requireNonNull(sounding, "El sondeo no puede ser nulo.");
        long startTime = System.currentTimeMillis();

        ThermodynamicState origin = parcelProfileBuilder.originState(originPressure, sounding);
        double t = origin.temperature();
        double p = origin.pressure();
        double td = origin.dewPoint();
        double accuracy = solverConfig.getDefaultBuoyancyAccuracy();
        CondensationLevel lcl = lclSolver.solve(origin);

        Optional<BuoyancyCrossing> equilibrium = findEquilibriumLevel(sounding, originPressure, accuracy);
        Optional<BuoyancyCrossing> freeConvection = equilibrium.flatMap(el ->
                buoyancyLevelSearch.findLevelOfFreeConvectionBelow(sounding, originPressure, accuracy, el));

        SoundingAnalysis analysis = SoundingAnalysis.builder()
                .origin(origin)
                .condensationLevel(lcl)
                .mixingRatio(equations.mixingRatio(td, p))
                .potentialTemperature(equations.potentialTemperature(t, p))
                .equivalentPotentialTemperature(moistThermodynamics.equivalentPotentialTemperature(lcl))
                .saturatedEquivalentPotentialTemperature(moistThermodynamics.saturatedEquivalentPotentialTemperature(t, p))
                .wetBulbPotentialTemperature(wetBulbSolver.solve(lcl))
                .equivalentTemperature(moistThermodynamics.equivalentTemperature(t, p, td))
                .equilibriumLevel(equilibrium.orElse(null))
                .levelOfFreeConvection(freeConvection.orElse(null))
                .build();

        log.info("Análisis desde {} Pa completado en {} ms", originPressure, System.currentTimeMillis() - startTime);
        return analysis;
    }

    @Override
    public void close() {
        batchProcessor.close();
    }
}
