package projectsonde.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectsonde.config.SolverConfig;
import projectsonde.config.ThermoConfig;
import projectsonde.domain.analysis.SoundingAnalysis;
import projectsonde.domain.buoyancy.LevelKind;
import projectsonde.domain.curve.AdiabatCurve;
import projectsonde.domain.exception.NoBuoyancyCrossingException;
import projectsonde.domain.profile.ParcelProfile;
import projectsonde.domain.sounding.Sounding;
import projectsonde.domain.thermo.CondensationLevel;
import projectsonde.support.ThermoFixtures;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test de integración del facade: cableado completo con la configuración por defecto.
 */
@Slf4j
class SoundingAnalyzerTest {

    private SoundingAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new SoundingAnalyzer(ThermoConfig.standardAtmosphere(), SolverConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        analyzer.close();
    }

    @Test
    @DisplayName("Resumen de la parcela de referencia (276.15 K, 60000 Pa, 268.15 K)")
    void referenceParcel() {
        // --- 1. Arrange ---
        Sounding sounding = new Sounding(
                new double[]{60000.0, 50000.0},
                new double[]{276.15, 268.15},
                new double[]{268.15, 255.15});

        // --- 2. Act ---
        SoundingAnalysis analysis = analyzer.analyze(sounding, 60000.0);
        log.info("Análisis de referencia: {}", analysis);

        // --- 3. Assert ---
        assertEquals(266.5101, analysis.getCondensationLevel().temperature(), 1e-3);
        assertEquals(52981.2, analysis.getCondensationLevel().pressure(), 1.0);
        assertEquals(4.407, analysis.getMixingRatio() * 1000.0, 1e-3);
        assertEquals(319.5271, analysis.getPotentialTemperature(), 1e-3);
        assertEquals(333.6183, analysis.getEquivalentPotentialTemperature(), 1e-3);
        assertEquals(344.5202, analysis.getSaturatedEquivalentPotentialTemperature(), 1e-3);
        assertEquals(293.2848, analysis.getWetBulbPotentialTemperature(), 1e-3);
        assertEquals(286.9137, analysis.getEquivalentTemperature(), 1e-3);
    }

    @Test
    @DisplayName("Resumen completo sobre el sondeo convectivo, con EL y LFC")
    void convectiveSounding_fullAnalysis() {
        SoundingAnalysis analysis = analyzer.analyze(ThermoFixtures.convectiveSounding(), 100000.0);

        assertTrue(analysis.getEquilibriumLevel().isPresent());
        assertTrue(analysis.getLevelOfFreeConvection().isPresent());
        assertTrue(analysis.getLevelOfFreeConvection().get().pressure() > analysis.getEquilibriumLevel().get().pressure());
        assertTrue(analysis.getCondensationLevel().pressure() > analysis.getLevelOfFreeConvection().get().pressure());
    }

    @Test
    @DisplayName("Las variantes que lanzan excepción coinciden con las opcionales")
    void throwingVariants() {
        Sounding sounding = ThermoFixtures.convectiveSounding();

        double el = analyzer.equilibriumLevel(sounding);
        double lfc = analyzer.levelOfFreeConvection(sounding);

        assertEquals(analyzer.findEquilibriumLevel(sounding, 100000.0, 50.0).orElseThrow().pressure(), el, 0.0);
        assertEquals(analyzer.findLevelOfFreeConvection(sounding, 100000.0, 50.0).orElseThrow().pressure(), lfc, 0.0);
    }

    @Test
    @DisplayName("Sin EL en el sondeo: NoBuoyancyCrossingException")
    void stableSounding_throws() {
        Sounding stable = ThermoFixtures.stableSounding();

        NoBuoyancyCrossingException e = assertThrows(NoBuoyancyCrossingException.class, () -> analyzer.equilibriumLevel(stable));
        assertEquals(LevelKind.EQUILIBRIUM_LEVEL, e.getLevelKind());
        NoBuoyancyCrossingException lfc = assertThrows(NoBuoyancyCrossingException.class, () -> analyzer.levelOfFreeConvection(stable));
        assertEquals(LevelKind.LEVEL_OF_FREE_CONVECTION, lfc.getLevelKind());
        assertEquals(stable.surfacePressure(), lfc.getBottomPressure(), 0.0);
        assertEquals(stable.topPressure(), lfc.getTopPressure(), 0.0);

        SoundingAnalysis analysis = analyzer.analyze(stable, 100000.0);
        assertTrue(analysis.getEquilibriumLevel().isEmpty());
        assertTrue(analysis.getLevelOfFreeConvection().isEmpty());
    }

    @Test
    @DisplayName("Operaciones puntuales y curvas expuestas por el facade")
    void pointOperationsAndCurves() {
        CondensationLevel lcl = analyzer.liftingCondensationLevel(300.0, 100000.0, 290.0);
        double thetaE = analyzer.equivalentPotentialTemperature(300.0, 100000.0, 290.0);

        AdiabatCurve moist = analyzer.moistAdiabat(thetaE, lcl.pressure(), 30000.0, 1000.0);
        AdiabatCurve line = analyzer.mixingRatioLine(0.01, 100000.0, 50000.0, 1000.0);
        AdiabatCurve dry = analyzer.dryAdiabat(300.0, 100000.0, 10000.0, 1000.0);

        // En el LCL la adiabática húmeda arranca en la temperatura del LCL.
        assertEquals(lcl.temperature(), moist.getTemperatureAt(0), 0.05);
        assertEquals(analyzer.isoplethTemperature(0.01, 70000.0), line.getTemperatureAt(30), 0.0);
        int top = moist.size() - 1;
        assertEquals(analyzer.moistAdiabatTemperature(thetaE, moist.getPressureAt(top)), moist.getTemperatureAt(top), 0.0);
        assertEquals(91, dry.size());
        assertTrue(analyzer.wetBulbPotentialTemperature(300.0, 100000.0, 290.0) < thetaE);
        assertTrue(analyzer.saturatedEquivalentPotentialTemperature(300.0, 100000.0) > thetaE);
    }

    @Test
    @DisplayName("Perfil de parcela desde el facade")
    void parcelProfile() {
        Sounding sounding = ThermoFixtures.convectiveSounding();

        ParcelProfile sameLevels = analyzer.parcelProfile(100000.0, sounding);
        ParcelProfile stepped = analyzer.parcelProfile(100000.0, sounding, 100000.0, 20000.0, 1000.0);

        assertEquals(sounding.levelCount(), sameLevels.size());
        assertEquals(81, stepped.size());
        // Mismo nivel de presión, misma temperatura de parcela en ambos modos.
        assertEquals(sameLevels.getTemperatureAt(3), stepped.getTemperatureAt(30), 0.0);
        assertEquals(303.15, stepped.getTemperatureAt(0), 1e-9);
    }

    @Test
    @DisplayName("Configuración paralela: mismo resultado que la secuencial")
    void parallelConfiguration() {
        Sounding sounding = ThermoFixtures.convectiveSounding();

        try (SoundingAnalyzer parallel = new SoundingAnalyzer(ThermoConfig.standardAtmosphere(),
                SolverConfig.defaults().withCpuProcessorCount(4))) {
            assertEquals(analyzer.equilibriumLevel(sounding), parallel.equilibriumLevel(sounding), 0.0);
        }
    }

    @Test
    @DisplayName("EL sin LFC: la excepción del LFC informa del rango barrido, de la superficie al EL")
    void buoyantBelowEquilibrium_lfcExceptionReportsScannedRange() {
        // --- 1. Arrange ---
        // Inversión en superficie y capa superadiabática sobre el origen (94950 Pa, fuera de la rejilla):
        // la parcela es más cálida que el entorno desde la superficie hasta el EL.
        Sounding sounding = new Sounding(
                new double[]{100000.0, 94950.0, 85000.0, 70000.0, 50000.0, 30000.0, 20000.0},
                new double[]{290.0, 300.0, 285.0, 275.0, 258.0, 232.0, 228.0},
                new double[]{285.0, 292.0, 280.0, 262.0, 243.0, 220.0, 200.0});
        double origin = 94950.0;

        // --- 2. Act ---
        double el = analyzer.equilibriumLevel(sounding, origin, 50.0);
        NoBuoyancyCrossingException e = assertThrows(NoBuoyancyCrossingException.class,
                () -> analyzer.levelOfFreeConvection(sounding, origin, 50.0));
        log.info("EL = {} Pa; {}", el, e.getMessage());

        // --- 3. Assert ---
        assertTrue(el > 23000.0 && el < 24500.0, "EL fuera de rango: " + el);
        assertEquals(LevelKind.LEVEL_OF_FREE_CONVECTION, e.getLevelKind());
        assertEquals(100000.0, e.getBottomPressure(), 0.0);
        assertEquals(el, e.getTopPressure(), 0.0);
        assertTrue(analyzer.analyze(sounding, origin).getLevelOfFreeConvection().isEmpty());
    }

    @Test
    @DisplayName("Sondeo con tope por debajo de 5000 Pa: el análisis falla con IllegalArgumentException")
    void soundingAboveSingularityMargin_analyzeThrows() {
        Sounding deep = new Sounding(
                new double[]{100000.0, 85000.0, 70000.0, 50000.0, 30000.0, 20000.0, 4000.0},
                new double[]{303.15, 294.15, 283.15, 266.15, 239.15, 231.15, 225.0},
                new double[]{295.15, 280.15, 268.15, 250.15, 225.15, 205.15, 190.0});

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> analyzer.analyze(deep, 100000.0));
        assertTrue(e.getMessage().contains("margen de singularidad"), e.getMessage());
    }

    @Test
    @DisplayName("Origen en niveles altos: θw no está definida y el análisis falla con IllegalArgumentException")
    void upperLevelOrigin_analyzeThrows() {
        // θd en el LCL ≈ 396 K: e_s(θd) supera la presión de referencia.
        Sounding upper = new Sounding(
                new double[]{30000.0, 20000.0},
                new double[]{260.0, 250.0},
                new double[]{240.0, 230.0});

        assertThrows(IllegalArgumentException.class, () -> analyzer.wetBulbPotentialTemperature(250.0, 20000.0, 230.0));
        assertThrows(IllegalArgumentException.class, () -> analyzer.analyze(upper, 20000.0));
    }
}
