package projectsonde.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectsonde.config.SolverConfig;
import projectsonde.config.SolverConfig.ConvergenceCriterion;
import projectsonde.config.ThermoConfig;
import projectsonde.domain.thermo.CondensationLevel;
import projectsonde.domain.thermo.ThermodynamicState;
import projectsonde.physics.i.IRootFinder;
import projectsonde.physics.model.StateEquations;
import projectsonde.physics.solver.BisectionRootFinder;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@Slf4j
class LclSolverTest {

    private StateEquations equations;
    private LclSolver solver;

    @BeforeEach
    void setUp() {
        equations = new StateEquations(ThermoConfig.standardAtmosphere());
        solver = new LclSolver(equations, new BisectionRootFinder(200), SolverConfig.defaults());
    }

    @Test
    @DisplayName("Parcela saturada (T = Td): el LCL es el estado de superficie, sin iterar")
    void saturatedParcel_returnsSurfaceState() {
        // --- 1. Arrange ---
        IRootFinder rootFinder = mock(IRootFinder.class);
        LclSolver isolated = new LclSolver(equations, rootFinder, SolverConfig.defaults());

        // --- 2. Act ---
        CondensationLevel lcl = isolated.solve(281.3, 87000.0, 281.3);

        // --- 3. Assert ---
        assertEquals(new CondensationLevel(281.3, 87000.0), lcl);
        verifyNoInteractions(rootFinder);
    }

    @Test
    @DisplayName("Caso de referencia: T = 276.15 K, P = 60000 Pa, Td = 268.15 K")
    void referenceCase() {
        // --- 1. Arrange ---
        double t = 276.15;
        double p = 60000.0;
        double td = 268.15;

        // --- 2. Act ---
        CondensationLevel lcl = solver.solve(t, p, td);
        log.info("LCL de referencia: T={} K, P={} Pa", lcl.temperature(), lcl.pressure());

        // --- 3. Assert ---
        assertTrue(lcl.temperature() > 266.5 && lcl.temperature() < 267.0, "T_lcl fuera de rango: " + lcl.temperature());
        assertEquals(266.5101, lcl.temperature(), 1e-3);
        assertEquals(52981.2, lcl.pressure(), 1.0);
    }

    @Test
    @DisplayName("El LCL conserva la razón de mezcla y queda por encima de la superficie")
    void conservesMixingRatio() {
        double[][] cases = {
                {300.0, 100000.0, 290.0},
                {310.0, 95000.0, 280.0},
                {250.0, 50000.0, 240.0},
                {276.15, 60000.0, 268.15}
        };

        for (double[] c : cases) {
            CondensationLevel lcl = solver.solve(c[0], c[1], c[2]);

            assertTrue(lcl.temperature() <= c[0], "T_lcl > T en " + java.util.Arrays.toString(c));
            assertTrue(lcl.pressure() <= c[1], "P_lcl > P en " + java.util.Arrays.toString(c));
            assertEquals(equations.mixingRatio(c[2], c[1]),
                    equations.mixingRatio(lcl.temperature(), lcl.pressure()), 1e-6);
        }
    }

    @Test
    @DisplayName("El LCL de un estado con Td menor queda más alto (presión menor)")
    void drierParcel_higherLcl() {
        CondensationLevel moist = solver.solve(new ThermodynamicState(100000.0, 300.0, 295.0));
        CondensationLevel dry = solver.solve(new ThermodynamicState(100000.0, 300.0, 280.0));
        assertTrue(dry.pressure() < moist.pressure());
    }

    @Test
    @DisplayName("El criterio de residuo en el punto medio da un LCL equivalente")
    void midpointCriterion_agrees() {
        LclSolver alternative = new LclSolver(equations, new BisectionRootFinder(200),
                SolverConfig.defaults().withEquilibriumCriterion(ConvergenceCriterion.MIDPOINT_RESIDUAL));

        CondensationLevel legacy = solver.solve(276.15, 60000.0, 268.15);
        CondensationLevel principled = alternative.solve(276.15, 60000.0, 268.15);

        assertEquals(legacy.temperature(), principled.temperature(), 0.05);
    }

    @Test
    @DisplayName("Punto de rocío mayor que la temperatura: error de dominio")
    void supersaturated_throws() {
        assertThrows(IllegalArgumentException.class, () -> solver.solve(270.0, 80000.0, 275.0));
        assertThrows(IllegalArgumentException.class, () -> solver.solve(270.0, -1.0, 260.0));
    }
}
