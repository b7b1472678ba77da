package projectsonde.physics.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectsonde.config.SolverConfig;
import projectsonde.config.ThermoConfig;
import projectsonde.domain.thermo.CondensationLevel;
import projectsonde.physics.model.StateEquations;
import projectsonde.physics.solver.BisectionRootFinder;
import projectsonde.physics.solver.impl.LclSolver;

import static org.junit.jupiter.api.Assertions.*;

class MoistThermodynamicsTest {

    private MoistThermodynamics moist;
    private LclSolver lclSolver;

    @BeforeEach
    void setUp() {
        StateEquations equations = new StateEquations(ThermoConfig.standardAtmosphere());
        lclSolver = new LclSolver(equations, new BisectionRootFinder(200), SolverConfig.defaults());
        moist = new MoistThermodynamics(equations, lclSolver);
    }

    @Test
    @DisplayName("θe y θes del caso de referencia")
    void referenceCase() {
        assertEquals(333.6183, moist.equivalentPotentialTemperature(276.15, 60000.0, 268.15), 1e-3);
        assertEquals(344.5202, moist.saturatedEquivalentPotentialTemperature(276.15, 60000.0), 1e-3);
    }

    @Test
    @DisplayName("θes ≥ θe ≥ θ: saturar añade calor latente")
    void ordering() {
        double theta = moist.getEquations().potentialTemperature(276.15, 60000.0);
        double thetaE = moist.equivalentPotentialTemperature(276.15, 60000.0, 268.15);
        double thetaEs = moist.saturatedEquivalentPotentialTemperature(276.15, 60000.0);

        assertTrue(theta < thetaE);
        assertTrue(thetaE < thetaEs);
    }

    @Test
    @DisplayName("Temperatura equivalente delegada en las ecuaciones de estado")
    void equivalentTemperature() {
        assertEquals(286.9137, moist.equivalentTemperature(276.15, 60000.0, 268.15), 1e-3);
    }

    @Test
    @DisplayName("θe desde un LCL ya resuelto coincide con la versión que lo resuelve")
    void thetaEFromCondensationLevel() {
        CondensationLevel lcl = lclSolver.solve(276.15, 60000.0, 268.15);

        assertEquals(moist.equivalentPotentialTemperature(276.15, 60000.0, 268.15),
                moist.equivalentPotentialTemperature(lcl), 0.0);
    }
}
