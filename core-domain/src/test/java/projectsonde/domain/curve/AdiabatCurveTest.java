package projectsonde.domain.curve;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdiabatCurveTest {

    @Test
    @DisplayName("La presión debe ser estrictamente monótona en cualquier sentido")
    void requiresMonotonicPressure() {
        assertDoesNotThrow(() -> new AdiabatCurve(CurveType.DRY_ADIABAT, 300.0,
                new double[]{100000.0, 90000.0}, new double[]{300.0, 291.0}));
        assertDoesNotThrow(() -> new AdiabatCurve(CurveType.DRY_ADIABAT, 300.0,
                new double[]{90000.0, 100000.0}, new double[]{291.0, 300.0}));
        assertThrows(IllegalArgumentException.class, () -> new AdiabatCurve(CurveType.DRY_ADIABAT, 300.0,
                new double[]{100000.0, 90000.0, 95000.0}, new double[]{300.0, 291.0, 295.0}));
    }

    @Test
    @DisplayName("Una sola muestra es una curva válida")
    void singleSample() {
        AdiabatCurve curve = new AdiabatCurve(CurveType.MOIST_ADIABAT, 330.0, new double[]{50000.0}, new double[]{260.0});
        assertEquals(1, curve.size());
        assertEquals(260.0, curve.getTemperatureAt(0));
    }

    @Test
    @DisplayName("Longitudes distintas o curva vacía se rechazan")
    void rejectsInvalidShape() {
        assertThrows(IllegalArgumentException.class, () -> new AdiabatCurve(CurveType.MIXING_RATIO_LINE, 0.005,
                new double[]{100000.0}, new double[]{300.0, 291.0}));
        assertThrows(IllegalArgumentException.class, () -> new AdiabatCurve(CurveType.MIXING_RATIO_LINE, 0.005,
                new double[0], new double[0]));
    }
}
