package projectsonde.utils;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectsonde.domain.sounding.Sounding;

import static org.junit.jupiter.api.Assertions.*;

class LogPressureInterpolationTest {

    private Sounding sounding;

    @BeforeEach
    void setUp() {
        sounding = new Sounding(
                new double[]{100000.0, 80000.0, 50000.0},
                new double[]{300.0, 290.0, 260.0},
                new double[]{290.0, 280.0, 240.0});
    }

    @Test
    @DisplayName("Recta entre dos puntos")
    void linear() {
        assertEquals(5.0, LogPressureInterpolation.linear(0.5, 0.0, 0.0, 1.0, 10.0), 1e-12);
        assertEquals(20.0, LogPressureInterpolation.linear(2.0, 0.0, 0.0, 1.0, 10.0), 1e-12);
    }

    @Test
    @DisplayName("La interpolación es lineal en log10(P), no en P")
    void interpolate_isLogarithmic() {
        double p = Math.sqrt(100000.0 * 80000.0); // punto medio en log10(P)
        assertEquals(295.0, LogPressureInterpolation.interpolate(p, 100000.0, 300.0, 80000.0, 290.0), 1e-9);
        assertNotEquals(295.0, LogPressureInterpolation.interpolate(90000.0, 100000.0, 300.0, 80000.0, 290.0), 1e-3);
    }

    @Test
    @DisplayName("Nivel exacto del sondeo: se devuelve el valor observado")
    void exactLevel() {
        assertEquals(290.0, LogPressureInterpolation.temperatureAt(sounding, 80000.0), 0.0);
        assertEquals(240.0, LogPressureInterpolation.dewPointAt(sounding, 50000.0), 0.0);
    }

    @Test
    @DisplayName("Presión entre niveles: se usan los dos niveles que la encierran")
    void betweenLevels() {
        assertEquals(1, LogPressureInterpolation.bracketingIndex(sounding, 60000.0));
        double t = LogPressureInterpolation.temperatureAt(sounding, 60000.0);
        assertTrue(t < 290.0 && t > 260.0);
    }

    @Test
    @DisplayName("Presión fuera del sondeo: error")
    void outsideRange() {
        assertThrows(IllegalArgumentException.class, () -> LogPressureInterpolation.temperatureAt(sounding, 40000.0));
        assertThrows(IllegalArgumentException.class, () -> LogPressureInterpolation.dewPointAt(sounding, 101000.0));
    }
}
