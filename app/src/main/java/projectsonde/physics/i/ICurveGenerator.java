package projectsonde.physics.i;

import projectsonde.domain.curve.AdiabatCurve;
import projectsonde.domain.curve.CurveType;
import projectsonde.utils.PressureGrid;

/**
 * Generador de curvas (presión, temperatura) que conservan una magnitud.
 */
public interface ICurveGenerator extends ISolverComponent {

    CurveType getCurveType();

    /**
     * Genera la curva sobre un array arbitrario de presiones estrictamente monótono.
     *
     * @param level     Magnitud conservada (θ, w o θe).
     * @param pressures Presiones de muestreo [Pa].
     */
    AdiabatCurve generate(double level, double[] pressures);

    /**
     * Genera la curva desde p1 hasta p2 con paso fijo, ambos extremos incluidos.
     * Número de muestras: floor(|p1 - p2| / paso) + 1.
     */
    default AdiabatCurve generate(double level, double p1, double p2, double step) {
        return generate(level, PressureGrid.stepped(p1, p2, step));
    }

    /**
     * Temperatura de la curva en un único nivel de presión.
     */
    double temperatureAt(double level, double pressure);
}
