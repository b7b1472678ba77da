package projectsonde.domain.thermo;

/**
 * Nivel de condensación por ascenso (LCL): temperatura y presión a las que una
 * parcela que asciende por la adiabática seca alcanza la saturación.
 *
 * @param temperature Temperatura en el LCL [K].
 * @param pressure    Presión en el LCL [Pa].
 */
public record CondensationLevel(double temperature, double pressure) {

    public static CondensationLevel at(ThermodynamicState state) {
        return new CondensationLevel(state.temperature(), state.pressure());
    }
}
