package projectsonde.domain.profile;

import java.util.Objects;

/**
 * Validaciones compartidas por los perfiles co-indexados.
 */
final class ProfileArrays {

    private ProfileArrays() {
    }

    static void requireColumn(double[] pressure, double[] temperature, double[] dewPoint) {
        Objects.requireNonNull(pressure, "El array de presiones no puede ser nulo.");
        Objects.requireNonNull(temperature, "El array de temperaturas no puede ser nulo.");
        Objects.requireNonNull(dewPoint, "El array de puntos de rocío no puede ser nulo.");
        if (temperature.length != pressure.length || dewPoint.length != pressure.length) {
            throw new IllegalArgumentException("Los arrays del perfil deben tener la misma longitud.");
        }
        if (pressure.length == 0) {
            throw new IllegalArgumentException("Un perfil necesita al menos un nivel.");
        }
        for (int i = 1; i < pressure.length; i++) {
            if (pressure[i] >= pressure[i - 1]) {
                throw new IllegalArgumentException("La presión del perfil debe decrecer estrictamente con el índice (nivel " + i + ").");
            }
        }
    }
}
