package projectapogee.physics.model;

import projectapogee.domain.flight.AtmosphereProperties;

/**
 * Contrato de los modelos de atmósfera. Las implementaciones deben ser funciones puras
 * (sin efectos secundarios) para que el integrador pueda llamarlas millones de veces
 * desde ejecuciones independientes.
 */
@FunctionalInterface
public interface AtmosphereModel {

    /**
     * @param altitude Altitud geométrica sobre el nivel del mar [m].
     * @return densidad, presión, temperatura y velocidad del sonido en esa altitud.
     */
    AtmosphereProperties properties(double altitude);

    default double densityAt(double altitude) {
        return properties(altitude).density();
    }

    default double pressureAt(double altitude) {
        return properties(altitude).pressure();
    }
}
