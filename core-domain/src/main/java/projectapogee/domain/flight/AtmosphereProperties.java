package projectapogee.domain.flight;

/**
 * Propiedades de la atmósfera a una altitud dada.
 *
 * @param density      Densidad del aire [kg/m³].
 * @param pressure     Presión estática [Pa].
 * @param temperature  Temperatura [K].
 * @param speedOfSound Velocidad del sonido [m/s].
 */
public record AtmosphereProperties(
        double density,
        double pressure,
        double temperature,
        double speedOfSound
) {
}
