package projectapogee.config;

/**
 * Fases de vuelo que integra el integrador.
 */
public enum FlightMode {
    /**
     * Se detiene en el apogeo. Es lo único que necesita el optimizador.
     */
    ASCENT_ONLY,
    /**
     * Continúa con la caída balística (sin paracaídas) hasta el impacto con el suelo.
     */
    FULL_FLIGHT
}
