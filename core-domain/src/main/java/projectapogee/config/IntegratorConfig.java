package projectapogee.config;

import lombok.Builder;
import lombok.With;
import projectapogee.domain.exception.InvalidInputException;

/**
 * Parámetros del integrador adaptativo de las ecuaciones del movimiento.
 *
 * @param initialStep    Paso inicial [s].
 * @param minStep        Paso mínimo; por debajo el integrador falla [s].
 * @param maxStep        Paso máximo [s].
 * @param maxTime        Tiempo máximo simulado [s].
 * @param sampleInterval Intervalo de remuestreo de la salida [s]; &lt;= 0 guarda cada paso aceptado.
 * @param flightMode     Fase(s) a integrar.
 */
@Builder
@With
public record IntegratorConfig(
        double initialStep,
        double minStep,
        double maxStep,
        double maxTime,
        double sampleInterval,
        FlightMode flightMode
) {
    public IntegratorConfig {
        if (flightMode == null) {
            flightMode = FlightMode.ASCENT_ONLY;
        }
    }

    public void validate() {
        if (!(minStep > 0) || !(initialStep >= minStep) || !(maxStep >= initialStep) || !(maxTime > 0)) {
            throw new InvalidInputException("Se requiere 0 < minStep <= initialStep <= maxStep y maxTime > 0: " + this);
        }
    }

    public static IntegratorConfig getDefault() {
        return IntegratorConfig.builder()
                .initialStep(1e-3)
                .minStep(1e-10)
                .maxStep(0.1)
                .maxTime(300.0)
                .sampleInterval(0.05)
                .flightMode(FlightMode.ASCENT_ONLY)
                .build();
    }
}
