package projectapogee.domain.exception;

import lombok.Getter;

/**
 * El integrador adaptativo no pudo continuar: la tolerancia no se cumple tras el número
 * máximo de rechazos de paso, el estado dejó de ser finito o la masa se volvió no positiva.
 */
@Getter
public class IntegrationFailureException extends DesignException {

    /**
     * Tiempo de simulación en el que se detectó el fallo [s].
     */
    private final double time;

    public IntegrationFailureException(String message, double time) {
        super(String.format("%s (t=%.6f s)", message, time));
        this.time = time;
    }
}
