package projectapogee.domain.exception;

import lombok.Getter;

/**
 * Se agotó el presupuesto de iteraciones sin cumplir la tolerancia.
 * Adjunta el mejor candidato encontrado y su residuo para que el llamador decida.
 */
@Getter
public class NonConvergenceException extends DesignException {

    /**
     * Mejor valor de la variable de búsqueda (empuje [N], diámetro de núcleo [m]...).
     */
    private final double bestCandidate;

    /**
     * Residuo asociado al mejor candidato, en las unidades del objetivo.
     */
    private final double bestResidual;

    private final int iterations;

    public NonConvergenceException(String message, double bestCandidate, double bestResidual, int iterations) {
        super(String.format("%s (mejor candidato=%.6g, residuo=%.6g, iteraciones=%d)",
                message, bestCandidate, bestResidual, iterations));
        this.bestCandidate = bestCandidate;
        this.bestResidual = bestResidual;
        this.iterations = iterations;
    }
}
