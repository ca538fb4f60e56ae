package projectapogee.domain.exception;

/**
 * Parámetros de entrada no físicos (masas, áreas o constantes de combustión no positivas,
 * altitud objetivo no positiva...). Se lanza antes de iniciar cualquier integración.
 */
public class InvalidInputException extends DesignException {

    public InvalidInputException(String message) {
        super(message);
    }
}
