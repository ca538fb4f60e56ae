package projectapogee.domain.exception;

/**
 * Raíz de la taxonomía de fallos del motor de diseño.
 * <p>
 * Cada subclase representa un resultado distinto e inspeccionable por el llamador
 * (capa de presentación). Ninguna se degrada a un valor por defecto.
 */
public abstract class DesignException extends RuntimeException {

    protected DesignException(String message) {
        super(message);
    }

    protected DesignException(String message, Throwable cause) {
        super(message, cause);
    }
}
