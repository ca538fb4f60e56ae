package projectapogee.domain.exception;

/**
 * Ningún candidato dentro del rango físicamente razonable alcanza el objetivo
 * (por ejemplo, no existe horquilla de empuje válida o la monotonía apogeo-empuje se rompe).
 */
public class InfeasibleDesignException extends DesignException {

    public InfeasibleDesignException(String message) {
        super(message);
    }
}
