package projectapogee.domain.exception;

/**
 * Una magnitud geométrica resuelta cae fuera de su dominio válido:
 * áreas no positivas o no finitas, Mach complejo, grano que no cabe en la cámara.
 */
public class InvalidGeometryException extends DesignException {

    public InvalidGeometryException(String message) {
        super(message);
    }
}
