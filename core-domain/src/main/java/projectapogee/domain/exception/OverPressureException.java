package projectapogee.domain.exception;

import lombok.Getter;

/**
 * La presión de cámara resuelta supera la presión máxima de operación esperada (MEOP),
 * o la raíz del balance de masa no existe dentro del rango físico.
 */
@Getter
public class OverPressureException extends DesignException {

    /**
     * Presión que provocó el fallo [Pa]. Si {@link #aboveBracket} es cierto es sólo una cota inferior.
     */
    private final double pressure;

    /**
     * Techo de presión configurado [Pa].
     */
    private final double ceiling;

    /**
     * La raíz del balance de masa queda por encima de la horquilla de búsqueda y no se resolvió.
     */
    private final boolean aboveBracket;

    public OverPressureException(String message, double pressure, double ceiling) {
        this(message, pressure, ceiling, false);
    }

    private OverPressureException(String message, double pressure, double ceiling, boolean aboveBracket) {
        super(String.format(aboveBracket ? "%s (Pc > %.4g Pa, límite=%.4g Pa)" : "%s (Pc=%.4g Pa, límite=%.4g Pa)",
                message, pressure, ceiling));
        this.pressure = pressure;
        this.ceiling = ceiling;
        this.aboveBracket = aboveBracket;
    }

    /**
     * El balance de masa sigue generando más gas del que descarga en el extremo superior de la horquilla.
     *
     * @param bracketLimit Extremo superior de la horquilla [Pa]; la presión real es mayor.
     */
    public static OverPressureException aboveBracket(String message, double bracketLimit, double ceiling) {
        return new OverPressureException(message, bracketLimit, ceiling, true);
    }
}
