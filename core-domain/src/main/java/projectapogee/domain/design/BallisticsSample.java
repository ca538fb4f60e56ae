package projectapogee.domain.design;

/**
 * Estado de la balística interna en un instante de la combustión.
 *
 * @param time            [s]
 * @param regression      Web quemado desde el encendido [m].
 * @param coreDiameter    Diámetro de núcleo [m].
 * @param segmentLength   Longitud de segmento [m].
 * @param burningArea     Área de combustión Ab [m²].
 * @param kn              Relación Ab/At.
 * @param chamberPressure Presión de cámara [Pa].
 * @param burnRate        Velocidad de regresión [m/s].
 * @param massFlow        Gasto másico por la garganta [kg/s].
 * @param thrust          Empuje [N].
 */
public record BallisticsSample(
        double time,
        double regression,
        double coreDiameter,
        double segmentLength,
        double burningArea,
        double kn,
        double chamberPressure,
        double burnRate,
        double massFlow,
        double thrust
) {
}
