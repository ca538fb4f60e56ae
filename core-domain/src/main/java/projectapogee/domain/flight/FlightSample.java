package projectapogee.domain.flight;

/**
 * Fila de la serie temporal de una trayectoria, pensada para la capa de presentación
 * (gráficas de altitud, velocidad, arrastre y presión de cámara).
 *
 * @param time            [s]
 * @param altitude        Altitud sobre la plataforma [m].
 * @param velocity        Velocidad vertical [m/s].
 * @param acceleration    Aceleración vertical [m/s²].
 * @param mass            Masa instantánea [kg].
 * @param thrust          Empuje [N].
 * @param drag            Arrastre con signo (positivo cuando se opone a una subida) [N].
 * @param chamberPressure Presión de cámara [Pa].
 * @param mach            Número de Mach.
 */
public record FlightSample(
        double time,
        double altitude,
        double velocity,
        double acceleration,
        double mass,
        double thrust,
        double drag,
        double chamberPressure,
        double mach
) {
}
