package projectapogee.physics.model;

/**
 * Curva de empuje del motor en función del tiempo desde el encendido.
 * <p>
 * El intervalo propulsado es cerrado, {@code [0, burnTime()]}. El integrador de vuelo trata
 * {@code burnTime()} como punto de ruptura obligatorio del paso, de modo que la discontinuidad
 * del apagado nunca cae dentro de un paso de Runge-Kutta.
 */
public interface ThrustProfile {

    /**
     * Empuje [N]. Cero fuera de {@code [0, burnTime()]}.
     */
    double thrustAt(double time);

    /**
     * Gasto másico de propelente consumido [kg/s]. Cero fuera de {@code [0, burnTime()]}.
     */
    double massFlowAt(double time);

    /**
     * Presión de cámara [Pa] (0 si el perfil no la conoce o el motor está apagado).
     */
    double chamberPressureAt(double time);

    /**
     * Instante de apagado [s].
     */
    double burnTime();
}
