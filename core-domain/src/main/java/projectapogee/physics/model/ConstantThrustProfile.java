package projectapogee.physics.model;

/**
 * Modelo simplificado de empuje medio constante, la variable de búsqueda del optimizador.
 * El propelente se consume a gasto constante {@code mp / tb}.
 *
 * @param thrust          Empuje medio [N].
 * @param burnTime        Duración de combustión [s].
 * @param propellantMass  Masa de propelente consumida durante la combustión [kg].
 * @param chamberPressure Presión de cámara nominal asociada, sólo informativa [Pa].
 */
public record ConstantThrustProfile(
        double thrust,
        double burnTime,
        double propellantMass,
        double chamberPressure
) implements ThrustProfile {

    public ConstantThrustProfile {
        if (!(burnTime > 0)) {
            throw new IllegalArgumentException("El tiempo de combustión debe ser positivo: " + burnTime);
        }
    }

    private boolean isBurning(double time) {
        return time >= 0 && time <= burnTime;
    }

    @Override
    public double thrustAt(double time) {
        return isBurning(time) ? thrust : 0.0;
    }

    @Override
    public double massFlowAt(double time) {
        return isBurning(time) ? propellantMass / burnTime : 0.0;
    }

    @Override
    public double chamberPressureAt(double time) {
        return isBurning(time) ? chamberPressure : 0.0;
    }
}
