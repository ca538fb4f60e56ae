package projectapogee.domain.flight;

import projectapogee.domain.rocket.RocketSpec;

/**
 * Vector de estado del integrador en un instante: altitud sobre la plataforma,
 * velocidad vertical y masa instantánea.
 *
 * @param time     Tiempo desde el encendido [s].
 * @param altitude Altitud sobre la plataforma de lanzamiento [m].
 * @param velocity Velocidad vertical, positiva hacia arriba [m/s].
 * @param mass     Masa instantánea [kg].
 */
public record FlightState(double time, double altitude, double velocity, double mass) {

    /**
     * Condición inicial obligatoria: en tierra, en reposo, con todo el propelente.
     */
    public static FlightState onPad(RocketSpec rocket) {
        return new FlightState(0.0, 0.0, 0.0, rocket.liftoffMass());
    }

    public double[] toArray() {
        return new double[]{altitude, velocity, mass};
    }
}
