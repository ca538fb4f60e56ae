package projectapogee.physics.i;

import projectapogee.config.IntegratorConfig;
import projectapogee.config.IterationLimits;
import projectapogee.config.ToleranceConfig;
import projectapogee.domain.flight.TrajectoryResult;
import projectapogee.domain.rocket.RocketSpec;
import projectapogee.physics.model.ThrustProfile;

/**
 * Integrador de las ecuaciones del movimiento vertical del cohete.
 * <p>
 * Las implementaciones no deben guardar estado entre llamadas: el optimizador las invoca
 * repetidamente (y potencialmente en paralelo) con distintos empujes.
 */
public interface IFlightIntegrator extends ISolverComponent {

    /**
     * Integra la trayectoria desde la plataforma (altitud 0, velocidad 0, masa de despegue).
     *
     * @param rocket    Fuselaje.
     * @param thrust    Curva de empuje y gasto.
     * @param config    Pasos, tiempo máximo, remuestreo y fases de vuelo.
     * @param tolerance Tolerancias absoluta y relativa del control de error.
     * @param limits    Tope de rechazos consecutivos de paso.
     * @return La trayectoria completa.
     * @throws projectapogee.domain.exception.IntegrationFailureException si no se puede cumplir la tolerancia
     *                                                                    o la masa se vuelve no positiva.
     */
    TrajectoryResult integrate(RocketSpec rocket, ThrustProfile thrust, IntegratorConfig config,
                               ToleranceConfig tolerance, IterationLimits limits);
}
