package projectapogee.factory;

import projectapogee.config.DesignConfig;
import projectapogee.domain.design.DesignResult;
import projectapogee.domain.design.GrainDesign;
import projectapogee.domain.design.ThrustSearchResult;
import projectapogee.domain.flight.TrajectoryResult;
import projectapogee.domain.motor.MotorSpec;
import projectapogee.domain.motor.NozzleDesign;
import projectapogee.domain.rocket.RocketSpec;
import projectapogee.physics.model.IsaAtmosphereModel;

/**
 * Fábrica centralizada del {@link DesignResult} final.
 * <p>
 * Reúne las piezas convergidas (empuje, tobera, grano, trayectorias) y calcula las
 * prestaciones derivadas: impulso total, gasto másico y los dos impulsos específicos.
 */
public class DesignResultFactory {

    private static final double G0 = IsaAtmosphereModel.STANDARD_GRAVITY;

    /**
     * Prohibido construir esta clase utilidad
     */
    private DesignResultFactory() {
    }

    /**
     * Crea el resultado de un diseño convergido.
     *
     * @param config              Configuración de entrada.
     * @param search              Empuje medio convergido y su trayectoria.
     * @param nozzle              Tobera dimensionada para ese empuje.
     * @param grain               Grano dimensionado (o evaluado) con su balística.
     * @param ballisticTrajectory Vuelo con la curva de empuje de la balística; puede ser nulo.
     */
    public static DesignResult create(DesignConfig config,
                                      ThrustSearchResult search,
                                      NozzleDesign nozzle,
                                      GrainDesign grain,
                                      TrajectoryResult ballisticTrajectory) {
        RocketSpec rocket = config.rocket();
        MotorSpec motor = config.motor();

        double thrust = search.getThrust();
        double massFlow = rocket.propellantMass() / motor.burnTime();

        return DesignResult.builder()
                .targetAltitude(config.targetAltitude())
                .rocket(rocket)
                .motor(motor)
                .grain(grain)
                .nozzle(nozzle)
                .trajectory(search.getTrajectory())
                .ballisticTrajectory(ballisticTrajectory)
                .averageThrust(thrust)
                .totalImpulse(thrust * motor.burnTime())
                .designMassFlow(massFlow)
                .requiredSpecificImpulse(thrust / (massFlow * G0))
                .theoreticalSpecificImpulse(motor.characteristicVelocity() * nozzle.thrustCoefficient() / G0)
                .deliveredTotalImpulse(grain.getBallistics().getTotalImpulse())
                .optimizerIterations(search.getIterations())
                .build();
    }
}
