package projectapogee.domain.design;

import lombok.Builder;
import lombok.Value;
import projectapogee.domain.flight.TrajectoryResult;
import projectapogee.domain.motor.MotorSpec;
import projectapogee.domain.motor.NozzleDesign;
import projectapogee.domain.rocket.RocketSpec;

/**
 * Diseño convergido completo. Es el único objeto que se expone a la capa de presentación;
 * se crea una vez al converger el optimizador y es de sólo lectura a partir de entonces.
 */
@Value
@Builder
public class DesignResult {

    double targetAltitude;

    RocketSpec rocket;
    MotorSpec motor;
    GrainDesign grain;
    NozzleDesign nozzle;

    /**
     * Trayectoria aceptada con empuje medio constante.
     */
    TrajectoryResult trajectory;

    /**
     * Trayectoria de verificación con la curva de empuje de la balística interna (puede ser nula).
     */
    TrajectoryResult ballisticTrajectory;

    // --- Prestaciones ---
    double averageThrust;
    double totalImpulse;
    double designMassFlow;
    double requiredSpecificImpulse;
    double theoreticalSpecificImpulse;
    double deliveredTotalImpulse;

    int optimizerIterations;

    public double getApogeeError() {
        return trajectory.getApogeeAltitude() - targetAltitude;
    }
}
