package projectapogee.domain.design;

import lombok.Builder;
import lombok.Value;
import projectapogee.domain.flight.TrajectoryResult;

/**
 * Empuje medio convergido por la búsqueda en horquilla y la trayectoria aceptada.
 */
@Value
@Builder
public class ThrustSearchResult {

    double thrust;
    double apogee;
    double targetAltitude;

    /**
     * Horquilla final [N].
     */
    double lowerThrust;
    double upperThrust;

    int iterations;
    TrajectoryResult trajectory;

    public double getApogeeError() {
        return apogee - targetAltitude;
    }
}
