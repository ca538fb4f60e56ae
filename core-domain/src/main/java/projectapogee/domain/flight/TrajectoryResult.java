package projectapogee.domain.flight;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Resultado inmutable de una ejecución del integrador de vuelo.
 * <p>
 * Contiene la secuencia ordenada de muestras y los eventos clave de la trayectoria.
 * Las altitudes se miden sobre la plataforma de lanzamiento.
 */
@Value
@Builder
public class TrajectoryResult {

    /**
     * Muestras en orden cronológico (incluye los instantes exactos de apagado, apogeo e impacto).
     */
    List<FlightSample> samples;

    double apogeeAltitude;
    double apogeeTime;
    double burnoutTime;
    double maxVelocity;
    double maxAcceleration;

    /**
     * Instante de impacto con el suelo [s], o {@code NaN} si sólo se integró el ascenso.
     */
    double landingTime;

    /**
     * Pasos aceptados y rechazados por el control de error adaptativo.
     */
    int acceptedSteps;
    int rejectedSteps;

    public int getSampleCount() {
        return samples.size();
    }

    public FlightSample getSampleAt(int index) {
        return samples.get(index);
    }

    @JsonIgnore
    public Optional<FlightSample> getFinalSample() {
        if (samples.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(samples.get(samples.size() - 1));
    }

    public boolean hasLanded() {
        return !Double.isNaN(landingTime);
    }
}
