package projectapogee.domain.design;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import projectapogee.physics.model.TabulatedThrustProfile;

import java.util.List;

/**
 * Resultado de simular la combustión completa de un grano: serie temporal y magnitudes integradas.
 */
@Value
@Builder(toBuilder = true)
public class BallisticsResult {

    List<BallisticsSample> samples;

    /**
     * Instante en el que el web se agota [s].
     */
    double burnTime;
    double totalImpulse;
    double averageThrust;
    double averagePressure;
    double peakPressure;
    double propellantMassBurned;

    /**
     * Número de pasos de tiempo empleados.
     */
    int steps;

    @JsonIgnore
    public BallisticsSample getFinalSample() {
        return samples.get(samples.size() - 1);
    }

    /**
     * Convierte la serie en una curva de empuje que el integrador de vuelo puede consumir.
     */
    @JsonIgnore
    public TabulatedThrustProfile toThrustProfile() {
        int n = samples.size();
        double[] times = new double[n];
        double[] thrusts = new double[n];
        double[] flows = new double[n];
        double[] pressures = new double[n];
        for (int i = 0; i < n; i++) {
            BallisticsSample s = samples.get(i);
            times[i] = s.time();
            thrusts[i] = s.thrust();
            flows[i] = s.massFlow();
            pressures[i] = s.chamberPressure();
        }
        return new TabulatedThrustProfile(times, thrusts, flows, pressures);
    }
}
