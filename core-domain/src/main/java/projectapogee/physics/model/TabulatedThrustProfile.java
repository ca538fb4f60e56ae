package projectapogee.physics.model;

/**
 * Curva de empuje tabulada (típicamente la salida del solver de balística interna),
 * interpolada linealmente entre muestras.
 */
public class TabulatedThrustProfile implements ThrustProfile {

    private final double[] times;
    private final double[] thrusts;
    private final double[] massFlows;
    private final double[] pressures;

    /**
     * @param times     Instantes estrictamente crecientes [s]; el último es el apagado.
     * @param thrusts   Empuje en cada instante [N].
     * @param massFlows Gasto másico en cada instante [kg/s].
     * @param pressures Presión de cámara en cada instante [Pa].
     */
    public TabulatedThrustProfile(double[] times, double[] thrusts, double[] massFlows, double[] pressures) {
        int n = times.length;
        if (n < 2) {
            throw new IllegalArgumentException("Se necesitan al menos dos muestras para una curva de empuje.");
        }
        if (thrusts.length != n || massFlows.length != n || pressures.length != n) {
            throw new IllegalArgumentException("Todas las series de la curva de empuje deben tener la misma longitud.");
        }
        for (int i = 1; i < n; i++) {
            if (!(times[i] > times[i - 1])) {
                throw new IllegalArgumentException("Los instantes deben ser estrictamente crecientes (índice " + i + ").");
            }
        }
        this.times = times.clone();
        this.thrusts = thrusts.clone();
        this.massFlows = massFlows.clone();
        this.pressures = pressures.clone();
    }

    @Override
    public double thrustAt(double time) {
        return interpolate(thrusts, time);
    }

    @Override
    public double massFlowAt(double time) {
        return interpolate(massFlows, time);
    }

    @Override
    public double chamberPressureAt(double time) {
        return interpolate(pressures, time);
    }

    @Override
    public double burnTime() {
        return times[times.length - 1];
    }

    /**
     * Impulso total por integración trapezoidal [N·s].
     */
    public double totalImpulse() {
        return trapezoid(thrusts);
    }

    /**
     * Masa de propelente consumida por integración trapezoidal del gasto [kg].
     */
    public double consumedMass() {
        return trapezoid(massFlows);
    }

    private double trapezoid(double[] values) {
        double sum = 0.0;
        for (int i = 1; i < times.length; i++) {
            sum += 0.5 * (values[i] + values[i - 1]) * (times[i] - times[i - 1]);
        }
        return sum;
    }

    private double interpolate(double[] values, double time) {
        if (time < times[0] || time > burnTime()) {
            return 0.0;
        }
        // Búsqueda binaria del intervalo [i, i+1] que contiene a time
        int lo = 0;
        int hi = times.length - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (times[mid] <= time) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        double w = (time - times[lo]) / (times[hi] - times[lo]);
        return values[lo] + w * (values[hi] - values[lo]);
    }
}
