package projectapogee.physics.impl;

import lombok.extern.slf4j.Slf4j;
import projectapogee.config.FlightMode;
import projectapogee.config.IntegratorConfig;
import projectapogee.config.IterationLimits;
import projectapogee.config.ToleranceConfig;
import projectapogee.domain.exception.IntegrationFailureException;
import projectapogee.domain.flight.AtmosphereProperties;
import projectapogee.domain.flight.FlightSample;
import projectapogee.domain.flight.FlightState;
import projectapogee.domain.flight.TrajectoryResult;
import projectapogee.domain.rocket.RocketSpec;
import projectapogee.physics.i.IFlightIntegrator;
import projectapogee.physics.model.AtmosphereModel;
import projectapogee.physics.model.DragModel;
import projectapogee.physics.model.IsaAtmosphereModel;
import projectapogee.physics.model.ThrustProfile;
import projectapogee.physics.solver.ScalarRootFinder;

import java.util.ArrayList;
import java.util.List;

/**
 * Integrador Runge-Kutta embebido de Dormand-Prince 5(4) para el vuelo vertical.
 * <p>
 * Estado: {@code (altitud, velocidad, masa)}. Ecuaciones:
 * <pre>
 *   dh/dt = v
 *   dv/dt = (T - D - m·g0) / m,   D = ½·ρ(h)·v·|v|·Cd(M)·A
 *   dm/dt = -ṁ                     (0 tras el apagado)
 * </pre>
 * Responsabilidades:
 * 1. Control de error local con tolerancia absoluta + relativa (norma RMS escalada).
 * 2. El apagado del motor es un punto de ruptura: ningún paso lo atraviesa.
 * 3. Detección del apogeo (v cruza de + a -) y del impacto (h cruza 0) dentro del paso,
 *    mediante interpolación de Hermite cúbica.
 * <p>
 * No guarda estado entre llamadas: cada {@link #integrate} crea su propio estado de vuelo,
 * por lo que el optimizador puede invocarlo repetidamente sin interferencias.
 */
@Slf4j
public class DormandPrinceFlightIntegrator implements IFlightIntegrator {

    private static final double G0 = IsaAtmosphereModel.STANDARD_GRAVITY;

    // --- Tablero de Butcher de Dormand-Prince ---
    private static final double C2 = 1.0 / 5.0, C3 = 3.0 / 10.0, C4 = 4.0 / 5.0, C5 = 8.0 / 9.0;
    private static final double A21 = 1.0 / 5.0;
    private static final double A31 = 3.0 / 40.0, A32 = 9.0 / 40.0;
    private static final double A41 = 44.0 / 45.0, A42 = -56.0 / 15.0, A43 = 32.0 / 9.0;
    private static final double A51 = 19372.0 / 6561.0, A52 = -25360.0 / 2187.0, A53 = 64448.0 / 6561.0, A54 = -212.0 / 729.0;
    private static final double A61 = 9017.0 / 3168.0, A62 = -355.0 / 33.0, A63 = 46732.0 / 5247.0, A64 = 49.0 / 176.0, A65 = -5103.0 / 18656.0;
    // Pesos de la solución de orden 5 (coinciden con la última fila: FSAL)
    private static final double B1 = 35.0 / 384.0, B3 = 500.0 / 1113.0, B4 = 125.0 / 192.0, B5 = -2187.0 / 6784.0, B6 = 11.0 / 84.0;
    // Diferencia entre las soluciones de orden 5 y 4
    private static final double E1 = 71.0 / 57600.0, E3 = -71.0 / 16695.0, E4 = 71.0 / 1920.0,
            E5 = -17253.0 / 339200.0, E6 = 22.0 / 525.0, E7 = -1.0 / 40.0;

    // --- Control de paso ---
    private static final double SAFETY = 0.9;
    private static final double MIN_FACTOR = 0.2;
    private static final double MAX_FACTOR = 5.0;
    // Un rechazo al menos divide el paso a la mitad
    private static final double MAX_FACTOR_ON_REJECT = 0.5;

    private static final double TIME_EPSILON = 1e-12;
    private static final int EVENT_MAX_ITERATIONS = 200;
    private static final double EVENT_TOLERANCE = 1e-12;

    private final AtmosphereModel atmosphere;

    public DormandPrinceFlightIntegrator() {
        this(new IsaAtmosphereModel());
    }

    public DormandPrinceFlightIntegrator(AtmosphereModel atmosphere) {
        this.atmosphere = atmosphere;
    }

    @Override
    public String getName() {
        return "Dormand-Prince 5(4)";
    }

    @Override
    public String getDescription() {
        return "RK embebido 5(4) con FSAL, control de error abs+rel y eventos de apogeo/impacto por Hermite cúbico";
    }

    @Override
    public TrajectoryResult integrate(RocketSpec rocket, ThrustProfile thrust, IntegratorConfig config,
                                      ToleranceConfig tolerance, IterationLimits limits) {
        FlightDynamics dynamics = new FlightDynamics(rocket, thrust, atmosphere);
        TrajectoryRecorder recorder = new TrajectoryRecorder(config.sampleInterval(), dynamics);

        final double atol = tolerance.integratorAbsoluteTolerance();
        final double rtol = tolerance.integratorRelativeTolerance();
        final boolean fullFlight = config.flightMode() == FlightMode.FULL_FLIGHT;

        FlightState initial = FlightState.onPad(rocket);
        double t = initial.time();
        double[] y = initial.toArray();
        boolean liftedOff = false;
        Phase phase = dynamics.phaseAt(t, y, false);
        double[] k1 = dynamics.derivatives(t, y, phase);
        recorder.start(t, y, phase);

        double step = config.initialStep();
        double burnoutTime = phase.powered() ? Double.NaN : 0.0;
        double apogeeAltitude = 0.0;
        double apogeeTime = Double.NaN;
        double landingTime = Double.NaN;
        double maxVelocity = 0.0;
        double maxAcceleration = Math.max(0.0, k1[1]);
        int accepted = 0;
        int rejected = 0;
        int consecutiveRejections = 0;

        while (true) {
            if (t >= config.maxTime() - TIME_EPSILON) {
                if (!Double.isNaN(apogeeTime) && fullFlight) {
                    log.warn("Tiempo máximo ({} s) alcanzado antes del impacto; se devuelve la trayectoria parcial.", config.maxTime());
                    break;
                }
                throw new IntegrationFailureException("Tiempo máximo de simulación alcanzado sin llegar al apogeo", t);
            }

            double h = Math.min(step, config.maxStep());
            boolean toBurnout = false;
            if (phase.powered() && t + h >= dynamics.burnTime) {
                h = dynamics.burnTime - t;
                toBurnout = true;
            }
            if (t + h > config.maxTime()) {
                h = config.maxTime() - t;
                toBurnout = false;
            }

            StepAttempt attempt = attemptStep(dynamics, t, y, k1, h, phase);
            double err = errorNorm(y, attempt.y, attempt.error, atol, rtol);

            if (!Double.isFinite(err) || err > 1.0) {
                rejected++;
                consecutiveRejections++;
                if (consecutiveRejections > limits.integratorMaxStepRejections()) {
                    throw new IntegrationFailureException(String.format(
                            "No se cumple la tolerancia tras %d rechazos consecutivos (error=%.3g)", consecutiveRejections, err), t);
                }
                double factor = Double.isFinite(err)
                        ? Math.max(MIN_FACTOR, Math.min(MAX_FACTOR_ON_REJECT, SAFETY * Math.pow(err, -0.2)))
                        : MAX_FACTOR_ON_REJECT;
                step = h * factor;
                if (step < config.minStep()) {
                    throw new IntegrationFailureException(String.format(
                            "El paso adaptativo (%.3g s) cae por debajo del mínimo (%.3g s)", step, config.minStep()), t);
                }
                continue;
            }

            // --- Paso aceptado ---
            accepted++;
            consecutiveRejections = 0;
            double tNew = toBurnout ? dynamics.burnTime : t + h;
            double[] yNew = attempt.y;
            if (yNew[2] <= 0 || !Double.isFinite(yNew[0]) || !Double.isFinite(yNew[1]) || !Double.isFinite(yNew[2])) {
                throw new IntegrationFailureException(String.format(
                        "Estado no físico: h=%.4g m, v=%.4g m/s, m=%.4g kg", yNew[0], yNew[1], yNew[2]), tNew);
            }
            boolean massClamped = false;
            if (yNew[2] < dynamics.dryMass) {
                // El propelente agotado no puede dejar la masa por debajo de la masa en seco
                yNew[2] = dynamics.dryMass;
                massClamped = true;
            }

            StepData stepData = new StepData(t, y, k1, tNew, yNew, attempt.k7, phase);
            maxVelocity = Math.max(maxVelocity, yNew[1]);
            maxAcceleration = Math.max(maxAcceleration, attempt.k7[1]);

            boolean stop = false;

            // Apogeo: la velocidad cruza de positiva a no positiva
            if (liftedOff && Double.isNaN(apogeeTime) && y[1] > 0 && yNew[1] <= 0) {
                double theta = stepData.velocityRoot();
                apogeeTime = stepData.timeAt(theta);
                double[] apogeeState = stepData.stateAt(theta);
                apogeeAltitude = apogeeState[0];
                recorder.emitUpTo(stepData, apogeeTime);
                recorder.emitEvent(apogeeTime, apogeeState, phase);
                log.trace("Apogeo {} m en t={} s", apogeeAltitude, apogeeTime);
                if (!fullFlight) {
                    stop = true;
                }
            }

            // Impacto con el suelo (sólo en vuelo completo y tras el apogeo)
            if (!stop && fullFlight && !Double.isNaN(apogeeTime) && yNew[0] < 0) {
                double theta = stepData.altitudeRoot();
                landingTime = stepData.timeAt(theta);
                double[] landingState = stepData.stateAt(theta);
                landingState[0] = 0.0;
                recorder.emitUpTo(stepData, landingTime);
                recorder.emitEvent(landingTime, landingState, phase);
                stop = true;
            }

            if (!stop) {
                recorder.emitUpTo(stepData, tNew);
            }

            t = tNew;
            y = yNew;
            if (!liftedOff && y[1] > 0) {
                liftedOff = true;
                log.trace("Despegue en t={} s", t);
            }

            Phase next = dynamics.phaseAt(t, y, liftedOff);
            if (phase.powered() && !next.powered()) {
                burnoutTime = t;
                if (!stop) {
                    recorder.emitEvent(t, y, phase);
                }
            }

            if (stop) {
                break;
            }

            if (!liftedOff && !next.powered()) {
                // El empuje nunca superó al peso: el cohete no despega
                log.debug("El cohete no despega: empuje insuficiente durante toda la combustión.");
                apogeeAltitude = 0.0;
                apogeeTime = t;
                if (fullFlight) {
                    landingTime = t;
                }
                break;
            }

            k1 = (next.equals(phase) && !massClamped) ? attempt.k7 : dynamics.derivatives(t, y, next);
            phase = next;

            double growth = err == 0.0 ? MAX_FACTOR : Math.min(MAX_FACTOR, Math.max(MIN_FACTOR, SAFETY * Math.pow(err, -0.2)));
            step = Math.max(config.minStep(), h * growth);
        }

        return TrajectoryResult.builder()
                .samples(List.copyOf(recorder.samples))
                .apogeeAltitude(apogeeAltitude)
                .apogeeTime(apogeeTime)
                .burnoutTime(Double.isNaN(burnoutTime) ? t : burnoutTime)
                .maxVelocity(maxVelocity)
                .maxAcceleration(maxAcceleration)
                .landingTime(landingTime)
                .acceptedSteps(accepted)
                .rejectedSteps(rejected)
                .build();
    }

    /**
     * Un paso de Dormand-Prince desde {@code (t, y)} con tamaño {@code h}.
     * Todas las etapas se evalúan con la misma fase (propulsada / en rampa).
     */
    private static StepAttempt attemptStep(FlightDynamics dyn, double t, double[] y, double[] k1, double h, Phase phase) {
        int n = y.length;
        double[] tmp = new double[n];

        for (int i = 0; i < n; i++) tmp[i] = y[i] + h * A21 * k1[i];
        double[] k2 = dyn.derivatives(t + C2 * h, tmp, phase);

        for (int i = 0; i < n; i++) tmp[i] = y[i] + h * (A31 * k1[i] + A32 * k2[i]);
        double[] k3 = dyn.derivatives(t + C3 * h, tmp, phase);

        for (int i = 0; i < n; i++) tmp[i] = y[i] + h * (A41 * k1[i] + A42 * k2[i] + A43 * k3[i]);
        double[] k4 = dyn.derivatives(t + C4 * h, tmp, phase);

        for (int i = 0; i < n; i++) tmp[i] = y[i] + h * (A51 * k1[i] + A52 * k2[i] + A53 * k3[i] + A54 * k4[i]);
        double[] k5 = dyn.derivatives(t + C5 * h, tmp, phase);

        for (int i = 0; i < n; i++) tmp[i] = y[i] + h * (A61 * k1[i] + A62 * k2[i] + A63 * k3[i] + A64 * k4[i] + A65 * k5[i]);
        double[] k6 = dyn.derivatives(t + h, tmp, phase);

        double[] yNew = new double[n];
        for (int i = 0; i < n; i++) {
            yNew[i] = y[i] + h * (B1 * k1[i] + B3 * k3[i] + B4 * k4[i] + B5 * k5[i] + B6 * k6[i]);
        }
        double[] k7 = dyn.derivatives(t + h, yNew, phase);

        double[] error = new double[n];
        for (int i = 0; i < n; i++) {
            error[i] = h * (E1 * k1[i] + E3 * k3[i] + E4 * k4[i] + E5 * k5[i] + E6 * k6[i] + E7 * k7[i]);
        }
        return new StepAttempt(yNew, k7, error);
    }

    /**
     * Norma RMS del error local escalado por {@code atol + rtol·max(|y|, |yNew|)}.
     * Un valor &lt;= 1 significa que el paso cumple la tolerancia.
     */
    private static double errorNorm(double[] y, double[] yNew, double[] error, double atol, double rtol) {
        double sum = 0.0;
        for (int i = 0; i < y.length; i++) {
            double scale = atol + rtol * Math.max(Math.abs(y[i]), Math.abs(yNew[i]));
            double ratio = error[i] / scale;
            sum += ratio * ratio;
        }
        return Math.sqrt(sum / y.length);
    }

    private record StepAttempt(double[] y, double[] k7, double[] error) {
    }

    /**
     * Fase constante durante un paso completo.
     *
     * @param powered el motor empuja y consume propelente.
     * @param onPad   el cohete aún no ha despegado: la rampa impide aceleraciones negativas.
     */
    private record Phase(boolean powered, boolean onPad) {
    }

    /**
     * Ecuaciones del movimiento de una ejecución concreta.
     */
    private static final class FlightDynamics {

        private final double dryMass;
        private final double referenceArea;
        private final double launchAltitude;
        private final double burnTime;
        private final ThrustProfile profile;
        private final DragModel dragModel;
        private final AtmosphereModel atmosphere;

        FlightDynamics(RocketSpec rocket, ThrustProfile profile, AtmosphereModel atmosphere) {
            this.dryMass = rocket.dryMass();
            this.referenceArea = rocket.referenceArea();
            this.launchAltitude = rocket.launchAltitude();
            this.burnTime = profile.burnTime();
            this.profile = profile;
            this.dragModel = rocket.dragModel();
            this.atmosphere = atmosphere;
        }

        Phase phaseAt(double t, double[] y, boolean liftedOff) {
            boolean powered = burnTime - t > TIME_EPSILON && y[2] > dryMass;
            return new Phase(powered, !liftedOff);
        }

        double[] derivatives(double t, double[] y, Phase phase) {
            Forces f = forces(t, y, phase);
            return new double[]{y[1], f.acceleration, -f.massFlow};
        }

        Forces forces(double t, double[] y, Phase phase) {
            double altitude = y[0];
            double velocity = y[1];
            double mass = y[2];

            // Propelente agotado: empuje y gasto forzados a cero
            boolean burning = phase.powered() && mass > dryMass;
            double tEval = Math.min(t, burnTime);
            double thrust = burning ? profile.thrustAt(tEval) : 0.0;
            double massFlow = burning ? profile.massFlowAt(tEval) : 0.0;
            double chamberPressure = burning ? profile.chamberPressureAt(tEval) : 0.0;

            AtmosphereProperties air = atmosphere.properties(launchAltitude + Math.max(0.0, altitude));
            double mach = Math.abs(velocity) / air.speedOfSound();
            double cd = dragModel.dragCoefficient(mach);
            // v·|v| conserva el signo: el arrastre siempre se opone al movimiento
            double drag = 0.5 * air.density() * velocity * Math.abs(velocity) * cd * referenceArea;

            double acceleration = (thrust - drag - mass * G0) / mass;
            if (phase.onPad() && acceleration < 0) {
                acceleration = 0.0;
            }
            return new Forces(thrust, drag, acceleration, massFlow, chamberPressure, mach);
        }

        FlightSample sample(double t, double[] y, Phase phase) {
            Forces f = forces(t, y, phase);
            return new FlightSample(t, y[0], y[1], f.acceleration, y[2], f.thrust, f.drag, f.chamberPressure, f.mach);
        }
    }

    private record Forces(double thrust, double drag, double acceleration, double massFlow,
                          double chamberPressure, double mach) {
    }

    /**
     * Datos de un paso aceptado con interpolación de Hermite cúbica.
     * Altitud: nodos (h, v); velocidad: nodos (v, a); masa: lineal.
     */
    private record StepData(double t0, double[] y0, double[] k0, double t1, double[] y1, double[] k1, Phase phase) {

        double duration() {
            return t1 - t0;
        }

        double timeAt(double theta) {
            return t0 + theta * duration();
        }

        double thetaAt(double time) {
            return (time - t0) / duration();
        }

        double altitudeAt(double theta) {
            return hermite(theta, y0[0], k0[0], y1[0], k1[0]);
        }

        double velocityAt(double theta) {
            return hermite(theta, y0[1], k0[1], y1[1], k1[1]);
        }

        double[] stateAt(double theta) {
            return new double[]{altitudeAt(theta), velocityAt(theta), y0[2] + theta * (y1[2] - y0[2])};
        }

        double velocityRoot() {
            if (velocityAt(1.0) > 0) {
                // El interpolante no cambia de signo (paso muy grande): nos quedamos con el final
                return 1.0;
            }
            return ScalarRootFinder.bisect(this::velocityAt, 0.0, 1.0, EVENT_TOLERANCE, EVENT_MAX_ITERATIONS).root();
        }

        double altitudeRoot() {
            if (altitudeAt(0.0) < 0) {
                return 0.0;
            }
            return ScalarRootFinder.bisect(this::altitudeAt, 0.0, 1.0, EVENT_TOLERANCE, EVENT_MAX_ITERATIONS).root();
        }

        private double hermite(double theta, double p0, double d0, double p1, double d1) {
            double dt = duration();
            double t2 = theta * theta;
            double t3 = t2 * theta;
            double h00 = 2 * t3 - 3 * t2 + 1;
            double h10 = t3 - 2 * t2 + theta;
            double h01 = -2 * t3 + 3 * t2;
            double h11 = t3 - t2;
            return h00 * p0 + h10 * dt * d0 + h01 * p1 + h11 * dt * d1;
        }
    }

    /**
     * Acumula las muestras de salida: remuestreo a intervalo fijo más los eventos exactos.
     */
    private static final class TrajectoryRecorder {

        private final List<FlightSample> samples = new ArrayList<>();
        private final double interval;
        private final FlightDynamics dynamics;
        private long nextIndex = 1;

        TrajectoryRecorder(double interval, FlightDynamics dynamics) {
            this.interval = interval;
            this.dynamics = dynamics;
        }

        void start(double t, double[] y, Phase phase) {
            samples.add(dynamics.sample(t, y, phase));
        }

        /**
         * Emite las muestras del paso hasta {@code limit} (incluido).
         */
        void emitUpTo(StepData step, double limit) {
            if (interval <= 0) {
                if (limit >= step.t1() - TIME_EPSILON) {
                    add(dynamics.sample(step.t1(), step.y1(), step.phase()));
                }
                return;
            }
            double next = nextIndex * interval;
            while (next <= limit + TIME_EPSILON) {
                add(dynamics.sample(next, step.stateAt(step.thetaAt(next)), step.phase()));
                nextIndex++;
                next = nextIndex * interval;
            }
        }

        void emitEvent(double t, double[] y, Phase phase) {
            add(dynamics.sample(t, y, phase));
        }

        private void add(FlightSample sample) {
            FlightSample last = samples.get(samples.size() - 1);
            if (sample.time() <= last.time() + TIME_EPSILON) {
                // Mismo instante: el evento exacto sustituye a la muestra remuestreada
                samples.set(samples.size() - 1, sample);
            } else {
                samples.add(sample);
            }
        }
    }
}
