package projectapogee.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projectapogee.config.DesignConfig;
import projectapogee.config.FlightMode;
import projectapogee.config.IntegratorConfig;
import projectapogee.config.ThrustSearchConfig;
import projectapogee.config.ToleranceConfig;
import projectapogee.domain.design.ThrustSearchResult;
import projectapogee.domain.exception.InfeasibleDesignException;
import projectapogee.domain.exception.NonConvergenceException;
import projectapogee.domain.flight.TrajectoryResult;
import projectapogee.domain.motor.MotorSpec;
import projectapogee.domain.rocket.RocketSpec;
import projectapogee.physics.i.IFlightIntegrator;
import projectapogee.physics.impl.DormandPrinceFlightIntegrator;
import projectapogee.physics.model.ConstantThrustProfile;

/**
 * Invierte el objetivo de apogeo: busca el empuje medio constante con el que el cohete alcanza
 * la altitud deseada.
 * <p>
 * Responsabilidades:
 * 1. Establecer una horquilla {@code [T_lo, T_hi]} con {@code apogeo(T_lo) < objetivo <= apogeo(T_hi)},
 *    re-expandiéndola un número acotado de veces.
 * 2. Bisección sobre el empuje, una integración completa por iteración.
 * 3. Comprobar en cada punto medio que el apogeo sigue siendo monótono en el empuje.
 * <p>
 * Durante la búsqueda sólo se integra el ascenso; si la configuración pide el vuelo completo,
 * la trayectoria aceptada se recalcula una vez al final.
 */
@Slf4j
public class ThrustOptimizer {

    @Getter
    private final IFlightIntegrator integrator;

    public ThrustOptimizer(IFlightIntegrator integrator) {
        this.integrator = integrator;
    }

    public ThrustOptimizer() {
        this(new DormandPrinceFlightIntegrator());
    }

    /**
     * Busca el empuje que alcanza {@code config.targetAltitude()}.
     *
     * @throws projectapogee.domain.exception.InvalidInputException si la configuración no es física (sin integrar nada).
     * @throws InfeasibleDesignException si no existe horquilla válida o la monotonía se rompe.
     * @throws NonConvergenceException   si se agotan las iteraciones o la horquilla colapsa.
     */
    public ThrustSearchResult optimize(DesignConfig config) {
        config.validate();

        final double target = config.targetAltitude();
        final ThrustSearchConfig search = config.thrustSearch();
        final ToleranceConfig tolerance = config.tolerance();
        final int maxExpansions = config.iterationLimits().maxBracketExpansions();
        final IntegratorConfig ascent = config.integrator().withFlightMode(FlightMode.ASCENT_ONLY);

        log.info("Buscando empuje para un apogeo de {} m con {} ({} - {} N)",
                target, integrator.getName(), search.minThrust(), search.initialMaxThrust());

        // --- 1. Horquilla ---
        double lo = search.minThrust();
        double hi = search.initialMaxThrust();
        Evaluation low = evaluate(lo, config, ascent);
        Evaluation high = evaluate(hi, config, ascent);
        int expansions = 0;

        while (low.apogee() >= target) {
            if (isConverged(low, target, tolerance)) {
                return accept(low, lo, hi, 0, config);
            }
            if (++expansions > maxExpansions) {
                throw new InfeasibleDesignException(String.format(
                        "Incluso %.4g N supera el objetivo de %.1f m (apogeo %.1f m)", lo, target, low.apogee()));
            }
            lo *= 0.5;
            low = evaluate(lo, config, ascent);
        }
        while (high.apogee() < target) {
            if (isConverged(high, target, tolerance)) {
                return accept(high, lo, hi, 0, config);
            }
            if (hi >= search.maxThrust() || ++expansions > maxExpansions) {
                throw new InfeasibleDesignException(String.format(
                        "El objetivo de %.1f m es inalcanzable: con %.4g N el apogeo es %.1f m", target, hi, high.apogee()));
            }
            hi = Math.min(2.0 * hi, search.maxThrust());
            high = evaluate(hi, config, ascent);
        }
        if (expansions > 0) {
            log.debug("Horquilla re-expandida {} veces: [{}, {}] N", expansions, lo, hi);
        }

        // --- 2. Bisección ---
        Evaluation best = Math.abs(low.error(target)) < Math.abs(high.error(target)) ? low : high;
        int maxIterations = config.iterationLimits().optimizerMaxIterations();
        for (int i = 1; i <= maxIterations; i++) {
            double mid = 0.5 * (lo + hi);
            if (!(mid > lo && mid < hi)) {
                throw new NonConvergenceException("La horquilla de empuje colapsó sin cumplir la tolerancia",
                        best.thrust(), best.error(target), i - 1);
            }
            Evaluation middle = evaluate(mid, config, ascent);
            log.debug("Iter {}: T={} N, apogeo={} m, error={} m", i, mid, middle.apogee(), middle.error(target));

            // Monotonía: apogeo(lo) <= apogeo(mid) <= apogeo(hi)
            if (middle.apogee() < low.apogee() || middle.apogee() > high.apogee()) {
                throw new InfeasibleDesignException(String.format(
                        "El apogeo no es monótono en el empuje: %.2f m (%.4g N), %.2f m (%.4g N), %.2f m (%.4g N)",
                        low.apogee(), lo, middle.apogee(), mid, high.apogee(), hi));
            }
            if (Math.abs(middle.error(target)) < Math.abs(best.error(target))) {
                best = middle;
            }
            if (isConverged(middle, target, tolerance)) {
                return accept(middle, lo, hi, i, config);
            }
            if (middle.apogee() < target) {
                lo = mid;
                low = middle;
            } else {
                hi = mid;
                high = middle;
            }
        }
        throw new NonConvergenceException("Se agotaron las iteraciones de la búsqueda de empuje",
                best.thrust(), best.error(target), maxIterations);
    }

    /**
     * Apogeo alcanzado con un empuje medio constante (sólo ascenso).
     */
    public double apogeeFor(double thrust, DesignConfig config) {
        return evaluate(thrust, config, config.integrator().withFlightMode(FlightMode.ASCENT_ONLY)).apogee();
    }

    /**
     * Perfil de empuje constante que el optimizador evalúa para un candidato.
     */
    public static ConstantThrustProfile profileFor(double thrust, RocketSpec rocket, MotorSpec motor) {
        return new ConstantThrustProfile(thrust, motor.burnTime(), rocket.propellantMass(), motor.designChamberPressure());
    }

    private Evaluation evaluate(double thrust, DesignConfig config, IntegratorConfig integratorConfig) {
        TrajectoryResult trajectory = integrator.integrate(config.rocket(), profileFor(thrust, config.rocket(), config.motor()),
                integratorConfig, config.tolerance(), config.iterationLimits());
        return new Evaluation(thrust, trajectory);
    }

    private static boolean isConverged(Evaluation evaluation, double target, ToleranceConfig tolerance) {
        double error = Math.abs(evaluation.error(target));
        return error < tolerance.altitudeAbsoluteTolerance() || error / target < tolerance.altitudeRelativeTolerance();
    }

    private ThrustSearchResult accept(Evaluation evaluation, double lo, double hi, int iterations, DesignConfig config) {
        TrajectoryResult trajectory = evaluation.trajectory();
        if (config.integrator().flightMode() == FlightMode.FULL_FLIGHT) {
            trajectory = evaluate(evaluation.thrust(), config, config.integrator()).trajectory();
        }
        log.info("Empuje convergido: {} N, apogeo {} m (error {} m) en {} iteraciones",
                evaluation.thrust(), evaluation.apogee(), evaluation.error(config.targetAltitude()), iterations);
        return ThrustSearchResult.builder()
                .thrust(evaluation.thrust())
                .apogee(evaluation.apogee())
                .targetAltitude(config.targetAltitude())
                .lowerThrust(lo)
                .upperThrust(hi)
                .iterations(iterations)
                .trajectory(trajectory)
                .build();
    }

    private record Evaluation(double thrust, TrajectoryResult trajectory) {

        double apogee() {
            return trajectory.getApogeeAltitude();
        }

        double error(double target) {
            return apogee() - target;
        }
    }
}
