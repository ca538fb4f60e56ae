package projectapogee.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import projectapogee.config.DesignConfig;
import projectapogee.config.GrainMode;
import projectapogee.domain.design.DesignResult;
import projectapogee.domain.design.GrainDesign;
import projectapogee.domain.design.ThrustSearchResult;
import projectapogee.domain.exception.InfeasibleDesignException;
import projectapogee.domain.flight.TrajectoryResult;
import projectapogee.domain.motor.NozzleDesign;
import projectapogee.factory.DesignResultFactory;
import projectapogee.physics.i.IFlightIntegrator;
import projectapogee.physics.i.IGrainSizer;
import projectapogee.physics.i.INozzleSolver;
import projectapogee.physics.impl.BatesGrainSizer;
import projectapogee.physics.impl.IsentropicNozzleSolver;
import projectapogee.physics.model.AtmosphereModel;
import projectapogee.physics.model.IsaAtmosphereModel;

/**
 * Orquesta el diseño inverso completo del motor.
 * Facade de alto nivel sobre {@link ThrustOptimizer}, {@link INozzleSolver} e {@link IGrainSizer}.
 * <p>
 * Flujo: validar, buscar el empuje, dimensionar la tobera, dimensionar (o evaluar) el grano y,
 * opcionalmente, volar con la curva de empuje de la balística interna para verificar el apogeo.
 * Cualquier fallo de un paso aborta el diseño y se propaga sin degradarse.
 * <p>
 * El empuje se busca con un perfil constante de {@code tb} objetivo, así que el grano sólo es
 * coherente con esa trayectoria si quema en ese tiempo y entrega el impulso {@code F·tb}
 * dentro de {@link projectapogee.config.ToleranceConfig#impulseRelativeTolerance()}.
 * Si no, el diseño es infactible.
 */
@Slf4j
public class MotorDesigner {

    private static final double G0 = IsaAtmosphereModel.STANDARD_GRAVITY;

    private final ThrustOptimizer optimizer;
    private final INozzleSolver nozzleSolver;
    private final IGrainSizer grainSizer;
    private final AtmosphereModel atmosphere;

    public MotorDesigner(ThrustOptimizer optimizer, INozzleSolver nozzleSolver,
                         IGrainSizer grainSizer, AtmosphereModel atmosphere) {
        this.optimizer = optimizer;
        this.nozzleSolver = nozzleSolver;
        this.grainSizer = grainSizer;
        this.atmosphere = atmosphere;
    }

    public MotorDesigner() {
        this(new ThrustOptimizer(), new IsentropicNozzleSolver(), new BatesGrainSizer(), new IsaAtmosphereModel());
    }

    /**
     * Ejecuta el diseño completo.
     *
     * @param config Entrada del diseño.
     * @return El diseño convergido.
     * @throws projectapogee.domain.exception.DesignException si cualquier paso falla.
     */
    public DesignResult design(DesignConfig config) {
        config.validate();
        log.info("Diseño iniciado: objetivo {} m, cohete {} kg en seco + {} kg de propelente, tb={} s",
                config.targetAltitude(), config.rocket().dryMass(), config.rocket().propellantMass(), config.motor().burnTime());

        // 1. Empuje medio
        ThrustSearchResult search = optimizer.optimize(config);

        // 2. Tobera a la presión ambiente de la plataforma
        double ambientPressure = atmosphere.pressureAt(config.rocket().launchAltitude());
        NozzleDesign nozzle = nozzleSolver.solve(search.getThrust(), config.motor(), ambientPressure);
        requireDeliverableSpecificImpulse(config, search.getThrust(), nozzle);

        // 3. Grano
        GrainDesign grain = config.grainMode() == GrainMode.FIXED
                ? grainSizer.evaluate(config.grain(), config, nozzle)
                : grainSizer.size(config, nozzle);
        requireConsistentGrain(config, search.getThrust(), grain);

        // 4. Vuelo de verificación con la curva de empuje real
        TrajectoryResult ballisticTrajectory = null;
        if (config.simulateBallisticFlight()) {
            IFlightIntegrator integrator = optimizer.getIntegrator();
            ballisticTrajectory = integrator.integrate(config.rocket(), grain.getBallistics().toThrustProfile(),
                    config.integrator(), config.tolerance(), config.iterationLimits());
            log.info("Vuelo con la curva balística: apogeo {} m (objetivo {} m)",
                    ballisticTrajectory.getApogeeAltitude(), config.targetAltitude());
        }

        DesignResult result = DesignResultFactory.create(config, search, nozzle, grain, ballisticTrajectory);
        log.info("Diseño completado: F={} N, garganta {} mm, salida {} mm, núcleo {} mm, Isp requerido {} s",
                result.getAverageThrust(), nozzle.throatDiameter() * 1e3, nozzle.exitDiameter() * 1e3,
                grain.getGeometry().coreDiameter() * 1e3, result.getRequiredSpecificImpulse());
        return result;
    }

    /**
     * El propelente debe poder dar el Isp que exige el empuje: {@code F·tb / (mp·g0) <= η·c*·C_F / g0},
     * con el margen de la tolerancia de impulso.
     */
    private static void requireDeliverableSpecificImpulse(DesignConfig config, double thrust, NozzleDesign nozzle) {
        double required = thrust * config.motor().burnTime() / (config.rocket().propellantMass() * G0);
        double deliverable = nozzle.efficiency() * config.motor().characteristicVelocity() * nozzle.thrustCoefficient() / G0;
        double tolerance = config.tolerance().impulseRelativeTolerance();
        if (required > deliverable * (1.0 + tolerance)) {
            throw new InfeasibleDesignException(String.format(
                    "%.1f N durante %.2f s exigen Isp=%.1f s pero %.3f kg de propelente sólo dan %.1f s (margen %.0f%%)",
                    thrust, config.motor().burnTime(), required, config.rocket().propellantMass(), deliverable, tolerance * 100));
        }
    }

    /**
     * El grano debe quemar en el tiempo objetivo y entregar el impulso de la trayectoria buscada.
     */
    private static void requireConsistentGrain(DesignConfig config, double thrust, GrainDesign grain) {
        double burnTime = grain.getBallistics().getBurnTime();
        if (grain.isPortRatioLimited()) {
            throw new InfeasibleDesignException(String.format(
                    "El núcleo mínimo por relación de puerto (%.2f mm) quema en %.3f s, no en los %.3f s con los que se buscó el empuje",
                    grain.getGeometry().coreDiameter() * 1e3, burnTime, config.motor().burnTime()));
        }
        double required = thrust * config.motor().burnTime();
        double delivered = grain.getBallistics().getTotalImpulse();
        double tolerance = config.tolerance().impulseRelativeTolerance();
        if (Math.abs(delivered - required) > tolerance * required) {
            throw new InfeasibleDesignException(String.format(
                    "El grano entrega %.1f N·s en %.3f s frente a %.1f N·s requeridos (tolerancia %.0f%%)",
                    delivered, burnTime, required, tolerance * 100));
        }
        if (Math.abs(delivered - required) > 0.5 * tolerance * required) {
            log.warn("El grano entrega {} N·s frente a {} N·s requeridos", delivered, required);
        }
    }
}
