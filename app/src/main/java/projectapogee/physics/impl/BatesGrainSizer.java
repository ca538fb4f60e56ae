package projectapogee.physics.impl;

import lombok.extern.slf4j.Slf4j;
import projectapogee.config.BallisticsConfig;
import projectapogee.config.DesignConfig;
import projectapogee.domain.design.BallisticsResult;
import projectapogee.domain.design.GrainDesign;
import projectapogee.domain.exception.InfeasibleDesignException;
import projectapogee.domain.exception.InvalidGeometryException;
import projectapogee.domain.exception.NonConvergenceException;
import projectapogee.domain.exception.OverPressureException;
import projectapogee.domain.motor.GrainGeometry;
import projectapogee.domain.motor.MotorSpec;
import projectapogee.domain.motor.NozzleDesign;
import projectapogee.physics.i.IBallisticsSolver;
import projectapogee.physics.i.IGrainSizer;

/**
 * Dimensionado inverso de un grano BATES.
 * <p>
 * Reglas:
 * 1. Diámetro exterior fijado por la cámara: {@code D = Dcámara - 2·liner}.
 * 2. Núcleo mínimo por la relación puerto/garganta (2.0, o 3.0 si L/D supera el umbral erosivo).
 * 3. Longitud de segmento deducida de la masa de propelente para cada núcleo candidato.
 * 4. Bisección sobre el diámetro de núcleo hasta que la combustión simulada dure el tiempo objetivo.
 * <p>
 * Un núcleo mayor deja menos web y más área, así que la combustión es más rápida: el tiempo de
 * combustión decrece con el diámetro de núcleo. Los candidatos con sobrepresión cuentan como
 * "demasiado rápidos" y los que no sostienen presión como "demasiado lentos".
 */
@Slf4j
public class BatesGrainSizer implements IGrainSizer {

    private final IBallisticsSolver ballisticsSolver;

    public BatesGrainSizer(IBallisticsSolver ballisticsSolver) {
        this.ballisticsSolver = ballisticsSolver;
    }

    public BatesGrainSizer() {
        this(new BatesBallisticsSolver());
    }

    @Override
    public String getName() {
        return String.format("BATES sizer[%s]", ballisticsSolver.getName());
    }

    @Override
    public GrainDesign size(DesignConfig config, NozzleDesign nozzle) {
        MotorSpec motor = config.motor();
        BallisticsConfig rules = config.ballistics();
        double propellantMass = config.rocket().propellantMass();
        double outer = motor.grainOuterDiameter();
        if (!(outer > 0)) {
            throw new InvalidGeometryException(String.format(
                    "El liner (%.4f m) no deja sitio al grano en una cámara de %.4f m", motor.linerThickness(), motor.chamberInnerDiameter()));
        }

        // --- 1. Núcleo mínimo por relación de puerto ---
        double portRatio = rules.minPortToThroatRatio();
        double minCore = coreForPortRatio(portRatio, nozzle.throatArea());
        boolean erosive = false;
        if (minCore < outer && geometryFor(minCore, motor, propellantMass).lengthToDiameter() > rules.erosiveLengthToDiameter()) {
            erosive = true;
            portRatio = rules.erosivePortToThroatRatio();
            minCore = coreForPortRatio(portRatio, nozzle.throatArea());
            log.warn("L/D > {}: riesgo de combustión erosiva, se exige puerto/garganta >= {}", rules.erosiveLengthToDiameter(), portRatio);
        }
        double maxCore = outer - 2.0 * rules.minWebThickness();
        if (minCore >= maxCore) {
            throw new InvalidGeometryException(String.format(
                    "La garganta (%.2f mm) exige un núcleo de %.2f mm que no cabe en un grano de %.2f mm",
                    nozzle.throatDiameter() * 1e3, minCore * 1e3, outer * 1e3));
        }

        // --- 2. Horquilla sobre el diámetro de núcleo ---
        double target = motor.burnTime();
        double tolerance = config.tolerance().burnTimeRelativeTolerance() * target;

        Candidate low = simulate(minCore, config, nozzle);
        if (low.converged(target, tolerance)) {
            return finish(low, config, nozzle, erosive, false, 0);
        }
        if (low.residual(target) < 0) {
            if (low.ballistics() == null) {
                log.warn("El núcleo mínimo admisible ({} mm) ya sobrepresuriza la cámara", minCore * 1e3);
                throw low.overPressure();
            }
            log.warn("La relación de puerto limita el diseño: tb={} s < {} s con el núcleo mínimo",
                    low.ballistics().getBurnTime(), target);
            return finish(low, config, nozzle, erosive, true, 0);
        }

        Candidate high = simulate(maxCore, config, nozzle);
        if (high.residual(target) > 0) {
            throw new InfeasibleDesignException(String.format(
                    "Ni con el web mínimo (núcleo %.2f mm) la combustión baja de %.3f s", maxCore * 1e3, target));
        }

        // --- 3. Bisección ---
        double lo = minCore;
        double hi = maxCore;
        Candidate best = low;
        int maxIterations = config.iterationLimits().grainSolverMaxIterations();
        for (int i = 1; i <= maxIterations; i++) {
            double mid = 0.5 * (lo + hi);
            Candidate candidate = simulate(mid, config, nozzle);
            log.debug("Grano iter {}: núcleo={} mm, residuo tb={} s", i, mid * 1e3, candidate.residual(target));
            if (candidate.ballistics() != null
                    && Math.abs(candidate.residual(target)) < Math.abs(best.residual(target))) {
                best = candidate;
            }
            if (candidate.converged(target, tolerance)) {
                return finish(candidate, config, nozzle, erosive, false, i);
            }
            if (candidate.residual(target) > 0) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        throw new NonConvergenceException("El dimensionado del núcleo no alcanza el tiempo de combustión objetivo",
                best.coreDiameter(), best.residual(target), maxIterations);
    }

    @Override
    public GrainDesign evaluate(GrainGeometry geometry, DesignConfig config, NozzleDesign nozzle) {
        geometry.validate();
        BallisticsResult ballistics = ballisticsSolver.simulate(geometry, nozzle, config.motor(),
                config.ballistics(), config.tolerance(), config.iterationLimits());

        BallisticsConfig rules = config.ballistics();
        double portRatio = geometry.portToThroatRatio(nozzle.throatArea());
        boolean erosive = geometry.lengthToDiameter() > rules.erosiveLengthToDiameter();
        if (portRatio < rules.minPortToThroatRatio() || (erosive && portRatio < rules.erosivePortToThroatRatio())) {
            log.warn("Relación puerto/garganta {} por debajo del mínimo recomendado (L/D={})", portRatio, geometry.lengthToDiameter());
        }
        double suppliedMass = geometry.propellantMass(config.motor().propellantDensity());
        double expectedMass = config.rocket().propellantMass();
        if (Math.abs(suppliedMass - expectedMass) > 0.01 * expectedMass) {
            log.warn("La masa del grano fijo ({} kg) no coincide con la masa de propelente del cohete ({} kg)",
                    suppliedMass, expectedMass);
        }
        return build(geometry, ballistics, config, nozzle, erosive, false, 0);
    }

    /**
     * Diámetro de núcleo cuyo área de puerto es {@code ratio} veces la garganta.
     */
    static double coreForPortRatio(double ratio, double throatArea) {
        return Math.sqrt(4.0 * ratio * throatArea / Math.PI);
    }

    /**
     * Geometría BATES con el núcleo dado y la longitud que contiene exactamente la masa de propelente.
     */
    static GrainGeometry geometryFor(double coreDiameter, MotorSpec motor, double propellantMass) {
        double outer = motor.grainOuterDiameter();
        double annulus = Math.PI / 4.0 * (outer * outer - coreDiameter * coreDiameter);
        double segmentLength = propellantMass / (motor.propellantDensity() * motor.segmentCount() * annulus);
        return GrainGeometry.builder()
                .coreDiameter(coreDiameter)
                .outerDiameter(outer)
                .segmentLength(segmentLength)
                .segmentCount(motor.segmentCount())
                .exposedEndFaces(motor.exposedEndFaces())
                .build();
    }

    private Candidate simulate(double coreDiameter, DesignConfig config, NozzleDesign nozzle) {
        GrainGeometry geometry = geometryFor(coreDiameter, config.motor(), config.rocket().propellantMass());
        try {
            BallisticsResult result = ballisticsSolver.simulate(geometry, nozzle, config.motor(),
                    config.ballistics(), config.tolerance(), config.iterationLimits());
            return new Candidate(coreDiameter, geometry, result, null, false);
        } catch (OverPressureException e) {
            log.debug("Núcleo {} mm sobrepresuriza ({}), se trata como combustión rápida", coreDiameter * 1e3, e.getMessage());
            return new Candidate(coreDiameter, geometry, null, e, false);
        } catch (InvalidGeometryException e) {
            log.debug("Núcleo {} mm no sostiene presión ({}), se trata como combustión lenta", coreDiameter * 1e3, e.getMessage());
            return new Candidate(coreDiameter, geometry, null, null, true);
        }
    }

    private GrainDesign finish(Candidate candidate, DesignConfig config, NozzleDesign nozzle,
                               boolean erosive, boolean portLimited, int iterations) {
        GrainDesign design = build(candidate.geometry(), candidate.ballistics(), config, nozzle, erosive, portLimited, iterations);
        log.info("Grano dimensionado: núcleo={} mm, segmento={} mm x{}, tb={} s, Pc pico={} MPa",
                candidate.geometry().coreDiameter() * 1e3, candidate.geometry().segmentLength() * 1e3,
                candidate.geometry().segmentCount(), candidate.ballistics().getBurnTime(),
                candidate.ballistics().getPeakPressure() / 1e6);
        return design;
    }

    private GrainDesign build(GrainGeometry geometry, BallisticsResult ballistics, DesignConfig config, NozzleDesign nozzle,
                              boolean erosive, boolean portLimited, int iterations) {
        MotorSpec motor = config.motor();
        double envelope = geometry.envelopeVolume();
        if (envelope > motor.chamberVolume()) {
            throw new InvalidGeometryException(String.format(
                    "El grano (%.1f cm³ de envolvente, %.1f mm de largo) no cabe en la cámara de %.1f cm³",
                    envelope * 1e6, geometry.totalLength() * 1e3, motor.chamberVolume() * 1e6));
        }
        double massFlow = config.rocket().propellantMass() / motor.burnTime();
        double burnRate = motor.burnRate(motor.designChamberPressure());
        return GrainDesign.builder()
                .geometry(geometry)
                .ballistics(ballistics)
                .portToThroatRatio(geometry.portToThroatRatio(nozzle.throatArea()))
                .lengthToDiameter(geometry.lengthToDiameter())
                .erosiveBurningRisk(erosive)
                .portRatioLimited(portLimited)
                .requiredBurningArea(massFlow / (motor.propellantDensity() * burnRate))
                .designBurnRate(burnRate)
                .designMassFlow(massFlow)
                .initialFreeVolume(motor.chamberVolume() - geometry.propellantVolume())
                .iterations(iterations)
                .build();
    }

    /**
     * Resultado de simular un núcleo candidato.
     */
    private record Candidate(double coreDiameter, GrainGeometry geometry, BallisticsResult ballistics,
                             OverPressureException overPressure, boolean unsustained) {

        /**
         * tb simulado - tb objetivo [s]. Positivo = demasiado lento.
         */
        double residual(double target) {
            if (ballistics != null) {
                return ballistics.getBurnTime() - target;
            }
            return unsustained ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        }

        boolean converged(double target, double tolerance) {
            return ballistics != null && Math.abs(ballistics.getBurnTime() - target) <= tolerance;
        }
    }
}
