package projectapogee.physics.impl;

import lombok.extern.slf4j.Slf4j;
import projectapogee.config.BallisticsConfig;
import projectapogee.config.IterationLimits;
import projectapogee.config.ToleranceConfig;
import projectapogee.domain.design.BallisticsResult;
import projectapogee.domain.design.BallisticsSample;
import projectapogee.domain.exception.InvalidGeometryException;
import projectapogee.domain.exception.NonConvergenceException;
import projectapogee.domain.exception.OverPressureException;
import projectapogee.domain.motor.GrainGeometry;
import projectapogee.domain.motor.MotorSpec;
import projectapogee.domain.motor.NozzleDesign;
import projectapogee.physics.i.IBallisticsSolver;
import projectapogee.physics.solver.IsentropicFlow;
import projectapogee.physics.solver.RootResult;
import projectapogee.physics.solver.ScalarRootFinder;

import java.util.ArrayList;
import java.util.List;

/**
 * Balística interna cuasi-estacionaria de un grano BATES.
 * <p>
 * En cada instante la presión de cámara es la raíz del balance de masa
 * <pre>
 *   (ρp - Pc/RT)·Ab(x)·r(Pc) - Cd·Pc·At/c* = 0
 * </pre>
 * buscada con Brent en {@code [Pa, 10·Pmax]}. La regresión avanza con un paso de tiempo fijo
 * (punto medio) y el último paso se acorta para consumir el web exactamente en el apagado.
 * Una combustión cuya presión pico no basta para que la tobera dé empuje se rechaza.
 */
@Slf4j
public class BatesBallisticsSolver implements IBallisticsSolver {

    // Horquilla superior de la presión en múltiplos del techo del motor
    private static final double PRESSURE_BRACKET_FACTOR = 10.0;
    private static final int MAX_TIME_STEPS = 1_000_000;

    @Override
    public String getName() {
        return "BATES quasi-steady";
    }

    @Override
    public String getDescription() {
        return "Balance de masa cuasi-estacionario resuelto con Brent, regresión por punto medio a paso fijo";
    }

    @Override
    public BallisticsResult simulate(GrainGeometry grain, NozzleDesign nozzle, MotorSpec motor,
                                     BallisticsConfig config, ToleranceConfig tolerance, IterationLimits limits) {
        grain.validate();
        MassBalance balance = new MassBalance(grain, nozzle, motor, tolerance, limits);

        final double web = grain.webThickness();
        final double ceiling = motor.maxChamberPressure();

        List<BallisticsSample> samples = new ArrayList<>();
        double t = 0.0;
        double x = 0.0;
        double pc = balance.chamberPressure(x);
        samples.add(balance.sample(t, x, pc));

        double impulse = 0.0;
        double pressureIntegral = 0.0;
        double peak = pc;
        int steps = 0;
        // Muestras con la cámara presurizada pero C_F <= 0 (arranque o agotamiento del web)
        int separatedSamples = balance.separated(pc) ? 1 : 0;

        while (x < web) {
            if (++steps > MAX_TIME_STEPS) {
                throw new NonConvergenceException("La combustión no termina en un número razonable de pasos", x, web - x, steps);
            }
            BallisticsSample previous = samples.get(samples.size() - 1);
            double dt = config.timeStep();

            // Punto medio: velocidad de combustión evaluada a media regresión
            double r0 = previous.burnRate();
            double xMid = x + 0.5 * r0 * dt;
            double rate = xMid < web ? motor.burnRate(balance.chamberPressure(xMid)) : r0;

            double remaining = web - x;
            if (rate * dt >= remaining) {
                dt = remaining / rate;
                x = web;
            } else {
                x += rate * dt;
            }
            t += dt;

            BallisticsSample current;
            if (x >= web) {
                // Web agotado: la cámara se vacía hasta la presión ambiente
                current = balance.burnoutSample(t, x);
            } else {
                pc = balance.chamberPressure(x);
                current = balance.sample(t, x, pc);
                peak = Math.max(peak, pc);
                if (balance.separated(pc)) {
                    separatedSamples++;
                }
            }

            impulse += 0.5 * (previous.thrust() + current.thrust()) * dt;
            pressureIntegral += 0.5 * (previous.chamberPressure() + current.chamberPressure()) * dt;
            samples.add(current);
        }

        if (peak > ceiling) {
            throw new OverPressureException("La presión de cámara pico supera la presión máxima de operación", peak, ceiling);
        }
        double peakThrustCoefficient = balance.thrustCoefficient(peak);
        if (!(peakThrustCoefficient > 0)) {
            throw new InvalidGeometryException(String.format(
                    "La tobera (ε=%.2f) queda desprendida durante toda la combustión: C_F=%.3f a la presión pico de %.3f MPa",
                    nozzle.expansionRatio(), peakThrustCoefficient, peak / 1e6));
        }
        if (separatedSamples > 0) {
            log.debug("{} de {} muestras presurizadas con el chorro desprendido (C_F <= 0), empuje nulo en ellas",
                    separatedSamples, samples.size());
        }

        BallisticsResult result = BallisticsResult.builder()
                .samples(List.copyOf(samples))
                .burnTime(t)
                .totalImpulse(impulse)
                .averageThrust(impulse / t)
                .averagePressure(pressureIntegral / t)
                .peakPressure(peak)
                .propellantMassBurned(grain.propellantMass(motor.propellantDensity()))
                .steps(steps)
                .build();

        log.debug("Combustión: tb={} s, I={} N·s, Pc pico={} MPa, {} pasos",
                result.getBurnTime(), impulse, peak / 1e6, steps);
        return result;
    }

    /**
     * Balance de masa de la cámara para un grano y una tobera concretos.
     */
    private static final class MassBalance {

        private final GrainGeometry grain;
        private final MotorSpec motor;
        private final double throatArea;
        private final double ambientPressure;
        private final double exitToChamber;
        private final double expansionRatio;
        private final double gamma;
        private final double efficiency;
        private final double gasConstantTemperature;
        private final double upperPressure;
        private final double pressureTolerance;
        private final int maxIterations;

        MassBalance(GrainGeometry grain, NozzleDesign nozzle, MotorSpec motor,
                    ToleranceConfig tolerance, IterationLimits limits) {
            this.grain = grain;
            this.motor = motor;
            this.throatArea = nozzle.throatArea();
            this.ambientPressure = nozzle.ambientPressure();
            this.exitToChamber = nozzle.exitToChamberPressureRatio();
            this.expansionRatio = nozzle.expansionRatio();
            this.gamma = nozzle.specificHeatRatio();
            this.efficiency = nozzle.efficiency();
            this.gasConstantTemperature = motor.gasConstantTemperature();
            this.upperPressure = PRESSURE_BRACKET_FACTOR * motor.maxChamberPressure();
            this.pressureTolerance = tolerance.pressureRelativeTolerance() * motor.maxChamberPressure();
            this.maxIterations = limits.pressureSolverMaxIterations();
        }

        double residual(double pc, double burningArea) {
            double gasDensity = pc / gasConstantTemperature;
            double generated = (motor.propellantDensity() - gasDensity) * burningArea * motor.burnRate(pc);
            double discharged = motor.dischargeCoefficient() * pc * throatArea / motor.characteristicVelocity();
            return generated - discharged;
        }

        double chamberPressure(double regression) {
            double area = grain.burningAreaAt(regression);
            double fLow = residual(ambientPressure, area);
            if (fLow <= 0) {
                if (regression > 0) {
                    // Cola de la combustión: el área residual ya no presuriza, la cámara queda a presión ambiente
                    return ambientPressure;
                }
                throw new InvalidGeometryException(String.format(
                        "El grano no presuriza la cámara en el encendido (Ab=%.4g m², Kn=%.1f)", area, area / throatArea));
            }
            double fHigh = residual(upperPressure, area);
            if (fHigh > 0) {
                throw OverPressureException.aboveBracket("El balance de masa no tiene raíz dentro de la horquilla de presión",
                        upperPressure, motor.maxChamberPressure());
            }
            RootResult root = ScalarRootFinder.brent(p -> residual(p, area), ambientPressure, upperPressure,
                    pressureTolerance, maxIterations);
            if (!root.converged()) {
                throw new NonConvergenceException("La presión de cámara no converge", root.root(), root.residual(), root.iterations());
            }
            return root.root();
        }

        double thrustCoefficient(double pc) {
            return IsentropicFlow.thrustCoefficient(gamma, expansionRatio, exitToChamber, ambientPressure / pc);
        }

        boolean separated(double pc) {
            return pc > ambientPressure && !(thrustCoefficient(pc) > 0);
        }

        double thrust(double pc) {
            // Transitorios a baja presión: el chorro se desprende y el empuje es nulo, nunca negativo.
            // Si ni la presión pico da C_F > 0 el motor se rechaza tras la simulación.
            return Math.max(0.0, pc * throatArea * thrustCoefficient(pc) * efficiency);
        }

        BallisticsSample sample(double t, double x, double pc) {
            double area = grain.burningAreaAt(x);
            double rate = motor.burnRate(pc);
            double massFlow = motor.dischargeCoefficient() * pc * throatArea / motor.characteristicVelocity();
            return new BallisticsSample(t, x, grain.coreDiameterAt(x), grain.segmentLengthAt(x), area,
                    area / throatArea, pc, rate, massFlow, thrust(pc));
        }

        BallisticsSample burnoutSample(double t, double x) {
            return new BallisticsSample(t, x, grain.coreDiameterAt(x), grain.segmentLengthAt(x), 0.0,
                    0.0, ambientPressure, 0.0, 0.0, 0.0);
        }
    }
}
