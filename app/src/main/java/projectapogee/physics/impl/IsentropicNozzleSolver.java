package projectapogee.physics.impl;

import lombok.extern.slf4j.Slf4j;
import projectapogee.domain.exception.InvalidGeometryException;
import projectapogee.domain.motor.MotorSpec;
import projectapogee.domain.motor.NozzleDesign;
import projectapogee.physics.i.INozzleSolver;
import projectapogee.physics.solver.IsentropicFlow;

/**
 * Dimensiona una tobera convergente-divergente con relaciones isentrópicas cuasi-1D.
 * <p>
 * Pasos:
 * 1. Presión de cámara de diseño {@code Pc = Pmax · (Pmedia/Pmax)}.
 * 2. Mach de salida en la rama supersónica a partir de Ae/At (o de Pc/Pa si se pide expansión óptima).
 * 3. {@code Pe/Pc} y coeficiente de empuje a presión ambiente.
 * 4. {@code At = F / (Pc·C_F·η)} y {@code Ae = At·ε}.
 */
@Slf4j
public class IsentropicNozzleSolver implements INozzleSolver {

    @Override
    public String getName() {
        return "Isentropic CD Nozzle";
    }

    @Override
    public NozzleDesign solve(double requiredThrust, MotorSpec motor, double ambientPressure) {
        if (!(requiredThrust > 0) || !Double.isFinite(requiredThrust)) {
            throw new InvalidGeometryException("El empuje requerido debe ser positivo y finito: " + requiredThrust);
        }
        double gamma = motor.specificHeatRatio();
        double pc = motor.designChamberPressure();

        double expansionRatio;
        double exitMach;
        if (motor.expansionRatio() > 0) {
            expansionRatio = motor.expansionRatio();
            exitMach = IsentropicFlow.supersonicMachFromAreaRatio(expansionRatio, gamma);
        } else {
            // Expansión óptima: Pe = Pa en la plataforma
            exitMach = IsentropicFlow.machFromPressureRatio(pc / ambientPressure, gamma);
            expansionRatio = IsentropicFlow.areaRatio(exitMach, gamma);
        }

        double exitToChamber = IsentropicFlow.staticToStagnationPressure(exitMach, gamma);
        double thrustCoefficient = IsentropicFlow.thrustCoefficient(gamma, expansionRatio, exitToChamber, ambientPressure / pc);
        if (!(thrustCoefficient > 0) || !Double.isFinite(thrustCoefficient)) {
            throw new InvalidGeometryException(String.format(
                    "Coeficiente de empuje no físico (C_F=%.4g): la tobera está demasiado sobreexpandida", thrustCoefficient));
        }

        double throatArea = requiredThrust / (pc * thrustCoefficient * motor.nozzleEfficiency());
        double exitArea = throatArea * expansionRatio;
        if (!(throatArea > 0) || !Double.isFinite(throatArea) || !(exitArea > 0) || !Double.isFinite(exitArea)) {
            throw new InvalidGeometryException(String.format(
                    "Áreas de tobera no válidas: At=%.4g m², Ae=%.4g m²", throatArea, exitArea));
        }

        NozzleDesign nozzle = NozzleDesign.builder()
                .throatArea(throatArea)
                .exitArea(exitArea)
                .expansionRatio(expansionRatio)
                .exitMach(exitMach)
                .exitPressure(exitToChamber * pc)
                .chamberPressure(pc)
                .ambientPressure(ambientPressure)
                .thrustCoefficient(thrustCoefficient)
                .efficiency(motor.nozzleEfficiency())
                .specificHeatRatio(gamma)
                .build();

        log.debug("Tobera: At={} m² (dt={} mm), ε={}, Me={}, C_F={}",
                throatArea, nozzle.throatDiameter() * 1e3, expansionRatio, exitMach, thrustCoefficient);
        return nozzle;
    }
}
