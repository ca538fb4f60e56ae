package projectapogee.physics.impl;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectapogee.domain.exception.InvalidGeometryException;
import projectapogee.domain.motor.MotorSpec;
import projectapogee.domain.motor.NozzleDesign;
import projectapogee.physics.solver.IsentropicFlow;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class IsentropicNozzleSolverTest {

    private static final double SEA_LEVEL = 101_325.0;

    private final IsentropicNozzleSolver solver = new IsentropicNozzleSolver();
    private final MotorSpec knsb = MotorSpec.knsb();

    @Test
    @DisplayName("Ida y vuelta: Pc·At·C_F·η reproduce el empuje pedido")
    void solve_roundTrip_shouldReproduceRequiredThrust() {
        for (double thrust : new double[]{20.0, 175.0, 1500.0}) {
            NozzleDesign nozzle = solver.solve(thrust, knsb, SEA_LEVEL);

            assertEquals(thrust, nozzle.designThrust(), 1e-9 * thrust, "Empuje " + thrust + " N");
            assertEquals(nozzle.throatArea() * knsb.expansionRatio(), nozzle.exitArea(), 1e-18);
        }
    }

    @Test
    @DisplayName("Motor de referencia a 175 N: garganta de ~10 mm, Me ≈ 3.13, C_F ≈ 1.283")
    void solve_referenceMotor_shouldMatchHandCalculation() {
        NozzleDesign nozzle = solver.solve(175.0, knsb, SEA_LEVEL);
        log.info("At={} m², dt={} mm, de={} mm", nozzle.throatArea(), nozzle.throatDiameter() * 1e3, nozzle.exitDiameter() * 1e3);

        assertEquals(1.845e6, nozzle.chamberPressure(), 1e-6);
        assertEquals(3.131, nozzle.exitMach(), 1e-3);
        assertEquals(1.2832, nozzle.thrustCoefficient(), 1e-3);
        assertEquals(8.034e-5, nozzle.throatArea(), 1e-7);
        assertEquals(10.1, nozzle.throatDiameter() * 1e3, 0.1);
        assertTrue(nozzle.pressureRatio() < 1.0, "Con ε=7.414 la tobera está sobreexpandida a nivel del mar");
    }

    @Test
    @DisplayName("El Mach de salida satisface la relación área-Mach en la rama supersónica")
    void solve_exitMach_shouldSatisfyAreaMachRelation() {
        NozzleDesign nozzle = solver.solve(175.0, knsb, SEA_LEVEL);

        assertTrue(nozzle.exitMach() > 1.0);
        assertEquals(nozzle.expansionRatio(), IsentropicFlow.areaRatio(nozzle.exitMach(), nozzle.specificHeatRatio()), 1e-9);
    }

    @Test
    @DisplayName("Sin relación de expansión se diseña para expansión óptima: Pe = Pa")
    void solve_optimumExpansion_shouldMatchAmbientPressure() {
        NozzleDesign nozzle = solver.solve(175.0, knsb.withExpansionRatio(0.0), SEA_LEVEL);

        assertEquals(SEA_LEVEL, nozzle.exitPressure(), 1e-6 * SEA_LEVEL);
        assertEquals(1.0, nozzle.pressureRatio(), 1e-6);
        assertTrue(nozzle.expansionRatio() > 1.0);
        assertTrue(nozzle.thrustCoefficient() > solver.solve(175.0, knsb, SEA_LEVEL).thrustCoefficient());
    }

    @Test
    @DisplayName("Tobera muy sobreexpandida con C_F no positivo: InvalidGeometryException")
    void solve_negativeThrustCoefficient_shouldThrow() {
        MotorSpec lowPressure = knsb.withMaxChamberPressure(2.0e5).withExpansionRatio(20.0);

        assertThrows(InvalidGeometryException.class, () -> solver.solve(175.0, lowPressure, SEA_LEVEL));
    }

    @Test
    @DisplayName("Empuje requerido no positivo: InvalidGeometryException")
    void solve_nonPositiveThrust_shouldThrow() {
        assertThrows(InvalidGeometryException.class, () -> solver.solve(0.0, knsb, SEA_LEVEL));
        assertThrows(InvalidGeometryException.class, () -> solver.solve(Double.NaN, knsb, SEA_LEVEL));
    }
}
