package projectapogee.factory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectapogee.config.DesignConfig;
import projectapogee.domain.design.BallisticsResult;
import projectapogee.domain.design.DesignResult;
import projectapogee.domain.design.GrainDesign;
import projectapogee.domain.design.ThrustSearchResult;
import projectapogee.domain.flight.TrajectoryResult;
import projectapogee.domain.motor.NozzleDesign;
import projectapogee.physics.impl.IsentropicNozzleSolver;
import projectapogee.physics.model.IsaAtmosphereModel;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DesignResultFactoryTest {

    private final DesignConfig config = DesignConfig.getTestingDesign();

    private final TrajectoryResult trajectory = TrajectoryResult.builder()
            .samples(List.of())
            .apogeeAltitude(999.2)
            .landingTime(Double.NaN)
            .build();

    private final ThrustSearchResult search = ThrustSearchResult.builder()
            .thrust(175.0)
            .apogee(999.2)
            .targetAltitude(1000.0)
            .iterations(14)
            .trajectory(trajectory)
            .build();

    private final NozzleDesign nozzle = new IsentropicNozzleSolver().solve(175.0, config.motor(), 101_325.0);

    private final GrainDesign grain = GrainDesign.builder()
            .ballistics(BallisticsResult.builder().samples(List.of()).totalImpulse(317.0).build())
            .build();

    @Test
    @DisplayName("Las prestaciones derivadas se calculan a partir del empuje, la masa y el tiempo de combustión")
    void create_shouldDerivePerformanceFigures() {
        // ACT
        DesignResult result = DesignResultFactory.create(config, search, nozzle, grain, null);

        // ASSERT
        double g0 = IsaAtmosphereModel.STANDARD_GRAVITY;
        assertEquals(175.0, result.getAverageThrust());
        assertEquals(350.0, result.getTotalImpulse(), 1e-9);
        assertEquals(0.15, result.getDesignMassFlow(), 1e-12);
        assertEquals(175.0 / (0.15 * g0), result.getRequiredSpecificImpulse(), 1e-9);
        assertEquals(config.motor().characteristicVelocity() * nozzle.thrustCoefficient() / g0,
                result.getTheoreticalSpecificImpulse(), 1e-9);
        assertEquals(317.0, result.getDeliveredTotalImpulse());
        assertEquals(14, result.getOptimizerIterations());
        assertEquals(-0.8, result.getApogeeError(), 1e-9);
    }

    @Test
    @DisplayName("El resultado conserva las piezas de entrada sin copiarlas")
    void create_shouldKeepReferences() {
        DesignResult result = DesignResultFactory.create(config, search, nozzle, grain, trajectory);

        assertSame(config.rocket(), result.getRocket());
        assertSame(config.motor(), result.getMotor());
        assertSame(nozzle, result.getNozzle());
        assertSame(grain, result.getGrain());
        assertSame(trajectory, result.getTrajectory());
        assertSame(trajectory, result.getBallisticTrajectory());
        assertEquals(1000.0, result.getTargetAltitude());
    }

    @Test
    @DisplayName("Isp requerido y teórico de la referencia dentro del rango típico del KNSB (100-140 s)")
    void create_referenceDesign_requiredIspShouldBeRealistic() {
        DesignResult result = DesignResultFactory.create(config, search, nozzle, grain, null);

        assertTrue(result.getRequiredSpecificImpulse() > 100.0 && result.getRequiredSpecificImpulse() < 140.0);
        assertTrue(result.getTheoreticalSpecificImpulse() > 100.0 && result.getTheoreticalSpecificImpulse() < 140.0);
    }
}
