package projectapogee.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectapogee.domain.exception.InvalidInputException;
import projectapogee.domain.motor.MotorSpec;
import projectapogee.domain.rocket.RocketSpec;

import static org.junit.jupiter.api.Assertions.*;

class DesignConfigTest {

    @Test
    @DisplayName("La configuración de pruebas es válida")
    void getTestingDesign_shouldBeValid() {
        DesignConfig config = DesignConfig.getTestingDesign();

        assertDoesNotThrow(config::validate);
        assertEquals(1000.0, config.targetAltitude());
        assertEquals(GrainMode.SIZE_FROM_TARGET, config.grainMode());
    }

    @Test
    @DisplayName("Los bloques numéricos omitidos toman sus valores por defecto")
    void constructor_missingBlocks_shouldUseDefaults() {
        DesignConfig config = DesignConfig.builder()
                .targetAltitude(500.0)
                .rocket(RocketSpec.getDefault())
                .motor(MotorSpec.knsb())
                .build();

        assertEquals(ToleranceConfig.getDefault(), config.tolerance());
        assertEquals(IterationLimits.getDefault(), config.iterationLimits());
        assertEquals(ThrustSearchConfig.getDefault(), config.thrustSearch());
        assertEquals(IntegratorConfig.getDefault(), config.integrator());
        assertEquals(BallisticsConfig.getDefault(), config.ballistics());
        assertEquals(GrainMode.SIZE_FROM_TARGET, config.grainMode());
        assertEquals(FlightMode.ASCENT_ONLY, config.integrator().flightMode());
    }

    @Test
    @DisplayName("Altitud objetivo no positiva o especificaciones ausentes se rechazan")
    void validate_invalidTopLevel_shouldThrow() {
        DesignConfig config = DesignConfig.getTestingDesign();

        assertThrows(InvalidInputException.class, () -> config.withTargetAltitude(0.0).validate());
        assertThrows(InvalidInputException.class, () -> config.withTargetAltitude(-5.0).validate());
        assertThrows(InvalidInputException.class, () -> config.withRocket(null).validate());
        assertThrows(InvalidInputException.class, () -> config.withGrainMode(GrainMode.FIXED).validate(),
                "El modo FIXED sin geometría no es válido");
    }

    @Test
    @DisplayName("La validación se propaga a los bloques anidados")
    void validate_shouldCascadeToNestedBlocks() {
        DesignConfig config = DesignConfig.getTestingDesign();

        assertThrows(InvalidInputException.class,
                () -> config.withRocket(RocketSpec.getDefault().withPropellantMass(0.0)).validate());
        assertThrows(InvalidInputException.class,
                () -> config.withThrustSearch(new ThrustSearchConfig(100.0, 50.0, 1000.0)).validate());
        assertThrows(InvalidInputException.class,
                () -> config.withIntegrator(IntegratorConfig.getDefault().withMinStep(0.0)).validate());
        assertThrows(InvalidInputException.class,
                () -> config.withIterationLimits(IterationLimits.getDefault().withOptimizerMaxIterations(0)).validate());
        assertThrows(InvalidInputException.class,
                () -> config.withTolerance(ToleranceConfig.getDefault().withIntegratorRelativeTolerance(-1.0)).validate());
        assertThrows(InvalidInputException.class,
                () -> config.withTolerance(ToleranceConfig.getDefault().withImpulseRelativeTolerance(Double.NaN)).validate());
        assertThrows(InvalidInputException.class,
                () -> config.withTolerance(ToleranceConfig.getDefault().withImpulseRelativeTolerance(0.0)).validate());
    }
}
