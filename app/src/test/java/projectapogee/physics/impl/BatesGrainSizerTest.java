package projectapogee.physics.impl;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectapogee.config.DesignConfig;
import projectapogee.domain.design.BallisticsResult;
import projectapogee.domain.design.BallisticsSample;
import projectapogee.domain.design.GrainDesign;
import projectapogee.domain.exception.InfeasibleDesignException;
import projectapogee.domain.exception.InvalidGeometryException;
import projectapogee.domain.exception.NonConvergenceException;
import projectapogee.domain.exception.OverPressureException;
import projectapogee.domain.motor.GrainGeometry;
import projectapogee.domain.motor.MotorSpec;
import projectapogee.domain.motor.NozzleDesign;
import projectapogee.physics.i.IBallisticsSolver;

import java.util.List;
import java.util.function.DoubleUnaryOperator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@Slf4j
class BatesGrainSizerTest {

    private static final double SEA_LEVEL = 101_325.0;

    private final DesignConfig config = DesignConfig.getTestingDesign();
    private final MotorSpec knsb = config.motor();
    private final NozzleDesign nozzle = new IsentropicNozzleSolver().solve(175.0, knsb, SEA_LEVEL);

    /**
     * Balística ficticia de dos muestras con el tiempo de combustión dado.
     */
    private static BallisticsResult fakeBallistics(double burnTime) {
        return BallisticsResult.builder()
                .samples(List.of(
                        new BallisticsSample(0.0, 0.0, 0.016, 0.04, 0.01, 120.0, 2.0e6, 0.01, 0.15, 180.0),
                        new BallisticsSample(burnTime, 0.01, 0.036, 0.02, 0.0, 0.0, SEA_LEVEL, 0.0, 0.0, 0.0)))
                .burnTime(burnTime)
                .totalImpulse(180.0 * burnTime)
                .averageThrust(180.0)
                .averagePressure(1.9e6)
                .peakPressure(2.0e6)
                .propellantMassBurned(0.3)
                .steps(1)
                .build();
    }

    /**
     * Solver simulado cuyo tiempo de combustión es una función del diámetro de núcleo.
     */
    private static IBallisticsSolver mockSolver(DoubleUnaryOperator burnTimeOfCore) {
        IBallisticsSolver solver = mock(IBallisticsSolver.class);
        when(solver.simulate(any(), any(), any(), any(), any(), any())).thenAnswer(invocation -> {
            GrainGeometry grain = invocation.getArgument(0);
            return fakeBallistics(burnTimeOfCore.applyAsDouble(grain.coreDiameter()));
        });
        return solver;
    }

    @Test
    @DisplayName("Diseño de referencia: núcleo de ~16.4 mm que quema en 2 s y cabe en la cámara")
    void size_referenceDesign_shouldHitBurnTime() {
        // ARRANGE
        BatesGrainSizer sizer = new BatesGrainSizer();

        // ACT
        GrainDesign design = sizer.size(config, nozzle);
        GrainGeometry geometry = design.getGeometry();
        log.info("Núcleo {} mm, segmento {} mm, tb {} s en {} iteraciones",
                geometry.coreDiameter() * 1e3, geometry.segmentLength() * 1e3,
                design.getBallistics().getBurnTime(), design.getIterations());

        // ASSERT
        assertEquals(16.44, geometry.coreDiameter() * 1e3, 0.1);
        assertEquals(knsb.grainOuterDiameter(), geometry.outerDiameter(), 1e-15);
        assertEquals(2.0, design.getBallistics().getBurnTime(), 2.0e-3);
        assertEquals(0.3, geometry.propellantMass(knsb.propellantDensity()), 1e-9);
        assertTrue(geometry.envelopeVolume() < knsb.chamberVolume());
        assertTrue(design.getBallistics().getPeakPressure() < knsb.maxChamberPressure());
        assertTrue(design.getPortToThroatRatio() >= 2.0);
        assertFalse(design.isErosiveBurningRisk());
        assertFalse(design.isPortRatioLimited());
        assertTrue(design.getIterations() > 0);
        assertEquals(0.15, design.getDesignMassFlow(), 1e-12);
        assertEquals(knsb.chamberVolume() - geometry.propellantVolume(), design.getInitialFreeVolume(), 1e-15);
    }

    @Test
    @DisplayName("Bisección sobre el núcleo: encuentra el diámetro donde tb(d) cruza el objetivo")
    void size_monotoneBurnTime_shouldFindCrossing() {
        // ARRANGE: tb = 0.06/d, el objetivo de 2 s se cumple con d = 30 mm
        BatesGrainSizer sizer = new BatesGrainSizer(mockSolver(d -> 0.06 / d));

        // ACT
        GrainDesign design = sizer.size(config, nozzle);

        // ASSERT
        assertEquals(0.030, design.getGeometry().coreDiameter(), 5e-5);
        assertEquals(2.0, design.getBallistics().getBurnTime(), 2.0e-3);
    }

    @Test
    @DisplayName("Incluso el núcleo máximo quema demasiado despacio: InfeasibleDesignException")
    void size_alwaysTooSlow_shouldThrowInfeasible() {
        BatesGrainSizer sizer = new BatesGrainSizer(mockSolver(d -> 5.0));

        assertThrows(InfeasibleDesignException.class, () -> sizer.size(config, nozzle));
    }

    @Test
    @DisplayName("El núcleo mínimo ya quema demasiado rápido: se acepta limitado por la relación de puerto")
    void size_tooFastAtMinimumCore_shouldReturnPortLimited() {
        // ARRANGE
        IBallisticsSolver solver = mockSolver(d -> 1.0);
        BatesGrainSizer sizer = new BatesGrainSizer(solver);

        // ACT
        GrainDesign design = sizer.size(config, nozzle);

        // ASSERT
        assertTrue(design.isPortRatioLimited());
        assertEquals(0, design.getIterations());
        assertEquals(2.0, design.getPortToThroatRatio(), 1e-9);
        verify(solver, times(1)).simulate(any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("El núcleo mínimo sobrepresuriza: se propaga OverPressureException")
    void size_overPressureAtMinimumCore_shouldThrow() {
        // ARRANGE
        IBallisticsSolver solver = mock(IBallisticsSolver.class);
        when(solver.simulate(any(), any(), any(), any(), any(), any()))
                .thenThrow(new OverPressureException("Sobrepresión simulada", 5.0e6, 3.0e6));
        BatesGrainSizer sizer = new BatesGrainSizer(solver);

        // ACT
        OverPressureException e = assertThrows(OverPressureException.class, () -> sizer.size(config, nozzle));

        // ASSERT
        assertEquals(5.0e6, e.getPressure());
    }

    @Test
    @DisplayName("El núcleo mínimo sin raíz en la horquilla: se propaga la misma excepción marcada como cota")
    void size_rootAboveBracketAtMinimumCore_shouldKeepLowerBoundFlag() {
        // ARRANGE
        OverPressureException cause = OverPressureException.aboveBracket("Sin raíz", 3.0e7, 3.0e6);
        IBallisticsSolver solver = mock(IBallisticsSolver.class);
        when(solver.simulate(any(), any(), any(), any(), any(), any())).thenThrow(cause);

        // ACT
        OverPressureException e = assertThrows(OverPressureException.class,
                () -> new BatesGrainSizer(solver).size(config, nozzle));

        // ASSERT
        assertSame(cause, e);
        assertTrue(e.isAboveBracket());
    }

    @Test
    @DisplayName("Grano largo (L/D > 6): se exige relación de puerto 3 y se marca riesgo erosivo")
    void size_slenderGrain_shouldFlagErosiveBurning() {
        // ARRANGE: 1.5 kg de propelente en la cámara de 57 mm da L/D ≈ 8
        DesignConfig heavy = config
                .withRocket(config.rocket().withPropellantMass(1.5))
                .withMotor(knsb.withChamberVolume(2.0e-3));
        BatesGrainSizer sizer = new BatesGrainSizer(mockSolver(d -> 0.06 / d));

        // ACT
        GrainDesign design = sizer.size(heavy, nozzle);

        // ASSERT
        assertTrue(design.isErosiveBurningRisk());
        assertTrue(design.getLengthToDiameter() > 6.0);
        assertTrue(design.getPortToThroatRatio() >= 3.0);
    }

    @Test
    @DisplayName("El grano no cabe en la cámara: InvalidGeometryException")
    void size_envelopeLargerThanChamber_shouldThrow() {
        DesignConfig tiny = config.withMotor(knsb.withChamberVolume(1.0e-5));
        BatesGrainSizer sizer = new BatesGrainSizer(mockSolver(d -> 0.06 / d));

        assertThrows(InvalidGeometryException.class, () -> sizer.size(tiny, nozzle));
    }

    @Test
    @DisplayName("Liner más grueso que la cámara: InvalidGeometryException sin simular")
    void size_noRoomForGrain_shouldThrow() {
        // ARRANGE
        IBallisticsSolver solver = mock(IBallisticsSolver.class);
        DesignConfig thickLiner = config.withMotor(knsb.withLinerThickness(0.03));

        // ACT + ASSERT
        assertThrows(InvalidGeometryException.class, () -> new BatesGrainSizer(solver).size(thickLiner, nozzle));
        verify(solver, never()).simulate(any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("Sin iteraciones suficientes: NonConvergenceException con el mejor núcleo")
    void size_iterationBudgetExhausted_shouldThrowNonConvergence() {
        // ARRANGE
        DesignConfig starved = config.withIterationLimits(config.iterationLimits().withGrainSolverMaxIterations(1));
        BatesGrainSizer sizer = new BatesGrainSizer(mockSolver(d -> 0.06 / d));

        // ACT
        NonConvergenceException e = assertThrows(NonConvergenceException.class, () -> sizer.size(starved, nozzle));

        // ASSERT
        assertEquals(1, e.getIterations());
        assertTrue(Double.isFinite(e.getBestResidual()));
    }

    @Test
    @DisplayName("Modo FIXED: evalúa la geometría dada sin dimensionar")
    void evaluate_fixedGeometry_shouldKeepGeometry() {
        // ARRANGE
        GrainGeometry fixed = BatesGrainSizer.geometryFor(0.016, knsb, 0.3);
        BatesGrainSizer sizer = new BatesGrainSizer();

        // ACT
        GrainDesign design = sizer.evaluate(fixed, config, nozzle);

        // ASSERT
        assertSame(fixed, design.getGeometry());
        assertEquals(2.044, design.getBallistics().getBurnTime(), 0.01);
        assertEquals(0, design.getIterations());
        assertFalse(design.isPortRatioLimited());
    }

    @Test
    @DisplayName("La longitud de segmento contiene exactamente la masa de propelente")
    void geometryFor_shouldContainPropellantMass() {
        GrainGeometry geometry = BatesGrainSizer.geometryFor(0.02, knsb, 0.45);

        assertEquals(0.45, geometry.propellantMass(knsb.propellantDensity()), 1e-12);
        assertEquals(knsb.segmentCount(), geometry.segmentCount());
        assertEquals(knsb.exposedEndFaces(), geometry.exposedEndFaces());
    }
}
