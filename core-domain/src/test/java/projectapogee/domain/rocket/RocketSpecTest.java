package projectapogee.domain.rocket;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectapogee.domain.exception.InvalidInputException;
import projectapogee.physics.model.ConstantDragModel;
import projectapogee.physics.model.MachTableDragModel;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RocketSpecTest {

    private final RocketSpec rocket = RocketSpec.getDefault();

    @Test
    @DisplayName("Magnitudes derivadas: masa al despegue y Cd·A")
    void derivedQuantities_shouldMatchDefinitions() {
        assertEquals(1.3, rocket.liftoffMass(), 1e-12);
        assertEquals(0.0025, rocket.dragArea(), 1e-15);
    }

    @Test
    @DisplayName("Sin curva se usa Cd constante; con curva, la tabla Mach-Cd")
    void dragModel_shouldDependOnCurvePresence() {
        assertInstanceOf(ConstantDragModel.class, rocket.dragModel());

        RocketSpec withCurve = rocket.withDragCurve(List.of(new MachDragPoint(0.0, 0.45), new MachDragPoint(1.0, 0.7)));
        assertInstanceOf(MachTableDragModel.class, withCurve.dragModel());
        assertEquals(0.575, withCurve.dragModel().dragCoefficient(0.5), 1e-12);
    }

    @Test
    @DisplayName("La curva de arrastre es inmutable y nula equivale a vacía")
    void dragCurve_shouldBeDefensivelyCopied() {
        List<MachDragPoint> points = new ArrayList<>();
        points.add(new MachDragPoint(0.0, 0.5));
        RocketSpec spec = rocket.withDragCurve(points);
        points.add(new MachDragPoint(1.0, 0.9));

        assertEquals(1, spec.dragCurve().size());
        assertThrows(UnsupportedOperationException.class, () -> spec.dragCurve().add(new MachDragPoint(2.0, 1.0)));
        assertTrue(rocket.withDragCurve(null).dragCurve().isEmpty());
    }

    @Test
    @DisplayName("Masas, área o coeficientes no físicos se rechazan")
    void validate_nonPhysicalValues_shouldThrow() {
        assertDoesNotThrow(rocket::validate);
        assertThrows(InvalidInputException.class, () -> rocket.withDryMass(0.0).validate());
        assertThrows(InvalidInputException.class, () -> rocket.withPropellantMass(0.0).validate());
        assertThrows(InvalidInputException.class, () -> rocket.withReferenceArea(-0.01).validate());
        assertThrows(InvalidInputException.class, () -> rocket.withDragCoefficient(-0.1).validate());
        assertThrows(InvalidInputException.class, () -> rocket.withLaunchAltitude(-10.0).validate());
        assertThrows(InvalidInputException.class,
                () -> rocket.withDragCurve(List.of(new MachDragPoint(-1.0, 0.5))).validate());
    }

    @Test
    @DisplayName("Puntos de curva de arrastre con NaN o infinito se rechazan")
    void validate_nonFiniteDragCurvePoints_shouldThrow() {
        assertThrows(InvalidInputException.class,
                () -> rocket.withDragCurve(List.of(new MachDragPoint(Double.NaN, 0.5))).validate());
        assertThrows(InvalidInputException.class,
                () -> rocket.withDragCurve(List.of(new MachDragPoint(0.5, Double.NaN))).validate());
        assertThrows(InvalidInputException.class,
                () -> rocket.withDragCurve(List.of(new MachDragPoint(Double.POSITIVE_INFINITY, 0.5))).validate());
        assertThrows(InvalidInputException.class,
                () -> rocket.withDragCurve(List.of(new MachDragPoint(0.8, Double.POSITIVE_INFINITY))).validate());
    }
}
