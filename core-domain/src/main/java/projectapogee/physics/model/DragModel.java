package projectapogee.physics.model;

/**
 * Coeficiente de arrastre en función del número de Mach.
 */
@FunctionalInterface
public interface DragModel {

    double dragCoefficient(double mach);
}
