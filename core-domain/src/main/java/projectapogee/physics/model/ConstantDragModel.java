package projectapogee.physics.model;

/**
 * Cd independiente del Mach.
 */
public record ConstantDragModel(double coefficient) implements DragModel {

    @Override
    public double dragCoefficient(double mach) {
        return coefficient;
    }
}
