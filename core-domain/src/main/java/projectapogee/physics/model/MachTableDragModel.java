package projectapogee.physics.model;

import projectapogee.domain.rocket.MachDragPoint;

import java.util.Comparator;
import java.util.List;

/**
 * Curva Cd(Mach) tabulada con interpolación lineal. Fuera del rango de la tabla se
 * mantiene el valor del extremo más cercano.
 */
public class MachTableDragModel implements DragModel {

    private final double[] machs;
    private final double[] coefficients;

    public MachTableDragModel(List<MachDragPoint> points) {
        if (points == null || points.isEmpty()) {
            throw new IllegalArgumentException("La curva de arrastre necesita al menos un punto.");
        }
        List<MachDragPoint> sorted = points.stream()
                .sorted(Comparator.comparingDouble(MachDragPoint::mach))
                .toList();
        this.machs = new double[sorted.size()];
        this.coefficients = new double[sorted.size()];
        for (int i = 0; i < sorted.size(); i++) {
            machs[i] = sorted.get(i).mach();
            coefficients[i] = sorted.get(i).dragCoefficient();
        }
    }

    @Override
    public double dragCoefficient(double mach) {
        int last = machs.length - 1;
        if (mach <= machs[0]) {
            return coefficients[0];
        }
        if (mach >= machs[last]) {
            return coefficients[last];
        }
        int i = 0;
        while (machs[i + 1] < mach) {
            i++;
        }
        double span = machs[i + 1] - machs[i];
        if (span <= 0) {
            return coefficients[i + 1];
        }
        double w = (mach - machs[i]) / span;
        return coefficients[i] + w * (coefficients[i + 1] - coefficients[i]);
    }
}
