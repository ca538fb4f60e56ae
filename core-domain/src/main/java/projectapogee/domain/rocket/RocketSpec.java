package projectapogee.domain.rocket;

import lombok.Builder;
import lombok.With;
import projectapogee.domain.exception.InvalidInputException;
import projectapogee.physics.model.ConstantDragModel;
import projectapogee.physics.model.DragModel;
import projectapogee.physics.model.MachTableDragModel;

import java.util.List;

/**
 * Descripción inmutable del fuselaje del cohete.
 * <p>
 * Se suministra como configuración de entrada y nunca se muta. La masa instantánea durante el
 * vuelo vive en el estado del integrador, no aquí.
 *
 * @param dryMass         Masa en seco (estructura + motor vacío) [kg]. Debe ser &gt; 0.
 * @param propellantMass  Masa de propelente al despegue [kg]. Debe ser &gt; 0 para diseñar un motor.
 * @param referenceArea   Área de referencia (sección transversal) [m²].
 * @param dragCoefficient Coeficiente de arrastre constante, usado si no hay curva Mach-Cd.
 * @param dragCurve       Curva opcional Cd(Mach). Vacía significa Cd constante.
 * @param launchAltitude  Altitud de la plataforma de lanzamiento sobre el nivel del mar [m].
 */
@Builder
@With
public record RocketSpec(
        double dryMass,
        double propellantMass,
        double referenceArea,
        double dragCoefficient,
        List<MachDragPoint> dragCurve,
        double launchAltitude
) {
    public RocketSpec {
        dragCurve = dragCurve == null ? List.of() : List.copyOf(dragCurve);
    }

    /**
     * Masa total al despegue [kg].
     */
    public double liftoffMass() {
        return dryMass + propellantMass;
    }

    /**
     * Producto Cd·A con el coeficiente constante [m²].
     */
    public double dragArea() {
        return dragCoefficient * referenceArea;
    }

    /**
     * Construye el modelo de arrastre correspondiente a esta especificación.
     */
    public DragModel dragModel() {
        if (dragCurve.isEmpty()) {
            return new ConstantDragModel(dragCoefficient);
        }
        return new MachTableDragModel(dragCurve);
    }

    /**
     * Comprueba los invariantes físicos de la especificación.
     *
     * @throws InvalidInputException si alguna magnitud no es física.
     */
    public void validate() {
        requirePositive(dryMass, "La masa en seco");
        requirePositive(propellantMass, "La masa de propelente");
        requirePositive(referenceArea, "El área de referencia");
        if (!Double.isFinite(dragCoefficient) || dragCoefficient < 0) {
            throw new InvalidInputException("El coeficiente de arrastre debe ser finito y no negativo: " + dragCoefficient);
        }
        for (MachDragPoint point : dragCurve) {
            if (!(point.mach() >= 0) || !Double.isFinite(point.mach())
                    || !(point.dragCoefficient() >= 0) || !Double.isFinite(point.dragCoefficient())) {
                throw new InvalidInputException("Punto de curva de arrastre no físico: " + point);
            }
        }
        if (!Double.isFinite(launchAltitude) || launchAltitude < 0) {
            throw new InvalidInputException("La altitud de lanzamiento debe ser >= 0: " + launchAltitude);
        }
    }

    private static void requirePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new InvalidInputException(name + " debe ser positiva y finita: " + value);
        }
    }

    /**
     * Cohete de referencia: 1.0 kg en seco, 0.3 kg de propelente, 0.005 m², Cd 0.5, nivel del mar.
     */
    public static RocketSpec getDefault() {
        return RocketSpec.builder()
                .dryMass(1.0)
                .propellantMass(0.3)
                .referenceArea(0.005)
                .dragCoefficient(0.5)
                .dragCurve(List.of())
                .launchAltitude(0.0)
                .build();
    }
}
