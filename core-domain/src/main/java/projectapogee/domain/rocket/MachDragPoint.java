package projectapogee.domain.rocket;

/**
 * Punto de la curva de arrastre: coeficiente de arrastre a un número de Mach dado.
 *
 * @param mach            Número de Mach (adimensional, >= 0).
 * @param dragCoefficient Coeficiente de arrastre Cd a ese Mach.
 */
public record MachDragPoint(double mach, double dragCoefficient) {
}
