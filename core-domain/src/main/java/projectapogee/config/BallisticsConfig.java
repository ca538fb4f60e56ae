package projectapogee.config;

import lombok.Builder;
import lombok.With;
import projectapogee.domain.exception.InvalidInputException;

/**
 * Parámetros del solver de balística interna y de las reglas de dimensionado del grano.
 *
 * @param timeStep                  Paso de tiempo de la simulación de combustión [s].
 * @param minPortToThroatRatio      Relación puerto/garganta mínima (2.0).
 * @param erosivePortToThroatRatio  Relación exigida cuando hay riesgo erosivo (3.0).
 * @param erosiveLengthToDiameter   L/D a partir del cual hay riesgo de combustión erosiva (6.0).
 * @param minWebThickness           Web mínimo admisible al dimensionar [m].
 */
@Builder
@With
public record BallisticsConfig(
        double timeStep,
        double minPortToThroatRatio,
        double erosivePortToThroatRatio,
        double erosiveLengthToDiameter,
        double minWebThickness
) {
    public void validate() {
        if (!(timeStep > 0) || !(minPortToThroatRatio > 0) || !(erosivePortToThroatRatio >= minPortToThroatRatio)
                || !(erosiveLengthToDiameter > 0) || !(minWebThickness > 0)) {
            throw new InvalidInputException("Configuración de balística no válida: " + this);
        }
    }

    public static BallisticsConfig getDefault() {
        return BallisticsConfig.builder()
                .timeStep(0.01)
                .minPortToThroatRatio(2.0)
                .erosivePortToThroatRatio(3.0)
                .erosiveLengthToDiameter(6.0)
                .minWebThickness(1e-3)
                .build();
    }
}
