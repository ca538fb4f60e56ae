package projectapogee.config;

import lombok.Builder;
import lombok.With;
import projectapogee.domain.exception.InvalidInputException;

/**
 * Tolerancias numéricas de todos los solvers.
 *
 * @param altitudeAbsoluteTolerance  Error absoluto de apogeo aceptado por el optimizador [m].
 * @param altitudeRelativeTolerance  Error relativo de apogeo aceptado (se cumple una u otra).
 * @param integratorAbsoluteTolerance Tolerancia absoluta del control de error Runge-Kutta.
 * @param integratorRelativeTolerance Tolerancia relativa del control de error Runge-Kutta.
 * @param burnTimeRelativeTolerance  Error relativo aceptado en el tiempo de combustión del grano dimensionado.
 * @param pressureRelativeTolerance  Tolerancia relativa del buscador de raíces de presión de cámara.
 * @param impulseRelativeTolerance   Desviación relativa admitida entre el impulso que entrega el grano y el requerido.
 */
@Builder
@With
public record ToleranceConfig(
        double altitudeAbsoluteTolerance,
        double altitudeRelativeTolerance,
        double integratorAbsoluteTolerance,
        double integratorRelativeTolerance,
        double burnTimeRelativeTolerance,
        double pressureRelativeTolerance,
        double impulseRelativeTolerance
) {
    public void validate() {
        if (!(altitudeAbsoluteTolerance > 0) && !(altitudeRelativeTolerance > 0)) {
            throw new InvalidInputException("Se necesita al menos una tolerancia de altitud positiva.");
        }
        if (!(integratorAbsoluteTolerance > 0) || !(integratorRelativeTolerance > 0)) {
            throw new InvalidInputException("Las tolerancias del integrador deben ser positivas.");
        }
        if (!(burnTimeRelativeTolerance > 0) || !(pressureRelativeTolerance > 0)) {
            throw new InvalidInputException("Las tolerancias de balística interna deben ser positivas.");
        }
        if (!(impulseRelativeTolerance > 0) || !Double.isFinite(impulseRelativeTolerance)) {
            throw new InvalidInputException("La tolerancia de impulso debe ser positiva y finita: " + impulseRelativeTolerance);
        }
    }

    public static ToleranceConfig getDefault() {
        return ToleranceConfig.builder()
                .altitudeAbsoluteTolerance(1.0)
                .altitudeRelativeTolerance(1e-3)
                .integratorAbsoluteTolerance(1e-6)
                .integratorRelativeTolerance(1e-6)
                .burnTimeRelativeTolerance(1e-3)
                .pressureRelativeTolerance(1e-10)
                .impulseRelativeTolerance(0.15)
                .build();
    }
}
