package projectapogee.config;

import lombok.Builder;
import lombok.With;
import projectapogee.domain.exception.InvalidInputException;

/**
 * Topes de iteración: son las únicas guardas de terminación del sistema (no hay timeouts).
 *
 * @param optimizerMaxIterations      Bisecciones máximas de la búsqueda de empuje.
 * @param maxBracketExpansions        Re-expansiones máximas de la horquilla inicial de empuje.
 * @param grainSolverMaxIterations    Bisecciones máximas del dimensionado del núcleo.
 * @param pressureSolverMaxIterations Iteraciones máximas del buscador de raíces de presión.
 * @param integratorMaxStepRejections Rechazos consecutivos de paso tolerados antes de fallar.
 */
@Builder
@With
public record IterationLimits(
        int optimizerMaxIterations,
        int maxBracketExpansions,
        int grainSolverMaxIterations,
        int pressureSolverMaxIterations,
        int integratorMaxStepRejections
) {
    public void validate() {
        if (optimizerMaxIterations < 1 || grainSolverMaxIterations < 1
                || pressureSolverMaxIterations < 1 || integratorMaxStepRejections < 1) {
            throw new InvalidInputException("Los topes de iteración deben ser >= 1: " + this);
        }
        if (maxBracketExpansions < 0) {
            throw new InvalidInputException("Las re-expansiones de horquilla no pueden ser negativas: " + maxBracketExpansions);
        }
    }

    public static IterationLimits getDefault() {
        return IterationLimits.builder()
                .optimizerMaxIterations(60)
                .maxBracketExpansions(20)
                .grainSolverMaxIterations(60)
                .pressureSolverMaxIterations(100)
                .integratorMaxStepRejections(40)
                .build();
    }
}
