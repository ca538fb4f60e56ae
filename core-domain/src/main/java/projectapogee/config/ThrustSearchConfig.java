package projectapogee.config;

import lombok.Builder;
import lombok.With;
import projectapogee.domain.exception.InvalidInputException;

/**
 * Rango físicamente razonable de la búsqueda de empuje medio.
 *
 * @param minThrust        Extremo inferior inicial de la horquilla [N].
 * @param initialMaxThrust Extremo superior inicial de la horquilla [N].
 * @param maxThrust        Techo absoluto: si ni siquiera este empuje alcanza el objetivo, el diseño es inviable [N].
 */
@Builder
@With
public record ThrustSearchConfig(
        double minThrust,
        double initialMaxThrust,
        double maxThrust
) {
    public void validate() {
        if (!(minThrust > 0) || !(initialMaxThrust > minThrust) || !(maxThrust >= initialMaxThrust)) {
            throw new InvalidInputException(
                    "Se requiere 0 < minThrust < initialMaxThrust <= maxThrust: " + this);
        }
    }

    public static ThrustSearchConfig getDefault() {
        return ThrustSearchConfig.builder()
                .minThrust(10.0)
                .initialMaxThrust(1000.0)
                .maxThrust(100_000.0)
                .build();
    }
}
