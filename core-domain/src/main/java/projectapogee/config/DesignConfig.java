package projectapogee.config;

import lombok.Builder;
import lombok.With;
import projectapogee.domain.exception.InvalidInputException;
import projectapogee.domain.motor.GrainGeometry;
import projectapogee.domain.motor.MotorSpec;
import projectapogee.domain.rocket.RocketSpec;

/**
 * Contenedor principal de la entrada del diseño inverso.
 * <p>
 * Agrupa el objetivo de apogeo, las especificaciones físicas y todos los parámetros numéricos.
 * Toda la configuración viaja de forma explícita hasta cada solver; no existe estado global,
 * de modo que cada llamada es reproducible y testeable de forma aislada.
 *
 * @param targetAltitude          Apogeo objetivo sobre la plataforma [m].
 * @param rocket                  Fuselaje.
 * @param motor                   Propelente, cámara y tobera.
 * @param grain                   Geometría fija (sólo con {@link GrainMode#FIXED}); puede ser nula.
 * @param grainMode               Dimensionar el grano o usar el suministrado.
 * @param tolerance               Tolerancias numéricas.
 * @param iterationLimits         Topes de iteración.
 * @param thrustSearch            Rango de búsqueda de empuje.
 * @param integrator              Parámetros del integrador de vuelo.
 * @param ballistics              Parámetros de balística interna.
 * @param simulateBallisticFlight Volar también con la curva de empuje de la balística interna.
 */
@Builder
@With
public record DesignConfig(
        double targetAltitude,
        RocketSpec rocket,
        MotorSpec motor,
        GrainGeometry grain,
        GrainMode grainMode,
        ToleranceConfig tolerance,
        IterationLimits iterationLimits,
        ThrustSearchConfig thrustSearch,
        IntegratorConfig integrator,
        BallisticsConfig ballistics,
        boolean simulateBallisticFlight
) {
    public DesignConfig {
        // Los bloques numéricos omitidos (por ejemplo en un JSON parcial) toman sus valores por defecto
        if (grainMode == null) grainMode = GrainMode.SIZE_FROM_TARGET;
        if (tolerance == null) tolerance = ToleranceConfig.getDefault();
        if (iterationLimits == null) iterationLimits = IterationLimits.getDefault();
        if (thrustSearch == null) thrustSearch = ThrustSearchConfig.getDefault();
        if (integrator == null) integrator = IntegratorConfig.getDefault();
        if (ballistics == null) ballistics = BallisticsConfig.getDefault();
    }

    /**
     * Valida toda la entrada antes de lanzar cualquier integración.
     *
     * @throws InvalidInputException si algún parámetro no es físico o falta.
     */
    public void validate() {
        if (!Double.isFinite(targetAltitude) || targetAltitude <= 0) {
            throw new InvalidInputException("La altitud objetivo debe ser positiva: " + targetAltitude);
        }
        if (rocket == null || motor == null) {
            throw new InvalidInputException("Las especificaciones del cohete y del motor son obligatorias.");
        }
        rocket.validate();
        motor.validate();
        if (grainMode == GrainMode.FIXED && grain == null) {
            throw new InvalidInputException("El modo FIXED requiere una geometría de grano.");
        }
        tolerance.validate();
        iterationLimits.validate();
        thrustSearch.validate();
        integrator.validate();
        ballistics.validate();
    }

    /**
     * Configuración de referencia: cohete de 1.3 kg, motor KNSB, objetivo de 1000 m.
     */
    public static DesignConfig getTestingDesign() {
        return DesignConfig.builder()
                .targetAltitude(1000.0)
                .rocket(RocketSpec.getDefault())
                .motor(MotorSpec.knsb())
                .grainMode(GrainMode.SIZE_FROM_TARGET)
                .tolerance(ToleranceConfig.getDefault())
                .iterationLimits(IterationLimits.getDefault())
                .thrustSearch(ThrustSearchConfig.getDefault())
                .integrator(IntegratorConfig.getDefault())
                .ballistics(BallisticsConfig.getDefault())
                .simulateBallisticFlight(true)
                .build();
    }
}
