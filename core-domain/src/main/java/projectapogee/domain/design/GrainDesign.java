package projectapogee.domain.design;

import lombok.Builder;
import lombok.Value;
import projectapogee.domain.motor.GrainGeometry;

/**
 * Grano BATES dimensionado junto con la balística interna que lo valida.
 */
@Value
@Builder
public class GrainDesign {

    GrainGeometry geometry;
    BallisticsResult ballistics;

    /**
     * Relación área de puerto / garganta final.
     */
    double portToThroatRatio;
    double lengthToDiameter;

    /**
     * L/D &gt; 6: riesgo de combustión erosiva, se exigió una relación de puerto mayor.
     */
    boolean erosiveBurningRisk;

    /**
     * La relación de puerto mínima impidió alcanzar el tiempo de combustión objetivo exacto.
     */
    boolean portRatioLimited;

    /**
     * Área de combustión necesaria a presión de diseño, {@code Ab = ṁ / (ρ·r)} [m²].
     */
    double requiredBurningArea;

    /**
     * Velocidad de combustión a la presión de diseño [m/s].
     */
    double designBurnRate;

    /**
     * Gasto másico medio de diseño {@code mp / tb} [kg/s].
     */
    double designMassFlow;

    /**
     * Volumen libre inicial de cámara (cámara menos propelente) [m³].
     */
    double initialFreeVolume;

    int iterations;
}
