package projectapogee.domain.motor;

import lombok.Builder;

/**
 * Resultado inmutable del dimensionado de la tobera convergente-divergente.
 * Se produce una sola vez por diseño aceptado.
 *
 * @param throatArea        Área de garganta At [m²].
 * @param exitArea          Área de salida Ae [m²].
 * @param expansionRatio    Ae/At.
 * @param exitMach          Mach de salida (rama supersónica).
 * @param exitPressure      Presión estática en la salida [Pa].
 * @param chamberPressure   Presión de cámara de diseño [Pa].
 * @param ambientPressure   Presión ambiente en la plataforma [Pa].
 * @param thrustCoefficient Coeficiente de empuje C_F a presión ambiente.
 * @param efficiency        Corrección empírica η.
 * @param specificHeatRatio γ usado en las relaciones isentrópicas.
 */
@Builder
public record NozzleDesign(
        double throatArea,
        double exitArea,
        double expansionRatio,
        double exitMach,
        double exitPressure,
        double chamberPressure,
        double ambientPressure,
        double thrustCoefficient,
        double efficiency,
        double specificHeatRatio
) {

    public double throatDiameter() {
        return Math.sqrt(4.0 * throatArea / Math.PI);
    }

    public double exitDiameter() {
        return Math.sqrt(4.0 * exitArea / Math.PI);
    }

    /**
     * Relación presión de salida de diseño / presión ambiente. 1 = expansión óptima,
     * &lt; 1 sobreexpandida, &gt; 1 subexpandida.
     */
    public double pressureRatio() {
        return exitPressure / ambientPressure;
    }

    /**
     * Relación presión de salida / presión de cámara (fija para una Ae/At y γ dados).
     */
    public double exitToChamberPressureRatio() {
        return exitPressure / chamberPressure;
    }

    /**
     * Empuje entregado a la presión de cámara de diseño [N]: {@code F = Pc·At·C_F·η}.
     */
    public double designThrust() {
        return chamberPressure * throatArea * thrustCoefficient * efficiency;
    }
}
