package projectapogee.domain.motor;

import lombok.Builder;
import lombok.With;
import projectapogee.domain.exception.InvalidInputException;

/**
 * Un objeto de valor inmutable con todos los parámetros del motor de propelente sólido:
 * química del propelente, ley de velocidad de combustión, límites de la cámara y de la tobera.
 * <p>
 * Ley empírica de combustión (Saint-Robert / Vieille): {@code r = a · Pc^n}, con {@code r} en m/s y
 * {@code Pc} expresada en <b>MPa</b>, que es como se publican los coeficientes del KNSB.
 *
 * @param propellantDensity        Densidad del propelente [kg/m³].
 * @param burnRateCoefficient      Coeficiente {@code a} de la ley de combustión [m/s por MPa^n].
 * @param burnRateExponent         Exponente {@code n} de presión (0 &lt; n &lt; 1, régimen estable).
 * @param characteristicVelocity   Velocidad característica c* de los gases [m/s].
 * @param specificHeatRatio        Relación de calores específicos γ de los gases de combustión.
 * @param burnTime                 Duración de combustión objetivo [s].
 * @param maxChamberPressure       Presión máxima de operación esperada (MEOP) [Pa]. Techo de sobrepresión.
 * @param averageToMaxPressureRatio Fracción de la presión máxima que se toma como presión media de diseño.
 * @param expansionRatio           Relación de expansión Ae/At. Si es &lt;= 0 la tobera se diseña para expansión óptima.
 * @param nozzleEfficiency         Corrección empírica η aplicada al empuje ideal (0 &lt; η &lt;= 1).
 * @param dischargeCoefficient     Coeficiente de descarga de la garganta (gasto real / ideal).
 * @param chamberInnerDiameter     Diámetro interior de la cámara [m].
 * @param linerThickness           Espesor del tubo de cartón (liner) entre grano y cámara [m].
 * @param chamberVolume            Volumen interior útil de la cámara [m³].
 * @param segmentCount             Número de segmentos BATES.
 * @param exposedEndFaces          Caras extremas expuestas por segmento (0, 1 o 2).
 */
@Builder
@With
public record MotorSpec(
        // --- Propelente ---
        double propellantDensity,
        double burnRateCoefficient,
        double burnRateExponent,
        double characteristicVelocity,
        double specificHeatRatio,

        // --- Objetivos de combustión ---
        double burnTime,
        double maxChamberPressure,
        double averageToMaxPressureRatio,

        // --- Tobera ---
        double expansionRatio,
        double nozzleEfficiency,
        double dischargeCoefficient,

        // --- Cámara y grano ---
        double chamberInnerDiameter,
        double linerThickness,
        double chamberVolume,
        int segmentCount,
        int exposedEndFaces
) {

    private static final double PASCALS_PER_MEGAPASCAL = 1.0e6;

    /**
     * Presión media de cámara de diseño [Pa].
     */
    public double designChamberPressure() {
        return maxChamberPressure * averageToMaxPressureRatio;
    }

    /**
     * Velocidad de regresión de la superficie para una presión de cámara dada.
     *
     * @param chamberPressure Presión de cámara [Pa].
     * @return Velocidad de combustión [m/s].
     */
    public double burnRate(double chamberPressure) {
        if (chamberPressure <= 0) {
            return 0.0;
        }
        return burnRateCoefficient * Math.pow(chamberPressure / PASCALS_PER_MEGAPASCAL, burnRateExponent);
    }

    /**
     * Diámetro exterior del grano: cámara menos dos espesores de liner [m].
     */
    public double grainOuterDiameter() {
        return chamberInnerDiameter - 2.0 * linerThickness;
    }

    /**
     * Producto R·T de los gases de cámara deducido de c* y γ [J/kg].
     * <p>
     * {@code c* = sqrt(R·T) / Γ}, con {@code Γ = sqrt(γ)·(2/(γ+1))^((γ+1)/(2(γ-1)))}.
     */
    public double gasConstantTemperature() {
        double g = specificHeatRatio;
        double vandenkerckhove = Math.sqrt(g) * Math.pow(2.0 / (g + 1.0), (g + 1.0) / (2.0 * (g - 1.0)));
        double cStarGamma = characteristicVelocity * vandenkerckhove;
        return cStarGamma * cStarGamma;
    }

    /**
     * Comprueba los invariantes de la especificación del motor.
     *
     * @throws InvalidInputException si alguna constante no es física.
     */
    public void validate() {
        requirePositive(propellantDensity, "La densidad del propelente");
        requirePositive(burnRateCoefficient, "El coeficiente de combustión a");
        if (!(burnRateExponent > 0 && burnRateExponent < 1)) {
            throw new InvalidInputException("El exponente de combustión n debe estar en (0, 1): " + burnRateExponent);
        }
        requirePositive(characteristicVelocity, "La velocidad característica c*");
        if (!(specificHeatRatio > 1.0) || !Double.isFinite(specificHeatRatio)) {
            throw new InvalidInputException("La relación de calores específicos debe ser > 1: " + specificHeatRatio);
        }
        requirePositive(burnTime, "El tiempo de combustión");
        requirePositive(maxChamberPressure, "La presión máxima de cámara");
        if (!(averageToMaxPressureRatio > 0 && averageToMaxPressureRatio <= 1)) {
            throw new InvalidInputException("La relación presión media / máxima debe estar en (0, 1]: " + averageToMaxPressureRatio);
        }
        if (!Double.isFinite(expansionRatio) || (expansionRatio > 0 && expansionRatio < 1)) {
            throw new InvalidInputException("La relación de expansión debe ser >= 1 (o <= 0 para expansión óptima): " + expansionRatio);
        }
        if (!(nozzleEfficiency > 0 && nozzleEfficiency <= 1)) {
            throw new InvalidInputException("La eficiencia de tobera debe estar en (0, 1]: " + nozzleEfficiency);
        }
        if (!(dischargeCoefficient > 0 && dischargeCoefficient <= 1)) {
            throw new InvalidInputException("El coeficiente de descarga debe estar en (0, 1]: " + dischargeCoefficient);
        }
        requirePositive(chamberInnerDiameter, "El diámetro interior de cámara");
        if (!Double.isFinite(linerThickness) || linerThickness < 0) {
            throw new InvalidInputException("El espesor del liner debe ser >= 0: " + linerThickness);
        }
        requirePositive(chamberVolume, "El volumen de cámara");
        if (segmentCount < 1) {
            throw new InvalidInputException("Se necesita al menos un segmento: " + segmentCount);
        }
        if (exposedEndFaces < 0 || exposedEndFaces > 2) {
            throw new InvalidInputException("Las caras extremas expuestas deben ser 0, 1 o 2: " + exposedEndFaces);
        }
    }

    private static void requirePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new InvalidInputException(name + " debe ser positiva y finita: " + value);
        }
    }

    /**
     * Motor KNSB de referencia (valores típicos de Richard Nakka, Experimental Rocketry).
     * Cámara de 57 mm con liner de 1.5 mm y dos segmentos BATES con ambas caras libres.
     */
    public static MotorSpec knsb() {
        return MotorSpec.builder()
                .propellantDensity(1641.0)
                .burnRateCoefficient(8.26e-3)
                .burnRateExponent(0.319)
                .characteristicVelocity(895.0)
                .specificHeatRatio(1.226)
                .burnTime(2.0)
                .maxChamberPressure(3.0e6)
                .averageToMaxPressureRatio(0.615)
                .expansionRatio(7.414)
                .nozzleEfficiency(0.92)
                .dischargeCoefficient(0.98)
                .chamberInnerDiameter(0.057)
                .linerThickness(0.0015)
                .chamberVolume(5.1e-4)
                .segmentCount(2)
                .exposedEndFaces(2)
                .build();
    }
}
