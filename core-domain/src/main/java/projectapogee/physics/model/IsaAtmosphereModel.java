package projectapogee.physics.model;

import projectapogee.domain.flight.AtmosphereProperties;

/**
 * Atmósfera Estándar Internacional (ISA) por capas hasta 47 km.
 * <p>
 * Capas: troposfera (gradiente -6.5 K/km), tropopausa isoterma (11-20 km) y dos capas de
 * estratosfera con gradiente positivo (20-32 km, 32-47 km). La temperatura y presión de la base
 * de cada capa se calculan en el constructor a partir de la capa inferior, por lo que densidad y
 * presión son continuas en las fronteras.
 * <p>
 * Por debajo del nivel del mar la altitud se satura a 0. Por encima de 47 km se extrapola la ley
 * de la última capa (aproximación documentada, no un error).
 */
public class IsaAtmosphereModel implements AtmosphereModel {

    public static final double SEA_LEVEL_TEMPERATURE = 288.15;
    public static final double SEA_LEVEL_PRESSURE = 101_325.0;
    public static final double GAS_CONSTANT_AIR = 287.05;
    public static final double STANDARD_GRAVITY = 9.80665;
    private static final double GAMMA_AIR = 1.4;

    private static final double[] LAYER_BASE_ALTITUDES = {0.0, 11_000.0, 20_000.0, 32_000.0};
    private static final double[] LAYER_LAPSE_RATES = {-0.0065, 0.0, 0.001, 0.0028};

    private final double[] baseTemperatures = new double[LAYER_BASE_ALTITUDES.length];
    private final double[] basePressures = new double[LAYER_BASE_ALTITUDES.length];

    public IsaAtmosphereModel() {
        baseTemperatures[0] = SEA_LEVEL_TEMPERATURE;
        basePressures[0] = SEA_LEVEL_PRESSURE;
        for (int i = 1; i < LAYER_BASE_ALTITUDES.length; i++) {
            double dh = LAYER_BASE_ALTITUDES[i] - LAYER_BASE_ALTITUDES[i - 1];
            baseTemperatures[i] = baseTemperatures[i - 1] + LAYER_LAPSE_RATES[i - 1] * dh;
            basePressures[i] = pressureInLayer(i - 1, LAYER_BASE_ALTITUDES[i]);
        }
    }

    @Override
    public AtmosphereProperties properties(double altitude) {
        double h = Math.max(0.0, altitude);
        int layer = layerIndex(h);
        double temperature = temperatureInLayer(layer, h);
        double pressure = pressureInLayer(layer, h);
        double density = pressure / (GAS_CONSTANT_AIR * temperature);
        double speedOfSound = Math.sqrt(GAMMA_AIR * GAS_CONSTANT_AIR * temperature);
        return new AtmosphereProperties(density, pressure, temperature, speedOfSound);
    }

    /**
     * Propiedades calculadas forzando una capa concreta. Permite evaluar una frontera
     * "desde abajo" y "desde arriba" para verificar la continuidad.
     */
    public AtmosphereProperties propertiesInLayer(int layer, double altitude) {
        double temperature = temperatureInLayer(layer, altitude);
        double pressure = pressureInLayer(layer, altitude);
        double density = pressure / (GAS_CONSTANT_AIR * temperature);
        return new AtmosphereProperties(density, pressure, temperature, Math.sqrt(GAMMA_AIR * GAS_CONSTANT_AIR * temperature));
    }

    public static int layerCount() {
        return LAYER_BASE_ALTITUDES.length;
    }

    public static double layerBaseAltitude(int layer) {
        return LAYER_BASE_ALTITUDES[layer];
    }

    private static int layerIndex(double altitude) {
        int layer = 0;
        for (int i = 1; i < LAYER_BASE_ALTITUDES.length; i++) {
            if (altitude >= LAYER_BASE_ALTITUDES[i]) {
                layer = i;
            }
        }
        return layer;
    }

    private double temperatureInLayer(int layer, double altitude) {
        return baseTemperatures[layer] + LAYER_LAPSE_RATES[layer] * (altitude - LAYER_BASE_ALTITUDES[layer]);
    }

    private double pressureInLayer(int layer, double altitude) {
        double baseT = baseTemperatures[layer];
        double baseP = basePressures[layer];
        double lapse = LAYER_LAPSE_RATES[layer];
        double dh = altitude - LAYER_BASE_ALTITUDES[layer];
        if (lapse == 0.0) {
            // Capa isoterma: decaimiento exponencial
            return baseP * Math.exp(-STANDARD_GRAVITY * dh / (GAS_CONSTANT_AIR * baseT));
        }
        double temperature = baseT + lapse * dh;
        return baseP * Math.pow(temperature / baseT, -STANDARD_GRAVITY / (lapse * GAS_CONSTANT_AIR));
    }
}
