package projectapogee.physics.solver;

import projectapogee.domain.exception.InvalidGeometryException;

/**
 * Relaciones de flujo isentrópico cuasi-unidimensional de un gas ideal con γ constante.
 * <p>
 * Todas las funciones son puras. Las presiones se manejan como cocientes adimensionales.
 */
public final class IsentropicFlow {

    private static final double MACH_TOLERANCE = 1e-12;
    private static final int MACH_MAX_ITERATIONS = 200;
    private static final double MACH_CEILING = 100.0;

    /**
     * Prohibido construir esta clase utilidad
     */
    private IsentropicFlow() {
    }

    /**
     * Relación de áreas A/A* para un Mach dado.
     */
    public static double areaRatio(double mach, double gamma) {
        double exponent = (gamma + 1.0) / (2.0 * (gamma - 1.0));
        double term = (2.0 / (gamma + 1.0)) * (1.0 + 0.5 * (gamma - 1.0) * mach * mach);
        return Math.pow(term, exponent) / mach;
    }

    /**
     * Resuelve el Mach de salida de la rama supersónica para una relación de expansión.
     * <p>
     * La relación área-Mach es monótona creciente para M &gt;= 1, así que la raíz se busca con
     * Brent restringido a {@code [1, Mmax]}.
     *
     * @param expansionRatio Ae/At (&gt;= 1).
     * @param gamma          Relación de calores específicos.
     * @return Mach de salida (&gt;= 1).
     * @throws InvalidGeometryException si la relación de expansión no admite solución supersónica real.
     */
    public static double supersonicMachFromAreaRatio(double expansionRatio, double gamma) {
        if (!Double.isFinite(expansionRatio) || expansionRatio < 1.0) {
            throw new InvalidGeometryException(
                    "Relación de expansión sin solución supersónica real (Mach complejo): " + expansionRatio);
        }
        if (expansionRatio == 1.0) {
            return 1.0;
        }
        double upper = 2.0;
        while (areaRatio(upper, gamma) < expansionRatio) {
            upper *= 2.0;
            if (upper > MACH_CEILING) {
                throw new InvalidGeometryException("La relación de expansión exige Mach > " + MACH_CEILING + ": " + expansionRatio);
            }
        }
        RootResult result = ScalarRootFinder.brent(
                m -> areaRatio(m, gamma) - expansionRatio, 1.0, upper, MACH_TOLERANCE, MACH_MAX_ITERATIONS);
        return result.root();
    }

    /**
     * Presión estática / presión de remanso, Pe/Pc, a un Mach dado.
     */
    public static double staticToStagnationPressure(double mach, double gamma) {
        return Math.pow(1.0 + 0.5 * (gamma - 1.0) * mach * mach, -gamma / (gamma - 1.0));
    }

    /**
     * Mach correspondiente a una relación de presiones Pc/Pe (inversa cerrada de la anterior).
     *
     * @throws InvalidGeometryException si Pc/Pe &lt; 1 (no hay expansión posible).
     */
    public static double machFromPressureRatio(double stagnationToStatic, double gamma) {
        if (!(stagnationToStatic >= 1.0)) {
            throw new InvalidGeometryException(
                    "La presión de cámara no supera la de salida, no hay expansión: Pc/Pe=" + stagnationToStatic);
        }
        double term = Math.pow(stagnationToStatic, (gamma - 1.0) / gamma) - 1.0;
        return Math.sqrt(2.0 / (gamma - 1.0) * term);
    }

    /**
     * Coeficiente de empuje ideal C_F.
     * <pre>
     *   C_F = sqrt( 2γ²/(γ-1) · (2/(γ+1))^((γ+1)/(γ-1)) · (1 - (Pe/Pc)^((γ-1)/γ)) ) + (Pe/Pc - Pa/Pc) · ε
     * </pre>
     *
     * @param gamma          Relación de calores específicos.
     * @param expansionRatio Ae/At.
     * @param exitToChamber  Pe/Pc.
     * @param ambientToChamber Pa/Pc.
     */
    public static double thrustCoefficient(double gamma, double expansionRatio, double exitToChamber, double ambientToChamber) {
        double momentum = 2.0 * gamma * gamma / (gamma - 1.0)
                * Math.pow(2.0 / (gamma + 1.0), (gamma + 1.0) / (gamma - 1.0))
                * (1.0 - Math.pow(exitToChamber, (gamma - 1.0) / gamma));
        double pressureTerm = (exitToChamber - ambientToChamber) * expansionRatio;
        return Math.sqrt(momentum) + pressureTerm;
    }
}
