package projectapogee.physics.i;

import projectapogee.domain.motor.MotorSpec;
import projectapogee.domain.motor.NozzleDesign;

/**
 * Dimensionado de la tobera a partir del empuje requerido.
 */
public interface INozzleSolver extends ISolverComponent {

    /**
     * @param requiredThrust  Empuje medio requerido [N].
     * @param motor           Presiones de diseño, γ, relación de expansión y eficiencia.
     * @param ambientPressure Presión ambiente en la plataforma [Pa].
     * @return Geometría de la tobera.
     * @throws projectapogee.domain.exception.InvalidGeometryException si At o Ae no son positivas y finitas.
     */
    NozzleDesign solve(double requiredThrust, MotorSpec motor, double ambientPressure);
}
