package projectapogee.physics.i;

import projectapogee.config.BallisticsConfig;
import projectapogee.config.IterationLimits;
import projectapogee.config.ToleranceConfig;
import projectapogee.domain.design.BallisticsResult;
import projectapogee.domain.motor.GrainGeometry;
import projectapogee.domain.motor.MotorSpec;
import projectapogee.domain.motor.NozzleDesign;

/**
 * Balística interna: acopla la geometría de combustión con la presión de cámara en el tiempo.
 */
public interface IBallisticsSolver extends ISolverComponent {

    /**
     * Simula la combustión completa del grano hasta agotar el web.
     *
     * @throws projectapogee.domain.exception.OverPressureException si la presión supera el techo del motor.
     */
    BallisticsResult simulate(GrainGeometry grain, NozzleDesign nozzle, MotorSpec motor,
                              BallisticsConfig config, ToleranceConfig tolerance, IterationLimits limits);
}
