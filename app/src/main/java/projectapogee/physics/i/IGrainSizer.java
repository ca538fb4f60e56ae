package projectapogee.physics.i;

import projectapogee.config.DesignConfig;
import projectapogee.domain.design.GrainDesign;
import projectapogee.domain.motor.GrainGeometry;
import projectapogee.domain.motor.NozzleDesign;

/**
 * Dimensionado inverso del grano: a partir de la masa de propelente, la garganta y el tiempo de
 * combustión objetivo obtiene una geometría BATES.
 */
public interface IGrainSizer extends ISolverComponent {

    /**
     * Dimensiona el núcleo para que la combustión simulada dure el tiempo objetivo.
     */
    GrainDesign size(DesignConfig config, NozzleDesign nozzle);

    /**
     * Evalúa una geometría fija (sin dimensionar) con las mismas comprobaciones.
     */
    GrainDesign evaluate(GrainGeometry geometry, DesignConfig config, NozzleDesign nozzle);
}
