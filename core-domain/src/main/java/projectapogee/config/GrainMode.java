package projectapogee.config;

/**
 * Cómo se obtiene la geometría del grano.
 */
public enum GrainMode {
    /**
     * Se dimensiona el núcleo para cumplir el tiempo de combustión objetivo.
     */
    SIZE_FROM_TARGET,
    /**
     * Se usa la geometría suministrada tal cual y sólo se simula.
     */
    FIXED
}
