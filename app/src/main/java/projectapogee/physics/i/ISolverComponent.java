package projectapogee.physics.i;

/**
 * Contrato base de los componentes numéricos del motor de diseño.
 * Permite identificar cada solver en los logs y en los informes de diseño.
 */
public interface ISolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "Dormand-Prince 5(4)", "Brent").
     */
    String getName();

    /**
     * Descripción técnica del método numérico.
     */
    default String getDescription() {
        return getName();
    }
}
