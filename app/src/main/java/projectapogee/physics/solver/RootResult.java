package projectapogee.physics.solver;

/**
 * Resultado de un buscador de raíces escalar.
 *
 * @param root       Mejor aproximación de la raíz.
 * @param residual   f(root).
 * @param iterations Iteraciones consumidas.
 * @param converged  {@code true} si se alcanzó la tolerancia antes del tope de iteraciones.
 */
public record RootResult(double root, double residual, int iterations, boolean converged) {
}
