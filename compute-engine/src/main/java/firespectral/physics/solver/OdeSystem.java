package firespectral.physics.solver;

/**
 * Sistema de EDOs {@code y' = f(t, y)} sobre un vector plano de estado.
 */
public interface OdeSystem {

    /**
     * Dimensión del vector de estado.
     */
    int getDimension();

    /**
     * Evalúa f(t, y).
     *
     * @param time  Tiempo actual.
     * @param state Vector de estado (no se modifica).
     * @param rate  Destino de la derivada, misma longitud que {@code state}.
     */
    void computeDerivatives(double time, double[] state, double[] rate);
}
