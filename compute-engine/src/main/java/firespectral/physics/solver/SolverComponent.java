package firespectral.physics.solver;

/**
 * Pieza intercambiable del motor numérico.
 */
public interface SolverComponent {

    /**
     * Identificador del componente para logs y benchmarks.
     * @return Nombre técnico (ej: "Chebyshev_RCD_FreezeRate", "DOPRI5").
     */
    String getName();
}
