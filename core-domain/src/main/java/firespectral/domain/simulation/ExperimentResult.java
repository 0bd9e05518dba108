package firespectral.domain.simulation;

import firespectral.config.ExperimentConfig;
import firespectral.domain.spectral.SpectralGrid;
import lombok.Builder;
import org.ejml.data.DMatrixRMaj;

import java.util.Objects;

/**
 * Resultado completo de un experimento: la trayectoria más todo lo necesario para
 * visualizarla (malla, coeficientes muestreados y la configuración original con sus campos).
 *
 * @param config         Configuración con la que se lanzó el experimento.
 * @param grid           Malla compartida sobre la que se muestrearon los campos.
 * @param coefficients   Coeficientes A, V1, V2 y μ tal como entraron al integrador.
 * @param initialState   Condición inicial muestreada (antes de aplicar la política de frontera).
 * @param trajectory     Instantes y estados devueltos por el integrador.
 * @param elapsedMillis  Tiempo de pared del experimento completo.
 */
@Builder
public record ExperimentResult(
        ExperimentConfig config,
        SpectralGrid grid,
        TransportCoefficients coefficients,
        DMatrixRMaj initialState,
        Trajectory trajectory,
        long elapsedMillis
) {
    public ExperimentResult {
        Objects.requireNonNull(config, "La configuración no puede ser nula.");
        Objects.requireNonNull(grid, "La malla no puede ser nula.");
        Objects.requireNonNull(coefficients, "Los coeficientes no pueden ser nulos.");
        Objects.requireNonNull(trajectory, "La trayectoria no puede ser nula.");
        initialState = Objects.requireNonNull(initialState, "La condición inicial no puede ser nula.").copy();
    }
}
