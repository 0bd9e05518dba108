package firespectral.physics.simulator;

import firespectral.config.ExperimentConfig;
import firespectral.config.SolverConfig.BoundaryMode;
import firespectral.domain.simulation.ExperimentResult;
import firespectral.domain.simulation.Trajectory;
import firespectral.domain.simulation.TransportCoefficients;
import firespectral.domain.spectral.SpectralGrid;
import firespectral.factory.SpectralGridFactory;
import firespectral.physics.model.ScalarField;
import firespectral.utils.MatrixChecks;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Orquestador de experimentos.
 * <p>
 * Responsabilidades:
 * 1. Construir (una vez por resolución) la malla y los operadores espectrales, compartidos
 *    en solo lectura entre todos los experimentos.
 * 2. Muestrear A, V1, V2, W0 (y f en modo DIRICHLET) exactamente una vez por experimento.
 * 3. Lanzar la integración y medir el tiempo de pared.
 * <p>
 * Es seguro lanzar experimentos concurrentes: la caché de mallas es concurrente y cada
 * integración trabaja con su propio ensamblador.
 */
@Slf4j
public class ExperimentRunner {

    private final Map<Integer, SpectralGrid> gridCache = new ConcurrentHashMap<>();

    /**
     * Ejecuta el experimento completo.
     *
     * @param config Parámetros del experimento.
     * @return La trayectoria junto con la malla y los coeficientes muestreados.
     * @throws firespectral.exception.InvalidDimensionException si la resolución es negativa.
     * @throws firespectral.exception.ShapeMismatchException si un campo devuelve una forma distinta a la malla.
     * @throws firespectral.exception.IntegrationFailureException si la integración no llega al horizonte.
     */
    public ExperimentResult run(ExperimentConfig config) {
        Objects.requireNonNull(config, "La configuración del experimento no puede ser nula.");
        long start = System.currentTimeMillis();

        SpectralGrid grid = getGrid(config.getResolution());
        if (config.getResolution() == 0) {
            log.warn("Resolución N=0: un único nodo de frontera, el estado no evoluciona.");
        }

        TransportCoefficients coefficients = TransportCoefficients.builder()
                .diffusivity(config.getDiffusivity())
                .reaction(sample(config.getReactionField(), grid, "A"))
                .velocityX(sample(config.getVelocityFieldX(), grid, "V1"))
                .velocityY(sample(config.getVelocityFieldY(), grid, "V2"))
                .build();
        DMatrixRMaj initialState = sample(config.getInitialCondition(), grid, "W0");
        DMatrixRMaj boundaryValues = config.getSolverConfig().boundaryMode() == BoundaryMode.DIRICHLET
                ? sample(config.getBoundaryField(), grid, "frontera")
                : null;

        SpectralTransportSimulator simulator = new SpectralTransportSimulator(grid, config.getSolverConfig());
        Trajectory trajectory = simulator.integrate(coefficients, config.getDeltaTime(), config.getTimeSteps(),
                initialState, boundaryValues);

        long elapsed = System.currentTimeMillis() - start;
        log.info("Experimento finalizado (N={}, T={}). Tiempo de cómputo: {}ms",
                config.getResolution(), config.getTimeSteps(), elapsed);

        return ExperimentResult.builder()
                .config(config)
                .grid(grid)
                .coefficients(coefficients)
                .initialState(initialState)
                .trajectory(trajectory)
                .elapsedMillis(elapsed)
                .build();
    }

    /**
     * Malla cuadrada de resolución N, construida la primera vez y reutilizada después.
     */
    public SpectralGrid getGrid(int resolution) {
        return gridCache.computeIfAbsent(resolution, SpectralGridFactory::createSquareGrid);
    }

    /**
     * Muestrea un campo. La malla entrega copias de X e Y, así que el evaluador no puede
     * alterar la malla compartida.
     */
    private static DMatrixRMaj sample(ScalarField field, SpectralGrid grid, String operand) {
        Objects.requireNonNull(field, "El campo '" + operand + "' no puede ser nulo.");
        DMatrixRMaj values = field.sample(grid.x(), grid.y());
        return MatrixChecks.requireShape(values, grid.rows(), grid.cols(), operand);
    }
}
