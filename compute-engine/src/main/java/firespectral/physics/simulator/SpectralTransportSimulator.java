package firespectral.physics.simulator;

import firespectral.config.SolverConfig;
import firespectral.config.SolverConfig.BoundaryMode;
import firespectral.domain.simulation.Trajectory;
import firespectral.domain.simulation.TransportCoefficients;
import firespectral.domain.spectral.SpectralGrid;
import firespectral.exception.IntegrationFailureException;
import firespectral.physics.solver.OdeIntegrationException;
import firespectral.physics.solver.OdeIntegrator;
import firespectral.physics.solver.RhsAssembler;
import firespectral.physics.solver.impl.DormandPrinceIntegrator;
import firespectral.physics.solver.impl.RhsOdeSystem;
import firespectral.physics.solver.impl.SpectralRhsAssembler;
import firespectral.utils.MatrixChecks;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Avanza en el tiempo la ecuación semidiscretizada sobre una malla espectral fija.
 * <p>
 * Construye la malla temporal uniforme {@code t_k = k·dt}, k = 0..T-1, y delega el avance
 * en un integrador adaptativo: {@code dt} y {@code T} definen solo los instantes de reporte,
 * no el paso interno. Cada llamada crea su propio ensamblador (con sus buffers), así que una
 * misma instancia puede atender experimentos concurrentes sobre la misma malla.
 */
@Slf4j
public class SpectralTransportSimulator {

    @Getter
    private final SpectralGrid grid;
    @Getter
    private final SolverConfig solverConfig;
    private final OdeIntegrator integrator;

    public SpectralTransportSimulator(SpectralGrid grid) {
        this(grid, SolverConfig.defaults());
    }

    public SpectralTransportSimulator(SpectralGrid grid, SolverConfig solverConfig) {
        this(grid, solverConfig, new DormandPrinceIntegrator(solverConfig));
    }

    public SpectralTransportSimulator(SpectralGrid grid, SolverConfig solverConfig, OdeIntegrator integrator) {
        this.grid = Objects.requireNonNull(grid, "La malla no puede ser nula.");
        this.solverConfig = Objects.requireNonNull(solverConfig, "La configuración del solver no puede ser nula.");
        this.integrator = Objects.requireNonNull(integrator, "El integrador no puede ser nulo.");
    }

    /**
     * Integra con la política de frontera de la configuración. En modo DIRICHLET el valor
     * de frontera es el borde de la propia condición inicial.
     *
     * @param diffusivity Constante de difusión μ.
     * @param deltaTime   Separación de los instantes de reporte dt.
     * @param timeSteps   Número de instantes de reporte T (al menos 1).
     * @param reaction    Tasa de reacción A.
     * @param velocityX   Velocidad V1.
     * @param velocityY   Velocidad V2.
     * @param initial     Condición inicial W0.
     * @return T instantes y T instantáneas con la forma de W0.
     * @throws firespectral.exception.ShapeMismatchException si algún campo no tiene la forma de la malla.
     * @throws IntegrationFailureException si el integrador no alcanza el horizonte.
     */
    public Trajectory integrate(double diffusivity, double deltaTime, int timeSteps,
                                DMatrixRMaj reaction, DMatrixRMaj velocityX, DMatrixRMaj velocityY,
                                DMatrixRMaj initial) {
        return integrate(diffusivity, deltaTime, timeSteps, reaction, velocityX, velocityY, initial, initial);
    }

    /**
     * Variante con valores de frontera explícitos, usados solo en modo DIRICHLET.
     */
    public Trajectory integrate(double diffusivity, double deltaTime, int timeSteps,
                                DMatrixRMaj reaction, DMatrixRMaj velocityX, DMatrixRMaj velocityY,
                                DMatrixRMaj initial, DMatrixRMaj boundaryValues) {
        validateTemporalParameters(deltaTime, timeSteps);
        int rows = grid.rows();
        int cols = grid.cols();
        MatrixChecks.requireShape(reaction, rows, cols, "A");
        MatrixChecks.requireShape(velocityX, rows, cols, "V1");
        MatrixChecks.requireShape(velocityY, rows, cols, "V2");
        MatrixChecks.requireShape(initial, rows, cols, "W0");

        TransportCoefficients coefficients = new TransportCoefficients(diffusivity, reaction, velocityX, velocityY);
        return integrate(coefficients, deltaTime, timeSteps, initial, boundaryValues);
    }

    /**
     * Integra con coeficientes ya agrupados.
     * {@code boundaryValues} solo se lee en modo DIRICHLET y puede ser nulo en otro caso.
     */
    public Trajectory integrate(TransportCoefficients coefficients, double deltaTime, int timeSteps,
                                DMatrixRMaj initial, DMatrixRMaj boundaryValues) {
        Objects.requireNonNull(coefficients, "Los coeficientes no pueden ser nulos.");
        validateTemporalParameters(deltaTime, timeSteps);
        int rows = grid.rows();
        int cols = grid.cols();
        MatrixChecks.requireShape(coefficients.reaction(), rows, cols, "A");
        MatrixChecks.requireShape(initial, rows, cols, "W0");

        BoundaryMode mode = solverConfig.boundaryMode();
        DMatrixRMaj start = initial.copy();
        DMatrixRMaj boundary = null;
        if (mode == BoundaryMode.DIRICHLET) {
            boundary = MatrixChecks.requireShape(boundaryValues, rows, cols, "frontera");
            SpectralRhsAssembler.overwriteBoundary(start, boundary);
        }

        RhsAssembler assembler = new SpectralRhsAssembler(grid, coefficients, mode, boundary);
        double[] times = buildTimeGrid(deltaTime, timeSteps);

        log.info("Integrando {}x{} nodos: μ={}, dt={}, T={} ({} + {})",
                rows, cols, coefficients.diffusivity(), deltaTime, timeSteps, assembler.getName(), integrator.getName());

        try {
            OdeIntegrator.Solution solution = integrator.integrate(new RhsOdeSystem(assembler, rows, cols), start.data, times);
            Trajectory trajectory = new Trajectory(times, toMatrices(solution.states(), rows, cols), solution.statistics());
            log.info("Integración completada hasta t={}: {} pasos aceptados, {} rechazados, {} evaluaciones del RHS",
                    times[times.length - 1], solution.statistics().acceptedSteps(),
                    solution.statistics().rejectedSteps(), solution.statistics().derivativeEvaluations());
            return trajectory;
        } catch (OdeIntegrationException e) {
            int completed = e.getCompletedCount();
            double[] partialTimes = new double[completed];
            System.arraycopy(times, 0, partialTimes, 0, completed);
            Trajectory partial = new Trajectory(partialTimes,
                    toMatrices(e.getCompletedStates(), rows, cols), e.getStatistics());
            log.error("La integración falló en t={} tras {} de {} instantes de reporte", e.getLastTime(), completed, timeSteps);
            throw new IntegrationFailureException(
                    "La integración no alcanzó t=" + times[times.length - 1] + ": " + e.getMessage(),
                    e.getLastTime(), partial, e);
        }
    }

    /**
     * Malla temporal uniforme de T instantes separados dt, empezando en 0.
     */
    static double[] buildTimeGrid(double deltaTime, int timeSteps) {
        double[] times = new double[timeSteps];
        for (int k = 0; k < timeSteps; k++) {
            times[k] = k * deltaTime;
        }
        return times;
    }

    private static List<DMatrixRMaj> toMatrices(double[][] states, int rows, int cols) {
        List<DMatrixRMaj> matrices = new ArrayList<>(states.length);
        for (double[] state : states) {
            matrices.add(DMatrixRMaj.wrap(rows, cols, state));
        }
        return matrices;
    }

    private static void validateTemporalParameters(double deltaTime, int timeSteps) {
        if (!(deltaTime > 0.0) || Double.isInfinite(deltaTime)) {
            throw new IllegalArgumentException("El paso de tiempo dt debe ser positivo y finito: " + deltaTime);
        }
        if (timeSteps < 1) {
            throw new IllegalArgumentException("Se necesita al menos un instante de reporte (T >= 1): " + timeSteps);
        }
    }
}
