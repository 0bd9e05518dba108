package firespectral.physics.simulator;

import firespectral.config.ExperimentConfig;
import firespectral.config.SolverConfig;
import firespectral.domain.simulation.ExperimentResult;
import firespectral.domain.spectral.SpectralGrid;
import firespectral.exception.InvalidDimensionException;
import firespectral.exception.ShapeMismatchException;
import firespectral.physics.model.GaussianBumpField;
import firespectral.physics.model.GaussianMixtureField;
import firespectral.physics.model.ScalarField;
import firespectral.physics.model.SinusoidalWindField;
import firespectral.physics.model.VectorField;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Test unitario para ExperimentRunner.
 * Verifica la caché de mallas, el muestreo único de los campos y la propagación de errores.
 */
@Slf4j
@ExtendWith(MockitoExtension.class)
class ExperimentRunnerTest {

    @Mock
    private ScalarField mockReaction;

    @Mock
    private ScalarField mockBoundary;

    private ExperimentRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ExperimentRunner();
    }

    private static ExperimentConfig.ExperimentConfigBuilder baseConfig(int resolution) {
        return ExperimentConfig.builder()
                .resolution(resolution)
                .diffusivity(0.5)
                .deltaTime(0.01)
                .timeSteps(3)
                .reactionField(ScalarField.zero())
                .velocityField(VectorField.zero())
                .initialCondition(new GaussianBumpField(10.0, 0.0, 0.0, 5.0));
    }

    @Test
    @DisplayName("Caché: la misma resolución devuelve la misma malla")
    void getGrid_shouldReuseGridPerResolution() {
        SpectralGrid first = runner.getGrid(6);
        SpectralGrid second = runner.getGrid(6);
        SpectralGrid other = runner.getGrid(7);

        assertSame(first, second);
        assertNotSame(first, other);
        assertEquals(8, other.rows());
    }

    @Test
    @DisplayName("Experimento completo: incendio sobre combustible aleatorio con viento sinusoidal")
    void run_realisticExperiment_shouldProduceFullTrajectory() {
        ExperimentConfig config = baseConfig(10)
                .reactionField(GaussianMixtureField.random(4, 7L, 2.0, 6.0))
                .velocityField(SinusoidalWindField.builder()
                        .amplitudeX(0.5)
                        .amplitudeY(0.5)
                        .angularFrequency(Math.PI)
                        .build())
                .timeSteps(6)
                .build();

        ExperimentResult result = runner.run(config);

        log.info("Experimento completado en {}ms: {}", result.elapsedMillis(), result.trajectory().getStatistics());
        assertEquals(6, result.trajectory().getTimestepCount());
        assertSame(runner.getGrid(10), result.grid());
        assertTrue(MatrixFeatures_DDRM.isIdentical(result.initialState(), result.trajectory().getStateAt(0), 0.0));
        assertThat(result.trajectory().getStatistics().acceptedSteps()).isPositive();
        assertThat(result.elapsedMillis()).isGreaterThanOrEqualTo(0L);
    }

    @Test
    @DisplayName("Muestreo único: cada campo se evalúa exactamente una vez por experimento")
    void run_shouldSampleEveryFieldOnce() {
        SpectralGrid grid = runner.getGrid(4);
        when(mockReaction.sample(any(), any())).thenAnswer(inv -> new DMatrixRMaj(grid.rows(), grid.cols()));

        runner.run(baseConfig(4).reactionField(mockReaction).build());

        verify(mockReaction, times(1)).sample(any(), any());
    }

    @Test
    @DisplayName("Frontera congelada: el campo de frontera no se evalúa fuera del modo Dirichlet")
    void run_freezeRateMode_shouldNotSampleBoundaryField() {
        // ARRANGE
        ExperimentConfig config = baseConfig(4).boundaryField(mockBoundary).build();

        // ACT
        ExperimentResult result = runner.run(config);

        // ASSERT
        assertEquals(3, result.trajectory().getTimestepCount());
        verifyNoInteractions(mockBoundary);
    }

    @Test
    @DisplayName("Dirichlet: el campo de frontera se evalúa exactamente una vez")
    void run_dirichletMode_shouldSampleBoundaryFieldOnce() {
        // ARRANGE
        SpectralGrid grid = runner.getGrid(4);
        when(mockBoundary.sample(any(), any())).thenAnswer(inv -> {
            DMatrixRMaj values = new DMatrixRMaj(grid.rows(), grid.cols());
            values.fill(3.0);
            return values;
        });
        ExperimentConfig config = baseConfig(4)
                .boundaryField(mockBoundary)
                .solverConfig(SolverConfig.builder().boundaryMode(SolverConfig.BoundaryMode.DIRICHLET).build())
                .build();

        // ACT
        ExperimentResult result = runner.run(config);

        // ASSERT
        verify(mockBoundary, times(1)).sample(any(), any());
        assertEquals(3.0, result.trajectory().getFinalState().orElseThrow().get(0, 2), 0.0);
    }

    @Test
    @DisplayName("Aislamiento: un campo que altera las coordenadas no corrompe la malla compartida")
    void run_fieldMutatingCoordinates_shouldNotAffectCachedGrid() {
        SpectralGrid grid = runner.getGrid(4);
        DMatrixRMaj originalX = grid.x().copy();
        ScalarField vandal = (x, y) -> {
            x.fill(42.0);
            return new DMatrixRMaj(x.getNumRows(), x.getNumCols());
        };

        runner.run(baseConfig(4).reactionField(vandal).build());

        assertTrue(MatrixFeatures_DDRM.isIdentical(originalX, runner.getGrid(4).x(), 0.0));
    }

    @Test
    @DisplayName("Forma: un campo que devuelve otra forma aborta el experimento")
    void run_fieldWithWrongShape_shouldThrow() {
        ScalarField wrong = (x, y) -> new DMatrixRMaj(2, 3);

        ShapeMismatchException ex = assertThrows(ShapeMismatchException.class,
                () -> runner.run(baseConfig(5).initialCondition(wrong).build()));
        log.info("Mensaje: {}", ex.getMessage());
    }

    @Test
    @DisplayName("Resolución negativa: InvalidDimensionException")
    void run_negativeResolution_shouldThrow() {
        assertThrows(InvalidDimensionException.class, () -> runner.run(baseConfig(-1).build()));
    }

    @Test
    @DisplayName("N=0: un único nodo de frontera que nunca evoluciona")
    void run_zeroResolution_shouldKeepSingleNodeConstant() {
        ExperimentResult result = runner.run(baseConfig(0).build());

        assertEquals(3, result.trajectory().getTimestepCount());
        for (int k = 0; k < 3; k++) {
            DMatrixRMaj state = result.trajectory().getStateAt(k);
            assertEquals(1, state.getNumElements());
            assertEquals(result.initialState().get(0, 0), state.get(0, 0), 0.0);
        }
    }

    @Test
    @DisplayName("Dirichlet: el campo de frontera del experimento fija el borde")
    void run_dirichletExperiment_shouldUseBoundaryField() {
        ExperimentConfig config = baseConfig(6)
                .boundaryField(ScalarField.constant(2.0))
                .solverConfig(SolverConfig.builder().boundaryMode(SolverConfig.BoundaryMode.DIRICHLET).build())
                .build();

        ExperimentResult result = runner.run(config);

        DMatrixRMaj last = result.trajectory().getFinalState().orElseThrow();
        assertEquals(2.0, last.get(0, 0), 0.0);
        assertEquals(2.0, last.get(6, 3), 0.0);
        assertEquals(2.0, last.get(3, 0), 0.0);
    }
}
