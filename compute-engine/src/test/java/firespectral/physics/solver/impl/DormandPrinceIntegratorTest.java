package firespectral.physics.solver.impl;

import firespectral.config.SolverConfig;
import firespectral.domain.simulation.IntegrationStatistics;
import firespectral.physics.solver.OdeIntegrationException;
import firespectral.physics.solver.OdeIntegrator.Solution;
import firespectral.physics.solver.OdeSystem;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleUnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class DormandPrinceIntegratorTest {

    private DormandPrinceIntegrator integrator;

    @BeforeEach
    void setUp() {
        integrator = new DormandPrinceIntegrator(SolverConfig.builder()
                .relativeTolerance(1e-9)
                .absoluteTolerance(1e-12)
                .build());
    }

    /**
     * Sistema escalar y' = f(y) a partir de una lambda.
     */
    private static OdeSystem scalar(DoubleUnaryOperator f) {
        return new OdeSystem() {
            @Override
            public int getDimension() {
                return 1;
            }

            @Override
            public void computeDerivatives(double time, double[] state, double[] rate) {
                rate[0] = f.applyAsDouble(state[0]);
            }
        };
    }

    @Test
    @DisplayName("Decaimiento exponencial: y' = -y coincide con e^-t en cada instante de reporte")
    void integrate_exponentialDecay_shouldMatchAnalyticSolution() {
        double[] times = {0.0, 0.5, 1.0, 2.0, 5.0};

        Solution solution = integrator.integrate(scalar(y -> -y), new double[]{1.0}, times);

        assertEquals(times.length, solution.states().length);
        for (int k = 0; k < times.length; k++) {
            assertEquals(Math.exp(-times[k]), solution.states()[k][0], 1e-8, "t=" + times[k]);
        }
        log.info("Estadísticas: {}", solution.statistics());
        assertThat(solution.statistics().acceptedSteps()).isPositive();
    }

    @Test
    @DisplayName("Oscilador armónico: conserva la energía y la fase tras un periodo")
    void integrate_harmonicOscillator_shouldReturnToInitialState() {
        OdeSystem oscillator = new OdeSystem() {
            @Override
            public int getDimension() {
                return 2;
            }

            @Override
            public void computeDerivatives(double time, double[] state, double[] rate) {
                rate[0] = state[1];
                rate[1] = -state[0];
            }
        };
        double period = 2.0 * Math.PI;

        Solution solution = integrator.integrate(oscillator, new double[]{1.0, 0.0},
                new double[]{0.0, period / 4.0, period});

        assertEquals(0.0, solution.states()[1][0], 1e-7);
        assertEquals(-1.0, solution.states()[1][1], 1e-7);
        assertEquals(1.0, solution.states()[2][0], 1e-7);
        assertEquals(0.0, solution.states()[2][1], 1e-7);
    }

    @Test
    @DisplayName("Instante único: devuelve una copia del estado inicial sin integrar")
    void integrate_singleOutputTime_shouldReturnInitialCopy() {
        double[] initial = {3.0, 4.0};
        OdeSystem never = new OdeSystem() {
            @Override
            public int getDimension() {
                return 2;
            }

            @Override
            public void computeDerivatives(double time, double[] state, double[] rate) {
                fail("No debería evaluarse la derivada");
            }
        };

        Solution solution = integrator.integrate(never, initial, new double[]{0.0});

        assertArrayEquals(initial, solution.states()[0]);
        assertNotSame(initial, solution.states()[0]);
        assertEquals(IntegrationStatistics.EMPTY, solution.statistics());
    }

    @Test
    @DisplayName("Contabilidad: evaluaciones = 2 iniciales + 6 por paso intentado (FSAL)")
    void integrate_statistics_shouldCountDerivativeEvaluations() {
        AtomicLong calls = new AtomicLong();
        OdeSystem counted = scalar(y -> {
            calls.incrementAndGet();
            return -2.0 * y;
        });

        Solution solution = integrator.integrate(counted, new double[]{1.0}, new double[]{0.0, 1.0, 3.0});

        IntegrationStatistics stats = solution.statistics();
        assertEquals(calls.get(), stats.derivativeEvaluations());
        assertEquals(2 + 6 * stats.totalSteps(), stats.derivativeEvaluations());
        assertThat(stats.lastStepSize()).isPositive();
    }

    @Test
    @DisplayName("Explosión: y' = y² diverge en t=1 y el fallo conserva los instantes completados")
    void integrate_finiteTimeBlowUp_shouldFailWithPartialOutputs() {
        OdeIntegrationException ex = assertThrows(OdeIntegrationException.class,
                () -> integrator.integrate(scalar(y -> y * y), new double[]{1.0}, new double[]{0.0, 0.5, 2.0}));

        log.info("Fallo esperado: {} (t={})", ex.getMessage(), ex.getLastTime());
        assertEquals(2, ex.getCompletedCount());
        assertEquals(1.0, ex.getCompletedStates()[0][0], 0.0);
        assertEquals(2.0, ex.getCompletedStates()[1][0], 1e-6);
        assertThat(ex.getLastTime()).isGreaterThan(0.5).isLessThan(1.01);
    }

    @Test
    @DisplayName("Presupuesto de pasos: se lanza OdeIntegrationException al agotar maxSteps")
    void integrate_maxStepsExhausted_shouldThrow() {
        DormandPrinceIntegrator limited = new DormandPrinceIntegrator(SolverConfig.builder()
                .relativeTolerance(1e-12)
                .absoluteTolerance(1e-14)
                .maxSteps(5)
                .build());

        OdeIntegrationException ex = assertThrows(OdeIntegrationException.class,
                () -> limited.integrate(scalar(y -> -y), new double[]{1.0}, new double[]{0.0, 100.0}));

        assertEquals(1, ex.getCompletedCount());
        assertEquals(5, ex.getStatistics().totalSteps());
    }

    @Test
    @DisplayName("Derivada no finita en el estado inicial: fallo inmediato")
    void integrate_nonFiniteInitialDerivative_shouldThrow() {
        OdeIntegrationException ex = assertThrows(OdeIntegrationException.class,
                () -> integrator.integrate(scalar(y -> Double.NaN), new double[]{1.0}, new double[]{0.0, 1.0}));

        assertEquals(0.0, ex.getLastTime());
        assertEquals(1, ex.getCompletedCount());
    }

    @Test
    @DisplayName("Validación: instantes no crecientes, no finitos o dimensión incorrecta")
    void integrate_invalidArguments_shouldThrow() {
        OdeSystem decay = scalar(y -> -y);

        assertThrows(IllegalArgumentException.class,
                () -> integrator.integrate(decay, new double[]{1.0}, new double[]{0.0, 1.0, 1.0}));
        assertThrows(IllegalArgumentException.class,
                () -> integrator.integrate(decay, new double[]{1.0}, new double[]{0.0, Double.NaN}));
        assertThrows(IllegalArgumentException.class,
                () -> integrator.integrate(decay, new double[]{1.0}, new double[0]));
        assertThrows(IllegalArgumentException.class,
                () -> integrator.integrate(decay, new double[]{1.0, 2.0}, new double[]{0.0, 1.0}));
    }

    @Test
    @DisplayName("Paso inicial fijo: se respeta y la solución sigue siendo precisa")
    void integrate_withExplicitInitialStep_shouldStillConverge() {
        DormandPrinceIntegrator fixedStart = new DormandPrinceIntegrator(SolverConfig.builder()
                .relativeTolerance(1e-9)
                .absoluteTolerance(1e-12)
                .initialStepSize(0.5)
                .build());

        Solution solution = fixedStart.integrate(scalar(y -> -3.0 * y), new double[]{2.0}, new double[]{0.0, 1.0});

        assertEquals(2.0 * Math.exp(-3.0), solution.states()[1][0], 1e-8);
        assertEquals("DOPRI5(4)", fixedStart.getName());
    }
}
