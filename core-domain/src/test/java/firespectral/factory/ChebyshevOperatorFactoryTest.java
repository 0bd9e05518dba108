package firespectral.factory;

import firespectral.domain.spectral.SpectralContext;
import firespectral.exception.InvalidDimensionException;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.function.DoubleUnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class ChebyshevOperatorFactoryTest {

    private static final double RELATIVE_TOLERANCE = 1e-10;

    @Test
    @DisplayName("N=0: operador nulo de 1x1 y un único nodo en x=1")
    void build_zeroResolution_shouldReturnTrivialOperator() {
        SpectralContext context = ChebyshevOperatorFactory.build(0);

        assertEquals(0, context.resolution());
        assertEquals(1, context.size());
        assertArrayEquals(new double[]{1.0}, context.nodes());
        assertEquals(0.0, context.differentiationMatrix().get(0, 0));
        assertEquals(0.0, context.secondDerivativeMatrix().get(0, 0));
    }

    @Test
    @DisplayName("N negativo: debe fallar con InvalidDimensionException")
    void build_negativeResolution_shouldThrow() {
        InvalidDimensionException ex = assertThrows(InvalidDimensionException.class,
                () -> ChebyshevOperatorFactory.build(-3));

        assertEquals(-3, ex.getDimension());
    }

    @Test
    @DisplayName("N=1 y N=2: coinciden con las matrices de referencia calculadas a mano")
    void build_smallResolutions_shouldMatchHandComputedMatrices() {
        // N=1: x = [1, -1], c = [2, -2]
        DMatrixRMaj d1 = ChebyshevOperatorFactory.build(1).differentiationMatrix();
        double[][] expected1 = {{0.5, -0.5}, {0.5, -0.5}};

        // N=2: x = [1, 0, -1], c = [2, -1, 2]
        DMatrixRMaj d2 = ChebyshevOperatorFactory.build(2).differentiationMatrix();
        double[][] expected2 = {{1.5, -2.0, 0.5}, {0.5, 0.0, -0.5}, {-0.5, 2.0, -1.5}};

        assertMatrixEquals(expected1, d1, 1e-14);
        assertMatrixEquals(expected2, d2, 1e-14);
    }

    @Test
    @DisplayName("Nodos: cos(πk/N) en orden estrictamente decreciente de 1 a -1")
    void build_nodes_shouldBeDecreasingChebyshevPoints() {
        int n = 12;
        double[] nodes = ChebyshevOperatorFactory.build(n).nodes();

        assertEquals(n + 1, nodes.length);
        assertEquals(1.0, nodes[0], 0.0);
        assertEquals(-1.0, nodes[n], 1e-15);
        for (int k = 0; k <= n; k++) {
            assertEquals(Math.cos(Math.PI * k / n), nodes[k], 0.0, "Nodo " + k);
            if (k > 0) {
                assertTrue(nodes[k] < nodes[k - 1], "Los nodos deben ser decrecientes en k=" + k);
            }
        }
    }

    @Test
    @DisplayName("Diagonal: cada D_ii es exactamente la suma negativa del resto de la fila")
    void build_diagonal_shouldBeNegativeRowSum() {
        DMatrixRMaj d = ChebyshevOperatorFactory.build(20).differentiationMatrix();

        for (int i = 0; i < d.getNumRows(); i++) {
            double offDiagonal = 0.0;
            for (int j = 0; j < d.getNumCols(); j++) {
                if (j != i) {
                    offDiagonal += d.get(i, j);
                }
            }
            assertEquals(-offDiagonal, d.get(i, i), 0.0, "Fila " + i);
        }
    }

    @ParameterizedTest(name = "N={0}")
    @ValueSource(ints = {1, 4, 9, 16, 32})
    @DisplayName("Anulación de constantes: D aplicado a un vector constante da cero")
    void build_constantVector_shouldBeAnnihilated(int n) {
        DMatrixRMaj d = ChebyshevOperatorFactory.build(n).differentiationMatrix();
        DMatrixRMaj ones = new DMatrixRMaj(n + 1, 1);
        ones.fill(1.0);

        DMatrixRMaj derivative = new DMatrixRMaj(n + 1, 1);
        CommonOps_DDRM.mult(d, ones, derivative);

        double maxAbs = CommonOps_DDRM.elementMaxAbs(derivative);
        log.info("N={} -> max|D·1| = {}", n, maxAbs);
        assertThat(maxAbs).isLessThan(1e-12 * n * n);
    }

    @ParameterizedTest(name = "N={0}")
    @ValueSource(ints = {5, 8, 12})
    @DisplayName("Exactitud polinómica: derivada exacta de un polinomio de grado 5 en los nodos")
    void build_polynomial_shouldBeDifferentiatedExactly(int n) {
        // p(x) = 3x^5 - 2x^3 + x - 4  ->  p'(x) = 15x^4 - 6x^2 + 1
        DoubleUnaryOperator p = x -> 3 * Math.pow(x, 5) - 2 * Math.pow(x, 3) + x - 4;
        DoubleUnaryOperator dp = x -> 15 * Math.pow(x, 4) - 6 * x * x + 1;

        SpectralContext context = ChebyshevOperatorFactory.build(n);
        DMatrixRMaj derivative = applyToNodes(context.differentiationMatrix(), context.nodes(), p);

        for (int k = 0; k <= n; k++) {
            double expected = dp.applyAsDouble(context.nodeAt(k));
            assertEquals(expected, derivative.get(k, 0), RELATIVE_TOLERANCE * Math.max(1.0, Math.abs(expected)),
                    "Derivada incorrecta en el nodo " + k);
        }
    }

    @Test
    @DisplayName("Segunda derivada: D2 = D·D aplicado a x² vale 2 en todos los nodos")
    void build_secondDerivativeOfSquare_shouldBeTwo() {
        SpectralContext context = ChebyshevOperatorFactory.build(10);
        DMatrixRMaj result = applyToNodes(context.secondDerivativeMatrix(), context.nodes(), x -> x * x);

        log.info("D2·x² = {}", result);
        for (int k = 0; k <= 10; k++) {
            assertEquals(2.0, result.get(k, 0), 1e-9, "Nodo " + k);
        }
    }

    @Test
    @DisplayName("Inmutabilidad: modificar la copia de los nodos no altera el contexto")
    void build_context_shouldNotLeakNodeArray() {
        SpectralContext context = ChebyshevOperatorFactory.build(4);
        double[] nodes = context.nodes();
        nodes[0] = 42.0;

        assertEquals(1.0, context.nodeAt(0));
    }

    @Test
    @DisplayName("Inmutabilidad: alterar las matrices devueltas no modifica el contexto compartido")
    void build_context_shouldNotLeakOperators() {
        SpectralContext context = ChebyshevOperatorFactory.build(4);
        double d00 = context.differentiationMatrix().get(0, 0);
        double d2Trace = CommonOps_DDRM.trace(context.secondDerivativeMatrix());

        context.differentiationMatrix().set(0, 0, 999.0);
        context.secondDerivativeMatrix().zero();

        assertEquals(d00, context.differentiationMatrix().get(0, 0), 0.0);
        assertEquals(d2Trace, CommonOps_DDRM.trace(context.secondDerivativeMatrix()), 0.0);
        assertNotSame(context.differentiationMatrix(), context.differentiationMatrix());
    }

    private static DMatrixRMaj applyToNodes(DMatrixRMaj operator, double[] nodes, DoubleUnaryOperator f) {
        DMatrixRMaj values = new DMatrixRMaj(nodes.length, 1);
        for (int k = 0; k < nodes.length; k++) {
            values.set(k, 0, f.applyAsDouble(nodes[k]));
        }
        DMatrixRMaj result = new DMatrixRMaj(nodes.length, 1);
        CommonOps_DDRM.mult(operator, values, result);
        return result;
    }

    private static void assertMatrixEquals(double[][] expected, DMatrixRMaj actual, double tolerance) {
        assertEquals(expected.length, actual.getNumRows());
        for (int i = 0; i < expected.length; i++) {
            for (int j = 0; j < expected[i].length; j++) {
                assertEquals(expected[i][j], actual.get(i, j), tolerance, "Elemento (" + i + "," + j + ")");
            }
        }
    }
}
