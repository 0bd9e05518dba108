package firespectral.factory;

import firespectral.domain.spectral.SpectralContext;
import firespectral.exception.InvalidDimensionException;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * Fábrica del operador de diferenciación espectral de Chebyshev en 1D.
 * <p>
 * Para una resolución N construye:
 * <ol>
 * <li>Los nodos de Chebyshev-Gauss-Lobatto {@code x_k = cos(πk/N)}, k = 0..N (orden decreciente).</li>
 * <li>Los pesos baricéntricos {@code c_k = (2 si k ∈ {0,N}, si no 1)·(-1)^k}.</li>
 * <li>Las entradas fuera de la diagonal {@code D_ij = c_i / c_j / (x_i - x_j)}.</li>
 * <li>La diagonal como suma negativa de la fila, {@code D_ii = -Σ_{j≠i} D_ij}.</li>
 * </ol>
 * La diagonal NO usa la fórmula cerrada. Con la suma negativa, D aplicado a un vector
 * constante da cero hasta el redondeo.
 *
 * @see SpectralGridFactory
 */
@Slf4j
public class ChebyshevOperatorFactory {

    private ChebyshevOperatorFactory() {
    }

    /**
     * Construye de forma atómica el par (D, x) y el operador derivado D2 = D·D.
     *
     * @param resolution La resolución N (número de nodos menos uno).
     * @return El contexto espectral inmutable para N.
     * @throws InvalidDimensionException si N es negativo.
     */
    public static SpectralContext build(int resolution) {
        if (resolution < 0) {
            throw new InvalidDimensionException("La resolución N debe ser no negativa, se recibió " + resolution, resolution);
        }

        // Caso degenerado: un único nodo en x=1, operador nulo.
        if (resolution == 0) {
            log.debug("Resolución N=0: operador trivial de un solo nodo.");
            return new SpectralContext(0, new DMatrixRMaj(1, 1), new double[]{1.0}, new DMatrixRMaj(1, 1));
        }

        int size = resolution + 1;
        double[] nodes = chebyshevNodes(resolution);
        double[] weights = barycentricWeights(resolution);

        DMatrixRMaj d = new DMatrixRMaj(size, size);
        for (int i = 0; i < size; i++) {
            double rowSum = 0.0;
            for (int j = 0; j < size; j++) {
                if (i == j) {
                    continue;
                }
                double entry = weights[i] / weights[j] / (nodes[i] - nodes[j]);
                d.unsafe_set(i, j, entry);
                rowSum += entry;
            }
            d.unsafe_set(i, i, -rowSum);
        }

        DMatrixRMaj d2 = new DMatrixRMaj(size, size);
        CommonOps_DDRM.mult(d, d, d2);

        log.debug("Operador de Chebyshev construido: N={}, dimensión {}x{}", resolution, size, size);
        return new SpectralContext(resolution, d, nodes, d2);
    }

    /**
     * Nodos de Chebyshev-Gauss-Lobatto {@code cos(πk/N)}, de 1 a -1.
     */
    static double[] chebyshevNodes(int resolution) {
        double[] nodes = new double[resolution + 1];
        for (int k = 0; k <= resolution; k++) {
            nodes[k] = Math.cos(Math.PI * k / resolution);
        }
        return nodes;
    }

    /**
     * Pesos {@code c_k}: 2 en los extremos, 1 en el interior, con signo alterno.
     */
    static double[] barycentricWeights(int resolution) {
        double[] weights = new double[resolution + 1];
        for (int k = 0; k <= resolution; k++) {
            double magnitude = (k == 0 || k == resolution) ? 2.0 : 1.0;
            weights[k] = (k % 2 == 0) ? magnitude : -magnitude;
        }
        return weights;
    }
}
