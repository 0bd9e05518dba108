package firespectral.domain.spectral;

import firespectral.exception.InvalidDimensionException;
import firespectral.utils.MatrixChecks;
import org.ejml.data.DMatrixRMaj;

import java.util.Objects;

/**
 * Contexto espectral 1D inmutable para una resolución N fija.
 * <p>
 * Agrupa la matriz de diferenciación de Chebyshev D, los nodos de Gauss-Lobatto
 * {@code x_k = cos(πk/N)} (en orden decreciente) y el operador de segunda derivada
 * {@code D2 = D·D}. Se construye una sola vez por resolución y no cambia después:
 * los accesores de matrices y nodos devuelven copias.
 *
 * @param resolution              La resolución N. La dimensión de todas las matrices es N+1.
 * @param differentiationMatrix   Operador de primera derivada D, (N+1)x(N+1).
 * @param nodes                   Nodos de Chebyshev-Gauss-Lobatto, N+1 valores en [-1, 1].
 * @param secondDerivativeMatrix  Operador de segunda derivada D·D, (N+1)x(N+1).
 */
public record SpectralContext(
        int resolution,
        DMatrixRMaj differentiationMatrix,
        double[] nodes,
        DMatrixRMaj secondDerivativeMatrix
) {
    /**
     * Constructor canónico: valida dimensiones y guarda copias propias de las matrices.
     */
    public SpectralContext {
        if (resolution < 0) {
            throw new InvalidDimensionException("La resolución N no puede ser negativa: " + resolution, resolution);
        }
        Objects.requireNonNull(nodes, "El vector de nodos no puede ser nulo.");
        int size = resolution + 1;
        if (nodes.length != size) {
            throw new InvalidDimensionException(
                    "Se esperaban " + size + " nodos para N=" + resolution + " pero hay " + nodes.length, resolution);
        }
        MatrixChecks.requireShape(differentiationMatrix, size, size, "D");
        MatrixChecks.requireShape(secondDerivativeMatrix, size, size, "D2");

        differentiationMatrix = differentiationMatrix.copy();
        secondDerivativeMatrix = secondDerivativeMatrix.copy();
        nodes = nodes.clone();
    }

    /**
     * Número de nodos del eje (N+1).
     */
    public int size() {
        return resolution + 1;
    }

    /**
     * Devuelve una copia del operador D.
     */
    @Override
    public DMatrixRMaj differentiationMatrix() {
        return differentiationMatrix.copy();
    }

    /**
     * Devuelve una copia del operador D2.
     */
    @Override
    public DMatrixRMaj secondDerivativeMatrix() {
        return secondDerivativeMatrix.copy();
    }

    /**
     * Devuelve una copia del vector de nodos.
     */
    @Override
    public double[] nodes() {
        return nodes.clone();
    }

    /**
     * Devuelve el nodo k-ésimo sin copiar el vector completo.
     */
    public double nodeAt(int k) {
        return nodes[k];
    }
}
