package firespectral.physics.model;

import firespectral.utils.MatrixChecks;
import org.ejml.data.DMatrixRMaj;

import java.util.function.DoubleBinaryOperator;

/**
 * Define el contrato para campos escalares (tasa de reacción, condición inicial,
 * componentes de velocidad) muestreados sobre la malla.
 * <p>
 * La evaluación debe ser determinista y sin efectos secundarios. Se realiza una única
 * vez por experimento, antes de integrar: los coeficientes no se remuestrean en el tiempo.
 */
@FunctionalInterface
public interface ScalarField {

    /**
     * Muestrea el campo en todos los nodos de la malla.
     *
     * @param x Coordenadas x de cada nodo (misma forma que el estado).
     * @param y Coordenadas y de cada nodo (misma forma que el estado).
     * @return Una matriz NUEVA con la misma forma que {@code x} e {@code y}.
     */
    DMatrixRMaj sample(DMatrixRMaj x, DMatrixRMaj y);

    /**
     * Adapta una función puntual f(x, y) al contrato matricial.
     */
    static ScalarField pointwise(DoubleBinaryOperator function) {
        return (x, y) -> {
            DMatrixRMaj result = new DMatrixRMaj(x.getNumRows(), x.getNumCols());
            int n = x.getNumElements();
            for (int i = 0; i < n; i++) {
                result.data[i] = function.applyAsDouble(x.data[i], y.data[i]);
            }
            return result;
        };
    }

    static ScalarField constant(double value) {
        return pointwise((x, y) -> value);
    }

    static ScalarField zero() {
        return constant(0.0);
    }

    /**
     * Suma punto a punto de este campo con otro.
     */
    default ScalarField plus(ScalarField other) {
        return (x, y) -> {
            DMatrixRMaj left = sample(x, y);
            DMatrixRMaj right = MatrixChecks.requireShape(other.sample(x, y),
                    left.getNumRows(), left.getNumCols(), "sumando");
            DMatrixRMaj result = new DMatrixRMaj(left.getNumRows(), left.getNumCols());
            for (int i = 0; i < left.getNumElements(); i++) {
                result.data[i] = left.data[i] + right.data[i];
            }
            return result;
        };
    }

    /**
     * Escala el campo por un factor constante.
     */
    default ScalarField scaled(double factor) {
        return (x, y) -> {
            DMatrixRMaj result = sample(x, y).copy();
            for (int i = 0; i < result.getNumElements(); i++) {
                result.data[i] *= factor;
            }
            return result;
        };
    }
}
