package firespectral.utils;

import firespectral.exception.ShapeMismatchException;
import org.ejml.data.DMatrixRMaj;

import java.util.Objects;

/**
 * Validaciones de forma compartidas por la malla, el ensamblador y el integrador.
 */
public final class MatrixChecks {

    private MatrixChecks() {
    }

    /**
     * Verifica que la matriz existe y tiene exactamente {@code rows x cols}.
     *
     * @return la misma matriz, para poder encadenar la validación en asignaciones.
     * @throws ShapeMismatchException si la forma no coincide.
     */
    public static DMatrixRMaj requireShape(DMatrixRMaj matrix, int rows, int cols, String operand) {
        Objects.requireNonNull(matrix, "La matriz '" + operand + "' no puede ser nula.");
        if (matrix.getNumRows() != rows || matrix.getNumCols() != cols) {
            throw new ShapeMismatchException(operand, rows, cols, matrix.getNumRows(), matrix.getNumCols());
        }
        return matrix;
    }
}
