package firespectral.exception;

import lombok.Getter;

/**
 * Un campo de coeficientes o la condición inicial no tiene la forma (filas x columnas) de la malla.
 */
@Getter
public class ShapeMismatchException extends SpectralSolverException {

    private final String operand;
    private final int expectedRows;
    private final int expectedCols;
    private final int actualRows;
    private final int actualCols;

    public ShapeMismatchException(String operand, int expectedRows, int expectedCols, int actualRows, int actualCols) {
        super(String.format("Forma inválida para '%s': se esperaba %dx%d pero se recibió %dx%d",
                operand, expectedRows, expectedCols, actualRows, actualCols));
        this.operand = operand;
        this.expectedRows = expectedRows;
        this.expectedCols = expectedCols;
        this.actualRows = actualRows;
        this.actualCols = actualCols;
    }
}
