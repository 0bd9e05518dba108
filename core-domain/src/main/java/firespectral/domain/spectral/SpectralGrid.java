package firespectral.domain.spectral;

import firespectral.utils.MatrixChecks;
import org.ejml.data.DMatrixRMaj;

import java.util.Objects;

/**
 * Malla producto tensorial 2D junto con los operadores de derivada de cada eje.
 * <p>
 * Convención fija para todo el proyecto: el índice de <b>fila</b> recorre el eje y,
 * el índice de <b>columna</b> recorre el eje x. Por tanto {@code X[i][j] = x[j]} e
 * {@code Y[i][j] = y[i]}, y un operador sobre x se aplica por la derecha
 * ({@code W·Dxᵀ}) mientras que uno sobre y se aplica por la izquierda ({@code Dy·W}).
 * <p>
 * Inmutable: se comparte entre experimentos y todos los accesores de matrices devuelven copias.
 *
 * @param x       Coordenadas x de cada nodo, filas x columnas.
 * @param y       Coordenadas y de cada nodo, filas x columnas.
 * @param dx      Primera derivada a lo largo de x (columnas x columnas).
 * @param dy      Primera derivada a lo largo de y (filas x filas).
 * @param d2x     Segunda derivada a lo largo de x, {@code Dx·Dx}.
 * @param d2y     Segunda derivada a lo largo de y, {@code Dy·Dy}.
 */
public record SpectralGrid(
        DMatrixRMaj x,
        DMatrixRMaj y,
        DMatrixRMaj dx,
        DMatrixRMaj dy,
        DMatrixRMaj d2x,
        DMatrixRMaj d2y
) {
    public SpectralGrid {
        Objects.requireNonNull(x, "La matriz de coordenadas X no puede ser nula.");
        int rows = x.getNumRows();
        int cols = x.getNumCols();
        MatrixChecks.requireShape(y, rows, cols, "Y");
        MatrixChecks.requireShape(dx, cols, cols, "Dx");
        MatrixChecks.requireShape(d2x, cols, cols, "D2x");
        MatrixChecks.requireShape(dy, rows, rows, "Dy");
        MatrixChecks.requireShape(d2y, rows, rows, "D2y");

        x = x.copy();
        y = y.copy();
        dx = dx.copy();
        dy = dy.copy();
        d2x = d2x.copy();
        d2y = d2y.copy();
    }

    @Override
    public DMatrixRMaj x() {
        return x.copy();
    }

    @Override
    public DMatrixRMaj y() {
        return y.copy();
    }

    @Override
    public DMatrixRMaj dx() {
        return dx.copy();
    }

    @Override
    public DMatrixRMaj dy() {
        return dy.copy();
    }

    @Override
    public DMatrixRMaj d2x() {
        return d2x.copy();
    }

    @Override
    public DMatrixRMaj d2y() {
        return d2y.copy();
    }

    /**
     * Número de filas de cualquier campo muestreado en esta malla (nodos en y).
     */
    public int rows() {
        return x.getNumRows();
    }

    /**
     * Número de columnas de cualquier campo muestreado en esta malla (nodos en x).
     */
    public int cols() {
        return x.getNumCols();
    }

    /**
     * Número total de nodos de la malla.
     */
    public int nodeCount() {
        return rows() * cols();
    }

    /**
     * Crea una matriz de ceros con la forma de la malla.
     */
    public DMatrixRMaj zeros() {
        return new DMatrixRMaj(rows(), cols());
    }

    /**
     * Indica si el nodo (fila, columna) pertenece a la frontera del dominio.
     */
    public boolean isBoundary(int row, int col) {
        return row == 0 || col == 0 || row == rows() - 1 || col == cols() - 1;
    }
}
