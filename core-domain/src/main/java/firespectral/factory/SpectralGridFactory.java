package firespectral.factory;

import firespectral.domain.spectral.SpectralContext;
import firespectral.domain.spectral.SpectralGrid;
import firespectral.exception.InvalidDimensionException;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

import java.util.Objects;

/**
 * Ensambla la malla producto tensorial 2D a partir de dos ejes 1D.
 * <p>
 * Las segundas derivadas se obtienen por composición ({@code D2 = D·D}) y no con una
 * fórmula analítica propia, de modo que heredan la estabilidad del operador de primer orden.
 * Función pura: sin estado oculto y determinista para entradas fijas.
 */
@Slf4j
public class SpectralGridFactory {

    private SpectralGridFactory() {
    }

    /**
     * Ensambla la malla a partir de los operadores y nodos de cada eje.
     *
     * @param dx Operador de primera derivada del eje x.
     * @param x  Nodos del eje x (recorren las columnas).
     * @param dy Operador de primera derivada del eje y.
     * @param y  Nodos del eje y (recorren las filas).
     * @return La malla con X, Y, Dx, Dy, D2x y D2y.
     * @throws InvalidDimensionException si algún operador no es cuadrado o no coincide con sus nodos.
     */
    public static SpectralGrid assembleGrid(DMatrixRMaj dx, double[] x, DMatrixRMaj dy, double[] y) {
        validateAxis(dx, x, "x");
        validateAxis(dy, y, "y");

        DMatrixRMaj d2x = new DMatrixRMaj(dx.getNumRows(), dx.getNumCols());
        CommonOps_DDRM.mult(dx, dx, d2x);
        DMatrixRMaj d2y = new DMatrixRMaj(dy.getNumRows(), dy.getNumCols());
        CommonOps_DDRM.mult(dy, dy, d2y);

        return buildGrid(dx, x, dy, y, d2x, d2y);
    }

    /**
     * Ensambla la malla reutilizando el D2 ya cacheado en cada contexto.
     */
    public static SpectralGrid assembleGrid(SpectralContext xAxis, SpectralContext yAxis) {
        Objects.requireNonNull(xAxis, "El contexto del eje x no puede ser nulo.");
        Objects.requireNonNull(yAxis, "El contexto del eje y no puede ser nulo.");
        return buildGrid(xAxis.differentiationMatrix(), xAxis.nodes(),
                yAxis.differentiationMatrix(), yAxis.nodes(),
                xAxis.secondDerivativeMatrix(), yAxis.secondDerivativeMatrix());
    }

    /**
     * Atajo para el dominio cuadrado habitual: el mismo eje de resolución N en x e y.
     */
    public static SpectralGrid createSquareGrid(int resolution) {
        SpectralContext context = ChebyshevOperatorFactory.build(resolution);
        SpectralGrid grid = assembleGrid(context, context);
        log.info("Malla espectral {}x{} ensamblada (N={})", grid.rows(), grid.cols(), resolution);
        return grid;
    }

    private static SpectralGrid buildGrid(DMatrixRMaj dx, double[] x, DMatrixRMaj dy, double[] y,
                                          DMatrixRMaj d2x, DMatrixRMaj d2y) {
        int rows = y.length;
        int cols = x.length;
        DMatrixRMaj gridX = new DMatrixRMaj(rows, cols);
        DMatrixRMaj gridY = new DMatrixRMaj(rows, cols);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                gridX.unsafe_set(i, j, x[j]);
                gridY.unsafe_set(i, j, y[i]);
            }
        }
        return new SpectralGrid(gridX, gridY, dx, dy, d2x, d2y);
    }

    private static void validateAxis(DMatrixRMaj operator, double[] nodes, String axis) {
        Objects.requireNonNull(operator, "El operador del eje " + axis + " no puede ser nulo.");
        Objects.requireNonNull(nodes, "Los nodos del eje " + axis + " no pueden ser nulos.");
        if (operator.getNumRows() != operator.getNumCols()) {
            throw new InvalidDimensionException(String.format("El operador del eje %s no es cuadrado (%dx%d)",
                    axis, operator.getNumRows(), operator.getNumCols()), operator.getNumRows());
        }
        if (operator.getNumRows() != nodes.length) {
            throw new InvalidDimensionException(String.format("El operador del eje %s (%d) no coincide con sus %d nodos",
                    axis, operator.getNumRows(), nodes.length), nodes.length);
        }
        if (nodes.length == 0) {
            throw new InvalidDimensionException("El eje " + axis + " no tiene nodos", 0);
        }
    }
}
