package firespectral.domain.dto;

import firespectral.domain.simulation.Trajectory;
import org.ejml.data.DMatrixRMaj;

/**
 * Vista plana de una {@link Trajectory} para exportar a JSON.
 *
 * @param rows   Filas de cada instantánea (nodos en y).
 * @param cols   Columnas de cada instantánea (nodos en x).
 * @param times  Instantes de reporte.
 * @param states Instantáneas indexadas como [instante][fila][columna].
 */
public record TrajectoryDTO(int rows, int cols, double[] times, double[][][] states) {

    public static TrajectoryDTO from(Trajectory trajectory) {
        int count = trajectory.getTimestepCount();
        double[][][] states = new double[count][][];
        int rows = 0;
        int cols = 0;
        for (int k = 0; k < count; k++) {
            DMatrixRMaj state = trajectory.getStateAt(k);
            rows = state.getNumRows();
            cols = state.getNumCols();
            states[k] = toArray(state);
        }
        return new TrajectoryDTO(rows, cols, trajectory.getTimes(), states);
    }

    private static double[][] toArray(DMatrixRMaj matrix) {
        double[][] values = new double[matrix.getNumRows()][matrix.getNumCols()];
        for (int i = 0; i < matrix.getNumRows(); i++) {
            for (int j = 0; j < matrix.getNumCols(); j++) {
                values[i][j] = matrix.unsafe_get(i, j);
            }
        }
        return values;
    }
}
