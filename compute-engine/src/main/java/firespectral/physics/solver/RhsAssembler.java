package firespectral.physics.solver;

import org.ejml.data.DMatrixRMaj;

/**
 * Define el contrato para el operador espacial de la ecuación de
 * reacción-convección-difusión semidiscretizada: dado el estado W en el tiempo t,
 * calcula la tasa de cambio W' con las condiciones de frontera ya impuestas.
 * <p>
 * Los coeficientes (μ, A, V1, V2) y la malla quedan fijados al construir la implementación
 * y no se remuestrean entre llamadas.
 */
public interface RhsAssembler extends SolverComponent {

    /**
     * Calcula la tasa de cambio en un buffer proporcionado por el llamador.
     *
     * @param state Estado actual W, filas x columnas de la malla. No se modifica.
     * @param time  Tiempo actual. El operador es autónomo y no depende de él.
     * @param rate  Destino de W', misma forma que {@code state}.
     */
    void evaluate(DMatrixRMaj state, double time, DMatrixRMaj rate);

    /**
     * Variante que reserva una matriz nueva para el resultado.
     */
    default DMatrixRMaj evaluate(DMatrixRMaj state, double time) {
        DMatrixRMaj rate = new DMatrixRMaj(state.getNumRows(), state.getNumCols());
        evaluate(state, time, rate);
        return rate;
    }
}
