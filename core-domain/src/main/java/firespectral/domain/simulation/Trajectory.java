package firespectral.domain.simulation;

import lombok.Getter;
import org.ejml.data.DMatrixRMaj;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Secuencia ordenada de instantes de tiempo emparejados con las instantáneas del estado.
 * <p>
 * Se produce una vez por experimento y pasa a ser propiedad del llamador. Guarda copias
 * propias de cada instantánea y devuelve copias, por lo que es inmutable en la práctica.
 */
public final class Trajectory {

    private final double[] times;
    private final List<DMatrixRMaj> states;

    @Getter
    private final IntegrationStatistics statistics;

    public Trajectory(double[] times, List<DMatrixRMaj> states, IntegrationStatistics statistics) {
        Objects.requireNonNull(times, "El vector de tiempos no puede ser nulo.");
        Objects.requireNonNull(states, "La lista de estados no puede ser nula.");
        if (times.length != states.size()) {
            throw new IllegalArgumentException(String.format(
                    "Hay %d tiempos pero %d instantáneas.", times.length, states.size()));
        }
        List<DMatrixRMaj> copies = new ArrayList<>(states.size());
        for (DMatrixRMaj state : states) {
            copies.add(Objects.requireNonNull(state, "Una instantánea no puede ser nula.").copy());
        }
        this.times = times.clone();
        this.states = Collections.unmodifiableList(copies);
        this.statistics = statistics == null ? IntegrationStatistics.EMPTY : statistics;
    }

    /**
     * Número de instantáneas disponibles.
     */
    public int getTimestepCount() {
        return times.length;
    }

    public double getTimeAt(int index) {
        validateIndex(index);
        return times[index];
    }

    public double[] getTimes() {
        return times.clone();
    }

    /**
     * Copia del estado en el instante {@code index}.
     */
    public DMatrixRMaj getStateAt(int index) {
        validateIndex(index);
        return states.get(index).copy();
    }

    /**
     * Helper para obtener el último estado (útil para encadenar simulaciones).
     */
    public Optional<DMatrixRMaj> getFinalState() {
        if (times.length == 0) {
            return Optional.empty();
        }
        return Optional.of(getStateAt(times.length - 1));
    }

    /**
     * Máximo del estado excluyendo filas y columnas del borde.
     * Si no hay nodos interiores (malla de 2x2 o menor) devuelve {@link Double#NaN}.
     */
    public double interiorMaximum(int index) {
        validateIndex(index);
        DMatrixRMaj state = states.get(index);
        double max = Double.NaN;
        for (int i = 1; i < state.getNumRows() - 1; i++) {
            for (int j = 1; j < state.getNumCols() - 1; j++) {
                double value = state.unsafe_get(i, j);
                if (Double.isNaN(max) || value > max) {
                    max = value;
                }
            }
        }
        return max;
    }

    private void validateIndex(int index) {
        if (index < 0 || index >= times.length) {
            throw new IndexOutOfBoundsException(
                    "El índice " + index + " está fuera de los límites [0, " + (times.length - 1) + "].");
        }
    }
}
