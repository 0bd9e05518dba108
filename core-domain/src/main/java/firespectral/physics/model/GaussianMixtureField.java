package firespectral.physics.model;

import lombok.Getter;
import org.ejml.data.DMatrixRMaj;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Mezcla de focos gaussianos sobre un nivel base.
 * <p>
 * Modela la distribución de combustible: cada componente es una mancha de vegetación y el
 * valor resultante se usa como tasa de reacción A(x, y). Con nivel base negativo el campo
 * actúa como sumidero donde no hay combustible.
 */
@Getter
public class GaussianMixtureField implements ScalarField {

    private final List<GaussianBumpField> components;
    private final double baseline;

    public GaussianMixtureField(List<GaussianBumpField> components, double baseline) {
        Objects.requireNonNull(components, "La lista de componentes no puede ser nula.");
        this.components = List.copyOf(components);
        this.baseline = baseline;
    }

    public GaussianMixtureField(List<GaussianBumpField> components) {
        this(components, 0.0);
    }

    /**
     * Genera una mezcla reproducible con centros uniformes en [-1, 1]² y amplitudes
     * uniformes en [0, maxAmplitude).
     *
     * @param componentCount Número de focos.
     * @param seed           Semilla del generador, para resultados reproducibles.
     * @param maxAmplitude   Amplitud máxima de cada foco.
     * @param sharpness      Concentración común de todos los focos.
     */
    public static GaussianMixtureField random(int componentCount, long seed, double maxAmplitude, double sharpness) {
        if (componentCount < 0) {
            throw new IllegalArgumentException("El número de componentes no puede ser negativo: " + componentCount);
        }
        Random random = new Random(seed);
        List<GaussianBumpField> bumps = new ArrayList<>(componentCount);
        for (int k = 0; k < componentCount; k++) {
            double cx = 2.0 * random.nextDouble() - 1.0;
            double cy = 2.0 * random.nextDouble() - 1.0;
            bumps.add(new GaussianBumpField(maxAmplitude * random.nextDouble(), cx, cy, sharpness));
        }
        return new GaussianMixtureField(bumps);
    }

    public double valueAt(double x, double y) {
        double value = baseline;
        for (GaussianBumpField bump : components) {
            value += bump.valueAt(x, y);
        }
        return value;
    }

    @Override
    public DMatrixRMaj sample(DMatrixRMaj x, DMatrixRMaj y) {
        DMatrixRMaj result = new DMatrixRMaj(x.getNumRows(), x.getNumCols());
        for (int i = 0; i < x.getNumElements(); i++) {
            result.data[i] = valueAt(x.data[i], y.data[i]);
        }
        return result;
    }
}
