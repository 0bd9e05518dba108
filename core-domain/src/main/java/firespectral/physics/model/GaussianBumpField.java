package firespectral.physics.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.ejml.data.DMatrixRMaj;

/**
 * Foco gaussiano aislado: {@code amplitude · exp(-sharpness · ((x - x0)² + (y - y0)²))}.
 * <p>
 * Es la condición inicial típica (foco de temperatura) y el componente básico de
 * {@link GaussianMixtureField}.
 */
@Value
@Builder
@With
public class GaussianBumpField implements ScalarField {

    double amplitude;
    double centerX;
    double centerY;

    /**
     * Inverso del ancho del foco. Valores grandes producen un foco más estrecho.
     */
    double sharpness;

    public GaussianBumpField(double amplitude, double centerX, double centerY, double sharpness) {
        if (sharpness <= 0.0) {
            throw new IllegalArgumentException("El coeficiente de concentración del foco debe ser positivo: " + sharpness);
        }
        this.amplitude = amplitude;
        this.centerX = centerX;
        this.centerY = centerY;
        this.sharpness = sharpness;
    }

    /**
     * Valor del campo en un punto.
     */
    public double valueAt(double x, double y) {
        double ddx = x - centerX;
        double ddy = y - centerY;
        return amplitude * Math.exp(-sharpness * (ddx * ddx + ddy * ddy));
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
