package firespectral.domain.simulation;

import firespectral.utils.MatrixChecks;
import lombok.Builder;
import lombok.With;
import org.ejml.data.DMatrixRMaj;

import java.util.Objects;

/**
 * Coeficientes de la ecuación, ya muestreados sobre la malla y constantes durante
 * toda una integración. Los accesores de matrices devuelven copias.
 *
 * @param diffusivity Constante de difusión μ (no negativa).
 * @param reaction    Tasa de reacción A.
 * @param velocityX   Componente x de la velocidad, V1.
 * @param velocityY   Componente y de la velocidad, V2.
 */
@Builder
@With
public record TransportCoefficients(
        double diffusivity,
        DMatrixRMaj reaction,
        DMatrixRMaj velocityX,
        DMatrixRMaj velocityY
) {
    public TransportCoefficients {
        if (!(diffusivity >= 0.0) || Double.isInfinite(diffusivity)) {
            throw new IllegalArgumentException("La difusividad μ debe ser finita y no negativa: " + diffusivity);
        }
        Objects.requireNonNull(reaction, "El campo de reacción A no puede ser nulo.");
        int rows = reaction.getNumRows();
        int cols = reaction.getNumCols();
        MatrixChecks.requireShape(velocityX, rows, cols, "V1");
        MatrixChecks.requireShape(velocityY, rows, cols, "V2");

        reaction = reaction.copy();
        velocityX = velocityX.copy();
        velocityY = velocityY.copy();
    }

    @Override
    public DMatrixRMaj reaction() {
        return reaction.copy();
    }

    @Override
    public DMatrixRMaj velocityX() {
        return velocityX.copy();
    }

    @Override
    public DMatrixRMaj velocityY() {
        return velocityY.copy();
    }

    public int rows() {
        return reaction.getNumRows();
    }

    public int cols() {
        return reaction.getNumCols();
    }
}
