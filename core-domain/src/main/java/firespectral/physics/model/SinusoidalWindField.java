package firespectral.physics.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Viento sinusoidal estacionario:
 * {@code v1(x, y) = amplitudeX · cos(ω·y + φ)}, {@code v2(x, y) = amplitudeY · sin(ω·x + φ)}.
 * <p>
 * Cada componente depende solo de la coordenada transversal, lo que produce bandas de
 * viento alternas (cizalladura) sobre el dominio.
 */
@Value
@Builder
@With
public class SinusoidalWindField implements VectorField {

    double amplitudeX;
    double amplitudeY;
    double angularFrequency;
    double phase;

    @Override
    public ScalarField xComponent() {
        return ScalarField.pointwise((x, y) -> amplitudeX * Math.cos(angularFrequency * y + phase));
    }

    @Override
    public ScalarField yComponent() {
        return ScalarField.pointwise((x, y) -> amplitudeY * Math.sin(angularFrequency * x + phase));
    }
}
