package firespectral.physics.model;

import java.util.Objects;

/**
 * Campo vectorial 2D (por ejemplo, el viento) expresado como dos campos escalares.
 * <p>
 * La componente x actúa sobre la derivada a lo largo de las columnas y la componente y
 * sobre la derivada a lo largo de las filas.
 */
public interface VectorField {

    ScalarField xComponent();

    ScalarField yComponent();

    static VectorField of(ScalarField xComponent, ScalarField yComponent) {
        Objects.requireNonNull(xComponent, "La componente x no puede ser nula.");
        Objects.requireNonNull(yComponent, "La componente y no puede ser nula.");
        return new VectorField() {
            @Override
            public ScalarField xComponent() {
                return xComponent;
            }

            @Override
            public ScalarField yComponent() {
                return yComponent;
            }
        };
    }

    /**
     * Viento uniforme en todo el dominio.
     */
    static VectorField constant(double vx, double vy) {
        return of(ScalarField.constant(vx), ScalarField.constant(vy));
    }

    static VectorField zero() {
        return constant(0.0, 0.0);
    }
}
