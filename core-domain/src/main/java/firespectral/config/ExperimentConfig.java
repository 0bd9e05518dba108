package firespectral.config;

import firespectral.physics.model.ScalarField;
import firespectral.physics.model.VectorField;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * Contenedor de todos los parámetros de un experimento.
 * Enumera exactamente los datos que necesita una integración: μ, dt, T y los campos
 * de coeficientes, más la resolución de la malla y los ajustes del integrador.
 */
@Value
@Builder
@With
public class ExperimentConfig {

    /**
     * Resolución N de la malla. El estado tiene (N+1)x(N+1) nodos.
     */
    int resolution;

    /**
     * Constante de difusión μ.
     */
    double diffusivity;

    /**
     * Separación de la malla temporal de reporte.
     */
    double deltaTime;

    /**
     * Número de instantes de reporte T (incluye t=0).
     */
    int timeSteps;

    /**
     * Tasa de reacción A(x, y): fuente si es positiva, sumidero si es negativa.
     */
    @NonNull
    ScalarField reactionField;

    /**
     * Componente x de la velocidad, V1(x, y).
     */
    @NonNull
    ScalarField velocityFieldX;

    /**
     * Componente y de la velocidad, V2(x, y).
     */
    @NonNull
    ScalarField velocityFieldY;

    /**
     * Condición inicial W0(x, y).
     */
    @NonNull
    ScalarField initialCondition;

    /**
     * Valor de frontera f(x, y). Solo se usa con {@link SolverConfig.BoundaryMode#DIRICHLET}.
     */
    @Builder.Default
    ScalarField boundaryField = ScalarField.zero();

    @Builder.Default
    SolverConfig solverConfig = SolverConfig.defaults();

    /**
     * Instante final de la malla de reporte, (T-1)·dt.
     */
    public double getFinalTime() {
        return (timeSteps - 1) * deltaTime;
    }

    /**
     * Extensión del builder para asignar las dos componentes del viento de una vez.
     */
    public static class ExperimentConfigBuilder {
        public ExperimentConfigBuilder velocityField(VectorField velocityField) {
            this.velocityFieldX = velocityField.xComponent();
            this.velocityFieldY = velocityField.yComponent();
            return this;
        }
    }
}
