package firespectral.config;

import lombok.Builder;
import lombok.With;

/**
 * Parámetros del integrador temporal adaptativo y de la política de frontera.
 * <p>
 * Los valores a cero (los que deja un builder incompleto o un JSON parcial) se sustituyen
 * por los valores por defecto; los valores negativos se rechazan.
 *
 * @param relativeTolerance Tolerancia relativa del control de error por paso (defecto 1e-6).
 * @param absoluteTolerance Tolerancia absoluta del control de error por paso (defecto 1e-9).
 * @param maxSteps          Máximo de pasos internos (aceptados + rechazados) por ejecución (defecto 500 000).
 * @param minStepSize       Paso mínimo relativo al horizonte; por debajo se declara fallo (defecto 1e-12).
 * @param initialStepSize   Paso inicial. 0 lo estima automáticamente a partir de la derivada en t=0.
 * @param boundaryMode      Política de frontera (defecto {@link BoundaryMode#FREEZE_RATE}).
 */
@Builder
@With
public record SolverConfig(
        double relativeTolerance,
        double absoluteTolerance,
        int maxSteps,
        double minStepSize,
        double initialStepSize,
        BoundaryMode boundaryMode
) {
    public static final double DEFAULT_RELATIVE_TOLERANCE = 1e-6;
    public static final double DEFAULT_ABSOLUTE_TOLERANCE = 1e-9;
    public static final int DEFAULT_MAX_STEPS = 500_000;
    public static final double DEFAULT_MIN_STEP_SIZE = 1e-12;

    public SolverConfig {
        requireNonNegative(relativeTolerance, "relativeTolerance");
        requireNonNegative(absoluteTolerance, "absoluteTolerance");
        requireNonNegative(minStepSize, "minStepSize");
        requireNonNegative(initialStepSize, "initialStepSize");
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps no puede ser negativo: " + maxSteps);
        }

        relativeTolerance = relativeTolerance == 0.0 ? DEFAULT_RELATIVE_TOLERANCE : relativeTolerance;
        absoluteTolerance = absoluteTolerance == 0.0 ? DEFAULT_ABSOLUTE_TOLERANCE : absoluteTolerance;
        maxSteps = maxSteps == 0 ? DEFAULT_MAX_STEPS : maxSteps;
        minStepSize = minStepSize == 0.0 ? DEFAULT_MIN_STEP_SIZE : minStepSize;
        boundaryMode = boundaryMode == null ? BoundaryMode.FREEZE_RATE : boundaryMode;
    }

    /**
     * Configuración estándar: tolerancias 1e-6 / 1e-9 y congelación de la frontera.
     */
    public static SolverConfig defaults() {
        return SolverConfig.builder().build();
    }

    private static void requireNonNegative(double value, String name) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " debe ser un número finito no negativo: " + value);
        }
    }

    /**
     * Cómo se trata la frontera del dominio durante la integración.
     */
    public enum BoundaryMode {
        /**
         * Anula la tasa de cambio en las filas y columnas del borde.
         * El valor de frontera es el que trae la condición inicial y se mantiene durante
         * toda la ejecución.
         */
        FREEZE_RATE,

        /**
         * Dirichlet explícito: el borde del estado se reasigna con un campo de frontera
         * f(x, y) antes de integrar y en cada evaluación, y su tasa de cambio es nula.
         * La instantánea inicial devuelta ya tiene el borde igual a f.
         */
        DIRICHLET
    }
}
