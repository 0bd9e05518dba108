package firespectral.domain.simulation;

/**
 * Métricas de coste de una integración adaptativa.
 *
 * @param acceptedSteps         Pasos internos aceptados por el control de error.
 * @param rejectedSteps         Pasos rechazados y repetidos con un paso menor.
 * @param derivativeEvaluations Evaluaciones del lado derecho (ensamblador RHS).
 * @param lastStepSize          Último tamaño de paso aceptado.
 */
public record IntegrationStatistics(
        long acceptedSteps,
        long rejectedSteps,
        long derivativeEvaluations,
        double lastStepSize
) {
    public static final IntegrationStatistics EMPTY = new IntegrationStatistics(0, 0, 0, 0.0);

    public long totalSteps() {
        return acceptedSteps + rejectedSteps;
    }
}
