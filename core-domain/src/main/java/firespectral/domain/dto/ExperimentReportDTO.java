package firespectral.domain.dto;

import firespectral.config.ExperimentConfig;
import firespectral.config.SolverConfig;
import firespectral.domain.simulation.ExperimentResult;
import firespectral.domain.simulation.IntegrationStatistics;

/**
 * Informe exportable de un experimento: parámetros escalares, coste y trayectoria.
 * Los campos de coeficientes (funciones) no se serializan.
 */
public record ExperimentReportDTO(
        int resolution,
        double diffusivity,
        double deltaTime,
        int timeSteps,
        SolverConfig solverConfig,
        long elapsedMillis,
        IntegrationStatistics statistics,
        TrajectoryDTO trajectory
) {
    public static ExperimentReportDTO from(ExperimentResult result) {
        ExperimentConfig config = result.config();
        return new ExperimentReportDTO(
                config.getResolution(),
                config.getDiffusivity(),
                config.getDeltaTime(),
                config.getTimeSteps(),
                config.getSolverConfig(),
                result.elapsedMillis(),
                result.trajectory().getStatistics(),
                TrajectoryDTO.from(result.trajectory()));
    }
}
