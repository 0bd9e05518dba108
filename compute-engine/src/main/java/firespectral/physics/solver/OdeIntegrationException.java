package firespectral.physics.solver;

import firespectral.domain.simulation.IntegrationStatistics;
import lombok.Getter;

/**
 * Fallo interno del integrador: paso por debajo del mínimo, derivada no finita
 * o límite de pasos agotado.
 * <p>
 * Lleva los estados de reporte ya completados para que la capa superior construya
 * la trayectoria parcial.
 */
@Getter
public class OdeIntegrationException extends RuntimeException {

    private final double lastTime;
    private final double[][] completedStates;
    private final IntegrationStatistics statistics;

    public OdeIntegrationException(String message, double lastTime, double[][] completedStates,
                                   IntegrationStatistics statistics) {
        super(message);
        this.lastTime = lastTime;
        this.completedStates = completedStates;
        this.statistics = statistics;
    }

    /**
     * Número de instantes de reporte completados antes del fallo.
     */
    public int getCompletedCount() {
        return completedStates.length;
    }
}
