package firespectral.physics.solver;

import firespectral.domain.simulation.IntegrationStatistics;

/**
 * Define el contrato para integradores temporales de sistemas de EDOs.
 * <p>
 * Responsabilidad de Estabilidad:
 * la separación entre instantes de reporte NO es el paso interno. La implementación
 * subdivide o alarga sus pasos según su control de error y solo garantiza devolver el
 * estado exactamente en cada instante pedido.
 */
public interface OdeIntegrator extends SolverComponent {

    /**
     * Integra el sistema desde {@code outputTimes[0]} reportando el estado en cada instante.
     *
     * @param system      Sistema a integrar.
     * @param initial     Estado en {@code outputTimes[0]} (no se modifica).
     * @param outputTimes Instantes de reporte, estrictamente crecientes.
     * @return Un estado por instante de reporte (el primero es copia de {@code initial}).
     * @throws OdeIntegrationException si no se alcanza el horizonte dentro de los límites del paso.
     */
    Solution integrate(OdeSystem system, double[] initial, double[] outputTimes);

    /**
     * Estados en los instantes de reporte y coste de la integración.
     */
    record Solution(double[][] states, IntegrationStatistics statistics) {
    }
}
