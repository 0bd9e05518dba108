package firespectral.exception;

import firespectral.domain.simulation.Trajectory;
import lombok.Getter;

/**
 * El integrador adaptativo no pudo cumplir sus restricciones de tolerancia o de paso
 * mínimo antes de alcanzar el horizonte solicitado.
 * <p>
 * Transporta el último tiempo alcanzado con éxito y la trayectoria parcial con todos
 * los instantes de reporte completados antes del fallo. Nunca se devuelve un resultado
 * truncado en silencio: el llamador decide qué hacer con los datos parciales.
 */
@Getter
public class IntegrationFailureException extends SpectralSolverException {

    /**
     * Tiempo más lejano alcanzado por un paso aceptado.
     */
    private final double lastTime;

    /**
     * Instantáneas completadas antes del fallo (puede contener solo la condición inicial).
     */
    private final Trajectory partialTrajectory;

    public IntegrationFailureException(String message, double lastTime, Trajectory partialTrajectory, Throwable cause) {
        super(message, cause);
        this.lastTime = lastTime;
        this.partialTrajectory = partialTrajectory;
    }
}
