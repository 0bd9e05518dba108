package firespectral.exception;

/**
 * Raíz de la taxonomía de errores del solver espectral.
 * <p>
 * Todas las excepciones son no comprobadas: se lanzan en el punto de detección
 * y se propagan sin reintentos hasta el orquestador del experimento.
 */
public class SpectralSolverException extends RuntimeException {

    public SpectralSolverException(String message) {
        super(message);
    }

    public SpectralSolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
