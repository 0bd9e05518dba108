package firespectral.exception;

import lombok.Getter;

/**
 * La resolución N es negativa o los operadores 1D no forman una base coherente.
 */
@Getter
public class InvalidDimensionException extends SpectralSolverException {

    private final int dimension;

    public InvalidDimensionException(String message, int dimension) {
        super(message);
        this.dimension = dimension;
    }
}
