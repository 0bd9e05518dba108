package firespectral.physics.solver.impl;

import firespectral.config.SolverConfig.BoundaryMode;
import firespectral.domain.simulation.TransportCoefficients;
import firespectral.domain.spectral.SpectralGrid;
import firespectral.physics.solver.RhsAssembler;
import firespectral.utils.MatrixChecks;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

import java.util.Objects;

/**
 * Lado derecho espectral de la ecuación de reacción-convección-difusión 2D.
 * <p>
 * {@code W' = μ(W·D2xᵀ + D2y·W) − [(W·Dxᵀ)∘V1 + (Dy·W)∘V2] + A∘W}
 * <p>
 * La convección se discretiza en forma no conservativa {@code v·∇u}: no incluye las
 * derivadas de la velocidad que aparecerían en {@code ∇·(uv)}.
 * <p>
 * Tras el cálculo, las filas y columnas del borde de W' se fuerzan a cero. Eso fija la
 * TASA de cambio en la frontera, no su valor: el borde conserva lo que tenía el estado
 * inicial. En modo {@link BoundaryMode#DIRICHLET} además se sustituye el borde del estado
 * por los valores de frontera antes de derivar.
 * <p>
 * No es thread-safe: cada instancia reutiliza buffers de trabajo y debe quedar confinada
 * a una única integración.
 */
public class SpectralRhsAssembler implements RhsAssembler {

    @Getter
    private final SpectralGrid grid;
    @Getter
    private final TransportCoefficients coefficients;
    @Getter
    private final BoundaryMode boundaryMode;
    private final DMatrixRMaj boundaryValues;

    // Copias propias de operadores y coeficientes para el bucle de evaluación
    private final DMatrixRMaj dx;
    private final DMatrixRMaj dy;
    private final DMatrixRMaj d2x;
    private final DMatrixRMaj d2y;
    private final double[] reaction;
    private final double[] velocityX;
    private final double[] velocityY;

    private final DMatrixRMaj effectiveState;
    private final DMatrixRMaj laplacianX;
    private final DMatrixRMaj laplacianY;
    private final DMatrixRMaj gradientX;
    private final DMatrixRMaj gradientY;

    /**
     * Constructor con la política de frontera por defecto (congelación de la tasa).
     */
    public SpectralRhsAssembler(SpectralGrid grid, TransportCoefficients coefficients) {
        this(grid, coefficients, BoundaryMode.FREEZE_RATE, null);
    }

    /**
     * @param grid           Malla con los operadores de derivada.
     * @param coefficients   μ, A, V1 y V2 con la forma de la malla.
     * @param boundaryMode   Política de frontera.
     * @param boundaryValues Valores de frontera f; obligatorio solo en modo DIRICHLET.
     */
    public SpectralRhsAssembler(SpectralGrid grid, TransportCoefficients coefficients,
                                BoundaryMode boundaryMode, DMatrixRMaj boundaryValues) {
        this.grid = Objects.requireNonNull(grid, "La malla no puede ser nula.");
        this.coefficients = Objects.requireNonNull(coefficients, "Los coeficientes no pueden ser nulos.");
        this.boundaryMode = Objects.requireNonNull(boundaryMode, "La política de frontera no puede ser nula.");

        int rows = grid.rows();
        int cols = grid.cols();
        MatrixChecks.requireShape(coefficients.reaction(), rows, cols, "A");

        this.dx = grid.dx();
        this.dy = grid.dy();
        this.d2x = grid.d2x();
        this.d2y = grid.d2y();
        this.reaction = coefficients.reaction().data;
        this.velocityX = coefficients.velocityX().data;
        this.velocityY = coefficients.velocityY().data;

        if (boundaryMode == BoundaryMode.DIRICHLET) {
            Objects.requireNonNull(boundaryValues, "El modo DIRICHLET necesita valores de frontera.");
            this.boundaryValues = MatrixChecks.requireShape(boundaryValues, rows, cols, "frontera").copy();
        } else {
            this.boundaryValues = null;
        }

        this.effectiveState = new DMatrixRMaj(rows, cols);
        this.laplacianX = new DMatrixRMaj(rows, cols);
        this.laplacianY = new DMatrixRMaj(rows, cols);
        this.gradientX = new DMatrixRMaj(rows, cols);
        this.gradientY = new DMatrixRMaj(rows, cols);
    }

    @Override
    public String getName() {
        return "Chebyshev_RCD_" + (boundaryMode == BoundaryMode.DIRICHLET ? "Dirichlet" : "FreezeRate");
    }

    @Override
    public void evaluate(DMatrixRMaj state, double time, DMatrixRMaj rate) {
        int rows = grid.rows();
        int cols = grid.cols();
        MatrixChecks.requireShape(state, rows, cols, "W");
        MatrixChecks.requireShape(rate, rows, cols, "W'");

        DMatrixRMaj w = state;
        if (boundaryMode == BoundaryMode.DIRICHLET) {
            effectiveState.setTo(state);
            overwriteBoundary(effectiveState, boundaryValues);
            w = effectiveState;
        }

        // Difusión: el operador en x actúa por la derecha, el de y por la izquierda
        CommonOps_DDRM.multTransB(w, d2x, laplacianX);
        CommonOps_DDRM.mult(d2y, w, laplacianY);

        // Convección: gradiente direccional por cada eje
        CommonOps_DDRM.multTransB(w, dx, gradientX);
        CommonOps_DDRM.mult(dy, w, gradientY);

        double mu = coefficients.diffusivity();
        double[] a = reaction;
        double[] v1 = velocityX;
        double[] v2 = velocityY;
        double[] lx = laplacianX.data;
        double[] ly = laplacianY.data;
        double[] gx = gradientX.data;
        double[] gy = gradientY.data;
        double[] wd = w.data;
        double[] out = rate.data;

        int n = rows * cols;
        for (int k = 0; k < n; k++) {
            double diffusion = mu * (lx[k] + ly[k]);
            double convection = gx[k] * v1[k] + gy[k] * v2[k];
            double reaction = a[k] * wd[k];
            out[k] = diffusion - convection + reaction;
        }

        zeroBoundary(rate);
    }

    /**
     * Anula la primera y última fila y la primera y última columna.
     */
    static void zeroBoundary(DMatrixRMaj matrix) {
        int rows = matrix.getNumRows();
        int cols = matrix.getNumCols();
        for (int j = 0; j < cols; j++) {
            matrix.unsafe_set(0, j, 0.0);
            matrix.unsafe_set(rows - 1, j, 0.0);
        }
        for (int i = 0; i < rows; i++) {
            matrix.unsafe_set(i, 0, 0.0);
            matrix.unsafe_set(i, cols - 1, 0.0);
        }
    }

    /**
     * Copia el borde de {@code source} sobre {@code target}, dejando el interior intacto.
     */
    public static void overwriteBoundary(DMatrixRMaj target, DMatrixRMaj source) {
        int rows = target.getNumRows();
        int cols = target.getNumCols();
        for (int j = 0; j < cols; j++) {
            target.unsafe_set(0, j, source.unsafe_get(0, j));
            target.unsafe_set(rows - 1, j, source.unsafe_get(rows - 1, j));
        }
        for (int i = 0; i < rows; i++) {
            target.unsafe_set(i, 0, source.unsafe_get(i, 0));
            target.unsafe_set(i, cols - 1, source.unsafe_get(i, cols - 1));
        }
    }
}
