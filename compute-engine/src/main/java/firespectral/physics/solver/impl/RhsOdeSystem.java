package firespectral.physics.solver.impl;

import firespectral.physics.solver.OdeSystem;
import firespectral.physics.solver.RhsAssembler;
import org.ejml.data.DMatrixRMaj;

import java.util.Objects;

/**
 * Adapta un {@link RhsAssembler} matricial al vector plano que maneja el integrador.
 * El aplanado es fila a fila (row-major), el mismo orden interno de {@link DMatrixRMaj},
 * así que no hay copias: las matrices envuelven directamente los arrays del integrador.
 */
public class RhsOdeSystem implements OdeSystem {

    private final RhsAssembler assembler;
    private final int rows;
    private final int cols;

    public RhsOdeSystem(RhsAssembler assembler, int rows, int cols) {
        this.assembler = Objects.requireNonNull(assembler, "El ensamblador no puede ser nulo.");
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Dimensiones inválidas: " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
    }

    @Override
    public int getDimension() {
        return rows * cols;
    }

    @Override
    public void computeDerivatives(double time, double[] state, double[] rate) {
        DMatrixRMaj w = DMatrixRMaj.wrap(rows, cols, state);
        DMatrixRMaj wPrime = DMatrixRMaj.wrap(rows, cols, rate);
        assembler.evaluate(w, time, wPrime);
    }
}
