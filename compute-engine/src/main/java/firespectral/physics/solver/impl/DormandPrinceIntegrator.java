package firespectral.physics.solver.impl;

import firespectral.config.SolverConfig;
import firespectral.domain.simulation.IntegrationStatistics;
import firespectral.physics.solver.OdeIntegrationException;
import firespectral.physics.solver.OdeIntegrator;
import firespectral.physics.solver.OdeSystem;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Objects;

/**
 * Integrador Runge-Kutta explícito embebido de Dormand-Prince 5(4) con control
 * adaptativo del paso.
 * <p>
 * Responsabilidades:
 * 1. Avanzar con la solución de 5º orden y estimar el error con la de 4º orden.
 * 2. Ajustar el paso con el controlador estándar {@code h·0.9·err^(-1/5)}, acotado a [0.2, 5].
 * 3. Recortar el paso para aterrizar exactamente en cada instante de reporte.
 * 4. Reutilizar la última etapa como primera del paso siguiente (FSAL).
 * <p>
 * Si el paso cae por debajo del mínimo, la derivada deja de ser finita de forma persistente
 * o se agota el presupuesto de pasos, lanza {@link OdeIntegrationException} con los
 * instantes de reporte ya completados. Nunca devuelve un resultado truncado.
 */
@Slf4j
@Getter
public class DormandPrinceIntegrator implements OdeIntegrator {

    private static final double SAFETY = 0.9;
    private static final double MIN_FACTOR = 0.2;
    private static final double MAX_FACTOR = 5.0;

    // Tablero de Butcher
    private static final double C2 = 1.0 / 5.0;
    private static final double C3 = 3.0 / 10.0;
    private static final double C4 = 4.0 / 5.0;
    private static final double C5 = 8.0 / 9.0;

    private static final double A21 = 1.0 / 5.0;
    private static final double A31 = 3.0 / 40.0;
    private static final double A32 = 9.0 / 40.0;
    private static final double A41 = 44.0 / 45.0;
    private static final double A42 = -56.0 / 15.0;
    private static final double A43 = 32.0 / 9.0;
    private static final double A51 = 19372.0 / 6561.0;
    private static final double A52 = -25360.0 / 2187.0;
    private static final double A53 = 64448.0 / 6561.0;
    private static final double A54 = -212.0 / 729.0;
    private static final double A61 = 9017.0 / 3168.0;
    private static final double A62 = -355.0 / 33.0;
    private static final double A63 = 46732.0 / 5247.0;
    private static final double A64 = 49.0 / 176.0;
    private static final double A65 = -5103.0 / 18656.0;

    // Pesos de 5º orden (coinciden con la última fila: propiedad FSAL)
    private static final double B1 = 35.0 / 384.0;
    private static final double B3 = 500.0 / 1113.0;
    private static final double B4 = 125.0 / 192.0;
    private static final double B5 = -2187.0 / 6784.0;
    private static final double B6 = 11.0 / 84.0;

    // Diferencia entre los pesos de 5º y 4º orden
    private static final double E1 = 71.0 / 57600.0;
    private static final double E3 = -71.0 / 16695.0;
    private static final double E4 = 71.0 / 1920.0;
    private static final double E5 = -17253.0 / 339200.0;
    private static final double E6 = 22.0 / 525.0;
    private static final double E7 = -1.0 / 40.0;

    private final double relativeTolerance;
    private final double absoluteTolerance;
    private final int maxSteps;
    private final double minStepSize;
    private final double initialStepSize;

    /**
     * Constructor por defecto: tolerancias de {@link SolverConfig#defaults()}.
     */
    public DormandPrinceIntegrator() {
        this(SolverConfig.defaults());
    }

    public DormandPrinceIntegrator(SolverConfig config) {
        Objects.requireNonNull(config, "La configuración del solver no puede ser nula.");
        this.relativeTolerance = config.relativeTolerance();
        this.absoluteTolerance = config.absoluteTolerance();
        this.maxSteps = config.maxSteps();
        this.minStepSize = config.minStepSize();
        this.initialStepSize = config.initialStepSize();
    }

    @Override
    public String getName() {
        return "DOPRI5(4)";
    }

    @Override
    public Solution integrate(OdeSystem system, double[] initial, double[] outputTimes) {
        Objects.requireNonNull(system, "El sistema no puede ser nulo.");
        Objects.requireNonNull(initial, "El estado inicial no puede ser nulo.");
        validateOutputTimes(outputTimes);
        int n = system.getDimension();
        if (initial.length != n) {
            throw new IllegalArgumentException(String.format(
                    "El estado inicial tiene %d componentes y el sistema %d.", initial.length, n));
        }

        double[][] outputs = new double[outputTimes.length][];
        outputs[0] = initial.clone();
        if (outputTimes.length == 1) {
            return new Solution(outputs, IntegrationStatistics.EMPTY);
        }

        double t = outputTimes[0];
        double horizon = outputTimes[outputTimes.length - 1] - t;
        double minStep = minStepSize * horizon;

        double[] y = initial.clone();
        double[] yNew = new double[n];
        double[] yStage = new double[n];
        double[] k1 = new double[n];
        double[] k2 = new double[n];
        double[] k3 = new double[n];
        double[] k4 = new double[n];
        double[] k5 = new double[n];
        double[] k6 = new double[n];
        double[] k7 = new double[n];

        long accepted = 0;
        long rejected = 0;
        long evaluations = 0;
        double lastAcceptedStep = 0.0;

        system.computeDerivatives(t, y, k1);
        evaluations++;
        if (!allFinite(k1)) {
            throw new OdeIntegrationException("La derivada en el estado inicial no es finita.", t,
                    Arrays.copyOf(outputs, 1), new IntegrationStatistics(0, 0, evaluations, 0.0));
        }

        double h;
        if (initialStepSize > 0.0) {
            h = initialStepSize;
        } else {
            h = estimateInitialStep(system, t, y, k1, yStage, k2, horizon);
            evaluations++;
        }
        h = Math.min(h, horizon);
        boolean previousRejected = false;

        log.debug("Integración DOPRI5: dimensión={}, horizonte={}, paso inicial={}", n, horizon, h);

        int nextOutput = 1;
        while (nextOutput < outputTimes.length) {
            double target = outputTimes[nextOutput];

            while (t < target) {
                if (accepted + rejected >= maxSteps) {
                    IntegrationStatistics stats = new IntegrationStatistics(accepted, rejected, evaluations, lastAcceptedStep);
                    log.warn("Presupuesto de pasos agotado ({}) en t={}", maxSteps, t);
                    throw new OdeIntegrationException(
                            "Se agotó el máximo de " + maxSteps + " pasos internos en t=" + t,
                            t, Arrays.copyOf(outputs, nextOutput), stats);
                }

                double step = Math.min(h, target - t);
                boolean clipped = step < h;

                // Etapas 2..6
                for (int i = 0; i < n; i++) {
                    yStage[i] = y[i] + step * (A21 * k1[i]);
                }
                system.computeDerivatives(t + C2 * step, yStage, k2);
                for (int i = 0; i < n; i++) {
                    yStage[i] = y[i] + step * (A31 * k1[i] + A32 * k2[i]);
                }
                system.computeDerivatives(t + C3 * step, yStage, k3);
                for (int i = 0; i < n; i++) {
                    yStage[i] = y[i] + step * (A41 * k1[i] + A42 * k2[i] + A43 * k3[i]);
                }
                system.computeDerivatives(t + C4 * step, yStage, k4);
                for (int i = 0; i < n; i++) {
                    yStage[i] = y[i] + step * (A51 * k1[i] + A52 * k2[i] + A53 * k3[i] + A54 * k4[i]);
                }
                system.computeDerivatives(t + C5 * step, yStage, k5);
                for (int i = 0; i < n; i++) {
                    yStage[i] = y[i] + step * (A61 * k1[i] + A62 * k2[i] + A63 * k3[i] + A64 * k4[i] + A65 * k5[i]);
                }
                system.computeDerivatives(t + step, yStage, k6);

                // Solución de 5º orden y última etapa (FSAL)
                for (int i = 0; i < n; i++) {
                    yNew[i] = y[i] + step * (B1 * k1[i] + B3 * k3[i] + B4 * k4[i] + B5 * k5[i] + B6 * k6[i]);
                }
                system.computeDerivatives(t + step, yNew, k7);
                evaluations += 6;

                double errorNorm = errorNorm(step, y, yNew, k1, k3, k4, k5, k6, k7);

                if (errorNorm <= 1.0) {
                    t = clipped ? target : t + step;
                    double[] swap = y;
                    y = yNew;
                    yNew = swap;
                    swap = k1;
                    k1 = k7;
                    k7 = swap;
                    accepted++;
                    lastAcceptedStep = step;

                    double factor = errorNorm == 0.0
                            ? MAX_FACTOR
                            : Math.min(MAX_FACTOR, Math.max(MIN_FACTOR, SAFETY * Math.pow(errorNorm, -0.2)));
                    if (previousRejected) {
                        factor = Math.min(1.0, factor);
                    }
                    double proposal = step * factor;
                    // Tras un paso recortado se conserva la propuesta anterior si era mayor
                    h = clipped ? Math.max(h, proposal) : proposal;
                    previousRejected = false;
                } else {
                    rejected++;
                    double factor = Double.isFinite(errorNorm)
                            ? Math.max(MIN_FACTOR, SAFETY * Math.pow(errorNorm, -0.2))
                            : MIN_FACTOR;
                    h = step * factor;
                    previousRejected = true;
                    log.debug("Paso rechazado en t={}: h={} (error={})", t, step, errorNorm);
                }

                double stepFloor = Math.max(minStep, 2.0 * Math.ulp(t));
                if (h < stepFloor) {
                    IntegrationStatistics stats = new IntegrationStatistics(accepted, rejected, evaluations, lastAcceptedStep);
                    log.warn("Paso por debajo del mínimo en t={}: h={} < {}", t, h, stepFloor);
                    throw new OdeIntegrationException(String.format(
                            "El paso (%.3e) cayó por debajo del mínimo (%.3e) en t=%.6g; el sistema es demasiado rígido o diverge.",
                            h, stepFloor, t), t, Arrays.copyOf(outputs, nextOutput), stats);
                }
            }

            outputs[nextOutput] = y.clone();
            log.debug("Instante de reporte {} alcanzado: t={} (aceptados={}, rechazados={})",
                    nextOutput, target, accepted, rejected);
            nextOutput++;
        }

        return new Solution(outputs, new IntegrationStatistics(accepted, rejected, evaluations, lastAcceptedStep));
    }

    /**
     * Norma RMS ponderada del error local: {@code sc_i = atol + rtol·max(|y_i|, |yNew_i|)}.
     * Devuelve NaN o infinito si el paso produjo valores no finitos.
     */
    private double errorNorm(double step, double[] y, double[] yNew,
                             double[] k1, double[] k3, double[] k4, double[] k5, double[] k6, double[] k7) {
        int n = y.length;
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            double error = step * (E1 * k1[i] + E3 * k3[i] + E4 * k4[i] + E5 * k5[i] + E6 * k6[i] + E7 * k7[i]);
            double scale = absoluteTolerance + relativeTolerance * Math.max(Math.abs(y[i]), Math.abs(yNew[i]));
            double ratio = error / scale;
            sum += ratio * ratio;
        }
        return Math.sqrt(sum / n);
    }

    /**
     * Estimación del paso inicial (Hairer, Nørsett y Wanner) a partir de la derivada en t0
     * y de una evaluación de prueba.
     */
    private double estimateInitialStep(OdeSystem system, double t, double[] y, double[] f0,
                                       double[] yTrial, double[] f1, double horizon) {
        int n = y.length;
        double d0 = 0.0;
        double d1 = 0.0;
        for (int i = 0; i < n; i++) {
            double scale = absoluteTolerance + relativeTolerance * Math.abs(y[i]);
            d0 += (y[i] / scale) * (y[i] / scale);
            d1 += (f0[i] / scale) * (f0[i] / scale);
        }
        d0 = Math.sqrt(d0 / n);
        d1 = Math.sqrt(d1 / n);

        double h0 = (d0 < 1e-5 || d1 < 1e-5) ? 1e-6 : 0.01 * d0 / d1;
        h0 = Math.min(h0, horizon);

        for (int i = 0; i < n; i++) {
            yTrial[i] = y[i] + h0 * f0[i];
        }
        system.computeDerivatives(t + h0, yTrial, f1);

        double d2 = 0.0;
        for (int i = 0; i < n; i++) {
            double scale = absoluteTolerance + relativeTolerance * Math.abs(y[i]);
            double diff = (f1[i] - f0[i]) / scale;
            d2 += diff * diff;
        }
        d2 = Math.sqrt(d2 / n) / h0;

        double dMax = Math.max(d1, d2);
        double h1 = dMax <= 1e-15 ? Math.max(1e-6, h0 * 1e-3) : Math.pow(0.01 / dMax, 0.2);
        double h = Math.min(100.0 * h0, h1);
        return Double.isFinite(h) && h > 0.0 ? h : h0;
    }

    private static void validateOutputTimes(double[] outputTimes) {
        Objects.requireNonNull(outputTimes, "Los instantes de reporte no pueden ser nulos.");
        if (outputTimes.length == 0) {
            throw new IllegalArgumentException("Se necesita al menos un instante de reporte.");
        }
        for (int i = 0; i < outputTimes.length; i++) {
            if (!Double.isFinite(outputTimes[i])) {
                throw new IllegalArgumentException("Instante de reporte no finito en la posición " + i);
            }
            if (i > 0 && outputTimes[i] <= outputTimes[i - 1]) {
                throw new IllegalArgumentException("Los instantes de reporte deben ser estrictamente crecientes.");
            }
        }
    }

    private static boolean allFinite(double[] values) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
