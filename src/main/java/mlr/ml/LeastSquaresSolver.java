package mlr.ml;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordinary Least Squares solve of a design matrix against a label vector.
 * <p>
 * Minimises ‖y − Xw‖² through a QR decomposition of X (X = QR, then Rw = Qᵗy) so the
 * normal equations (XᵗX)w = Xᵗy are never formed explicitly.
 * <p>
 * X is expected to carry the intercept column already. Instances hold no state beyond
 * the tolerance and may be shared between threads.
 */
public class LeastSquaresSolver {

    private static final Logger log = LoggerFactory.getLogger(LeastSquaresSolver.class);

    /** Size of a diagonal entry of R, relative to its column norm, under which it counts as zero. */
    public static final double DEFAULT_SINGULARITY_TOLERANCE = 1e-12;

    private final double singularityTolerance;

    public LeastSquaresSolver() {
        this(DEFAULT_SINGULARITY_TOLERANCE);
    }

    public LeastSquaresSolver(double singularityTolerance) {
        if (!(singularityTolerance >= 0) || Double.isInfinite(singularityTolerance)) {
            throw new IllegalArgumentException("singularity tolerance must be a finite value >= 0, got " + singularityTolerance);
        }
        this.singularityTolerance = singularityTolerance;
    }

    public double getSingularityTolerance() {
        return singularityTolerance;
    }

    /**
     * Solve for the weights and the residual sum of squares.
     *
     * @param design design matrix (rows = observations, columns = intercept + features)
     * @param labels response vector (length = number of observations)
     * @throws SingularDesignMatrixException if X does not have full column rank
     * @throws NumericalInstabilityException if inputs or results are not finite
     */
    public FittedModel solve(double[][] design, double[] labels) {
        if (design.length == 0) throw new IllegalArgumentException("design matrix has no rows");
        int n = design.length;
        int cols = design[0].length;
        if (labels.length != n) {
            throw new IllegalArgumentException("design has " + n + " rows but " + labels.length + " labels were given");
        }
        if (n < cols) {
            throw new SingularDesignMatrixException(
                "Design matrix has " + n + " rows for " + cols + " columns; at least " + cols + " observations are required");
        }
        requireFinite(design, labels);
        log.debug("Solving least squares for {} observations x {} columns", n, cols);

        RealMatrix x = MatrixUtils.createRealMatrix(design);
        RealVector y = MatrixUtils.createRealVector(labels);

        QRDecomposition qr = new QRDecomposition(x);
        requireFullRank(qr.getR(), x, cols);

        RealVector w;
        try {
            DecompositionSolver solver = qr.getSolver();
            w = solver.solve(y);
        } catch (SingularMatrixException e) {
            throw new SingularDesignMatrixException("Design matrix is singular", e);
        }

        // r = y - Xw
        RealVector residuals = y.subtract(x.operate(w));
        double rss = residuals.dotProduct(residuals);

        double[] weights = w.toArray();
        for (int j = 0; j < weights.length; j++) {
            if (!Double.isFinite(weights[j])) {
                throw new NumericalInstabilityException("Weight " + j + " is not finite: " + weights[j]);
            }
        }
        if (!Double.isFinite(rss)) {
            throw new NumericalInstabilityException("Residual sum of squares overflowed");
        }

        // R² = 1 - SS_res / SS_tot
        double meanY = 0;
        for (double v : labels) meanY += v;
        meanY /= n;
        double ssTot = 0;
        for (double v : labels) ssTot += (v - meanY) * (v - meanY);
        double rSquared = (ssTot > 0) ? 1.0 - (rss / ssTot) : 0;
        double adjustedRSquared = (n > cols) ? 1.0 - (1.0 - rSquared) * (n - 1) / (n - cols) : rSquared;

        return new FittedModel(weights, rss, rSquared, adjustedRSquared);
    }

    /** Each |R_jj| is measured against the norm of column j, so rescaling a feature does not change the verdict. */
    private void requireFullRank(RealMatrix r, RealMatrix x, int cols) {
        for (int j = 0; j < cols; j++) {
            double columnNorm = x.getColumnVector(j).getNorm();
            double diag = Math.abs(r.getEntry(j, j));
            if (columnNorm == 0) {
                throw new SingularDesignMatrixException("Design matrix is rank deficient: column " + j + " is all zeros");
            }
            if (diag <= singularityTolerance * columnNorm) {
                throw new SingularDesignMatrixException(j == 0
                    ? "Design matrix is rank deficient: column 0 is numerically zero"
                    : "Design matrix is rank deficient: column " + j + " is linearly dependent on columns 0.." + (j - 1));
            }
        }
    }

    private static void requireFinite(double[][] design, double[] labels) {
        for (int i = 0; i < design.length; i++) {
            for (int j = 0; j < design[i].length; j++) {
                if (!Double.isFinite(design[i][j])) {
                    throw new NumericalInstabilityException("Non-finite value " + design[i][j] + " at row " + i + ", column " + j);
                }
            }
            if (!Double.isFinite(labels[i])) {
                throw new NumericalInstabilityException("Non-finite label " + labels[i] + " at row " + i);
            }
        }
    }
}
