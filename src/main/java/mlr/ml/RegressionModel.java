package mlr.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Multivariate linear regression fitted once, at construction.
 * <p>
 * Model: y = β₀ + β₁x₁ + β₂x₂ + ... + βₚxₚ
 * <p>
 * Structurally invalid training data fails the constructor with a
 * {@link ConfigurationException}. A numerically failed fit (rank deficient or non-finite)
 * does not throw: the instance is left unfitted, {@link #failure()} tells why, and the
 * weight/RSS/predict queries return empty values. There is no re-fit; build a new
 * instance with different data.
 */
public class RegressionModel {

    private static final Logger log = LoggerFactory.getLogger(RegressionModel.class);

    private final int featureCount;
    private final FittedModel model;
    private final FitFailure failure;

    /**
     * @param xt feature rows (no intercept column), all of the same width
     * @param y  labels, one per row of {@code xt}
     */
    public RegressionModel(double[][] xt, double[] y) {
        this(xt, y, new LeastSquaresSolver());
    }

    public RegressionModel(double[][] xt, double[] y, LeastSquaresSolver solver) {
        validate(xt, y);
        this.featureCount = xt[0].length;

        FittedModel fitted = null;
        FitFailure failed = null;
        try {
            fitted = solver.solve(designMatrix(xt), y);
            log.debug("Fitted {} observations x {} features, rss={}", xt.length, featureCount, fitted.getRss());
        } catch (ModelFitException e) {
            failed = FitFailure.of(e);
            log.warn("Linear regression training failed on {} observations x {} features: {}",
                xt.length, featureCount, failed);
        }
        this.model = fitted;
        this.failure = failed;
    }

    private static void validate(double[][] xt, double[] y) {
        if (xt == null || xt.length == 0) {
            throw new ConfigurationException("Cannot perform a multivariate linear regression on undefined or empty features");
        }
        if (y == null || y.length == 0) {
            throw new ConfigurationException("Cannot train a multivariate linear regression with undefined or empty labels");
        }
        if (xt.length != y.length) {
            throw new ConfigurationException("Size of input data " + xt.length + " and labels " + y.length + " differ");
        }
        if (xt[0] == null) {
            throw new ConfigurationException("Feature row 0 is undefined");
        }
        int width = xt[0].length;
        for (int i = 1; i < xt.length; i++) {
            if (xt[i] == null) {
                throw new ConfigurationException("Feature row " + i + " is undefined");
            }
            if (xt[i].length != width) {
                throw new ConfigurationException("Feature row " + i + " has " + xt[i].length + " values, expected " + width);
            }
        }
    }

    /** Prepend a column of 1s for the intercept. */
    static double[][] designMatrix(double[][] xt) {
        int n = xt.length;
        int features = xt[0].length;
        double[][] design = new double[n][features + 1];
        for (int i = 0; i < n; i++) {
            design[i][0] = 1.0;
            System.arraycopy(xt[i], 0, design[i], 1, features);
        }
        return design;
    }

    public boolean isFitted() {
        return model != null;
    }

    /** Why training failed; empty when the model is fitted. */
    public Optional<FitFailure> failure() {
        return Optional.ofNullable(failure);
    }

    /** Number of features p a prediction input must have. */
    public int featureCount() {
        return featureCount;
    }

    public Optional<FittedModel> model() {
        return Optional.ofNullable(model);
    }

    /** [β₀, β₁, ..., βₚ] if the model was trained. */
    public Optional<double[]> weights() {
        return model != null ? Optional.of(model.getWeights()) : Optional.empty();
    }

    public OptionalDouble residualSumOfSquares() {
        return model != null ? OptionalDouble.of(model.getRss()) : OptionalDouble.empty();
    }

    public OptionalDouble rSquared() {
        return model != null ? OptionalDouble.of(model.getRSquared()) : OptionalDouble.empty();
    }

    public OptionalDouble adjustedRSquared() {
        return model != null ? OptionalDouble.of(model.getAdjustedRSquared()) : OptionalDouble.empty();
    }

    /**
     * Predict y for one observation (no intercept in x).
     *
     * @throws InvalidInputException if {@code x} is null or does not hold exactly
     *                               {@link #featureCount()} values, fitted or not
     * @return the prediction, or empty if the model was never trained
     */
    public OptionalDouble predict(double[] x) {
        checkWidth(x, -1);
        if (model == null) return OptionalDouble.empty();
        return OptionalDouble.of(model.apply(x));
    }

    /** Predict y for each row of X; empty if the model was never trained. */
    public Optional<double[]> predict(double[][] x) {
        if (x == null) {
            throw new InvalidInputException("Input rows for prediction are undefined");
        }
        for (int i = 0; i < x.length; i++) {
            checkWidth(x[i], i);
        }
        if (model == null) return Optional.empty();
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = model.apply(x[i]);
        }
        return Optional.of(out);
    }

    private void checkWidth(double[] x, int row) {
        String where = row < 0 ? "" : " at row " + row;
        if (x == null) {
            throw new InvalidInputException("Input data for prediction" + where + " is undefined");
        }
        if (x.length != featureCount) {
            throw new InvalidInputException(
                "Size of input data for prediction" + where + " is " + x.length + ", should be " + featureCount);
        }
    }
}
