package mlr.ml;

import java.util.Arrays;

/**
 * Result of a successful least squares fit.
 * <p>
 * {@code weights[0]} is the intercept β₀, {@code weights[i]} the slope of feature i-1.
 * Immutable: arrays are copied on the way in and on the way out.
 */
public final class FittedModel {

    private final double[] weights;
    private final double rss;
    private final double rSquared;
    private final double adjustedRSquared;

    public FittedModel(double[] weights, double rss, double rSquared, double adjustedRSquared) {
        this.weights = weights.clone();
        this.rss = rss;
        this.rSquared = rSquared;
        this.adjustedRSquared = adjustedRSquared;
    }

    /** All coefficients [β₀, β₁, ..., βₚ] */
    public double[] getWeights() {
        return weights.clone();
    }

    /** Intercept β₀ */
    public double getIntercept() {
        return weights[0];
    }

    /** Number of features p (weights minus the intercept). */
    public int getFeatureCount() {
        return weights.length - 1;
    }

    /** Residual sum of squares over the training rows. */
    public double getRss() { return rss; }
    public double getRSquared() { return rSquared; }
    public double getAdjustedRSquared() { return adjustedRSquared; }

    /** β₀ + Σ βᵢ·xᵢ₋₁; callers check the width. */
    double apply(double[] x) {
        double y = weights[0];
        for (int i = 0; i < x.length; i++) {
            y += weights[i + 1] * x[i];
        }
        return y;
    }

    @Override
    public String toString() {
        return "FittedModel{weights=" + Arrays.toString(weights) + ", rss=" + rss + ", rSquared=" + rSquared + "}";
    }
}
