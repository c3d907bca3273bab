package mlr.ml;

/**
 * The least squares solve could not produce a usable solution.
 * <p>
 * {@link RegressionModel} never lets this escape its constructor; it is turned into
 * a {@link FitFailure} on the model instead.
 */
public abstract class ModelFitException extends RuntimeException {

    protected ModelFitException(String message) {
        super(message);
    }

    protected ModelFitException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Kind of failure, as reported by {@link FitFailure#getReason()}. */
    public abstract FitFailure.Reason reason();
}
