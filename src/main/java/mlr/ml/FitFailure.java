package mlr.ml;

/**
 * Why a {@link RegressionModel} ended up without a fitted model.
 */
public final class FitFailure {

    public enum Reason {
        SINGULAR_MATRIX,
        NUMERICAL_INSTABILITY
    }

    private final Reason reason;
    private final String message;

    public FitFailure(Reason reason, String message) {
        this.reason = reason;
        this.message = message;
    }

    static FitFailure of(ModelFitException e) {
        String msg = e.getMessage();
        return new FitFailure(e.reason(), msg != null && !msg.isEmpty() ? msg : e.getClass().getSimpleName());
    }

    public Reason getReason() { return reason; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return reason + ": " + message;
    }
}
