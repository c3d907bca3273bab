package mlr.ml;

/** Design matrix is rank deficient: collinear columns or fewer rows than columns. */
public class SingularDesignMatrixException extends ModelFitException {

    public SingularDesignMatrixException(String message) {
        super(message);
    }

    public SingularDesignMatrixException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FitFailure.Reason reason() {
        return FitFailure.Reason.SINGULAR_MATRIX;
    }
}
