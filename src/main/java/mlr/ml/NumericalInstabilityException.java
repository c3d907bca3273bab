package mlr.ml;

/** Inputs or intermediate results are not finite (NaN, overflow). */
public class NumericalInstabilityException extends ModelFitException {

    public NumericalInstabilityException(String message) {
        super(message);
    }

    @Override
    public FitFailure.Reason reason() {
        return FitFailure.Reason.NUMERICAL_INSTABILITY;
    }
}
