package mlr.ml;

/** A feature vector passed to predict is missing or has the wrong width. */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
