package mlr.ml;

/**
 * Training data handed to {@link RegressionModel} is structurally invalid
 * (empty, mismatched lengths, ragged rows). Raised before any numerical work.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
