package mlr;

import mlr.ml.RegressionDataset;
import mlr.ml.RegressionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.Locale;

/**
 * Demo: fit the built-in sample (or a CSV given as first argument) and print the model.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        AppConfig config = AppConfig.load();

        RegressionDataset dataset = RegressionDataset.sample();
        String source = "built-in sample";
        if (args.length > 0 && args[0] != null && !args[0].trim().isEmpty()) {
            try {
                dataset = RegressionDataset.fromCsv(Paths.get(args[0].trim()));
                source = args[0].trim();
            } catch (Exception e) {
                String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.error("CSV error: {}", msg);
                System.exit(1);
            }
        }

        RegressionModel model = dataset.fit(config.newSolver());
        System.out.println("=== Multivariate linear regression (" + source + ", " + dataset.size() + " rows) ===");
        if (!model.isFitted()) {
            System.out.println("Training failed: " + model.failure().map(Object::toString).orElse("unknown"));
            return;
        }
        double[] w = model.weights().orElseThrow();
        System.out.printf(Locale.ROOT, "Intercept β₀ = %.4f%n", w[0]);
        for (int i = 1; i < w.length; i++) {
            System.out.printf(Locale.ROOT, "Slope β%d = %.4f%n", i, w[i]);
        }
        System.out.printf(Locale.ROOT, "RSS = %.4f, R² = %.4f, Adjusted R² = %.4f%n",
            model.residualSumOfSquares().orElseThrow(), model.rSquared().orElseThrow(), model.adjustedRSquared().orElseThrow());

        double[] fitted = model.predict(dataset.getFeatures()).orElseThrow();
        System.out.println("Fitted (first 5): " + format(fitted, 5));

        double[] next = meanRow(dataset.getFeatures());
        System.out.println("Prediction at feature means " + format(next, next.length) + ": "
            + String.format(Locale.ROOT, "%.2f", model.predict(next).orElseThrow()));
    }

    private static double[] meanRow(double[][] x) {
        double[] mean = new double[x[0].length];
        for (double[] row : x) {
            for (int j = 0; j < mean.length; j++) mean[j] += row[j];
        }
        for (int j = 0; j < mean.length; j++) mean[j] /= x.length;
        return mean;
    }

    private static String format(double[] a, int max) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < Math.min(a.length, max); i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format(Locale.ROOT, "%.2f", a[i]));
        }
        if (a.length > max) sb.append("...");
        sb.append("]");
        return sb.toString();
    }
}
