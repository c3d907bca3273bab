package mlr.ml;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Feature rows and labels ready to be fitted by {@link RegressionModel}.
 */
public class RegressionDataset {

    private final double[][] features;
    private final double[] labels;

    public RegressionDataset(double[][] features, double[] labels) {
        if (features == null || labels == null) throw new IllegalArgumentException("features and labels required");
        this.features = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            this.features[i] = features[i] != null ? features[i].clone() : null;
        }
        this.labels = labels.clone();
    }

    /** Copy of the feature rows. */
    public double[][] getFeatures() {
        double[][] out = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            out[i] = features[i] != null ? features[i].clone() : null;
        }
        return out;
    }

    public double[] getLabels() { return labels.clone(); }
    public int size() { return labels.length; }

    public RegressionModel fit() {
        return new RegressionModel(features, labels);
    }

    public RegressionModel fit(LeastSquaresSolver solver) {
        return new RegressionModel(features, labels, solver);
    }

    /** Load a dataset from a CSV. Expected: one row per observation, first column = label, the rest = features. */
    public static RegressionDataset fromCsv(Path path) throws IOException {
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    static RegressionDataset parse(List<String> lines) {
        if (lines.isEmpty()) throw new IllegalArgumentException("Empty file");
        List<Double> labelList = new ArrayList<>();
        List<double[]> featureList = new ArrayList<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] parts = line.split("[,;\t]+");
            if (parts.length < 2) continue;
            double label;
            double[] row = new double[parts.length - 1];
            try {
                label = Double.parseDouble(parts[0].trim());
                for (int j = 1; j < parts.length; j++) row[j - 1] = Double.parseDouble(parts[j].trim());
            } catch (NumberFormatException e) {
                continue; // header or invalid line
            }
            labelList.add(label);
            featureList.add(row);
        }
        if (labelList.isEmpty()) throw new IllegalArgumentException("No numeric rows with a label and at least one feature");
        double[] labels = labelList.stream().mapToDouble(Double::doubleValue).toArray();
        return new RegressionDataset(featureList.toArray(new double[0][]), labels);
    }

    /** Synthetic sample: y ≈ 3 + 2·x₁ − 0.5·x₂ with a little noise. */
    public static RegressionDataset sample() {
        double[][] x = {
            {1, 4}, {2, 1}, {3, 6}, {4, 2}, {5, 8}, {6, 3},
            {7, 5}, {8, 9}, {9, 2}, {10, 7}, {11, 4}, {12, 10}
        };
        double[] y = {
            3.1, 6.4, 5.9, 9.8, 9.1, 13.6,
            14.4, 14.6, 20.1, 19.4, 23.1, 21.9
        };
        return new RegressionDataset(x, y);
    }
}
