package mlr;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import mlr.ml.LeastSquaresSolver;
import mlr.ml.RegressionDataset;
import mlr.ml.RegressionModel;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON request handling behind {@link WebApp}, kept free of HTTP types.
 * <p>
 * Request: {@code {"features": [[..], ..], "labels": [..], "predict": [[..], ..]}}
 * ({@code predict} optional).
 */
public class RegressionApi {

    static final Gson GSON = new Gson();

    private final LeastSquaresSolver solver;

    public RegressionApi(LeastSquaresSolver solver) {
        this.solver = solver;
    }

    /** Fit the posted data; never throws, errors come back under "error". */
    public Map<String, Object> fit(String body) {
        Map<String, Object> out = new HashMap<>();
        try {
            if (body == null || body.isBlank()) {
                out.put("error", "Missing request body");
                return out;
            }
            Type type = new TypeToken<Map<String, Object>>() {}.getType();
            Map<String, Object> req = GSON.fromJson(body, type);
            if (req == null) {
                out.put("error", "Invalid JSON");
                return out;
            }
            double[][] features = toMatrix(req.get("features"), "features");
            double[] labels = toVector(req.get("labels"), "labels");

            RegressionModel model = new RegressionModel(features, labels, solver);
            out.put("fitted", model.isFitted());
            out.put("featureCount", model.featureCount());
            if (!model.isFitted()) {
                model.failure().ifPresent(f -> {
                    Map<String, Object> failure = new HashMap<>();
                    failure.put("reason", f.getReason().name());
                    failure.put("message", f.getMessage());
                    out.put("failure", failure);
                });
                return out;
            }
            out.put("weights", toList(model.weights().orElseThrow()));
            out.put("rss", model.residualSumOfSquares().orElseThrow());
            out.put("rSquared", model.rSquared().orElseThrow());
            out.put("adjustedRSquared", model.adjustedRSquared().orElseThrow());
            out.put("fittedValues", toFiniteList(model.predict(features).orElseThrow(), "fitted value"));
            if (req.get("predict") != null) {
                double[][] inputs = toMatrix(req.get("predict"), "predict");
                out.put("predictions", toFiniteList(model.predict(inputs).orElseThrow(), "prediction"));
            }
        } catch (RuntimeException e) {
            String msg = e.getMessage();
            out.put("error", msg != null && !msg.isEmpty() ? msg : e.getClass().getSimpleName());
        }
        return out;
    }

    /** Sample dataset in request form. */
    public static Map<String, Object> sampleRequest() {
        RegressionDataset sample = RegressionDataset.sample();
        Map<String, Object> out = new HashMap<>();
        List<List<Double>> rows = new ArrayList<>();
        for (double[] row : sample.getFeatures()) rows.add(toList(row));
        out.put("features", rows);
        out.put("labels", toList(sample.getLabels()));
        return out;
    }

    private static double[][] toMatrix(Object obj, String name) {
        if (!(obj instanceof List<?>)) {
            throw new IllegalArgumentException("Missing or invalid '" + name + "' array");
        }
        List<?> rows = (List<?>) obj;
        double[][] out = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            out[i] = toVector(rows.get(i), name + "[" + i + "]");
        }
        return out;
    }

    private static double[] toVector(Object obj, String name) {
        if (!(obj instanceof List<?>)) {
            throw new IllegalArgumentException("Missing or invalid '" + name + "' array");
        }
        List<?> list = (List<?>) obj;
        double[] out = new double[list.size()];
        for (int i = 0; i < list.size(); i++) {
            Object o = list.get(i);
            if (!(o instanceof Number)) {
                throw new IllegalArgumentException("All '" + name + "' values must be numbers");
            }
            out[i] = ((Number) o).doubleValue();
        }
        return out;
    }

    /** JSON has no Infinity/NaN, so such outputs are reported as an error instead. */
    private static List<Double> toFiniteList(double[] a, String name) {
        for (int i = 0; i < a.length; i++) {
            if (!Double.isFinite(a[i])) {
                throw new IllegalArgumentException("The " + name + " at row " + i + " is not finite: " + a[i]);
            }
        }
        return toList(a);
    }

    private static List<Double> toList(double[] a) {
        List<Double> list = new ArrayList<>(a.length);
        for (double v : a) list.add(v);
        return list;
    }
}
