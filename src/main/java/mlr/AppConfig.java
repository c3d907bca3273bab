package mlr;

import mlr.ml.LeastSquaresSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * Settings read from {@code /mlr.properties} on the classpath. The {@code PORT}
 * environment variable overrides {@code server.port}.
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    static final String RESOURCE = "/mlr.properties";
    static final int DEFAULT_PORT = 7000;

    private final int port;
    private final double singularityTolerance;

    AppConfig(Properties props, Map<String, String> env) {
        int p = parseInt(props.getProperty("server.port"), DEFAULT_PORT, "server.port");
        String envPort = env.get("PORT");
        if (envPort != null && !envPort.isBlank()) {
            p = parseInt(envPort, p, "PORT");
        }
        this.port = p;
        double tol = parseDouble(props.getProperty("solver.singularityTolerance"),
            LeastSquaresSolver.DEFAULT_SINGULARITY_TOLERANCE, "solver.singularityTolerance");
        this.singularityTolerance = (tol >= 0 && Double.isFinite(tol)) ? tol : LeastSquaresSolver.DEFAULT_SINGULARITY_TOLERANCE;
    }

    public static AppConfig load() {
        Properties props = new Properties();
        try (InputStream in = AppConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            log.warn("Could not read {}, using defaults", RESOURCE, e);
        }
        return new AppConfig(props, System.getenv());
    }

    public int getPort() { return port; }
    public double getSingularityTolerance() { return singularityTolerance; }

    public LeastSquaresSolver newSolver() {
        return new LeastSquaresSolver(singularityTolerance);
    }

    private static int parseInt(String value, int def, String key) {
        if (value == null || value.isBlank()) return def;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {}={}", key, value);
            return def;
        }
    }

    private static double parseDouble(String value, double def, String key) {
        if (value == null || value.isBlank()) return def;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {}={}", key, value);
            return def;
        }
    }
}
