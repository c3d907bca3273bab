package mlr;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.staticfiles.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Web front end for the regression model.
 * Run with: mvn exec:java -Dexec.mainClass="mlr.WebApp"
 * Open http://localhost:7000 (or http://127.0.0.1:7000)
 */
public class WebApp {

    private static final Logger log = LoggerFactory.getLogger(WebApp.class);

    public static void main(String[] args) {
        AppConfig config = AppConfig.load();
        int port = config.getPort();
        RegressionApi api = new RegressionApi(config.newSolver());

        Javalin app = Javalin.create(cfg -> {
            cfg.staticFiles.add("/public", Location.CLASSPATH);
        }).start("0.0.0.0", port);

        // Serve index from classpath so it always works (avoids static path issues)
        app.get("/", ctx -> ctx.contentType("text/html").result(loadIndexHtml()));

        app.post("/api/fit", ctx -> sendJson(ctx, 200, api.fit(ctx.body())));

        app.get("/api/sample", ctx -> sendJson(ctx, 200, RegressionApi.sampleRequest()));

        app.get("/api/health", ctx -> {
            Map<String, Object> h = new HashMap<>();
            h.put("status", "ok");
            h.put("port", port);
            sendJson(ctx, 200, h);
        });

        log.info("Regression web app: http://localhost:{}", port);
    }

    private static void sendJson(Context ctx, int status, Object body) {
        ctx.status(status).contentType("application/json").result(RegressionApi.GSON.toJson(body));
    }

    private static String loadIndexHtml() {
        try (InputStream in = WebApp.class.getResourceAsStream("/public/index.html")) {
            if (in == null) throw new IllegalStateException("Missing /public/index.html on classpath");
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new RuntimeException("Could not load index.html", e);
        }
    }
}
