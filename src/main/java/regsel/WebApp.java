package regsel;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonSyntaxException;
import com.google.gson.reflect.TypeToken;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.staticfiles.Location;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import regsel.data.DataTable;
import regsel.data.SampleData;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * HTTP front end: one JSON endpoint per analysis.
 * Run with: mvn exec:java -Dexec.mainClass="regsel.WebApp"
 * Open http://localhost:7000 (or set PORT).
 */
public class WebApp {

    private static final Logger logger = LogManager.getLogger(WebApp.class);

    static final Gson GSON = new GsonBuilder().serializeSpecialFloatingPointValues().create();
    private static final Type REQUEST_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    public static void main(String[] args) {
        AnalysisConfig config = AnalysisConfig.fromEnvironment();
        logger.info("Starting with {}", config);
        Javalin app = create(new AnalysisService(config)).start("0.0.0.0", config.getPort());
        logger.info("regsel web app: http://localhost:{}", app.port());
    }

    static Javalin create(AnalysisService service) {
        Javalin app = Javalin.create(cfg -> {
            cfg.staticFiles.add("/public", Location.CLASSPATH);
        });

        app.get("/index.html", ctx -> ctx.contentType("text/html").result(loadIndexHtml()));

        app.post("/api/fit", ctx -> analyze(ctx, service::fit));
        app.post("/api/subsets", ctx -> analyze(ctx, service::subsets));
        app.post("/api/bootstrap", ctx -> analyze(ctx, service::bootstrap));
        app.post("/api/permute", ctx -> analyze(ctx, service::permute));
        app.post("/api/boxcox", ctx -> analyze(ctx, service::boxcox));
        app.post("/api/logshift", ctx -> analyze(ctx, service::logshift));

        app.get("/api/sample", ctx -> {
            DataTable table = SampleData.table();
            Map<String, Object> columns = new LinkedHashMap<>();
            for (String name : table.columnNames()) columns.put(name, table.column(name));
            sendJson(ctx, columns);
        });

        app.get("/api/health", ctx -> {
            Map<String, Object> h = new HashMap<>();
            h.put("status", "ok");
            h.put("port", service.getConfig().getPort());
            sendJson(ctx, h);
        });
        return app;
    }

    /** Decode the body, run the analysis, and answer {"error": ...} on any failure. */
    static String handle(String body, Function<Map<String, Object>, Map<String, Object>> analysis) {
        Map<String, Object> out;
        try {
            if (body == null || body.isBlank()) {
                out = error("Missing request body");
            } else {
                Map<String, Object> req = GSON.fromJson(body, REQUEST_TYPE);
                out = req == null ? error("Invalid JSON") : analysis.apply(req);
            }
        } catch (JsonSyntaxException e) {
            out = error("Invalid JSON: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.debug("Analysis failed", e);
            String msg = e.getMessage();
            out = error(msg != null && !msg.isEmpty() ? msg : e.getClass().getSimpleName());
        }
        return GSON.toJson(out);
    }

    private static void analyze(Context ctx, Function<Map<String, Object>, Map<String, Object>> analysis) {
        ctx.status(200).contentType("application/json").result(handle(ctx.body(), analysis));
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> out = new HashMap<>();
        out.put("error", message);
        return out;
    }

    private static void sendJson(Context ctx, Object body) {
        ctx.status(200).contentType("application/json").result(GSON.toJson(body));
    }

    private static String loadIndexHtml() {
        try (InputStream in = WebApp.class.getResourceAsStream("/public/index.html")) {
            if (in == null) throw new IllegalStateException("Missing /public/index.html on classpath");
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Could not load index.html", e);
        }
    }
}
