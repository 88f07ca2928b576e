package regsel;

import com.google.gson.reflect.TypeToken;
import org.junit.jupiter.api.Test;
import regsel.ml.DesignMatrix;
import regsel.ml.RankDeficiencyException;

import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AnalysisServiceTest {

    private static final Type MAP = new TypeToken<Map<String, Object>>() {}.getType();

    private final AnalysisService service = new AnalysisService(new AnalysisConfig(7000, 0.05, 200, 1L, 4, 2, 1e-7));

    private static Map<String, Object> sample(Object... keyValues) {
        Map<String, Object> req = new HashMap<>();
        req.put("sample", true);
        req.put("response", "y");
        for (int i = 0; i < keyValues.length; i += 2) req.put((String) keyValues[i], keyValues[i + 1]);
        return req;
    }

    @Test
    @SuppressWarnings("unchecked")
    void fitReportsCoefficientsTestsAndDiagnostics() {
        Map<String, Object> out = service.fit(sample());
        assertThat(out.get("n")).isEqualTo(60);
        assertThat((List<?>) out.get("coefficients")).hasSize(5);
        assertThat(out).containsKeys("rss", "sigma", "rSquared", "aic", "bic", "overallF", "conditionNumber");
        Map<String, Double> vif = (Map<String, Double>) out.get("vif");
        assertThat(vif).containsOnlyKeys("x1", "x2", "x3", "x4");
        assertThat((List<?>) out.get("aliased")).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void aliasedColumnsAreRefusedUnlessDropRequested() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("y", List.of(1.0, 3.0, 2.0, 5.0, 4.0, 6.0));
        data.put("a", List.of(1.0, 2.0, 3.0, 4.0, 5.0, 6.0));
        data.put("b", List.of(2.0, 4.0, 6.0, 8.0, 10.0, 12.0));
        Map<String, Object> req = new HashMap<>();
        req.put("data", data);

        assertThatThrownBy(() -> service.fit(req)).isInstanceOf(RankDeficiencyException.class)
            .hasMessageContaining("b");
        req.put("dropAliased", true);
        Map<String, Object> out = service.fit(req);
        List<String> aliased = (List<String>) out.get("aliased");
        assertThat(aliased).containsExactly("b");
    }

    @Test
    void designDropsRowsWithMissingValues() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("y", Arrays.asList(1.0, 2.0, null, 4.0, 5.0));
        data.put("x", Arrays.asList(1.0, 2.5, 3.0, null, 4.5));
        Map<String, Object> req = new HashMap<>();
        req.put("data", data);
        DesignMatrix d = service.design(req);
        assertThat(d.rowIds()).containsExactly(0, 1, 4);
        assertThat(d.columnNames()).containsExactly(DesignMatrix.INTERCEPT, "x");
    }

    @Test
    void subsetsRankByTheRequestedCriterion() {
        Map<String, Object> out = service.subsets(sample("criterion", "bic", "nbest", 2));
        assertThat(out.get("criterion")).isEqualTo("BIC");
        assertThat((List<?>) out.get("bestPerSize")).hasSize(7);
        assertThat((List<?>) out.get("best")).isNotEmpty();
        assertThat((Long) out.get("evaluated")).isPositive();
    }

    @Test
    void bootstrapModes() {
        Map<String, Object> residual = service.bootstrap(sample("term", "x2"));
        assertThat(residual.get("completed")).isEqualTo(200);
        assertThat((Double) residual.get("lower")).isLessThan((Double) residual.get("upper"));

        Map<String, Object> cases = service.bootstrap(sample("term", "x2", "mode", "case", "replicates", 50));
        assertThat(cases.get("requested")).isEqualTo(50);

        assertThatThrownBy(() -> service.bootstrap(sample("term", "x2", "mode", "jackknife")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.bootstrap(sample()))
            .hasMessageContaining("needs a term");
    }

    @Test
    void permutationOfAColumn() {
        Map<String, Object> out = service.permute(sample("target", "x3", "statistic", "abs-t", "term", "x3"));
        assertThat((Double) out.get("p")).isBetween(0.0, 1.0);
        assertThat(out.get("target")).asString().contains("x3");
    }

    @Test
    void transformsUseTheirDefaultGrids() {
        Map<String, Object> boxcox = service.boxcox(sample());
        assertThat(boxcox.get("kind")).isEqualTo("BOX_COX");
        assertThat((List<?>) boxcox.get("profile")).hasSize(81);
        assertThat(boxcox).containsKeys("rss", "coefficients");

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("y", List.of(-0.5, 0.2, 1.4, 2.9, 4.1, 6.3, 8.8));
        data.put("x", List.of(1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0));
        Map<String, Object> req = new HashMap<>();
        req.put("data", data);
        req.put("grid", Map.of("from", 0.0, "to", 3.0, "step", 0.5));
        Map<String, Object> logshift = service.logshift(req);
        assertThat(logshift.get("kind")).isEqualTo("LOG_SHIFT");
        // alpha = 0 and 0.5 leave y + alpha <= 0
        assertThat((List<?>) logshift.get("profile")).hasSize(5);
    }

    @Test
    void handleAnswersErrorsAsJson() {
        Map<String, Object> blank = WebApp.GSON.fromJson(WebApp.handle("  ", service::fit), MAP);
        assertThat(blank).containsEntry("error", "Missing request body");

        Map<String, Object> broken = WebApp.GSON.fromJson(WebApp.handle("{not json", service::fit), MAP);
        assertThat((String) broken.get("error")).startsWith("Invalid JSON");

        Map<String, Object> noData = WebApp.GSON.fromJson(WebApp.handle("{}", service::fit), MAP);
        assertThat((String) noData.get("error")).contains("data");

        Map<String, Object> unknown = WebApp.GSON.fromJson(
            WebApp.handle("{\"sample\": true, \"predictors\": [\"zz\"]}", service::fit), MAP);
        assertThat((String) unknown.get("error")).contains("zz");
    }

    @Test
    void handleRunsTheAnalysisOnDecodedJson() {
        String body = "{\"sample\": true, \"response\": \"y\", \"predictors\": [\"x1\", \"x2\"], \"alpha\": 0.1}";
        Map<String, Object> out = WebApp.GSON.fromJson(WebApp.handle(body, service::fit), MAP);
        assertThat(out).doesNotContainKey("error");
        assertThat((List<?>) out.get("coefficients")).hasSize(3);
        assertThat(((Number) out.get("n")).intValue()).isEqualTo(60);
    }
}
