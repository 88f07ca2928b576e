package regsel;

import org.junit.jupiter.api.Test;
import regsel.ml.EmpiricalDistribution;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class ResultTablesTest {

    @Test
    void renderPadsColumnsToTheWidestCell() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", 1);
        first.put("bb", "x");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("a", 22);
        second.put("bb", "yyy");
        assertThat(ResultTables.render(List.of(first, second)))
            .isEqualTo("a   bb \n1   x  \n22  yyy\n");
        assertThat(ResultTables.render(List.of())).isEqualTo("(no rows)\n");
    }

    @Test
    void renderedNumbersParseBackExactly() {
        double value = 0.1 + 0.2;
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("v", value);
        String[] lines = ResultTables.render(List.of(row)).split("\n");
        assertThat(Double.parseDouble(lines[1].trim())).isEqualTo(value);
    }

    @Test
    void quantileRowsFollowTheReportedLevels() {
        double[] values = new double[101];
        for (int i = 0; i < values.length; i++) values[i] = i;
        List<Map<String, Object>> rows = ResultTables.quantiles(new EmpiricalDistribution(50, values, 101, 0));
        assertThat(rows).hasSize(ResultTables.QUANTILES.length);
        assertThat(rows.get(1)).containsEntry("quantile", 0.025).containsEntry("value", 2.5);
        assertThat(rows.get(4)).containsEntry("value", 50.0);
    }
}
