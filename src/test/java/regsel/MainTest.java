package regsel;

import org.junit.jupiter.api.Test;
import regsel.data.DataTable;
import regsel.data.SampleData;
import regsel.ml.DesignMatrix;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class MainTest {

    private final AnalysisConfig config = new AnalysisConfig(7000, 0.05, 100, 3L, 3, 2, 1e-7);

    @Test
    void reportCoversEveryAnalysis() {
        DataTable table = SampleData.table();
        DesignMatrix design = table.toDesignMatrix("y", List.of("x1", "x2", "x3", "x4"), true);
        String report = Main.run(design, config);
        assertThat(report)
            .contains("=== Least squares fit (n = 60) ===")
            .contains("=== Best subsets (sizes 1..3) ===")
            .contains("Best by AIC")
            .contains("Residual bootstrap of x1")
            .contains("BOX_COX");
    }

    @Test
    void nonPositiveResponseFallsBackToShiftedLog() {
        DataTable table = SampleData.table();
        double[] y = table.column("y");
        double[] shifted = new double[y.length];
        for (int i = 0; i < y.length; i++) shifted[i] = y[i] - 5;
        DesignMatrix design = table.toDesignMatrix("y", List.of("x1", "x2"), true).withResponse(shifted);
        assertThat(Main.run(design, config)).contains("LOG_SHIFT");
    }
}
