package regsel.ml;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DesignMatrixTest {

    private static DesignMatrix small() {
        return DesignMatrix.withIntercept(
            new double[][] {{1, 10}, {2, 20}, {3, 31}, {4, 39}},
            new double[] {1.5, 2.5, 3.5, 4.0},
            "a", "b");
    }

    @Test
    void interceptIsColumnZero() {
        DesignMatrix d = small();
        assertThat(d.hasIntercept()).isTrue();
        assertThat(d.columnNames()).containsExactly(DesignMatrix.INTERCEPT, "a", "b");
        assertThat(d.column(0)).containsOnly(1.0);
        assertThat(d.predictorNames()).containsExactly("a", "b");
        assertThat(d.predictorIndices()).containsExactly(1, 2);
    }

    @Test
    void rejectsFewerRowsThanColumns() {
        assertThatThrownBy(() -> DesignMatrix.withIntercept(new double[][] {{1, 2}, {3, 4}}, new double[] {1, 2}, "a", "b"))
            .isInstanceOf(DimensionException.class)
            .hasMessageContaining("fewer than");
    }

    @Test
    void rejectsResponseLengthMismatch() {
        assertThatThrownBy(() -> DesignMatrix.withIntercept(new double[][] {{1}, {2}, {3}}, new double[] {1, 2}, "a"))
            .isInstanceOf(DimensionException.class);
    }

    @Test
    void rejectsRaggedRowsAndNonFiniteValues() {
        assertThatThrownBy(() -> DesignMatrix.withoutIntercept(new double[][] {{1, 2}, {3}}, new double[] {1, 2}, "a", "b"))
            .isInstanceOf(DimensionException.class);
        assertThatThrownBy(() -> DesignMatrix.withoutIntercept(new double[][] {{1}, {Double.NaN}}, new double[] {1, 2}, "a"))
            .isInstanceOf(RegressionException.class)
            .hasMessageContaining("not finite");
    }

    @Test
    void unknownColumnIsReported() {
        assertThatThrownBy(() -> small().columnIndex("zzz"))
            .isInstanceOf(UnknownTermException.class)
            .hasMessageContaining("zzz");
    }

    @Test
    void selectionKeepsInterceptInFrontAndRowIds() {
        DesignMatrix d = small().selectRows(new int[] {3, 2, 1, 0});
        DesignMatrix s = d.select(List.of("b", DesignMatrix.INTERCEPT));
        assertThat(s.columnNames()).containsExactly(DesignMatrix.INTERCEPT, "b");
        assertThat(s.hasIntercept()).isTrue();
        assertThat(s.rowIds()).containsExactly(3, 2, 1, 0);
        assertThat(s.column(1)).containsExactly(39, 31, 20, 10);

        DesignMatrix noIntercept = small().without(DesignMatrix.INTERCEPT);
        assertThat(noIntercept.hasIntercept()).isFalse();
        assertThat(noIntercept.columnNames()).containsExactly("a", "b");
    }

    @Test
    void modificationsReturnNewMatrices() {
        DesignMatrix d = small();
        DesignMatrix y2 = d.withResponse(new double[] {9, 9, 9, 9});
        DesignMatrix c2 = d.withColumn(1, new double[] {0, 0, 0, 1});
        assertThat(d.response()).containsExactly(1.5, 2.5, 3.5, 4.0);
        assertThat(d.column(1)).containsExactly(1, 2, 3, 4);
        assertThat(y2.response()).containsOnly(9.0);
        assertThat(c2.column(1)).containsExactly(0, 0, 0, 1);

        double[] leaked = d.response();
        leaked[0] = 100;
        assertThat(d.response(0)).isEqualTo(1.5);
    }

    @Test
    void interceptCannotBeReplaced() {
        assertThatThrownBy(() -> small().withColumn(0, new double[] {2, 2, 2, 2}))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builderAcceptsRowIds() {
        DesignMatrix d = DesignMatrix.builder()
            .response(new double[] {1, 2, 3})
            .column("x", new double[] {4, 5, 7})
            .rowIds(new int[] {2, 5, 9})
            .build();
        assertThat(d.rowIds()).containsExactly(2, 5, 9);
        assertThat(d.columns()).isEqualTo(2);
    }
}
