package regsel;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AnalysisConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("REGSEL_REPLICATES");
        System.clearProperty("REGSEL_ALPHA");
        System.clearProperty("REGSEL_SEED");
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty("REGSEL_REPLICATES", "250");
        System.setProperty("REGSEL_SEED", " 99 ");
        AnalysisConfig config = AnalysisConfig.fromEnvironment();
        assertThat(config.getReplicates()).isEqualTo(250);
        assertThat(config.getSeed()).isEqualTo(99L);
        assertThat(config.getAlpha()).isEqualTo(0.05);
    }

    @Test
    void unparsableValuesFallBackToDefaults() {
        System.setProperty("REGSEL_ALPHA", "five percent");
        assertThat(AnalysisConfig.fromEnvironment().getAlpha()).isEqualTo(AnalysisConfig.defaults().getAlpha());
    }

    @Test
    void outOfRangeValuesAreRejected() {
        assertThatThrownBy(() -> new AnalysisConfig(7000, 1.5, 10, 1, 3, 1, 1e-7))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AnalysisConfig(7000, 0.05, 0, 1, 3, 1, 1e-7))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
