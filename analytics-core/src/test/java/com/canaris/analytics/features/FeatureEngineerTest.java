package com.canaris.analytics.features;

import com.canaris.analytics.exception.InsufficientDataException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeatureEngineerTest {

    private final FeatureEngineer engineer = new FeatureEngineer();

    @Test
    void buildsOneVectorPerValueWithDefaultLayout() {
        double[] values = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

        List<FeatureVector> vectors = engineer.transform(values);

        assertThat(vectors).hasSize(10);
        assertThat(vectors).allSatisfy(v -> assertThat(v.length()).isEqualTo(6));
        assertThat(FeatureConfig.defaults().featureNames())
                .containsExactly("value", "rolling_mean_6", "rolling_std_6", "rolling_min_6", "rolling_max_6", "lag_1");
    }

    @Test
    void firstPositionUsesOnlyItselfAndRepeatsValueForLag() {
        FeatureVector first = engineer.transform(new double[]{4, 8, 8, 8, 8, 8, 8, 8, 8, 8}).get(0);

        assertThat(first.toArray()).containsExactly(4, 4, 0, 4, 4, 4);
    }

    @Test
    void lastPositionAggregatesTrailingWindow() {
        FeatureVector last = engineer.transform(new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10}).get(9);

        assertThat(last.value()).isEqualTo(10);
        assertThat(last.get(1)).isCloseTo(7.5, within(1e-9));
        assertThat(last.get(2)).isCloseTo(Math.sqrt(35.0 / 12.0), within(1e-9));
        assertThat(last.get(3)).isEqualTo(5);
        assertThat(last.get(4)).isEqualTo(10);
        assertThat(last.get(5)).isEqualTo(9);
        assertThat(last.getPosition()).isEqualTo(9);
    }

    @Test
    void multipleWindowsAndLagsExtendTheVector() {
        FeatureConfig config = FeatureConfig.builder().rollingWindow(3).rollingWindow(5).lag(1).lag(2).build();
        FeatureEngineer custom = new FeatureEngineer(config);

        List<FeatureVector> vectors = custom.transform(new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11});

        assertThat(config.dimensions()).isEqualTo(11);
        assertThat(vectors.get(10).length()).isEqualTo(11);
        assertThat(vectors.get(10).get(9)).isEqualTo(10);
        assertThat(vectors.get(10).get(10)).isEqualTo(9);
        assertThat(vectors.get(1).get(10)).isEqualTo(2);
    }

    @Test
    void rejectsShortSeries() {
        assertThatThrownBy(() -> engineer.transform(new double[9]))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("10")
                .hasMessageContaining("9")
                .satisfies(e -> {
                    InsufficientDataException ide = (InsufficientDataException) e;
                    assertThat(ide.getRequired()).isEqualTo(10);
                    assertThat(ide.getActual()).isEqualTo(9);
                });
    }

    @Test
    void rejectsNonPositiveWindows() {
        assertThatThrownBy(() -> new FeatureEngineer(FeatureConfig.builder().rollingWindow(0).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FeatureEngineer(FeatureConfig.builder().rollingWindow(3).lag(-1).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
