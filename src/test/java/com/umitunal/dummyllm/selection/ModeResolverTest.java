package com.umitunal.dummyllm.selection;

import com.umitunal.dummyllm.config.ModeWeights;
import com.umitunal.dummyllm.config.SimulatorConfig;
import com.umitunal.dummyllm.core.Mode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ModeResolverTest {

    private static final ModeWeights WEIGHTS =
            ModeWeights.parse("ok=70,echo=10,slow=10,fail=5,hang=3,timeout=2,flaky=0");

    private ModeResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ModeResolver(SimulatorConfig.defaults().getFlakySplit());
    }

    @ParameterizedTest
    @EnumSource(value = Mode.class, names = {"OK", "ECHO", "SLOW", "FAIL", "HANG", "TIMEOUT"})
    @DisplayName("Should return fixed policies without drawing")
    void testFixedPolicy(Mode policy) {
        DrawSource draws = new SplitMixDrawSource(1337);

        Mode resolved = resolver.resolve(policy, WEIGHTS, draws);

        assertThat(resolved).isEqualTo(policy);
        assertThat(draws.drawCount()).isZero();
    }

    @Test
    @DisplayName("Should resolve the same random sequence across independent runs")
    void testRandomDeterminism() {
        // Given
        DrawSource firstRun = new SplitMixDrawSource(1337);
        DrawSource secondRun = new SplitMixDrawSource(1337);

        // When
        List<Mode> first = new ArrayList<>();
        List<Mode> second = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            first.add(resolver.resolve(Mode.RANDOM, WEIGHTS, firstRun));
            second.add(new ModeResolver(SimulatorConfig.defaults().getFlakySplit())
                    .resolve(Mode.RANDOM, WEIGHTS, secondRun));
        }

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first).allMatch(Mode::isConcrete);
        assertThat(firstRun.drawCount()).isEqualTo(500);
    }

    @Test
    @DisplayName("Should match configured weights within chi-square tolerance")
    void testWeightedProportionality() {
        // Given
        int samples = 10_000;
        DrawSource draws = new SplitMixDrawSource(1337);
        Map<Mode, Integer> histogram = new EnumMap<>(Mode.class);

        // When
        for (int i = 0; i < samples; i++) {
            histogram.merge(resolver.resolve(Mode.RANDOM, WEIGHTS, draws), 1, Integer::sum);
        }

        // Then - 5 degrees of freedom, critical value at p = 0.001
        double chiSquare = 0;
        for (Map.Entry<Mode, Integer> entry : WEIGHTS.asMap().entrySet()) {
            if (entry.getValue() == 0) {
                assertThat(histogram).doesNotContainKey(entry.getKey());
                continue;
            }
            double expected = samples * entry.getValue() / (double) WEIGHTS.totalWeight();
            double observed = histogram.getOrDefault(entry.getKey(), 0);
            chiSquare += (observed - expected) * (observed - expected) / expected;
        }
        assertThat(chiSquare).isLessThan(20.515);
    }

    @Test
    @DisplayName("Should fall back to ok without drawing when all weights are zero")
    void testAllZeroFallback() {
        // Given
        ModeWeights zero = ModeWeights.parse("ok=0,echo=0,slow=0,fail=0,hang=0,timeout=0,flaky=0");
        DrawSource draws = new SplitMixDrawSource(1337);

        // When
        for (int i = 0; i < 50; i++) {
            assertThat(resolver.resolve(Mode.RANDOM, zero, draws)).isEqualTo(Mode.OK);
        }

        // Then - the next draw is still the first one of the sequence
        assertThat(draws.drawCount()).isZero();
        assertThat(draws.next()).isEqualTo(new SplitMixDrawSource(1337).next());
    }

    @Test
    @DisplayName("Should resolve flaky to ok, fail or hang with one draw per job")
    void testFlakyUsesOneDraw() {
        DrawSource draws = new SplitMixDrawSource(1337);

        for (int i = 0; i < 100; i++) {
            assertThat(resolver.resolve(Mode.FLAKY, WEIGHTS, draws)).isIn(Mode.OK, Mode.FAIL, Mode.HANG);
        }

        assertThat(draws.drawCount()).isEqualTo(100);
    }

    @Test
    @DisplayName("Should split flaky jobs into roughly equal thirds")
    void testFlakyEqualSplit() {
        // Given
        DrawSource draws = new SplitMixDrawSource(1337);
        Map<Mode, Integer> histogram = new EnumMap<>(Mode.class);

        // When
        for (int i = 0; i < 3000; i++) {
            histogram.merge(resolver.resolve(Mode.FLAKY, WEIGHTS, draws), 1, Integer::sum);
        }

        // Then
        assertThat(histogram).containsOnlyKeys(Mode.OK, Mode.FAIL, Mode.HANG);
        assertThat(histogram.values()).allSatisfy(count -> assertThat(count).isBetween(880, 1120));
    }

    @Test
    @DisplayName("Should reproduce flaky assignments per index across runs")
    void testFlakyReproducible() {
        DrawSource firstRun = new SplitMixDrawSource(99);
        DrawSource secondRun = new SplitMixDrawSource(99);

        for (int i = 0; i < 200; i++) {
            assertThat(resolver.resolve(Mode.FLAKY, WEIGHTS, firstRun))
                    .as("job %d", i)
                    .isEqualTo(resolver.resolve(Mode.FLAKY, WEIGHTS, secondRun));
        }
    }

    @Test
    @DisplayName("Should honour a custom flaky split")
    void testCustomFlakySplit() {
        // Given - never hang, never succeed
        ModeResolver failOnly = new ModeResolver(SimulatorConfig.newBuilder()
                .withFlakySplit(0, 1, 0)
                .build()
                .getFlakySplit());
        DrawSource draws = new SplitMixDrawSource(5);

        // Then
        for (int i = 0; i < 50; i++) {
            assertThat(failOnly.resolve(Mode.FLAKY, WEIGHTS, draws)).isEqualTo(Mode.FAIL);
        }
    }

    @Test
    @DisplayName("Should resolve a flaky bucket in the random table with a single draw")
    void testRandomFlakyBucket() {
        // Given
        ModeWeights flakyOnly = ModeWeights.parse("flaky=9");
        DrawSource draws = new SplitMixDrawSource(1337);
        Map<Mode, Integer> histogram = new EnumMap<>(Mode.class);

        // When
        for (int i = 0; i < 900; i++) {
            histogram.merge(resolver.resolve(Mode.RANDOM, flakyOnly, draws), 1, Integer::sum);
        }

        // Then
        assertThat(draws.drawCount()).isEqualTo(900);
        assertThat(histogram).containsOnlyKeys(Mode.OK, Mode.FAIL, Mode.HANG);
    }

    @ParameterizedTest
    @ValueSource(strings = {"flaky=1", "flaky=4"})
    @DisplayName("Should split a flaky-only random table into equal thirds for any flaky weight")
    void testRandomFlakyBucketProportions(String spec) {
        // Given
        ModeWeights flakyOnly = ModeWeights.parse(spec);
        DrawSource draws = new SplitMixDrawSource(1337);
        Map<Mode, Integer> histogram = new EnumMap<>(Mode.class);

        // When
        for (int i = 0; i < 3000; i++) {
            histogram.merge(resolver.resolve(Mode.RANDOM, flakyOnly, draws), 1, Integer::sum);
        }

        // Then
        assertThat(histogram).containsOnlyKeys(Mode.OK, Mode.FAIL, Mode.HANG);
        assertThat(histogram.values()).allSatisfy(count -> assertThat(count).isBetween(880, 1120));
    }

    @Test
    @DisplayName("Should reach every flaky outcome when the flaky weight is smaller than the split")
    void testRandomSmallFlakyWeight() {
        // Given
        ModeWeights weights = ModeWeights.parse("ok=1,flaky=2");
        DrawSource draws = new SplitMixDrawSource(1337);
        Map<Mode, Integer> histogram = new EnumMap<>(Mode.class);

        // When
        for (int i = 0; i < 3000; i++) {
            histogram.merge(resolver.resolve(Mode.RANDOM, weights, draws), 1, Integer::sum);
        }

        // Then - ok gets its own third plus a third of the flaky share
        assertThat(histogram.get(Mode.FAIL)).isBetween(580, 760);
        assertThat(histogram.get(Mode.HANG)).isBetween(580, 760);
        assertThat(histogram.get(Mode.OK)).isBetween(1560, 1780);
        assertThat(draws.drawCount()).isEqualTo(3000);
    }

    @Test
    @DisplayName("Should map weight ranges in canonical order")
    void testBucketBoundaries() {
        ModeWeights weights = ModeWeights.parse("ok=2,fail=1,timeout=3");

        assertThat(ModeResolver.select(weights, 0)).isEqualTo(Mode.OK);
        assertThat(ModeResolver.select(weights, 1)).isEqualTo(Mode.OK);
        assertThat(ModeResolver.select(weights, 2)).isEqualTo(Mode.FAIL);
        assertThat(ModeResolver.select(weights, 3)).isEqualTo(Mode.TIMEOUT);
        assertThat(ModeResolver.select(weights, 5)).isEqualTo(Mode.TIMEOUT);
        assertThatThrownBy(() -> ModeResolver.select(weights, 6))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should reject a flaky split that weights other modes")
    void testInvalidFlakySplit() {
        assertThatThrownBy(() -> new ModeResolver(ModeWeights.parse("ok=1,slow=1")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("slow");
        assertThatThrownBy(() -> new ModeResolver(ModeWeights.parse("")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
