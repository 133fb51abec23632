package tech.noetzold.risk_assessment_api.service.scoring;

import org.junit.jupiter.api.Test;
import tech.noetzold.risk_assessment_api.model.FeatureVector;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FallbackEstimatorTest {

    private static FeatureVector vector(double... normalized) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < normalized.length; i++) {
            names.add("f" + i);
        }
        return new FeatureVector(names, normalized, normalized);
    }

    @Test
    void sameSeedGivesSameScores() {
        FallbackEstimator first = new FallbackEstimator(500, 42, 100);
        FallbackEstimator second = new FallbackEstimator(500, 42, 100);
        FeatureVector v = vector(0.2, 0.9, 0.7, 0.4);

        assertThat(first.rawScore(v)).isEqualTo(second.rawScore(v));
    }

    @Test
    void higherReadingsScoreHigher() {
        FallbackEstimator estimator = new FallbackEstimator(500, 42, 100);

        double low = estimator.rawScore(vector(0.1, 0.1, 0.1));
        double mid = estimator.rawScore(vector(0.5, 0.5, 0.5));
        double high = estimator.rawScore(vector(0.9, 0.9, 0.9));

        assertThat(low).isLessThan(mid);
        assertThat(mid).isLessThan(high);
        assertThat(low).isBetween(0.0, 1.0);
        assertThat(high).isBetween(0.0, 1.0);
    }

    @Test
    void trainsLazilyAndOnlyOnceUnderConcurrentFirstUse() throws Exception {
        FallbackEstimator estimator = new FallbackEstimator(1000, 42, 300);
        assertThat(estimator.isTrained()).isFalse();

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Double>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return estimator.rawScore(vector(0.6, 0.7));
                }));
            }
            start.countDown();
            double expected = results.get(0).get(30, TimeUnit.SECONDS);
            for (Future<Double> result : results) {
                assertThat(result.get(30, TimeUnit.SECONDS)).isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(estimator.isTrained()).isTrue();
        assertThat(estimator.trainingRuns()).isEqualTo(1);
    }

    @Test
    void rejectsDegenerateTrainingSetup() {
        assertThatThrownBy(() -> new FallbackEstimator(1, 42, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FallbackEstimator(100, 42, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
