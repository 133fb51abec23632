package tech.noetzold.risk_assessment_api.service.scoring;

import lombok.extern.slf4j.Slf4j;
import tech.noetzold.risk_assessment_api.model.FeatureVector;

import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Placeholder scorer, not clinically meaningful. Trained once per instance on seeded synthetic data.
 */
@Slf4j
public class FallbackEstimator implements ScoringStrategy {

    private static final int SYNTHETIC_DIMENSIONS = 8;
    private static final double LABEL_NOISE = 0.1;
    private static final double LEARNING_RATE = 0.5;

    private final int samples;
    private final long seed;
    private final int iterations;
    private final AtomicInteger trainingRuns = new AtomicInteger();

    private volatile Model model;

    public FallbackEstimator(int samples, long seed, int iterations) {
        if (samples < 2 || iterations < 1) {
            throw new IllegalArgumentException("fallback estimator needs samples >= 2 and iterations >= 1");
        }
        this.samples = samples;
        this.seed = seed;
        this.iterations = iterations;
    }

    @Override
    public double rawScore(FeatureVector vector) {
        Model m = model();
        return sigmoid(m.weight() * deviation(vector.toArray()) + m.bias());
    }

    @Override
    public String name() {
        return "fallback";
    }

    public boolean isTrained() {
        return model != null;
    }

    int trainingRuns() {
        return trainingRuns.get();
    }

    private Model model() {
        Model m = model;
        if (m == null) {
            synchronized (this) {
                m = model;
                if (m == null) {
                    m = train();
                    model = m;
                }
            }
        }
        return m;
    }

    private Model train() {
        trainingRuns.incrementAndGet();
        Random random = new Random(seed);
        double[] z = new double[samples];
        double[] y = new double[samples];
        for (int i = 0; i < samples; i++) {
            double sum = 0.0;
            for (int j = 0; j < SYNTHETIC_DIMENSIONS; j++) {
                sum += random.nextGaussian();
            }
            z[i] = sum / Math.sqrt(SYNTHETIC_DIMENSIONS);
            y[i] = sum + random.nextGaussian() * LABEL_NOISE > 0 ? 1.0 : 0.0;
        }

        double weight = 0.0;
        double bias = 0.0;
        for (int it = 0; it < iterations; it++) {
            double gradWeight = 0.0;
            double gradBias = 0.0;
            for (int i = 0; i < samples; i++) {
                double error = sigmoid(weight * z[i] + bias) - y[i];
                gradWeight += error * z[i];
                gradBias += error;
            }
            weight -= LEARNING_RATE * gradWeight / samples;
            bias -= LEARNING_RATE * gradBias / samples;
        }
        log.info("Fallback estimator trained on {} synthetic samples (seed={}, weight={}, bias={})",
                samples, seed, weight, bias);
        return new Model(weight, bias);
    }

    // Midpoint-centred features scaled so that random vectors of any length share one spread.
    private static double deviation(double[] normalized) {
        if (normalized.length == 0) return 0.0;
        double sum = 0.0;
        for (double value : normalized) {
            double bounded = Math.max(0.0, Math.min(1.0, value));
            sum += (bounded - 0.5) * 2.0;
        }
        return sum / Math.sqrt(normalized.length);
    }

    private static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }

    private record Model(double weight, double bias) {}
}
