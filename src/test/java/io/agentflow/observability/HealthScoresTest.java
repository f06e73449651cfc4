package io.agentflow.observability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class HealthScoresTest {

    @Test
    void formulaAtKnownPoints() {
        Assertions.assertEquals(100.0, HealthScores.compute(100.0, 0.0, 0.0), 1e-9);
        Assertions.assertEquals(30.0, HealthScores.compute(0.0, 0.0, 100.0), 1e-9);
        Assertions.assertEquals(79.5, HealthScores.compute(75.0, 1_000.0, 25.0), 1e-9);
        // latency term bottoms out at 10s average
        Assertions.assertEquals(70.0, HealthScores.compute(100.0, 10_000.0, 0.0), 1e-9);
        Assertions.assertEquals(70.0, HealthScores.compute(100.0, 60_000.0, 0.0), 1e-9);
    }

    @Test
    void scoreNeverDropsAsSuccessRateRises() {
        double[] averages = {0.0, 750.0, 5_000.0, 25_000.0};
        double[] errorRates = {0.0, 12.5, 50.0, 100.0};
        for (double avg : averages) {
            for (double errorRate : errorRates) {
                double previous = HealthScores.compute(0.0, avg, errorRate);
                for (int success = 1; success <= 100; success++) {
                    double score = HealthScores.compute(success, avg, errorRate);
                    Assertions.assertTrue(score >= previous,
                            "avg=" + avg + " errorRate=" + errorRate + " success=" + success);
                    previous = score;
                }
            }
        }
    }

    @Test
    void scoreIsClampedToPercentRange() {
        Assertions.assertEquals(0.0, HealthScores.compute(0.0, 1_000_000.0, 150.0), 1e-9);
        Assertions.assertEquals(100.0, HealthScores.compute(100.0, 0.0, -50.0), 1e-9);
        Assertions.assertEquals(0.0, HealthScores.compute(Double.NaN, 0.0, 0.0), 1e-9);
        for (int success = 0; success <= 100; success += 10) {
            double score = HealthScores.compute(success, success * 500.0, 100.0 - success);
            Assertions.assertTrue(score >= 0.0 && score <= 100.0, "score=" + score);
        }
    }
}
