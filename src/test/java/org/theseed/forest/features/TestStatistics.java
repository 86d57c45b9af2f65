/**
 *
 */
package org.theseed.forest.features;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.SortedMap;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.Test;

/**
 * Tests for the statistics utilities.
 *
 * @author Bruce Parrello
 *
 */
public class TestStatistics {

    @Test
    public void testPurityMeasures() {
        assertThat(Statistics.gini(new double[] { 0, 0, 1, 1 }), closeTo(0.5, 1e-12));
        assertThat(Statistics.gini(new double[] { 4, 4, 4 }), equalTo(0.0));
        assertThat(Statistics.gini(new double[] { 1, 2, 3 }), closeTo(2.0 / 3.0, 1e-12));
        assertThat(Statistics.gini(new double[0]), equalTo(0.0));
        assertThat(Statistics.stdevP(new double[] { 2, 4, 4, 4, 5, 5, 7, 9 }), closeTo(2.0, 1e-12));
        assertThat(Statistics.stdevP(new double[] { 3 }), equalTo(0.0));
        assertThat(Statistics.stdevP(new double[0]), equalTo(0.0));
        assertThat(Statistics.mean(new double[] { 1, 2, 3, 6 }), closeTo(3.0, 1e-12));
        assertThat(Statistics.mean(new double[0]), equalTo(0.0));
    }

    @Test
    public void testAccuracy() {
        assertThat(Statistics.accuracy(new double[] { 5, 5, 5, 1, 1, 1 }, new double[] { 5, 5, 5, 1, 1, 1 }),
                equalTo(1.0));
        assertThat(Statistics.accuracy(new double[] { 1, 2, 3, 4 }, new double[] { 1, 2, 0, 4 }), closeTo(0.75, 1e-12));
        assertThrows(IllegalArgumentException.class, () -> Statistics.accuracy(new double[] { 1 }, new double[] { 1, 2 }));
        assertThrows(IllegalArgumentException.class, () -> Statistics.accuracy(new double[0], new double[0]));
        assertThat(Statistics.sse(new double[] { 1, 2, 3 }, new double[] { 1, 3, 5 }), closeTo(5.0, 1e-12));
    }

    @Test
    public void testRSquared() {
        double[] actuals = { 1, 2, 3, 4, 5 };
        double[] predictions = { 1.1, 1.9, 3.2, 3.8, 5.0 };
        Pair<Double, Double> result = Statistics.rSquared(actuals, predictions, 1);
        assertThat(result.getLeft(), closeTo(0.99, 1e-9));
        assertThat(result.getRight(), closeTo(1.0 - 0.01 * 4.0 / 3.0, 1e-9));
        result = Statistics.rSquared(actuals, actuals, 0);
        assertThat(result.getLeft(), closeTo(1.0, 1e-12));
        assertThat(result.getRight(), equalTo(0.0));
        assertThrows(IllegalArgumentException.class, () -> Statistics.rSquared(actuals, new double[] { 1 }, 0));
    }

    @Test
    public void testClassMetrics() {
        double[] actuals = { 1, 1, 2, 2, 3 };
        double[] predictions = { 1, 2, 2, 2, 1 };
        assertThat(Statistics.classificationError(actuals, predictions), closeTo(0.4, 1e-12));
        assertThat(Statistics.classificationError(actuals, actuals), equalTo(0.0));
        SortedMap<Double, Pair<Double, Double>> metrics = Statistics.classificationMetrics(actuals, predictions);
        assertThat(metrics.keySet(), contains(1.0, 2.0, 3.0));
        assertThat(metrics.get(1.0).getLeft(), closeTo(0.5, 1e-12));
        assertThat(metrics.get(1.0).getRight(), closeTo(0.5, 1e-12));
        assertThat(metrics.get(2.0).getLeft(), closeTo(2.0 / 3.0, 1e-12));
        assertThat(metrics.get(2.0).getRight(), closeTo(1.0, 1e-12));
        // Label 3 is never predicted.
        assertThat(metrics.get(3.0).getLeft().isNaN(), equalTo(true));
        assertThat(metrics.get(3.0).getRight(), equalTo(0.0));
        assertThrows(IllegalArgumentException.class, () -> Statistics.classificationMetrics(actuals, new double[] { 1 }));
    }

}
