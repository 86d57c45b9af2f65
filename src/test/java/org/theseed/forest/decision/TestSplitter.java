/**
 *
 */
package org.theseed.forest.decision;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.theseed.forest.features.Statistics;

/**
 * Tests for the split-point search.
 *
 * @author Bruce Parrello
 *
 */
public class TestSplitter {

    @Test
    public void testColumnSplit() {
        double[] values = { 1, 1, 1, 2, 12, 1, 1, 2, 1, 2, 3, 1 };
        double[] target = { 0, 0, 0, 1, 1, 0, 0, 1, 1, 0, 0, 1 };
        Splitter split = Splitter.computeSplit(0, values, target, PurityFunction.GINI);
        assertThat(split.getFeature(), equalTo(0));
        assertThat(split.getLimit(), closeTo(7.5, 1e-9));
        assertThat(split.getGain(), closeTo(0.0618686868, 1e-8));
        double[] values2 = { 0, 0, 0, 0, 0, 0, 0, 0, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1 };
        double[] target2 = { 0, 0, 0, 0, 0, 0, 1, 1, 0, 0, 0, 0, 0, 0, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1 };
        split = Splitter.computeSplit(3, values2, target2, PurityFunction.GINI);
        assertThat(split.getFeature(), equalTo(3));
        assertThat(split.getLimit(), closeTo(0.5, 1e-9));
        assertThat(split.getGain(), closeTo(0.0625, 1e-9));
    }

    @Test
    public void testDegenerateSplits() {
        double[] same = { 5, 5, 5, 5 };
        double[] target = { 0, 1, 0, 1 };
        Splitter split = Splitter.computeSplit(1, same, target, PurityFunction.GINI);
        assertThat(split.getLimit(), equalTo(4.0));
        assertThat(split.getGain(), equalTo(0.0));
        split = Splitter.computeSplit(2, new double[0], new double[0], PurityFunction.STDEV);
        assertThat(split.getFeature(), equalTo(2));
        assertThat(split.getLimit(), equalTo(0.0));
        assertThat(split.getGain(), equalTo(0.0));
        // A constant target cannot be improved.
        double[] values = { 1, 2, 3, 4 };
        double[] flat = { 7, 7, 7, 7 };
        split = Splitter.computeSplit(0, values, flat, PurityFunction.GINI);
        assertThat(split.getGain(), equalTo(0.0));
    }

    @Test
    public void testMatrixSplit() {
        double[][] matrix = { {0, 1.0}, {0, 1.0}, {0, 1.0}, {0, 2.0}, {0, 12.0}, {0, 1.0}, {1, 1.0}, {1, 2.0},
                {1, 1.0}, {2, 2.0}, {2, 3.0}, {2, 1.0} };
        double[] target = { 0, 0, 0, 1, 1, 0, 1, 1, 1, 0, 0, 1 };
        Splitter split = Splitter.computeSplit(matrix, target, PurityFunction.GINI, -1, new Random(100));
        assertThat(split.getFeature(), equalTo(0));
        assertThat(split.getLimit(), closeTo(0.5, 1e-9));
        assertThat(split.getGain(), closeTo(1.0 / 18.0, 1e-12));
        // The standard deviation prefers the outlier in the second column.
        split = Splitter.computeSplit(matrix, target, PurityFunction.STDEV, 0, new Random(100));
        assertThat(split.getFeature(), equalTo(1));
        assertThat(split.getLimit(), closeTo(7.5, 1e-9));
        assertThat(split.getGain(), closeTo(0.0435645354, 1e-8));
        // Check the row filter.
        split = new Splitter(1, 1.5, 0.1);
        boolean[] filter = split.filter(matrix);
        assertThat(filter.length, equalTo(12));
        for (int i = 0; i < matrix.length; i++)
            assertThat(Integer.toString(i), filter[i], equalTo(matrix[i][1] > 1.5));
        assertThat(split.splitsYes(new double[] { 0, 2.0 }), equalTo(true));
        assertThat(split.splitsYes(new double[] { 0, 1.5 }), equalTo(false));
    }

    @Test
    public void testRandomColumns() {
        // Only the last column is informative.
        double[][] matrix = new double[20][];
        double[] target = new double[20];
        for (int i = 0; i < 20; i++) {
            matrix[i] = new double[] { 1.0, 1.0, 1.0, i };
            target[i] = (i < 10 ? 0.0 : 1.0);
        }
        Splitter split = Splitter.computeSplit(matrix, target, PurityFunction.GINI, 4, new Random(12));
        assertThat(split.getFeature(), equalTo(3));
        assertThat(split.getLimit(), closeTo(9.5, 1e-9));
        assertThat(split.getGain(), closeTo(0.5, 1e-9));
        // With one random column, we either find the good split or nothing.
        Random rand = new Random(42);
        for (int i = 0; i < 20; i++) {
            split = Splitter.computeSplit(matrix, target, PurityFunction.GINI, 1, rand);
            if (split.getFeature() == 3)
                assertThat(split.getGain(), closeTo(0.5, 1e-9));
            else
                assertThat(split.getGain(), equalTo(0.0));
        }
    }

    @Test
    public void testTies() {
        // Two split points have the same gain, and the lower one is kept.
        double[] values = { 1, 2, 3, 4 };
        double[] target = { 0, 1, 1, 0 };
        Splitter split = Splitter.computeSplit(0, values, target, PurityFunction.GINI);
        assertThat(split.getLimit(), closeTo(1.5, 1e-12));
        assertThat(split.getGain(), closeTo(1.0 / 6.0, 1e-12));
        // The input order of the rows does not matter.
        split = Splitter.computeSplit(0, new double[] { 4, 3, 2, 1 }, new double[] { 0, 1, 1, 0 }, PurityFunction.GINI);
        assertThat(split.getLimit(), closeTo(1.5, 1e-12));
        // Two identical columns have the same gain, and the first one is kept.
        double[][] matrix = new double[8][];
        double[] target2 = new double[8];
        for (int i = 0; i < 8; i++) {
            matrix[i] = new double[] { 1.0, i, i };
            target2[i] = (i < 4 ? 0.0 : 1.0);
        }
        split = Splitter.computeSplit(matrix, target2, PurityFunction.GINI, 0, new Random(100));
        assertThat(split.getFeature(), equalTo(1));
        assertThat(split.getLimit(), closeTo(3.5, 1e-12));
        assertThat(split.getGain(), closeTo(0.5, 1e-12));
    }

    @Test
    public void testRunningPurity() {
        Random rand = new Random(2024);
        double[] labels = new double[40];
        double[] values = new double[40];
        for (int i = 0; i < 40; i++) {
            labels[i] = rand.nextInt(3);
            values[i] = rand.nextGaussian() * 10.0 + 5.0;
        }
        double[] gini = PurityFunction.GINI.runningPurity(labels);
        double[] stdev = PurityFunction.STDEV.runningPurity(values);
        assertThat(gini.length, equalTo(41));
        assertThat(gini[0], equalTo(0.0));
        assertThat(stdev[0], equalTo(0.0));
        for (int i = 1; i <= 40; i++) {
            double[] head = Arrays.copyOf(labels, i);
            assertThat(Integer.toString(i), gini[i], closeTo(Statistics.gini(head), 1e-12));
            head = Arrays.copyOf(values, i);
            assertThat(Integer.toString(i), stdev[i], closeTo(Statistics.stdevP(head), 1e-9));
        }
        // A lambda purity function takes the slow path and must find the same gain.
        IPurityFunction slowGini = x -> Statistics.gini(x);
        IPurityFunction slowStdev = x -> Statistics.stdevP(x);
        for (int trial = 0; trial < 10; trial++) {
            double[] column = new double[30];
            double[] classes = new double[30];
            double[] targets = new double[30];
            for (int i = 0; i < 30; i++) {
                column[i] = rand.nextInt(20);
                classes[i] = rand.nextInt(2);
                targets[i] = rand.nextDouble();
            }
            Splitter fast = Splitter.computeSplit(0, column, classes, PurityFunction.GINI);
            Splitter slow = Splitter.computeSplit(0, column, classes, slowGini);
            assertThat(fast.getGain(), closeTo(slow.getGain(), 1e-9));
            fast = Splitter.computeSplit(0, column, targets, PurityFunction.STDEV);
            slow = Splitter.computeSplit(0, column, targets, slowStdev);
            assertThat(fast.getGain(), closeTo(slow.getGain(), 1e-9));
        }
    }

}
