/**
 *
 */
package org.theseed.forest.features;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.HashSet;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.Set;
import java.util.SortedMap;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.Test;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Tests for the feature-matrix utilities.
 *
 * @author Bruce Parrello
 *
 */
public class TestFeatures {

    /**
     * @return a matrix whose row i is {i, 10 * i}
     *
     * @param n		number of rows
     */
    private static double[][] matrix(int n) {
        double[][] retVal = new double[n][];
        for (int i = 0; i < n; i++)
            retVal[i] = new double[] { i, 10.0 * i };
        return retVal;
    }

    /**
     * @return a target vector whose entry i is 100 * i
     *
     * @param n		number of entries
     */
    private static double[] target(int n) {
        double[] retVal = new double[n];
        for (int i = 0; i < n; i++)
            retVal[i] = 100.0 * i;
        return retVal;
    }

    /**
     * Verify that each row of a sample is an intact input row with the correct target.
     *
     * @param sample	sample to check
     */
    private static void checkRows(Sample sample) {
        double[][] features = sample.getFeatures();
        double[] labels = sample.getLabels();
        for (int i = 0; i < sample.size(); i++) {
            double base = features[i][0];
            assertThat(features[i][1], equalTo(base * 10.0));
            assertThat(labels[i], equalTo(base * 100.0));
        }
    }

    @Test
    public void testBootstrap() {
        double[][] matrix = matrix(50);
        double[] target = target(50);
        Sample sample = Features.bootstrap(matrix, target, true, new Random(11));
        assertThat(sample.size(), equalTo(50));
        checkRows(sample);
        Set<Double> used = new HashSet<Double>();
        for (double[] row : sample.getFeatures())
            used.add(row[0]);
        int[] oob = sample.getOutOfBag();
        assertThat(oob.length, equalTo(50 - used.size()));
        for (int idx : oob)
            assertThat(used.contains((double) idx), equalTo(false));
        // The output rows are copies.
        sample.getFeatures()[0][1] = -1.0;
        for (double[] row : matrix)
            assertThat(row[1], not(equalTo(-1.0)));
        sample = Features.bootstrap(matrix, target, false);
        assertThat(sample.size(), equalTo(50));
        assertThat(sample.getOutOfBag().length, equalTo(0));
        assertThrows(IllegalArgumentException.class, () -> Features.bootstrap(matrix, target(49), false));
    }

    @Test
    public void testShuffle() {
        double[][] matrix = matrix(20);
        double[] target = target(20);
        Sample sample = Features.shuffle(matrix, target, new Random(99));
        assertThat(sample.size(), equalTo(20));
        checkRows(sample);
        double[] sorted = Arrays.stream(sample.getFeatures()).mapToDouble(x -> x[0]).sorted().toArray();
        assertThat(sorted, equalTo(Features.column(matrix, 0)));
        // Same seed, same order.
        Sample sample2 = Features.shuffle(matrix, target, new Random(99));
        assertThat(sample2.getLabels(), equalTo(sample.getLabels()));
        INDArray features = sample.getFeatureArray();
        assertThat(features.rows(), equalTo(20));
        assertThat(features.columns(), equalTo(2));
        assertThat(sample.getLabelArray().toDoubleVector(), equalTo(sample.getLabels()));
    }

    @Test
    public void testSplit() {
        Pair<Sample, Sample> sets = Features.split(matrix(10), target(10), 0.5);
        assertThat(sets.getLeft().size(), equalTo(5));
        assertThat(sets.getRight().size(), equalTo(5));
        assertThat(sets.getLeft().getLabels(), equalTo(new double[] { 0, 100, 200, 300, 400 }));
        checkRows(sets.getRight());
        sets = Features.split(matrix(10), target(10), 0.8);
        assertThat(sets.getLeft().size(), equalTo(8));
        assertThat(sets.getRight().getLabels(), equalTo(new double[] { 800, 900 }));
        assertThrows(IllegalArgumentException.class, () -> Features.split(matrix(10), target(10), 0.0));
        assertThrows(IllegalArgumentException.class, () -> Features.split(matrix(10), target(10), 1.0));
        // Filters.
        boolean[] filter = { true, false, false, true };
        Pair<double[][], double[][]> rows = Features.splitRows(matrix(4), filter);
        assertThat(rows.getLeft().length, equalTo(2));
        assertThat(rows.getLeft()[1][0], equalTo(3.0));
        assertThat(rows.getRight()[0][0], equalTo(1.0));
        Pair<double[], double[]> values = Features.splitValues(target(4), filter);
        assertThat(values.getLeft(), equalTo(new double[] { 0, 300 }));
        assertThat(values.getRight(), equalTo(new double[] { 100, 200 }));
        assertThrows(IllegalArgumentException.class, () -> Features.splitValues(target(3), filter));
    }

    @Test
    public void testKFold() {
        KFoldIterator iter = new KFoldIterator(10, 3);
        assertThat(iter.getFoldCount(), equalTo(3));
        assertThat(iter.getCurrentFold(), equalTo(0));
        int[] testCounts = new int[10];
        int folds = 0;
        while (iter.hasNext()) {
            boolean[] filter = iter.next();
            folds++;
            assertThat(iter.getCurrentFold(), equalTo(folds));
            assertThat(filter.length, equalTo(10));
            int testRows = 0;
            for (int i = 0; i < 10; i++) {
                if (! filter[i]) {
                    testRows++;
                    testCounts[i]++;
                }
            }
            assertThat(testRows, equalTo(3));
        }
        assertThat(folds, equalTo(3));
        // The leftover row is always used for training.
        assertThat(testCounts, equalTo(new int[] { 1, 1, 1, 1, 1, 1, 1, 1, 1, 0 }));
        assertThrows(NoSuchElementException.class, () -> iter.next());
        assertThrows(IllegalArgumentException.class, () -> new KFoldIterator(10, 1));
        assertThrows(IllegalArgumentException.class, () -> new KFoldIterator(2, 3));
    }

    @Test
    public void testSelect() {
        int[] source = { 10, 20, 30, 40, 50, 60, 70, 80, 90, 100 };
        Random rand = new Random(7);
        for (int trial = 0; trial < 20; trial++) {
            int[] chosen = Features.select(source, 3, rand);
            assertThat(chosen.length, equalTo(3));
            Set<Integer> found = new HashSet<Integer>();
            for (int value : chosen) {
                assertThat(value % 10, equalTo(0));
                assertThat(value, allOf(greaterThanOrEqualTo(10), lessThanOrEqualTo(100)));
                found.add(value);
            }
            assertThat(found.size(), equalTo(3));
        }
        int[] all = Features.select(source, 20, rand);
        Arrays.sort(all);
        assertThat(all, equalTo(source));
        assertThat(source[0], equalTo(10));
    }

    @Test
    public void testClassCounts() {
        double[] target = { 2.0, 1.0, 2.0, 3.0, 2.0, 1.0 };
        SortedMap<Double, Integer> counts = Features.classCounts(target);
        assertThat(counts.keySet(), contains(1.0, 2.0, 3.0));
        assertThat(counts.get(2.0), equalTo(3));
        SortedMap<Double, Double> props = Features.classProportions(target);
        assertThat(props.get(1.0), closeTo(1.0 / 3.0, 1e-12));
        assertThat(props.get(2.0), closeTo(0.5, 1e-12));
        assertThat(props.get(3.0), closeTo(1.0 / 6.0, 1e-12));
        assertThat(Features.distinct(target), equalTo(new double[] { 1.0, 2.0, 3.0 }));
        double[][] copy = Features.copy(matrix(3));
        assertThat(copy[2], equalTo(new double[] { 2.0, 20.0 }));
        assertThat(Features.column(copy, 1), equalTo(new double[] { 0.0, 10.0, 20.0 }));
        assertThrows(IllegalArgumentException.class, () -> new Sample(matrix(3), target(2)));
    }

}
