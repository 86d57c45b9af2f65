/**
 *
 */
package org.theseed.forest.features;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.IntStream;

import org.apache.commons.lang3.tuple.Pair;

/**
 * This class contains utilities that operate on model inputs:  a feature matrix (one array per row) and a
 * parallel target vector.  These are used to prepare data for training (shuffling, hold-out splits,
 * bootstrap resampling) and by the decision tree itself to partition its working set.
 *
 * None of the methods modify their inputs.
 *
 * @author Bruce Parrello
 *
 */
public class Features {

    /**
     * Verify that a feature matrix and a target vector have the same number of rows.
     *
     * @param matrix	feature matrix
     * @param target	target vector
     */
    private static void checkLengths(double[][] matrix, double[] target) {
        if (matrix.length != target.length)
            throw new IllegalArgumentException("Inputs must be same length");
    }

    /**
     * @return a copy of a single column of a feature matrix
     *
     * @param matrix	feature matrix to examine
     * @param col		index of the desired column
     */
    public static double[] column(double[][] matrix, int col) {
        double[] retVal = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++)
            retVal[i] = matrix[i][col];
        return retVal;
    }

    /**
     * @return a deep copy of a feature matrix
     *
     * @param matrix	feature matrix to copy
     */
    public static double[][] copy(double[][] matrix) {
        double[][] retVal = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++)
            retVal[i] = matrix[i].clone();
        return retVal;
    }

    /**
     * Draw a bootstrap sample:  the same number of rows as the input, chosen at random with replacement.
     * Each output row is a copy of exactly one input row.
     *
     * @param matrix			feature matrix to sample
     * @param target			parallel target vector
     * @param trackOutOfBag		TRUE to record the indices of the rows never chosen
     * @param rand				random-number generator to use
     *
     * @return the resampled rows and their targets
     */
    public static Sample bootstrap(double[][] matrix, double[] target, boolean trackOutOfBag, Random rand) {
        checkLengths(matrix, target);
        final int n = matrix.length;
        double[][] features = new double[n][];
        double[] labels = new double[n];
        boolean[] used = new boolean[n];
        for (int i = 0; i < n; i++) {
            int idx = rand.nextInt(n);
            features[i] = matrix[idx].clone();
            labels[i] = target[idx];
            used[idx] = true;
        }
        int[] outOfBag;
        if (trackOutOfBag)
            outOfBag = IntStream.range(0, n).filter(i -> ! used[i]).toArray();
        else
            outOfBag = new int[0];
        return new Sample(features, labels, outOfBag);
    }

    /**
     * Draw a bootstrap sample using an unseeded random-number generator.
     *
     * @param matrix			feature matrix to sample
     * @param target			parallel target vector
     * @param trackOutOfBag		TRUE to record the indices of the rows never chosen
     *
     * @return the resampled rows and their targets
     */
    public static Sample bootstrap(double[][] matrix, double[] target, boolean trackOutOfBag) {
        return bootstrap(matrix, target, trackOutOfBag, new Random());
    }

    /**
     * Shuffle the rows of a feature matrix and a target vector together, so that each target value stays
     * with its row.
     *
     * @param matrix	feature matrix to shuffle
     * @param target	parallel target vector
     * @param rand		random-number generator to use
     *
     * @return the shuffled rows and their targets
     */
    public static Sample shuffle(double[][] matrix, double[] target, Random rand) {
        checkLengths(matrix, target);
        final int n = matrix.length;
        int[] order = IntStream.range(0, n).toArray();
        for (int i = n - 1; i > 0; i--) {
            int j = rand.nextInt(i + 1);
            int buffer = order[i];
            order[i] = order[j];
            order[j] = buffer;
        }
        double[][] features = new double[n][];
        double[] labels = new double[n];
        for (int i = 0; i < n; i++) {
            features[i] = matrix[order[i]].clone();
            labels[i] = target[order[i]];
        }
        return new Sample(features, labels);
    }

    /**
     * Split a feature matrix and target vector into a training set and a testing set.  The rows are not
     * shuffled:  the leading rows go into the training set.
     *
     * @param matrix	feature matrix to split
     * @param target	parallel target vector
     * @param ratio		fraction of the rows to put in the training set (must be strictly between 0 and 1)
     *
     * @return a pair containing the training set on the left and the testing set on the right
     */
    public static Pair<Sample, Sample> split(double[][] matrix, double[] target, double ratio) {
        if (ratio <= 0.0 || ratio >= 1.0)
            throw new IllegalArgumentException("Ratio must be between 0 and 1.");
        checkLengths(matrix, target);
        double cutPoint = (matrix.length - 1) * ratio;
        boolean[] filter = new boolean[matrix.length];
        for (int i = 0; i < filter.length; i++)
            filter[i] = (i <= cutPoint);
        Pair<double[][], double[][]> rows = splitRows(matrix, filter);
        Pair<double[], double[]> values = splitValues(target, filter);
        return Pair.of(new Sample(rows.getLeft(), values.getLeft()), new Sample(rows.getRight(), values.getRight()));
    }

    /**
     * Split the rows of a matrix using a boolean filter.  Rows with a TRUE filter value go on the left, the
     * others on the right.  The row arrays themselves are shared, not copied.
     *
     * @param matrix	matrix to split
     * @param filter	filter array, one entry per row
     *
     * @return a pair containing the selected rows on the left and the rejected rows on the right
     */
    public static Pair<double[][], double[][]> splitRows(double[][] matrix, boolean[] filter) {
        if (matrix.length != filter.length)
            throw new IllegalArgumentException("Inputs must be same length");
        List<double[]> left = new ArrayList<double[]>(matrix.length);
        List<double[]> right = new ArrayList<double[]>(matrix.length);
        for (int i = 0; i < matrix.length; i++) {
            if (filter[i])
                left.add(matrix[i]);
            else
                right.add(matrix[i]);
        }
        return Pair.of(left.toArray(new double[left.size()][]), right.toArray(new double[right.size()][]));
    }

    /**
     * Split a vector using a boolean filter.  Values with a TRUE filter value go on the left, the others
     * on the right.
     *
     * @param values	vector to split
     * @param filter	filter array, one entry per value
     *
     * @return a pair containing the selected values on the left and the rejected values on the right
     */
    public static Pair<double[], double[]> splitValues(double[] values, boolean[] filter) {
        if (values.length != filter.length)
            throw new IllegalArgumentException("Inputs must be same length");
        double[] left = new double[values.length];
        double[] right = new double[values.length];
        int nLeft = 0;
        int nRight = 0;
        for (int i = 0; i < values.length; i++) {
            if (filter[i])
                left[nLeft++] = values[i];
            else
                right[nRight++] = values[i];
        }
        return Pair.of(Arrays.copyOf(left, nLeft), Arrays.copyOf(right, nRight));
    }

    /**
     * Choose a random subset of an array without replacement.
     *
     * @param source	array from which to choose
     * @param nSelect	number of elements to choose
     * @param rand		random-number generator to use
     *
     * @return an array of the chosen elements, in the order chosen
     */
    public static int[] select(int[] source, int nSelect, Random rand) {
        final int n = source.length;
        if (nSelect > n) nSelect = n;
        int[] range = source.clone();
        int[] retVal = new int[nSelect];
        // This is a partial Fisher-Yates shuffle.
        for (int i = 0; i < nSelect; i++) {
            int pick = rand.nextInt(n - i);
            retVal[i] = range[pick + i];
            range[pick + i] = range[i];
        }
        return retVal;
    }

    /**
     * @return a sorted map from each distinct value to the number of times it occurs
     *
     * @param target	vector of values to count
     */
    public static SortedMap<Double, Integer> classCounts(double[] target) {
        SortedMap<Double, Integer> retVal = new TreeMap<Double, Integer>();
        for (double value : target)
            retVal.merge(value, 1, Integer::sum);
        return retVal;
    }

    /**
     * @return a sorted map from each distinct value to the fraction of the vector it occupies
     *
     * @param target	vector of values to examine
     */
    public static SortedMap<Double, Double> classProportions(double[] target) {
        SortedMap<Double, Double> retVal = new TreeMap<Double, Double>();
        double total = target.length;
        for (var entry : classCounts(target).entrySet())
            retVal.put(entry.getKey(), entry.getValue() / total);
        return retVal;
    }

    /**
     * @return the distinct values in a vector, in ascending order
     *
     * @param target	vector of values to examine
     */
    public static double[] distinct(double[] target) {
        return Arrays.stream(target).distinct().sorted().toArray();
    }

}
