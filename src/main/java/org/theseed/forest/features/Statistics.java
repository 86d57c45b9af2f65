/**
 *
 */
package org.theseed.forest.features;

import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Statistical functions used for measuring node purity and evaluating predictions.
 *
 * @author Bruce Parrello
 *
 */
public class Statistics {

    /**
     * @return the Gini index of a set of discrete values (0 means all values are the same)
     *
     * @param values	values to examine
     */
    public static double gini(double[] values) {
        double retVal = 0.0;
        if (values.length > 0) {
            Map<Double, Integer> counts = new HashMap<Double, Integer>();
            for (double value : values)
                counts.merge(value, 1, Integer::sum);
            double total = values.length;
            retVal = 1.0;
            for (int count : counts.values()) {
                double p = count / total;
                retVal -= p * p;
            }
        }
        return retVal;
    }

    /**
     * @return the population standard deviation of a set of values (0 for an empty set)
     *
     * @param values	values to examine
     */
    public static double stdevP(double[] values) {
        double retVal = 0.0;
        if (values.length > 0)
            retVal = new StandardDeviation(false).evaluate(values);
        return retVal;
    }

    /**
     * @return the mean of a set of values (0 for an empty set)
     *
     * @param values	values to examine
     */
    public static double mean(double[] values) {
        double retVal = 0.0;
        if (values.length > 0)
            retVal = StatUtils.mean(values);
        return retVal;
    }

    /**
     * Verify that two prediction vectors can be compared.
     *
     * @param actuals		expected values
     * @param predictions	predicted values
     */
    private static void checkLengths(double[] actuals, double[] predictions) {
        if (actuals.length != predictions.length)
            throw new IllegalArgumentException("Inputs must be same length");
        if (actuals.length == 0)
            throw new IllegalArgumentException("Input must not be empty");
    }

    /**
     * @return the fraction of predictions that exactly match the expected class labels
     *
     * @param actuals		expected class labels
     * @param predictions	predicted class labels
     */
    public static double accuracy(double[] actuals, double[] predictions) {
        checkLengths(actuals, predictions);
        int good = 0;
        for (int i = 0; i < actuals.length; i++) {
            if (actuals[i] == predictions[i])
                good++;
        }
        return ((double) good) / actuals.length;
    }

    /**
     * @return the fraction of predictions that do not match the expected class labels
     *
     * @param actuals		expected class labels
     * @param predictions	predicted class labels
     */
    public static double classificationError(double[] actuals, double[] predictions) {
        return 1.0 - accuracy(actuals, predictions);
    }

    /**
     * Compute the precision and recall for each class label found in a set of predictions.  Precision is
     * the fraction of the predictions of a label that were correct, and recall is the fraction of the rows
     * with the label that were predicted correctly.  A label that is never predicted has a precision of NaN, and
     * a label that never occurs has a recall of NaN.
     *
     * @param actuals		expected class labels
     * @param predictions	predicted class labels
     *
     * @return a map from each label to a pair containing its precision and recall
     */
    public static SortedMap<Double, Pair<Double, Double>> classificationMetrics(double[] actuals, double[] predictions) {
        checkLengths(actuals, predictions);
        // For each label we count true positives, false positives, and false negatives.
        SortedMap<Double, int[]> counts = new TreeMap<Double, int[]>();
        for (int i = 0; i < actuals.length; i++) {
            int[] actualCounts = counts.computeIfAbsent(actuals[i], x -> new int[3]);
            if (actuals[i] == predictions[i])
                actualCounts[0]++;
            else {
                actualCounts[2]++;
                counts.computeIfAbsent(predictions[i], x -> new int[3])[1]++;
            }
        }
        SortedMap<Double, Pair<Double, Double>> retVal = new TreeMap<Double, Pair<Double, Double>>();
        for (Map.Entry<Double, int[]> entry : counts.entrySet()) {
            int[] tpfpfn = entry.getValue();
            double precision = ((double) tpfpfn[0]) / (tpfpfn[0] + tpfpfn[1]);
            double recall = ((double) tpfpfn[0]) / (tpfpfn[0] + tpfpfn[2]);
            retVal.put(entry.getKey(), Pair.of(precision, recall));
        }
        return retVal;
    }

    /**
     * @return the sum of the squared differences between predictions and expectations
     *
     * @param actuals		expected values
     * @param predictions	predicted values
     */
    public static double sse(double[] actuals, double[] predictions) {
        checkLengths(actuals, predictions);
        double retVal = 0.0;
        for (int i = 0; i < actuals.length; i++) {
            double diff = actuals[i] - predictions[i];
            retVal += diff * diff;
        }
        return retVal;
    }

    /**
     * Compute the coefficient of determination for a set of predictions.
     *
     * @param actuals		expected values
     * @param predictions	predicted values
     * @param p				number of explanatory terms, used for the adjusted value; 0 to skip it
     *
     * @return a pair containing the r-squared value and the adjusted r-squared value (0 if p is 0)
     */
    public static Pair<Double, Double> rSquared(double[] actuals, double[] predictions, int p) {
        double error = sse(actuals, predictions);
        double sst = StatUtils.populationVariance(actuals) * actuals.length;
        double rsq = 1.0 - error / sst;
        double adjusted = 0.0;
        if (p > 0) {
            double n = actuals.length;
            adjusted = 1.0 - (1.0 - rsq) * ((n - 1) / (n - p - 1));
        }
        return Pair.of(rsq, adjusted);
    }

}
