/**
 *
 */
package org.theseed.forest.decision;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;
import java.util.stream.IntStream;

import org.theseed.forest.features.Features;

/**
 * This class contains a proposal for splitting a choice node.  Rows whose value in the split column is
 * greater than the limit go to the "yes" branch; the others go to the "no" branch.  The best splitter has
 * the highest purity gain.  A splitter with a gain of 0 is useless, and the tree should make a leaf instead.
 *
 * @author Bruce Parrello
 *
 */
public class Splitter {

    // FIELDS
    /** index of the column to split on */
    private final int feature;
    /** split point */
    private final double limit;
    /** purity gain */
    private final double gain;
    /** null splitter, indicating do not split */
    public static final Splitter NULL = new Splitter(0, 0.0, 0.0);

    /**
     * Create a split proposal.
     *
     * @param feature	index of the column to split on
     * @param limit		split point
     * @param gain		purity gain from the split
     */
    public Splitter(int feature, double limit, double gain) {
        this.feature = feature;
        this.limit = limit;
        this.gain = gain;
    }

    /**
     * Find the best split point for a single column.  The values are sorted, and a candidate split is made
     * at the midpoint between each pair of adjacent distinct values.  The first candidate with the highest
     * gain wins.
     *
     * If the column is empty, the split point and gain are both 0.  If all the values are the same, the split
     * point is one less than the common value, so every row would go to the "no" branch, and the gain is 0.
     *
     * @param iFeature	index of the column being examined
     * @param values	column values
     * @param target	target values, one per column value
     * @param purityFn	purity function for measuring the target values
     *
     * @return the best split for the column
     */
    public static Splitter computeSplit(int iFeature, double[] values, double[] target, IPurityFunction purityFn) {
        final int n = values.length;
        if (n == 0)
            return new Splitter(iFeature, 0.0, 0.0);
        // Sort the rows by value.  The sort is stable, so equal values stay in input order.
        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> values[i]));
        double[] sortedValues = new double[n];
        double[] sortedTargets = new double[n];
        for (int i = 0; i < n; i++) {
            sortedValues[i] = values[order[i]];
            sortedTargets[i] = target[order[i]];
        }
        // The standard purity functions can measure every partition in two passes.
        double[] leftPurity = null;
        double[] rightPurity = null;
        double oldPurity;
        if (purityFn instanceof PurityFunction) {
            PurityFunction standard = (PurityFunction) purityFn;
            leftPurity = standard.runningPurity(sortedTargets);
            double[] reversed = new double[n];
            for (int i = 0; i < n; i++)
                reversed[i] = sortedTargets[n - i - 1];
            rightPurity = standard.runningPurity(reversed);
            oldPurity = leftPurity[n];
        } else
            oldPurity = purityFn.purity(target);
        double bestLimit = 0.0;
        double bestGain = 0.0;
        boolean allSame = true;
        // Everything up to and including position i is on the left of the candidate split.
        for (int i = 0; i < n - 1; i++) {
            if (sortedValues[i] == sortedValues[i + 1]) continue;
            allSame = false;
            int leftCount = i + 1;
            int rightCount = n - leftCount;
            double leftValue;
            double rightValue;
            if (leftPurity != null) {
                leftValue = leftPurity[leftCount];
                rightValue = rightPurity[rightCount];
            } else {
                leftValue = purityFn.purity(Arrays.copyOfRange(sortedTargets, 0, leftCount));
                rightValue = purityFn.purity(Arrays.copyOfRange(sortedTargets, leftCount, n));
            }
            double gain = oldPurity - leftValue * leftCount / n - rightValue * rightCount / n;
            if (gain > bestGain) {
                bestGain = gain;
                bestLimit = (sortedValues[i] + sortedValues[i + 1]) / 2.0;
            }
        }
        Splitter retVal;
        if (allSame)
            retVal = new Splitter(iFeature, sortedValues[0] - 1.0, 0.0);
        else
            retVal = new Splitter(iFeature, bestLimit, bestGain);
        return retVal;
    }

    /**
     * Find the best split for a matrix.  Each eligible column is examined in column order, and the first
     * one with the highest positive gain is chosen.
     *
     * @param matrix			feature rows
     * @param target			target values, one per row
     * @param purityFn			purity function for measuring the target values
     * @param randomFeatures	if greater than 0 and less than the column count, the number of columns to
     * 							choose at random for examination
     * @param rand				random-number generator for choosing columns
     *
     * @return the best split found, or {@link #NULL} if no split improves the purity
     */
    public static Splitter computeSplit(double[][] matrix, double[] target, IPurityFunction purityFn,
            int randomFeatures, Random rand) {
        Splitter retVal = NULL;
        if (matrix.length > 0) {
            final int nCols = matrix[0].length;
            int[] cols = IntStream.range(0, nCols).toArray();
            if (randomFeatures > 0 && randomFeatures < nCols) {
                cols = Features.select(cols, randomFeatures, rand);
                Arrays.sort(cols);
            }
            for (int col : cols) {
                double[] values = Features.column(matrix, col);
                Splitter test = computeSplit(col, values, target, purityFn);
                if (test.gain > retVal.gain)
                    retVal = test;
            }
        }
        return retVal;
    }

    /**
     * @return a filter array indicating which rows go to the "yes" branch
     *
     * @param matrix	feature rows to check
     */
    public boolean[] filter(double[][] matrix) {
        boolean[] retVal = new boolean[matrix.length];
        for (int i = 0; i < matrix.length; i++)
            retVal[i] = this.splitsYes(matrix[i]);
        return retVal;
    }

    /**
     * @return TRUE if the specified row would go to the "yes" branch, else FALSE
     *
     * @param row	row to check
     */
    public boolean splitsYes(double[] row) {
        return row[this.feature] > this.limit;
    }

    /**
     * @return a choice node created from this splitter
     *
     * @param recordCount	number of training rows reaching the node
     */
    protected DecisionTree.ChoiceNode createNode(int recordCount) {
        return new DecisionTree.ChoiceNode(this.feature, this.limit, this.gain, recordCount);
    }

    /**
     * @return the index of the column to split on
     */
    public int getFeature() {
        return this.feature;
    }

    /**
     * @return the split point
     */
    public double getLimit() {
        return this.limit;
    }

    /**
     * @return the purity gain
     */
    public double getGain() {
        return this.gain;
    }

    @Override
    public String toString() {
        return "Splitter[feature=" + this.feature + ", limit=" + this.limit + ", gain=" + this.gain + "]";
    }

}
