/**
 *
 */
package org.theseed.forest.features;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

/**
 * This object contains a feature matrix and its parallel target vector, as produced by one of the
 * resampling or splitting methods in {@link Features}.  If the sample was drawn with replacement, it can
 * also carry the indices of the original rows that were never drawn.
 *
 * @author Bruce Parrello
 *
 */
public class Sample {

    // FIELDS
    /** feature rows */
    private final double[][] features;
    /** target values, one per row */
    private final double[] labels;
    /** indices of the source rows not present in the sample */
    private final int[] outOfBag;

    /**
     * Construct a sample with no out-of-bag information.
     *
     * @param features	feature rows
     * @param labels	target values
     */
    public Sample(double[][] features, double[] labels) {
        this(features, labels, new int[0]);
    }

    /**
     * Construct a sample.
     *
     * @param features	feature rows
     * @param labels	target values
     * @param outOfBag	indices of the source rows that were not drawn
     */
    public Sample(double[][] features, double[] labels, int[] outOfBag) {
        if (features.length != labels.length)
            throw new IllegalArgumentException("Inputs must be same length");
        this.features = features;
        this.labels = labels;
        this.outOfBag = outOfBag;
    }

    /**
     * @return the feature rows
     */
    public double[][] getFeatures() {
        return this.features;
    }

    /**
     * @return the target values
     */
    public double[] getLabels() {
        return this.labels;
    }

    /**
     * @return the indices of the source rows that were never drawn
     */
    public int[] getOutOfBag() {
        return this.outOfBag;
    }

    /**
     * @return the number of rows in this sample
     */
    public int size() {
        return this.labels.length;
    }

    /**
     * @return the feature rows as a matrix suitable for training or prediction
     */
    public INDArray getFeatureArray() {
        return Nd4j.create(this.features);
    }

    /**
     * @return the target values as a vector suitable for training
     */
    public INDArray getLabelArray() {
        return Nd4j.create(this.labels);
    }

}
