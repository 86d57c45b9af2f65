/**
 *
 */
package org.theseed.forest.decision;

import java.util.Collections;
import java.util.SortedMap;

/**
 * This object represents a classification prediction for a single input row:  the predicted label and the
 * estimated probability of each label.
 *
 * @author Bruce Parrello
 *
 */
public class ClassPrediction {

    // FIELDS
    /** predicted label */
    private final double label;
    /** probability of each label */
    private final SortedMap<Double, Double> probabilities;

    /**
     * Construct a classification prediction.
     *
     * @param label				predicted label
     * @param probabilities		map of labels to probabilities
     */
    public ClassPrediction(double label, SortedMap<Double, Double> probabilities) {
        this.label = label;
        this.probabilities = probabilities;
    }

    /**
     * @return the predicted label
     */
    public double getLabel() {
        return this.label;
    }

    /**
     * @return the map of labels to probabilities
     */
    public SortedMap<Double, Double> getProbabilities() {
        return Collections.unmodifiableSortedMap(this.probabilities);
    }

    /**
     * @return the probability of a specific label (0 if the label was never seen)
     *
     * @param label		label of interest
     */
    public double getProbability(double label) {
        return this.probabilities.getOrDefault(label, 0.0);
    }

    @Override
    public String toString() {
        return "ClassPrediction[label=" + this.label + ", probabilities=" + this.probabilities + "]";
    }

}
