/**
 *
 */
package org.theseed.forest.decision;

import java.util.Locale;
import java.util.SortedMap;

import org.theseed.forest.features.Features;
import org.theseed.forest.features.Statistics;

/**
 * Enumerator for the type of model.  The mode determines what kind of leaf node is built from the training
 * rows that reach it and how the predictions of the trees in a forest are combined.
 *
 * CLASSIFICATION	target values are class labels; leaves hold label counts and predict the most common label
 * REGRESSION		target values are continuous; leaves predict the mean
 *
 * @author Bruce Parrello
 *
 */
public enum TreeMode {
    CLASSIFICATION {
        @Override
        protected DecisionTree.LeafNode createLeaf(double[] target) {
            SortedMap<Double, Integer> counts = Features.classCounts(target);
            return new DecisionTree.ClassLeafNode(target.length, DecisionTree.bestLabel(counts), counts);
        }

        @Override
        public double combine(double[] predictions) {
            SortedMap<Double, Integer> votes = Features.classCounts(predictions);
            return DecisionTree.bestLabel(votes);
        }

        @Override
        public boolean isClassifier() {
            return true;
        }

        @Override
        public String getDescription() {
            return "Predict class labels.";
        }
    }, REGRESSION {
        @Override
        protected DecisionTree.LeafNode createLeaf(double[] target) {
            return new DecisionTree.LeafNode(target.length, Statistics.mean(target));
        }

        @Override
        public double combine(double[] predictions) {
            return Statistics.mean(predictions);
        }

        @Override
        public boolean isClassifier() {
            return false;
        }

        @Override
        public String getDescription() {
            return "Predict continuous values.";
        }
    };

    /**
     * @return a leaf node for the specified target values
     *
     * @param target	target values of the training rows reaching the leaf
     */
    protected abstract DecisionTree.LeafNode createLeaf(double[] target);

    /**
     * @return the combined prediction of several trees (majority vote or mean)
     *
     * @param predictions	individual tree predictions
     */
    public abstract double combine(double[] predictions);

    /**
     * @return TRUE if this mode predicts class labels
     */
    public abstract boolean isClassifier();

    /**
     * @return a description of this mode
     */
    public abstract String getDescription();

    /**
     * @return the mode corresponding to a name
     *
     * @param name	mode name ("classify", "classification", "regress", or "regression", case-insensitive)
     */
    public static TreeMode parse(String name) {
        TreeMode retVal;
        switch (name == null ? "" : name.toLowerCase(Locale.ROOT)) {
        case "classify" :
        case "classification" :
            retVal = CLASSIFICATION;
            break;
        case "regress" :
        case "regression" :
            retVal = REGRESSION;
            break;
        default :
            throw new ModelException(ModelException.Type.INVALID_CONFIGURATION,
                    "mode must be 'classify' or 'regress', not '" + name + "'");
        }
        return retVal;
    }

}
