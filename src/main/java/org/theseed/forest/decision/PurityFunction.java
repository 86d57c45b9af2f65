/**
 *
 */
package org.theseed.forest.decision;

import java.util.HashMap;
import java.util.Map;

import org.theseed.forest.features.Statistics;

/**
 * Standard purity functions.
 *
 * GINI		Gini index, appropriate for class labels
 * STDEV	population standard deviation, appropriate for continuous values
 *
 * @author Bruce Parrello
 *
 */
public enum PurityFunction implements IPurityFunction {
    GINI {
        @Override
        public double purity(double[] values) {
            return Statistics.gini(values);
        }

        @Override
        public double[] runningPurity(double[] values) {
            double[] retVal = new double[values.length + 1];
            Map<Double, Integer> counts = new HashMap<Double, Integer>();
            // The Gini index is 1 minus the sum of the squared counts over the squared total.
            long sumSquares = 0;
            for (int i = 0; i < values.length; i++) {
                int old = counts.getOrDefault(values[i], 0);
                counts.put(values[i], old + 1);
                sumSquares += 2 * old + 1;
                double n = i + 1;
                retVal[i + 1] = 1.0 - sumSquares / (n * n);
            }
            return retVal;
        }

        @Override
        public String getDescription() {
            return "Gini index of the class labels.";
        }
    }, STDEV {
        @Override
        public double purity(double[] values) {
            return Statistics.stdevP(values);
        }

        @Override
        public double[] runningPurity(double[] values) {
            double[] retVal = new double[values.length + 1];
            // Welford's method keeps the running mean and sum of squared deviations.
            double mean = 0.0;
            double m2 = 0.0;
            for (int i = 0; i < values.length; i++) {
                double delta = values[i] - mean;
                mean += delta / (i + 1);
                m2 += delta * (values[i] - mean);
                retVal[i + 1] = Math.sqrt(Math.max(0.0, m2) / (i + 1));
            }
            return retVal;
        }

        @Override
        public String getDescription() {
            return "Population standard deviation of the target values.";
        }
    };

    /**
     * Compute the purity of each leading portion of a value array in a single pass.
     *
     * @return an array whose element i is the purity of the first i values (element 0 is always 0)
     *
     * @param values	values to measure
     */
    public abstract double[] runningPurity(double[] values);

    /**
     * @return a description of this purity function
     */
    public abstract String getDescription();

}
