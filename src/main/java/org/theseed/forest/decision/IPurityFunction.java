/**
 *
 */
package org.theseed.forest.decision;

/**
 * This interface describes a function that measures the impurity of a set of target values.  A value of 0
 * means the set is perfectly pure; higher values are worse.  Decision trees use it to evaluate candidate
 * splits, and any implementation (including a lambda) can be plugged in.
 *
 * @author Bruce Parrello
 *
 */
@FunctionalInterface
public interface IPurityFunction {

    /**
     * @return the impurity of the specified target values
     *
     * @param values	target values to measure
     */
    public double purity(double[] values);

}
