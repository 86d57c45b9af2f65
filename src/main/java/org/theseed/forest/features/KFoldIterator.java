/**
 *
 */
package org.theseed.forest.features;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * This iterator produces the training/testing filters for k-fold cross-validation.  Each filter has one
 * entry per input row.  A FALSE entry means the row belongs to the current fold and should be used for
 * testing; a TRUE entry means it should be used for training.  The folds are contiguous ranges of equal
 * size, so the rows should be shuffled first.  If the row count is not a multiple of the fold count, the
 * leftover rows at the end are always in the training set.
 *
 * @author Bruce Parrello
 *
 */
public class KFoldIterator implements Iterator<boolean[]> {

    // FIELDS
    /** number of rows to split into folds */
    private final int size;
    /** number of folds */
    private final int kFolds;
    /** number of rows in each fold */
    private final int foldSize;
    /** number of the current fold (1-based, 0 before the first) */
    private int currentFold;

    /**
     * Create a new k-fold iterator.
     *
     * @param size		number of rows to split
     * @param k			number of folds
     */
    public KFoldIterator(int size, int k) {
        if (k < 2)
            throw new IllegalArgumentException("Fold count must be at least 2.");
        if (size < k)
            throw new IllegalArgumentException("Cannot split " + size + " rows into " + k + " folds.");
        this.size = size;
        this.kFolds = k;
        this.foldSize = size / k;
        this.currentFold = 0;
    }

    @Override
    public boolean hasNext() {
        return this.currentFold < this.kFolds;
    }

    @Override
    public boolean[] next() {
        if (! this.hasNext())
            throw new NoSuchElementException("All " + this.kFolds + " folds have been returned.");
        int foldStart = this.currentFold * this.foldSize;
        int foldEnd = foldStart + this.foldSize;
        this.currentFold++;
        boolean[] retVal = new boolean[this.size];
        for (int i = 0; i < this.size; i++)
            retVal[i] = (i < foldStart || i >= foldEnd);
        return retVal;
    }

    /**
     * @return the number of the fold last returned (1-based)
     */
    public int getCurrentFold() {
        return this.currentFold;
    }

    /**
     * @return the number of folds
     */
    public int getFoldCount() {
        return this.kFolds;
    }

    @Override
    public String toString() {
        return "KFoldIterator[k=" + this.kFolds + ", currentFold=" + this.currentFold + "]";
    }

}
