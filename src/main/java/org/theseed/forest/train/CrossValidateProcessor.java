/**
 *
 */
package org.theseed.forest.train;

import java.io.IOException;
import java.util.Random;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.forest.ParseFailureException;
import org.theseed.forest.features.Features;
import org.theseed.forest.features.KFoldIterator;
import org.theseed.forest.features.Sample;

/**
 * This command performs a cross-validation on a data file.  The data is shuffled and divided into folds.
 * For each fold, a random forest is trained on the other folds and scored on the fold itself.  The mean,
 * standard deviation, and extremes of the scores are reported.
 *
 * The positional parameter is the name of the tab-delimited data file.  In addition to the options supported
 * by all forest processors, the following command-line option is supported.
 *
 * -k	number of folds; the default is 5
 *
 * @author Bruce Parrello
 *
 */
public class CrossValidateProcessor extends ForestProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CrossValidateProcessor.class);
    /** fold scores */
    private SummaryStatistics stats;

    // COMMAND-LINE OPTIONS

    /** number of folds */
    @Option(name = "-k", aliases = { "--folds" }, metaVar = "10", usage = "number of folds")
    private int foldCount;

    @Override
    protected void setCommandDefaults() {
        this.foldCount = 5;
    }

    @Override
    protected void validateCommandParms() throws ParseFailureException {
        if (this.foldCount < 2)
            throw new ParseFailureException("Fold count must be at least 2.");
    }

    @Override
    protected void runCommand() throws Exception {
        Sample full = Features.shuffle(this.getData().getFeatures(), this.getData().getLabels(), new Random(this.seed));
        if (full.size() < this.foldCount)
            throw new IOException("Data file has only " + full.size() + " rows, which is not enough for "
                    + this.foldCount + " folds.");
        this.stats = new SummaryStatistics();
        KFoldIterator folds = new KFoldIterator(full.size(), this.foldCount);
        while (folds.hasNext()) {
            boolean[] filter = folds.next();
            Pair<double[][], double[][]> rows = Features.splitRows(full.getFeatures(), filter);
            Pair<double[], double[]> labels = Features.splitValues(full.getLabels(), filter);
            Sample trainingSet = new Sample(rows.getLeft(), labels.getLeft());
            Sample testingSet = new Sample(rows.getRight(), labels.getRight());
            double score = this.trainAndScore(this.createForest(), trainingSet, testingSet);
            log.info("Fold {} of {} has {} {}.", folds.getCurrentFold(), this.foldCount, this.getScoreName(), score);
            this.stats.addValue(score);
        }
        System.out.format("%d-fold cross-validation of %s:  mean %s = %8.4f, std dev = %8.4f, min = %8.4f, max = %8.4f%n",
                this.foldCount, this.getTreeMode().getDescription(), this.getScoreName(), this.stats.getMean(),
                this.stats.getStandardDeviation(), this.stats.getMin(), this.stats.getMax());
    }

    /**
     * @return the statistics of the fold scores
     */
    public SummaryStatistics getStats() {
        return this.stats;
    }

}
