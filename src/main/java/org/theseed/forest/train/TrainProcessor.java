/**
 *
 */
package org.theseed.forest.train;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import org.apache.commons.lang3.time.DurationFormatUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.text.TextStringBuilder;
import org.kohsuke.args4j.Option;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.forest.ParseFailureException;
import org.theseed.forest.decision.RandomForest;
import org.theseed.forest.features.Features;
import org.theseed.forest.features.Sample;

/**
 * This command trains a random forest on part of a data file and tests it on the remainder.  The output is a
 * report of the model's accuracy and per-class sensitivity and precision (classification) or coefficient of
 * determination and error statistics (regression), followed by the most impactful input columns.
 *
 * The positional parameter is the name of the tab-delimited data file.  In addition to the options supported
 * by all forest processors, the following command-line options are supported.
 *
 * -o	name of output file for the report; the default is to write to STDOUT
 * -r	fraction of the rows to use for training; the default is 0.8
 *
 * --impact		number of impactful columns to list; the default is 20
 *
 * @author Bruce Parrello
 *
 */
public class TrainProcessor extends ForestProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TrainProcessor.class);
    /** trained model */
    private RandomForest model;
    /** score on the testing set */
    private double score;
    /** column impacts, from most to least important */
    private List<Pair<String, Double>> impacts;
    /** result report */
    private String report;

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "-o", aliases = { "--output" }, metaVar = "report.txt", usage = "if specified, file to contain the report")
    private File outFile;

    /** training set fraction */
    @Option(name = "-r", aliases = { "--ratio" }, metaVar = "0.75", usage = "fraction of the rows to use for training")
    private double ratio;

    /** number of impact columns to show */
    @Option(name = "--impact", metaVar = "10", usage = "number of impactful columns to list")
    private int impactCount;

    @Override
    protected void setCommandDefaults() {
        this.outFile = null;
        this.ratio = 0.8;
        this.impactCount = 20;
        this.score = 0.0;
    }

    @Override
    protected void validateCommandParms() throws ParseFailureException {
        if (this.ratio <= 0.0 || this.ratio >= 1.0)
            throw new ParseFailureException("Training ratio must be strictly between 0 and 1.");
        if (this.impactCount < 0)
            throw new ParseFailureException("Impact column count cannot be negative.");
    }

    @Override
    protected void runCommand() throws Exception {
        // Shuffle the data and split off the testing set.
        Sample full = Features.shuffle(this.getData().getFeatures(), this.getData().getLabels(), new Random(this.seed));
        Pair<Sample, Sample> sets = Features.split(full.getFeatures(), full.getLabels(), this.ratio);
        Sample trainingSet = sets.getLeft();
        Sample testingSet = sets.getRight();
        if (testingSet.size() == 0)
            throw new IOException("Data file is too small to split with ratio " + this.ratio + ".");
        log.info("{} training rows and {} testing rows.", trainingSet.size(), testingSet.size());
        // Build and test the model.
        long start = System.currentTimeMillis();
        this.model = this.createForest();
        this.score = this.trainAndScore(this.model, trainingSet, testingSet);
        String duration = DurationFormatUtils.formatDuration(System.currentTimeMillis() - start, "mm:ss");
        this.impacts = this.computeImpactList(this.model.purityGains());
        // Write the report.
        RandomForest.Parms parms = this.getParms();
        TextStringBuilder reportBuilder = new TextStringBuilder(800);
        reportBuilder.appendNewLine();
        reportBuilder.appendln(
                        "Data file has %d rows, %d training and %d testing.%n" +
                        "=========================== Parameters ===========================%n" +
                        "     maxFeatures = %12d, minSplit      = %12d%n" +
                        "     nEstimators = %12d, maxDepth      = %12d%n" +
                        "     --------------------------------------------------------%n" +
                        "     Model type is %s using %s purity with seed %d.%n" +
                        "     %s minutes to train model.",
                        this.getData().size(), trainingSet.size(), testingSet.size(),
                        this.model.getRandomFeatures(), parms.getMinRows(), parms.getNumTrees(), parms.getMaxDepth(),
                        this.getTreeMode().getDescription(), this.getPurity().getDescription(), this.seed, duration);
        reportBuilder.appendNewLine();
        reportBuilder.appendln("Testing set %s is %8.4f.", this.getScoreName(), this.score);
        reportBuilder.appendNewLine();
        reportBuilder.appendln(this.getEvaluationReport());
        reportBuilder.appendln("Impact       Column Name");
        reportBuilder.appendln("---------------------------------------------------------");
        for (int i = 0; i < this.impacts.size() && i < this.impactCount; i++) {
            Pair<String, Double> item = this.impacts.get(i);
            reportBuilder.appendln("%12.4f %s", item.getRight(), item.getLeft());
        }
        this.report = reportBuilder.toString();
        log.info(this.report);
        if (this.outFile != null) {
            try (OutputStream outStream = new FileOutputStream(this.outFile)) {
                this.writeReport(outStream);
            }
        } else
            this.writeReport(System.out);
    }

    /**
     * Write the report to an output stream.  The stream is flushed but not closed.
     *
     * @param outStream		target output stream
     */
    private void writeReport(OutputStream outStream) {
        PrintWriter writer = new PrintWriter(outStream);
        writer.print(this.report);
        writer.flush();
    }

    /**
     * @return a list of the impact values for all the columns, from highest to lowest
     *
     * @param impact	impact vector, indexed by input column
     */
    private List<Pair<String, Double>> computeImpactList(INDArray impact) {
        List<String> colNames = this.getData().getFeatureNames();
        List<Pair<String, Double>> retVal = new ArrayList<Pair<String, Double>>(colNames.size());
        for (int i = 0; i < colNames.size(); i++)
            retVal.add(Pair.of(colNames.get(i), impact.getDouble(i)));
        retVal.sort(Comparator.comparing((Pair<String, Double> x) -> x.getRight()).reversed()
                .thenComparing(x -> x.getLeft()));
        return retVal;
    }

    /**
     * @return the trained model
     */
    public RandomForest getModel() {
        return this.model;
    }

    /**
     * @return the testing-set score
     */
    public double getScore() {
        return this.score;
    }

    /**
     * @return the column impacts, from most to least important
     */
    public List<Pair<String, Double>> getImpacts() {
        return this.impacts;
    }

    /**
     * @return the text of the report
     */
    public String getReport() {
        return this.report;
    }

}
