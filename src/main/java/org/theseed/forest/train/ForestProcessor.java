/**
 *
 */
package org.theseed.forest.train;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.DoubleStream;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.TextStringBuilder;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.nd4j.evaluation.classification.ConfusionMatrix;
import org.nd4j.evaluation.classification.Evaluation;
import org.nd4j.evaluation.regression.RegressionEvaluation;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.forest.BaseProcessor;
import org.theseed.forest.ParseFailureException;
import org.theseed.forest.TabbedDataReader;
import org.theseed.forest.decision.ModelException;
import org.theseed.forest.decision.PurityFunction;
import org.theseed.forest.decision.RandomForest;
import org.theseed.forest.decision.TreeMode;
import org.theseed.forest.features.Sample;

/**
 * This is the base class for commands that build random forests from a data file.  It handles the
 * hyper-parameters and the loading of the data.
 *
 * The positional parameter is the name of the tab-delimited data file.  The following command-line options
 * are supported.
 *
 * -h	display command-line usage
 * -v	display more detailed log messages
 * -c	name or index (1-based) of the label column; the default is "1"
 * -s	seed value to use for random number generation; the default is to use the last 20 bits of the
 * 		current time
 *
 * --meta			comma-delimited list of metadata columns to ignore
 * --mode			model type (classify or regress); the default is "classify"
 * --purity			purity function (GINI or STDEV); the default depends on the mode
 * --maxFeatures	number of features to use at each tree node; the default is the square root of the column count
 * --nEstimators	number of trees in the forest
 * --minSplit		minimum number of examples required to split a tree node
 * --maxDepth		maximum tree depth
 * --noBootstrap	train every tree on the full training set instead of a bootstrap sample
 *
 * @author Bruce Parrello
 *
 */
public abstract class ForestProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ForestProcessor.class);
    /** model type */
    private TreeMode treeMode;
    /** hyper-parameters */
    private RandomForest.Parms hParms;
    /** input data */
    private TabbedDataReader data;
    /** evaluation report from the most recent scoring */
    private String evaluationReport;

    // COMMAND-LINE OPTIONS

    /** label column ID or number */
    @Option(name = "-c", aliases = { "--col" }, metaVar = "result", usage = "label column name or index")
    private String labelCol;

    /** seed for random number generation */
    @Option(name = "-s", aliases = { "--seed" }, metaVar = "12345", usage = "random number seed")
    protected long seed;

    /** metadata columns */
    @Option(name = "--meta", metaVar = "id,name", usage = "comma-delimited list of columns to ignore")
    private String metaCols;

    /** model type */
    @Option(name = "--mode", metaVar = "regress", usage = "model type (classify or regress)")
    private String modeName;

    /** purity function */
    @Option(name = "--purity", usage = "purity function for evaluating splits (default depends on mode)")
    private PurityFunction purity;

    /** number of features to use at each tree node */
    @Option(name = "--maxFeatures", metaVar = "10", usage = "number of features to interrogate at each splitting tree node (0 for automatic)")
    private int maxFeatures;

    /** number of trees in the forest */
    @Option(name = "--nEstimators", metaVar = "100", usage = "number of trees in the forest")
    private int nEstimators;

    /** minimum number of examples required to split a node */
    @Option(name = "--minSplit", metaVar = "2", usage = "minimum number of examples required to split a tree node")
    private int minSplit;

    /** maximum permissible tree depth */
    @Option(name = "--maxDepth", metaVar = "10", usage = "maximum tree depth")
    private int maxDepth;

    /** TRUE to suppress bootstrap sampling */
    @Option(name = "--noBootstrap", usage = "train each tree on the full training set")
    private boolean noBootstrap;

    /** input data file */
    @Argument(index = 0, metaVar = "data.tbl", usage = "tab-delimited input data file", required = true)
    private File inFile;

    @Override
    protected final void setDefaults() {
        RandomForest.Parms defaults = new RandomForest.Parms();
        this.labelCol = "1";
        this.seed = System.currentTimeMillis() & 0xFFFFF;
        this.metaCols = "";
        this.modeName = "classify";
        this.purity = null;
        this.maxFeatures = defaults.getNumFeatures();
        this.nEstimators = defaults.getNumTrees();
        this.minSplit = defaults.getMinRows();
        this.maxDepth = defaults.getMaxDepth();
        this.noBootstrap = false;
        this.evaluationReport = "";
        this.setCommandDefaults();
    }

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        if (! this.inFile.canRead())
            throw new FileNotFoundException("Input file " + this.inFile + " is not found or unreadable.");
        try {
            this.treeMode = TreeMode.parse(this.modeName);
            if (this.purity == null)
                this.purity = (this.treeMode.isClassifier() ? PurityFunction.GINI : PurityFunction.STDEV);
            this.hParms = new RandomForest.Parms().setNumFeatures(this.maxFeatures).setNumTrees(this.nEstimators)
                    .setMinRows(this.minSplit).setMaxDepth(this.maxDepth).setBootstrap(! this.noBootstrap);
        } catch (ModelException e) {
            throw new ParseFailureException(e.getMessage(), e);
        }
        this.validateCommandParms();
        List<String> metaList = Collections.emptyList();
        if (! this.metaCols.isEmpty())
            metaList = Arrays.asList(StringUtils.split(this.metaCols, ','));
        this.data = new TabbedDataReader(this.inFile, this.labelCol, metaList);
        log.info("Model type is {} using {} purity.  Parameters are {}.", this.treeMode, this.purity, this.hParms);
        RandomForest.setSeed(this.seed);
        return true;
    }

    /**
     * Set the defaults for the subclass options.
     */
    protected abstract void setCommandDefaults();

    /**
     * Validate the subclass options.
     *
     * @throws ParseFailureException
     */
    protected abstract void validateCommandParms() throws ParseFailureException;

    /**
     * @return a new, untrained forest using the configured hyper-parameters
     */
    protected RandomForest createForest() {
        return new RandomForest(this.treeMode, this.purity, this.hParms);
    }

    /**
     * Train a forest and compute its score on a testing set.  For a classifier the score is the accuracy.
     * For a regression model it is the coefficient of determination.  The full evaluation is saved as
     * the evaluation report.
     *
     * @param forest		forest to train
     * @param trainingSet	training examples
     * @param testingSet	testing examples
     *
     * @return the model score on the testing set
     *
     * @throws IOException
     */
    protected double trainAndScore(RandomForest forest, Sample trainingSet, Sample testingSet) throws IOException {
        forest.train(trainingSet.getFeatureArray(), trainingSet.getLabelArray());
        INDArray predictions = forest.predict(testingSet.getFeatureArray());
        double[] predicted = predictions.toDoubleVector();
        double[] expected = testingSet.getLabels();
        TextStringBuilder buffer = new TextStringBuilder(800);
        double retVal;
        if (this.treeMode.isClassifier()) {
            double[] classes = DoubleStream.concat(Arrays.stream(forest.getClasses()), Arrays.stream(expected))
                    .distinct().sorted().toArray();
            if (classes.length < 2)
                throw new IOException("Classification data must have at least two classes.");
            List<String> classNames = this.getClassNames(classes);
            Evaluation eval = new Evaluation(classNames);
            eval.eval(oneHot(expected, classes), oneHot(predicted, classes));
            this.produceAccuracyReport(buffer, eval, classNames);
            retVal = eval.accuracy();
        } else {
            RegressionEvaluation eval = new RegressionEvaluation(Collections.singletonList(this.data.getLabelName()));
            eval.eval(columnArray(expected), columnArray(predicted));
            buffer.appendln(eval.stats());
            retVal = eval.rSquared(0);
        }
        this.evaluationReport = buffer.toString();
        return retVal;
    }

    /**
     * @return the display names for a set of class labels
     *
     * @param classes	sorted array of class labels
     */
    private List<String> getClassNames(double[] classes) {
        List<String> labelNames = this.data.getLabelNames();
        List<String> retVal = new ArrayList<String>(classes.length);
        for (double label : classes) {
            int code = (int) label;
            if (code == label && code >= 0 && code < labelNames.size())
                retVal.add(labelNames.get(code));
            else
                retVal.add(String.valueOf(label));
        }
        return retVal;
    }

    /**
     * @return a matrix with one row per label and a 1 in the column for the label's class
     *
     * @param labels	class labels to encode
     * @param classes	sorted array of all the class labels
     */
    private static INDArray oneHot(double[] labels, double[] classes) {
        double[][] retVal = new double[labels.length][classes.length];
        for (int i = 0; i < labels.length; i++)
            retVal[i][Arrays.binarySearch(classes, labels[i])] = 1.0;
        return Nd4j.create(retVal);
    }

    /**
     * @return a single-column matrix containing the specified values
     *
     * @param values	values to put in the matrix
     */
    private static INDArray columnArray(double[] values) {
        double[][] retVal = new double[values.length][];
        for (int i = 0; i < values.length; i++)
            retVal[i] = new double[] { values[i] };
        return Nd4j.create(retVal);
    }

    /**
     * Store a classification accuracy report in the specified text buffer.
     *
     * @param buffer		output text buffer
     * @param eval			classification evaluation object
     * @param classNames	names of the classes, in evaluation order
     */
    private void produceAccuracyReport(TextStringBuilder buffer, Evaluation eval, List<String> classNames) {
        buffer.appendln(eval.stats());
        ConfusionMatrix<Integer> matrix = eval.getConfusion();
        // Sensitivity is true positive / actual positive, precision is true positive / predicted positive.
        buffer.appendln("%-11s %11s %11s %11s", "class", "count", "sensitivity", "precision");
        buffer.appendln(StringUtils.repeat('-', 47));
        for (int i = 0; i < classNames.size(); i++) {
            String sensitivity = formatRatio(matrix.getCount(i, i), matrix.getActualTotal(i));
            String precision = formatRatio(matrix.getCount(i, i), matrix.getPredictedTotal(i));
            buffer.appendln("%-11s %11d %11s %11s", classNames.get(i), matrix.getActualTotal(i), sensitivity, precision);
        }
    }

    /**
     * Format a ratio for display in the evaluation table.
     *
     * @param value		numerator
     * @param total		denominator
     *
     * @return the ratio formatted for display, or a blank string if the denominator is 0
     */
    protected static String formatRatio(double value, int total) {
        String retVal = "";
        if (total > 0)
            retVal = String.format("%11.4f", value / total);
        return retVal;
    }

    /**
     * @return the evaluation report from the most recent scoring
     */
    public String getEvaluationReport() {
        return this.evaluationReport;
    }

    /**
     * @return the loaded data
     */
    public TabbedDataReader getData() {
        return this.data;
    }

    /**
     * @return the model type
     */
    public TreeMode getTreeMode() {
        return this.treeMode;
    }

    /**
     * @return the purity function
     */
    public PurityFunction getPurity() {
        return this.purity;
    }

    /**
     * @return the hyper-parameters
     */
    public RandomForest.Parms getParms() {
        return this.hParms;
    }

    /**
     * @return the name of the score for this model type
     */
    protected String getScoreName() {
        return (this.treeMode.isClassifier() ? "accuracy" : "r-squared");
    }

}
