/**
 *
 */
package org.theseed.forest.decision;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.forest.features.Features;

/**
 * A random forest is a set of decision trees, each trained on a bootstrap sample of the full training set and
 * examining a random subset of the columns at each split.  The trees are trained in parallel.  An entire
 * forest predicts an outcome by voting (classification) or averaging (regression).
 *
 * @author Bruce Parrello
 *
 */
public class RandomForest {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RandomForest.class);
    /** random number generator */
    private static Random rand = new Random();
    /** type of model */
    private final TreeMode mode;
    /** purity function for evaluating splits */
    private final IPurityFunction purityFn;
    /** hyperparameters */
    private Parms parms;
    /** trees in this forest */
    private List<DecisionTree> trees;
    /** number of input columns */
    private int nCols;
    /** number of training rows */
    private int inputRecordCount;
    /** number of columns examined at each split in the last training run */
    private int randomFeatures;
    /** distinct class labels in the training set (classification only) */
    private double[] classes;

    /**
     * Initialize the randomizer with a specified seed.
     *
     * @param seed	randomization seed to use
     */
    public static void setSeed(long seed) {
        rand = new Random(seed);
    }

    /**
     * This class represents the hyperparameters for the random forest.
     */
    public static class Parms {

        /** number of trees */
        private int nTrees;
        /** number of features to use at each node (0 for the square root of the column count) */
        private int nFeatures;
        /** minimum number of rows required to split a node */
        private int minRows;
        /** maximum tree depth */
        private int maxDepth;
        /** TRUE to train each tree on a bootstrap sample */
        private boolean bootstrap;
        /** TRUE to record out-of-bag rows for each tree */
        private boolean outOfBag;

        /**
         * Construct hyperparameters with default values.
         */
        public Parms() {
            this.nTrees = 103;
            this.nFeatures = 0;
            this.minRows = 3;
            this.maxDepth = 1000;
            this.bootstrap = true;
            this.outOfBag = false;
        }

        /**
         * @return the number of trees to build
         */
        public int getNumTrees() {
            return this.nTrees;
        }

        /**
         * Specify the number of trees to build.
         *
         * @param nTrees 	the number of trees to build
         */
        public Parms setNumTrees(int nTrees) {
            if (nTrees < 1)
                throw new ModelException(ModelException.Type.INVALID_CONFIGURATION, "a forest needs at least one tree");
            this.nTrees = nTrees;
            return this;
        }

        /**
         * @return the number of features to test at each choice node (0 for the default)
         */
        public int getNumFeatures() {
            return this.nFeatures;
        }

        /**
         * Set the number of features to test at each choice node.  A value of 0 means to use the square root
         * of the column count.
         *
         * @param nFeatures 	the number of features to set
         */
        public Parms setNumFeatures(int nFeatures) {
            if (nFeatures < 0)
                throw new ModelException(ModelException.Type.INVALID_CONFIGURATION, "feature count cannot be negative");
            this.nFeatures = nFeatures;
            return this;
        }

        /**
         * @return the minimum number of rows required to split a node
         */
        public int getMinRows() {
            return this.minRows;
        }

        /**
         * Specify the minimum number of rows required to split a node.
         *
         * @param minRows 	the row minimum to set
         */
        public Parms setMinRows(int minRows) {
            if (minRows < 0)
                throw new ModelException(ModelException.Type.INVALID_CONFIGURATION, "minimum rows cannot be negative");
            this.minRows = minRows;
            return this;
        }

        /**
         * @return the maximum permissible tree depth
         */
        public int getMaxDepth() {
            return this.maxDepth;
        }

        /**
         * Specify the maximum permissible tree depth.
         *
         * @param maxDepth 	the depth to set
         */
        public Parms setMaxDepth(int maxDepth) {
            if (maxDepth < 0)
                throw new ModelException(ModelException.Type.INVALID_CONFIGURATION, "maximum depth cannot be negative");
            this.maxDepth = maxDepth;
            return this;
        }

        /**
         * @return TRUE if each tree is trained on a bootstrap sample
         */
        public boolean isBootstrap() {
            return this.bootstrap;
        }

        /**
         * Specify whether or not each tree is trained on a bootstrap sample.
         *
         * @param bootstrap		TRUE to resample the training rows for each tree
         */
        public Parms setBootstrap(boolean bootstrap) {
            this.bootstrap = bootstrap;
            return this;
        }

        /**
         * @return TRUE if each tree records its out-of-bag rows
         */
        public boolean isOutOfBag() {
            return this.outOfBag;
        }

        /**
         * Specify whether or not each tree records its out-of-bag rows.
         *
         * @param outOfBag		TRUE to record the rows left out of each bootstrap sample
         */
        public Parms setOutOfBag(boolean outOfBag) {
            this.outOfBag = outOfBag;
            return this;
        }

        @Override
        public String toString() {
            return "Parms[nTrees=" + this.nTrees + ", nFeatures=" + this.nFeatures + ", minRows=" + this.minRows
                    + ", maxDepth=" + this.maxDepth + ", bootstrap=" + this.bootstrap + "]";
        }

    }

    /**
     * Construct an untrained random forest with default hyperparameters.
     *
     * @param mode			type of model
     * @param purityFn		purity function for evaluating splits
     */
    public RandomForest(TreeMode mode, IPurityFunction purityFn) {
        this(mode, purityFn, new Parms());
    }

    /**
     * Construct an untrained random forest.
     *
     * @param mode			type of model
     * @param purityFn		purity function for evaluating splits
     * @param parms			hyperparameters
     */
    public RandomForest(TreeMode mode, IPurityFunction purityFn, Parms parms) {
        this.mode = mode;
        this.purityFn = purityFn;
        this.parms = parms;
        this.trees = new ArrayList<DecisionTree>();
        this.nCols = 0;
        this.inputRecordCount = 0;
        this.randomFeatures = parms.getNumFeatures();
        this.classes = new double[0];
    }

    /**
     * Construct a random forest from trees that have already been built.
     *
     * @param mode			type of model
     * @param purityFn		purity function for evaluating splits
     * @param trees			trained trees to use
     */
    protected RandomForest(TreeMode mode, IPurityFunction purityFn, List<DecisionTree> trees) {
        this(mode, purityFn, new Parms().setNumTrees(trees.size()));
        this.trees.addAll(trees);
        DecisionTree first = trees.get(0);
        this.nCols = first.getMinColumns();
        this.inputRecordCount = first.getInputRecordCount();
        this.classes = first.getClasses();
    }

    /**
     * Train this forest.  Any previous trees are discarded.
     *
     * @param features	feature matrix, one row per example
     * @param labels	target vector, one value per example
     */
    public void train(INDArray features, INDArray labels) {
        DecisionTree.checkTrainingInput(features, labels);
        final double[][] matrix = features.toDoubleMatrix();
        final double[] target = DecisionTree.toVector(labels);
        this.nCols = matrix[0].length;
        this.inputRecordCount = matrix.length;
        if (this.mode.isClassifier())
            this.classes = Features.distinct(target);
        // Compute the number of features to examine at each split.
        int nFeatures = this.parms.getNumFeatures();
        if (nFeatures == 0)
            nFeatures = (int) Math.round(Math.sqrt(this.nCols));
        this.randomFeatures = nFeatures;
        final int nTrees = this.parms.getNumTrees();
        log.info("Training {} trees on {} rows with {} of {} features per split.", nTrees, this.inputRecordCount,
                this.randomFeatures, this.nCols);
        long start = System.currentTimeMillis();
        // Create an array of randomizer seeds.  Each tree gets its own generator.
        long[] seeds = rand.longs(nTrees).toArray();
        // Create the decision trees in the random forest.
        this.trees = IntStream.range(0, nTrees).parallel()
                .mapToObj(i -> this.buildTree(seeds[i], matrix, target))
                .collect(Collectors.toList());
        log.info("{} trees trained in {} seconds.", nTrees, (System.currentTimeMillis() - start) / 1000.0);
    }

    /**
     * Create and train a decision tree.  All the trees are built in parallel, so care has been taken not to
     * modify the incoming parameters.
     *
     * @param seed			seed for the tree's random-number generator
     * @param matrix		feature rows of the full training set
     * @param target		target values of the full training set
     *
     * @return a trained decision tree
     */
    private DecisionTree buildTree(long seed, double[][] matrix, double[] target) {
        DecisionTree retVal = new DecisionTree(this.mode, this.purityFn)
                .setMaxDepth(this.parms.getMaxDepth())
                .setMinRows(this.parms.getMinRows())
                .setRandomFeatures(this.randomFeatures)
                .setBootstrap(this.parms.isBootstrap())
                .setTrackOutOfBag(this.parms.isOutOfBag())
                .setSeed(seed);
        retVal.train(matrix, target);
        return retVal;
    }

    /**
     * Verify that a prediction set is acceptable.
     *
     * @param features	feature matrix, one row per example
     */
    private void checkPredictionInput(INDArray features) {
        DecisionTree.checkPredictionInput(features, this.isTrained(), this.nCols);
    }

    /**
     * Predict the outcomes for a set of input rows.
     *
     * @param features		feature matrix, one row per example
     *
     * @return a vector of predictions, one per input row
     */
    public INDArray predict(INDArray features) {
        this.checkPredictionInput(features);
        final double[][] rows = features.toDoubleMatrix();
        final double[] retVal = new double[rows.length];
        IntStream.range(0, rows.length).parallel().forEach(i -> retVal[i] = this.predictRow(rows[i]));
        return Nd4j.create(retVal);
    }

    /**
     * @return the combined prediction of all the trees for a single row
     *
     * @param row	input row
     */
    private double predictRow(double[] row) {
        double[] predictions = new double[this.trees.size()];
        for (int i = 0; i < predictions.length; i++)
            predictions[i] = this.trees.get(i).predictRow(row);
        return this.mode.combine(predictions);
    }

    /**
     * Predict the class labels for a set of input rows, along with the label probabilities.  The label is
     * decided by majority vote.  The probabilities are the sums of the leaf probabilities from each tree,
     * normalized so they add up to 1.
     *
     * @param features		feature matrix, one row per example
     *
     * @return a list of predictions, one per input row
     */
    public List<ClassPrediction> predictWithProbabilities(INDArray features) {
        if (! this.mode.isClassifier())
            throw new ModelException(ModelException.Type.MODE_MISMATCH);
        this.checkPredictionInput(features);
        final double[][] rows = features.toDoubleMatrix();
        final ClassPrediction[] retVal = new ClassPrediction[rows.length];
        IntStream.range(0, rows.length).parallel().forEach(i -> retVal[i] = this.predictRowWithProbabilities(rows[i]));
        List<ClassPrediction> list = new ArrayList<ClassPrediction>(rows.length);
        Collections.addAll(list, retVal);
        return list;
    }

    /**
     * @return the majority label and combined label probabilities for a single row
     *
     * @param row	input row
     */
    private ClassPrediction predictRowWithProbabilities(double[] row) {
        SortedMap<Double, Integer> votes = new TreeMap<Double, Integer>();
        SortedMap<Double, Double> probabilities = new TreeMap<Double, Double>();
        for (DecisionTree tree : this.trees) {
            DecisionTree.ClassLeafNode leaf = tree.findClassLeaf(row);
            votes.merge(leaf.getPredicted(), 1, Integer::sum);
            for (Map.Entry<Double, Double> entry : leaf.getProbabilities().entrySet())
                probabilities.merge(entry.getKey(), entry.getValue(), Double::sum);
        }
        double total = probabilities.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total > 0.0)
            probabilities.replaceAll((k, v) -> v / total);
        return new ClassPrediction(DecisionTree.bestLabel(votes), probabilities);
    }

    /**
     * Compute the importance of each input column.  This is the mean of the weighted purity gains of the
     * individual trees.
     *
     * @return a vector of mean purity gains, one per input column
     */
    public INDArray purityGains() {
        if (! this.isTrained())
            throw new ModelException(ModelException.Type.UNTRAINED);
        INDArray retVal = Nd4j.zeros(DataType.DOUBLE, this.nCols);
        for (DecisionTree tree : this.trees)
            retVal.addi(tree.purityGains());
        retVal.divi(this.trees.size());
        return retVal;
    }

    /**
     * @return TRUE if this forest has been trained
     */
    public boolean isTrained() {
        return ! this.trees.isEmpty();
    }

    /**
     * @return the trees in this forest
     */
    public List<DecisionTree> getTrees() {
        return Collections.unmodifiableList(this.trees);
    }

    /**
     * @return the number of trees in this forest
     */
    public int getTreeCount() {
        return this.trees.size();
    }

    /**
     * @return the type of model
     */
    public TreeMode getMode() {
        return this.mode;
    }

    /**
     * @return the hyperparameters
     */
    public Parms getParms() {
        return this.parms;
    }

    /**
     * @return the number of columns trained on
     */
    public int getMinColumns() {
        return this.nCols;
    }

    /**
     * @return the number of rows trained on
     */
    public int getInputRecordCount() {
        return this.inputRecordCount;
    }

    /**
     * @return the number of columns examined at each split
     */
    public int getRandomFeatures() {
        return this.randomFeatures;
    }

    /**
     * @return the distinct class labels in the training set (empty for regression)
     */
    public double[] getClasses() {
        return this.classes;
    }

}
