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

import org.apache.commons.lang3.tuple.Pair;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.forest.features.Features;
import org.theseed.forest.features.Sample;

/**
 * A decision tree is a data structure that can be used to classify an item or predict a value based on a set
 * of features.  Each choice node specifies a feature column and a split point.  Rows with a value greater than
 * the split point go to the "yes" child and the others to the "no" child.  At the leaf level a class label or
 * a value is specified.
 *
 * The nodes are kept in a list, and children are referenced by their index in the list.  The root is always
 * node 0, and a node's children are always added after the node itself.
 *
 * Training is recursive.  Growth stops at a node when the depth limit is exceeded, when too few rows remain,
 * when all the target values are the same, or when no useful split can be found.  In addition, there are hard
 * limits on the number of recursions and splits to guarantee termination.
 *
 * @author Bruce Parrello
 *
 */
public class DecisionTree {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(DecisionTree.class);
    /** default maximum number of recursions during training */
    public static final int MAX_RECURSIONS = 10000;
    /** default maximum number of choice nodes */
    public static final int MAX_SPLITS = 10000;
    /** maximum number of steps in a traversal from the root */
    public static final int MAX_STEPS = 10000;
    /** type of model */
    private final TreeMode mode;
    /** purity function for evaluating splits */
    private final IPurityFunction purityFn;
    /** maximum depth of a choice node */
    private int maxDepth;
    /** minimum number of rows required to split a node */
    private int minRows;
    /** number of columns to examine at each split (0 or less for all) */
    private int randomFeatures;
    /** TRUE to train on a bootstrap sample of the input */
    private boolean bootstrap;
    /** TRUE to record the rows left out of the bootstrap sample */
    private boolean trackOutOfBag;
    /** random-number generator for sampling */
    private Random rand;
    /** maximum number of recursions during training */
    private int maxRecursions;
    /** maximum number of choice nodes created during training */
    private int maxSplits;
    /** list of nodes, with the root first */
    private List<Node> nodes;
    /** number of columns trained on */
    private int nCols;
    /** number of rows trained on */
    private int inputRecordCount;
    /** distinct class labels in the training data (classification only) */
    private double[] classes;
    /** deepest level reached during training */
    private int depth;
    /** number of choice nodes created during training */
    private int splitCount;
    /** indices of the training rows left out of the bootstrap sample */
    private int[] outOfBag;

    /**
     * This nested class represents a tree node.
     */
    public static abstract class Node {

        /** number of training rows that reached this node */
        private int recordCount;

        protected Node(int recordCount) {
            this.recordCount = recordCount;
        }

        /**
         * @return the number of training rows that reached this node
         */
        public int getRecordCount() {
            return this.recordCount;
        }

    }

    /**
     * This is a decision node, with two children.
     */
    public static class ChoiceNode extends Node {

        /** index of deciding feature */
        private int iFeature;
        /** split point (greater values go to the "yes" child) */
        private double limit;
        /** purity gain */
        private double gain;
        /** index of the "yes" child */
        private int yesIdx;
        /** index of the "no" child */
        private int noIdx;

        /**
         * Create a new node with the specified decision criteria.  The children are filled in later.
         *
         * @param iFeat			index of deciding feature
         * @param lim			split point
         * @param gain			purity gain from the split
         * @param recordCount	number of training rows reaching this node
         */
        protected ChoiceNode(int iFeat, double lim, double gain, int recordCount) {
            super(recordCount);
            this.iFeature = iFeat;
            this.limit = lim;
            this.gain = gain;
            this.yesIdx = -1;
            this.noIdx = -1;
        }

        /**
         * Create a new node with known children.
         *
         * @param iFeat			index of deciding feature
         * @param lim			split point
         * @param gain			purity gain from the split
         * @param recordCount	number of training rows reaching this node
         * @param yesIdx		index of the "yes" child
         * @param noIdx			index of the "no" child
         */
        protected ChoiceNode(int iFeat, double lim, double gain, int recordCount, int yesIdx, int noIdx) {
            this(iFeat, lim, gain, recordCount);
            this.yesIdx = yesIdx;
            this.noIdx = noIdx;
        }

        /**
         * @return the index of the child relevant to the specified input row
         *
         * @param row	input row to test
         */
        public int choose(double[] row) {
            return (row[this.iFeature] > this.limit ? this.yesIdx : this.noIdx);
        }

        /**
         * @return the decision feature index for this node
         */
        public int getFeatureIdx() {
            return this.iFeature;
        }

        /**
         * @return the split point
         */
        public double getLimit() {
            return this.limit;
        }

        /**
         * @return the purity gain for this node
         */
        public double getGain() {
            return this.gain;
        }

        /**
         * @return the index of the "yes" child
         */
        public int getYesIdx() {
            return this.yesIdx;
        }

        /**
         * @return the index of the "no" child
         */
        public int getNoIdx() {
            return this.noIdx;
        }

        /**
         * Attach the "yes" child.
         *
         * @param yesIdx	index of the "yes" child
         */
        protected void setYesIdx(int yesIdx) {
            this.yesIdx = yesIdx;
        }

        /**
         * Attach the "no" child.
         *
         * @param noIdx		index of the "no" child
         */
        protected void setNoIdx(int noIdx) {
            this.noIdx = noIdx;
        }

        @Override
        public String toString() {
            return "ChoiceNode[iFeature=" + this.iFeature + ", limit=" + this.limit + ", yes=" + this.yesIdx
                    + ", no=" + this.noIdx + "]";
        }

    }

    /**
     * This class represents a regression leaf node.
     */
    public static class LeafNode extends Node {

        /** predicted value */
        private double predicted;

        /**
         * Construct a leaf node.
         *
         * @param recordCount	number of training rows reaching the leaf
         * @param predicted		value predicted by the leaf
         */
        protected LeafNode(int recordCount, double predicted) {
            super(recordCount);
            this.predicted = predicted;
        }

        /**
         * @return the value predicted by this leaf
         */
        public double getPredicted() {
            return this.predicted;
        }

        @Override
        public String toString() {
            return "LeafNode[predicted=" + this.predicted + ", records=" + this.getRecordCount() + "]";
        }

    }

    /**
     * This class represents a classification leaf node.  In addition to the predicted label, it remembers
     * how many training rows of each label reached it.
     */
    public static class ClassLeafNode extends LeafNode {

        /** number of training rows for each label */
        private SortedMap<Double, Integer> classCounts;

        /**
         * Construct a classification leaf node.
         *
         * @param recordCount	number of training rows reaching the leaf
         * @param predicted		label predicted by the leaf
         * @param classCounts	number of training rows for each label
         */
        protected ClassLeafNode(int recordCount, double predicted, SortedMap<Double, Integer> classCounts) {
            super(recordCount, predicted);
            this.classCounts = classCounts;
        }

        /**
         * @return the number of training rows for each label
         */
        public SortedMap<Double, Integer> getClassCounts() {
            return Collections.unmodifiableSortedMap(this.classCounts);
        }

        /**
         * @return the fraction of training rows for each label
         */
        public SortedMap<Double, Double> getProbabilities() {
            SortedMap<Double, Double> retVal = new TreeMap<Double, Double>();
            double total = this.getRecordCount();
            for (Map.Entry<Double, Integer> entry : this.classCounts.entrySet())
                retVal.put(entry.getKey(), entry.getValue() / total);
            return retVal;
        }

        @Override
        public String toString() {
            return "ClassLeafNode[predicted=" + this.getPredicted() + ", records=" + this.getRecordCount()
                    + ", counts=" + this.classCounts + "]";
        }

    }

    /**
     * This object tracks the counters for a single training run.  It is passed down through the recursion.
     */
    private static class GrowthContext {

        /** recursion limit */
        private final int maxRecursions;
        /** split limit */
        private final int maxSplits;
        /** number of recursive calls */
        private int recursions;
        /** number of choice nodes created */
        private int splits;
        /** deepest level reached */
        private int deepest;
        /** TRUE if a hard limit has been reported */
        private boolean warned;

        /**
         * Create the counters for a training run.
         *
         * @param maxRecursions		maximum number of recursions
         * @param maxSplits			maximum number of choice nodes
         */
        protected GrowthContext(int maxRecursions, int maxSplits) {
            this.maxRecursions = maxRecursions;
            this.maxSplits = maxSplits;
        }

        /**
         * Record entry to a new level of recursion.
         *
         * @param parentDepth	depth of the parent node (0 for the root)
         *
         * @return the depth of the new node
         */
        protected int enter(int parentDepth) {
            this.recursions++;
            int retVal = parentDepth + 1;
            if (retVal > this.deepest) this.deepest = retVal;
            return retVal;
        }

        /**
         * @return TRUE if one of the hard limits has been exceeded
         */
        protected boolean isExhausted() {
            boolean retVal = (this.recursions > this.maxRecursions || this.splits > this.maxSplits);
            if (retVal && ! this.warned) {
                log.warn("Tree growth limit reached after {} recursions and {} splits.", this.recursions, this.splits);
                this.warned = true;
            }
            return retVal;
        }

        /**
         * Count a new choice node.
         */
        protected void countSplit() {
            this.splits++;
        }

    }

    /**
     * Create an untrained decision tree with the default hyperparameters.
     *
     * @param mode			type of model
     * @param purityFn		purity function for evaluating splits
     */
    public DecisionTree(TreeMode mode, IPurityFunction purityFn) {
        this.mode = mode;
        this.purityFn = purityFn;
        this.maxDepth = 15;
        this.minRows = 3;
        this.randomFeatures = -1;
        this.bootstrap = false;
        this.trackOutOfBag = false;
        this.rand = new Random();
        this.maxRecursions = MAX_RECURSIONS;
        this.maxSplits = MAX_SPLITS;
        this.clear();
    }

    /**
     * Erase the training results.
     */
    private void clear() {
        this.nodes = new ArrayList<Node>();
        this.nCols = 0;
        this.inputRecordCount = 0;
        this.classes = new double[0];
        this.depth = 0;
        this.splitCount = 0;
        this.outOfBag = new int[0];
    }

    /**
     * Specify the maximum depth of a choice node.
     *
     * @param maxDepth	the depth limit to set
     */
    public DecisionTree setMaxDepth(int maxDepth) {
        if (maxDepth < 0)
            throw new ModelException(ModelException.Type.INVALID_CONFIGURATION, "maximum depth cannot be negative");
        this.maxDepth = maxDepth;
        return this;
    }

    /**
     * Specify the minimum number of rows required to split a node.
     *
     * @param minRows	the row minimum to set
     */
    public DecisionTree setMinRows(int minRows) {
        if (minRows < 0)
            throw new ModelException(ModelException.Type.INVALID_CONFIGURATION, "minimum rows cannot be negative");
        this.minRows = minRows;
        return this;
    }

    /**
     * Specify the number of columns to examine at each split.
     *
     * @param randomFeatures	number of columns to choose at random, or 0 or less to use all the columns
     */
    public DecisionTree setRandomFeatures(int randomFeatures) {
        this.randomFeatures = randomFeatures;
        return this;
    }

    /**
     * Specify whether or not to train on a bootstrap sample.
     *
     * @param bootstrap		TRUE to resample the training rows with replacement
     */
    public DecisionTree setBootstrap(boolean bootstrap) {
        this.bootstrap = bootstrap;
        return this;
    }

    /**
     * Specify whether or not to record the training rows left out of the bootstrap sample.
     *
     * @param trackOutOfBag		TRUE to record the out-of-bag rows
     */
    public DecisionTree setTrackOutOfBag(boolean trackOutOfBag) {
        this.trackOutOfBag = trackOutOfBag;
        return this;
    }

    /**
     * Specify the hard limits on tree growth.  When either limit is passed, every remaining node becomes a leaf.
     *
     * @param maxRecursions		maximum number of recursions during training
     * @param maxSplits			maximum number of choice nodes
     */
    protected DecisionTree setGrowthLimits(int maxRecursions, int maxSplits) {
        if (maxRecursions < 1 || maxSplits < 0)
            throw new ModelException(ModelException.Type.INVALID_CONFIGURATION, "recursion limit must be positive and split limit cannot be negative");
        this.maxRecursions = maxRecursions;
        this.maxSplits = maxSplits;
        return this;
    }

    /**
     * Specify the seed for the random-number generator used in sampling.
     *
     * @param seed	seed to use
     */
    public DecisionTree setSeed(long seed) {
        this.rand = new Random(seed);
        return this;
    }

    /**
     * @return the number of rows in a feature matrix
     *
     * @param features	feature matrix to check
     */
    protected static long rowCount(INDArray features) {
        long retVal = 0;
        if (features != null && ! features.isEmpty() && features.rank() > 0)
            retVal = features.size(0);
        return retVal;
    }

    /**
     * Verify that a training set is acceptable.
     *
     * @param features	feature matrix, one row per example
     * @param labels	target vector, one value per example
     */
    protected static void checkTrainingInput(INDArray features, INDArray labels) {
        long rows = rowCount(features);
        long n = (labels == null || labels.isEmpty() ? 0 : labels.length());
        if (rows == 0 || n == 0)
            throw new ModelException(ModelException.Type.EMPTY_INPUT);
        if (features.rank() != 2)
            throw new ModelException(ModelException.Type.SHAPE_MISMATCH, "features must be a two-dimensional matrix");
        if (rows != n)
            throw new ModelException(ModelException.Type.SHAPE_MISMATCH, rows + " rows and " + n + " target values");
    }

    /**
     * Verify that a prediction set is acceptable to a trained model.
     *
     * @param features	feature matrix, one row per example
     * @param trained	TRUE if the model is trained
     * @param nCols		number of columns the model was trained on
     */
    protected static void checkPredictionInput(INDArray features, boolean trained, int nCols) {
        if (! trained)
            throw new ModelException(ModelException.Type.UNTRAINED);
        if (rowCount(features) == 0)
            throw new ModelException(ModelException.Type.EMPTY_INPUT);
        if (features.rank() != 2 || features.size(1) != nCols)
            throw new ModelException(ModelException.Type.SHAPE_MISMATCH, "model was trained on " + nCols + " columns");
    }

    /**
     * @return the values of a target array as a vector
     *
     * @param labels	target array (any vector shape)
     */
    protected static double[] toVector(INDArray labels) {
        return labels.ravel().toDoubleVector();
    }

    /**
     * Train this tree.
     *
     * @param features	feature matrix, one row per example
     * @param labels	target vector, one value per example
     */
    public void train(INDArray features, INDArray labels) {
        this.train(features, labels, false);
    }

    /**
     * Train this tree.
     *
     * @param features		feature matrix, one row per example
     * @param labels		target vector, one value per example
     * @param skipChecks	TRUE if the caller has already validated the input
     */
    public void train(INDArray features, INDArray labels, boolean skipChecks) {
        if (! skipChecks)
            checkTrainingInput(features, labels);
        this.train(features.toDoubleMatrix(), toVector(labels));
    }

    /**
     * Train this tree from a validated training set.  The input arrays are not modified.
     *
     * @param matrix	feature rows
     * @param target	target values, one per row
     */
    protected void train(double[][] matrix, double[] target) {
        this.clear();
        this.nCols = matrix[0].length;
        this.inputRecordCount = matrix.length;
        if (this.mode.isClassifier())
            this.classes = Features.distinct(target);
        // Get the working copy of the data.
        double[][] workMatrix;
        double[] workTarget;
        if (this.bootstrap) {
            Sample sample = Features.bootstrap(matrix, target, this.trackOutOfBag, this.rand);
            workMatrix = sample.getFeatures();
            workTarget = sample.getLabels();
            this.outOfBag = sample.getOutOfBag();
        } else {
            workMatrix = Features.copy(matrix);
            workTarget = target.clone();
        }
        GrowthContext context = new GrowthContext(this.maxRecursions, this.maxSplits);
        this.grow(workMatrix, workTarget, 0, context);
        this.depth = context.deepest;
        this.splitCount = context.splits;
        log.debug("Tree trained on {} rows with {} nodes, {} splits, and depth {}.", this.inputRecordCount,
                this.nodes.size(), this.splitCount, this.depth);
    }

    /**
     * Recursively compute the tree node for the specified training rows.
     *
     * @param matrix		feature rows reaching this node
     * @param target		target values for the rows
     * @param parentDepth	depth of the parent node (0 for the root)
     * @param context		counters for this training run
     *
     * @return the index of the new node
     */
    private int grow(double[][] matrix, double[] target, int parentDepth, GrowthContext context) {
        int level = context.enter(parentDepth);
        int recordCount = target.length;
        // Is this a leaf?
        if (context.isExhausted() || level > this.maxDepth || recordCount < this.minRows || allSame(target))
            return this.addLeaf(target);
        // Find the best split.  If nothing improves the purity, this is a leaf.
        Splitter best = Splitter.computeSplit(matrix, target, this.purityFn, this.randomFeatures, this.rand);
        if (best.getGain() <= 0.0)
            return this.addLeaf(target);
        // Partition the rows.
        boolean[] filter = best.filter(matrix);
        Pair<double[][], double[][]> rows = Features.splitRows(matrix, filter);
        Pair<double[], double[]> values = Features.splitValues(target, filter);
        double[][] yesRows = rows.getLeft();
        double[][] noRows = rows.getRight();
        double[] yesValues = values.getLeft();
        double[] noValues = values.getRight();
        // If the split is useless, this is a leaf.
        if (yesValues.length == 0 || noValues.length == 0 || yesValues.length < this.minRows
                || noValues.length < this.minRows)
            return this.addLeaf(target);
        // Release the parent working set.
        matrix = null;
        target = null;
        rows = null;
        values = null;
        // Here we can split the node.
        int retVal = this.nodes.size();
        ChoiceNode newNode = best.createNode(recordCount);
        this.nodes.add(newNode);
        context.countSplit();
        newNode.setYesIdx(this.grow(yesRows, yesValues, level, context));
        newNode.setNoIdx(this.grow(noRows, noValues, level, context));
        return retVal;
    }

    /**
     * @return TRUE if all the values in a vector are equal
     *
     * @param target	vector to check
     */
    private static boolean allSame(double[] target) {
        boolean retVal = true;
        for (int i = 1; retVal && i < target.length; i++)
            retVal = (target[i] == target[0]);
        return retVal;
    }

    /**
     * Add a leaf node for a set of training rows.
     *
     * @param target	target values of the rows
     *
     * @return the index of the new node
     */
    private int addLeaf(double[] target) {
        int retVal = this.nodes.size();
        this.nodes.add(this.mode.createLeaf(target));
        return retVal;
    }

    /**
     * @return the most common label in a count map (the lowest label wins ties)
     *
     * @param counts	map of labels to counts
     */
    public static double bestLabel(SortedMap<Double, Integer> counts) {
        double retVal = 0.0;
        int best = -1;
        for (Map.Entry<Double, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                retVal = entry.getKey();
                best = entry.getValue();
            }
        }
        return retVal;
    }

    /**
     * Install a list of nodes built elsewhere in place of the training results.
     *
     * @param nodes				list of nodes, with the root first
     * @param nCols				number of input columns
     * @param inputRecordCount	number of rows the nodes were built from
     */
    protected void restore(List<Node> nodes, int nCols, int inputRecordCount) {
        this.clear();
        this.nodes.addAll(nodes);
        this.nCols = nCols;
        this.inputRecordCount = inputRecordCount;
        if (this.mode.isClassifier()) {
            this.classes = nodes.stream().filter(x -> x instanceof ClassLeafNode)
                    .flatMap(x -> ((ClassLeafNode) x).classCounts.keySet().stream())
                    .mapToDouble(Double::doubleValue).distinct().sorted().toArray();
        }
        for (Node node : nodes) {
            if (node instanceof ChoiceNode) this.splitCount++;
        }
    }

    /**
     * @return the leaf reached by an input row
     *
     * @param row	input row
     */
    protected LeafNode findLeaf(double[] row) {
        Node current = this.nodes.get(0);
        int steps = 0;
        while (current instanceof ChoiceNode) {
            steps++;
            if (steps > MAX_STEPS)
                throw new ModelException(ModelException.Type.LIMIT_EXCEEDED, "no leaf found after " + MAX_STEPS
                        + " steps");
            current = this.nodes.get(((ChoiceNode) current).choose(row));
        }
        return (LeafNode) current;
    }

    /**
     * @return the classification leaf reached by an input row
     *
     * @param row	input row
     */
    protected ClassLeafNode findClassLeaf(double[] row) {
        return (ClassLeafNode) this.findLeaf(row);
    }

    /**
     * @return the prediction for an input row
     *
     * @param row	input row
     */
    protected double predictRow(double[] row) {
        return this.findLeaf(row).getPredicted();
    }

    /**
     * @return the predictions for a set of input rows
     *
     * @param features	feature matrix, one row per example
     */
    public INDArray predict(INDArray features) {
        return this.predict(features, false);
    }

    /**
     * @return the predictions for a set of input rows
     *
     * @param features		feature matrix, one row per example
     * @param skipChecks	TRUE if the caller has already validated the input
     */
    public INDArray predict(INDArray features, boolean skipChecks) {
        if (! skipChecks)
            checkPredictionInput(features, this.isTrained(), this.nCols);
        double[][] rows = features.toDoubleMatrix();
        double[] retVal = new double[rows.length];
        for (int i = 0; i < rows.length; i++)
            retVal[i] = this.predictRow(rows[i]);
        return Nd4j.create(retVal);
    }

    /**
     * Verify that a classification-only method can be used.
     */
    private void checkClassifier() {
        if (! this.mode.isClassifier())
            throw new ModelException(ModelException.Type.MODE_MISMATCH);
    }

    /**
     * @return the predicted label and label probabilities for each input row
     *
     * @param features	feature matrix, one row per example
     */
    public List<ClassPrediction> predictWithProbabilities(INDArray features) {
        this.checkClassifier();
        checkPredictionInput(features, this.isTrained(), this.nCols);
        double[][] rows = features.toDoubleMatrix();
        List<ClassPrediction> retVal = new ArrayList<ClassPrediction>(rows.length);
        for (double[] row : rows) {
            ClassLeafNode leaf = this.findClassLeaf(row);
            retVal.add(new ClassPrediction(leaf.getPredicted(), leaf.getProbabilities()));
        }
        return retVal;
    }

    /**
     * @return the predicted label and the training label counts at the leaf for each input row
     *
     * @param features	feature matrix, one row per example
     */
    public List<Pair<Double, SortedMap<Double, Integer>>> predictWithClassCounts(INDArray features) {
        this.checkClassifier();
        checkPredictionInput(features, this.isTrained(), this.nCols);
        double[][] rows = features.toDoubleMatrix();
        List<Pair<Double, SortedMap<Double, Integer>>> retVal = new ArrayList<>(rows.length);
        for (double[] row : rows) {
            ClassLeafNode leaf = this.findClassLeaf(row);
            retVal.add(Pair.of(leaf.getPredicted(), leaf.getClassCounts()));
        }
        return retVal;
    }

    /**
     * Compute the importance of each input column.  Each choice node contributes its purity gain, weighted
     * by the fraction of the training rows that reached it, to the total for its column.
     *
     * @return a vector of weighted purity gains, one per input column
     */
    public INDArray purityGains() {
        if (! this.isTrained())
            throw new ModelException(ModelException.Type.UNTRAINED);
        double[] retVal = new double[this.nCols];
        for (Node node : this.nodes) {
            if (node instanceof ChoiceNode) {
                ChoiceNode choice = (ChoiceNode) node;
                retVal[choice.getFeatureIdx()] += choice.getGain() * choice.getRecordCount() / this.inputRecordCount;
            }
        }
        return Nd4j.create(retVal);
    }

    /**
     * @return TRUE if this tree has been trained
     */
    public boolean isTrained() {
        return ! this.nodes.isEmpty();
    }

    /**
     * @return the number of nodes in the tree
     */
    public int size() {
        return this.nodes.size();
    }

    /**
     * @return the node at the specified index
     *
     * @param idx	index of the desired node (0 is the root)
     */
    public Node getNode(int idx) {
        return this.nodes.get(idx);
    }

    /**
     * @return the type of model
     */
    public TreeMode getMode() {
        return this.mode;
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
     * @return the distinct class labels in the training set (empty for regression)
     */
    public double[] getClasses() {
        return this.classes;
    }

    /**
     * @return the deepest level reached during training (the root is level 1)
     */
    public int getDepth() {
        return this.depth;
    }

    /**
     * @return the number of choice nodes
     */
    public int getSplitCount() {
        return this.splitCount;
    }

    /**
     * @return the indices of the training rows left out of the bootstrap sample (empty unless tracking is on)
     */
    public int[] getOutOfBagRows() {
        return this.outOfBag;
    }

    /**
     * @return the maximum depth of a choice node
     */
    public int getMaxDepth() {
        return this.maxDepth;
    }

    /**
     * @return the minimum number of rows required to split a node
     */
    public int getMinRows() {
        return this.minRows;
    }

    /**
     * @return the number of columns examined at each split (0 or less for all)
     */
    public int getRandomFeatures() {
        return this.randomFeatures;
    }

    /**
     * @return TRUE if this tree trains on a bootstrap sample
     */
    public boolean isBootstrap() {
        return this.bootstrap;
    }

}
