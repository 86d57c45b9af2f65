/**
 *
 */
package org.theseed.forest.train;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.forest.BaseProcessor;
import org.theseed.forest.decision.PurityFunction;
import org.theseed.forest.decision.TreeMode;

/**
 * Tests for the command processors.
 *
 * @author Bruce Parrello
 *
 */
public class TestProcessors {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TestProcessors.class);

    @Test
    public void testClassTraining() throws IOException {
        File outFile = new File("src/test/data", "train.report.txt");
        String[] args = { "-c", "species", "--meta", "sample_id,growth", "-s", "12345", "--nEstimators", "25",
                "-o", outFile.getPath(), "src/test/data/samples.tbl" };
        TrainProcessor processor = new TrainProcessor();
        assertThat(processor.parseCommand(args), equalTo(true));
        assertThat(processor.getTreeMode(), equalTo(TreeMode.CLASSIFICATION));
        assertThat(processor.getPurity(), equalTo(PurityFunction.GINI));
        assertThat(processor.getParms().getNumTrees(), equalTo(25));
        assertThat(processor.getParms().isBootstrap(), equalTo(true));
        processor.run();
        log.info("Classification score is {}.", processor.getScore());
        assertThat(processor.getScore(), greaterThan(0.9));
        assertThat(processor.getModel().getTreeCount(), equalTo(25));
        List<Pair<String, Double>> impacts = processor.getImpacts();
        assertThat(impacts.size(), equalTo(4));
        assertThat(impacts.get(0).getLeft(), not(equalTo("noise")));
        for (int i = 1; i < impacts.size(); i++)
            assertThat(impacts.get(i).getRight(), lessThanOrEqualTo(impacts.get(i-1).getRight()));
        String report = new String(Files.readAllBytes(outFile.toPath()), StandardCharsets.UTF_8);
        assertThat(report, equalTo(processor.getReport()));
        assertThat(report, containsString("Testing set accuracy"));
        // The report includes the per-class evaluation.
        assertThat(report, containsString(processor.getEvaluationReport()));
        assertThat(report, containsString("Precision"));
        assertThat(report, containsString("sensitivity"));
        for (String species : new String[] { "alpha", "beta", "gamma" })
            assertThat(species, processor.getEvaluationReport(), containsString(species));
        Files.delete(outFile.toPath());
    }

    @Test
    public void testRegressionTraining() {
        String[] args = { "--col", "growth", "--meta", "sample_id,species", "--mode", "regress", "--seed", "54321",
                "--nEstimators", "20", "--ratio", "0.75", "--maxFeatures", "4", "src/test/data/samples.tbl" };
        TrainProcessor processor = new TrainProcessor();
        assertThat(processor.parseCommand(args), equalTo(true));
        assertThat(processor.getTreeMode(), equalTo(TreeMode.REGRESSION));
        assertThat(processor.getPurity(), equalTo(PurityFunction.STDEV));
        processor.run();
        log.info("Regression score is {}.", processor.getScore());
        assertThat(processor.getScore(), greaterThan(0.7));
        assertThat(processor.getReport(), containsString("Testing set r-squared"));
        assertThat(processor.getEvaluationReport(), containsString("growth"));
        assertThat(processor.getReport(), containsString(processor.getEvaluationReport()));
    }

    @Test
    public void testParmFileOptions() throws IOException {
        List<String> parms = new ArrayList<String>(BaseProcessor.readParmFile(new File("src/test/data", "train.prm")));
        parms.addAll(Arrays.asList("-s", "100", "--impact", "2", "src/test/data/samples.tbl"));
        TrainProcessor processor = new TrainProcessor();
        assertThat(processor.parseCommand(parms.toArray(new String[parms.size()])), equalTo(true));
        assertThat(processor.getParms().getNumTrees(), equalTo(11));
        assertThat(processor.getParms().isBootstrap(), equalTo(false));
        assertThat(processor.getData().getLabelNames(), contains("alpha", "beta", "gamma"));
    }

    @Test
    public void testBadParms() {
        String[][] badArgs = new String[][] {
            { "-c", "species", "--meta", "sample_id,growth", "--ratio", "1.5", "src/test/data/samples.tbl" },
            { "-c", "species", "--meta", "sample_id,growth", "--mode", "cluster", "src/test/data/samples.tbl" },
            { "-c", "species", "--meta", "sample_id,growth", "--nEstimators", "0", "src/test/data/samples.tbl" },
            { "-c", "species", "--meta", "sample_id,growth", "src/test/data/nosuchfile.tbl" },
            { "-c", "nosuchcolumn", "src/test/data/samples.tbl" },
            { "-c", "species", "--meta", "sample_id,growth", "--purity", "ENTROPY", "src/test/data/samples.tbl" },
            { "-c", "species" }
        };
        for (String[] args : badArgs) {
            TrainProcessor processor = new TrainProcessor();
            assertThat(String.join(" ", args), processor.parseCommand(args), equalTo(false));
        }
        CrossValidateProcessor xProcessor = new CrossValidateProcessor();
        String[] args = { "-c", "species", "--meta", "sample_id,growth", "-k", "1", "src/test/data/samples.tbl" };
        assertThat(xProcessor.parseCommand(args), equalTo(false));
    }

    @Test
    public void testCrossValidate() {
        String[] args = { "-c", "species", "--meta", "sample_id,growth", "-s", "777", "-k", "3", "--nEstimators", "15",
                "src/test/data/samples.tbl" };
        CrossValidateProcessor processor = new CrossValidateProcessor();
        assertThat(processor.parseCommand(args), equalTo(true));
        processor.run();
        assertThat(processor.getStats().getN(), equalTo(3L));
        assertThat(processor.getStats().getMean(), greaterThan(0.9));
        assertThat(processor.getStats().getMax(), lessThanOrEqualTo(1.0));
    }

}
