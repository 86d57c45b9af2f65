/**
 *
 */
package org.theseed.forest;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.theseed.forest.features.Sample;

/**
 * Tests for the data file reader and the parameter file reader.
 *
 * @author Bruce Parrello
 *
 */
public class TestTabbedDataReader {

    /** sample data file */
    private static final File SAMPLE_FILE = new File("src/test/data", "samples.tbl");

    /**
     * @return an input stream for a string
     *
     * @param data	string to read
     */
    private static InputStream stream(String data) {
        return new ByteArrayInputStream(data.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testClassLabels() throws IOException {
        TabbedDataReader reader = new TabbedDataReader(SAMPLE_FILE, "species", Arrays.asList("sample_id", "growth"));
        assertThat(reader.size(), equalTo(90));
        assertThat(reader.getFeatureNames(), contains("length", "width", "height", "noise"));
        assertThat(reader.getLabelNames(), contains("alpha", "beta", "gamma"));
        double[][] features = reader.getFeatures();
        assertThat(features.length, equalTo(90));
        assertThat(features[0], equalTo(new double[] { 0.513, 4.706, 1.759, 6.480 }));
        assertThat(reader.getLabels()[0], equalTo(0.0));
        assertThat(reader.getLabels()[1], equalTo(1.0));
        assertThat(reader.getLabels()[2], equalTo(2.0));
        Sample sample = reader.getSample();
        assertThat(sample.size(), equalTo(90));
        // The label column can also be given by position.
        reader = new TabbedDataReader(SAMPLE_FILE, "7", Arrays.asList("sample_id", "growth"));
        assertThat(reader.getLabelNames(), contains("alpha", "beta", "gamma"));
        assertThat(reader.getLabelName(), equalTo("species"));
    }

    @Test
    public void testNumericLabels() throws IOException {
        TabbedDataReader reader = new TabbedDataReader(SAMPLE_FILE, "growth", Arrays.asList("sample_id", "species"));
        assertThat(reader.getLabelNames().isEmpty(), equalTo(true));
        assertThat(reader.getLabelName(), equalTo("growth"));
        assertThat(reader.getLabels()[0], closeTo(3.407, 1e-9));
        assertThat(reader.getFeatureNames().size(), equalTo(4));
        reader = new TabbedDataReader(stream("x\ty\tlabel\n1\t2\t3\n\n4\t5\t6\n"), "label", Collections.emptyList());
        assertThat(reader.size(), equalTo(2));
        assertThat(reader.getFeatures()[1], equalTo(new double[] { 4.0, 5.0 }));
        assertThat(reader.getLabels(), equalTo(new double[] { 3.0, 6.0 }));
    }

    @Test
    public void testErrors() {
        assertThrows(IOException.class, () -> new TabbedDataReader(SAMPLE_FILE, "missing", Collections.emptyList()));
        assertThrows(IOException.class, () -> new TabbedDataReader(new File("src/test/data", "nosuchfile.tbl"),
                "species", Collections.emptyList()));
        assertThrows(IOException.class, () -> new TabbedDataReader(stream("x\tlabel\nabc\t1\n"), "label",
                Collections.emptyList()));
        assertThrows(IOException.class, () -> new TabbedDataReader(stream("x\tlabel\n1\t2\t3\n"), "label",
                Collections.emptyList()));
        assertThrows(IOException.class, () -> new TabbedDataReader(stream("x\tlabel\n"), "label",
                Collections.emptyList()));
        assertThrows(IOException.class, () -> new TabbedDataReader(stream(""), "label", Collections.emptyList()));
        assertThrows(IOException.class, () -> new TabbedDataReader(stream("x\tlabel\n1\t2\n"), "label",
                Arrays.asList("x")));
    }

    @Test
    public void testParmFile() throws IOException {
        List<String> parms = BaseProcessor.readParmFile(new File("src/test/data", "train.prm"));
        assertThat(parms, contains("--col", "species", "--meta", "sample_id,growth", "--nEstimators", "11",
                "--noBootstrap"));
    }

}
