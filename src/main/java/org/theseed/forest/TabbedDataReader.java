/**
 *
 */
package org.theseed.forest;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.forest.features.Sample;

/**
 * This class loads a data set from a tab-delimited file with a header line.  One column contains the labels.
 * Metadata columns are ignored.  All the other columns are features, and must be numeric.
 *
 * If every label is numeric, the labels are used as-is.  Otherwise, the distinct label strings are sorted
 * and each is replaced by its position in the sorted list.
 *
 * @author Bruce Parrello
 *
 */
public class TabbedDataReader {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TabbedDataReader.class);
    /** name of the label column */
    private String labelName;
    /** names of the feature columns */
    private List<String> featureNames;
    /** label names, in code order (empty if the labels are numeric) */
    private List<String> labelNames;
    /** feature matrix */
    private double[][] features;
    /** label vector */
    private double[] labels;

    /**
     * Load a data set from a file.
     *
     * @param file		the file containing the data set
     * @param labelCol	the name or index (1-based) of the column containing the label
     * @param metaCols	a list of metadata column names; these columns are ignored
     *
     * @throws IOException
     */
    public TabbedDataReader(File file, String labelCol, Collection<String> metaCols) throws IOException {
        if (! file.canRead())
            throw new FileNotFoundException("Data file " + file + " is not found or unreadable.");
        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            this.load(reader, labelCol, metaCols);
        }
        log.info("{} rows with {} features read from {}.", this.labels.length, this.featureNames.size(), file);
    }

    /**
     * Load a data set from an input stream.
     *
     * @param stream	the stream containing the data set
     * @param labelCol	the name or index (1-based) of the column containing the label
     * @param metaCols	a list of metadata column names; these columns are ignored
     *
     * @throws IOException
     */
    public TabbedDataReader(InputStream stream, String labelCol, Collection<String> metaCols) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            this.load(reader, labelCol, metaCols);
        }
    }

    /**
     * Read the data set.
     *
     * @param reader	reader positioned at the header line
     * @param labelCol	the name or index (1-based) of the column containing the label
     * @param metaCols	a list of metadata column names
     *
     * @throws IOException
     */
    private void load(BufferedReader reader, String labelCol, Collection<String> metaCols) throws IOException {
        String header = reader.readLine();
        if (header == null)
            throw new IOException("Data file is empty.");
        String[] headers = StringUtils.splitPreserveAllTokens(header, '\t');
        int labelIdx = findColumn(headers, labelCol);
        this.labelName = headers[labelIdx];
        // Compute the feature columns.
        Set<String> metaSet = new HashSet<String>(metaCols);
        List<Integer> featureCols = new ArrayList<Integer>(headers.length);
        this.featureNames = new ArrayList<String>(headers.length);
        for (int i = 0; i < headers.length; i++) {
            if (i != labelIdx && ! metaSet.contains(headers[i])) {
                featureCols.add(i);
                this.featureNames.add(headers[i]);
            }
        }
        if (featureCols.isEmpty())
            throw new IOException("Data file has no feature columns.");
        // Read the data lines.
        List<double[]> rows = new ArrayList<double[]>();
        List<String> labelStrings = new ArrayList<String>();
        int lineNum = 1;
        for (String line = reader.readLine(); line != null; line = reader.readLine()) {
            lineNum++;
            if (StringUtils.isBlank(line))
                continue;
            String[] fields = StringUtils.splitPreserveAllTokens(line, '\t');
            if (fields.length != headers.length)
                throw new IOException("Line " + lineNum + " has " + fields.length + " columns, but " + headers.length
                        + " were expected.");
            double[] row = new double[featureCols.size()];
            for (int j = 0; j < row.length; j++) {
                String field = fields[featureCols.get(j)];
                try {
                    row[j] = Double.parseDouble(field);
                } catch (NumberFormatException e) {
                    throw new IOException("Invalid numeric value \"" + field + "\" in line " + lineNum + ".", e);
                }
            }
            rows.add(row);
            labelStrings.add(fields[labelIdx]);
        }
        if (rows.isEmpty())
            throw new IOException("Data file has no data rows.");
        this.features = rows.toArray(new double[rows.size()][]);
        this.labels = new double[labelStrings.size()];
        if (labelStrings.stream().allMatch(x -> isNumeric(x))) {
            this.labelNames = Collections.emptyList();
            for (int i = 0; i < this.labels.length; i++)
                this.labels[i] = Double.parseDouble(labelStrings.get(i));
        } else {
            this.labelNames = new ArrayList<String>(new TreeSet<String>(labelStrings));
            for (int i = 0; i < this.labels.length; i++)
                this.labels[i] = Collections.binarySearch(this.labelNames, labelStrings.get(i));
        }
    }

    /**
     * @return the index of the specified column
     *
     * @param headers	array of column headers
     * @param colSpec	column name or 1-based column index
     *
     * @throws IOException
     */
    public static int findColumn(String[] headers, String colSpec) throws IOException {
        int retVal = -1;
        for (int i = 0; i < headers.length && retVal < 0; i++) {
            if (headers[i].equals(colSpec))
                retVal = i;
        }
        if (retVal < 0 && StringUtils.isNumeric(colSpec)) {
            int idx = Integer.parseInt(colSpec);
            if (idx >= 1 && idx <= headers.length)
                retVal = idx - 1;
        }
        if (retVal < 0)
            throw new IOException("Column \"" + colSpec + "\" not found in data file.");
        return retVal;
    }

    /**
     * @return TRUE if the string is a valid floating-point number
     *
     * @param value		string to check
     */
    private static boolean isNumeric(String value) {
        boolean retVal = true;
        try {
            Double.parseDouble(value);
        } catch (NumberFormatException e) {
            retVal = false;
        }
        return retVal;
    }

    /**
     * @return the names of the feature columns
     */
    public List<String> getFeatureNames() {
        return this.featureNames;
    }

    /**
     * @return the name of the label column
     */
    public String getLabelName() {
        return this.labelName;
    }

    /**
     * @return the label names in code order, or an empty list if the labels are numeric
     */
    public List<String> getLabelNames() {
        return this.labelNames;
    }

    /**
     * @return the feature matrix
     */
    public double[][] getFeatures() {
        return this.features;
    }

    /**
     * @return the label vector
     */
    public double[] getLabels() {
        return this.labels;
    }

    /**
     * @return the number of data rows
     */
    public int size() {
        return this.labels.length;
    }

    /**
     * @return the data set as a sample
     */
    public Sample getSample() {
        return new Sample(this.features, this.labels);
    }

}
