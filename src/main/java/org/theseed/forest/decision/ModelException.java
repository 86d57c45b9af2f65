/**
 *
 */
package org.theseed.forest.decision;

/**
 * This exception is thrown when a decision tree or random forest rejects its input or configuration, or
 * detects that its internal structure is damaged.  The type indicates which of these happened, so that a
 * caller can distinguish bad input it can fix from a fatal failure.
 *
 * @author Bruce Parrello
 *
 */
public class ModelException extends RuntimeException {

    /** serialization ID */
    private static final long serialVersionUID = -1398715437267263920L;

    /**
     * Enumerator for the failure types.
     */
    public static enum Type {
        /** target length differs from the row count, or the column count differs from the training data */
        SHAPE_MISMATCH("Inputs must be same length", false),
        /** no rows were supplied */
        EMPTY_INPUT("Input must not be empty", false),
        /** the model was used before it was trained */
        UNTRAINED("Model must be trained first", false),
        /** a classification-only method was called on a regression model */
        MODE_MISMATCH("Method only valid for classification", false),
        /** a hyperparameter or mode value is not acceptable */
        INVALID_CONFIGURATION("Invalid model configuration", false),
        /** a traversal exceeded its iteration limit, so the node list is damaged */
        LIMIT_EXCEEDED("Maximum iterations exceeded", true);

        /** standard message */
        private String description;
        /** TRUE if the condition indicates internal damage rather than bad input */
        private boolean fatal;

        private Type(String description, boolean fatal) {
            this.description = description;
            this.fatal = fatal;
        }

        /**
         * @return the standard message for this failure type
         */
        public String getDescription() {
            return this.description;
        }

        /**
         * @return TRUE if this failure indicates internal damage, FALSE if the input was rejected
         */
        public boolean isFatal() {
            return this.fatal;
        }

    }

    // FIELDS
    /** type of failure */
    private final Type type;

    /**
     * Construct a model exception with the standard message.
     *
     * @param type		type of failure
     */
    public ModelException(Type type) {
        super(type.getDescription());
        this.type = type;
    }

    /**
     * Construct a model exception with additional detail.
     *
     * @param type		type of failure
     * @param detail	explanation to append to the standard message
     */
    public ModelException(Type type, String detail) {
        super(type.getDescription() + ": " + detail);
        this.type = type;
    }

    /**
     * @return the type of failure
     */
    public Type getType() {
        return this.type;
    }

}
