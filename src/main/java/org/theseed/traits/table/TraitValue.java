/**
 *
 */
package org.theseed.traits.table;

import java.util.regex.Pattern;

/**
 * This object represents a single trait value in a trait table.  A value is either numeric, if its
 * text parses as a floating-point number, or textual.  The values have a total ordering so that
 * they can be ranked:  numbers compare numerically (with positive and negative zero equal), strings
 * compare lexicographically, and all numbers sort before all strings.
 *
 * @author Bruce Parrello
 *
 */
public abstract class TraitValue implements Comparable<TraitValue> {

    /** pattern for a decimal floating-point literal */
    private static final Pattern NUMBER_PATTERN = Pattern.compile("[-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?");
    /** pattern for the special floating-point words */
    private static final Pattern SPECIAL_PATTERN = Pattern.compile("(?i)([-+]?)(nan|inf|infinity)");

    /**
     * @return a trait value for the specified raw text
     *
     * @param raw		raw text from the trait table
     */
    public static TraitValue parse(String raw) {
        TraitValue retVal;
        String trimmed = raw.strip();
        if (NUMBER_PATTERN.matcher(trimmed).matches())
            retVal = new Numeric(Double.parseDouble(trimmed));
        else {
            var m = SPECIAL_PATTERN.matcher(trimmed);
            if (! m.matches())
                retVal = new Text(raw);
            else if (m.group(2).equalsIgnoreCase("nan"))
                retVal = new Numeric(Double.NaN);
            else if (m.group(1).equals("-"))
                retVal = new Numeric(Double.NEGATIVE_INFINITY);
            else
                retVal = new Numeric(Double.POSITIVE_INFINITY);
        }
        return retVal;
    }

    /**
     * @return TRUE if this value is numeric
     */
    public abstract boolean isNumeric();

    /**
     * @return the numeric value (NaN for text values)
     */
    public abstract double getNumber();

    /**
     * @return the value as it should appear in a trait table
     */
    public abstract String render();

    /**
     * @return the sort class of this value (numbers before text)
     */
    protected abstract int sortClass();

    /**
     * Compare two values of the same sort class.
     *
     * @param other		other value to compare
     *
     * @return a negative number if this value is less, positive if it is greater, and 0 if they are equal
     */
    protected abstract int compareSame(TraitValue other);

    @Override
    public int compareTo(TraitValue o) {
        int retVal = Integer.compare(this.sortClass(), o.sortClass());
        if (retVal == 0)
            retVal = this.compareSame(o);
        return retVal;
    }

    @Override
    public boolean equals(Object obj) {
        boolean retVal;
        if (this == obj)
            retVal = true;
        else if (! (obj instanceof TraitValue))
            retVal = false;
        else
            retVal = (this.compareTo((TraitValue) obj) == 0);
        return retVal;
    }

    @Override
    public String toString() {
        return this.render();
    }

    /**
     * This is a numeric trait value.
     */
    public static class Numeric extends TraitValue {

        /** value of the trait */
        private double value;

        /**
         * Construct a numeric trait value.
         *
         * @param value		number to store
         */
        public Numeric(double value) {
            this.value = value;
        }

        @Override
        public boolean isNumeric() {
            return true;
        }

        @Override
        public double getNumber() {
            return this.value;
        }

        @Override
        public String render() {
            return Double.toString(this.value);
        }

        @Override
        protected int sortClass() {
            return 0;
        }

        @Override
        protected int compareSame(TraitValue other) {
            double otherValue = ((Numeric) other).value;
            // Positive and negative zero are the same value.
            return (this.value == otherValue ? 0 : Double.compare(this.value, otherValue));
        }

        @Override
        public int hashCode() {
            return Double.hashCode(this.value + 0.0);
        }

    }

    /**
     * This is a text trait value.  The original text is kept verbatim.
     */
    public static class Text extends TraitValue {

        /** text of the trait */
        private String value;

        /**
         * Construct a text trait value.
         *
         * @param value		string to store
         */
        public Text(String value) {
            this.value = value;
        }

        @Override
        public boolean isNumeric() {
            return false;
        }

        @Override
        public double getNumber() {
            return Double.NaN;
        }

        @Override
        public String render() {
            return this.value;
        }

        @Override
        protected int sortClass() {
            return 1;
        }

        @Override
        protected int compareSame(TraitValue other) {
            return this.value.compareTo(((Text) other).value);
        }

        @Override
        public int hashCode() {
            return this.value.hashCode();
        }

    }

}
