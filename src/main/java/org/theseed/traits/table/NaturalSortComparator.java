/**
 *
 */
package org.theseed.traits.table;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * This is a comparator for trait names that sorts embedded numbers numerically.  Each name is broken
 * into alternating runs of digits and non-digits.  The runs are compared in order:  two digit runs
 * compare by numeric value, two non-digit runs compare lexicographically, and a digit run sorts
 * before a non-digit run.  If one name's runs are a prefix of the other's, the shorter name is less.
 *
 * Optionally, names beginning with "metadata" can be sent to the end of the ordering.  They are
 * still naturally sorted among themselves.
 *
 * @author Bruce Parrello
 *
 */
public class NaturalSortComparator implements Comparator<String> {

    // FIELDS
    /** TRUE if metadata names should sort last */
    private boolean metadataLast;
    /** prefix for metadata trait names */
    public static final String METADATA_PREFIX = "metadata";

    /**
     * Construct a natural-sort comparator.
     *
     * @param metadataLast	TRUE if names beginning with "metadata" should sort after all others
     */
    public NaturalSortComparator(boolean metadataLast) {
        this.metadataLast = metadataLast;
    }

    @Override
    public int compare(String o1, String o2) {
        int retVal = 0;
        if (this.metadataLast)
            retVal = Boolean.compare(o1.startsWith(METADATA_PREFIX), o2.startsWith(METADATA_PREFIX));
        if (retVal == 0) {
            List<String> tokens1 = tokenize(o1);
            List<String> tokens2 = tokenize(o2);
            final int n = Math.min(tokens1.size(), tokens2.size());
            for (int i = 0; i < n && retVal == 0; i++)
                retVal = compareTokens(tokens1.get(i), tokens2.get(i));
            if (retVal == 0)
                retVal = Integer.compare(tokens1.size(), tokens2.size());
        }
        return retVal;
    }

    /**
     * Split a name into alternating digit and non-digit runs.
     *
     * @param name		name to split
     *
     * @return a list of the runs, in order
     */
    public static List<String> tokenize(String name) {
        List<String> retVal = new ArrayList<String>();
        final int n = name.length();
        int start = 0;
        while (start < n) {
            boolean digits = isDigit(name.charAt(start));
            int end = start + 1;
            while (end < n && isDigit(name.charAt(end)) == digits)
                end++;
            retVal.add(name.substring(start, end));
            start = end;
        }
        return retVal;
    }

    /**
     * Compare two runs.
     *
     * @param t1	first run
     * @param t2	second run
     *
     * @return a negative number if the first run is less, positive if it is greater, and 0 if they are equal
     */
    private static int compareTokens(String t1, String t2) {
        int retVal;
        boolean num1 = isDigit(t1.charAt(0));
        boolean num2 = isDigit(t2.charAt(0));
        if (num1 && num2) {
            // Compare the numbers without converting them, so there is no limit on length.
            String v1 = StringUtils.stripStart(t1, "0");
            String v2 = StringUtils.stripStart(t2, "0");
            retVal = Integer.compare(v1.length(), v2.length());
            if (retVal == 0)
                retVal = v1.compareTo(v2);
        } else if (num1 || num2)
            retVal = (num1 ? -1 : 1);
        else
            retVal = t1.compareTo(t2);
        return retVal;
    }

    /**
     * @return TRUE if the character is an ASCII digit
     *
     * @param c		character to check
     */
    private static boolean isDigit(char c) {
        return (c >= '0' && c <= '9');
    }

}
