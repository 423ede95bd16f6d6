/**
 *
 */
package org.theseed.traits.table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;

/**
 * This object computes the Spearman rank correlation between two trait entries.  Only traits present
 * in both entries are used, and a trait is skipped if either value is a numeric NaN.  Tied values
 * receive the average of the ranks they would occupy, and text values are ranked by their natural
 * ordering just like numbers.
 *
 * The correlation is undefined if there are fewer than two shared traits or if either entry has
 * the same value for every shared trait.  In these cases the result is NaN.
 *
 * @author Bruce Parrello
 *
 */
public class TraitCorrelator {

    // FIELDS
    /** rank correlation engine */
    private SpearmansCorrelation engine;

    /**
     * Construct a new trait correlator.
     */
    public TraitCorrelator() {
        this.engine = new SpearmansCorrelation();
    }

    /**
     * Compute the correlation between two entries over a list of candidate traits.
     *
     * @param entry1	first entry
     * @param entry2	second entry
     * @param traits	candidate trait names; a trait missing from either entry is skipped
     *
     * @return the Spearman rank correlation coefficient, or NaN if it is undefined
     *
     * @throws NoSharedTraitsException	if none of the candidate traits has a usable value in both entries
     */
    public double correlation(TraitEntry entry1, TraitEntry entry2, Collection<String> traits) {
        List<TraitValue> values1 = new ArrayList<TraitValue>(traits.size());
        List<TraitValue> values2 = new ArrayList<TraitValue>(traits.size());
        for (String trait : traits) {
            TraitValue v1 = entry1.getValue(trait);
            TraitValue v2 = entry2.getValue(trait);
            if (v1 != null && v2 != null && ! isNaN(v1) && ! isNaN(v2)) {
                values1.add(v1);
                values2.add(v2);
            }
        }
        if (values1.isEmpty())
            throw new NoSharedTraitsException(entry1.getName(), entry2.getName());
        double retVal = Double.NaN;
        double[] x = ordinals(values1);
        double[] y = ordinals(values2);
        if (x.length >= 2 && ! isConstant(x) && ! isConstant(y))
            retVal = this.engine.correlation(x, y);
        return retVal;
    }

    /**
     * Convert a list of trait values to an array of ordinal numbers.  Each value is replaced by its
     * position in the sorted list of distinct values, so the ordinals rank the same way as the values.
     *
     * @param values	list of trait values to convert
     *
     * @return an array of ordinals parallel to the list
     */
    protected static double[] ordinals(List<TraitValue> values) {
        Map<TraitValue, Integer> positions = new TreeMap<TraitValue, Integer>();
        for (TraitValue value : values)
            positions.put(value, 0);
        int pos = 0;
        for (Map.Entry<TraitValue, Integer> posEntry : positions.entrySet())
            posEntry.setValue(pos++);
        double[] retVal = new double[values.size()];
        for (int i = 0; i < retVal.length; i++)
            retVal[i] = positions.get(values.get(i));
        return retVal;
    }

    /**
     * @return TRUE if the value is a numeric NaN, which has no rank
     *
     * @param value		value to check
     */
    private static boolean isNaN(TraitValue value) {
        return (value.isNumeric() && Double.isNaN(value.getNumber()));
    }

    /**
     * @return TRUE if all the values in the array are the same
     *
     * @param array		array to check
     */
    private static boolean isConstant(double[] array) {
        boolean retVal = true;
        for (int i = 1; retVal && i < array.length; i++)
            retVal = (array[i] == array[0]);
        return retVal;
    }

}
