/**
 *
 */
package org.theseed.traits.table;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * This object represents a single entry in a trait table.  The entry has a name and a map from trait
 * names to values.  Traits are added one at a time during parsing, and a trait can only be given a
 * value once.
 *
 * @author Bruce Parrello
 *
 */
public class TraitEntry {

    // FIELDS
    /** name of this entry */
    private String name;
    /** map of trait names to values, in the order added */
    private Map<String, TraitValue> traits;
    /** shared correlation engine */
    private static final TraitCorrelator CORRELATOR = new TraitCorrelator();

    /**
     * Construct a new, empty trait entry.
     *
     * @param name		name of the entry
     */
    public TraitEntry(String name) {
        this.name = name;
        this.traits = new LinkedHashMap<String, TraitValue>();
    }

    /**
     * Add a trait to this entry.  The raw value is stored as a number if it parses as one, and
     * as text otherwise.
     *
     * @param trait		name of the trait
     * @param rawValue	raw text of the trait value
     *
     * @throws DuplicateTraitException	if this entry already has a value for the trait
     */
    public void addTrait(String trait, String rawValue) {
        if (this.traits.containsKey(trait))
            throw new DuplicateTraitException(this.name, trait);
        this.traits.put(trait, TraitValue.parse(rawValue));
    }

    /**
     * @return the name of this entry
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the value of a trait, or NULL if this entry does not have it
     *
     * @param trait		name of the desired trait
     */
    public TraitValue getValue(String trait) {
        return this.traits.get(trait);
    }

    /**
     * @return TRUE if this entry has a value for the specified trait
     *
     * @param trait		name of the trait to check
     */
    public boolean hasTrait(String trait) {
        return this.traits.containsKey(trait);
    }

    /**
     * @return the names of the traits in this entry, in the order they were added
     */
    public Set<String> getTraitNames() {
        return Collections.unmodifiableSet(this.traits.keySet());
    }

    /**
     * @return the number of traits in this entry
     */
    public int size() {
        return this.traits.size();
    }

    /**
     * Compute the Spearman correlation between this entry and another over all of this entry's traits.
     *
     * Note that the candidate traits come from this entry only, never from the other entry.  Because a
     * trait is only used if both entries have it, the traits actually compared are the ones the two
     * entries share, taken in this entry's order.  Callers that need a fixed set of traits across many
     * comparisons should pass an explicit list, since each pair may share a different set.
     *
     * @param other		other entry to compare
     *
     * @return the correlation coefficient, or NaN if it is undefined
     *
     * @throws NoSharedTraitsException	if the two entries have no traits in common
     */
    public double correlation(TraitEntry other) {
        return this.correlation(other, this.traits.keySet());
    }

    /**
     * Compute the Spearman correlation between this entry and another over a list of candidate traits.
     * Traits missing from either entry are silently left out.
     *
     * @param other		other entry to compare
     * @param traits	names of the candidate traits
     *
     * @return the correlation coefficient, or NaN if it is undefined
     *
     * @throws NoSharedTraitsException	if none of the candidate traits is in both entries
     */
    public double correlation(TraitEntry other, Collection<String> traits) {
        return CORRELATOR.correlation(this, other, traits);
    }

    @Override
    public String toString() {
        return "TraitEntry " + this.name;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + ((this.name == null) ? 0 : this.name.hashCode());
        result = prime * result + this.traits.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        TraitEntry other = (TraitEntry) obj;
        if (this.name == null) {
            if (other.name != null)
                return false;
        } else if (! this.name.equals(other.name))
            return false;
        return this.traits.equals(other.traits);
    }

}
