/**
 *
 */
package org.theseed.traits.table;

/**
 * This exception is thrown when a trait is added to an entry that already has a value for it.
 *
 * @author Bruce Parrello
 *
 */
public class DuplicateTraitException extends IllegalArgumentException {

    /** serialization version ID */
    private static final long serialVersionUID = -2301877413927504164L;

    /**
     * Construct a duplicate-trait exception.
     *
     * @param entryName		name of the entry being updated
     * @param trait			name of the duplicate trait
     */
    public DuplicateTraitException(String entryName, String trait) {
        super("Entry " + entryName + " already has a trait called \"" + trait + "\".");
    }

}
