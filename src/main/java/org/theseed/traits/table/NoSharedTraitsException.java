/**
 *
 */
package org.theseed.traits.table;

/**
 * This exception is thrown when two entries are correlated but have no candidate traits in common.
 *
 * @author Bruce Parrello
 *
 */
public class NoSharedTraitsException extends IllegalArgumentException {

    /** serialization version ID */
    private static final long serialVersionUID = 6120573320498716650L;

    /**
     * Construct a no-shared-traits exception.
     *
     * @param entry1	name of the first entry
     * @param entry2	name of the second entry
     */
    public NoSharedTraitsException(String entry1, String entry2) {
        super("No traits were shared between entries " + entry1 + " and " + entry2 + ".");
    }

}
