/**
 *
 */
package org.theseed.traits;

import org.theseed.traits.table.TraitEntry;
import org.theseed.traits.table.TraitTable;

/**
 * This command copies a trait table with the trait columns in natural order.  Numbers embedded in the trait
 * names are sorted numerically, and metadata traits are placed at the end unless "--inline" is specified.
 *
 * The positional parameter is the name of the trait table file.  The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file (if not STDOUT)
 *
 * --inline		if specified, metadata traits are sorted with the other traits
 *
 * @author Bruce Parrello
 *
 */
public class SortProcessor extends TableCopyProcessor {

    @Override
    protected void setCopyDefaults() {
    }

    @Override
    protected void validateCopyParms() {
    }

    @Override
    protected boolean isSorted() {
        return true;
    }

    @Override
    protected Iterable<TraitEntry> selectEntries(TraitTable table) {
        return table;
    }

}
