/**
 *
 */
package org.theseed.traits;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.theseed.traits.table.TraitEntry;
import org.theseed.traits.table.TraitTable;
import org.theseed.traits.utils.ParseFailureException;

/**
 * This command copies selected entries from a trait table.  The entry names are taken from the first column
 * of a name file (one name per line, no headers).  Normally only the named entries are copied; with
 * "--remove", every entry except the named ones is copied.
 *
 * The positional parameters are the name of the trait table file and the name of the name file.  The
 * command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file (if not STDOUT)
 *
 * --remove		if specified, the named entries are removed instead of kept
 * --sort		if specified, the trait columns are written in natural order
 * --inline		if specified, metadata traits are sorted with the other traits
 *
 * @author Bruce Parrello
 *
 */
public class SubsetProcessor extends TableCopyProcessor {

    // FIELDS
    /** set of entry names */
    private Set<String> names;

    // COMMAND-LINE OPTIONS

    /** if specified, the named entries are excluded */
    @Option(name = "--remove", aliases = { "-x" }, usage = "if specified, the named entries are excluded instead of selected")
    private boolean removeFlag;

    /** if specified, the trait columns are sorted */
    @Option(name = "--sort", usage = "if specified, trait columns are written in natural order")
    private boolean sortFlag;

    /** file of entry names */
    @Argument(index = 1, metaVar = "names.txt", usage = "file of entry names to select", required = true)
    private File nameFile;

    @Override
    protected void setCopyDefaults() {
        this.removeFlag = false;
        this.sortFlag = false;
    }

    @Override
    protected void validateCopyParms() throws IOException, ParseFailureException {
        if (! this.nameFile.canRead())
            throw new FileNotFoundException("Name file " + this.nameFile + " is not found or unreadable.");
        this.names = new LinkedHashSet<String>();
        for (String line : FileUtils.readLines(this.nameFile, StandardCharsets.UTF_8)) {
            String name = StringUtils.substringBefore(line, "\t").strip();
            if (! name.isEmpty())
                this.names.add(name);
        }
        log.info("{} entry names read from {}. Named entries will be {}.", this.names.size(), this.nameFile,
                (this.removeFlag ? "removed" : "kept"));
    }

    @Override
    protected boolean isSorted() {
        return this.sortFlag;
    }

    @Override
    protected Iterable<TraitEntry> selectEntries(TraitTable table) {
        return table.getSubset(this.names, this.removeFlag);
    }

}
