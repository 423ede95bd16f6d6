/**
 *
 */
package org.theseed.traits.table;

import java.io.Closeable;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object manages a trait table.  A trait table is a tab-delimited file with headers.  The first
 * column contains entry names, and the remaining columns contain trait values.  The first header may
 * be prefixed with a comment marker ("#"), which is removed.
 *
 * The header is read once, when the table is constructed.  Each iteration through the table re-reads
 * the file from the beginning, so the table can be iterated any number of times and nothing is kept
 * in memory between passes.
 *
 * Blank lines are skipped.  A line with no tab, a line with more values than there are traits, or a
 * line that assigns the same trait twice (because the header repeats a name) is logged and skipped.
 * A line with fewer values than there are traits produces an entry with only the leading traits.
 *
 * Trailing whitespace is removed from each data line before it is split.  As a result, empty values at the
 * end of a line are dropped (the entry does not get those traits), and trailing spaces in the last value
 * are lost.  An entry with such values will not read back identically after it is written out.
 *
 * @author Bruce Parrello
 *
 */
public class TraitTable implements Iterable<TraitEntry> {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TraitTable.class);
    /** trait table file */
    private File tableFile;
    /** label for the entry name column */
    private String entryHeader;
    /** names of the traits, in column order */
    private List<String> traits;
    /** comment marker for the header line */
    public static final String COMMENT_MARKER = "#";

    /**
     * Construct a trait table from a file.  Only the header line is read.
     *
     * @param tableFile		trait table file to manage
     *
     * @throws IOException
     */
    public TraitTable(File tableFile) throws IOException {
        this.tableFile = tableFile;
        if (! tableFile.canRead())
            throw new FileNotFoundException("Trait table file " + tableFile + " is not found or unreadable.");
        try (LineIterator lines = FileUtils.lineIterator(tableFile, StandardCharsets.UTF_8.name())) {
            if (! lines.hasNext())
                throw new IOException("Trait table file " + tableFile + " has no header line.");
            String[] headers = StringUtils.splitPreserveAllTokens(StringUtils.stripEnd(lines.next(), null), '\t');
            if (headers.length == 0)
                headers = new String[] { "" };
            this.entryHeader = StringUtils.removeStart(headers[0], COMMENT_MARKER);
            this.traits = Collections.unmodifiableList(Arrays.asList(Arrays.copyOfRange(headers, 1, headers.length)));
        } catch (IllegalStateException e) {
            throw unwrap(e);
        }
        log.debug("Trait table {} has {} traits.", tableFile, this.traits.size());
    }

    /**
     * @return the trait table file
     */
    public File getFile() {
        return this.tableFile;
    }

    /**
     * @return the label of the entry name column
     */
    public String getEntryHeader() {
        return this.entryHeader;
    }

    /**
     * @return the trait names, in column order
     */
    public List<String> getTraits() {
        return this.traits;
    }

    @Override
    public Iterator<TraitEntry> iterator() {
        return new EntryIterator();
    }

    /**
     * @return a stream of the entries in this table; close the stream to release the file early
     */
    public Stream<TraitEntry> stream() {
        EntryIterator iter = new EntryIterator();
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iter, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(iter::close);
    }

    /**
     * @return the trait names in natural order, with metadata traits at the end
     */
    public List<String> getOrderedTraits() {
        return this.getOrderedTraits(true);
    }

    /**
     * @return the trait names in natural order
     *
     * @param metadataLast	TRUE if traits whose names begin with "metadata" should be placed at the end
     */
    public List<String> getOrderedTraits(boolean metadataLast) {
        List<String> retVal = new ArrayList<String>(this.traits);
        retVal.sort(new NaturalSortComparator(metadataLast));
        return retVal;
    }

    /**
     * Select or exclude a set of entries by name.
     *
     * @param names		names of the entries of interest
     * @param remove	if TRUE, the named entries are excluded; otherwise only the named entries are included
     *
     * @return an iterable for the selected entries
     */
    public Iterable<TraitEntry> getSubset(Collection<String> names, boolean remove) {
        return (remove ? this.getExclusion(names) : this.getSubset(names));
    }

    /**
     * Select the entries with the specified names.  The entries are returned in file order, and the scan
     * stops as soon as every name has been found.
     *
     * @param names		names of the entries to select
     *
     * @return an iterable for the selected entries
     */
    public Iterable<TraitEntry> getSubset(Collection<String> names) {
        final Set<String> targets = new HashSet<String>(names);
        return () -> new InclusionIterator(targets);
    }

    /**
     * Select the entries whose names are not in the specified collection.  The entire file is always
     * scanned.
     *
     * @param names		names of the entries to skip
     *
     * @return an iterable for the remaining entries
     */
    public Iterable<TraitEntry> getExclusion(Collection<String> names) {
        final Set<String> skips = new HashSet<String>(names);
        return () -> new ExclusionIterator(skips);
    }

    /**
     * Parse a data line into an entry.
     *
     * @param line		data line to parse, with trailing whitespace removed
     *
     * @return the entry for the line, or NULL if the line is not usable
     */
    protected TraitEntry parseLine(String line) {
        TraitEntry retVal = null;
        int tabIdx = line.indexOf('\t');
        if (tabIdx < 0)
            log.warn("Malformed line (no tab) in {}: \"{}\".", this.tableFile, line);
        else {
            String name = line.substring(0, tabIdx);
            String[] values = StringUtils.splitPreserveAllTokens(line.substring(tabIdx + 1), '\t');
            if (values.length > this.traits.size())
                log.warn("Line for {} in {} has {} values but there are only {} traits.", name, this.tableFile,
                        values.length, this.traits.size());
            else {
                TraitEntry entry = new TraitEntry(name);
                try {
                    for (int i = 0; i < values.length; i++)
                        entry.addTrait(this.traits.get(i), values[i]);
                    retVal = entry;
                } catch (DuplicateTraitException e) {
                    log.warn("Skipping line in {}: {}", this.tableFile, e.getMessage());
                }
            }
        }
        return retVal;
    }

    /**
     * Convert a line-iterator failure to an I/O exception.
     *
     * @param e		exception thrown by the line iterator
     *
     * @return the underlying I/O exception, if there is one
     */
    private static IOException unwrap(IllegalStateException e) {
        IOException retVal;
        if (e.getCause() instanceof IOException)
            retVal = (IOException) e.getCause();
        else
            retVal = new IOException(e.getMessage(), e);
        return retVal;
    }

    /**
     * This iterator reads the entries from the table file.  Each one has its own file reader, which
     * is closed when the end of the file is reached.
     */
    protected class EntryIterator implements Iterator<TraitEntry>, Closeable {

        /** underlying line iterator, or NULL if the file is closed */
        private LineIterator lines;
        /** next entry to return, or NULL if it has not been read */
        private TraitEntry nextEntry;
        /** number of data lines read */
        private int lineCount;
        /** number of entries produced */
        private int entryCount;

        /**
         * Open the file and skip the header.
         */
        public EntryIterator() {
            try {
                this.lines = FileUtils.lineIterator(TraitTable.this.tableFile, StandardCharsets.UTF_8.name());
                if (this.lines.hasNext())
                    this.lines.next();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            } catch (IllegalStateException e) {
                throw new UncheckedIOException(unwrap(e));
            }
            this.nextEntry = null;
            this.lineCount = 0;
            this.entryCount = 0;
        }

        @Override
        public boolean hasNext() {
            try {
                while (this.nextEntry == null && this.lines != null) {
                    if (! this.lines.hasNext()) {
                        log.debug("{} data lines read from {}, {} entries produced, {} skipped.", this.lineCount,
                                TraitTable.this.tableFile, this.entryCount, this.lineCount - this.entryCount);
                        this.close();
                    } else {
                        String line = StringUtils.stripEnd(this.lines.next(), null);
                        if (! line.isEmpty()) {
                            this.lineCount++;
                            this.nextEntry = TraitTable.this.parseLine(line);
                            if (this.nextEntry != null)
                                this.entryCount++;
                        }
                    }
                }
            } catch (IllegalStateException e) {
                this.close();
                throw new UncheckedIOException(unwrap(e));
            }
            return (this.nextEntry != null);
        }

        @Override
        public TraitEntry next() {
            if (! this.hasNext())
                throw new NoSuchElementException("Attempt to read past end of " + TraitTable.this.tableFile + ".");
            TraitEntry retVal = this.nextEntry;
            this.nextEntry = null;
            return retVal;
        }

        @Override
        public void close() {
            if (this.lines != null) {
                try {
                    this.lines.close();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                } finally {
                    this.lines = null;
                }
            }
        }

    }

    /**
     * This iterator returns only the entries with names in a target set.  It stops reading the file as soon as
     * every target name has been found.
     */
    protected class InclusionIterator implements Iterator<TraitEntry> {

        /** underlying entry iterator */
        private EntryIterator entries;
        /** names of the entries to return */
        private Set<String> targets;
        /** names not yet found */
        private Set<String> remaining;
        /** next entry to return, or NULL if it has not been found */
        private TraitEntry nextEntry;

        /**
         * Construct an iterator for the specified target names.
         *
         * @param targets	set of entry names to return
         */
        public InclusionIterator(Set<String> targets) {
            this.targets = targets;
            this.remaining = new HashSet<String>(targets);
            this.nextEntry = null;
            // With nothing to find, we never need to open the file.
            this.entries = (targets.isEmpty() ? null : new EntryIterator());
        }

        @Override
        public boolean hasNext() {
            while (this.nextEntry == null && this.entries != null) {
                if (this.remaining.isEmpty() || ! this.entries.hasNext()) {
                    if (! this.remaining.isEmpty())
                        log.debug("{} requested entries not found in {}.", this.remaining.size(), TraitTable.this.tableFile);
                    this.entries.close();
                    this.entries = null;
                } else {
                    TraitEntry entry = this.entries.next();
                    String name = entry.getName();
                    if (this.targets.contains(name)) {
                        this.remaining.remove(name);
                        this.nextEntry = entry;
                    }
                }
            }
            return (this.nextEntry != null);
        }

        @Override
        public TraitEntry next() {
            if (! this.hasNext())
                throw new NoSuchElementException("No more selected entries in " + TraitTable.this.tableFile + ".");
            TraitEntry retVal = this.nextEntry;
            this.nextEntry = null;
            return retVal;
        }

    }

    /**
     * This iterator returns every entry whose name is not in a skip set.  It always reads the whole file.
     */
    protected class ExclusionIterator implements Iterator<TraitEntry> {

        /** underlying entry iterator */
        private EntryIterator entries;
        /** names of the entries to skip */
        private Set<String> skips;
        /** next entry to return, or NULL if it has not been found */
        private TraitEntry nextEntry;

        /**
         * Construct an iterator that skips the specified names.
         *
         * @param skips		set of entry names to leave out
         */
        public ExclusionIterator(Set<String> skips) {
            this.skips = skips;
            this.entries = new EntryIterator();
            this.nextEntry = null;
        }

        @Override
        public boolean hasNext() {
            while (this.nextEntry == null && this.entries.hasNext()) {
                TraitEntry entry = this.entries.next();
                if (! this.skips.contains(entry.getName()))
                    this.nextEntry = entry;
            }
            return (this.nextEntry != null);
        }

        @Override
        public TraitEntry next() {
            if (! this.hasNext())
                throw new NoSuchElementException("No more remaining entries in " + TraitTable.this.tableFile + ".");
            TraitEntry retVal = this.nextEntry;
            this.nextEntry = null;
            return retVal;
        }

    }

}
