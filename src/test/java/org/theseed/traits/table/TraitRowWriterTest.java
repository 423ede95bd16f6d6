/**
 *
 */
package org.theseed.traits.table;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * @author Bruce Parrello
 *
 */
public class TraitRowWriterTest {

    @Test
    public void testFormatting() {
        TraitEntry entry = new TraitEntry("otu1");
        entry.addTrait("t1", "2");
        entry.addTrait("t2", "red");
        StringWriter buffer = new StringWriter();
        try (TraitRowWriter writer = new TraitRowWriter(buffer)) {
            String row = writer.formatRow(entry, Arrays.asList("t2", "t1"));
            assertThat(row, equalTo("otu1\tred\t2.0"));
            assertThat(writer.getRowCount(), equalTo(0));
            row = writer.write(entry, Arrays.asList("t1", "t3", "t2"));
            assertThat(row, equalTo("otu1\t2.0\tNA\tred"));
            assertThat(writer.getRowCount(), equalTo(1));
            assertThat(writer.getMissingCount(), equalTo(1));
            row = writer.write(entry, Collections.emptyList());
            assertThat(row, equalTo("otu1"));
        }
        String[] lines = buffer.toString().split("\\R");
        assertThat(lines, arrayContaining("otu1\t2.0\tNA\tred", "otu1"));
    }

    @Test
    public void testRoundTrip(@TempDir File tempDir) throws IOException {
        TraitTable table = new TraitTable(new File("data", "traits.tab"));
        List<String> order = table.getOrderedTraits();
        // Add a trait none of the entries have.
        List<String> outOrder = new ArrayList<String>(order);
        outOrder.add(1, "trait3");
        File outFile = new File(tempDir, "copy.tab");
        try (TraitRowWriter writer = new TraitRowWriter(outFile)) {
            writer.writeHeader(table.getEntryHeader(), outOrder);
            for (TraitEntry entry : table)
                writer.write(entry, outOrder);
            assertThat(writer.getRowCount(), equalTo(4));
            assertThat(writer.getMissingCount(), equalTo(4));
        }
        TraitTable copy = new TraitTable(outFile);
        assertThat(copy.getEntryHeader(), equalTo("OTU_IDs"));
        assertThat(copy.getTraits(), equalTo(outOrder));
        Iterator<TraitEntry> copyIter = copy.iterator();
        for (TraitEntry original : table) {
            TraitEntry copied = copyIter.next();
            assertThat(copied.getName(), equalTo(original.getName()));
            for (String trait : order)
                assertThat(copied.getValue(trait), equalTo(original.getValue(trait)));
            // The missing trait reads back as the placeholder text.
            assertThat(copied.getValue("trait3"), equalTo((TraitValue) new TraitValue.Text(TraitRowWriter.MISSING)));
        }
        assertThat(copyIter.hasNext(), equalTo(false));
    }

    @Test
    public void testTrailingWhitespace(@TempDir File tempDir) throws IOException {
        TraitEntry blank = new TraitEntry("e1");
        blank.addTrait("t1", "1");
        blank.addTrait("t2", "");
        TraitEntry padded = new TraitEntry("e2");
        padded.addTrait("t1", "left  ");
        padded.addTrait("t2", "red  ");
        List<String> order = Arrays.asList("t1", "t2");
        File outFile = new File(tempDir, "trailing.tab");
        try (TraitRowWriter writer = new TraitRowWriter(outFile)) {
            writer.writeHeader("id", order);
            assertThat(writer.write(blank, order), equalTo("e1\t1.0\t"));
            assertThat(writer.write(padded, order), equalTo("e2\tleft  \tred  "));
        }
        Iterator<TraitEntry> iter = new TraitTable(outFile).iterator();
        // A trailing empty value is lost when the row is read back.
        TraitEntry copied = iter.next();
        assertThat(copied.getName(), equalTo("e1"));
        assertThat(copied.getValue("t1"), equalTo((TraitValue) new TraitValue.Numeric(1.0)));
        assertThat(copied.getValue("t2"), nullValue());
        // Trailing spaces survive only on interior values.
        copied = iter.next();
        assertThat(copied.getValue("t1").render(), equalTo("left  "));
        assertThat(copied.getValue("t2").render(), equalTo("red"));
        assertThat(iter.hasNext(), equalTo(false));
    }

}
