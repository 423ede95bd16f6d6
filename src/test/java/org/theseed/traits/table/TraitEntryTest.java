/**
 *
 */
package org.theseed.traits.table;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * @author Bruce Parrello
 *
 */
public class TraitEntryTest {

    /**
     * @return an entry with the specified traits and values
     *
     * @param name		entry name
     * @param traits	array of alternating trait names and raw values
     */
    private static TraitEntry build(String name, String... traits) {
        TraitEntry retVal = new TraitEntry(name);
        for (int i = 0; i < traits.length; i += 2)
            retVal.addTrait(traits[i], traits[i+1]);
        return retVal;
    }

    @Test
    public void testTraits() {
        TraitEntry entry = build("e1", "t1", "1.5", "t2", "abc", "t3", "NA");
        assertThat(entry.getName(), equalTo("e1"));
        assertThat(entry.size(), equalTo(3));
        assertThat(entry.getTraitNames(), contains("t1", "t2", "t3"));
        assertThat(entry.getValue("t1").getNumber(), equalTo(1.5));
        assertThat(entry.getValue("t2").isNumeric(), equalTo(false));
        assertThat(entry.getValue("t3").render(), equalTo("NA"));
        assertThat(entry.getValue("t4"), nullValue());
        assertThat(entry.hasTrait("t2"), equalTo(true));
        assertThat(entry.hasTrait("t4"), equalTo(false));
        assertThat(entry.toString(), equalTo("TraitEntry e1"));
    }

    @Test
    public void testDuplicates() {
        TraitEntry entry = build("e1", "t1", "1.0");
        assertThrows(DuplicateTraitException.class, () -> entry.addTrait("t1", "1.0"));
        assertThrows(DuplicateTraitException.class, () -> entry.addTrait("t1", "2.0"));
        // A duplicate is a bad argument, not a bad reader state.
        assertThat(new DuplicateTraitException("e1", "t1"), instanceOf(IllegalArgumentException.class));
        assertThat(new DuplicateTraitException("e1", "t1"), not(instanceOf(IllegalStateException.class)));
        assertThat(entry.getValue("t1").getNumber(), equalTo(1.0));
        assertThat(entry.size(), equalTo(1));
    }

    @Test
    public void testPerfectCorrelation() {
        TraitEntry a = build("a", "t1", "1", "t2", "2", "t3", "3", "t4", "4");
        TraitEntry b = build("b", "t1", "10", "t2", "20", "t3", "30", "t4", "400");
        TraitEntry c = build("c", "t1", "9", "t2", "7", "t3", "5", "t4", "-1");
        assertThat(a.correlation(b), closeTo(1.0, 1e-10));
        assertThat(a.correlation(c), closeTo(-1.0, 1e-10));
        assertThat(c.correlation(b), closeTo(-1.0, 1e-10));
    }

    @Test
    public void testTies() {
        TraitEntry a = build("a", "t1", "1", "t2", "2", "t3", "2", "t4", "3");
        TraitEntry b = build("b", "t1", "1", "t2", "2", "t3", "3", "t4", "4");
        assertThat(a.correlation(b), closeTo(0.948683, 1e-6));
        assertThat(b.correlation(a), closeTo(0.948683, 1e-6));
        // Negative zero ties with zero.
        TraitEntry c = build("c", "t1", "-0", "t2", "0", "t3", "1");
        TraitEntry d = build("d", "t1", "5", "t2", "4", "t3", "6");
        assertThat(c.correlation(d), closeTo(0.866025, 1e-6));
        assertThat(d.correlation(c), closeTo(0.866025, 1e-6));
    }

    @Test
    public void testNaNValues() {
        TraitEntry a = build("a", "t1", "nan", "t2", "1", "t3", "2", "t4", "3");
        TraitEntry b = build("b", "t1", "0", "t2", "1", "t3", "2", "t4", "3");
        assertThat(a.correlation(b), closeTo(1.0, 1e-10));
        assertThat(b.correlation(a), closeTo(1.0, 1e-10));
        TraitEntry c = build("c", "t1", "1", "t2", "NaN", "t3", "3", "t4", "2");
        assertThat(b.correlation(c), closeTo(0.5, 1e-10));
        // If NaN is all that is left, nothing is shared.
        TraitEntry d = build("d", "t1", "5", "t9", "6");
        assertThrows(NoSharedTraitsException.class, () -> a.correlation(d));
        assertThrows(NoSharedTraitsException.class, () -> d.correlation(a));
    }

    @Test
    public void testTextRanking() {
        TraitEntry a = build("a", "t1", "apple", "t2", "banana", "t3", "cherry");
        TraitEntry b = build("b", "t1", "1", "t2", "2", "t3", "3");
        assertThat(a.correlation(b), closeTo(1.0, 1e-10));
        // Numbers always rank below text.
        TraitEntry c = build("c", "t1", "5", "t2", "x", "t3", "1");
        assertThat(c.correlation(b), closeTo(-0.5, 1e-10));
    }

    @Test
    public void testSymmetry() {
        TraitEntry a = build("a", "t1", "3.1", "t2", "0.4", "t3", "2.2", "t4", "9", "t5", "1");
        TraitEntry b = build("b", "t1", "1", "t2", "2", "t3", "5", "t4", "3", "t5", "4", "t6", "0");
        List<String> traits = Arrays.asList("t1", "t2", "t3", "t4", "t5");
        double ab = a.correlation(b, traits);
        double ba = b.correlation(a, traits);
        assertThat(ab, closeTo(ba, 1e-12));
        assertThat(ab, closeTo(-0.1, 1e-10));
        // The default uses the invoking entry's traits, but only shared traits are ever compared.
        assertThat(a.correlation(b), closeTo(ab, 1e-12));
        assertThat(b.correlation(a), closeTo(ab, 1e-12));
    }

    @Test
    public void testPartialTraits() {
        TraitEntry a = build("a", "t1", "1", "t2", "2", "t3", "3");
        TraitEntry b = build("b", "t1", "1", "t3", "2", "t4", "9");
        // Only t1 and t3 are shared; the explicit list may name traits neither entry has.
        assertThat(a.correlation(b, Arrays.asList("t1", "t2", "t3", "t9")), closeTo(1.0, 1e-10));
        assertThat(Double.isNaN(a.correlation(b, Arrays.asList("t1", "t2"))), equalTo(true));
    }

    @Test
    public void testNoSharedTraits() {
        TraitEntry a = build("a", "t1", "1", "t2", "2");
        TraitEntry b = build("b", "t3", "1", "t4", "2");
        assertThrows(NoSharedTraitsException.class, () -> a.correlation(b));
        assertThrows(NoSharedTraitsException.class, () -> b.correlation(a));
        TraitEntry c = build("c", "t1", "5", "t2", "6");
        assertThrows(NoSharedTraitsException.class, () -> a.correlation(c, Arrays.asList("t3")));
    }

    @Test
    public void testDegenerate() {
        TraitEntry a = build("a", "t1", "1", "t2", "2", "t3", "3");
        TraitEntry flat = build("flat", "t1", "4", "t2", "4", "t3", "4");
        assertThat(Double.isNaN(a.correlation(flat)), equalTo(true));
    }

}
