/**
 *
 */
package org.theseed.traits.ko;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * @author Bruce Parrello
 *
 */
public class KoMapTest {

    /** KO metadata test file */
    private static final File KO_FILE = new File("data", "ko_metadata.tab");

    @Test
    public void testPathwayLevels() throws IOException {
        Map<String, List<String>> level1 = KoPathwayMap.load(KO_FILE, 1);
        assertThat(level1.keySet(), contains("Metabolism", "Unclassified"));
        assertThat(level1.get("Metabolism"), contains("K00001", "K00001", "K00002", "K00003"));
        assertThat(level1.get("Unclassified"), contains("K00004"));
        Map<String, List<String>> level2 = KoPathwayMap.load(KO_FILE, 2);
        assertThat(level2.keySet(), contains("Metabolism;Amino Acid Metabolism", "Metabolism;Carbohydrate Metabolism",
                "Metabolism;Lipid Metabolism", "Unclassified"));
        assertThat(level2.get("Metabolism;Carbohydrate Metabolism"), contains("K00001", "K00002"));
        assertThat(level2.get("Metabolism;Lipid Metabolism"), contains("K00001"));
        // A pathway shorter than the level is used whole.
        assertThat(level2.get("Unclassified"), contains("K00004"));
        Map<String, List<String>> level3 = KoPathwayMap.load(KO_FILE, 3);
        assertThat(level3.keySet(), contains("Metabolism;Amino Acid Metabolism;Glycine, serine and threonine metabolism",
                "Metabolism;Carbohydrate Metabolism;Glycolysis", "Metabolism;Lipid Metabolism", "Unclassified"));
        assertThat(level3.get("Metabolism;Carbohydrate Metabolism;Glycolysis"), contains("K00001", "K00002"));
        assertThat(level3.get("Metabolism;Amino Acid Metabolism;Glycine, serine and threonine metabolism"),
                contains("K00003"));
        assertThat(level3.get("Metabolism;Lipid Metabolism"), contains("K00001"));
        assertThat(level3.get("Unclassified"), contains("K00004"));
    }

    @Test
    public void testBadLevel() {
        assertThrows(IllegalArgumentException.class, () -> KoPathwayMap.load(KO_FILE, 0));
        assertThrows(IllegalArgumentException.class, () -> KoPathwayMap.load(KO_FILE, 4));
    }

    @Test
    public void testLineages() throws IOException {
        Map<String, List<String>> lineages = LineageKoMap.load(new File("data", "lineage_kos.tab"));
        assertThat(lineages.size(), equalTo(4));
        assertThat(lineages.get("Bacteria;Proteobacteria"), contains("K00001", "K00002"));
        assertThat(lineages.get("Bacteria;Firmicutes"), empty());
        assertThat(lineages.get("Archaea"), contains("K00003"));
        // Empty items between separators are kept.
        assertThat(lineages.get("Bacteria;Actinobacteria"), contains("K00004", "", "K00005"));
    }

}
