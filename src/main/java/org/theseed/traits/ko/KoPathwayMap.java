/**
 *
 */
package org.theseed.traits.ko;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class builds a map from pathway classifications to KO identifiers.  The input is a tab-delimited
 * KO metadata file with headers.  The first column is the KO ID and the last column is a list of
 * pathways separated by vertical bars.  Each pathway is a hierarchy of levels separated by semicolons.
 *
 * Level 1 is the top level, level 2 is an intermediate level (roughly corresponding to COGs), and
 * level 3 is the pathway level.  The map key is the pathway truncated to the requested level.  A pathway
 * with fewer levels than requested is used whole, so a top-level classification such as "Unclassified"
 * appears as a key at every level.
 *
 * @author Bruce Parrello
 *
 */
public class KoPathwayMap {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(KoPathwayMap.class);
    /** maximum pathway level */
    public static final int MAX_LEVEL = 3;

    /**
     * Build the pathway map for a KO metadata file.
     *
     * @param koFile	KO metadata file
     * @param level		pathway level to use (1 to 3)
     *
     * @return a sorted map from each pathway prefix to the KOs in it
     *
     * @throws IOException
     */
    public static Map<String, List<String>> load(File koFile, int level) throws IOException {
        if (level < 1 || level > MAX_LEVEL)
            throw new IllegalArgumentException("Level must be 1, 2, or 3.");
        Map<String, List<String>> retVal = new TreeMap<String, List<String>>();
        int koCount = 0;
        try (LineIterator lines = FileUtils.lineIterator(koFile, StandardCharsets.UTF_8.name())) {
            // Skip the header.
            if (lines.hasNext())
                lines.next();
            while (lines.hasNext()) {
                String line = StringUtils.stripEnd(lines.next(), null);
                if (! line.isEmpty()) {
                    koCount++;
                    String koName = StringUtils.substringBefore(line, "\t");
                    String pathways = StringUtils.substringAfterLast(line, "\t");
                    for (String pathway : StringUtils.splitPreserveAllTokens(pathways, '|')) {
                        String[] levels = StringUtils.splitPreserveAllTokens(pathway, ';');
                        if (levels.length < level)
                            log.debug("{} pathway \"{}\" has fewer than {} levels.", koName, pathway, level);
                        String key = StringUtils.join(Arrays.copyOf(levels, Math.min(level, levels.length)), ';');
                        retVal.computeIfAbsent(key, x -> new ArrayList<String>()).add(koName);
                    }
                }
            }
        }
        log.info("{} KOs read from {}, {} pathways found at level {}.", koCount, koFile, retVal.size(), level);
        return retVal;
    }

}
