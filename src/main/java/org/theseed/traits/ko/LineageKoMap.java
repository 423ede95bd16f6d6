/**
 *
 */
package org.theseed.traits.ko;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class builds a map from lineages to associated KO identifiers.  The input is a tab-delimited file with
 * headers and two columns:  the lineage and a semicolon-delimited list of KO IDs, which may be empty.  Empty
 * items inside a non-empty list are kept.
 *
 * @author Bruce Parrello
 *
 */
public class LineageKoMap {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(LineageKoMap.class);

    /**
     * Build the lineage map for a lineage KO file.
     *
     * @param lineageFile	lineage KO file
     *
     * @return a sorted map from each lineage to its KOs
     *
     * @throws IOException
     */
    public static Map<String, List<String>> load(File lineageFile) throws IOException {
        Map<String, List<String>> retVal = new TreeMap<String, List<String>>();
        try (LineIterator lines = FileUtils.lineIterator(lineageFile, StandardCharsets.UTF_8.name())) {
            // Skip the header.
            if (lines.hasNext())
                lines.next();
            while (lines.hasNext()) {
                String line = lines.next();
                if (! line.isBlank()) {
                    String lineage = StringUtils.substringBefore(line, "\t");
                    String kos = StringUtils.substringAfter(line, "\t").strip();
                    List<String> koList;
                    if (kos.isEmpty())
                        koList = Collections.emptyList();
                    else
                        koList = Arrays.asList(StringUtils.splitPreserveAllTokens(kos, ';'));
                    retVal.put(lineage, koList);
                }
            }
        }
        log.info("{} lineages read from {}.", retVal.size(), lineageFile);
        return retVal;
    }

}
