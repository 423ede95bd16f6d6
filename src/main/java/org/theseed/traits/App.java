package org.theseed.traits;

import java.util.Arrays;

import org.theseed.traits.utils.BaseProcessor;

/**
 * Commands for Trait Table Utilities
 *
 * correlate	compute Spearman correlations between entries of a trait table
 * subset		copy selected entries of a trait table (or all but the selected ones)
 * sort			copy a trait table with its trait columns in natural order
 * pathways		summarize KO groupings from a KO metadata or lineage file
 *
 */
public class App
{
    public static void main( String[] args )
    {
        if (args.length < 1) {
            System.err.println("No command specified.  Use one of: correlate, subset, sort, pathways.");
            System.exit(1);
        }
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Determine the command to process.
        switch (command) {
        case "correlate" :
            processor = new CorrelateProcessor();
            break;
        case "subset" :
            processor = new SubsetProcessor();
            break;
        case "sort" :
            processor = new SortProcessor();
            break;
        case "pathways" :
            processor = new PathwayProcessor();
            break;
        default:
            throw new RuntimeException("Invalid command " + command);
        }
        // Process it.
        boolean ok = processor.parseCommand(newArgs);
        if (ok) {
            processor.run();
            if (! processor.isSuccessful())
                System.exit(1);
        }
    }
}
