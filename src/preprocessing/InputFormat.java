package preprocessing;

import java.util.regex.Pattern;

/**
 * Input formats accepted on the command line, recognised by file name.
 */
public enum InputFormat {
    NEWICK,         // *.nwk
    NEXUS,          // *.nex.<run>.tre, as written by the concordance analysis
    STDIN_NEWICK;   // "-"

    private static final Pattern NEXUS_NAME = Pattern.compile("\\.nex\\.\\S+\\.tre$");

    /**
     * Returns the format for a command line argument, or null if the argument
     * does not name a tree input.
     */
    public static InputFormat detect(String argument) {
        if (argument == null) {
            return null;
        }
        if ("-".equals(argument)) {
            return STDIN_NEWICK;
        }
        if (argument.endsWith(".nwk")) {
            return NEWICK;
        }
        if (NEXUS_NAME.matcher(argument).find()) {
            return NEXUS;
        }
        return null;
    }
}
