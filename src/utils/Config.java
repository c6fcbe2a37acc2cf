package utils;

/**
 * Configuration class for the exhaustive subdivision analysis.
 * Holds the global settings that the command line can change.
 */
public class Config {

    /**
     * Clades supported by fewer majority-rule consensus trees than this
     * (the support value in the tree file) are not accepted as phylogenetic
     * species while a larger enclosing clade remains.
     */
    public static int MIN_SUPPORT = 1;

    /**
     * How the input trees are read
     */
    public enum ComputationMode {
        CPU_SINGLE,    // Read and parse inputs one after another
        CPU_PARALLEL   // Parse inputs on a fixed thread pool
    }

    public static ComputationMode COMPUTATION_MODE = ComputationMode.CPU_PARALLEL;

    /**
     * Progress messages and the retained clade table on standard error
     */
    public static boolean VERBOSE = false;

    public static int threadCount() {
        if (COMPUTATION_MODE == ComputationMode.CPU_SINGLE) {
            return 1;
        }
        return Runtime.getRuntime().availableProcessors();
    }
}
