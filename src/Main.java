import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import core.ExhaustiveSubdivision;
import preprocessing.ConcordanceTrees;
import preprocessing.InputFormat;
import tree.CladeTable;
import tree.MalformedTreeException;
import utils.Config;

/**
 * Main entry point of the exhaustive subdivision analysis of GCPSR
 * (sensu Brankovics et al. 2017).
 *
 * Reads the concordance / non-discordance trees, delimits the phylogenetic
 * species and prints them as a Newick string annotated with clade support.
 */
public class Main {

    private static final Pattern COUNT = Pattern.compile("^-count=(\\d+)$");
    private static final Pattern HELP = Pattern.compile("^(-)?-h(elp)?$");

    /**
     * Command line settings, classified but not yet applied to {@link Config}.
     */
    static class Arguments {
        final List<String> treeInputs = new ArrayList<>();
        final List<String> notUsed = new ArrayList<>();
        Integer minSupport;
        String outputFilePath;
        String computationMode;
        boolean verbose;
        boolean help;
    }

    /**
     * Sorts the command line into tree inputs, options and incorrect arguments.
     */
    static Arguments parseArguments(String[] args) {
        Arguments parsed = new Arguments();
        for (int i = 0; i < args.length; i++) {
            Matcher count = COUNT.matcher(args[i]);
            if (count.matches()) {
                try {
                    parsed.minSupport = Integer.parseInt(count.group(1));
                } catch (NumberFormatException e) {
                    // too large for an int
                    parsed.notUsed.add(args[i]);
                }
            } else if (args[i].equals("-o") && i + 1 < args.length) {
                parsed.outputFilePath = args[i + 1];
                i++; // Skip next argument as it's the file path
            } else if (args[i].equals("-m") && i + 1 < args.length) {
                parsed.computationMode = args[i + 1];
                i++; // Skip next argument as it's the mode
            } else if (args[i].equals("-v")) {
                parsed.verbose = true;
            } else if (HELP.matcher(args[i]).matches()) {
                parsed.help = true;
            } else if (InputFormat.detect(args[i]) != null) {
                parsed.treeInputs.add(args[i]);
            } else {
                parsed.notUsed.add(args[i]);
            }
        }
        return parsed;
    }

    /**
     * Main method that handles command line arguments and orchestrates the analysis.
     */
    public static void main(String[] args) {

        Arguments arguments = parseArguments(args);
        List<String> treeInputs = arguments.treeInputs;
        String outputFilePath = arguments.outputFilePath;

        if (arguments.help) {
            System.out.print(usage());
            System.exit(0);
        }
        if (!arguments.notUsed.isEmpty()) {
            for (String arg : arguments.notUsed) {
                System.err.println("'" + arg + "' is an incorrect argument");
            }
            System.err.print(usage());
            System.exit(-1);
        }

        if (arguments.minSupport != null) {
            Config.MIN_SUPPORT = arguments.minSupport;
        }
        if (arguments.verbose) {
            Config.VERBOSE = true;
        }

        // Set computation mode if specified
        if (arguments.computationMode != null) {
            try {
                Config.COMPUTATION_MODE = Config.ComputationMode.valueOf(arguments.computationMode);
            } catch (IllegalArgumentException e) {
                System.err.println("Error: Invalid computation mode '" + arguments.computationMode + "'");
                System.err.println("Valid modes: CPU_SINGLE, CPU_PARALLEL");
                System.exit(-1);
            }
        }

        if (Config.VERBOSE) {
            System.err.println("Tree inputs: " + treeInputs);
            System.err.println("Minimum support: " + Config.MIN_SUPPORT);
            System.err.println("Computation mode: " + Config.COMPUTATION_MODE);
        }

        long startTime = System.nanoTime();

        try {
            ConcordanceTrees concordanceTrees = new ConcordanceTrees(treeInputs);
            concordanceTrees.readTrees();
            CladeTable cladeTable = concordanceTrees.collectClades();

            ExhaustiveSubdivision.Result result = new ExhaustiveSubdivision(Config.MIN_SUPPORT).run(cladeTable);

            if (outputFilePath == null) {
                System.out.println(result.newick);
            } else {
                try (BufferedWriter writer = Files.newBufferedWriter(Path.of(outputFilePath), StandardCharsets.UTF_8)) {
                    writer.write(result.newick + "\n");
                }
            }
        } catch (MalformedTreeException e) {
            System.err.println("Error: Malformed tree: " + e.getMessage());
            System.exit(-1);
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(-1);
        }

        if (Config.VERBOSE) {
            double duration = (System.nanoTime() - startTime) / 1_000_000_000.0;
            System.err.println("Time taken: " + duration + " seconds");
            if (outputFilePath != null) {
                System.err.println("Output written to: " + outputFilePath);
            }
        }
    }

    private static String usage() {
        return "Usage:\n\tjava Main [-h | --help] [-count=<int>] [-m <mode>] [-o <file>] [-v] tree...\n"
            + "Description:\n\tA tool to implement the exhaustive subdivision analysis of GCPSR sensu Brankovics et al. 2017\n"
            + "Input:\ttree\n"
            + "\tTree file produced by the concordance and non-discordance analysis of GCPSR sensu Brankovics et al. 2017.\n"
            + "\tTree file in either newick (*.nwk) or nexus (*.nex.<run>.tre) format with the number of single locus trees\n"
            + "\tsupporting a clade as support values.\n"
            + "\tThe input is read from standard input if '-' was specified as tree.\n"
            + "Options:\n"
            + "\t-h | --help\n\t\tPrint the help message; ignore other arguments.\n"
            + "\t-count=<int>\n\t\tAll clades that are supported by less than <int> majority-rule consensus trees\n"
            + "\t\t(support value in the tree file) will not be considered as phylogenetic species. (Default: 1)\n"
            + "\t-m <mode>\n\t\tComputation mode for reading the trees: CPU_SINGLE, CPU_PARALLEL (Default: CPU_PARALLEL)\n"
            + "\t-o <file>\n\t\tWrite the result to <file> instead of standard output.\n"
            + "\t-v\n\t\tVerbose progress output on standard error.\n"
            + "\n";
    }
}
