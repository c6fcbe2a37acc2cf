package preprocessing;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import tree.MalformedTreeException;

/**
 * Reads the first tree of a Newick or NEXUS input.
 *
 * Each input of the concordance analysis holds a single tree; any further
 * trees in the same input are ignored. The reader only extracts the Newick
 * text of the tree (and the NEXUS translation table); parsing into nodes is
 * done by {@link tree.Tree}.
 */
public class TreeFileReader {

    /**
     * Newick text of one tree plus the NEXUS leaf translation, if any.
     */
    public static class TreeText {
        public final String source;
        public final String newick;
        public final Map<String, String> translate;

        public TreeText(String source, String newick, Map<String, String> translate) {
            this.source = source;
            this.newick = newick;
            this.translate = translate;
        }
    }

    private final InputStream stdin;

    public TreeFileReader() {
        this(System.in);
    }

    public TreeFileReader(InputStream stdin) {
        this.stdin = stdin;
    }

    /**
     * Reads the tree named by a command line argument. Returns null when the
     * input contains no tree.
     */
    public TreeText read(String argument) throws IOException {
        InputFormat format = InputFormat.detect(argument);
        if (format == null) {
            throw new IllegalArgumentException("'" + argument + "' is not a tree input");
        }
        switch (format) {
            case STDIN_NEWICK:
                return readNewick("<stdin>", new InputStreamReader(stdin, StandardCharsets.UTF_8));
            case NEXUS:
                try (Reader reader = Files.newBufferedReader(Path.of(argument), StandardCharsets.UTF_8)) {
                    return readNexus(argument, reader);
                }
            case NEWICK:
            default:
                try (Reader reader = Files.newBufferedReader(Path.of(argument), StandardCharsets.UTF_8)) {
                    return readNewick(argument, reader);
                }
        }
    }

    /**
     * Returns the first ';'-terminated statement of a Newick input.
     */
    public static TreeText readNewick(String source, Reader reader) throws IOException {
        List<String> statements = splitStatements(readAll(reader));
        for (String statement : statements) {
            if (!statement.isBlank()) {
                return new TreeText(source, statement.trim() + ";", null);
            }
        }
        return null;
    }

    /**
     * Returns the first tree statement of the TREES block of a NEXUS input,
     * together with its translation table.
     */
    public static TreeText readNexus(String source, Reader reader) throws IOException {
        String content = readAll(reader);
        if (!content.stripLeading().toUpperCase(Locale.ROOT).startsWith("#NEXUS")) {
            throw new MalformedTreeException(source + " does not start with #NEXUS");
        }

        boolean inTrees = false;
        Map<String, String> translate = new HashMap<>();

        for (String raw : splitStatements(content.stripLeading().substring("#NEXUS".length()))) {
            String statement = stripComments(raw).trim();
            String lower = statement.toLowerCase(Locale.ROOT);
            if (lower.startsWith("begin")) {
                inTrees = lower.replaceAll("\\s+", " ").equals("begin trees");
            }
            else if (lower.equals("end") || lower.equals("endblock")) {
                inTrees = false;
            }
            else if (inTrees && lower.startsWith("translate")) {
                parseTranslate(statement.substring("translate".length()), translate);
            }
            else if (inTrees && (lower.startsWith("tree ") || lower.startsWith("utree "))) {
                int eq = raw.indexOf('=');
                if (eq < 0) {
                    throw new MalformedTreeException("Tree statement without '=' in " + source);
                }
                return new TreeText(source, raw.substring(eq + 1).trim() + ";",
                        translate.isEmpty() ? null : translate);
            }
        }
        return null;
    }

    private static void parseTranslate(String body, Map<String, String> translate) {
        for (String pair : body.split(",")) {
            String entry = pair.trim();
            if (entry.isEmpty()) {
                continue;
            }
            String[] parts = entry.split("\\s+", 2);
            if (parts.length != 2) {
                throw new MalformedTreeException("Invalid translate entry '" + entry + "'");
            }
            translate.put(parts[0], unquote(parts[1].trim()));
        }
    }

    private static String unquote(String label) {
        if (label.length() >= 2 && label.startsWith("'") && label.endsWith("'")) {
            return label.substring(1, label.length() - 1).replace("''", "'");
        }
        return label;
    }

    /**
     * Splits on ';' outside of quoted labels and bracketed comments.
     */
    static List<String> splitStatements(String content) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        int comment = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '\'' && comment == 0) {
                quoted = !quoted;
            } else if (!quoted && c == '[') {
                comment++;
            } else if (!quoted && c == ']' && comment > 0) {
                comment--;
            } else if (!quoted && comment == 0 && c == ';') {
                statements.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (!current.toString().isBlank()) {
            statements.add(current.toString());
        }
        return statements;
    }

    private static String stripComments(String statement) {
        return statement.replaceAll("\\[[^\\]]*\\]", "");
    }

    private static String readAll(Reader reader) throws IOException {
        StringBuilder sb = new StringBuilder();
        BufferedReader br = new BufferedReader(reader);
        String line;
        while ((line = br.readLine()) != null) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
