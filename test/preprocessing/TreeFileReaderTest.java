package preprocessing;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import junit.framework.TestCase;
import tree.MalformedTreeException;

public class TreeFileReaderTest extends TestCase {

    private static final String NEXUS =
        "#NEXUS\n"
        + "[written by the concordance analysis]\n"
        + "BEGIN TAXA;\n"
        + "    DIMENSIONS NTAX=3;\n"
        + "END;\n"
        + "Begin trees;\n"
        + "    Translate\n"
        + "        1 strain_A,\n"
        + "        2 'strain B',\n"
        + "        3 strain_C\n"
        + "        ;\n"
        + "tree con_50_majrule = [&U] ((1,2)4,3);\n"
        + "tree second = ((1,3)1,2);\n"
        + "End;\n";

    public void testDetectsFormatsByName() {
        assertEquals(InputFormat.NEWICK, InputFormat.detect("concordance.nwk"));
        assertEquals(InputFormat.NEXUS, InputFormat.detect("loci.nex.run1.tre"));
        assertEquals(InputFormat.STDIN_NEWICK, InputFormat.detect("-"));
        assertNull(InputFormat.detect("loci.nex"));
        assertNull(InputFormat.detect("-count"));
        assertNull(InputFormat.detect("tree.txt"));
    }

    public void testNewickUsesFirstTreeOnly() throws IOException {
        TreeFileReader.TreeText text = TreeFileReader.readNewick("in",
                new StringReader("((A,B)2,C);\n((A,C)1,B);\n"));

        assertEquals("((A,B)2,C);", text.newick);
        assertNull(text.translate);
    }

    public void testNewickMaySpanLines() throws IOException {
        TreeFileReader.TreeText text = TreeFileReader.readNewick("in",
                new StringReader("((A,B)2,\n C\n);"));
        assertEquals("((A,B)2,\n C\n);", text.newick);
    }

    public void testSemicolonInsideQuotesDoesNotEndTree() throws IOException {
        TreeFileReader.TreeText text = TreeFileReader.readNewick("in",
                new StringReader("(('a;b',C)1,D);"));
        assertEquals("(('a;b',C)1,D);", text.newick);
    }

    public void testEmptyNewickInputHasNoTree() throws IOException {
        assertNull(TreeFileReader.readNewick("in", new StringReader("\n  \n")));
    }

    public void testNexusTreeAndTranslateTable() throws IOException {
        TreeFileReader.TreeText text = TreeFileReader.readNexus("in", new StringReader(NEXUS));

        assertEquals("[&U] ((1,2)4,3);", text.newick);
        assertEquals("strain_A", text.translate.get("1"));
        assertEquals("strain B", text.translate.get("2"));
        assertEquals("strain_C", text.translate.get("3"));
    }

    public void testNexusWithoutTreesBlockHasNoTree() throws IOException {
        assertNull(TreeFileReader.readNexus("in", new StringReader("#NEXUS\nbegin taxa;\nend;\n")));
    }

    public void testNexusHeaderIsRequired() throws IOException {
        try {
            TreeFileReader.readNexus("in", new StringReader("((A,B)1,C);"));
            fail("expected MalformedTreeException");
        } catch (MalformedTreeException e) {
            // expected
        }
    }

    public void testReadsStandardInput() throws IOException {
        TreeFileReader reader = new TreeFileReader(
                new ByteArrayInputStream("(X,Y)5;\n".getBytes(StandardCharsets.UTF_8)));

        TreeFileReader.TreeText text = reader.read("-");

        assertEquals("<stdin>", text.source);
        assertEquals("(X,Y)5;", text.newick);
    }

    public void testReadsFilesByExtension() throws IOException {
        Path newick = Files.createTempFile("subdivision", ".nwk");
        Path nexus = Files.createTempFile("subdivision", ".nex.run1.tre");
        try {
            Files.write(newick, "((A,B)2,C);\n".getBytes(StandardCharsets.UTF_8));
            Files.write(nexus, NEXUS.getBytes(StandardCharsets.UTF_8));

            TreeFileReader reader = new TreeFileReader();
            assertEquals("((A,B)2,C);", reader.read(newick.toString()).newick);
            assertNotNull(reader.read(nexus.toString()).translate);
        } finally {
            Files.deleteIfExists(newick);
            Files.deleteIfExists(nexus);
        }
    }

    public void testRejectsArgumentsThatAreNotTreeInputs() throws IOException {
        try {
            new TreeFileReader().read("notes.txt");
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
