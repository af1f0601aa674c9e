package de.uos.ikw.izpb.lexicon;

import de.uos.ikw.izpb.formats.WikiPage;
import de.uos.ikw.izpb.schemas.GenderLabel;
import de.uos.ikw.izpb.schemas.PrnEntry;
import de.uos.ikw.izpb.util.MissingInputException;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class PrnCompilerTest {

    @TempDir
    Path tempDir;

    private static Path sampleDump() throws URISyntaxException {
        return Paths.get(PrnCompilerTest.class.getResource("/lexicon/dewiktionary-sample.xml").toURI());
    }

    @Test
    void compilesGenderedFormsFromTheSampleDump() throws Exception {
        List<PrnEntry> entries = new PrnCompiler(CollisionPolicy.AMBIGUOUS).compile(sampleDump());

        assertThat(entries).extracting(PrnEntry::lemma, PrnEntry::gender).containsExactly(
                tuple("Azubi", GenderLabel.AMBIGUOUS),
                tuple("Azubis", GenderLabel.MALE),
                tuple("Lehrer", GenderLabel.MALE),
                tuple("Lehrerin", GenderLabel.FEMALE),
                tuple("Lehrerinnen", GenderLabel.FEMALE),
                tuple("Nonne", GenderLabel.FEMALE),
                tuple("Nonnen", GenderLabel.FEMALE));
    }

    @Test
    void joinsTheSourcesOfEveryContributingPage() throws Exception {
        List<PrnEntry> entries = new PrnCompiler(CollisionPolicy.AMBIGUOUS).compile(sampleDump());

        PrnEntry lehrer = entries.stream().filter(e -> e.lemma().equals("Lehrer")).findFirst().orElseThrow();
        assertThat(lehrer.sourceUrl()).isEqualTo(PrnCompiler.SOURCE_URL_PREFIX + "Lehrer; "
                + PrnCompiler.SOURCE_URL_PREFIX + "Lehrerin");
    }

    @Test
    void dropPolicyRemovesCollisions() throws Exception {
        List<PrnEntry> entries = new PrnCompiler(CollisionPolicy.DROP).compile(sampleDump());

        assertThat(entries).extracting(PrnEntry::lemma).doesNotContain("Azubi").contains("Azubis", "Lehrer");
        assertThat(entries).extracting(PrnEntry::gender).doesNotContain(GenderLabel.AMBIGUOUS);
    }

    @Test
    void resultDoesNotDependOnPageOrder() throws Exception {
        List<WikiPage> pages = new ArrayList<>();
        new WiktionaryDumpReader().read(sampleDump(), pages::add);

        PrnCompiler forward = new PrnCompiler(CollisionPolicy.AMBIGUOUS);
        pages.forEach(forward::accept);
        Collections.reverse(pages);
        PrnCompiler backward = new PrnCompiler(CollisionPolicy.AMBIGUOUS);
        pages.forEach(backward::accept);

        assertThat(backward.entries()).isEqualTo(forward.entries());
    }

    @Test
    void readsCompressedDumps() throws Exception {
        Path compressed = tempDir.resolve("dewiktionary-sample.xml.bz2");
        try (OutputStream out = new BZip2CompressorOutputStream(Files.newOutputStream(compressed))) {
            Files.copy(sampleDump(), out);
        }

        List<PrnEntry> plain = new PrnCompiler(CollisionPolicy.AMBIGUOUS).compile(sampleDump());
        List<PrnEntry> fromBz2 = new PrnCompiler(CollisionPolicy.AMBIGUOUS).compile(compressed);

        assertThat(fromBz2).isEqualTo(plain);
    }

    @Test
    void writtenListCanBeLoadedAgain() throws Exception {
        List<PrnEntry> entries = new PrnCompiler(CollisionPolicy.AMBIGUOUS).compile(sampleDump());
        Path output = tempDir.resolve("lists").resolve("prn_list.csv");

        PrnCompiler.write(output, entries);

        assertThat(Files.readAllLines(output).get(0)).isEqualTo("gender,lemma,source_url");
        assertThat(PrnTable.read(output)).isEqualTo(entries);
    }

    @Test
    void missingDumpIsReported() {
        Path missing = tempDir.resolve("missing.xml.bz2");

        assertThatThrownBy(() -> new PrnCompiler(CollisionPolicy.AMBIGUOUS).compile(missing))
                .isInstanceOf(MissingInputException.class)
                .hasMessageContaining("Wiktionary dump");
    }
}
