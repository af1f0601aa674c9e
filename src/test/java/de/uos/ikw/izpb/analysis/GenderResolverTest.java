package de.uos.ikw.izpb.analysis;

import de.uos.ikw.izpb.lexicon.PrnTable;
import de.uos.ikw.izpb.lookup.FixtureGenderLookup;
import de.uos.ikw.izpb.lookup.GenderLookup;
import de.uos.ikw.izpb.lookup.LookupException;
import de.uos.ikw.izpb.schemas.GenderLabel;
import de.uos.ikw.izpb.schemas.Mention;
import de.uos.ikw.izpb.schemas.MentionKind;
import de.uos.ikw.izpb.schemas.PrnEntry;
import de.uos.ikw.izpb.schemas.Resolution;
import de.uos.ikw.izpb.schemas.ResolutionSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenderResolverTest {

    private static final PrnTable PRN_TABLE = new PrnTable(List.of(
            new PrnEntry("Lehrerin", GenderLabel.FEMALE, "https://de.wiktionary.org/w/index.php?title=Lehrerin"),
            new PrnEntry("Schüler", GenderLabel.AMBIGUOUS, "manual")));

    @Mock
    private GenderLookup unreachable;

    private static Mention mention(MentionKind kind, String lemma) {
        return new Mention("art-1", 1, 0, lemma.length(), lemma, lemma, kind);
    }

    private static GenderResolver resolver(GenderLookup lookup) {
        return new GenderResolver(PRN_TABLE, new PoolResolution(lookup, 2, Duration.ofSeconds(5)));
    }

    @Test
    void resolvesNounsFromTheListAndNamesFromTheLookup() {
        Mention lehrerin = mention(MentionKind.PRN, "Lehrerin");
        Mention pupil = mention(MentionKind.PRN, "Schüler");
        Mention maria = mention(MentionKind.PER, "Maria Schmidt");
        Mention unknown = mention(MentionKind.PER, "Erika Mustermann");

        resolver(new FixtureGenderLookup(Map.of("Maria Schmidt", GenderLabel.FEMALE)))
                .resolve(List.of(lehrerin, pupil, maria, unknown));

        assertThat(lehrerin.resolution()).isEqualTo(new Resolution(GenderLabel.FEMALE, ResolutionSource.PRN_LIST, 1.0,
                "https://de.wiktionary.org/w/index.php?title=Lehrerin"));
        assertThat(pupil.gender()).isEqualTo(GenderLabel.AMBIGUOUS);
        assertThat(maria.gender()).isEqualTo(GenderLabel.FEMALE);
        assertThat(maria.resolution().source()).isEqualTo(ResolutionSource.KNOWLEDGE_BASE);
        assertThat(unknown.gender()).isEqualTo(GenderLabel.UNDETERMINED);
    }

    @Test
    void nounsMissingFromTheListAreUndetermined() {
        Resolution resolution = resolver(new FixtureGenderLookup(Map.of())).resolvePrn("Bogus");

        assertThat(resolution.label()).isEqualTo(GenderLabel.UNDETERMINED);
        assertThat(resolution.source()).isEqualTo(ResolutionSource.NOT_RESOLVED);
    }

    @Test
    void unreachableKnowledgeBaseLeavesNamesUndetermined() throws Exception {
        when(unreachable.lookup(anyString())).thenThrow(new LookupException("connect timed out"));
        Mention lehrerin = mention(MentionKind.PRN, "Lehrerin");
        Mention maria = mention(MentionKind.PER, "Maria Schmidt");

        resolver(unreachable).resolve(List.of(lehrerin, maria));

        assertThat(lehrerin.gender()).isEqualTo(GenderLabel.FEMALE);
        assertThat(maria.gender()).isEqualTo(GenderLabel.UNDETERMINED);
        assertThat(maria.resolution().source()).isEqualTo(ResolutionSource.LOOKUP_ERROR);
    }

    @Test
    void namesAreNormalizedBeforeTheLookup() {
        Map<String, Resolution> resolutions = resolver(new FixtureGenderLookup(Map.of("Bernd Muster", GenderLabel.MALE)))
                .resolveNames(List.of(" Bernd   Muster "));

        assertThat(resolutions).containsOnlyKeys("Bernd Muster");
        assertThat(resolutions.get("Bernd Muster").label()).isEqualTo(GenderLabel.MALE);
    }
}
