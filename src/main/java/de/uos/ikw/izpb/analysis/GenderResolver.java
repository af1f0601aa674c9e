package de.uos.ikw.izpb.analysis;

import de.uos.ikw.izpb.lexicon.PrnTable;
import de.uos.ikw.izpb.schemas.Mention;
import de.uos.ikw.izpb.schemas.MentionKind;
import de.uos.ikw.izpb.schemas.PrnEntry;
import de.uos.ikw.izpb.schemas.Resolution;
import de.uos.ikw.izpb.schemas.ResolutionSource;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static de.uos.ikw.izpb.lookup.GenderLookup.normalize;

/**
 * Sets the resolution of mentions: PRNs from the PRN table, person names from the knowledge base.
 * Never fails; anything that cannot be resolved is UNDETERMINED.
 */
public class GenderResolver {
    private final PrnTable prnTable;
    private final PoolResolution pool;

    public GenderResolver(PrnTable prnTable, PoolResolution pool) {
        this.prnTable = prnTable;
        this.pool = pool;
    }

    public void resolve(Collection<Mention> mentions) {
        List<String> names = mentions.stream()
                .filter(m -> m.kind() == MentionKind.PER)
                .map(m -> normalize(m.lemma()))
                .toList();
        Map<String, Resolution> resolutions = pool.resolveAll(names);

        for (Mention mention : mentions) {
            if (mention.kind() == MentionKind.PRN) {
                mention.setResolution(resolvePrn(mention.lemma()));
            } else {
                Resolution resolution = resolutions.get(normalize(mention.lemma()));
                mention.setResolution(resolution != null ? resolution
                        : Resolution.undetermined(ResolutionSource.NOT_RESOLVED, "not looked up"));
            }
        }
    }

    public Resolution resolvePrn(String lemma) {
        Optional<PrnEntry> entry = prnTable.get(lemma);
        if (entry.isEmpty()) {
            return Resolution.undetermined(ResolutionSource.NOT_RESOLVED, "not in PRN list");
        }
        return new Resolution(entry.get().gender(), ResolutionSource.PRN_LIST, 1.0, entry.get().sourceUrl());
    }

    /**
     * Resolves person names that are not mentions (author names).
     */
    public Map<String, Resolution> resolveNames(Collection<String> names) {
        return pool.resolveAll(names.stream().map(n -> normalize(n)).toList());
    }
}
