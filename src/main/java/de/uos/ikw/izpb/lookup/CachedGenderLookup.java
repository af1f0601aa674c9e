package de.uos.ikw.izpb.lookup;

import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import de.uos.ikw.izpb.formats.LookupCacheRow;
import de.uos.ikw.izpb.schemas.GenderLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static de.uos.ikw.izpb.util.AuxiliarFunctions.createFolder;
import static de.uos.ikw.izpb.util.AuxiliarFunctions.exists;
import static de.uos.ikw.izpb.util.ObjectReaderUtils.readAllRows;
import static de.uos.ikw.izpb.util.ObjectReaderUtils.writeAllRows;

/**
 * Caches the answers of another lookup by normalized name. Failed lookups are not cached, so a
 * later run asks again. The cache can be saved to and loaded from a CSV file.
 */
public class CachedGenderLookup extends GenderLookup {
    private static final Logger logger = LoggerFactory.getLogger(CachedGenderLookup.class);

    public static final CsvSchema CACHE_SCHEMA = CsvSchema.emptySchema().withHeader();

    private final GenderLookup delegate;
    private final Map<String, LookupResult> cache = new ConcurrentHashMap<>();
    private final AtomicInteger hits = new AtomicInteger();
    private final AtomicInteger misses = new AtomicInteger();

    public CachedGenderLookup(GenderLookup delegate) {
        this.delegate = delegate;
    }

    @Override
    public LookupResult lookup(String name) throws LookupException {
        String normalized = normalize(name);
        LookupResult cached = cache.get(normalized);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        misses.incrementAndGet();
        LookupResult result = delegate.lookup(normalized);
        cache.put(normalized, result);
        return result;
    }

    public int size() {
        return cache.size();
    }

    public int hits() {
        return hits.get();
    }

    public int misses() {
        return misses.get();
    }

    /**
     * Adds the entries of a cache file; a missing file leaves the cache as is.
     *
     * @return Number of entries read.
     */
    public int load(Path path) throws IOException {
        if (!exists(path)) {
            logger.info("No lookup cache at {}, starting empty", path);
            return 0;
        }
        int numEntries = 0;
        for (LookupCacheRow row : readAllRows(path, CACHE_SCHEMA, LookupCacheRow.class)) {
            GenderLabel label;
            try {
                label = GenderLabel.fromLabel(row.gender());
            } catch (IllegalArgumentException | NullPointerException e) {
                logger.warn("Skipped cache entry {}: unknown gender '{}'", row.name(), row.gender());
                continue;
            }
            cache.put(normalize(row.name()), new LookupResult(label, row.candidates(), row.agreement(),
                    row.detail() == null ? "" : row.detail()));
            numEntries++;
        }
        logger.info("Loaded {} cached lookups from {}", numEntries, path);
        return numEntries;
    }

    /**
     * Writes the cache sorted by name.
     */
    public void save(Path path) throws IOException {
        if (path.toAbsolutePath().getParent() != null) {
            createFolder(path.toAbsolutePath().getParent());
        }
        List<LookupCacheRow> rows = cache.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Comparator.naturalOrder()))
                .map(e -> new LookupCacheRow(e.getKey(), e.getValue().label().label(), e.getValue().candidates(),
                        e.getValue().agreement(), e.getValue().detail()))
                .toList();
        writeAllRows(path, LookupCacheRow.class, rows);
        logger.info("Saved {} cached lookups to {} ({} hits, {} misses)", rows.size(), path, hits.get(), misses.get());
    }
}
