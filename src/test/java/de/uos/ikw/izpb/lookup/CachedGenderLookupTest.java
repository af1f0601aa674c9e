package de.uos.ikw.izpb.lookup;

import de.uos.ikw.izpb.schemas.GenderLabel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CachedGenderLookupTest {

    @Mock
    private GenderLookup delegate;

    @TempDir
    Path tempDir;

    @Test
    void repeatedNamesAreAnsweredFromTheCache() throws Exception {
        when(delegate.lookup("Maria Schmidt")).thenReturn(new LookupResult(GenderLabel.FEMALE, 1, 1.0, "Q1:f"));
        CachedGenderLookup lookup = new CachedGenderLookup(delegate);

        lookup.lookup("Maria Schmidt");
        LookupResult second = lookup.lookup(" Maria  Schmidt");

        assertThat(second.label()).isEqualTo(GenderLabel.FEMALE);
        verify(delegate, times(1)).lookup("Maria Schmidt");
        assertThat(lookup.hits()).isEqualTo(1);
        assertThat(lookup.misses()).isEqualTo(1);
    }

    @Test
    void failedLookupsAreNotCached() throws Exception {
        when(delegate.lookup("Bernd Muster"))
                .thenThrow(new LookupException("HTTP 503"))
                .thenReturn(new LookupResult(GenderLabel.MALE, 1, 1.0, "Q2:m"));
        CachedGenderLookup lookup = new CachedGenderLookup(delegate);

        assertThatThrownBy(() -> lookup.lookup("Bernd Muster")).isInstanceOf(LookupException.class);
        assertThat(lookup.size()).isZero();
        assertThat(lookup.lookup("Bernd Muster").label()).isEqualTo(GenderLabel.MALE);
        verify(delegate, times(2)).lookup("Bernd Muster");
    }

    @Test
    void savedCacheIsLoadedByTheNextRun() throws Exception {
        when(delegate.lookup("Maria Schmidt")).thenReturn(new LookupResult(GenderLabel.FEMALE, 2, 1.0, "Q1:f Q7:f"));
        when(delegate.lookup("Kim Doe")).thenReturn(new LookupResult(GenderLabel.AMBIGUOUS, 2, 0.5, "Q3:f Q4:m"));
        CachedGenderLookup first = new CachedGenderLookup(delegate);
        first.lookup("Maria Schmidt");
        first.lookup("Kim Doe");
        Path cacheFile = tempDir.resolve("cache").resolve("wikidata_cache.csv");

        first.save(cacheFile);
        CachedGenderLookup second = new CachedGenderLookup(delegate);
        int numLoaded = second.load(cacheFile);

        assertThat(numLoaded).isEqualTo(2);
        assertThat(Files.readAllLines(cacheFile).get(1)).contains("Kim Doe", "ambiguous");
        assertThat(second.lookup("Kim Doe")).isEqualTo(new LookupResult(GenderLabel.AMBIGUOUS, 2, 0.5, "Q3:f Q4:m"));
        assertThat(second.hits()).isEqualTo(1);
        verify(delegate, times(1)).lookup("Kim Doe");
    }

    @Test
    void missingCacheFileStartsEmpty() throws Exception {
        CachedGenderLookup lookup = new CachedGenderLookup(delegate);

        assertThat(lookup.load(tempDir.resolve("absent.csv"))).isZero();
        assertThat(lookup.size()).isZero();
    }
}
