package com.identity.matching.directory;

import com.identity.matching.core.model.CandidateRecord;
import com.identity.matching.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CachingDirectoryProvider Tests")
class CachingDirectoryProviderTest {

    @Mock
    private DirectoryProvider delegate;

    private SimpleMeterRegistry registry;
    private CachingDirectoryProvider provider;

    private final List<CandidateRecord> people = List.of(
            CandidateRecord.builder().externalId("P1").name("Mary Smith").build());

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        provider = new CachingDirectoryProvider(delegate, DirectoryCacheConfig.defaults(),
                new MicrometerMetricsService(registry));
    }

    @Test
    void secondFetchIsServedFromCache() {
        when(delegate.fetchAllCandidates("list-1", false)).thenReturn(people);

        assertEquals(people, provider.fetchAllCandidates("list-1", false));
        assertEquals(people, provider.fetchAllCandidates("list-1", false));

        verify(delegate, times(1)).fetchAllCandidates("list-1", false);
        assertEquals(1.0, registry.get("identity.directory.cache.hit").counter().count());
        assertEquals(1.0, registry.get("identity.directory.cache.miss").counter().count());
    }

    @Test
    void scopesAreCachedSeparately() {
        when(delegate.fetchAllCandidates(anyString(), eq(false))).thenReturn(people);

        provider.fetchAllCandidates("list-1", false);
        provider.fetchAllCandidates("list-2", false);

        verify(delegate).fetchAllCandidates("list-1", false);
        verify(delegate).fetchAllCandidates("list-2", false);
    }

    @Test
    @DisplayName("Forced refresh bypasses and replaces the cached entry")
    void forceRefreshGoesToDelegate() {
        List<CandidateRecord> refreshed = List.of(
                CandidateRecord.builder().externalId("P2").name("Ann Lee").build());
        when(delegate.fetchAllCandidates("list-1", false)).thenReturn(people);
        when(delegate.fetchAllCandidates("list-1", true)).thenReturn(refreshed);

        provider.fetchAllCandidates("list-1", false);
        assertEquals(refreshed, provider.fetchAllCandidates("list-1", true));
        assertEquals(refreshed, provider.fetchAllCandidates("list-1", false));

        verify(delegate).fetchAllCandidates("list-1", true);
        verify(delegate, times(1)).fetchAllCandidates("list-1", false);
    }

    @Test
    void failuresAreNotCached() {
        when(delegate.fetchAllCandidates("list-1", false))
                .thenThrow(new DirectoryFetchException("down"))
                .thenReturn(people);

        assertThrows(DirectoryFetchException.class, () -> provider.fetchAllCandidates("list-1", false));
        assertEquals(people, provider.fetchAllCandidates("list-1", false));
    }

    @Test
    void cachedListIsACopy() {
        List<CandidateRecord> mutable = new ArrayList<>(people);
        when(delegate.fetchAllCandidates("list-1", false)).thenReturn(mutable);

        provider.fetchAllCandidates("list-1", false);
        mutable.clear();

        assertEquals(1, provider.fetchAllCandidates("list-1", false).size());
    }

    @Test
    void invalidateDropsEntry() {
        when(delegate.fetchAllCandidates("list-1", false)).thenReturn(people);

        provider.fetchAllCandidates("list-1", false);
        provider.invalidate("list-1");
        provider.fetchAllCandidates("list-1", false);

        verify(delegate, times(2)).fetchAllCandidates("list-1", false);
    }

    @Test
    void disabledCachePassesThrough() {
        CachingDirectoryProvider disabled = new CachingDirectoryProvider(delegate, DirectoryCacheConfig.disabled());
        when(delegate.fetchAllCandidates("list-1", false)).thenReturn(people);

        disabled.fetchAllCandidates("list-1", false);
        disabled.fetchAllCandidates("list-1", false);

        verify(delegate, times(2)).fetchAllCandidates("list-1", false);
    }

    @Test
    void configRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new DirectoryCacheConfig(0, 10, true));
        assertThrows(IllegalArgumentException.class, () -> new DirectoryCacheConfig(10, 0, true));
    }
}
