package com.transitlog.backend.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.transitlog.backend.model.CachedResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResponseCacheTest {

    @Mock
    private SharedCache brokenCache;

    private ResponseCache responseCache;

    @BeforeEach
    void setUp() {
        responseCache = new ResponseCache(new InMemorySharedCache(), new ObjectMapper());
    }

    @Test
    void testCacheKey_StripsQueryString() {
        assertEquals("https://gtfs.example/v2/gtfsposition",
                ResponseCache.cacheKey("https://gtfs.example/v2/gtfsposition?apikey=secret"));
        assertEquals("https://gtfs.example/v2/gtfsposition",
                ResponseCache.cacheKey("https://gtfs.example/v2/gtfsposition"));
    }

    @Test
    void testPutThenGet_DifferentApiKeys_ShareEntry() {
        // Given
        CachedResponse response = CachedResponse.builder()
                .status(200)
                .body("feed".getBytes(StandardCharsets.UTF_8))
                .contentType("application/octet-stream")
                .build();

        // When
        responseCache.put("https://gtfs.example/v2/gtfsposition?apikey=one", response, Duration.ofSeconds(29));
        Optional<CachedResponse> cached = responseCache.get("https://gtfs.example/v2/gtfsposition?apikey=two");

        // Then
        assertTrue(cached.isPresent());
        assertEquals(200, cached.get().getStatus());
        assertArrayEquals("feed".getBytes(StandardCharsets.UTF_8), cached.get().getBody());
        assertEquals(29, cached.get().getMaxAgeSeconds());
        assertEquals("public, max-age=29", cached.get().getCacheControl());
    }

    @Test
    void testGet_Miss_ReturnsEmpty() {
        assertTrue(responseCache.get("https://gtfs.example/unknown").isEmpty());
    }

    @Test
    void testPut_BackendFailure_IsSwallowed() {
        // Given
        doThrow(new IllegalStateException("redis down")).when(brokenCache).put(anyString(), anyString(), any());
        ResponseCache cache = new ResponseCache(brokenCache, new ObjectMapper());

        // When / Then
        assertDoesNotThrow(() -> cache.put("https://gtfs.example/a", CachedResponse.builder().status(200).build(),
                Duration.ofSeconds(10)));
    }

    @Test
    void testGet_UnreadableEntry_TreatedAsMiss() {
        // Given
        when(brokenCache.get("response:https://gtfs.example/a")).thenReturn(Optional.of("not json"));
        ResponseCache cache = new ResponseCache(brokenCache, new ObjectMapper());

        // Then
        assertTrue(cache.get("https://gtfs.example/a").isEmpty());
    }
}
