package com.transitlog.backend.client;

import com.transitlog.backend.exception.FeedDecodeException;
import com.transitlog.backend.exception.UpstreamHttpException;
import com.transitlog.backend.model.Alert;
import com.transitlog.backend.model.CachedResponse;
import com.transitlog.backend.model.Position;
import com.transitlog.backend.service.DomainNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static com.transitlog.backend.GtfsFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RealtimeFeedClientTest {

    @Mock
    private CachingHttpClient httpClient;

    private RealtimeFeedClient client;

    @BeforeEach
    void setUp() {
        ApiKeyRotator rotator = new ApiKeyRotator("key1,key2", 1000, 86400);
        client = new RealtimeFeedClient(httpClient, rotator, new DomainNormalizer(Clock.systemUTC()));
        ReflectionTestUtils.setField(client, "apiUrl", "https://gtfs.example");
    }

    private static CachedResponse ok(byte[] body) {
        return CachedResponse.builder().status(200).body(body).build();
    }

    @Test
    void testGetPositions_RequestsFeedWithRotatedKeyAndQuotaTtl() {
        // Given
        byte[] feed = feed(
                vehicleEntity("1", vehicle("9431", -123.1f, 49.2f)),
                vehicleEntity("2", vehicle("9432", 0f, 0f))).toByteArray();
        when(httpClient.fetch(anyString(), any())).thenReturn(ok(feed));

        // When
        List<Position> positions = client.getPositions();

        // Then
        ArgumentCaptor<String> url = ArgumentCaptor.forClass(String.class);
        verify(httpClient).fetch(url.capture(), eq(Duration.ofSeconds(44)));
        assertTrue(url.getValue().matches("https://gtfs\\.example/v2/gtfsposition\\?apikey=key[12]"));
        assertEquals(1, positions.size());
        assertEquals(9431, positions.get(0).getVehicle());
    }

    @Test
    void testGetAlerts_OnlyBusAlerts() {
        // Given
        byte[] feed = feed(
                alertEntity("10", alert(busRoute("6641"))),
                alertEntity("11", alert(stop("50001")))).toByteArray();
        when(httpClient.fetch(startsWith("https://gtfs.example/v2/gtfsalerts?apikey="), any())).thenReturn(ok(feed));

        // When
        List<Alert> alerts = client.getAlerts();

        // Then
        assertEquals(1, alerts.size());
        assertEquals(10, alerts.get(0).getId());
    }

    @Test
    void testGetFeed_ErrorStatus_ThrowsWithStatusAndUrl() {
        when(httpClient.fetch(anyString(), any())).thenReturn(CachedResponse.builder().status(403).body(new byte[0]).build());

        UpstreamHttpException ex = assertThrows(UpstreamHttpException.class, () -> client.getFeed("gtfsposition"));

        assertEquals(403, ex.getStatus());
        assertEquals("https://gtfs.example/v2/gtfsposition", ex.getTarget());
        assertFalse(ex.getMessage().contains("apikey"));
    }

    @Test
    void testGetFeed_Garbage_ThrowsDecodeError() {
        when(httpClient.fetch(anyString(), any()))
                .thenReturn(ok("<html>maintenance</html>".getBytes(StandardCharsets.UTF_8)));

        assertThrows(FeedDecodeException.class, () -> client.getFeed("gtfsposition"));
    }
}
