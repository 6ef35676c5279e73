package com.transitlog.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An HTTP response as it is kept in the shared response cache.
 * The body is serialized as base64 by Jackson.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CachedResponse {
    private int status;
    private byte[] body;
    private String contentType;
    // Cache-Control max-age the response was stored with, 0 when never cached
    private long maxAgeSeconds;
    // Seconds since epoch
    private long storedAt;

    @JsonIgnore
    public boolean isOk() {
        return status >= 200 && status < 300;
    }

    @JsonIgnore
    public String getCacheControl() {
        return "public, max-age=" + maxAgeSeconds;
    }
}
