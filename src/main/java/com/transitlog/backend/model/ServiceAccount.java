package com.transitlog.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.io.IOException;
import java.util.Base64;

/**
 * Google service account key, as found in a downloaded key file.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceAccount {

    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("private_key_id")
    private String privateKeyId;

    @JsonProperty("client_email")
    private String clientEmail;

    @ToString.Exclude
    @JsonProperty("private_key")
    private String privateKey;

    // Raw key file, kept for google-auth-library
    @ToString.Exclude
    @JsonIgnore
    private byte[] keyFile;

    /**
     * Decode a base64 encoded key file.
     */
    public static ServiceAccount decode(String encoded, ObjectMapper objectMapper) {
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalStateException("Service account secret is not configured");
        }
        try {
            byte[] keyFile = Base64.getDecoder().decode(encoded.trim());
            ServiceAccount account = objectMapper.readValue(keyFile, ServiceAccount.class);
            account.setKeyFile(keyFile);
            return account;
        } catch (IllegalArgumentException | IOException e) {
            throw new IllegalStateException("Service account secret is not valid base64 JSON", e);
        }
    }
}
