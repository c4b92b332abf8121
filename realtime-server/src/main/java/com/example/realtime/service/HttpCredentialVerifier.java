package com.example.realtime.service;

import com.example.realtime.config.RealtimeProperties;
import com.example.realtime.service.exception.AuthException;
import com.example.realtime.service.exception.ConnectionException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Verifies a token the same way ordinary API requests are verified: by calling the auth endpoint
 * with it and trusting only the profile id that comes back.
 */
@Slf4j
@Component
public class HttpCredentialVerifier implements CredentialVerifier {

    private final RestTemplate restTemplate;
    private final String verifyUrl;

    public HttpCredentialVerifier(RestTemplateBuilder restTemplateBuilder, RealtimeProperties properties) {
        RealtimeProperties.Auth auth = properties.getAuth();
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(auth.getConnectTimeout())
                .setReadTimeout(auth.getReadTimeout())
                .build();
        this.verifyUrl = auth.getVerifyUrl();
    }

    @Override
    public String resolveProfileId(String bearerToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(bearerToken);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange(verifyUrl, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
        } catch (HttpStatusCodeException ex) {
            if (ex.getStatusCode().is4xxClientError()) {
                throw new AuthException("Invalid authentication token (HTTP " + ex.getStatusCode().value() + ")", ex);
            }
            throw new ConnectionException("Auth service error (HTTP " + ex.getStatusCode().value() + ")", ex);
        } catch (RestClientException ex) {
            throw new ConnectionException("Auth service unreachable", ex);
        }

        JsonNode body = response.getBody();
        if (body == null || !body.path("success").asBoolean(false)) {
            throw new AuthException("Authentication failed");
        }
        String profileId = body.path("data").path("profile").path("id").asText(null);
        if (profileId == null || profileId.isBlank()) {
            throw new AuthException("No profile attached to token");
        }
        return profileId;
    }
}
