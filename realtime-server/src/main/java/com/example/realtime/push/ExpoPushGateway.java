package com.example.realtime.push;

import com.example.realtime.config.RealtimeProperties;
import com.example.realtime.service.exception.DeliveryException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts message batches to the Expo push API. The response carries one ticket per message under
 * {@code data}; request-level failures come back under {@code errors}.
 */
@Slf4j
@Component
public class ExpoPushGateway implements PushGateway {

    private static final TypeReference<List<PushTicket>> TICKETS = new TypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String endpoint;
    private final String accessToken;

    public ExpoPushGateway(RestTemplateBuilder restTemplateBuilder, ObjectMapper objectMapper, RealtimeProperties properties) {
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(15))
                .build();
        this.objectMapper = objectMapper;
        this.endpoint = properties.getPush().getEndpoint();
        this.accessToken = properties.getPush().getAccessToken();
    }

    @Override
    public List<PushTicket> send(List<PushMessage> messages) {
        if (messages.isEmpty()) {
            return List.of();
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (StringUtils.hasText(accessToken)) {
            headers.setBearerAuth(accessToken);
        }

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.postForEntity(endpoint, new HttpEntity<>(messages, headers), JsonNode.class);
        } catch (HttpStatusCodeException ex) {
            throw new DeliveryException("Push provider rejected batch (HTTP " + ex.getStatusCode().value() + "): "
                    + ex.getResponseBodyAsString(), ex);
        } catch (RestClientException ex) {
            throw new DeliveryException("Push provider unreachable", ex);
        }

        JsonNode body = response.getBody();
        if (body == null) {
            throw new DeliveryException("Push provider returned an empty response");
        }
        if (body.hasNonNull("errors")) {
            throw new DeliveryException("Push provider reported errors: " + body.get("errors"));
        }
        JsonNode data = body.path("data");
        if (!data.isArray()) {
            throw new DeliveryException("Push provider response has no ticket list");
        }
        List<PushTicket> tickets = objectMapper.convertValue(data, TICKETS);
        if (tickets.size() != messages.size()) {
            log.warn("Push provider returned {} ticket(s) for {} message(s)", tickets.size(), messages.size());
        }
        return tickets;
    }
}
