package com.mlorenc.project.board.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlorenc.project.board.exception.TransportException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RestGraphQlTransport implements GraphQlTransport {

    private final RestTemplate restTemplate;
    private final String graphqlUrl;
    private final String token;

    public RestGraphQlTransport(RestTemplate restTemplate, String graphqlUrl, String token) {
        this.restTemplate = restTemplate;
        this.graphqlUrl = graphqlUrl;
        this.token = token;
    }

    @Override
    public JsonNode execute(String query, Map<String, Object> variables) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("variables", variables);

        HttpHeaders headers = new HttpHeaders();
        if (token != null && !token.isBlank()) {
            headers.setBearerAuth(token);
        }
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(graphqlUrl, HttpMethod.POST,
                    new HttpEntity<>(payload, headers), JsonNode.class);
            JsonNode body = response.getBody();
            if (body == null) {
                throw new TransportException("Empty GraphQL response from " + graphqlUrl);
            }
            return body;
        } catch (RestClientException ex) {
            throw new TransportException("GraphQL request to " + graphqlUrl + " failed: " + ex.getMessage(), ex);
        }
    }
}
