package com.mlorenc.project.board.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlorenc.project.board.core.GhCliGraphQlTransport;
import com.mlorenc.project.board.core.RestGraphQlTransport;
import com.mlorenc.project.board.core.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AppConfigTest {

    private final AppConfig config = new AppConfig();

    private static BoardProperties properties(BoardProperties.TransportKind transport) {
        return new BoardProperties(
                transport,
                new BoardProperties.Github("https://api.github.com/graphql", "ghp_token", "gh --hostname github.com"),
                new BoardProperties.Http(Duration.ofSeconds(5), Duration.ofSeconds(30)),
                new BoardProperties.Retry(4, Duration.ofMillis(250)),
                new BoardProperties.Bulk(Duration.ofMillis(500)));
    }

    @Test
    void shouldSelectTransportFromProperties() {
        RestTemplate restTemplate = new RestTemplate();
        ObjectMapper objectMapper = new ObjectMapper();

        assertThat(config.graphQlTransport(properties(BoardProperties.TransportKind.REST), restTemplate, objectMapper))
                .isInstanceOf(RestGraphQlTransport.class);
        assertThat(config.graphQlTransport(properties(BoardProperties.TransportKind.GH_CLI), restTemplate, objectMapper))
                .isInstanceOf(GhCliGraphQlTransport.class);
    }

    @Test
    void shouldBuildRetryPolicyFromProperties() {
        RetryPolicy policy = config.retryPolicy(properties(BoardProperties.TransportKind.REST));

        assertThat(policy.maxAttempts()).isEqualTo(4);
        assertThat(policy.delayAfterAttempt(2)).isEqualTo(Duration.ofMillis(500));
    }
}
