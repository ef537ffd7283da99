package com.mlorenc.project.board.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "board")
public record BoardProperties(TransportKind transport, Github github, Http http, Retry retry, Bulk bulk) {

    public enum TransportKind {
        REST,
        GH_CLI
    }

    public record Github(String graphqlUrl, String token, String cliCommand) {
    }

    public record Http(Duration connectTimeout, Duration readTimeout) {
    }

    public record Retry(int maxAttempts, Duration baseDelay) {
    }

    public record Bulk(Duration rowDelay) {
    }
}
