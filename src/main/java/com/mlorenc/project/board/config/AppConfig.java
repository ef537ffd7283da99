package com.mlorenc.project.board.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlorenc.project.board.core.GhCliGraphQlTransport;
import com.mlorenc.project.board.core.GraphQlTransport;
import com.mlorenc.project.board.core.RestGraphQlTransport;
import com.mlorenc.project.board.core.RetryPolicy;
import com.mlorenc.project.board.core.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;

@Configuration
@EnableConfigurationProperties(BoardProperties.class)
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    RestTemplate restTemplate(BoardProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.http().connectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.http().readTimeout().toMillis());
        return new RestTemplate(requestFactory);
    }

    @Bean
    GraphQlTransport graphQlTransport(BoardProperties properties, RestTemplate restTemplate, ObjectMapper objectMapper) {
        if (properties.transport() == BoardProperties.TransportKind.GH_CLI) {
            log.atInfo().addKeyValue("event", "board.transport.selected")
                    .addKeyValue("transport", "gh-cli")
                    .log("Using gh command-line proxy for GraphQL calls");
            return new GhCliGraphQlTransport(
                    Arrays.asList(properties.github().cliCommand().trim().split("\\s+")),
                    properties.http().readTimeout(),
                    objectMapper);
        }
        log.atInfo().addKeyValue("event", "board.transport.selected")
                .addKeyValue("transport", "rest")
                .addKeyValue("graphqlUrl", properties.github().graphqlUrl())
                .log("Using HTTPS transport for GraphQL calls");
        return new RestGraphQlTransport(restTemplate, properties.github().graphqlUrl(), properties.github().token());
    }

    @Bean
    RetryPolicy retryPolicy(BoardProperties properties) {
        return new RetryPolicy(properties.retry().maxAttempts(), properties.retry().baseDelay());
    }

    @Bean
    Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }
}
