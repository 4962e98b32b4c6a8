package dev.careercrawler.notify;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careercrawler.config.DiscordConfig;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.Map;

/**
 * Sends alerts to a Discord channel through the bot REST API.
 * Each session owns its own connection pool, released when the session closes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiscordAlertChannel implements AlertChannel {

    private final WebClient.Builder webClientBuilder;
    private final DiscordConfig discordConfig;

    @Override
    public AlertSession open() {
        ConnectionProvider connectionProvider = ConnectionProvider.builder("discord-alerts")
                .maxConnections(1)
                .build();
        Duration timeout = discordConfig.getRequestTimeout();

        WebClient client = webClientBuilder.clone()
                .baseUrl(discordConfig.getApiBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create(connectionProvider)))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bot " + discordConfig.getToken())
                .build();

        try {
            DiscordUser user = client.get()
                    .uri("/users/@me")
                    .retrieve()
                    .bodyToMono(DiscordUser.class)
                    .timeout(timeout)
                    .block();
            log.info("Discord client ready. Logged in as {}", user != null ? user.getUsername() : "unknown");

            DiscordChannel channel = client.get()
                    .uri("/channels/{id}", discordConfig.getChannelId())
                    .retrieve()
                    .bodyToMono(DiscordChannel.class)
                    .timeout(timeout)
                    .block();
            log.info("Sending notifications to channel: #{}",
                    channel != null && channel.getName() != null ? channel.getName() : discordConfig.getChannelId());

            return new DiscordSession(client, connectionProvider, discordConfig.getChannelId(), timeout);
        } catch (RuntimeException e) {
            connectionProvider.dispose();
            throw translate(e, "opening Discord session");
        }
    }

    static AlertChannelException translate(RuntimeException e, String action) {
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            if (status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value()) {
                return new AlertPermissionException(
                        "Permission error " + action + " (HTTP " + status + "). Check the bot token and permissions.",
                        responseException);
            }
            if (status == HttpStatus.NOT_FOUND.value()) {
                return new AlertChannelException("Not found while " + action + " (HTTP 404)", responseException);
            }
            return new AlertDeliveryException("HTTP " + status + " while " + action, responseException);
        }
        return new AlertDeliveryException("Error " + action + ": " + cause.getMessage(), cause);
    }

    /**
     * Open session bound to one channel.
     */
    static class DiscordSession implements AlertSession {

        private final WebClient client;
        private final ConnectionProvider connectionProvider;
        private final String channelId;
        private final Duration timeout;

        DiscordSession(WebClient client, ConnectionProvider connectionProvider, String channelId, Duration timeout) {
            this.client = client;
            this.connectionProvider = connectionProvider;
            this.channelId = channelId;
            this.timeout = timeout;
        }

        @Override
        public void send(String message) {
            try {
                client.post()
                        .uri("/channels/{id}/messages", channelId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(Map.of("content", message))
                        .retrieve()
                        .toBodilessEntity()
                        .timeout(timeout)
                        .block();
            } catch (RuntimeException e) {
                AlertChannelException translated = translate(e, "sending message");
                if (translated instanceof AlertPermissionException
                        || translated instanceof AlertDeliveryException) {
                    throw translated;
                }
                throw new AlertDeliveryException(translated.getMessage(), translated.getCause());
            }
        }

        @Override
        public void close() {
            log.info("Closing Discord client connection.");
            connectionProvider.dispose();
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DiscordUser {
        private String id;
        private String username;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DiscordChannel {
        private String id;
        private String name;
        private int type;
    }
}
