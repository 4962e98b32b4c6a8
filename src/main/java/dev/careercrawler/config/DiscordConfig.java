package dev.careercrawler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for Discord alerts.
 * Loaded from application.yml under 'discord' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "discord")
public class DiscordConfig {

    public static final String TOKEN_PLACEHOLDER = "YOUR_DISCORD_BOT_TOKEN";
    public static final String CHANNEL_PLACEHOLDER = "YOUR_DISCORD_CHANNEL_OR_USER_ID";

    private boolean enabled = false;
    private String token;
    private String channelId;
    private int maxAlertsPerRun = 10;
    private String apiBaseUrl = "https://discord.com/api/v10";
    private Duration minSendInterval = Duration.ofSeconds(1);
    private Duration requestTimeout = Duration.ofSeconds(15);

    public boolean hasToken() {
        return token != null && !token.isBlank() && !TOKEN_PLACEHOLDER.equals(token);
    }

    public boolean hasValidChannelId() {
        return channelId != null && !CHANNEL_PLACEHOLDER.equals(channelId) && channelId.matches("\\d+");
    }
}
