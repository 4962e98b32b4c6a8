package dev.careercrawler.service;

import dev.careercrawler.config.DiscordConfig;
import dev.careercrawler.entity.Posting;
import dev.careercrawler.metrics.CrawlerMetrics;
import dev.careercrawler.notify.AlertChannel;
import dev.careercrawler.notify.AlertChannelException;
import dev.careercrawler.notify.AlertDeliveryException;
import dev.careercrawler.notify.AlertMessageFormatter;
import dev.careercrawler.notify.AlertPermissionException;
import dev.careercrawler.notify.AlertSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Sends one alert per new posting and marks delivered postings as notified.
 * A posting is marked only after the channel confirmed delivery, so a crash in between
 * can repeat an alert on the next run but never lose one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final PostingStore postingStore;
    private final AlertChannel alertChannel;
    private final AlertMessageFormatter messageFormatter;
    private final DiscordConfig discordConfig;
    private final CrawlerMetrics metrics;

    @Value("${scanner.dry-run:false}")
    private boolean dryRun;

    /**
     * Alert on postings not yet notified, up to {@code cap} messages.
     *
     * @param cap maximum number of alerts for this run
     * @return number of alerts delivered
     */
    public int notifyNewPostings(int cap) {
        if (!discordConfig.hasToken()) {
            log.error("Discord bot token is missing or not set. Skipping notifications.");
            return 0;
        }
        if (!discordConfig.hasValidChannelId()) {
            log.error("Discord channel ID '{}' is missing or invalid. Must be an integer.",
                    discordConfig.getChannelId());
            return 0;
        }

        List<Posting> pending = postingStore.selectUnnotifiedAcceptable();
        if (pending.isEmpty()) {
            log.info("No new postings to notify about.");
            return 0;
        }
        log.info("Found {} new postings to potentially notify about (cap: {})", pending.size(), cap);

        if (dryRun) {
            pending.stream().limit(Math.max(0, cap)).forEach(posting ->
                    log.info("DRY RUN - Would send alert:\n{}", messageFormatter.format(posting)));
            return 0;
        }

        int sent = 0;
        try (AlertSession session = alertChannel.open()) {
            sent = sendAll(session, pending, cap);
        } catch (AlertPermissionException e) {
            log.error("Discord permission error: {}", e.getMessage());
        } catch (AlertChannelException e) {
            log.error("Could not open Discord session: {}", e.getMessage());
        }

        log.info("Finished sending {} Discord notifications. {} postings still awaiting notification.",
                sent, postingStore.countUnnotifiedAcceptable());
        return sent;
    }

    private int sendAll(AlertSession session, List<Posting> pending, int cap) {
        int sent = 0;
        int attempted = 0;

        for (Posting posting : pending) {
            if (sent >= cap) {
                log.warn("Reached maximum alert limit ({}). Holding remaining {} notifications for next run.",
                        cap, pending.size() - attempted);
                break;
            }
            if (attempted > 0 && !pause(discordConfig.getMinSendInterval())) {
                break;
            }
            attempted++;

            try {
                session.send(messageFormatter.format(posting));
            } catch (AlertPermissionException e) {
                log.error("Permission error sending alert for posting ID {}. Aborting remaining sends: {}",
                        posting.getId(), e.getMessage());
                metrics.recordAlertFailure();
                break;
            } catch (AlertDeliveryException e) {
                log.error("Failed to send alert for posting ID {}: {}", posting.getId(), e.getMessage());
                metrics.recordAlertFailure();
                continue;
            }

            sent++;
            metrics.recordAlertSent();
            log.info("Sent alert for posting ID {}: {}", posting.getId(), posting.getTitle());
            if (!postingStore.markNotified(posting.getId())) {
                log.warn("Failed to mark posting ID {} as notified after sending alert.", posting.getId());
            }
        }
        return sent;
    }

    private boolean pause(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(interval.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Notification pause interrupted. Stopping sends for this run.");
            return false;
        }
    }
}
