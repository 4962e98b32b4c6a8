package dev.careercrawler.notify;

import dev.careercrawler.config.AppConfig;
import dev.careercrawler.entity.Posting;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlertMessageFormatterTest {

    private AlertMessageFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new AlertMessageFormatter(AppConfig.createAlertTemplateEngine());
    }

    @Test
    void shouldRenderCompanyTitleLocationAndUrl() {
        Posting posting = Posting.builder()
                .company("Acme")
                .title("Backend Engineer")
                .location("Remote")
                .url("https://acme.example/jobs/1")
                .build();

        assertThat(formatter.format(posting)).isEqualTo("""
                **Acme** - Backend Engineer
                *Location:* Remote
                <https://acme.example/jobs/1>""");
    }

    @Test
    void shouldUseUnknownForMissingLocation() {
        Posting posting = Posting.builder()
                .company("Acme")
                .title("Backend Engineer")
                .url("https://acme.example/jobs/1")
                .build();

        assertThat(formatter.format(posting)).contains("*Location:* unknown");
    }

    @Test
    void shouldNotEscapeMarkupCharacters() {
        Posting posting = Posting.builder()
                .company("R&D Labs")
                .title("C++ Engineer <Platform>")
                .url("https://acme.example/jobs?id=1&ref=x")
                .build();

        String message = formatter.format(posting);

        assertThat(message).startsWith("**R&D Labs** - C++ Engineer <Platform>");
        assertThat(message).endsWith("<https://acme.example/jobs?id=1&ref=x>");
    }

    @Test
    void shouldTruncateLongTitleAndKeepUrl() {
        Posting posting = Posting.builder()
                .company("Acme")
                .title("Engineer ".repeat(400))
                .url("https://acme.example/jobs/1")
                .build();

        String message = formatter.format(posting);

        assertThat(message.length()).isLessThanOrEqualTo(AlertMessageFormatter.MAX_MESSAGE_LENGTH);
        assertThat(message).contains("...\n*Location:*");
        assertThat(message).endsWith("<https://acme.example/jobs/1>");
    }

    @Test
    void shouldCapWholeMessageAtDiscordLimit() {
        Posting posting = Posting.builder()
                .company("Acme")
                .title("Engineer")
                .url("https://acme.example/jobs?q=" + "a".repeat(2100))
                .build();

        assertThat(formatter.format(posting)).hasSize(AlertMessageFormatter.MAX_MESSAGE_LENGTH);
    }
}
