package dev.careercrawler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Shared infrastructure beans.
 */
@Slf4j
@Configuration
public class AppConfig {

    private static final String ALERT_TEMPLATE_PREFIX = "templates/";
    private static final String ALERT_TEMPLATE_SUFFIX = ".txt";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Plain-text template engine for alert messages.
     */
    @Bean
    public TemplateEngine alertTemplateEngine() {
        return createAlertTemplateEngine();
    }

    public static TemplateEngine createAlertTemplateEngine() {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix(ALERT_TEMPLATE_PREFIX);
        resolver.setSuffix(ALERT_TEMPLATE_SUFFIX);
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCharacterEncoding(StandardCharsets.UTF_8.name());
        resolver.setCacheable(true);

        TemplateEngine engine = new TemplateEngine();
        engine.setTemplateResolver(resolver);
        log.debug("Alert template engine configured ({}*{})", ALERT_TEMPLATE_PREFIX, ALERT_TEMPLATE_SUFFIX);
        return engine;
    }
}
