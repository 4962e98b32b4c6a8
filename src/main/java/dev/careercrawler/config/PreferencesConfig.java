package dev.careercrawler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * User preferences a candidate posting is matched against.
 * Loaded from application.yml under 'preferences' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "preferences")
public class PreferencesConfig {

    public static final String ANY = "any";
    public static final String EXCLUDE_PREFIX = "exclude:";

    private List<String> titles = new ArrayList<>();
    private List<String> exclusions = new ArrayList<>();
    private List<String> location = new ArrayList<>(List.of(ANY));
    private List<String> seniority = new ArrayList<>(List.of(ANY));
    private List<String> department = new ArrayList<>(List.of(ANY));

    /**
     * True when the list is exactly the {@code ["any"]} sentinel.
     */
    public static boolean isAny(List<String> values) {
        if (values == null || values.size() != 1 || values.get(0) == null) {
            return false;
        }
        return ANY.equalsIgnoreCase(values.get(0).trim());
    }
}
