package dev.careercrawler.service;

import dev.careercrawler.config.PreferencesConfig;
import dev.careercrawler.model.CandidatePosting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a candidate posting matches the user's preferences.
 * Stateless: the verdict depends only on the candidate and the preferences passed in.
 */
@Slf4j
@Service
public class PreferenceFilter {

    /**
     * Result of a preference check.
     */
    public record FilterVerdict(
            boolean accepted,
            String rejectReason) {

        public static FilterVerdict accept() {
            return new FilterVerdict(true, null);
        }

        public static FilterVerdict reject(String reason) {
            return new FilterVerdict(false, reason);
        }
    }

    public boolean accepts(CandidatePosting candidate, PreferencesConfig preferences) {
        return evaluate(candidate, preferences).accepted();
    }

    /**
     * Run the checks in order: exclusions, title, location, seniority, department.
     * The first failing check rejects the candidate.
     *
     * @param candidate   the posting to check
     * @param preferences the user's preferences
     * @return FilterVerdict with the decision and, when rejected, the reason
     */
    public FilterVerdict evaluate(CandidatePosting candidate, PreferencesConfig preferences) {
        if (candidate == null) {
            return FilterVerdict.reject("Null candidate");
        }

        String title = lower(candidate.getTitle());
        String description = lower(candidate.getDescription());
        String location = lower(candidate.getLocation());
        String combined = title + " " + description;

        // 1. Exclusion keywords
        for (String exclusion : normalize(preferences.getExclusions())) {
            if (combined.contains(exclusion)) {
                log.debug("Filtering out '{}' by exclusion keyword: {}", candidate.getTitle(), exclusion);
                return FilterVerdict.reject("Excluded keyword: " + exclusion);
            }
        }

        // 2. Preferred titles, no constraint when none configured
        List<String> titles = normalize(preferences.getTitles());
        if (!titles.isEmpty() && titles.stream().noneMatch(title::contains)) {
            log.debug("Filtering out '{}' by title keywords", candidate.getTitle());
            return FilterVerdict.reject("Title not preferred");
        }

        // 3. Location
        List<String> locationPrefs = preferences.getLocation();
        if (!PreferencesConfig.isAny(locationPrefs) && locationPrefs != null) {
            List<String> excluded = locationPrefs.stream()
                    .filter(PreferenceFilter::isExcludeEntry)
                    .map(value -> value.trim().substring(PreferencesConfig.EXCLUDE_PREFIX.length()))
                    .map(value -> value.trim().toLowerCase(Locale.ROOT))
                    .filter(value -> !value.isEmpty())
                    .toList();
            List<String> included = normalize(locationPrefs.stream()
                    .filter(value -> !isExcludeEntry(value))
                    .toList());

            for (String excludedLocation : excluded) {
                if (location.contains(excludedLocation)) {
                    log.debug("Filtering out '{}' by excluded location '{}'", candidate.getTitle(), location);
                    return FilterVerdict.reject("Excluded location: " + excludedLocation);
                }
            }
            if (!included.isEmpty() && included.stream().noneMatch(location::contains)) {
                log.debug("Filtering out '{}': location '{}' not in preferred list", candidate.getTitle(), location);
                return FilterVerdict.reject("Location not preferred");
            }
        }

        // 4. Seniority, matched against the title only
        List<String> seniority = preferences.getSeniority();
        if (!PreferencesConfig.isAny(seniority)) {
            List<String> levels = normalize(seniority);
            if (!levels.isEmpty() && levels.stream().noneMatch(title::contains)) {
                log.debug("Filtering out '{}' by seniority", candidate.getTitle());
                return FilterVerdict.reject("Seniority not preferred");
            }
        }

        // 5. Department is configurable but cannot be detected from a link; never enforced
        if (!PreferencesConfig.isAny(preferences.getDepartment())) {
            log.trace("Department filtering not implemented. Skipping check for: {}", candidate.getTitle());
        }

        log.debug("Candidate passed filters: {}", candidate.getTitle());
        return FilterVerdict.accept();
    }

    private static boolean isExcludeEntry(String value) {
        return value != null
                && value.trim().toLowerCase(Locale.ROOT).startsWith(PreferencesConfig.EXCLUDE_PREFIX);
    }

    private static List<String> normalize(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    private static String lower(String text) {
        return text != null ? text.toLowerCase(Locale.ROOT) : "";
    }
}
