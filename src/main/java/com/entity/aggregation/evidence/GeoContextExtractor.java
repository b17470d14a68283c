package com.entity.aggregation.evidence;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds address or venue text in post snippets. Only text that is literally present is
 * returned; nothing is inferred or completed.
 *
 * <p>Patterns, strongest first:</p>
 * <ol>
 *   <li>street address: {@code 12 Rue de Rivoli}, {@code 500 Castro St}</li>
 *   <li>location pin: {@code 📍 Le Marais, Paris}</li>
 *   <li>venue phrase: capitalized words after "at" or "in", e.g. {@code at Blue Bottle Coffee}</li>
 * </ol>
 */
public class GeoContextExtractor {

    private static final Pattern STREET_ADDRESS = Pattern.compile(
            "\\b\\d{1,5}\\s+(?i:rue|calle|via)\\s+(?:[\\p{L}'’.-]+\\s+){0,2}[\\p{L}'’.-]+"
                    + "|\\b\\d{1,5}\\s+(?:\\p{Lu}[\\p{L}'’.-]*\\s+){1,4}"
                    + "(?:St|Street|Ave|Avenue|Rd|Road|Blvd|Boulevard|Ln|Lane|Dr|Drive|Way|Pl|Place|Sq|Square)\\b\\.?");

    private static final Pattern PIN = Pattern.compile("📍\\s*([^\\n#|]+)");

    private static final Pattern VENUE = Pattern.compile(
            "\\b(?i:at|in)\\s+((?:[Tt]he\\s+)?\\p{Lu}[\\p{L}'’&-]*(?:\\s+\\p{Lu}[\\p{L}'’&-]*){0,4})");

    public Optional<String> extract(String snippet) {
        if (snippet == null || snippet.isBlank()) {
            return Optional.empty();
        }
        Matcher address = STREET_ADDRESS.matcher(snippet);
        if (address.find()) {
            return Optional.of(clean(address.group()));
        }
        Matcher pin = PIN.matcher(snippet);
        if (pin.find() && !clean(pin.group(1)).isEmpty()) {
            return Optional.of(clean(pin.group(1)));
        }
        Matcher venue = VENUE.matcher(snippet);
        if (venue.find()) {
            return Optional.of(clean(venue.group(1)));
        }
        return Optional.empty();
    }

    /**
     * First context found, scanning snippets in the given order.
     */
    public Optional<String> extractFirst(List<String> snippets) {
        for (String snippet : snippets) {
            Optional<String> found = extract(snippet);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private static String clean(String text) {
        return text.trim().replaceAll("[\\s,.;:!?]+$", "").replaceAll("\\s+", " ");
    }
}
