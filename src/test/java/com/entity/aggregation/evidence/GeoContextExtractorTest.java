package com.entity.aggregation.evidence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GeoContextExtractorTest {

    private final GeoContextExtractor extractor = new GeoContextExtractor();

    @ParameterizedTest
    @DisplayName("Should find addresses, pins and venues")
    @CsvSource(delimiter = '|', value = {
            "Lunch at 12 Rue de Rivoli, Paris|12 Rue de Rivoli",
            "Coffee break at 500 Castro St. with friends|500 Castro St",
            "📍 Le Marais, Paris #travel|Le Marais, Paris",
            "Best matcha in Kyoto Japan today|Kyoto Japan",
            "Flat white at Blue Bottle Coffee.|Blue Bottle Coffee"
    })
    void testExtraction(String snippet, String expected) {
        assertEquals(Optional.of(expected), extractor.extract(snippet));
    }

    @Test
    @DisplayName("Should report nothing rather than guess")
    void testAbsence() {
        assertEquals(Optional.empty(), extractor.extract("we stayed in and cooked"));
        assertEquals(Optional.empty(), extractor.extract(""));
        assertEquals(Optional.empty(), extractor.extract(null));
    }

    @Test
    @DisplayName("Should scan snippets in order")
    void testExtractFirst() {
        List<String> snippets = Arrays.asList("no place here", null, "sunset in Lisbon", "at Blue Bottle");

        assertEquals(Optional.of("Lisbon"), extractor.extractFirst(snippets));
    }
}
