package br.com.analytics.pipeline.sales_warehouse_batch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

import java.util.Map;

class CodeMappingsTest {

    private final CodeMappings mappings = CodeMappings.defaults();

    @Test
    void countryOf_knownAliases_resolveToCanonicalCountry() {
        assertEquals("USA", mappings.countryOf("US"));
        assertEquals("USA", mappings.countryOf(" United States "));
        assertEquals("Germany", mappings.countryOf("DE"));
        assertEquals("UK", mappings.countryOf("United Kingdom"));
        assertEquals("Australia", mappings.countryOf("Australia"));
    }

    @Test
    void countryOf_unknownOrBlank_resolvesToNotAvailable() {
        assertEquals("N/A", mappings.countryOf("Unknown Place"));
        assertEquals("N/A", mappings.countryOf(""));
        assertEquals("N/A", mappings.countryOf(null));
    }

    @Test
    void productLineOf_paddedLowerCaseCode_isMatched() {
        assertEquals("Mountain", mappings.productLineOf(" m "));
        assertEquals("Other Sales", mappings.productLineOf("S"));
        assertEquals("N/A", mappings.productLineOf("X"));
    }

    @Test
    void erpGenderOf_wordsAndLetters_areBothAccepted() {
        assertEquals("Male", mappings.erpGenderOf("male"));
        assertEquals("Female", mappings.erpGenderOf("F"));
        assertEquals("N/A", mappings.erpGenderOf(" "));
    }

    @Test
    void constructor_customTable_keysAreNormalized() {
        CodeMappings custom = new CodeMappings(Map.of(), Map.of(), Map.of(), Map.of(),
                Map.of("nl", "Netherlands"), null);

        assertEquals("Netherlands", custom.countryOf("NL"));
        assertEquals("N/A", custom.notAvailable());
    }

    @Test
    void isNotAvailable_sentinelAndNull_areNotAvailable() {
        assertTrue(mappings.isNotAvailable("N/A"));
        assertTrue(mappings.isNotAvailable(null));
        assertFalse(mappings.isNotAvailable("Male"));
    }
}
