package de.bsommerfeld.harvester.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationModeTest {

    @Test
    void parse_shouldDefaultToProd() {
        assertEquals(ApplicationMode.PROD, ApplicationMode.parse(null));
        assertEquals(ApplicationMode.PROD, ApplicationMode.parse(""));
    }

    @Test
    void parse_shouldBeCaseInsensitive() {
        assertEquals(ApplicationMode.TEST, ApplicationMode.parse("test"));
        assertTrue(ApplicationMode.parse(" Test ").isTest());
    }

    @Test
    void parse_shouldFallBackToProdForUnknownValues() {
        assertEquals(ApplicationMode.PROD, ApplicationMode.parse("staging"));
    }

    @Test
    void get_shouldHonorSystemProperty() {
        String previous = System.getProperty("harvester.mode");
        try {
            System.setProperty("harvester.mode", "TEST");
            assertEquals(ApplicationMode.TEST, ApplicationMode.get());
        } finally {
            if (previous == null) {
                System.clearProperty("harvester.mode");
            } else {
                System.setProperty("harvester.mode", previous);
            }
        }
    }
}
