package de.bsommerfeld.harvester.cli;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HarvesterMainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return HarvesterMain.run(args, Map.of(),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void run_shouldExitWithUsageCodeOnBadArguments() {
        int code = run("--project");

        assertEquals(HarvesterMain.EXIT_USAGE, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage:"));
    }

    @Test
    void run_shouldExitWithUsageCodeWithoutToken() {
        assertEquals(HarvesterMain.EXIT_USAGE, run("--project", "p1"));
    }

    @Test
    void run_shouldPrintUsageForHelp() {
        assertEquals(HarvesterMain.EXIT_OK, run("--help"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("--list-projects"));
    }

    @Test
    void run_shouldSetLogDirectoryProperty() {
        run("--help");

        assertTrue(System.getProperty(HarvesterMain.LOG_DIR_PROPERTY).endsWith("logs"));
    }
}
