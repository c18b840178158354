package de.bsommerfeld.harvester.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.bsommerfeld.harvester.core.domain.HarvestReport;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a {@link HarvestReport} as indented JSON.
 */
final class ReportWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private ReportWriter() {
    }

    static void write(HarvestReport report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        MAPPER.writeValue(target.toFile(), report);
    }

    static void write(HarvestReport report, OutputStream out) throws IOException {
        out.write(MAPPER.writeValueAsBytes(report));
        out.write('\n');
        out.flush();
    }
}
