package com.property.linkage.bulk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.property.linkage.api.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Writes a {@link RunSummary} as pretty-printed JSON.
 */
public class SummaryJsonWriter {
    private static final Logger log = LoggerFactory.getLogger(SummaryJsonWriter.class);

    private final ObjectMapper mapper;

    public SummaryJsonWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public SummaryJsonWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void write(RunSummary summary, Path file) {
        try {
            mapper.writeValue(file.toFile(), summary);
            log.info("summary.written file={} datasets={}", file, summary.datasets().size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write run summary to " + file, e);
        }
    }

    public String toJson(RunSummary summary) {
        try {
            return mapper.writeValueAsString(summary);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize run summary", e);
        }
    }
}
