package com.rollup.service.flush;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.rollup.service.model.AnalyticsEvent;
import com.rollup.service.model.RollupKeys;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.zip.GZIPOutputStream;

/**
 * Writes raw event batches as gzipped JSON lines, one file per batch:
 * {@code <directory>/<yyyy-MM-dd>/events-<epochMillis>-<n>.jsonl.gz}.
 */
@Slf4j
public class JsonLinesRawEventExporter implements RawEventExporter {

    private static final String FILE_PREFIX = "events-";
    private static final String FILE_SUFFIX = ".jsonl.gz";

    private final Path directory;
    private final ObjectWriter writer;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public JsonLinesRawEventExporter(Path directory, ObjectMapper objectMapper) {
        this(directory, objectMapper, Clock.systemUTC());
    }

    public JsonLinesRawEventExporter(Path directory, ObjectMapper objectMapper, Clock clock) {
        this.directory = directory;
        this.writer = objectMapper.writerFor(AnalyticsEvent.class)
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        this.clock = clock;
        log.info("Raw events will be exported to {}", directory.toAbsolutePath());
    }

    @Override
    public void export(List<AnalyticsEvent> events) throws IOException {
        if (events.isEmpty()) {
            return;
        }
        Path target = nextFile();
        Files.createDirectories(target.getParent());

        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(target));
             Writer lines = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8))) {
            for (AnalyticsEvent event : events) {
                writer.writeValue(lines, event);
                lines.write('\n');
            }
        }
        log.info("Exported {} raw events to {}", events.size(), target);
    }

    private Path nextFile() {
        var now = clock.instant();
        String fileName = FILE_PREFIX + now.toEpochMilli() + "-" + sequence.incrementAndGet() + FILE_SUFFIX;
        return directory.resolve(RollupKeys.dateOf(now)).resolve(fileName);
    }

    public Path getDirectory() {
        return directory;
    }
}
