package dev.mlagents.trace;

import dev.mlagents.log.MlAgentsLogger;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Writes finished spans to the mlagents logger. Meant for local debugging of evaluation runs.
 * Verbose mode ({@code MLAGENTS_DEBUG}) adds span attributes and one line per event.
 */
public class LoggingSpanExporter implements SpanExporter {
    private final boolean verbose;

    public LoggingSpanExporter() {
        this(false);
    }

    public LoggingSpanExporter(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public CompletableResultCode export(Collection<SpanData> spans) {
        for (SpanData span : spans) {
            describe(span).forEach(line -> MlAgentsLogger.info("{}", line));
        }
        return CompletableResultCode.ofSuccess();
    }

    List<String> describe(SpanData span) {
        long durationMs =
                TimeUnit.NANOSECONDS.toMillis(span.getEndEpochNanos() - span.getStartEpochNanos());
        var lines = new ArrayList<String>();
        lines.add(
                "span: name=%s, traceId=%s, spanId=%s, status=%s, durationMs=%d"
                        .formatted(
                                span.getName(),
                                span.getTraceId(),
                                span.getSpanId(),
                                span.getStatus().getStatusCode(),
                                durationMs));
        if (verbose) {
            lines.add("  attributes: " + span.getAttributes());
            span.getEvents()
                    .forEach(
                            event ->
                                    lines.add(
                                            "  event: %s %s"
                                                    .formatted(
                                                            event.getName(),
                                                            event.getAttributes())));
        }
        return lines;
    }

    @Override
    public CompletableResultCode flush() {
        return CompletableResultCode.ofSuccess();
    }

    @Override
    public CompletableResultCode shutdown() {
        return CompletableResultCode.ofSuccess();
    }
}
