package dev.mlagents.trace;

import static org.junit.jupiter.api.Assertions.*;

import dev.mlagents.config.MlAgentsConfig;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

public class EvalTracingTest {

    @Test
    void enableAddsServiceResource() {
        var exporter = InMemorySpanExporter.create();
        var builder =
                SdkTracerProvider.builder().addSpanProcessor(SimpleSpanProcessor.create(exporter));
        EvalTracing.enable(MlAgentsConfig.of(), builder);
        try (var provider = builder.build()) {
            provider.get("test").spanBuilder("evaluation").startSpan().end();

            var span = exporter.getFinishedSpanItems().get(0);
            assertEquals(
                    "mlagents-app",
                    span.getResource().getAttribute(AttributeKey.stringKey("service.name")));
            assertNotNull(
                    span.getResource().getAttribute(AttributeKey.stringKey("service.version")));
        }
    }

    @Test
    void tracerFromSdkRecordsSpans() {
        var openTelemetry =
                EvalTracing.of(
                        MlAgentsConfig.of("MLAGENTS_ENABLE_TRACE_CONSOLE_LOG", "true"), false);

        var span = EvalTracing.getTracer(openTelemetry).spanBuilder("evaluation").startSpan();
        span.setAttribute(EvalTracing.EVALUATION_ID, "e1");
        span.addEvent("attempt", Attributes.of(EvalTracing.ATTEMPT, 1L));

        assertTrue(span.isRecording());
        span.end();
    }

    @Test
    void loggingExporterAcceptsSpans() {
        var exporter = new LoggingSpanExporter();
        var provider =
                SdkTracerProvider.builder()
                        .addSpanProcessor(SimpleSpanProcessor.create(exporter))
                        .build();
        provider.get("test").spanBuilder("question").startSpan().end();

        assertTrue(exporter.flush().isSuccess());
        assertTrue(provider.shutdown().join(1, TimeUnit.SECONDS).isSuccess());
    }

    @Test
    void debugModeDescribesAttributesAndEvents() {
        var spans = InMemorySpanExporter.create();
        try (var provider =
                SdkTracerProvider.builder()
                        .addSpanProcessor(SimpleSpanProcessor.create(spans))
                        .build()) {
            var span = provider.get("test").spanBuilder("question").startSpan();
            span.setAttribute(EvalTracing.QUESTION_ID, "q1");
            span.addEvent("attempt", Attributes.of(EvalTracing.ATTEMPT, 1L));
            span.end();
        }
        var finished = spans.getFinishedSpanItems().get(0);

        var brief = new LoggingSpanExporter(false).describe(finished);
        var verbose = new LoggingSpanExporter(true).describe(finished);

        assertEquals(1, brief.size());
        assertTrue(brief.get(0).startsWith("span: name=question"));
        assertEquals(3, verbose.size());
        assertTrue(verbose.get(1).contains("q1"));
        assertTrue(verbose.get(2).startsWith("  event: attempt"));
    }
}
