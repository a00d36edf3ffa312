package dev.mlagents.trace;

import dev.mlagents.config.MlAgentsConfig;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SdkTracerProviderBuilder;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for tracing setup. Evaluations and questions are recorded as OpenTelemetry spans;
 * this class wires an SDK for callers that do not bring their own.
 */
@Slf4j
public final class EvalTracing {
    public static final AttributeKey<String> EVALUATION_ID =
            AttributeKey.stringKey("mlagents.evaluation.id");
    public static final AttributeKey<String> BENCHMARK_ID =
            AttributeKey.stringKey("mlagents.benchmark.id");
    public static final AttributeKey<String> STRATEGY = AttributeKey.stringKey("mlagents.strategy");
    public static final AttributeKey<String> MODEL = AttributeKey.stringKey("mlagents.model");
    public static final AttributeKey<String> QUESTION_ID =
            AttributeKey.stringKey("mlagents.question.id");
    public static final AttributeKey<Long> ATTEMPT = AttributeKey.longKey("mlagents.attempt");
    public static final AttributeKey<String> STATUS = AttributeKey.stringKey("mlagents.status");
    public static final AttributeKey<String> FAILURE_REASON =
            AttributeKey.stringKey("mlagents.failure.reason");

    static final String OTEL_SERVICE_NAME = "mlagents-app";
    static final String INSTRUMENTATION_NAME = "mlagents-java";
    static final String INSTRUMENTATION_VERSION = loadVersionFromProperties();

    /** Sets up a global OpenTelemetry SDK configured from the environment. */
    public static OpenTelemetry quickstart() {
        return of(MlAgentsConfig.fromEnvironment(), true);
    }

    /**
     * Builds an OpenTelemetry SDK for the evaluation engine. When {@code
     * MLAGENTS_ENABLE_TRACE_CONSOLE_LOG} is set, finished spans are written to the log, with their
     * attributes and events when {@code MLAGENTS_DEBUG} is set too.
     */
    public static OpenTelemetry of(@Nonnull MlAgentsConfig config, boolean registerGlobal) {
        var tracerBuilder = SdkTracerProvider.builder();
        enable(config, tracerBuilder);
        var tracerProvider = tracerBuilder.build();
        var openTelemetry = OpenTelemetrySdk.builder().setTracerProvider(tracerProvider).build();
        if (registerGlobal) {
            GlobalOpenTelemetry.set(openTelemetry);
            log.debug("Registered OpenTelemetry globally");
        }
        Runtime.getRuntime()
                .addShutdownHook(
                        new Thread(
                                () -> {
                                    var result =
                                            tracerProvider.shutdown().join(10, TimeUnit.SECONDS);
                                    log.debug(
                                            "otel shutdown complete. done: {}, successful: {}",
                                            result.isDone(),
                                            result.isSuccess());
                                }));
        return openTelemetry;
    }

    /** Adds the engine's resource and span processors to an existing tracer provider builder. */
    public static void enable(
            @Nonnull MlAgentsConfig config,
            @Nonnull SdkTracerProviderBuilder tracerProviderBuilder) {
        log.info(
                "Initializing OpenTelemetry with service={}, instrumentation-name={},"
                        + " instrumentation-version={}, jvm-version={}",
                OTEL_SERVICE_NAME,
                INSTRUMENTATION_NAME,
                INSTRUMENTATION_VERSION,
                System.getProperty("java.runtime.version"));
        var resource =
                Resource.getDefault().toBuilder()
                        .put(AttributeKey.stringKey("service.name"), OTEL_SERVICE_NAME)
                        .put(AttributeKey.stringKey("service.version"), INSTRUMENTATION_VERSION)
                        .build();
        tracerProviderBuilder.addResource(resource);
        if (config.enableTraceConsoleLog()) {
            tracerProviderBuilder.addSpanProcessor(
                    SimpleSpanProcessor.create(new LoggingSpanExporter(config.debug())));
        }
    }

    /** Gets a tracer from the global OpenTelemetry instance. */
    public static Tracer getTracer() {
        return getTracer(GlobalOpenTelemetry.get());
    }

    /** Gets a tracer from a specific OpenTelemetry instance. */
    public static Tracer getTracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME, INSTRUMENTATION_VERSION);
    }

    private static String loadVersionFromProperties() {
        try (var is = EvalTracing.class.getResourceAsStream("/mlagents.properties")) {
            var props = new Properties();
            props.load(is);
            return props.getProperty("sdk.version");
        } catch (Exception e) {
            throw new IllegalStateException("unable to determine sdk version", e);
        }
    }

    private EvalTracing() {}
}
