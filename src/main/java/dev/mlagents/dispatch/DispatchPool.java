package dev.mlagents.dispatch;

import dev.mlagents.agent.AgentConfig;
import dev.mlagents.agent.AgentRunner;
import dev.mlagents.benchmark.Question;
import dev.mlagents.failure.FailureClassifier;
import dev.mlagents.failure.FailureReason;
import dev.mlagents.gateway.LLMGateway;
import dev.mlagents.retry.RetryPolicy;
import dev.mlagents.trace.EvalTracing;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs questions against the model with at most {@code maxConcurrency} attempts in flight.
 *
 * <p>Each question goes through build request, gateway call, parse. Failures are classified and
 * handed to the {@link RetryPolicy}; a retry is put on the scheduler for its back-off delay and
 * holds no worker while it waits. Questions are independent and settle in no particular order.
 *
 * <p>After {@link #stopAccepting()} queued attempts and pending back-offs are dropped and their
 * futures complete with an {@link Settlement.Status#ABANDONED abandoned} settlement. Attempts
 * already talking to the model run to completion; one that then fails with a retryable reason is
 * abandoned as well instead of settling as failed.
 */
@Slf4j
public class DispatchPool implements AutoCloseable {
    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final LLMGateway gateway;
    private final RetryPolicy retryPolicy;
    private final FailureClassifier classifier;
    private final Duration requestTimeout;
    private final ScheduledExecutorService scheduler;
    private final Tracer tracer;
    private final ExecutorService workers;
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final Set<Unit> backingOff = ConcurrentHashMap.newKeySet();

    public DispatchPool(
            int maxConcurrency,
            LLMGateway gateway,
            RetryPolicy retryPolicy,
            FailureClassifier classifier,
            Duration requestTimeout,
            ScheduledExecutorService scheduler,
            Tracer tracer) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException(
                    "maxConcurrency must be positive: " + maxConcurrency);
        }
        this.gateway = gateway;
        this.retryPolicy = retryPolicy;
        this.classifier = classifier;
        this.requestTimeout = requestTimeout;
        this.scheduler = scheduler;
        this.tracer = tracer;
        var poolId = POOL_COUNTER.incrementAndGet();
        var threadCounter = new AtomicInteger();
        this.workers =
                Executors.newFixedThreadPool(
                        maxConcurrency,
                        runnable -> {
                            var name =
                                    "mlagents-dispatch-%d-%d"
                                            .formatted(poolId, threadCounter.incrementAndGet());
                            var thread = new Thread(runnable, name);
                            thread.setDaemon(true);
                            return thread;
                        });
    }

    /**
     * Admits a question. The returned future completes once the question succeeded, failed for
     * good (after {@link SettlementListener#onSettled} returned) or was abandoned.
     *
     * @param parentContext trace context the question span is created under
     */
    public CompletableFuture<Settlement> dispatch(
            Question question,
            AgentRunner runner,
            AgentConfig config,
            SettlementListener listener,
            Context parentContext) {
        var span =
                tracer.spanBuilder("question")
                        .setParent(parentContext)
                        .setSpanKind(SpanKind.INTERNAL)
                        .setAttribute(EvalTracing.QUESTION_ID, question.id())
                        .startSpan();
        var unit = new Unit(question, runner, config, listener, span, System.nanoTime());
        submit(unit);
        return unit.future;
    }

    /** Stops admitting attempts. Back-offs still waiting are cancelled and abandoned. */
    public void stopAccepting() {
        if (!accepting.getAndSet(false)) {
            return;
        }
        log.debug("dispatch stopped; {} question(s) backing off", backingOff.size());
        for (var unit : backingOff) {
            var retry = unit.retry;
            if (retry != null && retry.cancel(false)) {
                backingOff.remove(unit);
                abandon(unit);
            }
        }
    }

    public boolean isAccepting() {
        return accepting.get();
    }

    @Override
    public void close() {
        stopAccepting();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(requestTimeout.toMillis() * 2, TimeUnit.MILLISECONDS)) {
                log.warn("dispatch workers still busy after shutdown; interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void submit(Unit unit) {
        if (!accepting.get()) {
            abandon(unit);
            return;
        }
        try {
            workers.execute(() -> attempt(unit));
        } catch (RejectedExecutionException e) {
            log.debug("attempt for question {} rejected; pool shut down", unit.question.id());
            abandon(unit);
        }
    }

    private void attempt(Unit unit) {
        if (!accepting.get()) {
            abandon(unit);
            return;
        }
        int attempt = unit.attempts + 1;
        unit.attempts = attempt;
        var question = unit.question;
        FailureReason reason;
        String details;
        try {
            var request = unit.runner.buildRequest(question, unit.config);
            var outcome = gateway.execute(request, requestTimeout);
            if (outcome.isSuccess()) {
                var parsed = unit.runner.parseAnswer(outcome.response());
                if (parsed.isSuccess()) {
                    recordAttempt(unit, attempt, "succeeded", null);
                    settle(
                            unit,
                            Settlement.succeeded(
                                    question.id(), parsed.answer(), attempt, unit.elapsed()));
                    return;
                }
                reason = FailureReason.MALFORMED_RESPONSE;
                details = parsed.failure();
            } else {
                reason = classifier.classify(outcome.error());
                details = outcome.error().describe();
            }
        } catch (RuntimeException e) {
            reason = FailureReason.UNKNOWN;
            details = e.toString();
        } catch (Error e) {
            fail(unit, e);
            throw e;
        }
        if (reason == FailureReason.UNKNOWN) {
            log.warn(
                    "unclassified failure for question {} (attempt {}): {}",
                    question.id(),
                    attempt,
                    details);
        }
        recordAttempt(unit, attempt, reason.code(), details);

        var decision = retryPolicy.decide(reason, attempt);
        if (decision.shouldRetry() && !accepting.get()) {
            // the question keeps no terminal result and is dispatched again on resume
            log.debug(
                    "question {} attempt {} failed ({}) after dispatch stopped",
                    question.id(),
                    attempt,
                    reason);
            abandon(unit);
        } else if (decision.shouldRetry()) {
            var delay = decision.delay().orElseThrow();
            log.debug(
                    "question {} attempt {} failed ({}); retrying in {} ms",
                    question.id(),
                    attempt,
                    reason,
                    delay.toMillis());
            try {
                unit.listener.onRetryScheduled(question, attempt, reason, details, delay);
            } catch (RuntimeException e) {
                fail(unit, e);
                return;
            }
            scheduleRetry(unit, delay);
        } else {
            settle(
                    unit,
                    Settlement.failed(question.id(), reason, details, attempt, unit.elapsed()));
        }
    }

    private void scheduleRetry(Unit unit, Duration delay) {
        backingOff.add(unit);
        try {
            unit.retry =
                    scheduler.schedule(
                            () -> {
                                backingOff.remove(unit);
                                submit(unit);
                            },
                            delay.toMillis(),
                            TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            backingOff.remove(unit);
            abandon(unit);
            return;
        }
        // stopAccepting may have run before the retry handle was assigned
        if (!accepting.get() && unit.retry.cancel(false)) {
            backingOff.remove(unit);
            abandon(unit);
        }
    }

    private void recordAttempt(Unit unit, int attempt, String outcome, @Nullable String details) {
        var attributes =
                Attributes.builder()
                        .put(EvalTracing.ATTEMPT, (long) attempt)
                        .put(EvalTracing.STATUS, outcome);
        if (details != null) {
            attributes.put("mlagents.details", details);
        }
        unit.span.addEvent("attempt", attributes.build());
    }

    private void settle(Unit unit, Settlement settlement) {
        if (!unit.finished.compareAndSet(false, true)) {
            return;
        }
        unit.span.setAttribute(EvalTracing.ATTEMPT, (long) settlement.attempts());
        unit.span.setAttribute(
                EvalTracing.STATUS, settlement.status().name().toLowerCase(Locale.ROOT));
        settlement
                .failureReason()
                .ifPresent(
                        reason -> {
                            unit.span.setAttribute(EvalTracing.FAILURE_REASON, reason.code());
                            unit.span.setStatus(StatusCode.ERROR, reason.description());
                        });
        try {
            unit.listener.onSettled(unit.question, settlement);
            unit.future.complete(settlement);
        } catch (RuntimeException e) {
            unit.span.recordException(e);
            unit.future.completeExceptionally(e);
        } catch (Error e) {
            unit.span.recordException(e);
            unit.future.completeExceptionally(e);
            throw e;
        } finally {
            unit.span.end();
        }
    }

    private void fail(Unit unit, Throwable error) {
        if (!unit.finished.compareAndSet(false, true)) {
            return;
        }
        unit.span.recordException(error);
        unit.span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
        unit.span.end();
        unit.future.completeExceptionally(error);
    }

    private void abandon(Unit unit) {
        if (!unit.finished.compareAndSet(false, true)) {
            return;
        }
        unit.span.setAttribute(EvalTracing.STATUS, "abandoned");
        unit.span.end();
        unit.future.complete(
                Settlement.abandoned(unit.question.id(), unit.attempts, unit.elapsed()));
    }

    private static final class Unit {
        final Question question;
        final AgentRunner runner;
        final AgentConfig config;
        final SettlementListener listener;
        final Span span;
        final long startNanos;
        final CompletableFuture<Settlement> future = new CompletableFuture<>();
        final AtomicBoolean finished = new AtomicBoolean();
        // written only by the worker running the current attempt
        volatile int attempts;
        volatile ScheduledFuture<?> retry;

        Unit(
                Question question,
                AgentRunner runner,
                AgentConfig config,
                SettlementListener listener,
                Span span,
                long startNanos) {
            this.question = question;
            this.runner = runner;
            this.config = config;
            this.listener = listener;
            this.span = span;
            this.startNanos = startNanos;
        }

        Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }
    }
}
