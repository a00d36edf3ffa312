package dev.mlagents.eval;

import dev.mlagents.agent.AgentConfig;
import dev.mlagents.agent.AgentRunner;
import dev.mlagents.agent.AgentRunnerRegistry;
import dev.mlagents.benchmark.BenchmarkNotFoundException;
import dev.mlagents.benchmark.BenchmarkStore;
import dev.mlagents.benchmark.Question;
import dev.mlagents.config.MlAgentsConfig;
import dev.mlagents.dispatch.DispatchPool;
import dev.mlagents.dispatch.Settlement;
import dev.mlagents.dispatch.SettlementListener;
import dev.mlagents.failure.FailureClassifier;
import dev.mlagents.failure.FailureReason;
import dev.mlagents.gateway.LLMGateway;
import dev.mlagents.gateway.OpenAiGateway;
import dev.mlagents.retry.ExponentialBackoffRetryPolicy;
import dev.mlagents.retry.RetryPolicy;
import dev.mlagents.store.EvaluationRepository;
import dev.mlagents.store.RepositoryUnavailableException;
import dev.mlagents.store.ResultRepository;
import dev.mlagents.trace.EvalTracing;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives evaluations from creation to a terminal state.
 *
 * <p>A run computes the questions that have no terminal result yet, dispatches them through a
 * bounded {@link DispatchPool} and persists each settled question before counting it as done.
 * Runs are therefore resumable: running the same evaluation again only dispatches what is left.
 *
 * <p>Per-question failures are recorded as data. A provider reporting an invalid configuration, or
 * the result store becoming unavailable, aborts the whole run and leaves the evaluation errored.
 */
@Slf4j
public final class EvaluationOrchestrator implements AutoCloseable {
    private static final Pattern MODEL_ID =
            Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*/[A-Za-z0-9][A-Za-z0-9._:+-]*");

    private final @Nonnull MlAgentsConfig config;
    private final @Nonnull BenchmarkStore benchmarkStore;
    private final @Nonnull EvaluationRepository evaluationRepository;
    private final @Nonnull ResultRepository resultRepository;
    private final @Nonnull LLMGateway gateway;
    private final @Nonnull AgentRunnerRegistry runners;
    private final @Nonnull Tracer tracer;
    private final @Nonnull RetryPolicy retryPolicy;
    private final @Nonnull FailureClassifier classifier;
    private final @Nonnull ScoringFunction scoring;
    private final @Nonnull Clock clock;
    private final @Nonnull ProgressListener progressListener;
    private final ScheduledExecutorService retryScheduler;
    private final Map<String, RunHandle> activeRuns = new ConcurrentHashMap<>();

    private EvaluationOrchestrator(Builder builder) {
        this.config = Objects.requireNonNull(builder.config);
        this.benchmarkStore = Objects.requireNonNull(builder.benchmarkStore);
        this.evaluationRepository = Objects.requireNonNull(builder.evaluationRepository);
        this.resultRepository = Objects.requireNonNull(builder.resultRepository);
        this.gateway = Objects.requireNonNull(builder.gateway);
        this.runners = Objects.requireNonNull(builder.runners);
        this.tracer = Objects.requireNonNull(builder.tracer);
        this.retryPolicy = Objects.requireNonNull(builder.retryPolicy);
        this.classifier = Objects.requireNonNull(builder.classifier);
        this.scoring = new ScoringFunction(builder.defaultMatcher, builder.matchersByBenchmark);
        this.clock = Objects.requireNonNull(builder.clock);
        this.progressListener = Objects.requireNonNull(builder.progressListener);
        this.retryScheduler =
                Executors.newSingleThreadScheduledExecutor(
                        runnable -> {
                            var thread = new Thread(runnable, "mlagents-retry-scheduler");
                            thread.setDaemon(true);
                            return thread;
                        });
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers a new pending evaluation.
     *
     * @throws BenchmarkNotFoundException if the benchmark is unknown
     * @throws InvalidConfigurationException listing every problem with the agent configuration
     */
    public String createEvaluation(String benchmarkId, AgentConfig agentConfig) {
        if (!benchmarkStore.exists(benchmarkId)) {
            throw new BenchmarkNotFoundException(benchmarkId);
        }
        var errors = validate(agentConfig);
        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException(errors);
        }
        var evaluation =
                Evaluation.create(
                        UUID.randomUUID().toString(), benchmarkId, agentConfig, now());
        evaluationRepository.save(evaluation);
        log.info(
                "created evaluation {} (benchmark={}, strategy={}, model={})",
                evaluation.id(),
                benchmarkId,
                agentConfig.strategy(),
                agentConfig.modelId());
        return evaluation.id();
    }

    /**
     * Runs an evaluation until every question has a terminal result, the run is aborted or it is
     * cancelled. Blocks the calling thread; interrupting it cancels the run.
     *
     * @return the evaluation in its final state for this run
     * @throws EvaluationNotFoundException if no evaluation has the id
     * @throws InvalidEvaluationStateException if the evaluation errored earlier or is already
     *     running in this orchestrator
     */
    public Evaluation run(String evaluationId) {
        var evaluation = load(evaluationId);
        if (evaluation.state() == EvaluationState.COMPLETED) {
            log.debug("evaluation {} already completed", evaluationId);
            return evaluation;
        }
        if (evaluation.state() == EvaluationState.ERRORED) {
            throw new InvalidEvaluationStateException(
                    "evaluation %s errored and cannot be run again: %s"
                            .formatted(evaluationId, evaluation.failureSummary().orElse("")));
        }
        var handle = new RunHandle(evaluationId);
        if (activeRuns.putIfAbsent(evaluationId, handle) != null) {
            throw new InvalidEvaluationStateException(
                    "evaluation %s is already running".formatted(evaluationId));
        }
        var span =
                tracer.spanBuilder("evaluation")
                        .setNoParent()
                        .setSpanKind(SpanKind.INTERNAL)
                        .setAttribute(EvalTracing.EVALUATION_ID, evaluationId)
                        .setAttribute(EvalTracing.BENCHMARK_ID, evaluation.benchmarkId())
                        .setAttribute(EvalTracing.STRATEGY, evaluation.agentConfig().strategy())
                        .setAttribute(EvalTracing.MODEL, evaluation.agentConfig().modelId())
                        .startSpan();
        try {
            var finished = execute(evaluation, handle, span);
            span.setAttribute(EvalTracing.STATUS, finished.state().code());
            finished.failureSummary()
                    .ifPresent(summary -> span.setStatus(StatusCode.ERROR, summary));
            return finished;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            throw e;
        } finally {
            activeRuns.remove(evaluationId, handle);
            span.end();
        }
    }

    /**
     * Signals an active run to stop. In-flight attempts finish and their results are kept; the
     * evaluation ends up cancelled and can be resumed with {@link #run(String)}.
     *
     * @return true if a run of this evaluation was active
     */
    public boolean cancel(String evaluationId) {
        var handle = activeRuns.get(evaluationId);
        if (handle == null) {
            return false;
        }
        log.info("cancelling evaluation {}", evaluationId);
        handle.cancel();
        return true;
    }

    /** Current progress of an evaluation, including partial results of errored ones. */
    public EvaluationStatus status(String evaluationId) {
        var evaluation = load(evaluationId);
        int total =
                benchmarkStore.exists(evaluation.benchmarkId())
                        ? benchmarkStore.questions(evaluation.benchmarkId()).size()
                        : 0;
        var results = resultRepository.list(evaluationId);
        int succeeded = 0;
        int failed = 0;
        int retrying = 0;
        int correct = 0;
        var failedByReason = new EnumMap<FailureReason, Integer>(FailureReason.class);
        for (var result : results) {
            if (result.isSucceeded()) {
                succeeded++;
                if (result.isCorrect()) {
                    correct++;
                }
            } else if (result.isFailed()) {
                failed++;
                result.failureReason().ifPresent(r -> failedByReason.merge(r, 1, Integer::sum));
            } else {
                retrying++;
            }
        }
        return new EvaluationStatus(
                evaluationId,
                evaluation.state(),
                total,
                succeeded,
                failed,
                failedByReason,
                retrying,
                Math.max(0, total - results.size()),
                correct,
                evaluation.failureSummary(),
                evaluation.results(),
                evaluation.executionTime());
    }

    /** Every evaluation, newest first, optionally only those in the given state. */
    public List<Evaluation> listEvaluations(Optional<EvaluationState> state) {
        var filter = EvaluationFilter.all();
        return listEvaluations(state.map(filter::withState).orElse(filter));
    }

    /** Evaluations matching the filter, newest first. */
    public List<Evaluation> listEvaluations(EvaluationFilter filter) {
        var matching = evaluationRepository.list().stream().filter(filter::matches);
        if (filter.limit().isPresent()) {
            matching = matching.limit(filter.limit().getAsInt());
        }
        var evaluations = matching.toList();
        log.debug("listed {} evaluation(s) for {}", evaluations.size(), filter);
        return evaluations;
    }

    /**
     * Compares accuracy, execution time and error counts of completed evaluations.
     *
     * @throws IllegalArgumentException if fewer than two ids are given
     * @throws EvaluationNotFoundException if an id is unknown
     * @throws InvalidEvaluationStateException if an evaluation has not completed
     */
    public EvaluationComparison compareEvaluations(List<String> evaluationIds) {
        if (evaluationIds.size() < 2) {
            throw new IllegalArgumentException(
                    "at least 2 evaluations are required for a comparison, got "
                            + evaluationIds.size());
        }
        var evaluations = evaluationIds.stream().map(this::load).toList();
        var comparison = EvaluationComparison.of(evaluations, now());
        log.info(
                "compared {} evaluation(s): best accuracy {}, worst {}",
                evaluations.size(),
                comparison.bestAccuracy(),
                comparison.worstAccuracy());
        return comparison;
    }

    /** Problems with an agent configuration; empty when it can be run. */
    public List<String> validate(AgentConfig agentConfig) {
        var errors = new ArrayList<String>();
        var runner = runners.find(agentConfig.strategy());
        if (runner.isEmpty()) {
            errors.add(
                    "unknown strategy '%s'; available: %s"
                            .formatted(agentConfig.strategy(), runners.strategyIds()));
        }
        if (!MODEL_ID.matcher(agentConfig.modelId()).matches()) {
            errors.add(
                    "model id '%s' is not of the form provider/model"
                            .formatted(agentConfig.modelId()));
        }
        runner.ifPresent(r -> errors.addAll(r.validate(agentConfig)));
        return errors;
    }

    @Override
    public void close() {
        activeRuns.values().forEach(RunHandle::cancel);
        retryScheduler.shutdownNow();
    }

    private Evaluation execute(Evaluation evaluation, RunHandle handle, Span span) {
        var evaluationId = evaluation.id();
        var agentConfig = evaluation.agentConfig();
        var errors = new ArrayList<String>();
        if (!benchmarkStore.exists(evaluation.benchmarkId())) {
            errors.add("benchmark not found: " + evaluation.benchmarkId());
        }
        errors.addAll(validate(agentConfig));
        if (!errors.isEmpty()) {
            return finish(
                    evaluation.fail("invalid configuration: " + String.join("; ", errors), now()));
        }
        var runner = runners.find(agentConfig.strategy()).orElseThrow();

        List<Question> questions;
        Set<String> done;
        try {
            questions = benchmarkStore.questions(evaluation.benchmarkId());
            var terminal = resultRepository.listTerminal(evaluationId);
            done =
                    terminal.stream()
                            .map(EvaluationQuestionResult::questionId)
                            .collect(Collectors.toSet());
            handle.startProgress(questions.size(), terminal, now());
            evaluation = evaluation.start(now());
            evaluationRepository.save(evaluation);
        } catch (RepositoryUnavailableException e) {
            log.error("repository unavailable before dispatching evaluation {}", evaluationId, e);
            return finish(evaluation.fail("repository unavailable: " + e.getMessage(), now()));
        }
        var remaining = questions.stream().filter(q -> !done.contains(q.id())).toList();
        log.info(
                "running evaluation {}: {} of {} question(s) remaining",
                evaluationId,
                remaining.size(),
                questions.size());

        if (!remaining.isEmpty()) {
            dispatchAll(evaluation, runner, remaining, handle, Context.root().with(span));
        }

        var abortSummary = handle.abortSummary.get();
        if (abortSummary != null) {
            log.warn("evaluation {} aborted: {}", evaluationId, abortSummary);
            return finish(evaluation.fail(abortSummary, now()));
        }
        try {
            var terminal = resultRepository.listTerminal(evaluationId);
            if (terminal.size() < questions.size()) {
                if (handle.cancelled) {
                    log.info(
                            "evaluation {} cancelled with {} of {} question(s) settled",
                            evaluationId,
                            terminal.size(),
                            questions.size());
                    return finish(evaluation.cancel(now()));
                }
                return finish(
                        evaluation.fail(
                                "%d question(s) left without a terminal result"
                                        .formatted(questions.size() - terminal.size()),
                                now()));
            }
            var results = scoring.aggregate(questions, terminal);
            log.info(
                    "evaluation {} completed: {}/{} succeeded, accuracy {}%",
                    evaluationId,
                    results.succeeded(),
                    results.total(),
                    results.accuracyPercent());
            return finish(evaluation.complete(results, now()));
        } catch (RepositoryUnavailableException e) {
            log.error("repository unavailable while completing evaluation {}", evaluationId, e);
            return finish(evaluation.fail("repository unavailable: " + e.getMessage(), now()));
        }
    }

    /**
     * Dispatches the first remaining question alone and fans out the rest once its first attempt
     * has an outcome, so a configuration the provider rejects leaves no results behind.
     */
    private void dispatchAll(
            Evaluation evaluation,
            AgentRunner runner,
            List<Question> remaining,
            RunHandle handle,
            Context parentContext) {
        var firstOutcome = new CompletableFuture<Void>();
        var listener = new PersistingListener(evaluation, handle, firstOutcome);
        var agentConfig = evaluation.agentConfig();
        try (var pool =
                new DispatchPool(
                        config.maxConcurrency(),
                        gateway,
                        retryPolicy,
                        classifier,
                        config.requestTimeout(),
                        retryScheduler,
                        tracer)) {
            handle.attach(pool);
            var futures = new ArrayList<CompletableFuture<Settlement>>(remaining.size());
            var first =
                    pool.dispatch(remaining.get(0), runner, agentConfig, listener, parentContext);
            futures.add(first);
            await(CompletableFuture.anyOf(firstOutcome, first), handle);
            for (var question : remaining.subList(1, remaining.size())) {
                if (handle.isStopped()) {
                    break;
                }
                futures.add(pool.dispatch(question, runner, agentConfig, listener, parentContext));
            }
            await(CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)), handle);
        }
    }

    /** Waits for dispatched work. An interrupt cancels the run; in-flight attempts still settle. */
    private void await(CompletableFuture<?> work, RunHandle handle) {
        boolean interrupted = false;
        while (true) {
            try {
                work.get();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
                handle.cancel();
            } catch (ExecutionException e) {
                var cause = e.getCause() == null ? e : e.getCause();
                log.error("evaluation {} run failed", handle.evaluationId, cause);
                handle.abort(describe(cause));
                break;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private Evaluation finish(Evaluation evaluation) {
        evaluationRepository.save(evaluation);
        return evaluation;
    }

    private Evaluation load(String evaluationId) {
        return evaluationRepository
                .load(evaluationId)
                .orElseThrow(() -> new EvaluationNotFoundException(evaluationId));
    }

    private Instant now() {
        return Instant.now(clock);
    }

    private static String describe(Throwable error) {
        if (error instanceof RepositoryUnavailableException) {
            return "repository unavailable: " + error.getMessage();
        }
        return "unexpected error: " + error;
    }

    /** Persists each attempt outcome of one run and feeds progress. */
    private final class PersistingListener implements SettlementListener {
        private final Evaluation evaluation;
        private final RunHandle handle;
        private final CompletableFuture<Void> firstOutcome;

        PersistingListener(
                Evaluation evaluation, RunHandle handle, CompletableFuture<Void> firstOutcome) {
            this.evaluation = evaluation;
            this.handle = handle;
            this.firstOutcome = firstOutcome;
        }

        @Override
        public void onRetryScheduled(
                Question question,
                int attempt,
                FailureReason reason,
                String details,
                Duration delay) {
            try {
                if (handle.isAborted()) {
                    return;
                }
                persist(
                        EvaluationQuestionResult.retrying(
                                evaluation.id(), question.id(), reason, details, attempt, now()));
            } finally {
                firstOutcome.complete(null);
            }
        }

        @Override
        public void onSettled(Question question, Settlement settlement) {
            try {
                record(question, settlement);
            } finally {
                firstOutcome.complete(null);
            }
        }

        private void record(Question question, Settlement settlement) {
            if (handle.isAborted()) {
                log.debug("discarding settlement of question {} after abort", question.id());
                return;
            }
            if (settlement.failureReason().orElse(null) == FailureReason.INVALID_CONFIGURATION) {
                handle.abort(
                        "invalid configuration reported for question %s: %s"
                                .formatted(question.id(), settlement.details()));
                return;
            }
            EvaluationQuestionResult result;
            if (settlement.status() == Settlement.Status.SUCCEEDED) {
                var answer = Objects.requireNonNull(settlement.answer());
                result =
                        EvaluationQuestionResult.succeeded(
                                evaluation.id(),
                                question.id(),
                                answer.value(),
                                answer.reasoning(),
                                scoring.judge(evaluation.benchmarkId(), question, answer.value()),
                                settlement.attempts(),
                                now());
            } else {
                result =
                        EvaluationQuestionResult.failed(
                                evaluation.id(),
                                question.id(),
                                settlement.failureReason().orElseThrow(),
                                settlement.details(),
                                settlement.attempts(),
                                now());
            }
            persist(result);
            reportProgress(handle.recordSettled(result.isSucceeded(), now()));
        }

        private void persist(EvaluationQuestionResult result) {
            try {
                resultRepository.upsert(result);
            } catch (RepositoryUnavailableException e) {
                handle.abort(describe(e));
                throw e;
            }
        }

        private void reportProgress(ProgressInfo progress) {
            try {
                progressListener.onProgress(progress);
            } catch (RuntimeException e) {
                log.warn("progress listener failed for evaluation {}", progress.evaluationId(), e);
            }
        }
    }

    /** State of one active run, shared between the run thread, workers and cancel callers. */
    private static final class RunHandle {
        final String evaluationId;
        final AtomicReference<String> abortSummary = new AtomicReference<>();
        final AtomicReference<DispatchPool> pool = new AtomicReference<>();
        volatile boolean cancelled;
        final AtomicInteger settled = new AtomicInteger();
        final AtomicInteger succeeded = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
        volatile int total;
        volatile Instant startedAt;

        RunHandle(String evaluationId) {
            this.evaluationId = evaluationId;
        }

        void attach(DispatchPool dispatchPool) {
            pool.set(dispatchPool);
            if (isStopped()) {
                dispatchPool.stopAccepting();
            }
        }

        void cancel() {
            cancelled = true;
            stopPool();
        }

        void abort(String summary) {
            abortSummary.compareAndSet(null, summary);
            stopPool();
        }

        boolean isAborted() {
            return abortSummary.get() != null;
        }

        boolean isStopped() {
            return cancelled || isAborted();
        }

        void startProgress(
                int totalQuestions, List<EvaluationQuestionResult> terminal, Instant at) {
            total = totalQuestions;
            startedAt = at;
            settled.set(terminal.size());
            succeeded.set(
                    (int) terminal.stream().filter(EvaluationQuestionResult::isSucceeded).count());
            failed.set(terminal.size() - succeeded.get());
        }

        ProgressInfo recordSettled(boolean success, Instant at) {
            var settledNow = settled.incrementAndGet();
            if (success) {
                succeeded.incrementAndGet();
            } else {
                failed.incrementAndGet();
            }
            return new ProgressInfo(
                    evaluationId, settledNow, total, succeeded.get(), failed.get(), startedAt, at);
        }

        private void stopPool() {
            var current = pool.get();
            if (current != null) {
                current.stopAccepting();
            }
        }
    }

    public static final class Builder {
        private @Nullable MlAgentsConfig config;
        private @Nullable BenchmarkStore benchmarkStore;
        private @Nullable EvaluationRepository evaluationRepository;
        private @Nullable ResultRepository resultRepository;
        private @Nullable LLMGateway gateway;
        private @Nullable AgentRunnerRegistry runners;
        private @Nullable Tracer tracer;
        private @Nullable RetryPolicy retryPolicy;
        private @Nonnull FailureClassifier classifier = new FailureClassifier();
        private @Nonnull AnswerMatcher defaultMatcher = AnswerMatcher.normalized();
        private final Map<String, AnswerMatcher> matchersByBenchmark = new HashMap<>();
        private @Nonnull Clock clock = Clock.systemUTC();
        private @Nonnull ProgressListener progressListener = ProgressListener.NOOP;

        public EvaluationOrchestrator build() {
            if (config == null) {
                config = MlAgentsConfig.fromEnvironment();
            }
            Objects.requireNonNull(benchmarkStore, "benchmarkStore is required");
            if (evaluationRepository == null) {
                evaluationRepository = new EvaluationRepository.InMemoryImpl();
            }
            if (resultRepository == null) {
                resultRepository = new ResultRepository.InMemoryImpl();
            }
            if (gateway == null) {
                gateway = OpenAiGateway.of(config);
            }
            if (runners == null) {
                runners = AgentRunnerRegistry.defaults();
            }
            if (tracer == null) {
                tracer = EvalTracing.getTracer();
            }
            if (retryPolicy == null) {
                retryPolicy = ExponentialBackoffRetryPolicy.fromConfig(config);
            }
            return new EvaluationOrchestrator(this);
        }

        public Builder config(@Nonnull MlAgentsConfig config) {
            this.config = Objects.requireNonNull(config);
            return this;
        }

        public Builder benchmarkStore(@Nonnull BenchmarkStore benchmarkStore) {
            this.benchmarkStore = Objects.requireNonNull(benchmarkStore);
            return this;
        }

        public Builder evaluationRepository(@Nonnull EvaluationRepository evaluationRepository) {
            this.evaluationRepository = Objects.requireNonNull(evaluationRepository);
            return this;
        }

        public Builder resultRepository(@Nonnull ResultRepository resultRepository) {
            this.resultRepository = Objects.requireNonNull(resultRepository);
            return this;
        }

        public Builder gateway(@Nonnull LLMGateway gateway) {
            this.gateway = Objects.requireNonNull(gateway);
            return this;
        }

        public Builder runners(@Nonnull AgentRunnerRegistry runners) {
            this.runners = Objects.requireNonNull(runners);
            return this;
        }

        public Builder tracer(@Nonnull Tracer tracer) {
            this.tracer = Objects.requireNonNull(tracer);
            return this;
        }

        public Builder retryPolicy(@Nonnull RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy);
            return this;
        }

        public Builder classifier(@Nonnull FailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier);
            return this;
        }

        public Builder defaultAnswerMatcher(@Nonnull AnswerMatcher matcher) {
            this.defaultMatcher = Objects.requireNonNull(matcher);
            return this;
        }

        /** Uses a specific matcher for one benchmark, e.g. numeric tolerance for math sets. */
        public Builder answerMatcher(@Nonnull String benchmarkId, @Nonnull AnswerMatcher matcher) {
            this.matchersByBenchmark.put(
                    Objects.requireNonNull(benchmarkId), Objects.requireNonNull(matcher));
            return this;
        }

        public Builder clock(@Nonnull Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public Builder progressListener(@Nonnull ProgressListener progressListener) {
            this.progressListener = Objects.requireNonNull(progressListener);
            return this;
        }
    }
}
