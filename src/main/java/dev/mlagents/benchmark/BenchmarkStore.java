package dev.mlagents.benchmark;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read access to ingested benchmarks. Question sequences are finite and re-readable without side
 * effects; the same benchmark id always yields the same questions in the same order.
 */
public interface BenchmarkStore {
    /** Ordered questions of a benchmark. Throws {@link BenchmarkNotFoundException} if unknown. */
    List<Question> questions(String benchmarkId);

    /** Whether a benchmark with the given id has been ingested. */
    boolean exists(String benchmarkId);

    /** Ids of every known benchmark. */
    Set<String> benchmarkIds();

    /** Implementation for embedding and test doubling */
    class InMemoryImpl implements BenchmarkStore {
        private final Map<String, List<Question>> benchmarks = new ConcurrentHashMap<>();

        public InMemoryImpl() {}

        public InMemoryImpl(Map<String, List<Question>> benchmarks) {
            benchmarks.forEach(this::put);
        }

        /** Registers (or replaces) a benchmark. Question ids must be unique within it. */
        public InMemoryImpl put(String benchmarkId, List<Question> questions) {
            var byId = new LinkedHashMap<String, Question>();
            for (var question : questions) {
                if (byId.putIfAbsent(question.id(), question) != null) {
                    throw new IllegalArgumentException(
                            "duplicate question id '%s' in benchmark %s"
                                    .formatted(question.id(), benchmarkId));
                }
            }
            benchmarks.put(benchmarkId, List.copyOf(byId.values()));
            return this;
        }

        @Override
        public List<Question> questions(String benchmarkId) {
            var questions = benchmarks.get(benchmarkId);
            if (questions == null) {
                throw new BenchmarkNotFoundException(benchmarkId);
            }
            return questions;
        }

        @Override
        public boolean exists(String benchmarkId) {
            return benchmarks.containsKey(benchmarkId);
        }

        @Override
        public Set<String> benchmarkIds() {
            return Set.copyOf(benchmarks.keySet());
        }
    }
}
