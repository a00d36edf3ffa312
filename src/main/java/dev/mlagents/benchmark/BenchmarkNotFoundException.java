package dev.mlagents.benchmark;

import dev.mlagents.eval.EvaluationException;

public class BenchmarkNotFoundException extends EvaluationException {

    public BenchmarkNotFoundException(String benchmarkId) {
        super("Benchmark not found: " + benchmarkId);
    }
}
