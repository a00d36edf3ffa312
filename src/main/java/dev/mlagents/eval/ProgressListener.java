package dev.mlagents.eval;

/** Receives progress updates. Called from dispatch threads; must not block. */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NOOP = progress -> {};

    void onProgress(ProgressInfo progress);
}
