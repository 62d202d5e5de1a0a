package com.proposalmind.core.engine;

/**
 * Fire-and-forget observer of a pipeline run. Stages are {@code start}, {@code level},
 * {@code agent}, {@code complete} and {@code error}. Listeners have no influence on
 * control flow; an exception thrown by a listener is logged and ignored.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (stage, message) -> { };

    void onProgress(String stage, String message);
}
