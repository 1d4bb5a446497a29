package organ.converter;

/**
 * Fire-and-forget notification at coarse phase boundaries. Called synchronously on the converting thread.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = message -> { };

    void onProgress(String message);
}
