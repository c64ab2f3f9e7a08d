package com.tether.process;

/**
 * Outcome of a bounded child-process run.
 *
 * @param completed false when the process could not be launched, timed out or was interrupted
 * @param exitCode  exit code when completed, otherwise -1
 */
public record ProbeResult(boolean completed, int exitCode) {

    static final ProbeResult NOT_COMPLETED = new ProbeResult(false, -1);

    /** True when the process ran to completion with exit code 0. */
    public boolean isSuccess() {
        return completed && exitCode == 0;
    }
}
