package io.stackwarden.tools.helper;

/**
 * Result of a swap, doubling as the helper's process exit code.
 */
public enum SwapOutcome {
    SWAPPED(0),
    RESTORED(1),
    RESTORE_FAILED(2);

    private final int exitCode;

    SwapOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
