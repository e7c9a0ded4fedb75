package org.rostilos.gitvault.bridge.process;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Captured outcome of an external command. Stdout may carry secrets, so it is kept
 * as bytes and can be wiped by the caller.
 */
public final class ProcessResult {

    private final int exitCode;
    private final byte[] stdout;
    private final byte[] stderr;

    public ProcessResult(int exitCode, byte[] stdout, byte[] stderr) {
        this.exitCode = exitCode;
        this.stdout = stdout != null ? stdout : new byte[0];
        this.stderr = stderr != null ? stderr : new byte[0];
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * Direct view of the captured stdout; {@link #wipe()} zeroes it.
     */
    public byte[] getStdout() {
        return stdout;
    }

    /**
     * First line of stderr, for diagnostics. Helpers do not print secrets on stderr.
     */
    public String stderrSummary() {
        String text = new String(stderr, StandardCharsets.UTF_8).strip();
        int newline = text.indexOf('\n');
        return newline >= 0 ? text.substring(0, newline) : text;
    }

    public void wipe() {
        Arrays.fill(stdout, (byte) 0);
    }

    @Override
    public String toString() {
        return "ProcessResult{exitCode=" + exitCode + ", stdout=" + stdout.length + " bytes}";
    }
}
