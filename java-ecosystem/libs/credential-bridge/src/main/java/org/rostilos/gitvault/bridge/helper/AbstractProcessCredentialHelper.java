package org.rostilos.gitvault.bridge.helper;

import org.rostilos.gitvault.bridge.process.ProcessResult;
import org.rostilos.gitvault.bridge.process.ProcessRunner;
import org.rostilos.gitvault.bridge.process.ProcessTimeoutException;
import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Base for helpers backed by a command line tool.
 */
public abstract class AbstractProcessCredentialHelper implements CredentialHelper {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    protected final ProcessRunner processRunner;
    protected final Duration timeout;

    protected AbstractProcessCredentialHelper(ProcessRunner processRunner, Duration timeout) {
        this.processRunner = processRunner;
        this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
    }

    /**
     * Executable this helper drives.
     */
    protected abstract String executable();

    @Override
    public boolean isAvailable() {
        return processRunner.isOnPath(executable());
    }

    protected ProcessResult execute(List<String> command, byte[] stdin, Map<String, String> environment) {
        try {
            return processRunner.run(command, stdin, environment, timeout);
        } catch (ProcessTimeoutException e) {
            throw new AuthException(EAuthErrorKind.HELPER_UNAVAILABLE,
                    "HELPER_TIMEOUT",
                    "Credential helper '" + name() + "' timed out after " + timeout.toMillis() + " ms",
                    "Check that '" + executable() + "' does not wait for interactive input",
                    e);
        } catch (IOException e) {
            throw new AuthException(EAuthErrorKind.HELPER_UNAVAILABLE,
                    "HELPER_FAILED",
                    "Credential helper '" + name() + "' could not be run: " + e.getMessage(),
                    "Check that '" + executable() + "' is installed and on PATH",
                    e);
        }
    }

    /**
     * Stdout with surrounding ASCII whitespace removed, as a fresh array.
     */
    protected static byte[] trimmed(byte[] output) {
        int start = 0;
        int end = output.length;
        while (start < end && isWhitespace(output[start])) {
            start++;
        }
        while (end > start && isWhitespace(output[end - 1])) {
            end--;
        }
        byte[] result = new byte[end - start];
        System.arraycopy(output, start, result, 0, result.length);
        return result;
    }

    private static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r';
    }
}
