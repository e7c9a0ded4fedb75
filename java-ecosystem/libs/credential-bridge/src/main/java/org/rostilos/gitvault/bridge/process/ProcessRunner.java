package org.rostilos.gitvault.bridge.process;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs external commands with bounded execution time.
 */
public interface ProcessRunner {

    /**
     * @param command     executable followed by its arguments
     * @param stdin       bytes written to the process input, then closed; may be {@code null}
     * @param environment variables added to the inherited environment
     * @param timeout     hard limit; the process is killed when it is exceeded
     * @throws ProcessTimeoutException when the limit is exceeded
     * @throws IOException             when the process cannot be started or its output read
     */
    ProcessResult run(List<String> command, byte[] stdin, Map<String, String> environment, Duration timeout)
            throws IOException;

    /**
     * Whether {@code executable} resolves on the search path.
     */
    boolean isOnPath(String executable);
}
