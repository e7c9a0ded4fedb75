package org.rostilos.gitvault.bridge.process;

import java.io.IOException;
import java.time.Duration;

public class ProcessTimeoutException extends IOException {

    public ProcessTimeoutException(String command, Duration timeout) {
        super("Command '" + command + "' did not finish within " + timeout.toMillis() + " ms");
    }
}
