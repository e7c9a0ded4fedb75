package org.rostilos.gitvault.bridge.sshagent;

import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
import org.rostilos.gitvault.core.model.SshKeyInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * SSH agent client over the Unix domain socket named by {@code SSH_AUTH_SOCK}.
 * <p>
 * Socket channels have no read timeout, so each exchange runs on a daemon thread and
 * the channel is closed when the caller's deadline passes.
 */
public class UnixSocketSshAgentClient implements SshAgentClient {

    private static final Logger log = LoggerFactory.getLogger(UnixSocketSshAgentClient.class);

    public static final String SSH_AUTH_SOCK = "SSH_AUTH_SOCK";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private static final ExecutorService AGENT_IO = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "gitvault-ssh-agent");
        thread.setDaemon(true);
        return thread;
    });

    private final Map<String, String> environment;
    private final Duration timeout;

    public UnixSocketSshAgentClient() {
        this(System.getenv(), DEFAULT_TIMEOUT);
    }

    public UnixSocketSshAgentClient(Map<String, String> environment, Duration timeout) {
        this.environment = Map.copyOf(environment);
        this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
    }

    @Override
    public boolean isAvailable() {
        Path socket = socketPath();
        if (socket == null || !Files.exists(socket)) {
            return false;
        }
        try (SocketChannel ignored = SocketChannel.open(UnixDomainSocketAddress.of(socket))) {
            return true;
        } catch (IOException e) {
            log.debug("SSH agent socket {} is not connectable: {}", socket, e.getMessage());
            return false;
        }
    }

    @Override
    public List<SshKeyInfo> listKeys() {
        Path socket = socketPath();
        if (socket == null) {
            throw unavailable("SSH_AUTH_SOCK is not set", "Start ssh-agent and add a key with 'ssh-add'", null);
        }

        SocketChannel channel;
        try {
            channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        } catch (IOException e) {
            throw unavailable("cannot open a Unix socket", null, e);
        }

        Future<List<SshKeyInfo>> exchange = AGENT_IO.submit(() -> {
            channel.connect(UnixDomainSocketAddress.of(socket));
            writeFully(channel, SshAgentProtocol.requestIdentities());
            return SshAgentProtocol.parseIdentitiesAnswer(readMessage(channel));
        });

        try {
            List<SshKeyInfo> keys = exchange.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("SSH agent holds {} identities", keys.size());
            return keys;
        } catch (TimeoutException e) {
            exchange.cancel(true);
            throw unavailable("agent did not answer within " + timeout.toMillis() + " ms", null, e);
        } catch (InterruptedException e) {
            exchange.cancel(true);
            Thread.currentThread().interrupt();
            throw unavailable("interrupted while talking to the agent", null, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SshAgentProtocol.AgentFailureException) {
                throw unavailable("agent refused to list identities", null, cause);
            }
            throw unavailable(cause.getMessage(), "Check that SSH_AUTH_SOCK points to a running agent", cause);
        } finally {
            closeQuietly(channel);
        }
    }

    private Path socketPath() {
        String value = environment.get(SSH_AUTH_SOCK);
        return value == null || value.isBlank() ? null : Path.of(value);
    }

    private static void writeFully(SocketChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    private static ByteBuffer readMessage(SocketChannel channel) throws IOException {
        ByteBuffer lengthBuffer = readExactly(channel, 4);
        int length = lengthBuffer.getInt();
        if (length <= 0 || length > SshAgentProtocol.MAX_MESSAGE_LENGTH) {
            throw new IOException("Invalid agent message length " + length);
        }
        return readExactly(channel, length);
    }

    private static ByteBuffer readExactly(SocketChannel channel, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                throw new EOFException("Agent closed the connection");
            }
        }
        buffer.flip();
        return buffer;
    }

    private static void closeQuietly(SocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Failed to close SSH agent socket: {}", e.getMessage());
        }
    }

    private static AuthException unavailable(String reason, String hint, Throwable cause) {
        return new AuthException(EAuthErrorKind.AGENT_UNAVAILABLE,
                "SSH_AGENT_UNAVAILABLE",
                "SSH agent is unavailable: " + reason,
                hint != null ? hint : "Check that ssh-agent is running and SSH_AUTH_SOCK is exported",
                cause);
    }
}
