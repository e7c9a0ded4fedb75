package org.rostilos.gitvault.bridge.sshagent;

import org.rostilos.gitvault.core.model.SshKeyInfo;

import java.util.List;

/**
 * Read-only view of a running SSH agent. Only public identities are ever requested.
 */
public interface SshAgentClient {

    boolean isAvailable();

    /**
     * @return identities held by the agent, empty when the agent holds none
     * @throws org.rostilos.gitvault.core.exception.AuthException with kind
     *         {@code AGENT_UNAVAILABLE} when the agent cannot be reached or refuses
     */
    List<SshKeyInfo> listKeys();
}
