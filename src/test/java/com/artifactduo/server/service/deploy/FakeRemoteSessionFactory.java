package com.artifactduo.server.service.deploy;

import com.artifactduo.server.exception.DeploymentException;
import com.artifactduo.server.model.internal.CommandResult;
import com.artifactduo.server.model.internal.DeploymentTarget;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Remote filesystem kept in memory per host. Hosts in {@link #failingHosts} reject authentication,
 * commands containing {@link #FAILING_COMMAND_MARKER} exit with 1.
 */
public class FakeRemoteSessionFactory implements RemoteSessionFactory {

    public static final String FAILING_COMMAND_MARKER = "fail";

    private final Set<String> failingHosts = new HashSet<>();

    private final List<String> connectAttempts = new ArrayList<>();

    private final Map<String, FakeRemoteSession> sessions = new LinkedHashMap<>();

    public FakeRemoteSessionFactory failAuthenticationFor(String host) {
        this.failingHosts.add(host);
        return this;
    }

    @Override
    public synchronized RemoteSession connect(DeploymentTarget target) throws DeploymentException {
        this.connectAttempts.add(target.host());
        if (this.failingHosts.contains(target.host())) {
            throw new DeploymentException("authentication failed for %s@%s".formatted(target.user(), target.host()));
        }
        return this.sessions.computeIfAbsent(target.host(), host -> new FakeRemoteSession());
    }

    public synchronized List<String> getConnectAttempts() {
        return new ArrayList<>(this.connectAttempts);
    }

    public synchronized FakeRemoteSession getSession(String host) {
        return this.sessions.get(host);
    }

    public static class FakeRemoteSession implements RemoteSession {

        private final Set<String> folders = new HashSet<>();

        private final Map<String, ByteArrayOutputStream> files = new LinkedHashMap<>();

        private final List<String> commands = new ArrayList<>();

        private int closeCount;

        @Override
        public boolean exists(String remotePath) {
            return this.folders.contains(remotePath) || this.files.containsKey(remotePath);
        }

        @Override
        public void mkdirs(String remotePath) {
            this.folders.add(remotePath);
        }

        @Override
        public ByteArrayOutputStream openForWrite(String remotePath) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            this.files.put(remotePath, out);
            return out;
        }

        @Override
        public CommandResult exec(String command) {
            this.commands.add(command);
            if (command.contains(FAILING_COMMAND_MARKER)) {
                return CommandResult.of(command, 1, "command failed");
            }
            return CommandResult.of(command, 0, "ok");
        }

        @Override
        public void close() {
            this.closeCount++;
        }

        public Set<String> getFolders() {
            return this.folders;
        }

        public Map<String, ByteArrayOutputStream> getFiles() {
            return this.files;
        }

        public List<String> getCommands() {
            return this.commands;
        }

        public int getCloseCount() {
            return this.closeCount;
        }
    }
}
