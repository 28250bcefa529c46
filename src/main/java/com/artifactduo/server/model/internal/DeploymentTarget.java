package com.artifactduo.server.model.internal;

public record DeploymentTarget(
        String id,
        boolean enabled,
        String name,
        String host,
        int port,
        String user,
        String password,
        String remotePath) {

    @Override
    public String toString() {
        // 不输出 password
        return "DeploymentTarget(id=%s, name=%s, host=%s, port=%s, user=%s, remotePath=%s)"
                .formatted(id, name, host, port, user, remotePath);
    }
}
