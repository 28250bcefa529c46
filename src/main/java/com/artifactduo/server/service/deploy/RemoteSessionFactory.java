package com.artifactduo.server.service.deploy;

import com.artifactduo.server.exception.DeploymentException;
import com.artifactduo.server.model.internal.DeploymentTarget;

public interface RemoteSessionFactory {

    /**
     * Connects and authenticates.
     *
     * @throws DeploymentException when the host is unreachable or authentication fails
     */
    RemoteSession connect(DeploymentTarget target) throws DeploymentException;
}
