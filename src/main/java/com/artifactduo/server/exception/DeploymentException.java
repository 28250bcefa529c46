package com.artifactduo.server.exception;

import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


@EqualsAndHashCode(callSuper = false)
public class DeploymentException extends ArtifactDuoException {

    public DeploymentException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public DeploymentException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
