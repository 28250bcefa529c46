package com.artifactduo.server.exception;

import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


@EqualsAndHashCode(callSuper = false)
public class ResourceNotFoundException extends ArtifactDuoException {

    public ResourceNotFoundException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, message, cause);
    }
}
