package com.artifactduo.server.exception;

import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


@EqualsAndHashCode(callSuper = false)
public class PipelineBusyException extends ArtifactDuoException {

    public PipelineBusyException(String message) {
        super(HttpStatus.CONFLICT, message);
    }

    public PipelineBusyException(String message, Throwable cause) {
        super(HttpStatus.CONFLICT, message, cause);
    }
}
