package com.artifactduo.server.configuration;

import com.artifactduo.server.exception.PipelineBusyException;
import com.artifactduo.server.exception.ValidationException;
import com.artifactduo.server.model.api.global.ArtifactDuoHttpResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

class GlobalControllerAdviceTest {

    private final GlobalControllerAdvice globalControllerAdvice = new GlobalControllerAdvice();

    @Test
    void busyRejectionMapsToConflict() {
        ResponseEntity<ArtifactDuoHttpResponse<Void>> response =
                this.globalControllerAdvice.handlePipelineBusyException(new PipelineBusyException("busy"));

        assertEquals(HttpStatus.CONFLICT.value(), response.getStatusCode().value());
        assertEquals(HttpStatus.CONFLICT.value(), response.getBody().getStatusCode());
        assertTrue(response.getBody().getMessage().contains("busy"));
    }

    @Test
    void validationMapsToBadRequestWithCauseChain() {
        ResponseEntity<ArtifactDuoHttpResponse<Void>> response = this.globalControllerAdvice.handleValidationException(
                new ValidationException("bad port", new IllegalArgumentException("70000")));

        assertEquals(HttpStatus.BAD_REQUEST.value(), response.getStatusCode().value());
        assertTrue(response.getBody().getMessage().contains("bad port"));
        assertTrue(response.getBody().getMessage().contains("70000"));
    }

    @Test
    void unknownExceptionMapsToInternalError() {
        ResponseEntity<ArtifactDuoHttpResponse<Void>> response =
                this.globalControllerAdvice.handleGlobalException(new IllegalStateException("boom"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR.value(), response.getStatusCode().value());
    }
}
