package com.artifactduo.server.configuration;

import com.artifactduo.server.exception.*;
import com.artifactduo.server.model.api.global.ArtifactDuoHttpResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;


@RestControllerAdvice
@Slf4j
public class GlobalControllerAdvice {
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ArtifactDuoHttpResponse<Void>> handleBusinessException(BusinessException e) {
        log.warn("controller failed. business logic failed. ", e);
        return toResponse(e);
    }

    @ExceptionHandler(PipelineBusyException.class)
    public ResponseEntity<ArtifactDuoHttpResponse<Void>> handlePipelineBusyException(PipelineBusyException e) {
        // 正常的拒绝, 不打印堆栈
        log.info("controller rejected. {}", e.getMessage());
        return toResponse(e);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ArtifactDuoHttpResponse<Void>> handleResourceNotFountException(ResourceNotFoundException e) {
        log.warn("controller failed. resource not found. ", e);
        return toResponse(e);
    }

    @ExceptionHandler(FileOperationException.class)
    public ResponseEntity<ArtifactDuoHttpResponse<Void>> handleFileOperationException(FileOperationException e) {
        log.warn("controller failed. file operation failed. ", e);
        return toResponse(e);
    }

    @ExceptionHandler(DeploymentException.class)
    public ResponseEntity<ArtifactDuoHttpResponse<Void>> handleDeploymentException(DeploymentException e) {
        log.warn("controller failed. deployment failed. ", e);
        return toResponse(e);
    }

    @ExceptionHandler(JsonException.class)
    public ResponseEntity<ArtifactDuoHttpResponse<Void>> handleJsonException(JsonException e) {
        log.warn("controller failed. json process failed. ", e);
        return toResponse(e);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ArtifactDuoHttpResponse<Void>> handleValidationException(ValidationException e) {
        log.warn("controller failed. validation failed. ", e);
        return toResponse(e);
    }

    @ExceptionHandler(ArtifactDuoException.class)
    public ResponseEntity<ArtifactDuoHttpResponse<Void>> handleArtifactDuoException(ArtifactDuoException e) {
        log.warn("controller failed. ArtifactDuoException happen", e);
        return toResponse(e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ArtifactDuoHttpResponse<Void>> handleGlobalException(Exception e) {
        log.warn("controller failed.", e);
        return toResponse(new ArtifactDuoException(HttpStatus.INTERNAL_SERVER_ERROR, e.toString()));
    }

    private static ResponseEntity<ArtifactDuoHttpResponse<Void>> toResponse(ArtifactDuoException e) {
        ArtifactDuoHttpResponse<Void> artifactDuoHttpResponse = ArtifactDuoHttpResponse.fail(e);
        return ResponseEntity.status(artifactDuoHttpResponse.getStatusCode()).body(artifactDuoHttpResponse);
    }
}
