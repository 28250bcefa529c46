package com.artifactduo.server.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


@Data
@EqualsAndHashCode(callSuper = false)
public class ArtifactDuoException extends RuntimeException {

    private HttpStatus status;

    public ArtifactDuoException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public ArtifactDuoException(HttpStatus status, Throwable cause) {
        super(cause);
        this.status = status;
    }

    public ArtifactDuoException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public ArtifactDuoException(String message) {
        super(message);
    }

    public ArtifactDuoException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getArtifactDuoMessage() {
        StringBuilder sb = new StringBuilder();
        buildMessageChain(this, sb, 0);
        return sb.toString();
    }

    // 递归构建完整的异常消息链
    private static void buildMessageChain(Throwable throwable, StringBuilder sb, int depth) {
        if (throwable == null || depth > 20) return;
        // <exception name> : <exception message> -> <next>
        sb.append("%s : %s -> ".formatted(
                throwable.getClass().getSimpleName(),
                throwable instanceof ArtifactDuoException ? throwable.getMessage() : throwable.toString()));
        buildMessageChain(throwable.getCause(), sb, depth + 1);
    }

    @Override
    public String toString() {
        return getArtifactDuoMessage();
    }
}
