package com.artifactduo.server.model.api.global;

import com.artifactduo.server.exception.ArtifactDuoException;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.Data;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.http.HttpStatus;


@Data
public class ArtifactDuoHttpResponse<T> {

    private int statusCode;

    private String message;

    private T data;

    @JsonSerialize(using = ToStringSerializer.class)
    private final long timestamp = System.currentTimeMillis();

    private ArtifactDuoHttpResponse() {}

    public static <T> ArtifactDuoHttpResponse<T> success(T data, String message) {
        ArtifactDuoHttpResponse<T> result = new ArtifactDuoHttpResponse<>();
        result.statusCode = HttpStatus.OK.value();
        result.message = message;
        result.data = data;
        return result;
    }

    public static <T> ArtifactDuoHttpResponse<T> success(T data) {
        return success(data, "success");
    }

    public static ArtifactDuoHttpResponse<Void> success() {
        return success(null);
    }

    public static ArtifactDuoHttpResponse<Void> fail(ArtifactDuoException e) {
        ArtifactDuoHttpResponse<Void> result = new ArtifactDuoHttpResponse<>();
        // fall back 方法
        result.statusCode = ObjectUtils.isEmpty(e.getStatus()) ?
                HttpStatus.INTERNAL_SERVER_ERROR.value() :
                e.getStatus().value();
        result.message = e.getArtifactDuoMessage();
        return result;
    }
}
