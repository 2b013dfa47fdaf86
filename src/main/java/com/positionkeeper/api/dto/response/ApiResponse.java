package com.positionkeeper.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope applied by {@link com.positionkeeper.config.ApiResponseAdvice}.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(T data) {
        this.data = data;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data);
    }
}
