package com.rollup.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope for every analytics endpoint: {@code success}, then either {@code data} or
 * {@code error}, plus the response timestamp.
 *
 * @param <T> the type of the response data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    /**
     * False whenever {@code error} is set.
     */
    private boolean success;

    /**
     * Report, flush status or accepted event count; omitted on error.
     */
    private T data;

    /**
     * Failure description; omitted on success.
     */
    private ErrorInfo error;

    /**
     * When the response was built.
     */
    @Builder.Default
    private Instant timestamp = Instant.now();

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> error(String message, String code) {
        return error(message, code, null);
    }

    /**
     * @param details optional diagnostic text, omitted from the JSON when null
     */
    public static <T> ApiResponse<T> error(String message, String code, String details) {
        return ApiResponse.<T>builder()
                .success(false)
                .error(new ErrorInfo(message, code, details))
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorInfo {

        private String message;

        /**
         * Machine-readable code, e.g. VALIDATION_ERROR, ANALYTICS_DISABLED,
         * REPOSITORY_WRITE_FAILED, FLUSH_CANCELLED or REPOSITORY_UNAVAILABLE.
         */
        private String code;

        /**
         * Field errors or the underlying cause, when known.
         */
        private String details;
    }
}
