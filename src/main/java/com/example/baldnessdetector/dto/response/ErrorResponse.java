package com.example.baldnessdetector.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatusCode;

import java.util.List;

/**
 * Envelope shared by every failure: {@code {"error": {"code", "message", "type", "details"}}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private ErrorBody error;

    public static ErrorResponse of(HttpStatusCode status, String type, String message) {
        return of(status, type, message, List.of());
    }

    public static ErrorResponse of(HttpStatusCode status, String type, String message, List<ErrorDetail> details) {
        return new ErrorResponse(ErrorBody.builder()
                .code(status.value())
                .message(message)
                .type(type)
                .details(details)
                .build());
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorBody {
        private int code;
        private String message;
        private String type;
        private List<ErrorDetail> details;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private String field;
        private String message;
    }
}
