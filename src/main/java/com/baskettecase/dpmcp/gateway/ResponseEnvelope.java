package com.baskettecase.dpmcp.gateway;

import com.baskettecase.dpmcp.backend.QueryResult;
import com.baskettecase.dpmcp.error.ErrorCode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * The one response shape callers see, serialized in snake_case.
 *
 * Error envelopes never carry rows; success envelopes always carry columns
 * consistent with {@code row_count}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ResponseEnvelope {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    private String status;
    private String requestId;
    private String message;
    private String productId;
    @Builder.Default
    private List<String> columns = List.of();
    @Builder.Default
    private List<List<Object>> rows = List.of();
    private int rowCount;
    private boolean truncated;
    private long queryTimeMs;
    private String transactionId;
    private String errorMessage;
    private ErrorCode errorCode;
    private boolean humanActionRequired;
    private String humanActionType;
    private Map<String, Object> humanActionContext;
    private Map<String, Object> metadata;

    public static ResponseEnvelope success(String requestId, String transactionId, String message, QueryResult result) {
        return ResponseEnvelope.builder()
                .status(SUCCESS)
                .requestId(requestId)
                .transactionId(transactionId)
                .message(message)
                .columns(result.columns())
                .rows(result.rows())
                .rowCount(result.rowCount())
                .truncated(result.truncated())
                .queryTimeMs(result.elapsedMs())
                .build();
    }

    public static ResponseEnvelope error(String requestId, String transactionId, ErrorCode errorCode, String errorMessage) {
        return ResponseEnvelope.builder()
                .status(ERROR)
                .requestId(requestId)
                .transactionId(transactionId)
                .message(errorMessage)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
