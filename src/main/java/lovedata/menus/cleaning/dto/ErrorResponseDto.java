package lovedata.menus.cleaning.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import lovedata.menus.cleaning.util.CorrelationIdUtil;

import java.time.LocalDateTime;

/**
 * Error body of the menu API. Carries the request's correlation id so a
 * failed upload can be found in the logs and in {@code cleaning_runs}.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponseDto {

    @JsonProperty("error")
    private String error;

    @JsonProperty("message")
    private String message;

    @JsonProperty("correlation_id")
    private String correlationId;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime timestamp;

    public ErrorResponseDto(String error, String message) {
        this.error = error;
        this.message = message;
        this.correlationId = CorrelationIdUtil.hasCorrelationId() ? CorrelationIdUtil.getCurrentCorrelationId() : null;
        this.timestamp = LocalDateTime.now();
    }
}
