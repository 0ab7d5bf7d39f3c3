package com.foodinventory.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "공통 오류 응답")
public class ErrorResponse {

    @Schema(description = "응답 코드", example = "INVENTORY_2400")
    private String code;

    @Schema(description = "오류 메시지", example = "필수 항목이 누락되었습니다.")
    private String error;

    @Schema(description = "필수 항목별 누락 여부 (누락이면 true)")
    private Map<String, Boolean> missingFields;

    public static ErrorResponse of(ResponseCode responseCode) {
        return new ErrorResponse(responseCode.getCode(), responseCode.getMessage(), null);
    }

    public static ErrorResponse of(ResponseCode responseCode, String customMessage) {
        return new ErrorResponse(responseCode.getCode(), customMessage, null);
    }

    public static ErrorResponse withMissingFields(ResponseCode responseCode, Map<String, Boolean> missingFields) {
        return new ErrorResponse(responseCode.getCode(), responseCode.getMessage(), missingFields);
    }
}
