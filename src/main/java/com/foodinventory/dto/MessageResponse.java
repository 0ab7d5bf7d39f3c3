package com.foodinventory.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "처리 결과 확인 응답")
public class MessageResponse {

    @Schema(description = "응답 코드", example = "INVENTORY_2004")
    private String code;

    @Schema(description = "메시지", example = "품목이 삭제되었습니다.")
    private String message;

    @Schema(description = "수량 변경으로 품목이 삭제되었는지 여부 (수량 변경 응답에만 포함)")
    private Boolean deleted;

    @Schema(description = "삭제된 품목 수 (전체 삭제 응답에만 포함)")
    private Long deletedCount;

    public static MessageResponse of(ResponseCode responseCode) {
        return new MessageResponse(responseCode.getCode(), responseCode.getMessage(), null, null);
    }

    public static MessageResponse quantityChanged(ResponseCode responseCode, boolean deleted) {
        return new MessageResponse(responseCode.getCode(), responseCode.getMessage(), deleted, null);
    }

    public static MessageResponse bulkDeleted(ResponseCode responseCode, long deletedCount) {
        return new MessageResponse(responseCode.getCode(), responseCode.getMessage(), null, deletedCount);
    }
}
