package com.foodinventory.application.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.foodinventory.domain.entity.InventoryItem;
import com.foodinventory.domain.service.AggregatedInventoryItem;

/**
 * 재고 목록 조회 응답 한 줄
 *
 * 같은 (name, brands) 품목을 하나로 묶고 count로 개수를 표시합니다.
 * 나머지 필드는 그룹의 대표 품목(마지막으로 읽힌 품목) 값입니다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InventoryEntryResponse(
    Long id,
    String name,
    String brands,
    String quantity,
    Integer stockQuantity,
    String ingredients,
    String categories,
    String imageUrl,
    String url,
    String expiryDate,
    int count
) {

    public static InventoryEntryResponse from(AggregatedInventoryItem entry) {
        InventoryItem item = entry.representative();
        return new InventoryEntryResponse(
                item.getId(),
                item.getName(),
                item.getBrands(),
                item.getQuantity(),
                item.getStockQuantity(),
                item.getIngredients(),
                item.getCategories(),
                item.getImageUrl(),
                item.getUrl(),
                item.getExpiryDate(),
                entry.count()
        );
    }
}
