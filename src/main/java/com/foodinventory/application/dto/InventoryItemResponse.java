package com.foodinventory.application.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.foodinventory.domain.entity.InventoryItem;

import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InventoryItemResponse(
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
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {

    public static InventoryItemResponse from(InventoryItem item) {
        return new InventoryItemResponse(
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
                item.getCreatedAt(),
                item.getUpdatedAt()
        );
    }
}
