package com.foodinventory.application.dto;

public record AddInventoryItemResponse(
    String message,
    InventoryItemResponse item
) {
}
