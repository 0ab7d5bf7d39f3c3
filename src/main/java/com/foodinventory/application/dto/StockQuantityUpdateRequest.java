package com.foodinventory.application.dto;

/**
 * 보유 수량 변경 요청
 * quantity는 보유 개수(stockQuantity)를 뜻하며 0이면 품목을 삭제합니다.
 */
public record StockQuantityUpdateRequest(
    Integer quantity
) {}
