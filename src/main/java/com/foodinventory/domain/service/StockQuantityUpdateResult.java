package com.foodinventory.domain.service;

/**
 * 보유 수량 변경 결과
 */
public enum StockQuantityUpdateResult {

    /**
     * 보유 수량을 새 값으로 덮어씀
     */
    UPDATED,

    /**
     * 수량 0 요청으로 품목을 삭제함
     */
    DELETED
}
