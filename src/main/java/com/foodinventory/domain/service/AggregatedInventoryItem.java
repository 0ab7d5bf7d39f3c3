package com.foodinventory.domain.service;

import com.foodinventory.domain.entity.InventoryItem;

/**
 * 집계된 재고 한 줄
 *
 * @param representative 같은 (name, brands) 그룹에서 마지막으로 읽힌 품목
 * @param count          그룹에 속한 품목 수 (1 이상)
 */
public record AggregatedInventoryItem(
    InventoryItem representative,
    int count
) {
}
