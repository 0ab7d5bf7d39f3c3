package com.foodinventory.domain.repository;

import com.foodinventory.domain.entity.InventoryItem;
import com.foodinventory.domain.service.ExpiryUpdateResult;

import java.util.List;
import java.util.Optional;

/**
 * 재고 품목 저장소
 *
 * 단건 연산은 저장소가 제공하는 키 단위 원자성만 보장합니다.
 * 여러 품목에 걸친 원자성은 없습니다.
 */
public interface InventoryItemRepository {

    InventoryItem save(InventoryItem item);

    Optional<InventoryItem> findById(Long id);

    /**
     * 전체 품목을 ID 오름차순(= 저장 순서)으로 조회합니다.
     */
    List<InventoryItem> findAll();

    ExpiryUpdateResult updateExpiryDate(Long id, String expiryDate);

    /**
     * @return 해당 ID의 품목이 있어 변경했으면 true
     */
    boolean updateStockQuantity(Long id, int stockQuantity);

    /**
     * @return 삭제된 품목이 있으면 true
     */
    boolean deleteById(Long id);

    /**
     * @return 삭제된 품목 수
     */
    long deleteAll();
}
