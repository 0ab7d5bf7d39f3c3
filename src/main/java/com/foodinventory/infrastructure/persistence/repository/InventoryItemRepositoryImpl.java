package com.foodinventory.infrastructure.persistence.repository;

import com.foodinventory.domain.entity.InventoryItem;
import com.foodinventory.domain.repository.InventoryItemRepository;
import com.foodinventory.domain.service.ExpiryUpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * MySQL(JPA) 기반 재고 품목 저장소
 * 변경/삭제는 단일 UPDATE/DELETE 문으로 처리하여 행 단위 원자성을 따릅니다.
 */
@Repository
@Profile("!memory")
@RequiredArgsConstructor
public class InventoryItemRepositoryImpl implements InventoryItemRepository {

    private final JpaInventoryItemRepository jpaInventoryItemRepository;

    @Override
    public InventoryItem save(InventoryItem item) {
        return jpaInventoryItemRepository.save(item);
    }

    @Override
    public Optional<InventoryItem> findById(Long id) {
        return jpaInventoryItemRepository.findById(id);
    }

    @Override
    public List<InventoryItem> findAll() {
        return jpaInventoryItemRepository.findAllByOrderByIdAsc();
    }

    @Override
    @Transactional
    public ExpiryUpdateResult updateExpiryDate(Long id, String expiryDate) {
        int modified = jpaInventoryItemRepository.updateExpiryDateIfChanged(id, expiryDate, LocalDateTime.now());
        if (modified > 0) {
            return ExpiryUpdateResult.UPDATED;
        }
        return jpaInventoryItemRepository.existsById(id)
                ? ExpiryUpdateResult.UNCHANGED
                : ExpiryUpdateResult.NOT_FOUND;
    }

    @Override
    @Transactional
    public boolean updateStockQuantity(Long id, int stockQuantity) {
        return jpaInventoryItemRepository.updateStockQuantity(id, stockQuantity, LocalDateTime.now()) > 0;
    }

    @Override
    @Transactional
    public boolean deleteById(Long id) {
        return jpaInventoryItemRepository.deleteItemById(id) > 0;
    }

    @Override
    @Transactional
    public long deleteAll() {
        return jpaInventoryItemRepository.deleteAllItems();
    }
}
