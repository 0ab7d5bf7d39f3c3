package com.foodinventory.infrastructure.repository;

import com.foodinventory.domain.entity.InventoryItem;
import com.foodinventory.domain.repository.InventoryItemRepository;
import com.foodinventory.domain.service.ExpiryUpdateResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * InMemory 재고 품목 저장소
 *
 * ID 순으로 정렬된 맵을 사용하므로 전체 조회 순서는 저장 순서와 같습니다.
 * 발급한 ID는 삭제 후에도 재사용하지 않습니다.
 */
@Slf4j
@Repository
@Profile("memory")
public class InMemoryInventoryItemRepository implements InventoryItemRepository {

    private final ConcurrentNavigableMap<Long, InventoryItem> store = new ConcurrentSkipListMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public InventoryItem save(InventoryItem item) {
        if (item.getId() == null) {
            item.assignId(idGenerator.getAndIncrement());
        }
        store.put(item.getId(), item);
        return item;
    }

    @Override
    public Optional<InventoryItem> findById(Long id) {
        return Optional.ofNullable(store.get(id));
    }

    @Override
    public List<InventoryItem> findAll() {
        return new ArrayList<>(store.values());
    }

    @Override
    public ExpiryUpdateResult updateExpiryDate(Long id, String expiryDate) {
        AtomicReference<ExpiryUpdateResult> result = new AtomicReference<>(ExpiryUpdateResult.NOT_FOUND);
        store.computeIfPresent(id, (key, item) -> {
            result.set(item.changeExpiryDate(expiryDate) ? ExpiryUpdateResult.UPDATED : ExpiryUpdateResult.UNCHANGED);
            return item;
        });
        return result.get();
    }

    @Override
    public boolean updateStockQuantity(Long id, int stockQuantity) {
        AtomicBoolean updated = new AtomicBoolean(false);
        store.computeIfPresent(id, (key, item) -> {
            item.changeStockQuantity(stockQuantity);
            updated.set(true);
            return item;
        });
        return updated.get();
    }

    @Override
    public boolean deleteById(Long id) {
        return store.remove(id) != null;
    }

    @Override
    public long deleteAll() {
        long removed = 0;
        for (Long id : store.keySet()) {
            if (store.remove(id) != null) {
                removed++;
            }
        }
        log.debug("InMemory 저장소 전체 삭제: removed={}", removed);
        return removed;
    }
}
