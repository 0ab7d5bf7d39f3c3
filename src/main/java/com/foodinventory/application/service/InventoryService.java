package com.foodinventory.application.service;

import com.foodinventory.application.dto.AddInventoryItemRequest;
import com.foodinventory.application.dto.InventoryEntryResponse;
import com.foodinventory.application.dto.InventoryItemResponse;
import com.foodinventory.domain.entity.InventoryItem;
import com.foodinventory.domain.repository.InventoryItemRepository;
import com.foodinventory.domain.service.ExpiryUpdateResult;
import com.foodinventory.domain.service.InventoryAggregator;
import com.foodinventory.domain.service.InventoryItemValidator;
import com.foodinventory.domain.service.RequiredFields;
import com.foodinventory.domain.service.StockQuantityUpdateResult;
import com.foodinventory.domain.vo.InventoryItemId;
import com.foodinventory.dto.ResponseCode;
import com.foodinventory.exception.BusinessException;
import com.foodinventory.exception.RequiredFieldsMissingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.List;
import java.util.function.Supplier;

/**
 * 재고 품목 Application 서비스
 *
 * 책임:
 * - 입력 검증 (저장소 호출 전에 수행)
 * - 품목 등록/조회/변경/삭제
 * - 전체 조회 결과를 집계기에 넘겨 목록 응답 생성
 *
 * 주의:
 * - 여러 요청 사이의 락이나 순서 보장은 하지 않음 (저장소의 단건 원자성에 의존)
 * - 재시도하지 않음
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryService {

    private final InventoryItemRepository inventoryItemRepository;
    private final InventoryAggregator inventoryAggregator;
    private final InventoryItemValidator inventoryItemValidator;

    /**
     * 품목을 등록하고, 저장소에서 다시 읽은 값을 반환합니다.
     *
     * @throws RequiredFieldsMissingException name, brands, quantity 중 공백 제거 후 비어 있는 항목이 있는 경우
     */
    public InventoryItemResponse addItem(AddInventoryItemRequest request) {
        RequiredFields required = inventoryItemValidator.normalizeRequiredFields(
                request.name(), request.brands(), request.quantity());
        if (!required.isComplete()) {
            throw new RequiredFieldsMissingException(required.missingFields());
        }
        if (!inventoryItemValidator.isValidInitialStockQuantity(request.stockQuantity())) {
            throw new BusinessException(ResponseCode.INVENTORY_INVALID_QUANTITY, "보유 수량은 1 이상이어야 합니다.");
        }

        InventoryItem item = new InventoryItem(
                required.name(),
                required.brands(),
                required.quantity(),
                request.stockQuantity(),
                request.toDetails(),
                request.expiryDate()
        );

        InventoryItem saved = withStore("재고 등록", () -> inventoryItemRepository.save(item));
        InventoryItem persisted = withStore("재고 등록", () -> inventoryItemRepository.findById(saved.getId()))
                .orElseThrow(() -> new BusinessException(ResponseCode.INVENTORY_STORE_ERROR,
                        "저장된 품목을 다시 읽을 수 없습니다: id=" + saved.getId()));

        log.info("재고 품목 등록: id={}, name={}, brands={}", persisted.getId(), persisted.getName(), persisted.getBrands());
        return InventoryItemResponse.from(persisted);
    }

    public InventoryItemResponse getItem(String rawId) {
        InventoryItemId id = parseId(rawId);

        return withStore("품목 조회", () -> inventoryItemRepository.findById(id.getValue()))
                .map(InventoryItemResponse::from)
                .orElseThrow(() -> new BusinessException(ResponseCode.INVENTORY_ITEM_NOT_FOUND));
    }

    /**
     * 같은 (name, brands) 품목을 묶어 개수와 함께 반환합니다.
     */
    public List<InventoryEntryResponse> getInventory() {
        List<InventoryItem> items = withStore("재고 목록 조회", inventoryItemRepository::findAll);

        return inventoryAggregator.aggregate(items).stream()
                .map(InventoryEntryResponse::from)
                .toList();
    }

    /**
     * 유통기한만 변경합니다.
     * 품목이 없는 경우와 같은 값인 경우는 코드로 구분하고, 응답 문구는 동일하게 내려줍니다.
     */
    public void updateExpiryDate(String rawId, String expiryDate) {
        InventoryItemId id = parseId(rawId);
        if (!inventoryItemValidator.isValidExpiryDate(expiryDate)) {
            throw new BusinessException(ResponseCode.INVENTORY_EXPIRY_DATE_REQUIRED);
        }

        ExpiryUpdateResult result = withStore("유통기한 변경",
                () -> inventoryItemRepository.updateExpiryDate(id.getValue(), expiryDate));

        switch (result) {
            case UPDATED -> log.info("유통기한 변경: id={}, expiryDate={}", id, expiryDate);
            case NOT_FOUND -> throw new BusinessException(ResponseCode.INVENTORY_ITEM_NOT_FOUND,
                    ResponseCode.INVENTORY_EXPIRY_UNCHANGED.getMessage());
            case UNCHANGED -> throw new BusinessException(ResponseCode.INVENTORY_EXPIRY_UNCHANGED);
        }
    }

    /**
     * 보유 수량을 변경합니다. 0이면 품목을 삭제합니다.
     *
     * @throws BusinessException 수량이 없거나 음수인 경우, 품목이 없는 경우
     */
    public StockQuantityUpdateResult updateStockQuantity(String rawId, Integer quantity) {
        InventoryItemId id = parseId(rawId);
        if (!inventoryItemValidator.isValidStockQuantityUpdate(quantity)) {
            throw new BusinessException(ResponseCode.INVENTORY_INVALID_QUANTITY);
        }

        if (quantity == 0) {
            boolean deleted = withStore("보유 수량 변경", () -> inventoryItemRepository.deleteById(id.getValue()));
            if (!deleted) {
                throw new BusinessException(ResponseCode.INVENTORY_ITEM_NOT_FOUND);
            }
            log.info("보유 수량 0으로 품목 삭제: id={}", id);
            return StockQuantityUpdateResult.DELETED;
        }

        boolean updated = withStore("보유 수량 변경",
                () -> inventoryItemRepository.updateStockQuantity(id.getValue(), quantity));
        if (!updated) {
            throw new BusinessException(ResponseCode.INVENTORY_ITEM_NOT_FOUND);
        }
        log.info("보유 수량 변경: id={}, stockQuantity={}", id, quantity);
        return StockQuantityUpdateResult.UPDATED;
    }

    public void deleteItem(String rawId) {
        InventoryItemId id = parseId(rawId);

        boolean deleted = withStore("품목 삭제", () -> inventoryItemRepository.deleteById(id.getValue()));
        if (!deleted) {
            throw new BusinessException(ResponseCode.INVENTORY_ITEM_NOT_FOUND);
        }
        log.info("재고 품목 삭제: id={}", id);
    }

    /**
     * 전체 품목을 삭제합니다.
     *
     * @return 삭제된 품목 수
     * @throws BusinessException 삭제할 품목이 없는 경우 (INVENTORY_EMPTY)
     */
    public long deleteAllItems() {
        long deletedCount = withStore("전체 삭제", inventoryItemRepository::deleteAll);
        if (deletedCount == 0) {
            throw new BusinessException(ResponseCode.INVENTORY_EMPTY);
        }
        log.info("전체 재고 삭제: deletedCount={}", deletedCount);
        return deletedCount;
    }

    private InventoryItemId parseId(String rawId) {
        try {
            return InventoryItemId.parse(rawId);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ResponseCode.INVENTORY_INVALID_ID, e.getMessage());
        }
    }

    private <T> T withStore(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | TransactionException e) {
            throw new BusinessException(ResponseCode.INVENTORY_STORE_ERROR,
                    operation + " 중 저장소 오류가 발생했습니다.", e);
        }
    }
}
