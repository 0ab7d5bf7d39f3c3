package com.foodinventory.domain.service;

import org.springframework.stereotype.Component;

/**
 * 재고 품목 입력 검증
 *
 * 저장소 호출 전에 수행되는 검증을 모아둡니다.
 */
@Component
public class InventoryItemValidator {

    /**
     * 필수 항목의 앞뒤 공백을 제거합니다. null은 빈 문자열로 취급합니다.
     */
    public RequiredFields normalizeRequiredFields(String name, String brands, String quantity) {
        return new RequiredFields(trimToEmpty(name), trimToEmpty(brands), trimToEmpty(quantity));
    }

    public boolean isValidExpiryDate(String expiryDate) {
        return expiryDate != null && !expiryDate.isBlank();
    }

    /**
     * 수량 변경 요청 값 검증 (0은 삭제 요청이므로 허용)
     */
    public boolean isValidStockQuantityUpdate(Integer stockQuantity) {
        return stockQuantity != null && stockQuantity >= 0;
    }

    /**
     * 등록 시 보유 수량 검증 (생략하면 기본값 1)
     */
    public boolean isValidInitialStockQuantity(Integer stockQuantity) {
        return stockQuantity == null || stockQuantity >= 1;
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
