package com.foodinventory.domain.service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 공백 제거가 끝난 필수 항목(name, brands, quantity)
 * 비어 있는 항목은 빈 문자열로 둡니다.
 */
public record RequiredFields(
    String name,
    String brands,
    String quantity
) {

    public boolean isComplete() {
        return !name.isEmpty() && !brands.isEmpty() && !quantity.isEmpty();
    }

    /**
     * 항목별 누락 여부 (누락이면 true)
     */
    public Map<String, Boolean> missingFields() {
        Map<String, Boolean> missing = new LinkedHashMap<>();
        missing.put("name", name.isEmpty());
        missing.put("brands", brands.isEmpty());
        missing.put("quantity", quantity.isEmpty());
        return missing;
    }
}
