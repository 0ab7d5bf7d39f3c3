package com.foodinventory.exception;

import com.foodinventory.dto.ResponseCode;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 필수 항목 누락 예외
 * 항목별 누락 여부를 함께 전달합니다.
 */
@Getter
public class RequiredFieldsMissingException extends BusinessException {

    private final Map<String, Boolean> missingFields;

    public RequiredFieldsMissingException(Map<String, Boolean> missingFields) {
        super(ResponseCode.INVENTORY_REQUIRED_FIELDS_MISSING);
        this.missingFields = Collections.unmodifiableMap(new LinkedHashMap<>(missingFields));
    }
}
