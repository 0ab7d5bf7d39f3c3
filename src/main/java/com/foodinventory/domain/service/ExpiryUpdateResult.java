package com.foodinventory.domain.service;

/**
 * 유통기한 변경 결과
 * 외부 응답 문구는 NOT_FOUND와 UNCHANGED가 같지만 내부적으로는 구분합니다.
 */
public enum ExpiryUpdateResult {
    UPDATED,
    NOT_FOUND,
    UNCHANGED
}
