package com.foodinventory.dto;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * API 응답 코드 정의
 *
 * 코드 구조: {도메인}_{숫자}
 * - COMMON: 1xxx (공통)
 * - INVENTORY: 2xxx (재고)
 * - CATALOG: 3xxx (외부 카탈로그 검색)
 */
@Getter
@RequiredArgsConstructor
public enum ResponseCode {

    // ===== 공통 (1xxx) =====
    BAD_REQUEST(HttpStatus.BAD_REQUEST, "COMMON_1400", "잘못된 요청입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "COMMON_1404", "요청한 리소스를 찾을 수 없습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "COMMON_1500", "서버 내부 오류가 발생했습니다."),

    // ===== 재고 (2xxx) =====
    INVENTORY_ITEM_ADDED(HttpStatus.CREATED, "INVENTORY_2000", "재고에 품목이 추가되었습니다."),
    INVENTORY_EXPIRY_UPDATED(HttpStatus.OK, "INVENTORY_2001", "유통기한이 변경되었습니다."),
    INVENTORY_QUANTITY_UPDATED(HttpStatus.OK, "INVENTORY_2002", "보유 수량이 변경되었습니다."),
    INVENTORY_ITEM_REMOVED_BY_ZERO_QUANTITY(HttpStatus.OK, "INVENTORY_2003", "보유 수량이 0이 되어 품목이 삭제되었습니다."),
    INVENTORY_ITEM_DELETED(HttpStatus.OK, "INVENTORY_2004", "품목이 삭제되었습니다."),
    INVENTORY_ALL_DELETED(HttpStatus.OK, "INVENTORY_2005", "전체 재고가 삭제되었습니다."),
    INVENTORY_REQUIRED_FIELDS_MISSING(HttpStatus.BAD_REQUEST, "INVENTORY_2400", "필수 항목이 누락되었습니다."),
    INVENTORY_INVALID_ID(HttpStatus.BAD_REQUEST, "INVENTORY_2401", "유효하지 않은 품목 ID입니다."),
    INVENTORY_EXPIRY_DATE_REQUIRED(HttpStatus.BAD_REQUEST, "INVENTORY_2402", "유통기한은 필수입니다."),
    INVENTORY_INVALID_QUANTITY(HttpStatus.BAD_REQUEST, "INVENTORY_2403", "수량은 0 이상의 정수여야 합니다."),
    INVENTORY_ITEM_NOT_FOUND(HttpStatus.NOT_FOUND, "INVENTORY_2404", "품목을 찾을 수 없습니다."),
    INVENTORY_EXPIRY_UNCHANGED(HttpStatus.NOT_FOUND, "INVENTORY_2405", "품목을 찾을 수 없거나 기존 유통기한과 같습니다."),
    INVENTORY_EMPTY(HttpStatus.NOT_FOUND, "INVENTORY_2406", "삭제할 품목이 없습니다."),
    INVENTORY_STORE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "INVENTORY_2500", "재고 저장소 처리 중 오류가 발생했습니다."),

    // ===== 카탈로그 (3xxx) =====
    CATALOG_SEARCH_TERM_REQUIRED(HttpStatus.BAD_REQUEST, "CATALOG_3400", "검색어를 입력해주세요."),
    CATALOG_NO_RESULTS(HttpStatus.NOT_FOUND, "CATALOG_3404", "검색 결과가 없습니다."),
    CATALOG_UPSTREAM_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "CATALOG_3500", "Open Food Facts 조회 중 오류가 발생했습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;
}
