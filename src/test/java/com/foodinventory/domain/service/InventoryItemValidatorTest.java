package com.foodinventory.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InventoryItemValidator 테스트")
class InventoryItemValidatorTest {

    private final InventoryItemValidator validator = new InventoryItemValidator();

    @Test
    @DisplayName("필수 항목의 공백을 제거하고 모두 있으면 완전한 입력으로 본다")
    void normalizeRequiredFields_Complete() {
        // when
        RequiredFields fields = validator.normalizeRequiredFields(" Milk ", "Acme", " 1L");

        // then
        assertThat(fields.isComplete()).isTrue();
        assertThat(fields.name()).isEqualTo("Milk");
        assertThat(fields.quantity()).isEqualTo("1L");
        assertThat(fields.missingFields())
                .containsEntry("name", false)
                .containsEntry("brands", false)
                .containsEntry("quantity", false);
    }

    @Test
    @DisplayName("공백만 있거나 null인 항목은 누락으로 표시된다")
    void normalizeRequiredFields_Missing() {
        // when
        RequiredFields fields = validator.normalizeRequiredFields("   ", "Acme", null);

        // then
        assertThat(fields.isComplete()).isFalse();
        assertThat(fields.missingFields())
                .containsEntry("name", true)
                .containsEntry("brands", false)
                .containsEntry("quantity", true);
    }

    @Test
    @DisplayName("유통기한은 비어 있으면 안 된다")
    void isValidExpiryDate() {
        assertThat(validator.isValidExpiryDate("2026-12-01")).isTrue();
        assertThat(validator.isValidExpiryDate("")).isFalse();
        assertThat(validator.isValidExpiryDate("  ")).isFalse();
        assertThat(validator.isValidExpiryDate(null)).isFalse();
    }

    @Test
    @DisplayName("수량 변경 값은 0 이상이어야 한다")
    void isValidStockQuantityUpdate() {
        assertThat(validator.isValidStockQuantityUpdate(0)).isTrue();
        assertThat(validator.isValidStockQuantityUpdate(3)).isTrue();
        assertThat(validator.isValidStockQuantityUpdate(-1)).isFalse();
        assertThat(validator.isValidStockQuantityUpdate(null)).isFalse();
    }

    @Test
    @DisplayName("등록 시 보유 수량은 생략하거나 1 이상이어야 한다")
    void isValidInitialStockQuantity() {
        assertThat(validator.isValidInitialStockQuantity(null)).isTrue();
        assertThat(validator.isValidInitialStockQuantity(1)).isTrue();
        assertThat(validator.isValidInitialStockQuantity(0)).isFalse();
    }
}
