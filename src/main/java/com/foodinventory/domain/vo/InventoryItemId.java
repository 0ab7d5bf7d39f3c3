package com.foodinventory.domain.vo;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 재고 품목 식별자 Value Object
 * 저장소 키로 쓸 수 있는 양의 정수 문자열만 허용합니다.
 */
public final class InventoryItemId {

    private static final Pattern ID_PATTERN = Pattern.compile("^[0-9]{1,19}$");

    private final long value;

    private InventoryItemId(long value) {
        this.value = value;
    }

    /**
     * 경로 변수 등 외부 입력을 식별자로 변환합니다.
     *
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static InventoryItemId parse(String raw) {
        if (raw == null || !ID_PATTERN.matcher(raw).matches()) {
            throw new IllegalArgumentException("유효하지 않은 품목 ID 형식입니다: " + raw);
        }
        long parsed;
        try {
            parsed = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("유효하지 않은 품목 ID 형식입니다: " + raw, e);
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException("품목 ID는 양수여야 합니다: " + raw);
        }
        return new InventoryItemId(parsed);
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InventoryItemId that = (InventoryItemId) o;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
