package com.foodinventory.domain.entity;

import com.foodinventory.domain.entity.base.BaseTimeEntity;
import com.foodinventory.domain.vo.ProductDetails;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Objects;

/**
 * 재고 품목 도메인 Entity
 *
 * quantity는 포장 단위 표기(예: "500g")이고, stockQuantity는 보유 개수입니다.
 * 두 값은 서로 다른 개념이며 수량 변경은 stockQuantity에만 적용됩니다.
 */
@Entity
@Table(name = "inventory_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class InventoryItem extends BaseTimeEntity {

    public static final int DEFAULT_STOCK_QUANTITY = 1;

    @Column(name = "name", nullable = false, columnDefinition = "TEXT")
    private String name;

    @Column(name = "brands", nullable = false, columnDefinition = "TEXT")
    private String brands;

    @Column(name = "quantity", nullable = false, columnDefinition = "TEXT")
    private String quantity;

    @Column(name = "stock_quantity", nullable = false)
    private Integer stockQuantity;

    @Column(name = "ingredients", columnDefinition = "TEXT")
    private String ingredients;

    @Column(name = "categories", columnDefinition = "TEXT")
    private String categories;

    @Column(name = "image_url", columnDefinition = "TEXT")
    private String imageUrl;

    @Column(name = "url", columnDefinition = "TEXT")
    private String url;

    // 변경 여부 비교는 대소문자와 악센트까지 구분 (바이너리 collation)
    @Column(name = "expiry_date", columnDefinition = "TEXT COLLATE utf8mb4_bin")
    private String expiryDate;

    public InventoryItem(String name, String brands, String quantity, Integer stockQuantity,
                         ProductDetails details, String expiryDate) {
        validateConstructorParams(name, brands, quantity, stockQuantity);
        ProductDetails safeDetails = details != null ? details : ProductDetails.empty();
        this.name = name.trim();
        this.brands = brands.trim();
        this.quantity = quantity.trim();
        this.stockQuantity = stockQuantity != null ? stockQuantity : DEFAULT_STOCK_QUANTITY;
        this.ingredients = safeDetails.ingredients();
        this.categories = safeDetails.categories();
        this.imageUrl = safeDetails.imageUrl();
        this.url = safeDetails.url();
        this.expiryDate = expiryDate;
        initializeTimestamps();
    }

    private void validateConstructorParams(String name, String brands, String quantity, Integer stockQuantity) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("상품명은 필수입니다");
        }
        if (brands == null || brands.isBlank()) {
            throw new IllegalArgumentException("브랜드는 필수입니다");
        }
        if (quantity == null || quantity.isBlank()) {
            throw new IllegalArgumentException("용량 정보는 필수입니다");
        }
        if (stockQuantity != null && stockQuantity < 1) {
            throw new IllegalArgumentException("보유 수량은 1 이상이어야 합니다");
        }
    }

    /**
     * 유통기한을 변경합니다.
     *
     * @param expiryDate 새 유통기한
     * @return 값이 실제로 바뀌었으면 true, 기존 값과 같으면 false
     */
    public boolean changeExpiryDate(String expiryDate) {
        if (expiryDate == null || expiryDate.isBlank()) {
            throw new IllegalArgumentException("유통기한은 필수입니다");
        }
        if (Objects.equals(this.expiryDate, expiryDate)) {
            return false;
        }
        this.expiryDate = expiryDate;
        updateTimestamp();
        return true;
    }

    /**
     * 보유 수량을 덮어씁니다. 0으로 만드는 경우는 삭제로 처리되므로 여기서 받지 않습니다.
     *
     * @throws IllegalArgumentException 수량이 1 미만인 경우
     */
    public void changeStockQuantity(int stockQuantity) {
        if (stockQuantity < 1) {
            throw new IllegalArgumentException("보유 수량은 1 이상이어야 합니다");
        }
        this.stockQuantity = stockQuantity;
        updateTimestamp();
    }
}
