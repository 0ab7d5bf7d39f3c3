package com.foodinventory.application.dto;

import com.foodinventory.domain.vo.ProductDetails;

/**
 * 재고 등록 요청
 * 필수 항목(name, brands, quantity) 검증은 항목별 누락 정보를 내려주기 위해 서비스에서 수행합니다.
 */
public record AddInventoryItemRequest(
    String name,
    String brands,
    String quantity,
    String ingredients,
    String categories,
    String imageUrl,
    String url,
    String expiryDate,
    Integer stockQuantity
) {

    public ProductDetails toDetails() {
        return new ProductDetails(ingredients, categories, imageUrl, url);
    }
}
