package com.foodinventory.application.dto;

import com.foodinventory.infrastructure.external.OpenFoodFactsProduct;

/**
 * 카탈로그 검색 결과 (아직 재고에 저장되지 않은 후보 상품)
 * 외부 응답에 없는 필드는 고정 안내 문구로 채웁니다.
 */
public record CatalogProductResponse(
    String name,
    String brands,
    String quantity,
    String categories,
    String imageUrl,
    String url,
    String ingredients
) {

    static final String NO_NAME = "No name available";
    static final String NO_BRAND = "No brand information";
    static final String UNKNOWN_QUANTITY = "Unknown quantity";
    static final String NO_CATEGORIES = "No categories available";
    static final String NO_IMAGE = "No image available";
    static final String NO_URL = "No URL available";
    static final String NO_INGREDIENTS = "No ingredients information";

    public static CatalogProductResponse from(OpenFoodFactsProduct product) {
        return new CatalogProductResponse(
                orDefault(product.productName(), NO_NAME),
                orDefault(product.brands(), NO_BRAND),
                orDefault(product.quantity(), UNKNOWN_QUANTITY),
                orDefault(product.categories(), NO_CATEGORIES),
                orDefault(product.imageUrl(), NO_IMAGE),
                orDefault(product.url(), NO_URL),
                orDefault(product.ingredientsText(), NO_INGREDIENTS)
        );
    }

    private static String orDefault(String value, String placeholder) {
        return value == null || value.isEmpty() ? placeholder : value;
    }
}
