package com.foodinventory.domain.vo;

/**
 * 카탈로그에서 넘어온 선택 항목 묶음
 * 값이 없으면 null 그대로 두며 기본값으로 채우지 않습니다.
 */
public record ProductDetails(
    String ingredients,
    String categories,
    String imageUrl,
    String url
) {

    public static ProductDetails empty() {
        return new ProductDetails(null, null, null, null);
    }
}
