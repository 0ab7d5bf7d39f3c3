package com.foodinventory.infrastructure.external;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Open Food Facts 검색 결과의 상품 항목
 * 상품마다 채워진 필드가 다르므로 모든 값이 null일 수 있습니다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenFoodFactsProduct(
    @JsonProperty("product_name") String productName,
    @JsonProperty("brands") String brands,
    @JsonProperty("quantity") String quantity,
    @JsonProperty("categories") String categories,
    @JsonProperty("image_url") String imageUrl,
    @JsonProperty("url") String url,
    @JsonProperty("ingredients_text") String ingredientsText
) {
}
