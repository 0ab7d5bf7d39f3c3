package com.foodinventory.infrastructure.external;

import java.util.List;

/**
 * 외부 식품 카탈로그 연동
 */
public interface FoodCatalogClient {

    /**
     * 자유 검색어로 카탈로그를 조회합니다.
     *
     * @param term 앞뒤 공백이 제거된 검색어
     * @return 카탈로그 원본 상품 목록 (결과가 없으면 빈 목록)
     * @throws FoodCatalogException 외부 호출 실패 또는 응답을 해석할 수 없는 경우
     */
    List<OpenFoodFactsProduct> search(String term);
}
