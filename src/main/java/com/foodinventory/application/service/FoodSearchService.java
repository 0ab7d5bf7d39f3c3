package com.foodinventory.application.service;

import com.foodinventory.application.dto.CatalogProductResponse;
import com.foodinventory.dto.ResponseCode;
import com.foodinventory.exception.BusinessException;
import com.foodinventory.infrastructure.external.FoodCatalogClient;
import com.foodinventory.infrastructure.external.FoodCatalogException;
import com.foodinventory.infrastructure.external.OpenFoodFactsProduct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 외부 카탈로그 검색 서비스
 */
@Service
@RequiredArgsConstructor
public class FoodSearchService {

    private final FoodCatalogClient foodCatalogClient;

    public List<CatalogProductResponse> search(String term) {
        if (term == null || term.isBlank()) {
            throw new BusinessException(ResponseCode.CATALOG_SEARCH_TERM_REQUIRED);
        }

        List<OpenFoodFactsProduct> products;
        try {
            products = foodCatalogClient.search(term.trim());
        } catch (FoodCatalogException e) {
            throw new BusinessException(ResponseCode.CATALOG_UPSTREAM_ERROR, e);
        }

        if (products.isEmpty()) {
            throw new BusinessException(ResponseCode.CATALOG_NO_RESULTS);
        }
        return products.stream()
                .map(CatalogProductResponse::from)
                .toList();
    }
}
