package com.foodinventory.infrastructure.external;

import com.foodinventory.config.CaffeineCacheConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * Open Food Facts 검색 API 연동
 *
 * GET {baseUrl}/cgi/search.pl?search_terms={term}&json=true
 * 재시도는 하지 않으며, 성공한 응답만 검색어 단위로 캐싱합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenFoodFactsCatalogClient implements FoodCatalogClient {

    private static final String SEARCH_PATH = "/cgi/search.pl";

    private final RestClient foodCatalogRestClient;

    @Override
    @Cacheable(value = CaffeineCacheConfig.FOOD_SEARCH_CACHE, key = "#term", sync = true)
    public List<OpenFoodFactsProduct> search(String term) {
        log.info("Open Food Facts 검색 요청: term={}", term);

        OpenFoodFactsSearchResponse response;
        try {
            response = foodCatalogRestClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path(SEARCH_PATH)
                            .queryParam("search_terms", "{term}")
                            .queryParam("json", true)
                            .build(term))
                    .retrieve()
                    .body(OpenFoodFactsSearchResponse.class);
        } catch (RestClientException e) {
            throw new FoodCatalogException("Open Food Facts 검색 호출에 실패했습니다: term=" + term, e);
        }

        if (response == null || response.products() == null) {
            return List.of();
        }
        return response.products();
    }
}
