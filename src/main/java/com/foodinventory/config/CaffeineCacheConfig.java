package com.foodinventory.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine 로컬 캐시 설정
 *
 * 외부 카탈로그 검색 결과만 캐싱합니다.
 * - 같은 검색어 반복 호출 시 Open Food Facts 호출을 줄임
 * - 예외는 캐싱되지 않으므로 외부 장애 응답이 남지 않음
 * - 재고 목록 집계는 캐싱하지 않음 (매 요청 새로 계산)
 */
@Configuration
@EnableCaching
public class CaffeineCacheConfig {

    public static final String FOOD_SEARCH_CACHE = "foodSearch";

    @Bean
    public CacheManager caffeineCacheManager(FoodCatalogProperties properties) {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(FOOD_SEARCH_CACHE);
        cacheManager.setCaffeine(caffeineCacheBuilder(properties));
        return cacheManager;
    }

    private Caffeine<Object, Object> caffeineCacheBuilder(FoodCatalogProperties properties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(properties.getCacheTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(properties.getCacheMaxSize())
                .recordStats();
    }
}
