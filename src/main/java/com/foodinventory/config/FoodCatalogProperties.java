package com.foodinventory.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Open Food Facts 연동 설정 (prefix: food-catalog)
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "food-catalog")
@Validated
public class FoodCatalogProperties {

    @NotBlank
    private String baseUrl = "https://world.openfoodfacts.org";

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(3);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(10);

    @Min(1)
    private long cacheTtlSeconds = 300;

    @Min(1)
    private long cacheMaxSize = 500;
}
