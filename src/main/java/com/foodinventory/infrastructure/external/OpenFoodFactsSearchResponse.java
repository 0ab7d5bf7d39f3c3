package com.foodinventory.infrastructure.external;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenFoodFactsSearchResponse(
    List<OpenFoodFactsProduct> products
) {
}
