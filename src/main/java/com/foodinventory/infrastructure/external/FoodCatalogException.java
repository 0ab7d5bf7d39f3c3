package com.foodinventory.infrastructure.external;

/**
 * 외부 카탈로그 호출 실패
 */
public class FoodCatalogException extends RuntimeException {

    public FoodCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
