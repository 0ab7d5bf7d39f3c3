package com.foodinventory.application.dto;

public record ExpiryDateUpdateRequest(
    String expiryDate
) {}
