package com.foodinventory.interfaces.controller;

import com.foodinventory.api.FoodInventoryApi;
import com.foodinventory.application.dto.AddInventoryItemRequest;
import com.foodinventory.application.dto.AddInventoryItemResponse;
import com.foodinventory.application.dto.CatalogProductResponse;
import com.foodinventory.application.dto.ExpiryDateUpdateRequest;
import com.foodinventory.application.dto.InventoryEntryResponse;
import com.foodinventory.application.dto.InventoryItemResponse;
import com.foodinventory.application.dto.StockQuantityUpdateRequest;
import com.foodinventory.application.service.FoodSearchService;
import com.foodinventory.application.service.InventoryService;
import com.foodinventory.domain.service.StockQuantityUpdateResult;
import com.foodinventory.dto.MessageResponse;
import com.foodinventory.dto.ResponseCode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class FoodInventoryController implements FoodInventoryApi {

    private final FoodSearchService foodSearchService;
    private final InventoryService inventoryService;

    @Override
    public List<CatalogProductResponse> search(String search) {
        return foodSearchService.search(search);
    }

    @Override
    public ResponseEntity<AddInventoryItemResponse> addItem(AddInventoryItemRequest request) {
        InventoryItemResponse item = inventoryService.addItem(request);
        return ResponseEntity
                .status(ResponseCode.INVENTORY_ITEM_ADDED.getHttpStatus())
                .body(new AddInventoryItemResponse(ResponseCode.INVENTORY_ITEM_ADDED.getMessage(), item));
    }

    @Override
    public List<InventoryEntryResponse> getInventory() {
        return inventoryService.getInventory();
    }

    @Override
    public InventoryItemResponse getItem(String id) {
        return inventoryService.getItem(id);
    }

    @Override
    public MessageResponse updateExpiryDate(String id, ExpiryDateUpdateRequest request) {
        inventoryService.updateExpiryDate(id, request.expiryDate());
        return MessageResponse.of(ResponseCode.INVENTORY_EXPIRY_UPDATED);
    }

    @Override
    public MessageResponse updateStockQuantity(String id, StockQuantityUpdateRequest request) {
        StockQuantityUpdateResult result = inventoryService.updateStockQuantity(id, request.quantity());
        if (result == StockQuantityUpdateResult.DELETED) {
            return MessageResponse.quantityChanged(ResponseCode.INVENTORY_ITEM_REMOVED_BY_ZERO_QUANTITY, true);
        }
        return MessageResponse.quantityChanged(ResponseCode.INVENTORY_QUANTITY_UPDATED, false);
    }

    @Override
    public MessageResponse deleteAllItems() {
        long deletedCount = inventoryService.deleteAllItems();
        return MessageResponse.bulkDeleted(ResponseCode.INVENTORY_ALL_DELETED, deletedCount);
    }

    @Override
    public MessageResponse deleteItem(String id) {
        inventoryService.deleteItem(id);
        return MessageResponse.of(ResponseCode.INVENTORY_ITEM_DELETED);
    }
}
