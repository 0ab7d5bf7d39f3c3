package com.foodinventory.api;

import com.foodinventory.application.dto.AddInventoryItemRequest;
import com.foodinventory.application.dto.AddInventoryItemResponse;
import com.foodinventory.application.dto.CatalogProductResponse;
import com.foodinventory.application.dto.ExpiryDateUpdateRequest;
import com.foodinventory.application.dto.InventoryEntryResponse;
import com.foodinventory.application.dto.InventoryItemResponse;
import com.foodinventory.application.dto.StockQuantityUpdateRequest;
import com.foodinventory.dto.MessageResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

@Tag(name = "Food", description = "식품 검색 및 재고 API")
@RequestMapping("/api/food")
public interface FoodInventoryApi {

    @Operation(summary = "식품 검색", description = "Open Food Facts에서 검색어로 상품 후보를 조회합니다.")
    @GetMapping("/search")
    List<CatalogProductResponse> search(
            @Parameter(description = "검색어", required = true, example = "milk")
            @RequestParam(name = "search", required = false) String search
    );

    @Operation(summary = "재고 등록", description = "선택한 상품을 재고에 추가합니다. name, brands, quantity는 필수입니다.")
    @PostMapping("/add")
    ResponseEntity<AddInventoryItemResponse> addItem(@RequestBody AddInventoryItemRequest request);

    @Operation(summary = "재고 목록 조회", description = "같은 (name, brands) 품목을 묶어 count와 함께 조회합니다.")
    @GetMapping("/inventory")
    List<InventoryEntryResponse> getInventory();

    @Operation(summary = "재고 품목 조회", description = "ID로 품목 하나를 조회합니다.")
    @GetMapping("/{id}")
    InventoryItemResponse getItem(
            @Parameter(description = "품목 ID", required = true, example = "1")
            @PathVariable("id") String id
    );

    @Operation(summary = "유통기한 변경", description = "품목의 유통기한만 변경합니다.")
    @PatchMapping("/update/{id}")
    MessageResponse updateExpiryDate(
            @Parameter(description = "품목 ID", required = true, example = "1")
            @PathVariable("id") String id,
            @RequestBody ExpiryDateUpdateRequest request
    );

    @Operation(summary = "보유 수량 변경", description = "보유 수량을 변경합니다. 0이면 품목이 삭제됩니다.")
    @PutMapping("/update/{id}")
    MessageResponse updateStockQuantity(
            @Parameter(description = "품목 ID", required = true, example = "1")
            @PathVariable("id") String id,
            @RequestBody StockQuantityUpdateRequest request
    );

    @Operation(summary = "전체 재고 삭제", description = "모든 품목을 삭제합니다. 삭제할 품목이 없으면 404를 반환합니다.")
    @DeleteMapping("/delete/all")
    MessageResponse deleteAllItems();

    @Operation(summary = "재고 품목 삭제", description = "ID로 품목 하나를 삭제합니다.")
    @DeleteMapping("/delete/{id}")
    MessageResponse deleteItem(
            @Parameter(description = "품목 ID", required = true, example = "1")
            @PathVariable("id") String id
    );
}
