package com.foodinventory.interfaces.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodinventory.application.dto.AddInventoryItemRequest;
import com.foodinventory.application.dto.CatalogProductResponse;
import com.foodinventory.application.dto.ExpiryDateUpdateRequest;
import com.foodinventory.application.dto.InventoryEntryResponse;
import com.foodinventory.application.dto.InventoryItemResponse;
import com.foodinventory.application.dto.StockQuantityUpdateRequest;
import com.foodinventory.application.service.FoodSearchService;
import com.foodinventory.application.service.InventoryService;
import com.foodinventory.domain.service.StockQuantityUpdateResult;
import com.foodinventory.dto.ResponseCode;
import com.foodinventory.exception.BusinessException;
import com.foodinventory.exception.RequiredFieldsMissingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(FoodInventoryController.class)
@DisplayName("FoodInventoryController 테스트")
class FoodInventoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private InventoryService inventoryService;

    @MockBean
    private FoodSearchService foodSearchService;

    private static InventoryItemResponse itemResponse(long id) {
        return new InventoryItemResponse(id, "Milk", "Acme", "1L", 1,
                null, null, null, null, null, null, null);
    }

    @Test
    @DisplayName("카탈로그를 검색한다")
    void search() throws Exception {
        // given
        when(foodSearchService.search("milk")).thenReturn(List.of(
                new CatalogProductResponse("Whole Milk", "Acme", "1 L", "Dairies",
                        "No image available", "No URL available", "milk")
        ));

        // when & then
        mockMvc.perform(get("/api/food/search").param("search", "milk"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Whole Milk"))
                .andExpect(jsonPath("$[0].imageUrl").value("No image available"));
    }

    @Test
    @DisplayName("검색어 없이 검색하면 400을 반환한다")
    void search_WithoutTerm() throws Exception {
        // given
        when(foodSearchService.search(null))
                .thenThrow(new BusinessException(ResponseCode.CATALOG_SEARCH_TERM_REQUIRED));

        // when & then
        mockMvc.perform(get("/api/food/search"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("CATALOG_3400"))
                .andExpect(jsonPath("$.error").value("검색어를 입력해주세요."));
    }

    @Test
    @DisplayName("품목을 등록하면 201과 저장된 품목을 반환한다")
    void addItem() throws Exception {
        // given
        AddInventoryItemRequest request =
                new AddInventoryItemRequest("Milk", "Acme", "1L", null, null, null, null, null, null);
        when(inventoryService.addItem(any(AddInventoryItemRequest.class))).thenReturn(itemResponse(1L));

        // when & then
        mockMvc.perform(post("/api/food/add")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value(ResponseCode.INVENTORY_ITEM_ADDED.getMessage()))
                .andExpect(jsonPath("$.item.id").value(1L))
                .andExpect(jsonPath("$.item.name").value("Milk"));
    }

    @Test
    @DisplayName("필수 항목이 없으면 400과 항목별 누락 정보를 반환한다")
    void addItem_MissingFields() throws Exception {
        // given
        Map<String, Boolean> missing = new LinkedHashMap<>();
        missing.put("name", false);
        missing.put("brands", true);
        missing.put("quantity", false);
        when(inventoryService.addItem(any(AddInventoryItemRequest.class)))
                .thenThrow(new RequiredFieldsMissingException(missing));

        // when & then
        mockMvc.perform(post("/api/food/add")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Milk\",\"quantity\":\"1L\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVENTORY_2400"))
                .andExpect(jsonPath("$.missingFields.name").value(false))
                .andExpect(jsonPath("$.missingFields.brands").value(true))
                .andExpect(jsonPath("$.missingFields.quantity").value(false));
    }

    @Test
    @DisplayName("JSON 형식이 잘못된 요청은 400을 반환한다")
    void addItem_MalformedBody() throws Exception {
        // when & then
        mockMvc.perform(post("/api/food/add")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("COMMON_1400"));

        verifyNoInteractions(inventoryService);
    }

    @Test
    @DisplayName("재고 목록을 조회한다")
    void getInventory() throws Exception {
        // given
        when(inventoryService.getInventory()).thenReturn(List.of(
                new InventoryEntryResponse(3L, "Milk", "Acme", "1L", 1, null, null, null, null, null, 2)
        ));

        // when & then
        mockMvc.perform(get("/api/food/inventory"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(3L))
                .andExpect(jsonPath("$[0].count").value(2));
    }

    @Test
    @DisplayName("형식이 잘못된 ID로 조회하면 400을 반환한다")
    void getItem_InvalidId() throws Exception {
        // given
        when(inventoryService.getItem("abc"))
                .thenThrow(new BusinessException(ResponseCode.INVENTORY_INVALID_ID));

        // when & then
        mockMvc.perform(get("/api/food/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVENTORY_2401"));
    }

    @Test
    @DisplayName("없는 품목을 조회하면 404를 반환한다")
    void getItem_NotFound() throws Exception {
        // given
        when(inventoryService.getItem("7"))
                .thenThrow(new BusinessException(ResponseCode.INVENTORY_ITEM_NOT_FOUND));

        // when & then
        mockMvc.perform(get("/api/food/7"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("품목을 찾을 수 없습니다."));
    }

    @Test
    @DisplayName("유통기한을 변경한다")
    void updateExpiryDate() throws Exception {
        // when & then
        mockMvc.perform(patch("/api/food/update/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ExpiryDateUpdateRequest("2026-12-01"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("INVENTORY_2001"));

        verify(inventoryService).updateExpiryDate("1", "2026-12-01");
    }

    @Test
    @DisplayName("수량을 0으로 변경하면 deleted=true를 반환한다")
    void updateStockQuantity_Deleted() throws Exception {
        // given
        when(inventoryService.updateStockQuantity("1", 0)).thenReturn(StockQuantityUpdateResult.DELETED);

        // when & then
        mockMvc.perform(put("/api/food/update/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new StockQuantityUpdateRequest(0))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(true))
                .andExpect(jsonPath("$.code").value("INVENTORY_2003"));
    }

    @Test
    @DisplayName("수량을 양수로 변경하면 deleted=false를 반환한다")
    void updateStockQuantity_Updated() throws Exception {
        // given
        when(inventoryService.updateStockQuantity("1", 3)).thenReturn(StockQuantityUpdateResult.UPDATED);

        // when & then
        mockMvc.perform(put("/api/food/update/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(false));
    }

    @Test
    @DisplayName("전체 삭제는 단건 삭제 경로와 구분되어 삭제 개수를 반환한다")
    void deleteAllItems() throws Exception {
        // given
        when(inventoryService.deleteAllItems()).thenReturn(3L);

        // when & then
        mockMvc.perform(delete("/api/food/delete/all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deletedCount").value(3))
                .andExpect(jsonPath("$.code").value("INVENTORY_2005"));

        verify(inventoryService).deleteAllItems();
    }

    @Test
    @DisplayName("비어 있는 재고를 전체 삭제하면 404를 반환한다")
    void deleteAllItems_Empty() throws Exception {
        // given
        when(inventoryService.deleteAllItems()).thenThrow(new BusinessException(ResponseCode.INVENTORY_EMPTY));

        // when & then
        mockMvc.perform(delete("/api/food/delete/all"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("INVENTORY_2406"));
    }

    @Test
    @DisplayName("품목을 삭제한다")
    void deleteItem() throws Exception {
        // when & then
        mockMvc.perform(delete("/api/food/delete/5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("INVENTORY_2004"));

        verify(inventoryService).deleteItem("5");
    }

    @Test
    @DisplayName("저장소 오류는 500을 반환한다")
    void deleteItem_StoreError() throws Exception {
        // given
        doThrow(new BusinessException(ResponseCode.INVENTORY_STORE_ERROR))
                .when(inventoryService).deleteItem("5");

        // when & then
        mockMvc.perform(delete("/api/food/delete/5"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INVENTORY_2500"));
    }

    @Test
    @DisplayName("서비스에서 변환되지 않은 트랜잭션 예외도 INVENTORY_STORE_ERROR로 응답한다")
    void transactionException_MapsToStoreError() throws Exception {
        // given
        when(inventoryService.getInventory())
                .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager for transaction"));

        // when & then
        mockMvc.perform(get("/api/food/inventory"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INVENTORY_2500"));
    }
}
