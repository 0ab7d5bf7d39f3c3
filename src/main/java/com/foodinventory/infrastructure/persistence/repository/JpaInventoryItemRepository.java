package com.foodinventory.infrastructure.persistence.repository;

import com.foodinventory.domain.entity.InventoryItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface JpaInventoryItemRepository extends JpaRepository<InventoryItem, Long> {

    List<InventoryItem> findAllByOrderByIdAsc();

    /**
     * 값이 달라질 때만 갱신합니다. 반환값 0은 "없음" 또는 "같은 값"입니다.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE InventoryItem i SET i.expiryDate = :expiryDate, i.updatedAt = :now " +
           "WHERE i.id = :id AND (i.expiryDate IS NULL OR i.expiryDate <> :expiryDate)")
    int updateExpiryDateIfChanged(@Param("id") Long id,
                                  @Param("expiryDate") String expiryDate,
                                  @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE InventoryItem i SET i.stockQuantity = :stockQuantity, i.updatedAt = :now WHERE i.id = :id")
    int updateStockQuantity(@Param("id") Long id,
                            @Param("stockQuantity") int stockQuantity,
                            @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM InventoryItem i WHERE i.id = :id")
    int deleteItemById(@Param("id") Long id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM InventoryItem i")
    int deleteAllItems();
}
