package com.foodinventory.domain.entity.base;

import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;

/**
 * 모든 Entity의 기본 클래스
 * 저장소가 발급하는 ID를 공통으로 관리합니다.
 */
@MappedSuperclass
@Getter
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * InMemory 저장소 전용: 저장 시점에 한 번만 ID를 발급합니다.
     */
    public void assignId(Long id) {
        if (this.id != null) {
            throw new IllegalStateException("이미 ID가 발급된 엔티티입니다: " + this.id);
        }
        this.id = id;
    }
}
