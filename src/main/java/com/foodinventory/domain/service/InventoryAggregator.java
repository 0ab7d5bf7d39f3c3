package com.foodinventory.domain.service;

import com.foodinventory.domain.entity.InventoryItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 재고 집계기
 *
 * 저장소 전체 조회 결과를 (name, brands) 기준으로 묶어 개수를 셉니다.
 * - 키 비교는 대소문자를 구분하며 정규화하지 않습니다 ("Acme"와 "ACME"는 다른 그룹)
 * - 결과 순서는 각 키가 처음 등장한 순서입니다
 * - 그룹의 필드 값은 마지막으로 읽힌 품목의 값입니다
 *
 * 상태를 갖지 않으며 조회 요청마다 새로 계산합니다.
 */
@Component
public class InventoryAggregator {

    public List<AggregatedInventoryItem> aggregate(List<InventoryItem> items) {
        Map<GroupingKey, Group> groups = new LinkedHashMap<>();
        for (InventoryItem item : items) {
            GroupingKey key = new GroupingKey(item.getName(), item.getBrands());
            Group group = groups.get(key);
            if (group == null) {
                groups.put(key, new Group(item));
            } else {
                group.add(item);
            }
        }

        List<AggregatedInventoryItem> result = new ArrayList<>(groups.size());
        for (Group group : groups.values()) {
            result.add(new AggregatedInventoryItem(group.last, group.count));
        }
        return result;
    }

    private record GroupingKey(String name, String brands) {
    }

    private static final class Group {

        private InventoryItem last;
        private int count;

        private Group(InventoryItem first) {
            this.last = first;
            this.count = 1;
        }

        private void add(InventoryItem item) {
            this.last = item;
            this.count++;
        }
    }
}
