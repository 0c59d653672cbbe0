package com.example.bulk_campaign.generator;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

/**
 * 順序付きリストを連続したチャンクに分割する。
 * size 未指定または 0 以下なら 1件ずつのグループ。最後のチャンクは短くてよい。
 */
@Component
public class Grouper {

    public <T> List<List<T>> group(List<T> items, Integer size) {
        List<List<T>> groups = new ArrayList<>();
        if (items == null || items.isEmpty()) {
            return groups;
        }
        if (size == null || size <= 0) {
            for (T item : items) {
                groups.add(List.of(item));
            }
            return groups;
        }
        for (int i = 0; i < items.size(); i += size) {
            groups.add(List.copyOf(items.subList(i, Math.min(i + size, items.size()))));
        }
        return groups;
    }
}
