package com.vigil.data;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the item metadata known at decision time.
 *
 * <p>The run loop builds one from {@link ItemMetaCache} before each decision; the
 * decision engine only ever reads it.
 */
public final class ItemCatalog {

    public static final ItemCatalog EMPTY = new ItemCatalog(Collections.emptyMap());

    private final Map<Integer, ItemMeta> byId;

    private ItemCatalog(Map<Integer, ItemMeta> byId) {
        this.byId = byId;
    }

    public static ItemCatalog of(Collection<ItemMeta> metas) {
        Map<Integer, ItemMeta> map = new HashMap<>();
        for (ItemMeta meta : metas) {
            if (meta != null && meta.getId() > 0) {
                map.put(meta.getId(), meta);
            }
        }
        return new ItemCatalog(Collections.unmodifiableMap(map));
    }

    @Nullable
    public ItemMeta get(int itemId) {
        return byId.get(itemId);
    }

    public Optional<ItemMeta> find(int itemId) {
        return Optional.ofNullable(byId.get(itemId));
    }

    public boolean contains(int itemId) {
        return byId.containsKey(itemId);
    }

    public int size() {
        return byId.size();
    }
}
