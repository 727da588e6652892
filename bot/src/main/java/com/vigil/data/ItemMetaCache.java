package com.vigil.data;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Process-lifetime cache of loot catalog entries.
 *
 * <p>Catalog entries are immutable once minted, so there is no expiry. Lookups that
 * fail or come back empty are not cached and will be retried on the next request.
 * Each running identity owns its own process, so the cache is never shared across
 * identities.
 */
@Slf4j
@Singleton
public class ItemMetaCache {

    private final Cache<Integer, ItemMeta> cache;

    @Inject
    public ItemMetaCache() {
        this.cache = CacheBuilder.newBuilder()
                .recordStats()
                .build();
    }

    /**
     * Get one entry, fetching it from the source on a miss.
     */
    public Optional<ItemMeta> get(ItemMetaSource source, int itemId) throws IOException {
        if (itemId <= 0) {
            return Optional.empty();
        }
        ItemMeta cached = cache.getIfPresent(itemId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<ItemMeta> fetched = source.fetchItemMeta(itemId);
        fetched.ifPresent(meta -> cache.put(itemId, meta));
        return fetched;
    }

    /**
     * Build a catalog for the given ids. Zero ids and duplicates are skipped; ids
     * whose lookup fails are left out of the catalog, and the decision engine treats
     * them as unknown items.
     */
    public ItemCatalog catalogFor(ItemMetaSource source, Collection<Integer> itemIds) {
        Set<Integer> unique = new LinkedHashSet<>();
        for (Integer id : itemIds) {
            if (id != null && id > 0) {
                unique.add(id);
            }
        }

        List<ItemMeta> metas = new ArrayList<>(unique.size());
        for (int id : unique) {
            try {
                get(source, id).ifPresent(metas::add);
            } catch (IOException e) {
                log.warn("Item metadata lookup failed for id {}: {}", id, e.getMessage());
            }
        }
        return ItemCatalog.of(metas);
    }

    public long size() {
        return cache.size();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }
}
