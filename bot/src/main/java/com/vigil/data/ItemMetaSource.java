package com.vigil.data;

import java.io.IOException;
import java.util.Optional;

/**
 * Read-only access to the loot catalog.
 */
public interface ItemMetaSource {

    /**
     * @param itemId item id, always positive
     * @return the catalog entry, or empty when the catalog has no such item
     * @throws IOException when the catalog could not be reached
     */
    Optional<ItemMeta> fetchItemMeta(int itemId) throws IOException;
}
