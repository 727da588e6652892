package com.vigil.data;

import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

public class ItemMetaCacheTest {

    @Mock
    private ItemMetaSource source;

    private ItemMetaCache cache;

    private static ItemMeta meta(int id, int tier, ItemSlot slot, DamageType type) {
        return ItemMeta.builder().id(id).tier(tier).slot(slot).damageType(type).build();
    }

    @Before
    public void setUp() throws IOException {
        MockitoAnnotations.openMocks(this);
        cache = new ItemMetaCache();
        when(source.fetchItemMeta(anyInt())).thenReturn(Optional.empty());
        when(source.fetchItemMeta(12)).thenReturn(Optional.of(meta(12, 5, ItemSlot.WEAPON, DamageType.BLUDGEON)));
        when(source.fetchItemMeta(3)).thenReturn(Optional.of(meta(3, 1, ItemSlot.NECK, DamageType.NECKLACE)));
    }

    @Test
    public void testGet_FetchesOnceThenServesFromCache() throws IOException {
        assertTrue(cache.get(source, 12).isPresent());
        assertTrue(cache.get(source, 12).isPresent());

        verify(source, times(1)).fetchItemMeta(12);
        assertEquals(1, cache.size());
        assertEquals(1, cache.hitCount());
    }

    @Test
    public void testGet_ZeroIdNeverHitsSource() throws IOException {
        assertFalse(cache.get(source, 0).isPresent());
        verify(source, never()).fetchItemMeta(anyInt());
    }

    @Test
    public void testGet_EmptyResultsAreNotCached() throws IOException {
        assertFalse(cache.get(source, 99).isPresent());
        assertFalse(cache.get(source, 99).isPresent());

        verify(source, times(2)).fetchItemMeta(99);
        assertEquals(0, cache.size());
    }

    @Test
    public void testCatalogFor_SkipsZeroAndDuplicates() throws IOException {
        ItemCatalog catalog = cache.catalogFor(source, Arrays.asList(12, 0, 12, 3, null));

        assertEquals(2, catalog.size());
        assertEquals(ItemSlot.WEAPON, catalog.get(12).getSlot());
        assertEquals(DamageType.NECKLACE, catalog.get(3).getDamageType());
        verify(source, times(1)).fetchItemMeta(12);
        verify(source, never()).fetchItemMeta(0);
    }

    @Test
    public void testCatalogFor_FailedLookupIsLeftOutAndRetried() throws IOException {
        when(source.fetchItemMeta(40)).thenThrow(new IOException("bridge down"))
                .thenReturn(Optional.of(meta(40, 2, ItemSlot.CHEST, DamageType.METAL)));

        ItemCatalog first = cache.catalogFor(source, Arrays.asList(12, 40));
        assertTrue(first.contains(12));
        assertFalse(first.contains(40));
        assertNull(first.get(40));

        ItemCatalog second = cache.catalogFor(source, Arrays.asList(12, 40));
        assertTrue(second.contains(40));
        assertEquals(2, second.get(40).getTier());
    }

    @Test
    public void testItemMeta_DefaultsToNoneSlotAndType() {
        ItemMeta unknown = ItemMeta.builder().id(5).build();
        assertEquals(ItemSlot.NONE, unknown.getSlot());
        assertEquals(DamageType.NONE, unknown.getDamageType());
        assertFalse(unknown.hasKnownTier());
    }
}
