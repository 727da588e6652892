package com.vigil.decision;

import com.vigil.combat.CombatMath;
import com.vigil.config.PolicyConfig;
import com.vigil.data.DamageType;
import com.vigil.data.ItemCatalog;
import com.vigil.data.ItemMeta;
import com.vigil.data.ItemSlot;
import com.vigil.state.DerivedState;
import com.vigil.state.Item;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Plans one market visit.
 *
 * <p>Potions come first and are bought on their own. Gear is collected into a single
 * order in priority order: early weapon upgrade, empty armor coverage, jewelry, then
 * opportunistic tier upgrades. Gear never spends the configured gold reserve, which is
 * kept for future potions.
 */
public final class MarketPlanner {

    private final DerivedState state;
    private final PolicyConfig policy;
    private final ItemCatalog catalog;
    private final ItemScorer scorer;

    private final List<ItemPurchase> purchases = new ArrayList<>();
    private final Set<ItemSlot> plannedSlots = EnumSet.noneOf(ItemSlot.class);
    private final List<String> reasons = new ArrayList<>();
    private int budget;

    public MarketPlanner(DerivedState state, PolicyConfig policy, ItemCatalog catalog) {
        this.state = state;
        this.policy = policy;
        this.catalog = catalog;
        this.scorer = new ItemScorer(policy, catalog, state.getLevel(), state.getEquipment());
    }

    public Optional<Action> plan() {
        Optional<Action> potions = planPotions();
        if (potions.isPresent()) {
            return potions;
        }

        budget = state.getGold() - policy.getGoldReserve();
        if (budget <= 0) {
            return Optional.empty();
        }

        planEarlyWeapon();
        planArmorCoverage();
        planJewelry();
        planUpgrades();

        if (purchases.isEmpty()) {
            return Optional.empty();
        }
        PurchaseOrder order = new PurchaseOrder(purchases, 0);
        return Optional.of(Action.of(ActionType.BUY_ITEMS,
                String.join("; ", reasons) + " (total " + order.totalPrice() + " gold)", order));
    }

    // ========================================================================
    // Potions
    // ========================================================================

    /**
     * Heal below the target, raising the target toward near-full when potions cost
     * the floor price. Never buy more than fits under max hp.
     */
    Optional<Action> planPotions() {
        int maxHp = state.getMaxHp();
        if (maxHp <= 0 || state.getHp() >= maxHp) {
            return Optional.empty();
        }

        int price = CombatMath.potionPrice(state.getLevel(), state.getStats().getCharisma());
        double target = price <= CombatMath.MIN_PRICE
                ? Math.max(policy.getBuyPotionIfBelowPct(), policy.getCheapPotionHealTargetPct())
                : policy.getBuyPotionIfBelowPct();
        if (state.getHpPct() >= target) {
            return Optional.empty();
        }

        int missing = maxHp - state.getHp();
        int withoutOvershoot = missing / CombatMath.POTION_HEAL;
        int toTarget = (int) Math.ceil((target * maxHp - state.getHp()) / CombatMath.POTION_HEAL);
        int affordable = state.getGold() / price;
        int count = Math.min(Math.min(withoutOvershoot, Math.max(1, toTarget)), affordable);
        if (count <= 0) {
            return Optional.empty();
        }

        PotionPurchase purchase = new PotionPurchase(count, price);
        return Optional.of(Action.of(ActionType.BUY_POTIONS, String.format(Locale.ROOT,
                "hp %.2f below heal target %.2f, %d potion(s) at %d gold",
                state.getHpPct(), target, count, price), purchase));
    }

    // ========================================================================
    // Gear
    // ========================================================================

    private void planEarlyWeapon() {
        if (state.getLevel() > policy.getEarlyWeaponUpgradeMaxLevel()) {
            return;
        }
        Item weapon = state.getEquipment().get(ItemSlot.WEAPON);
        ItemMeta current = weapon != null ? catalog.get(weapon.getId()) : null;
        int currentTier = current != null && current.hasKnownTier() ? current.getTier() : 5;

        Optional<ItemMeta> best = offers(ItemSlot.WEAPON).stream()
                .filter(meta -> meta.hasKnownTier() && currentTier - meta.getTier() >= policy.getEarlyWeaponMinTierGain())
                .filter(this::affordable)
                .min(Comparator.comparingInt(ItemMeta::getTier).thenComparingInt(this::price));
        best.ifPresent(meta -> add(meta, "early weapon T" + currentTier + " -> T" + meta.getTier()));
    }

    /**
     * With several armor slots empty, buy the cheapest viable piece first so more
     * slots get covered; with one empty slot, buy the best affordable piece.
     */
    private void planArmorCoverage() {
        List<ItemSlot> empty = new ArrayList<>(state.getEquipment().emptyArmorSlots());
        empty.removeAll(plannedSlots);
        if (empty.isEmpty()) {
            return;
        }

        boolean coverageFirst = empty.size() > 1;
        List<ItemMeta> candidates = new ArrayList<>();
        for (ItemSlot slot : empty) {
            candidates.addAll(offers(slot));
        }
        Comparator<ItemMeta> order = coverageFirst
                ? Comparator.comparingInt(this::price).thenComparingInt(MarketPlanner::tierOrWorst)
                : Comparator.comparingInt(MarketPlanner::tierOrWorst).thenComparingInt(this::price);
        candidates.sort(order);

        for (ItemMeta meta : candidates) {
            if (!plannedSlots.contains(meta.getSlot()) && affordable(meta)) {
                add(meta, "cover empty " + meta.getSlot().name().toLowerCase(Locale.ROOT));
            }
        }
    }

    private void planJewelry() {
        if (state.getEquipment().isEmpty(ItemSlot.RING) && !plannedSlots.contains(ItemSlot.RING)) {
            offers(ItemSlot.RING).stream()
                    .filter(this::affordable)
                    .max(Comparator.comparingDouble(this::ringValue))
                    .ifPresent(meta -> add(meta, "ring " + meta.getId()));
        }

        DamageType dominant = scorer.getDominantArmor();
        int wanted = CombatMath.neckItemFor(dominant);
        if (wanted > 0 && state.getEquipment().isEmpty(ItemSlot.NECK) && !plannedSlots.contains(ItemSlot.NECK)) {
            offers(ItemSlot.NECK).stream()
                    .filter(meta -> meta.getId() == wanted)
                    .filter(this::affordable)
                    .findFirst()
                    .ifPresent(meta -> add(meta, "neck matching " + dominant.name().toLowerCase(Locale.ROOT) + " armor"));
        }
    }

    /**
     * Replace equipped weapon or armor when a fresh item's base power beats the
     * current power by the configured margin.
     */
    private void planUpgrades() {
        for (ItemSlot slot : ItemSlot.values()) {
            if (slot != ItemSlot.WEAPON && !slot.isArmor()) {
                continue;
            }
            Item equipped = state.getEquipment().get(slot);
            if (equipped == null || plannedSlots.contains(slot)) {
                continue;
            }
            double current = scorer.score(equipped);
            double required = current * (1.0 + policy.getMarketUpgradeMargin());
            offers(slot).stream()
                    .filter(meta -> CombatMath.itemPower(0, meta.getTier()) > required)
                    .filter(this::affordable)
                    .max(Comparator.comparingInt((ItemMeta meta) -> CombatMath.itemPower(0, meta.getTier())))
                    .ifPresent(meta -> add(meta, "upgrade " + slot.name().toLowerCase(Locale.ROOT)
                            + " to T" + meta.getTier()));
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private List<ItemMeta> offers(ItemSlot slot) {
        List<ItemMeta> offers = new ArrayList<>();
        for (int id : state.getMarket()) {
            ItemMeta meta = catalog.get(id);
            if (meta != null && meta.getSlot() == slot && !state.getEquipment().isEquipped(id) && !owned(id)) {
                offers.add(meta);
            }
        }
        return offers;
    }

    private boolean owned(int itemId) {
        for (Item item : state.getBagItems()) {
            if (item.getId() == itemId) {
                return true;
            }
        }
        return false;
    }

    private int price(ItemMeta meta) {
        return CombatMath.itemPrice(meta.getTier(), state.getStats().getCharisma());
    }

    private boolean affordable(ItemMeta meta) {
        return price(meta) <= budget;
    }

    private double ringValue(ItemMeta meta) {
        double value = CombatMath.tierMultiplier(meta.getTier());
        return meta.getId() == policy.getPreferredRingId() ? value * policy.getPreferredRingBonus() : value;
    }

    private void add(ItemMeta meta, String reason) {
        int price = price(meta);
        purchases.add(new ItemPurchase(meta.getId(), true, meta.getSlot(), price));
        plannedSlots.add(meta.getSlot());
        reasons.add(reason);
        budget -= price;
    }

    private static int tierOrWorst(ItemMeta meta) {
        return meta.hasKnownTier() ? meta.getTier() : 5;
    }
}
