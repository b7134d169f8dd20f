package domain.engine;

import domain.collection.ArmorCollections;
import domain.model.ArmorItem;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GreedySelectorTest {

    private final GreedySelector selector = new GreedySelector();

    private final ArmorItem a = new ArmorItem("A", 10.0, 60.0);
    private final ArmorItem b = new ArmorItem("B", 20.0, 100.0);
    private final ArmorItem c = new ArmorItem("C", 30.0, 120.0);

    @Test
    void testSelect_EmptyItems() {
        assertTrue(selector.select(Collections.emptyList(), 100.0).isEmpty());
    }

    @Test
    void testSelect_ZeroBudget() {
        assertTrue(selector.select(Arrays.asList(a, b, c), 0.0).isEmpty());
    }

    @Test
    void testSelect_NegativeBudget() {
        assertTrue(selector.select(Arrays.asList(a, b, c), -5.0).isEmpty());
    }

    @Test
    void testSelect_PicksByEfficiency() {
        // Efficiencies 6, 5, 4: A then B, then C no longer fits
        List<ArmorItem> result = selector.select(Arrays.asList(c, b, a), 50.0);
        assertEquals(Arrays.asList(a, b), result);
        assertEquals(160.0, ArmorCollections.sum(result).getTotalDefense());
        assertEquals(30.0, ArmorCollections.sum(result).getTotalCost());
    }

    @Test
    void testSelect_ItemExactlyFillingBudgetIsEligible() {
        ArmorItem single = new ArmorItem("tower shield", 25.0, 7.0);
        assertEquals(Collections.singletonList(single), selector.select(Collections.singletonList(single), 25.0));
    }

    @Test
    void testSelect_SkipsUnaffordableBestItem() {
        ArmorItem pricey = new ArmorItem("mithril vest", 100.0, 1000.0);
        ArmorItem cheap = new ArmorItem("cloth hood", 5.0, 5.0);
        assertEquals(Collections.singletonList(cheap), selector.select(Arrays.asList(pricey, cheap), 50.0));
    }

    @Test
    void testSelect_EqualEfficiencyFirstFoundWins() {
        ArmorItem small = new ArmorItem("small", 5.0, 10.0);
        ArmorItem large = new ArmorItem("large", 10.0, 20.0);
        // Both have efficiency 2; the first in order is taken, then "large" no longer fits
        assertEquals(Collections.singletonList(small), selector.select(Arrays.asList(small, large), 10.0));
        assertEquals(Collections.singletonList(large), selector.select(Arrays.asList(large, small), 10.0));
    }

    @Test
    void testSelect_IdenticalItemsKeepInputOrder() {
        ArmorItem first = new ArmorItem("twin", 10.0, 20.0);
        ArmorItem second = new ArmorItem("twin", 10.0, 20.0);
        List<ArmorItem> result = selector.select(Arrays.asList(first, second), 20.0);
        assertEquals(2, result.size());
        assertSame(first, result.get(0));
        assertSame(second, result.get(1));
    }

    @Test
    void testSelect_ZeroDefenseItemStillFeasible() {
        ArmorItem rags = new ArmorItem("rags", 1.0, 0.0);
        assertEquals(Collections.singletonList(rags), selector.select(Collections.singletonList(rags), 5.0));
    }

    @Test
    void testSelect_DoesNotMutateInput() {
        List<ArmorItem> input = new ArrayList<>(Arrays.asList(a, b, c));
        List<ArmorItem> snapshot = new ArrayList<>(input);
        selector.select(input, 50.0);
        assertEquals(snapshot, input);
    }

    @Test
    void testSelect_Idempotent() {
        List<ArmorItem> input = Arrays.asList(c, a, b);
        assertEquals(selector.select(input, 45.0), selector.select(input, 45.0));
    }
}
