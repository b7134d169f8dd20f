package application;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SelectionConfigurationTest {

    @Test
    void testBuild_Defaults() {
        SelectionConfiguration config = new SelectionConfiguration.Builder()
            .setGoldBudget(500.0)
            .build();

        assertEquals(500.0, config.getGoldBudget());
        assertEquals(SelectionDefaults.DEFAULT_MIN_DEFENSE, config.getMinDefense());
        assertEquals(SelectionDefaults.DEFAULT_MAX_DEFENSE, config.getMaxDefense());
        assertEquals(SelectionDefaults.DEFAULT_ITEM_LIMIT, config.getItemLimit());
        assertEquals(SelectionConfiguration.Strategy.BOTH, config.getStrategy());
        assertFalse(config.isDebugMode());
    }

    @Test
    void testBuild_AllParameters() {
        SelectionConfiguration config = new SelectionConfiguration.Builder()
            .setGoldBudget(0.0)
            .setDefenseRange(5.0, 5.0)
            .setItemLimit(12)
            .setStrategy(SelectionConfiguration.Strategy.GREEDY)
            .setDebugMode(true)
            .build();

        assertEquals(0.0, config.getGoldBudget());
        assertEquals(5.0, config.getMinDefense());
        assertEquals(5.0, config.getMaxDefense());
        assertEquals(12, config.getItemLimit());
        assertEquals(SelectionConfiguration.Strategy.GREEDY, config.getStrategy());
        assertTrue(config.isDebugMode());
    }

    @Test
    void testBuild_RequiresBudget() {
        assertThrows(IllegalStateException.class, () -> new SelectionConfiguration.Builder().build());
    }

    @Test
    void testBuilder_RejectsInvalidValues() {
        SelectionConfiguration.Builder builder = new SelectionConfiguration.Builder();
        assertThrows(IllegalArgumentException.class, () -> builder.setGoldBudget(-1.0));
        assertThrows(IllegalArgumentException.class, () -> builder.setGoldBudget(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> builder.setDefenseRange(10.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> builder.setItemLimit(0));
        assertThrows(IllegalArgumentException.class, () -> builder.setStrategy(null));
    }

    @Test
    void testStrategy_Inclusion() {
        assertTrue(SelectionConfiguration.Strategy.GREEDY.includesGreedy());
        assertFalse(SelectionConfiguration.Strategy.GREEDY.includesExhaustive());
        assertFalse(SelectionConfiguration.Strategy.EXHAUSTIVE.includesGreedy());
        assertTrue(SelectionConfiguration.Strategy.EXHAUSTIVE.includesExhaustive());
        assertTrue(SelectionConfiguration.Strategy.BOTH.includesGreedy());
        assertTrue(SelectionConfiguration.Strategy.BOTH.includesExhaustive());
    }
}
