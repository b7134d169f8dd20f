package domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArmorItemTest {

    @Test
    void testConstructor_ValidItem() {
        ArmorItem helmet = new ArmorItem("new enchanted helmet", 12.5, 40.0);
        assertEquals("new enchanted helmet", helmet.getDescription());
        assertEquals(12.5, helmet.getCost());
        assertEquals(40.0, helmet.getDefense());
    }

    @Test
    void testConstructor_ZeroDefenseAllowed() {
        ArmorItem rags = new ArmorItem("rags", 1.0, 0.0);
        assertEquals(0.0, rags.getDefense());
        assertEquals(0.0, rags.getEfficiency());
    }

    @Test
    void testConstructor_RejectsEmptyDescription() {
        assertThrows(IllegalArgumentException.class, () -> new ArmorItem("", 1.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new ArmorItem(null, 1.0, 1.0));
    }

    @Test
    void testConstructor_RejectsNonPositiveCost() {
        assertThrows(IllegalArgumentException.class, () -> new ArmorItem("boots", 0.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new ArmorItem("boots", -3.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new ArmorItem("boots", Double.NaN, 1.0));
        assertThrows(IllegalArgumentException.class,
            () -> new ArmorItem("boots", Double.POSITIVE_INFINITY, 1.0));
    }

    @Test
    void testConstructor_RejectsNegativeDefense() {
        assertThrows(IllegalArgumentException.class, () -> new ArmorItem("cursed ring", 1.0, -0.5));
        assertThrows(IllegalArgumentException.class, () -> new ArmorItem("cursed ring", 1.0, Double.NaN));
    }

    @Test
    void testEfficiency_DefensePerGold() {
        assertEquals(6.0, new ArmorItem("A", 10.0, 60.0).getEfficiency());
        assertEquals(0.25, new ArmorItem("B", 4.0, 1.0).getEfficiency());
    }

    @Test
    void testEquality_IsIdentity() {
        ArmorItem first = new ArmorItem("shield", 5.0, 5.0);
        ArmorItem second = new ArmorItem("shield", 5.0, 5.0);
        assertNotEquals(first, second);
        assertEquals(first, first);
    }
}
