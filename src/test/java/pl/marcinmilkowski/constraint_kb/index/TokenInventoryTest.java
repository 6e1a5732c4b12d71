package pl.marcinmilkowski.constraint_kb.index;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.constraint_kb.morphology.Morphology;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TokenInventory.
 */
class TokenInventoryTest {

    private final Morphology morphology = new Morphology();

    @Test
    @DisplayName("Member tokens are keyed in the lowercase form the corpus analyzer produces")
    void testNormalisedKeys() {
        ClassIndex classes = ClassIndex.builder()
            .registerClass(2, List.of("Chedy", " SHEDY "), "ENERGY_OPERATOR")
            .registerClass(4, List.of("ol"), "AUXILIARY")
            .build();
        TokenInventory inventory = TokenInventory.build(classes, morphology);

        assertEquals(Set.of("chedy", "ol", "shedy"), inventory.tokens());
        assertTrue(inventory.contains("chedy"));
        assertTrue(inventory.contains("CHEDY"));
        assertEquals(2, inventory.get("shedy").orElseThrow().classId());
        assertEquals("edy", inventory.get("Chedy").orElseThrow().morphology().middle());
    }

    @Test
    @DisplayName("Null and unknown tokens are simply absent")
    void testAbsentTokens() {
        ClassIndex classes = ClassIndex.builder()
            .registerClass(4, List.of("ol"), "AUXILIARY")
            .build();
        TokenInventory inventory = TokenInventory.build(classes, morphology);

        assertTrue(inventory.get(null).isEmpty());
        assertFalse(inventory.contains(null));
        assertFalse(inventory.contains("daiin"));
    }

    @Test
    @DisplayName("Tokens that differ only in case may not belong to two classes")
    void testCaseCollision() {
        ClassIndex classes = ClassIndex.builder()
            .registerClass(1, List.of("chedy"), "CORE_CONTROL")
            .registerClass(2, List.of("Chedy"), "ENERGY_OPERATOR")
            .build();

        InvariantViolationException e = assertThrows(InvariantViolationException.class,
            () -> TokenInventory.build(classes, morphology));
        assertTrue(e.getMessage().contains("chedy"));
    }
}
