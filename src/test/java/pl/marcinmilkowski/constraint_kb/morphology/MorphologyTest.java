package pl.marcinmilkowski.constraint_kb.morphology;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.constraint_kb.config.MorphologyConfig;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Morphology segmentation.
 */
class MorphologyTest {

    private final Morphology morphology = new Morphology();

    @Test
    @DisplayName("Prefix, MIDDLE and suffix are split by longest match")
    void testFullSegmentation() {
        TokenMorphology m = morphology.extract("qokeedy");
        assertEquals("qo", m.prefix());
        assertEquals("ke", m.middle());
        assertEquals("edy", m.suffix());
        assertNull(m.articulator());

        TokenMorphology k = morphology.extract("qokaiin");
        assertEquals("qo", k.prefix());
        assertEquals("k", k.middle());
        assertEquals("aiin", k.suffix());
    }

    @Test
    @DisplayName("When affixes consume the token, the remainder after the prefix becomes the MIDDLE")
    void testPrefixRemainderAsMiddle() {
        TokenMorphology m = morphology.extract("chedy");
        assertEquals("ch", m.prefix());
        assertEquals("edy", m.middle());
        assertNull(m.suffix());

        TokenMorphology d = morphology.extract("daiin");
        assertEquals("da", d.prefix());
        assertEquals("iin", d.middle());
    }

    @Test
    @DisplayName("Articulator is recognised only in front of a prefix")
    void testArticulator() {
        TokenMorphology m = morphology.extract("ychedy");
        assertEquals("y", m.articulator());
        assertEquals("ch", m.prefix());
        assertEquals("edy", m.middle());
    }

    @Test
    @DisplayName("A bare token that is all suffix becomes its own MIDDLE")
    void testBareToken() {
        TokenMorphology m = morphology.extract("ol");
        assertNull(m.prefix());
        assertEquals("ol", m.middle());
        assertNull(m.suffix());
        assertTrue(m.hasMiddle());
    }

    @Test
    @DisplayName("Tokens are lowercased and trimmed; blank input never throws")
    void testNormalisationAndBlank() {
        assertEquals(morphology.extract("qokeedy").middle(), morphology.extract("  QOKEEDY ").middle());

        TokenMorphology blank = morphology.extract("   ");
        assertFalse(blank.hasMiddle());
        assertFalse(morphology.extract(null).hasMiddle());
    }

    @Test
    @DisplayName("Custom affix lists replace the defaults")
    void testCustomConfig() {
        Morphology custom = new Morphology(new MorphologyConfig(List.of("x"), List.of("z"), List.of()));
        TokenMorphology m = custom.extract("xabz");
        assertEquals("x", m.prefix());
        assertEquals("ab", m.middle());
        assertEquals("z", m.suffix());
        assertEquals("xabz = -+x+ab+z", m.toString());
    }
}
