package rowset.engine.numeric;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class NumericParserTest {

    @Test
    void parsesInvariantNumbers() {
        NumericParser p = NumericParser.invariant();
        assertEquals(1234.5, p.tryParse(" 1,234.5 ").getAsDouble(), 1e-9);
        assertEquals(-0.25, p.tryParse("-.25").getAsDouble(), 1e-9);
        assertEquals(1500.0, p.tryParse("1.5e3").getAsDouble(), 1e-9);
        assertTrue(p.isNumeric("+7"));
    }

    @Test
    void rejectsBlankTextAndNonFinite() {
        NumericParser p = NumericParser.invariant();
        assertTrue(p.tryParse("").isEmpty());
        assertTrue(p.tryParse("   ").isEmpty());
        assertTrue(p.tryParse(null).isEmpty());
        assertTrue(p.tryParse("abc").isEmpty());
        assertTrue(p.tryParse("NaN").isEmpty());
        assertTrue(p.tryParse("Infinity").isEmpty());
        assertTrue(p.tryParse("1e999").isEmpty());
        assertTrue(NumericParser.isBlank(" "));
        assertFalse(NumericParser.isBlank("0"));
    }

    @Test
    void europeanCultureSwapsSeparators() {
        NumericParser p = new NumericParser(NumericCulture.EUROPEAN);
        assertEquals(1234.5, p.tryParse("1.234,5").getAsDouble(), 1e-9);
        assertEquals(0.5, p.tryParse("0,5").getAsDouble(), 1e-9);
    }

    @Test
    void cultureSeparatorsMustDiffer() {
        assertThrows(IllegalArgumentException.class, () -> new NumericCulture('.', '.'));
    }

    @Test
    void formatsShortestPlainDecimal() {
        assertEquals("20", NumberFormatter.format(20.0));
        assertEquals("1.5", NumberFormatter.format(1.5));
        assertEquals("0.25", NumberFormatter.format(0.25));
        assertEquals("0", NumberFormatter.format(-0.0));
        assertEquals("10000000000", NumberFormatter.format(1e10));
        assertThrows(IllegalArgumentException.class, () -> NumberFormatter.format(Double.NaN));
    }
}
