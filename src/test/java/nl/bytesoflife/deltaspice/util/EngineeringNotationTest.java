package nl.bytesoflife.deltaspice.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EngineeringNotationTest {

    @Test
    void formatPicksTheQualifier() {
        assertEquals("4.7k", EngineeringNotation.format(4700));
        assertEquals("2.2k", EngineeringNotation.format(2200.0));
        assertEquals("1Meg", EngineeringNotation.format(1e6));
        assertEquals("1u", EngineeringNotation.format(1e-6));
        assertEquals("500m", EngineeringNotation.format(0.5));
        assertEquals("100n", EngineeringNotation.format(100e-9));
        assertEquals("10", EngineeringNotation.format(10));
        assertEquals("0", EngineeringNotation.format(0));
    }

    @Test
    void formatNegativeValues() {
        assertEquals("-3.3m", EngineeringNotation.format(-3.3e-3));
    }

    @Test
    void parseQualifiers() {
        assertEquals(4700, EngineeringNotation.parse("4.7k"), 1e-9);
        assertEquals(1e7, EngineeringNotation.parse("10Meg"), 1e-3);
        assertEquals(1e7, EngineeringNotation.parse("10MEG"), 1e-3);
        assertEquals(1e-6, EngineeringNotation.parse("1u"), 1e-18);
        assertEquals(1e-6, EngineeringNotation.parse("1µ"), 1e-18);
        assertEquals(1e-3, EngineeringNotation.parse("1m"), 1e-15);
        assertEquals(100e-9, EngineeringNotation.parse("100nF"), 1e-18);
        assertEquals(5, EngineeringNotation.parse("5"), 0);
        assertEquals(5, EngineeringNotation.parse(" 5V "), 0);
        assertEquals(1.5e-12, EngineeringNotation.parse("1.5p"), 1e-24);
    }

    @Test
    void parseRejectsText() {
        assertThrows(NumberFormatException.class, () -> EngineeringNotation.parse("{cval}"));
        assertThrows(NumberFormatException.class, () -> EngineeringNotation.parse("NMOS"));
    }

    @Test
    void formatThenParseKeepsTheValue() {
        double value = 47.5e3;
        assertEquals(value, EngineeringNotation.parse(EngineeringNotation.format(value)), 1e-6);
    }

    @Test
    void generalFormat() {
        assertEquals("0.001", EngineeringNotation.formatGeneral(0.001));
        assertEquals("1E-06", EngineeringNotation.formatGeneral(1e-6));
        assertEquals("1.23457E+06", EngineeringNotation.formatGeneral(1234567));
        assertEquals("2.5", EngineeringNotation.formatGeneral(2.5));
        assertEquals("100", EngineeringNotation.formatGeneral(100));
        assertEquals("1e-06", EngineeringNotation.formatShort(1e-6));
    }
}
