package nl.bytesoflife.deltaspice.netlist.grammar;

import nl.bytesoflife.deltaspice.netlist.UnknownPrefixException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineClassifierTest {

    @Test
    void componentLinesGiveTheirPrefix() {
        assertEquals("R", LineClassifier.classify("R1 a b 1k\n"));
        assertEquals("X", LineClassifier.classify("  x1 a b AMP\n"));
        assertEquals("@", LineClassifier.classify("@1 a b delay=1m\n"));
    }

    @Test
    void commentsAndBlankLines() {
        assertEquals("*", LineClassifier.classify("* title\n"));
        assertEquals("*", LineClassifier.classify("; note\n"));
        assertEquals("*", LineClassifier.classify("# note\n"));
        assertEquals("*", LineClassifier.classify("\n"));
        assertEquals("*", LineClassifier.classify("\r\n"));
        assertEquals("*", LineClassifier.classify(""));
        assertEquals("*", LineClassifier.classify("   \t"));
    }

    @Test
    void continuation() {
        assertEquals("+", LineClassifier.classify("+ 2.2k\n"));
    }

    @Test
    void directivesAreUpperCasedUpToWhitespace() {
        assertEquals(".TRAN", LineClassifier.classify(".tran 0 10m\n"));
        assertEquals(".SUBCKT", LineClassifier.classify(".subckt AMP in out\n"));
        assertEquals(".ENDS", LineClassifier.classify(".ends AMP\n"));
        assertEquals(".END", LineClassifier.classify(".end\n"));
        assertEquals(".END", LineClassifier.classify(".END"));
        assertEquals(".BACKANNO", LineClassifier.classify(".backanno\r\n"));
    }

    @Test
    void unknownLeadingCharacter() {
        UnknownPrefixException e = assertThrows(UnknownPrefixException.class,
                () -> LineClassifier.classify("N1 a b\n"));
        assertEquals("N1 a b\n", e.getLine());
        assertTrue(LineClassifier.tryClassify("N1 a b\n").isEmpty());
    }

    @Test
    void analysisDirectivesAreUnique() {
        assertTrue(LineClassifier.isUniqueInstruction(".TRAN"));
        assertTrue(LineClassifier.isUniqueInstruction(".AC"));
        assertFalse(LineClassifier.isUniqueInstruction(".MEAS"));
        assertTrue(LineClassifier.isParameterDirective(".PARAM"));
        assertTrue(LineClassifier.isParameterDirective(".PARAMS"));
        assertFalse(LineClassifier.isParameterDirective(".OPTIONS"));
    }

    @Test
    void componentCommands() {
        assertTrue(LineClassifier.isComponent("R"));
        assertFalse(LineClassifier.isComponent("*"));
        assertFalse(LineClassifier.isComponent(".END"));
    }

    @Test
    void lineTerminators() {
        assertEquals("R1 a b 1k", LineClassifier.stripTerminator("R1 a b 1k\r\n"));
        assertEquals("R1 a b 1k", LineClassifier.stripTerminator("R1 a b 1k\n"));
        assertEquals("R1 a b 1k", LineClassifier.stripTerminator("R1 a b 1k"));
        assertEquals(2, LineClassifier.firstNonBlank(" \tR1"));
        assertEquals(-1, LineClassifier.firstNonBlank(" \t"));
        assertEquals("R1", LineClassifier.firstTokenUpper("  r1 a b 1k\n"));
    }
}
