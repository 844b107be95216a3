package org.propositions.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.propositions.semantics.SemanticAnalyzer;
import org.propositions.syntax.Formula;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Rendering della tavola di verità")
class TruthTableRendererTest {

    @Test
    @DisplayName("Tabella markdown di ~(p&q76)")
    void testRenderNegatedConjunction() {
        String expected = String.join("\n",
                "| p | q76 | ~(p&q76) |",
                "|---|-----|----------|",
                "| F | F   | T        |",
                "| F | T   | T        |",
                "| T | F   | T        |",
                "| T | T   | F        |");

        assertEquals(expected, TruthTableRenderer.render(SemanticAnalyzer.truthTable(Formula.parse("~(p&q76)"))));
    }

    @Test
    @DisplayName("Formula senza variabili: una sola riga")
    void testRenderConstant() {
        String expected = String.join("\n",
                "| ~T |",
                "|----|",
                "| F  |");

        assertEquals(expected, TruthTableRenderer.render(SemanticAnalyzer.truthTable(Formula.parse("~T"))));
    }

    @Test
    @DisplayName("Singola cella")
    void testToCell() {
        assertEquals("T", TruthTableRenderer.toCell(true));
        assertEquals("F", TruthTableRenderer.toCell(false));
    }
}
