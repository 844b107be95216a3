package org.propositions.syntax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Parser a pila esplicita")
class FormulaParserTest {

    // ========== Formule valide e round trip ==========

    @ParameterizedTest
    @ValueSource(strings = {"p", "q76", "T", "F", "~p", "~~F", "(p&q)", "(p|q)", "(p->q)",
            "~(p&q76)", "((x&y)&~z)", "(~(p->T)|((q1&~x12)->F))", "~~~(z9|~z9)"})
    @DisplayName("Round trip: parse(str(f)) == f")
    void testRoundTrip(String text) {
        assertTrue(FormulaParser.isFormula(text));
        Formula formula = FormulaParser.parse(text);
        assertEquals(text, formula.toString());
        assertEquals(formula, FormulaParser.parse(formula.toString()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "(p&q", "->p", "p&q", "(p)", "()", "(p&&q)", "(p-q)", "(p-", "(p&q))",
            "a", "P", "~", "( p&q)", "(p&q )", "(p<->q)", "pq", "p q", "(p&q)r", "~(p&)", "TT"})
    @DisplayName("Testo malformato rifiutato senza eccezioni")
    void testInvalidFormulas(String text) {
        assertFalse(FormulaParser.isFormula(text));
    }

    @Test
    @DisplayName("Null non è una formula")
    void testNullIsNotFormula() {
        assertFalse(FormulaParser.isFormula(null));
    }

    @Test
    @DisplayName("parse su testo non valido è una violazione di precondizione")
    void testParseRejectsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> FormulaParser.parse("(p&q"));
        assertThrows(IllegalArgumentException.class, () -> FormulaParser.parse("pq"));
    }

    // ========== Parsing di prefissi ==========

    @Test
    @DisplayName("Il prefisso restituisce formula e suffisso non consumato")
    void testPrefixRemainder() {
        ParseResult result = FormulaParser.parsePrefix("(p&q)rest");
        assertTrue(result.isSuccess());
        assertFalse(result.isComplete());
        assertEquals("(p&q)", result.getFormula().toString());
        assertEquals("rest", result.getRemainder());
    }

    @Test
    @DisplayName("Le variabili consumano tutte le cifre successive")
    void testGreedyVariable() {
        ParseResult result = FormulaParser.parsePrefix("x12&y");
        assertEquals("x12", result.getFormula().toString());
        assertEquals("&y", result.getRemainder());

        ParseResult negated = FormulaParser.parsePrefix("~x12)");
        assertEquals("~x12", negated.getFormula().toString());
        assertEquals(")", negated.getRemainder());
    }

    @Test
    @DisplayName("Fallimenti con messaggio descrittivo e nessuna formula parziale")
    void testFailureMessages() {
        ParseResult empty = FormulaParser.parsePrefix("");
        assertFalse(empty.isSuccess());
        assertNull(empty.getFormula());
        assertTrue(empty.getError().contains("vuoto"));

        ParseResult unclosed = FormulaParser.parsePrefix("(p&q");
        assertFalse(unclosed.isSuccess());
        assertTrue(unclosed.getError().contains(")"));

        ParseResult badArrow = FormulaParser.parsePrefix("(p-q)");
        assertFalse(badArrow.isSuccess());
        assertTrue(badArrow.getError().contains(">"));

        ParseResult unknown = FormulaParser.parsePrefix("#");
        assertFalse(unknown.isSuccess());
        assertTrue(unknown.getError().contains("#"));
    }

    // ========== Annidamento profondo ==========

    @Test
    @DisplayName("Negazioni annidate senza limite di profondità")
    void testDeepNegations() {
        String deep = "~".repeat(100_000) + "p";
        ParseResult result = FormulaParser.parsePrefix(deep);

        assertTrue(result.isComplete());
        assertEquals(100_000, result.getFormula().depth());
        assertEquals(deep, result.getFormula().toString());
    }

    @Test
    @DisplayName("Catena binaria sinistra profonda: testo e albero coincidono")
    void testDeepLeftChain() {
        StringBuilder text = new StringBuilder("(".repeat(50_000)).append("x0");
        for (int i = 1; i <= 50_000; i++) {
            text.append('|').append('x').append(i % 7).append(')');
        }
        Formula formula = FormulaParser.parse(text.toString());

        assertEquals(50_000, formula.depth());
        assertEquals(text.toString(), formula.toString());
        assertEquals(formula, FormulaParser.parsePolish(formula.polish()));
    }

    @Test
    @DisplayName("Input molto annidato e incompleto rifiutato senza StackOverflowError")
    void testHostileNesting() {
        String hostile = "(".repeat(100_000) + "p";
        ParseResult result = FormulaParser.parsePrefix(hostile);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("operatore binario"));
        assertFalse(FormulaParser.isPolishFormula("~".repeat(100_000)));
    }

    // ========== Notazione polacca ==========

    @ParameterizedTest
    @ValueSource(strings = {"p", "T", "~p", "~&pq76", "->|xF~~y1", "&&xy~z", "|->p1p2T"})
    @DisplayName("Parsing polacco inverso di polish()")
    void testPolishRoundTrip(String polish) {
        assertTrue(FormulaParser.isPolishFormula(polish));
        assertEquals(polish, FormulaParser.parsePolish(polish).polish());
    }

    @Test
    @DisplayName("Conversione polacca -> standard")
    void testPolishToStandard() {
        assertEquals("~(p&q76)", FormulaParser.parsePolish("~&pq76").toString());
        assertEquals("((x&y)&~z)", FormulaParser.parsePolish("&&xy~z").toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "&p", "->p", "-pq", "(p&q)", "pq", "~", "&pqr"})
    @DisplayName("Testo polacco malformato rifiutato")
    void testInvalidPolish(String text) {
        assertFalse(FormulaParser.isPolishFormula(text));
    }
}
