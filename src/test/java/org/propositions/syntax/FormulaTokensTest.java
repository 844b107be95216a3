package org.propositions.syntax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Classificatori di token")
class FormulaTokensTest {

    @ParameterizedTest
    @ValueSource(strings = {"p", "q", "z", "q76", "x0", "p12345"})
    @DisplayName("Riconosce nomi di variabile validi")
    void testValidVariables(String token) {
        assertTrue(FormulaTokens.isVariable(token));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a", "o", "P", "T", "7", "pq", "p1q", "p-", "~p", "p 1"})
    @DisplayName("Rifiuta nomi di variabile non validi")
    void testInvalidVariables(String token) {
        assertFalse(FormulaTokens.isVariable(token));
    }

    @Test
    @DisplayName("Null non è una variabile")
    void testNullVariable() {
        assertFalse(FormulaTokens.isVariable(null));
    }

    @Test
    @DisplayName("Solo T e F sono costanti")
    void testConstants() {
        assertTrue(FormulaTokens.isConstant("T"));
        assertTrue(FormulaTokens.isConstant("F"));
        assertFalse(FormulaTokens.isConstant("t"));
        assertFalse(FormulaTokens.isConstant("TF"));
        assertFalse(FormulaTokens.isConstant("p"));
    }

    @Test
    @DisplayName("Operatori unari e binari")
    void testOperators() {
        assertTrue(FormulaTokens.isUnaryOperator("~"));
        assertFalse(FormulaTokens.isUnaryOperator("!"));

        assertTrue(FormulaTokens.isBinaryOperator("&"));
        assertTrue(FormulaTokens.isBinaryOperator("|"));
        assertTrue(FormulaTokens.isBinaryOperator("->"));
        assertFalse(FormulaTokens.isBinaryOperator("-"));
        assertFalse(FormulaTokens.isBinaryOperator("<->"));
        assertFalse(FormulaTokens.isBinaryOperator("+"));
        assertFalse(FormulaTokens.isBinaryOperator("~"));
    }
}
