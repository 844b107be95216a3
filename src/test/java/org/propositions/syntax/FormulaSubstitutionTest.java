package org.propositions.syntax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Motore di sostituzione")
class FormulaSubstitutionTest {

    // ========== Sostituzione variabili ==========

    @Test
    @DisplayName("Le variabili sostituite non vengono riscritte di nuovo")
    void testSubstituteVariablesSinglePass() {
        Formula result = Formula.parse("((p->p)|r)").substituteVariables(
                Map.of("p", Formula.parse("(q&r)"), "r", Formula.parse("p")));

        assertEquals("(((q&r)->(q&r))|p)", result.toString());
    }

    @Test
    @DisplayName("Variabili non presenti nella mappa e costanti restano invariate")
    void testSubstituteVariablesUntouched() {
        Formula original = Formula.parse("(~x&(T->y))");
        Formula result = original.substituteVariables(Map.of("y", Formula.parse("~z")));

        assertEquals("(~x&(T->~z))", result.toString());
        assertEquals("(~x&(T->y))", original.toString());
    }

    @Test
    @DisplayName("Chiavi non variabili rifiutate")
    void testSubstituteVariablesRejectsOperatorKeys() {
        Formula formula = Formula.parse("(p&q)");
        assertThrows(IllegalArgumentException.class,
                () -> formula.substituteVariables(Map.of("&", Formula.parse("p"))));
        assertThrows(IllegalArgumentException.class,
                () -> formula.substituteVariables(null));

        Map<String, Formula> withNull = new HashMap<>();
        withNull.put("p", null);
        assertThrows(IllegalArgumentException.class, () -> formula.substituteVariables(withNull));
    }

    // ========== Sostituzione operatori ==========

    @Test
    @DisplayName("Espansione di De Morgan della congiunzione")
    void testDeMorganExpansion() {
        Formula result = Formula.parse("((x&y)&~z)").substituteOperators(
                Map.of("&", Formula.parse("~(~p|~q)")));

        assertEquals("~(~~(~x|~y)|~~z)", result.toString());
    }

    @Test
    @DisplayName("Sostituzione di negazione e costanti")
    void testUnaryAndConstants() {
        Formula result = Formula.parse("(~p->F)").substituteOperators(Map.of(
                "~", Formula.parse("(p->F)"),
                "F", Formula.parse("~T")));

        assertEquals("((p->F)->~T)", result.toString());
    }

    @Test
    @DisplayName("Gli operatori introdotti dai template non vengono riscritti")
    void testTemplatesNotResubstituted() {
        Formula result = Formula.parse("(p|q)").substituteOperators(Map.of(
                "|", Formula.parse("~(~p&~q)"),
                "&", Formula.parse("(p|q)")));

        assertEquals("~(~p&~q)", result.toString());
    }

    @Test
    @DisplayName("Variabili delle formule non confuse con i segnaposto")
    void testPlaceholdersBoundToOperands() {
        Formula result = Formula.parse("(q->p)").substituteOperators(
                Map.of("->", Formula.parse("(~p|q)")));

        assertEquals("(~q|p)", result.toString());
    }

    @Test
    @DisplayName("Template con variabili diverse da p e q rifiutati")
    void testInvalidTemplates() {
        Formula formula = Formula.parse("(p&q)");
        assertThrows(IllegalArgumentException.class,
                () -> formula.substituteOperators(Map.of("&", Formula.parse("(p&r)"))));
        assertThrows(IllegalArgumentException.class,
                () -> formula.substituteOperators(Map.of("p", Formula.parse("q"))));
    }
}
