package org.propositions.proofs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.propositions.syntax.Formula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Regola di inferenza")
class InferenceRuleTest {

    @Test
    @DisplayName("Variabili ordinate di assunzioni e conclusione")
    void testVariables() {
        InferenceRule rule = new InferenceRule(
                List.of(Formula.parse("(r->q)"), Formula.parse("~x1")), Formula.parse("(p&T)"));

        assertEquals(List.of("p", "q", "r", "x1"), List.copyOf(rule.variables()));
    }

    @Test
    @DisplayName("Copia difensiva delle assunzioni")
    void testImmutable() {
        List<Formula> assumptions = new ArrayList<>(List.of(Formula.parse("p")));
        InferenceRule rule = new InferenceRule(assumptions, Formula.parse("q"));
        assumptions.add(Formula.parse("r"));

        assertEquals(1, rule.getAssumptions().size());
        assertThrows(UnsupportedOperationException.class, () -> rule.getAssumptions().add(Formula.parse("s")));
    }

    @Test
    @DisplayName("Uguaglianza strutturale e rappresentazione testuale")
    void testEqualityAndToString() {
        InferenceRule first = new InferenceRule(List.of(Formula.parse("p"), Formula.parse("(p->q)")),
                Formula.parse("q"));
        InferenceRule second = new InferenceRule(List.of(Formula.parse("p"), Formula.parse("(p->q)")),
                Formula.parse("q"));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertEquals("[p, (p->q)] ==> q", first.toString());
        assertNotEquals(first, new InferenceRule(List.of(Formula.parse("(p->q)"), Formula.parse("p")),
                Formula.parse("q")));
    }

    @Test
    @DisplayName("Parametri null rifiutati")
    void testNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> new InferenceRule(null, Formula.parse("p")));
        assertThrows(IllegalArgumentException.class, () -> new InferenceRule(List.of(), null));
        assertThrows(IllegalArgumentException.class,
                () -> new InferenceRule(Arrays.asList(Formula.parse("p"), null), Formula.parse("q")));
    }
}
