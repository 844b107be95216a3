package org.propositions.semantics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.propositions.proofs.InferenceRule;
import org.propositions.syntax.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Verifica delle inferenze")
class InferenceCheckerTest {

    private static InferenceRule rule(String conclusion, String... assumptions) {
        List<Formula> parsed = new ArrayList<>();
        for (String assumption : assumptions) {
            parsed.add(Formula.parse(assumption));
        }
        return new InferenceRule(parsed, Formula.parse(conclusion));
    }

    @Test
    @DisplayName("Valutazione in un modello: vacuamente vera se un'assunzione è falsa")
    void testEvaluateInference() {
        InferenceRule rule = rule("q", "p");

        assertFalse(InferenceChecker.evaluateInference(rule, Model.of(Map.of("p", true, "q", false))));
        assertTrue(InferenceChecker.evaluateInference(rule, Model.of(Map.of("p", false, "q", false))));
        assertTrue(InferenceChecker.evaluateInference(rule, Model.of(Map.of("p", true, "q", true))));
    }

    @Test
    @DisplayName("Modus ponens e sillogismo ipotetico corretti")
    void testSoundRules() {
        assertTrue(InferenceChecker.isSoundInference(rule("q", "p", "(p->q)")));
        assertTrue(InferenceChecker.isSoundInference(rule("(p->r)", "(p->q)", "(q->r)")));
        assertTrue(InferenceChecker.isSoundInference(rule("(p|q)", "p")));
        assertTrue(InferenceChecker.isSoundInference(rule("r", "p", "~p")));
    }

    @Test
    @DisplayName("Affermazione del conseguente non corretta")
    void testUnsoundRules() {
        assertFalse(InferenceChecker.isSoundInference(rule("p", "q", "(p->q)")));
        assertFalse(InferenceChecker.isSoundInference(rule("(p&q)", "(p|q)")));
    }

    @Test
    @DisplayName("Senza assunzioni: corretta se e solo se la conclusione è una tautologia")
    void testNoAssumptions() {
        assertTrue(InferenceChecker.isSoundInference(rule("(p|~p)")));
        assertTrue(InferenceChecker.isSoundInference(rule("T")));
        assertFalse(InferenceChecker.isSoundInference(rule("p")));
        assertTrue(InferenceChecker.evaluateInference(rule("T"), Model.empty()));
    }

    @Test
    @DisplayName("Modello che non copre la regola rifiutato")
    void testUncoveredModel() {
        assertThrows(IllegalArgumentException.class,
                () -> InferenceChecker.evaluateInference(rule("q", "p"), Model.of(Map.of("p", true))));
        assertThrows(IllegalArgumentException.class, () -> InferenceChecker.isSoundInference(null));
    }
}
