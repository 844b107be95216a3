package org.propositions.semantics;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.propositions.proofs.InferenceRule;
import org.propositions.syntax.Formula;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Verifica esaustiva parallela")
class ParallelModelCheckerTest {

    private ParallelModelChecker checker;

    @BeforeEach
    void setUp() {
        checker = new ParallelModelChecker(3);
    }

    @AfterEach
    void tearDown() {
        checker.close();
    }

    @ParameterizedTest
    @ValueSource(strings = {"T", "F", "p", "(p|~p)", "(p&~p)", "(((p->q)&(q->r))->(p->r))",
            "((x1|x2)&(~x1|x3))", "(((x1&x2)|(x3&x4))->(x5|~x6))"})
    @DisplayName("Stessi risultati dell'analisi sequenziale")
    void testParityWithSequential(String text) {
        Formula formula = Formula.parse(text);

        assertEquals(SemanticAnalyzer.isTautology(formula), checker.isTautology(formula));
        assertEquals(SemanticAnalyzer.isContradiction(formula), checker.isContradiction(formula));
        assertEquals(SemanticAnalyzer.isSatisfiable(formula), checker.isSatisfiable(formula));
    }

    @Test
    @DisplayName("Valori di verità nell'ordine dei modelli")
    void testTruthValuesOrder() {
        Formula formula = Formula.parse("((p&~q)|(r->s))");
        List<String> variables = List.of("s", "r", "q", "p");

        assertEquals(SemanticAnalyzer.truthValueList(formula, ModelEnumerator.allModels(variables)),
                checker.truthValues(formula, variables));
        assertEquals(List.of(true), checker.truthValues(Formula.parse("T"), List.of()));
    }

    @Test
    @DisplayName("Tautologia su molte variabili")
    void testLargeTautology() {
        Formula formula = Formula.parse("(x0|~x0)");
        for (int i = 1; i < 14; i++) {
            formula = Formula.parse("(" + formula + "&(x" + i + "|~x" + i + "))");
        }

        assertTrue(checker.isTautology(formula));
        assertFalse(checker.isTautology(Formula.parse("(" + formula + "&x7)")));
    }

    @Test
    @DisplayName("Correttezza delle inferenze")
    void testSoundInference() {
        InferenceRule modusPonens = new InferenceRule(
                List.of(Formula.parse("p"), Formula.parse("(p->q)")), Formula.parse("q"));
        InferenceRule converse = new InferenceRule(
                List.of(Formula.parse("q"), Formula.parse("(p->q)")), Formula.parse("p"));

        assertTrue(checker.isSoundInference(modusPonens));
        assertFalse(checker.isSoundInference(converse));
    }

    @Test
    @DisplayName("Parametri non validi rifiutati")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelModelChecker(0));
        assertThrows(IllegalArgumentException.class,
                () -> checker.truthValues(Formula.parse("(p&q)"), List.of("p")));
        assertEquals(3, checker.getThreads());
    }
}
