package org.propositions.semantics;

import org.propositions.proofs.InferenceRule;
import org.propositions.syntax.Formula;

import java.util.logging.Logger;

/**
 * Verifica semantica delle regole di inferenza.
 *
 * Una regola vale in un modello se, quando tutte le assunzioni sono vere, anche la
 * conclusione è vera. È corretta (sound) se vale in ogni modello sull'unione delle
 * variabili di assunzioni e conclusione.
 */
public final class InferenceChecker {

    private static final Logger LOGGER = Logger.getLogger(InferenceChecker.class.getName());

    /**
     * Previene istanziazione - classe utility
     */
    private InferenceChecker() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param rule regola da verificare
     * @param model modello che copre tutte le formule della regola
     * @return vero se la regola vale nel modello (vacuamente se un'assunzione è falsa)
     * @throws IllegalArgumentException se il modello non copre la regola
     */
    public static boolean evaluateInference(InferenceRule rule, Model model) {
        if (rule == null || model == null) {
            throw new IllegalArgumentException("Regola e modello non possono essere null");
        }
        if (!model.variables().containsAll(rule.variables())) {
            throw new IllegalArgumentException("Il modello " + model + " non copre la regola " + rule);
        }
        for (Formula assumption : rule.getAssumptions()) {
            if (!Evaluator.evaluateCovered(assumption, model)) {
                return true;
            }
        }
        return Evaluator.evaluateCovered(rule.getConclusion(), model);
    }

    /**
     * Vero se la regola vale in ogni modello sulle sue variabili.
     */
    public static boolean isSoundInference(InferenceRule rule) {
        if (rule == null) {
            throw new IllegalArgumentException("Regola non può essere null");
        }
        for (Model model : ModelEnumerator.allModels(rule.variables())) {
            if (!evaluateInference(rule, model)) {
                LOGGER.fine("Regola non corretta " + rule + ", controesempio: " + model);
                return false;
            }
        }
        return true;
    }
}
