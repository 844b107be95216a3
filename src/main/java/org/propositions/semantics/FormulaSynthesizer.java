package org.propositions.semantics;

import org.propositions.syntax.Formula;
import org.propositions.syntax.FormulaTokens;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * SINTESI DA TAVOLA DI VERITÀ - Costruzione di formule in DNF e CNF
 *
 * DNF: una clausola congiuntiva per ogni modello in cui la tavola vale vero,
 * disgiunte da sinistra a destra nell'ordine degli indici dei modelli.
 *
 * CNF: duale per De Morgan, una clausola disgiuntiva per ogni modello in cui
 * la tavola vale falso, congiunte nello stesso ordine.
 *
 * La formula sintetizzata ha esattamente la tavola di verità ricevuta.
 */
public final class FormulaSynthesizer {

    private static final Logger LOGGER = Logger.getLogger(FormulaSynthesizer.class.getName());

    /**
     * Previene istanziazione - classe utility
     */
    private FormulaSynthesizer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region CLAUSOLE PER SINGOLO MODELLO

    /**
     * Clausola congiuntiva vera nel modello dato e falsa in ogni altro modello
     * sulle stesse variabili.
     *
     * ESEMPIO: {p: vero, q: falso} -&gt; (p&amp;~q)
     *
     * @param model modello su un insieme non vuoto di variabili
     * @throws IllegalArgumentException se il modello è vuoto
     */
    public static Formula synthesizeForModel(Model model) {
        requireNonEmpty(model);
        Formula clause = null;
        for (String variable : model.variables()) {
            Formula literal = model.get(variable)
                    ? new Formula(variable)
                    : Formula.not(new Formula(variable));
            clause = clause == null ? literal : new Formula(FormulaTokens.AND, clause, literal);
        }
        return clause;
    }

    /**
     * Clausola disgiuntiva falsa nel modello dato e vera in ogni altro modello
     * sulle stesse variabili.
     *
     * ESEMPIO: {p: vero, q: falso} -&gt; (~p|q)
     *
     * @param model modello su un insieme non vuoto di variabili
     * @throws IllegalArgumentException se il modello è vuoto
     */
    public static Formula synthesizeForAllExceptModel(Model model) {
        requireNonEmpty(model);
        Formula clause = null;
        for (String variable : model.variables()) {
            Formula literal = model.get(variable)
                    ? Formula.not(new Formula(variable))
                    : new Formula(variable);
            clause = clause == null ? literal : new Formula(FormulaTokens.OR, clause, literal);
        }
        return clause;
    }

    //endregion

    //region SINTESI DNF E CNF

    /**
     * Sintetizza una formula in DNF con la tavola di verità data.
     * Se nessun valore è vero restituisce la contraddizione (v&amp;~v) sulla prima variabile.
     *
     * @param variables variabili non vuote, senza duplicati
     * @param values valori allineati indice per indice con {@link ModelEnumerator#allModels}
     * @return formula sintetizzata
     * @throws IllegalArgumentException se le variabili sono vuote o i valori non sono 2^n
     */
    public static Formula synthesize(List<String> variables, Iterable<Boolean> values) {
        List<Boolean> table = validateTable(variables, values);

        Formula result = null;
        int index = 0;
        for (Model model : ModelEnumerator.allModels(variables)) {
            if (table.get(index++)) {
                Formula clause = synthesizeForModel(model);
                result = result == null ? clause : new Formula(FormulaTokens.OR, result, clause);
            }
        }

        if (result == null) {
            Formula first = new Formula(variables.get(0));
            result = new Formula(FormulaTokens.AND, first, Formula.not(first));
        }

        LOGGER.fine("Sintesi DNF su " + variables + ": " + result);
        return result;
    }

    /**
     * Sintetizza una formula in CNF con la tavola di verità data.
     * Se nessun valore è falso restituisce la tautologia (v|~v) sulla prima variabile.
     *
     * @param variables variabili non vuote, senza duplicati
     * @param values valori allineati indice per indice con {@link ModelEnumerator#allModels}
     * @return formula sintetizzata
     * @throws IllegalArgumentException se le variabili sono vuote o i valori non sono 2^n
     */
    public static Formula synthesizeCnf(List<String> variables, Iterable<Boolean> values) {
        List<Boolean> table = validateTable(variables, values);

        Formula result = null;
        int index = 0;
        for (Model model : ModelEnumerator.allModels(variables)) {
            if (!table.get(index++)) {
                Formula clause = synthesizeForAllExceptModel(model);
                result = result == null ? clause : new Formula(FormulaTokens.AND, result, clause);
            }
        }

        if (result == null) {
            Formula first = new Formula(variables.get(0));
            result = new Formula(FormulaTokens.OR, first, Formula.not(first));
        }

        LOGGER.fine("Sintesi CNF su " + variables + ": " + result);
        return result;
    }

    //endregion

    //region VALIDAZIONE

    private static void requireNonEmpty(Model model) {
        if (model == null || model.size() == 0) {
            throw new IllegalArgumentException("Il modello deve assegnare almeno una variabile");
        }
    }

    private static List<Boolean> validateTable(List<String> variables, Iterable<Boolean> values) {
        if (variables == null || variables.isEmpty()) {
            throw new IllegalArgumentException("La sintesi richiede almeno una variabile");
        }
        if (values == null) {
            throw new IllegalArgumentException("Tavola di verità non può essere null");
        }
        long expected = ModelEnumerator.modelCount(variables.size());

        List<Boolean> table = new ArrayList<>();
        for (Boolean value : values) {
            if (value == null) {
                throw new IllegalArgumentException("Tavola di verità non può contenere valori null");
            }
            if (table.size() >= expected) {
                throw new IllegalArgumentException("Tavola di verità con più di " + expected + " valori");
            }
            table.add(value);
        }
        if (table.size() != expected) {
            throw new IllegalArgumentException("Tavola di verità con " + table.size() +
                    " valori, attesi " + expected);
        }
        return table;
    }

    //endregion
}
