package org.propositions.semantics;

import org.propositions.syntax.Formula;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

/**
 * ANALISI SEMANTICA - Fatti derivati dalla valutazione esaustiva
 *
 * OPERAZIONI:
 * • Valori di verità di una formula su una sequenza di modelli
 * • Tautologia: vera in ogni modello sulle sue variabili
 * • Contraddizione: la negazione è una tautologia
 * • Soddisfacibilità: non è una contraddizione
 * • Costruzione della tavola di verità completa
 *
 * Costo O(2^|variabili| · |formula|), senza euristiche SAT.
 * Per la versione parallela vedere {@link ParallelModelChecker}.
 */
public final class SemanticAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(SemanticAnalyzer.class.getName());

    /**
     * Previene istanziazione - classe utility
     */
    private SemanticAnalyzer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region VALORI DI VERITÀ

    /**
     * Sequenza pigra dei valori della formula nei modelli dati, nello stesso ordine.
     *
     * @param formula formula da valutare
     * @param models modelli che coprono la formula
     * @return iterabile della stessa lunghezza dei modelli
     */
    public static Iterable<Boolean> truthValues(Formula formula, Iterable<Model> models) {
        if (formula == null || models == null) {
            throw new IllegalArgumentException("Formula e modelli non possono essere null");
        }
        return () -> new Iterator<>() {
            private final Iterator<Model> source = models.iterator();

            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public Boolean next() {
                return Evaluator.evaluate(formula, source.next());
            }
        };
    }

    /**
     * Raccoglie in lista i valori di {@link #truthValues(Formula, Iterable)}.
     */
    public static List<Boolean> truthValueList(Formula formula, Iterable<Model> models) {
        List<Boolean> values = new ArrayList<>();
        for (Boolean value : truthValues(formula, models)) {
            values.add(value);
        }
        return values;
    }

    /**
     * Tavola di verità completa: colonne = variabili ordinate della formula.
     */
    public static TruthTable truthTable(Formula formula) {
        List<String> variables = new ArrayList<>(formula.variables());
        List<Model> models = new ArrayList<>();
        List<Boolean> values = new ArrayList<>();

        for (Model model : ModelEnumerator.allModels(variables)) {
            models.add(model);
            values.add(Evaluator.evaluate(formula, model));
        }

        LOGGER.fine("Tavola di verità di " + formula + ": " + models.size() + " righe");
        return new TruthTable(formula, variables, models, values);
    }

    //endregion

    //region TAUTOLOGIA, CONTRADDIZIONE, SODDISFACIBILITÀ

    /**
     * Vero se la formula vale in ogni modello sulle sue variabili.
     */
    public static boolean isTautology(Formula formula) {
        for (Model model : ModelEnumerator.allModels(formula.variables())) {
            if (!Evaluator.evaluate(formula, model)) {
                LOGGER.finest("Controesempio per " + formula + ": " + model);
                return false;
            }
        }
        return true;
    }

    /**
     * Vero se la negazione della formula è una tautologia.
     */
    public static boolean isContradiction(Formula formula) {
        return isTautology(Formula.not(formula));
    }

    /**
     * Vero se la formula non è una contraddizione.
     */
    public static boolean isSatisfiable(Formula formula) {
        return !isContradiction(formula);
    }

    //endregion
}
