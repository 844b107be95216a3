package org.propositions.semantics;

import org.propositions.syntax.Formula;
import org.propositions.syntax.FormulaTokens;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * VALUTATORE - Interprete strutturale delle formule in un modello
 *
 * SEMANTICA:
 * • Variabile: valore assegnato dal modello
 * • T / F: vero / falso
 * • ~A: negazione di A
 * • (A&amp;B), (A|B): congiunzione e disgiunzione
 * • (A-&gt;B): implicazione materiale, falsa solo con A vero e B falso
 *
 * Tempo lineare nella dimensione dell'albero; il modello non viene mai modificato.
 */
public final class Evaluator {

    /**
     * Previene istanziazione - classe utility
     */
    private Evaluator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Calcola il valore di verità della formula nel modello.
     *
     * @param formula formula da valutare
     * @param model modello su (un soprainsieme del)le variabili della formula
     * @return valore di verità
     * @throws IllegalArgumentException se il modello non copre la formula
     */
    public static boolean evaluate(Formula formula, Model model) {
        if (formula == null || model == null) {
            throw new IllegalArgumentException("Formula e modello non possono essere null");
        }
        if (!model.covers(formula)) {
            SortedSet<String> missing = new TreeSet<>(formula.variables());
            missing.removeAll(model.variables());
            throw new IllegalArgumentException("Il modello " + model + " non assegna le variabili " + missing +
                    " della formula " + formula);
        }
        return evaluateCovered(formula, model);
    }

    /**
     * Valutazione con copertura già verificata, su pila esplicita.
     *
     * Un nodo binario viene visitato due volte: prima per valutare il primo operando,
     * poi per decidere se il secondo serve. Con primo operando falso per &amp; e -&gt;,
     * oppure vero per |, il risultato è noto e il secondo operando non viene visitato;
     * altrimenti il valore del nodo coincide con quello del secondo operando.
     */
    static boolean evaluateCovered(Formula formula, Model model) {
        Deque<Formula> pending = new ArrayDeque<>();
        Deque<Boolean> resumed = new ArrayDeque<>();
        Deque<Boolean> values = new ArrayDeque<>();
        pending.push(formula);
        resumed.push(false);

        while (!pending.isEmpty()) {
            Formula node = pending.pop();
            boolean afterFirst = resumed.pop();

            switch (node.getType()) {
                case VARIABLE -> values.push(model.get(node.getRoot()));
                case CONSTANT -> values.push(FormulaTokens.TRUE.equals(node.getRoot()));
                case UNARY -> {
                    if (afterFirst) {
                        values.push(!values.pop());
                    } else {
                        pending.push(node);
                        resumed.push(true);
                        pending.push(node.getFirst());
                        resumed.push(false);
                    }
                }
                case BINARY -> {
                    if (!afterFirst) {
                        pending.push(node);
                        resumed.push(true);
                        pending.push(node.getFirst());
                        resumed.push(false);
                    } else {
                        boolean first = values.pop();
                        Boolean decided = shortCircuit(node.getRoot(), first);
                        if (decided != null) {
                            values.push(decided);
                        } else {
                            pending.push(node.getSecond());
                            resumed.push(false);
                        }
                    }
                }
            }
        }
        return values.pop();
    }

    /**
     * Valore del nodo binario determinato dal solo primo operando, null se serve il secondo.
     */
    private static Boolean shortCircuit(String operator, boolean first) {
        return switch (operator) {
            case FormulaTokens.AND -> first ? null : Boolean.FALSE;
            case FormulaTokens.OR -> first ? Boolean.TRUE : null;
            case FormulaTokens.IMPLIES -> first ? null : Boolean.TRUE;
            default -> throw new IllegalStateException("Operatore binario non supportato: " + operator);
        };
    }
}
