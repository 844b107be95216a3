package org.propositions.semantics;

import org.propositions.syntax.FormulaTokens;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.logging.Logger;

/**
 * ENUMERATORE DI MODELLI - Tutti i 2^n assegnamenti su una lista ordinata di variabili
 *
 * ORDINE GARANTITO:
 * Ordine lessicografico con falso &lt; vero per posizione, dove la posizione i
 * corrisponde alla variabile i-esima. Equivale a contare da 0 a 2^n - 1 in binario
 * con il bit più significativo associato alla prima variabile.
 *
 * Questo ordine è un contratto: la sintesi da tavola di verità si basa sulla
 * corrispondenza indice/modello.
 *
 * L'enumerazione si arresta con {@link CancellationException} se il thread
 * consumatore viene interrotto, ad esempio allo scadere di un timeout.
 */
public final class ModelEnumerator {

    private static final Logger LOGGER = Logger.getLogger(ModelEnumerator.class.getName());

    /** Limite imposto dalla rappresentazione dell'indice come long */
    public static final int MAX_VARIABLES = 62;

    /**
     * Previene istanziazione - classe utility
     */
    private ModelEnumerator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Sequenza pigra di tutti i modelli sulle variabili date.
     * Con lista vuota produce esattamente un modello vuoto.
     *
     * @param variables variabili ordinate, senza duplicati
     * @return iterabile rieseguibile sui 2^n modelli
     * @throws IllegalArgumentException se un nome non è una variabile, ci sono duplicati
     *         o le variabili sono più di {@value #MAX_VARIABLES}
     */
    public static Iterable<Model> allModels(Collection<String> variables) {
        List<String> ordered = validateVariables(variables);
        long count = modelCount(ordered.size());
        LOGGER.finest("Enumerazione di " + count + " modelli su " + ordered);

        return () -> new Iterator<>() {
            private long next = 0;

            @Override
            public boolean hasNext() {
                return next < count;
            }

            @Override
            public Model next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("Modelli esauriti");
                }
                checkForInterruption();
                return buildModel(ordered, next++);
            }
        };
    }

    /**
     * Modello di indice dato nell'ordine di {@link #allModels(Collection)}.
     *
     * @param variables variabili ordinate
     * @param index indice in [0, 2^n)
     */
    public static Model modelAt(List<String> variables, long index) {
        List<String> ordered = validateVariables(variables);
        if (index < 0 || index >= modelCount(ordered.size())) {
            throw new IllegalArgumentException("Indice modello fuori intervallo: " + index);
        }
        return buildModel(ordered, index);
    }

    /**
     * Numero di modelli su n variabili: 2^n.
     */
    public static long modelCount(int variableCount) {
        if (variableCount < 0 || variableCount > MAX_VARIABLES) {
            throw new IllegalArgumentException("Numero di variabili non supportato: " + variableCount);
        }
        return 1L << variableCount;
    }

    //region SUPPORTO

    /**
     * Verifica se il thread corrente è stato interrotto e interrompe l'enumerazione.
     *
     * @throws CancellationException se interruzione rilevata
     */
    static void checkForInterruption() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Enumerazione dei modelli interrotta");
        }
    }

    static Model buildModel(List<String> variables, long index) {
        int n = variables.size();
        LinkedHashMap<String, Boolean> assignment = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            // Bit più significativo -> prima variabile
            assignment.put(variables.get(i), ((index >>> (n - 1 - i)) & 1L) == 1L);
        }
        return Model.trusted(assignment);
    }

    static List<String> validateVariables(Collection<String> variables) {
        if (variables == null) {
            throw new IllegalArgumentException("Lista variabili non può essere null");
        }
        if (variables.size() > MAX_VARIABLES) {
            throw new IllegalArgumentException("Troppe variabili per l'enumerazione esaustiva: " +
                    variables.size() + " (massimo " + MAX_VARIABLES + ")");
        }
        Set<String> seen = new HashSet<>();
        for (String variable : variables) {
            if (!FormulaTokens.isVariable(variable)) {
                throw new IllegalArgumentException("Nome non valido come variabile: '" + variable + "'");
            }
            if (!seen.add(variable)) {
                throw new IllegalArgumentException("Variabile duplicata: " + variable);
            }
        }
        return new ArrayList<>(variables);
    }

    //endregion
}
