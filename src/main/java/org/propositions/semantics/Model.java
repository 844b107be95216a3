package org.propositions.semantics;

import org.propositions.syntax.Formula;
import org.propositions.syntax.FormulaTokens;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * MODELLO - Assegnamento immutabile di valori di verità a variabili proposizionali
 *
 * Mantiene l'ordine di inserimento delle variabili, così che i modelli prodotti
 * da {@link ModelEnumerator} conservino l'ordine della lista di variabili.
 *
 * INVARIANTI:
 * • Ogni chiave è un nome di variabile valido
 * • Nessun valore null
 * • Nessuna modifica dopo la costruzione
 */
public final class Model {

    private static final Model EMPTY = new Model(new LinkedHashMap<>());

    private final Map<String, Boolean> assignment;

    private Model(LinkedHashMap<String, Boolean> assignment) {
        this.assignment = Collections.unmodifiableMap(assignment);
    }

    //region COSTRUZIONE E VALIDAZIONE

    /**
     * Crea un modello dalla mappa data, copiandola.
     *
     * @param assignment mappa nome variabile -&gt; valore
     * @return modello validato
     * @throws IllegalArgumentException se una chiave non è una variabile o un valore è null
     */
    public static Model of(Map<String, Boolean> assignment) {
        if (assignment == null) {
            throw new IllegalArgumentException("Assegnamento non può essere null");
        }
        if (!isModel(assignment)) {
            throw new IllegalArgumentException("Assegnamento con chiavi non valide come variabili: " +
                    assignment.keySet());
        }
        for (Map.Entry<String, Boolean> entry : assignment.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Valore null per la variabile " + entry.getKey());
            }
        }
        return new Model(new LinkedHashMap<>(assignment));
    }

    /**
     * Modello vuoto: unico modello sull'insieme vuoto di variabili.
     */
    public static Model empty() {
        return EMPTY;
    }

    /**
     * Costruzione senza validazione per chiavi già verificate dal chiamante.
     */
    static Model trusted(LinkedHashMap<String, Boolean> assignment) {
        return new Model(assignment);
    }

    /**
     * Verifica se la mappa è un modello, cioè se tutte le chiavi sono nomi di variabile.
     * Una mappa null non è un modello.
     */
    public static boolean isModel(Map<String, Boolean> assignment) {
        if (assignment == null) {
            return false;
        }
        for (String key : assignment.keySet()) {
            if (!FormulaTokens.isVariable(key)) {
                return false;
            }
        }
        return true;
    }

    //endregion

    //region ACCESSO

    /**
     * Variabili su cui è definito il modello, nell'ordine di inserimento.
     */
    public Set<String> variables() {
        return assignment.keySet();
    }

    /**
     * @param variable nome della variabile
     * @return valore assegnato
     * @throws IllegalArgumentException se la variabile non è assegnata
     */
    public boolean get(String variable) {
        Boolean value = assignment.get(variable);
        if (value == null) {
            throw new IllegalArgumentException("Variabile non assegnata nel modello: " + variable);
        }
        return value;
    }

    /**
     * Il modello copre la formula se ne assegna tutte le variabili.
     */
    public boolean covers(Formula formula) {
        return assignment.keySet().containsAll(formula.variables());
    }

    public Map<String, Boolean> asMap() {
        return assignment;
    }

    public int size() {
        return assignment.size();
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Model)) return false;
        return assignment.equals(((Model) obj).assignment);
    }

    @Override
    public int hashCode() {
        return assignment.hashCode();
    }

    @Override
    public String toString() {
        return assignment.toString();
    }
}
