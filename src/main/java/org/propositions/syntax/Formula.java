package org.propositions.syntax;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile
 *
 * Ogni nodo è esattamente una delle quattro varianti, determinata dal simbolo radice:
 * • VARIABLE: nome di variabile (p, q76), nessun figlio
 * • CONSTANT: T oppure F, nessun figlio
 * • UNARY: operatore ~ con un solo figlio
 * • BINARY: operatore &amp;, | oppure -&gt; con due figli
 *
 * INVARIANTI:
 * • Corrispondenza chiusa simbolo/arità verificata in costruzione
 * • Nessuna mutazione dopo la costruzione: le trasformazioni producono nuovi alberi
 * • Uguaglianza e hash derivati dalla rappresentazione testuale canonica
 *
 * Le proprietà derivate senza parametri (stringa canonica, variabili, operatori)
 * sono calcolate al primo accesso e poi memorizzate, dato che l'albero non cambia mai.
 *
 * Tutte le visite dell'albero usano una pila esplicita: catene profonde come quelle
 * prodotte dalla sintesi DNF non consumano lo stack del thread.
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Varianti di nodo supportate nella rappresentazione ad albero.
     */
    public enum Type {
        VARIABLE,   // Variabile proposizionale: p, q76
        CONSTANT,   // Costante logica: T, F
        UNARY,      // Negazione: ~A
        BINARY      // Operatore binario: (A&B), (A|B), (A->B)
    }

    /** Variante del nodo, determinata dal simbolo radice */
    private final Type type;

    /** Costante, variabile o operatore alla radice dell'albero */
    private final String root;

    /** Primo operando (solo per nodi UNARY e BINARY) */
    private final Formula first;

    /** Secondo operando (solo per nodi BINARY) */
    private final Formula second;

    //endregion

    //region CACHE PROPRIETÀ DERIVATE

    private volatile String canonical;
    private volatile SortedSet<String> variables;
    private volatile SortedSet<String> operators;

    //endregion

    //region COSTRUTTORI E VALIDAZIONE ARITÀ

    /**
     * Costruisce una foglia: variabile o costante.
     *
     * @param root nome di variabile oppure costante T/F
     * @throws InvalidArityException se il simbolo richiede operandi
     */
    public Formula(String root) {
        this(root, null, null);
    }

    /**
     * Costruisce un nodo unario.
     *
     * @param root operatore unario (~)
     * @param first operando (non null)
     * @throws InvalidArityException se il simbolo non è unario
     */
    public Formula(String root, Formula first) {
        this(root, first, null);
    }

    /**
     * Costruisce un nodo con al più due operandi, validando la corrispondenza
     * tra simbolo radice e numero di figli.
     *
     * @param root simbolo radice
     * @param first primo operando (null per foglie)
     * @param second secondo operando (null per foglie e nodi unari)
     * @throws InvalidArityException se il numero di operandi non corrisponde al simbolo
     * @throws IllegalArgumentException se il simbolo non appartiene all'alfabeto
     */
    public Formula(String root, Formula first, Formula second) {
        if (root == null) {
            throw new IllegalArgumentException("Simbolo radice non può essere null");
        }

        int children = (first != null ? 1 : 0) + (second != null ? 1 : 0);

        if (FormulaTokens.isVariable(root) || FormulaTokens.isConstant(root)) {
            if (children != 0) {
                throw new InvalidArityException(root, 0, children);
            }
            this.type = FormulaTokens.isVariable(root) ? Type.VARIABLE : Type.CONSTANT;
        } else if (FormulaTokens.isUnaryOperator(root)) {
            if (first == null || second != null) {
                throw new InvalidArityException(root, 1, children);
            }
            this.type = Type.UNARY;
        } else if (FormulaTokens.isBinaryOperator(root)) {
            if (first == null || second == null) {
                throw new InvalidArityException(root, 2, children);
            }
            this.type = Type.BINARY;
        } else {
            throw new IllegalArgumentException("Simbolo radice sconosciuto: '" + root + "'");
        }

        this.root = root;
        this.first = first;
        this.second = second;
    }

    //endregion

    //region FACTORY METHODS

    /**
     * Costruisce la negazione della formula data.
     */
    public static Formula not(Formula operand) {
        return new Formula(FormulaTokens.NOT, operand);
    }

    /**
     * Interpreta una stringa valida in notazione standard.
     *
     * @param text rappresentazione standard (deve soddisfare {@link FormulaParser#isFormula})
     * @return albero corrispondente
     * @throws IllegalArgumentException se il testo non è una formula valida
     */
    public static Formula parse(String text) {
        return FormulaParser.parse(text);
    }

    //endregion

    //region ACCESSO ALLA STRUTTURA

    public Type getType() {
        return type;
    }

    public String getRoot() {
        return root;
    }

    /**
     * @return primo operando, null per variabili e costanti
     */
    public Formula getFirst() {
        return first;
    }

    /**
     * @return secondo operando, null se la radice non è binaria
     */
    public Formula getSecond() {
        return second;
    }

    //endregion

    //region INTERROGAZIONI STRUTTURALI

    /**
     * Insieme ordinato dei nomi di variabile raggiungibili dalla radice.
     *
     * @return insieme immutabile, memorizzato dopo il primo calcolo
     */
    public SortedSet<String> variables() {
        SortedSet<String> result = variables;
        if (result == null) {
            SortedSet<String> collected = new TreeSet<>();
            collectSymbols(collected, true);
            result = Collections.unmodifiableSortedSet(collected);
            variables = result;
        }
        return result;
    }

    /**
     * Insieme ordinato dei simboli non variabili (operatori e costanti) raggiungibili dalla radice.
     *
     * @return insieme immutabile, memorizzato dopo il primo calcolo
     */
    public SortedSet<String> operators() {
        SortedSet<String> result = operators;
        if (result == null) {
            SortedSet<String> collected = new TreeSet<>();
            collectSymbols(collected, false);
            result = Collections.unmodifiableSortedSet(collected);
            operators = result;
        }
        return result;
    }

    /**
     * Raccoglie variabili oppure operatori visitando tutti i nodi.
     */
    private void collectSymbols(SortedSet<String> symbols, boolean wantVariables) {
        Deque<Formula> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Formula node = pending.pop();
            if ((node.type == Type.VARIABLE) == wantVariables) {
                symbols.add(node.root);
            }
            pushChildren(pending, node);
        }
    }

    /**
     * Calcola la profondità massima dell'albero (0 per le foglie).
     */
    public int depth() {
        Deque<Formula> pending = new ArrayDeque<>();
        Deque<Integer> levels = new ArrayDeque<>();
        pending.push(this);
        levels.push(0);

        int max = 0;
        while (!pending.isEmpty()) {
            Formula node = pending.pop();
            int level = levels.pop();
            max = Math.max(max, level);
            if (node.first != null) {
                pending.push(node.first);
                levels.push(level + 1);
            }
            if (node.second != null) {
                pending.push(node.second);
                levels.push(level + 1);
            }
        }
        return max;
    }

    /**
     * Conta i nodi dell'albero.
     */
    public int size() {
        Deque<Formula> pending = new ArrayDeque<>();
        pending.push(this);

        int count = 0;
        while (!pending.isEmpty()) {
            count++;
            pushChildren(pending, pending.pop());
        }
        return count;
    }

    private static void pushChildren(Deque<Formula> pending, Formula node) {
        if (node.second != null) {
            pending.push(node.second);
        }
        if (node.first != null) {
            pending.push(node.first);
        }
    }

    //endregion

    //region SOSTITUZIONI

    /**
     * @see FormulaSubstitution#substituteVariables(Formula, Map)
     */
    public Formula substituteVariables(Map<String, Formula> substitutionMap) {
        return FormulaSubstitution.substituteVariables(this, substitutionMap);
    }

    /**
     * @see FormulaSubstitution#substituteOperators(Formula, Map)
     */
    public Formula substituteOperators(Map<String, Formula> substitutionMap) {
        return FormulaSubstitution.substituteOperators(this, substitutionMap);
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Rappresentazione standard della formula.
     *
     * FORMATO OUTPUT:
     * • Variabili e costanti: il simbolo stesso
     * • Negazioni: ~operando, senza parentesi
     * • Binari: (primo operatore secondo)
     *
     * @return stringa canonica, memorizzata dopo il primo calcolo
     */
    @Override
    public String toString() {
        String result = canonical;
        if (result == null) {
            StringBuilder builder = new StringBuilder();
            appendStandard(builder);
            result = builder.toString();
            canonical = result;
        }
        return result;
    }

    /**
     * La pila contiene formule ancora da scrivere e frammenti di testo
     * (operatore, parentesi chiusa) da emettere dopo il primo operando.
     */
    private void appendStandard(StringBuilder builder) {
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Object item = pending.pop();
            if (item instanceof String) {
                builder.append((String) item);
                continue;
            }
            Formula node = (Formula) item;
            switch (node.type) {
                case VARIABLE, CONSTANT -> builder.append(node.root);
                case UNARY -> {
                    builder.append(node.root);
                    pending.push(node.first);
                }
                case BINARY -> {
                    builder.append('(');
                    pending.push(")");
                    pending.push(node.second);
                    pending.push(node.root);
                    pending.push(node.first);
                }
            }
        }
    }

    /**
     * Rappresentazione in notazione polacca (prefissa): simbolo radice seguito
     * dalle rappresentazioni polacche dei figli, senza separatori né parentesi.
     */
    public String polish() {
        StringBuilder builder = new StringBuilder();
        appendPolish(builder);
        return builder.toString();
    }

    private void appendPolish(StringBuilder builder) {
        Deque<Formula> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Formula node = pending.pop();
            builder.append(node.root);
            pushChildren(pending, node);
        }
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Due formule sono uguali se e solo se le loro rappresentazioni standard coincidono.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Formula)) return false;
        return toString().equals(obj.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    //endregion
}
