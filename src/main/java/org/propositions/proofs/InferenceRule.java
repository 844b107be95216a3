package org.propositions.proofs;

import org.propositions.syntax.Formula;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * REGOLA DI INFERENZA - Lista ordinata di assunzioni e una conclusione
 *
 * Contenitore immutabile consumato in sola lettura dal verificatore semantico
 * delle inferenze. Le assunzioni possono essere vuote (assioma).
 */
public final class InferenceRule {

    private final List<Formula> assumptions;
    private final Formula conclusion;

    /**
     * @param assumptions assunzioni in ordine (non null, senza elementi null)
     * @param conclusion conclusione (non null)
     * @throws IllegalArgumentException se parametri non validi
     */
    public InferenceRule(List<Formula> assumptions, Formula conclusion) {
        if (assumptions == null) {
            throw new IllegalArgumentException("Lista assunzioni non può essere null");
        }
        for (Formula assumption : assumptions) {
            if (assumption == null) {
                throw new IllegalArgumentException("Lista assunzioni non può contenere elementi null");
            }
        }
        if (conclusion == null) {
            throw new IllegalArgumentException("Conclusione non può essere null");
        }

        this.assumptions = List.copyOf(assumptions);
        this.conclusion = conclusion;
    }

    public List<Formula> getAssumptions() {
        return assumptions;
    }

    public Formula getConclusion() {
        return conclusion;
    }

    /**
     * Unione ordinata delle variabili di assunzioni e conclusione.
     */
    public SortedSet<String> variables() {
        SortedSet<String> all = new TreeSet<>(conclusion.variables());
        for (Formula assumption : assumptions) {
            all.addAll(assumption.variables());
        }
        return Collections.unmodifiableSortedSet(all);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        InferenceRule other = (InferenceRule) obj;
        return assumptions.equals(other.assumptions) && conclusion.equals(other.conclusion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assumptions, conclusion);
    }

    /**
     * Formato: [assunzione1, assunzione2] ==&gt; conclusione
     */
    @Override
    public String toString() {
        return assumptions + " ==> " + conclusion;
    }
}
