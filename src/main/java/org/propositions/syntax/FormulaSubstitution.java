package org.propositions.syntax;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * MOTORE DI SOSTITUZIONE - Riscritture strutturali di alberi {@link Formula}
 *
 * Due trasformazioni in un'unica passata dall'alto verso il basso:
 * • Sostituzione di variabili con formule
 * • Sostituzione di operatori e costanti con template parametrici in p e q
 *
 * Le formule sostitutive non vengono mai a loro volta sottoposte a sostituzione:
 * solo le occorrenze presenti nell'albero originale sono riscritte.
 * Le sottoformule immutabili possono essere condivise tra albero originale e risultato.
 */
public final class FormulaSubstitution {

    private static final Logger LOGGER = Logger.getLogger(FormulaSubstitution.class.getName());

    private static final Set<String> TEMPLATE_PLACEHOLDERS =
            Set.of(FormulaTokens.FIRST_PLACEHOLDER, FormulaTokens.SECOND_PLACEHOLDER);

    /**
     * Previene istanziazione - classe utility
     */
    private FormulaSubstitution() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region SOSTITUZIONE VARIABILI

    /**
     * Sostituisce ogni variabile chiave della mappa con la formula corrispondente.
     *
     * ESEMPIO:
     * ((p-&gt;p)|r) con {p: (q&amp;r), r: p} -&gt; (((q&amp;r)-&gt;(q&amp;r))|p)
     *
     * @param formula formula di partenza
     * @param substitutionMap mappa nome variabile -&gt; formula sostitutiva
     * @return nuova formula con le sostituzioni applicate
     * @throws IllegalArgumentException se una chiave non è un nome di variabile
     */
    public static Formula substituteVariables(Formula formula, Map<String, Formula> substitutionMap) {
        validateMap(substitutionMap);
        for (String key : substitutionMap.keySet()) {
            if (!FormulaTokens.isVariable(key)) {
                throw new IllegalArgumentException("Chiave di sostituzione non è una variabile: '" + key + "'");
            }
        }

        Formula result = replaceVariables(formula, substitutionMap);
        LOGGER.finest("Sostituzione variabili: " + formula + " -> " + result);
        return result;
    }

    private static Formula replaceVariables(Formula formula, Map<String, Formula> substitutionMap) {
        return rewriteBottomUp(formula, (node, first, second) -> switch (node.getType()) {
            case VARIABLE -> substitutionMap.getOrDefault(node.getRoot(), node);
            case CONSTANT -> node;
            case UNARY, BINARY -> rebuild(node, first, second);
        });
    }

    //endregion

    //region SOSTITUZIONE OPERATORI

    /**
     * Sostituisce ogni operatore o costante chiave della mappa con il template
     * corrispondente, applicato agli operandi già riscritti: p per il primo, q per il secondo.
     *
     * ESEMPIO (De Morgan):
     * ((x&amp;y)&amp;~z) con {&amp;: ~(~p|~q)} -&gt; ~(~~(~x|~y)|~~z)
     *
     * I segnaposto senza operando corrispondente (p e q per le costanti, q per la
     * negazione) restano invariati nel risultato.
     *
     * @param formula formula di partenza
     * @param substitutionMap mappa simbolo -&gt; template
     * @return nuova formula con le sostituzioni applicate
     * @throws IllegalArgumentException se una chiave non è operatore/costante
     *         o un template usa variabili diverse da p e q
     */
    public static Formula substituteOperators(Formula formula, Map<String, Formula> substitutionMap) {
        validateMap(substitutionMap);
        for (Map.Entry<String, Formula> entry : substitutionMap.entrySet()) {
            String key = entry.getKey();
            if (!FormulaTokens.isBinaryOperator(key) && !FormulaTokens.isUnaryOperator(key)
                    && !FormulaTokens.isConstant(key)) {
                throw new IllegalArgumentException("Chiave di sostituzione non è un operatore: '" + key + "'");
            }
            if (!TEMPLATE_PLACEHOLDERS.containsAll(entry.getValue().variables())) {
                throw new IllegalArgumentException("Template per '" + key + "' usa variabili diverse da p e q: " +
                        entry.getValue());
            }
        }

        Formula result = replaceOperators(formula, substitutionMap);
        LOGGER.finest("Sostituzione operatori: " + formula + " -> " + result);
        return result;
    }

    private static Formula replaceOperators(Formula formula, Map<String, Formula> substitutionMap) {
        // I figli arrivano già riscritti: resta l'istanziazione del template sul nodo corrente
        return rewriteBottomUp(formula, (node, first, second) -> {
            if (node.getType() == Formula.Type.VARIABLE) {
                return node;
            }
            Formula template = substitutionMap.get(node.getRoot());
            if (template == null) {
                return node.getType() == Formula.Type.CONSTANT ? node : rebuild(node, first, second);
            }

            Map<String, Formula> operands = new HashMap<>();
            if (first != null) {
                operands.put(FormulaTokens.FIRST_PLACEHOLDER, first);
            }
            if (second != null) {
                operands.put(FormulaTokens.SECOND_PLACEHOLDER, second);
            }
            return replaceVariables(template, operands);
        });
    }

    //endregion

    //region VISITA POST-ORDINE

    /**
     * Riscrittura di un nodo dati i figli già riscritti (null se assenti).
     */
    @FunctionalInterface
    private interface NodeRewriter {
        Formula rewrite(Formula node, Formula first, Formula second);
    }

    /**
     * Applica la riscrittura dalle foglie verso la radice usando una pila esplicita.
     * Ogni nodo interno viene estratto due volte: la prima accoda i figli, la seconda
     * li preleva già riscritti dalla pila dei risultati.
     */
    private static Formula rewriteBottomUp(Formula formula, NodeRewriter rewriter) {
        Deque<Formula> pending = new ArrayDeque<>();
        Deque<Boolean> expanded = new ArrayDeque<>();
        Deque<Formula> results = new ArrayDeque<>();
        pending.push(formula);
        expanded.push(false);

        while (!pending.isEmpty()) {
            Formula node = pending.pop();
            boolean childrenDone = expanded.pop();

            if (!childrenDone && node.getFirst() != null) {
                pending.push(node);
                expanded.push(true);
                if (node.getSecond() != null) {
                    pending.push(node.getSecond());
                    expanded.push(false);
                }
                pending.push(node.getFirst());
                expanded.push(false);
                continue;
            }

            Formula second = node.getSecond() == null ? null : results.pop();
            Formula first = node.getFirst() == null ? null : results.pop();
            results.push(rewriter.rewrite(node, first, second));
        }
        return results.pop();
    }

    /**
     * Ricostruisce il nodo con i nuovi figli, riusandolo se i figli sono invariati.
     */
    private static Formula rebuild(Formula node, Formula first, Formula second) {
        if (first == node.getFirst() && second == node.getSecond()) {
            return node;
        }
        return new Formula(node.getRoot(), first, second);
    }

    //endregion

    private static void validateMap(Map<String, Formula> substitutionMap) {
        if (substitutionMap == null) {
            throw new IllegalArgumentException("Mappa di sostituzione non può essere null");
        }
        for (Formula replacement : substitutionMap.values()) {
            if (replacement == null) {
                throw new IllegalArgumentException("Mappa di sostituzione non può contenere formule null");
            }
        }
    }
}
