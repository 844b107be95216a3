package org.propositions.syntax;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PARSER A PILA ESPLICITA - Conversione testo -&gt; albero {@link Formula}
 *
 * Grammatica della notazione standard:
 * <pre>
 * formula := variabile | costante | '~' formula | '(' formula op-binario formula ')'
 * </pre>
 *
 * ARCHITETTURA:
 * • Un solo token di lookahead, nessun backtracking
 * • Cursore esplicito sull'input invece di sottostringhe ad ogni passo
 * • Il parsing di un prefisso restituisce formula e suffisso non consumato
 * • Negazioni e parentesi aperte sono frame in attesa su una pila nello heap:
 *   nessuna ricorsione Java, quindi nessun limite di annidamento
 *
 * Supporta anche la notazione polacca prodotta da {@link Formula#polish()}.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    /**
     * Previene istanziazione - classe utility
     */
    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region NOTAZIONE STANDARD

    /**
     * Interpreta il più lungo prefisso del testo che costituisce una formula standard.
     * Non solleva eccezioni su input malformato: restituisce un fallimento descrittivo.
     *
     * @param text testo da interpretare
     * @return formula e suffisso non consumato, oppure messaggio d'errore
     */
    public static ParseResult parsePrefix(String text) {
        Cursor cursor = new Cursor(text);
        return cursor.finish(cursor.parseStandard());
    }

    /**
     * Predicato totale: vero se e solo se l'intero testo è una formula standard valida.
     */
    public static boolean isFormula(String text) {
        ParseResult result = parsePrefix(text);
        if (!result.isComplete() && LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Testo non valido come formula: " + text + " -> " +
                    (result.isSuccess() ? "suffisso residuo '" + result.getRemainder() + "'" : result.getError()));
        }
        return result.isComplete();
    }

    /**
     * Interpreta una formula standard completa.
     * Precondizione: {@link #isFormula(String)} è vero; i chiamanti devono validare prima.
     *
     * @param text rappresentazione standard della formula
     * @return albero della formula
     * @throws IllegalArgumentException se la precondizione è violata
     */
    public static Formula parse(String text) {
        ParseResult result = parsePrefix(text);
        requireComplete(text, result);
        return result.getFormula();
    }

    //endregion

    //region NOTAZIONE POLACCA

    /**
     * Interpreta il più lungo prefisso del testo in notazione polacca.
     */
    public static ParseResult parsePolishPrefix(String text) {
        Cursor cursor = new Cursor(text);
        return cursor.finish(cursor.parsePolish());
    }

    /**
     * Predicato totale: vero se e solo se l'intero testo è una formula polacca valida.
     */
    public static boolean isPolishFormula(String text) {
        return parsePolishPrefix(text).isComplete();
    }

    /**
     * Interpreta una formula completa in notazione polacca.
     *
     * @throws IllegalArgumentException se il testo non è una formula polacca valida
     */
    public static Formula parsePolish(String text) {
        ParseResult result = parsePolishPrefix(text);
        requireComplete(text, result);
        return result.getFormula();
    }

    //endregion

    //region SUPPORTO

    private static void requireComplete(String text, ParseResult result) {
        if (!result.isSuccess()) {
            throw new IllegalArgumentException("Formula non valida '" + text + "': " + result.getError());
        }
        if (!result.getRemainder().isEmpty()) {
            throw new IllegalArgumentException("Formula non valida '" + text +
                    "': suffisso non consumato '" + result.getRemainder() + "'");
        }
    }

    /**
     * Nodo in costruzione: una negazione in attesa dell'operando, oppure un
     * operatore binario in attesa del primo o del secondo operando.
     */
    private static final class Frame {
        private final boolean negation;
        private String operator;
        private Formula first;

        private Frame(boolean negation, String operator) {
            this.negation = negation;
            this.operator = operator;
        }

        static Frame negation() {
            return new Frame(true, FormulaTokens.NOT);
        }

        static Frame binary(String operator) {
            return new Frame(false, operator);
        }
    }

    /**
     * Cursore sull'input: tiene la posizione corrente e il primo errore rilevato.
     */
    private static final class Cursor {
        private final String text;
        private int position;
        private String error;

        Cursor(String text) {
            this.text = text == null ? "" : text;
        }

        ParseResult finish(Formula formula) {
            if (formula == null) {
                return ParseResult.failure(error);
            }
            return ParseResult.success(formula, text.substring(position));
        }

        /**
         * Notazione standard. '(' e '~' aprono un frame; ogni sottoformula completata
         * chiude i frame in cima alla pila finché uno non richiede un altro operando.
         * Restituisce null e registra l'errore al primo fallimento.
         */
        Formula parseStandard() {
            Deque<Frame> pending = new ArrayDeque<>();

            while (true) {
                // Apertura: negazioni e parentesi fino alla prima foglia
                Formula completed = null;
                while (completed == null) {
                    if (atEnd()) {
                        return fail("input vuoto");
                    }
                    char current = text.charAt(position);
                    if (current == '(') {
                        position++;
                        pending.push(Frame.binary(null));
                    } else if (FormulaTokens.isUnaryOperator(String.valueOf(current))) {
                        position++;
                        pending.push(Frame.negation());
                    } else {
                        completed = readLeaf(current);
                        if (completed == null) {
                            return null;
                        }
                    }
                }

                // Chiusura dei frame completati
                boolean needsOperand = false;
                while (!needsOperand) {
                    Frame top = pending.peek();
                    if (top == null) {
                        return completed;
                    }
                    if (top.negation) {
                        pending.pop();
                        completed = new Formula(FormulaTokens.NOT, completed);
                    } else if (top.first == null) {
                        top.first = completed;
                        top.operator = readBinaryOperator();
                        if (top.operator == null) {
                            return null;
                        }
                        needsOperand = true;
                    } else {
                        if (atEnd() || text.charAt(position) != ')') {
                            return fail("attesa ')' in posizione " + position);
                        }
                        position++;
                        pending.pop();
                        completed = new Formula(top.operator, top.first, completed);
                    }
                }
            }
        }

        /**
         * Notazione polacca: l'arità è determinata dal simbolo, nessuna parentesi.
         */
        Formula parsePolish() {
            Deque<Frame> pending = new ArrayDeque<>();

            while (true) {
                Formula completed = null;
                while (completed == null) {
                    if (atEnd()) {
                        return fail("input vuoto");
                    }
                    char current = text.charAt(position);
                    if (FormulaTokens.isUnaryOperator(String.valueOf(current))) {
                        position++;
                        pending.push(Frame.negation());
                    } else if (current == '&' || current == '|' || current == '-') {
                        String operator = readBinaryOperator();
                        if (operator == null) {
                            return null;
                        }
                        pending.push(Frame.binary(operator));
                    } else {
                        completed = readLeaf(current);
                        if (completed == null) {
                            return null;
                        }
                    }
                }

                boolean needsOperand = false;
                while (!needsOperand) {
                    Frame top = pending.peek();
                    if (top == null) {
                        return completed;
                    }
                    if (top.negation) {
                        pending.pop();
                        completed = new Formula(FormulaTokens.NOT, completed);
                    } else if (top.first == null) {
                        top.first = completed;
                        needsOperand = true;
                    } else {
                        pending.pop();
                        completed = new Formula(top.operator, top.first, completed);
                    }
                }
            }
        }

        /**
         * Variabile o costante nella posizione corrente.
         */
        private Formula readLeaf(char current) {
            if (FormulaTokens.isVariableStart(current)) {
                return readVariable();
            }
            if (FormulaTokens.isConstant(String.valueOf(current))) {
                position++;
                return new Formula(String.valueOf(current));
            }
            return fail("carattere non riconosciuto '" + current + "' in posizione " + position);
        }

        /**
         * Consuma la lettera iniziale e tutte le cifre immediatamente successive.
         */
        private Formula readVariable() {
            int start = position;
            position++;
            while (!atEnd() && FormulaTokens.isDigit(text.charAt(position))) {
                position++;
            }
            return new Formula(text.substring(start, position));
        }

        /**
         * Tokenizza un operatore binario: '&amp;' e '|' sono token di un carattere,
         * '-' deve essere seguito da '&gt;'.
         */
        private String readBinaryOperator() {
            if (atEnd()) {
                fail("atteso operatore binario, trovata fine input");
                return null;
            }

            char current = text.charAt(position);

            if (current == '-') {
                if (position + 1 < text.length() && text.charAt(position + 1) == '>') {
                    position += 2;
                    return FormulaTokens.IMPLIES;
                }
                fail("atteso '>' dopo '-' in posizione " + position);
                return null;
            }

            String token = String.valueOf(current);
            if (FormulaTokens.isBinaryOperator(token)) {
                position++;
                return token;
            }

            fail("operatore binario non riconosciuto '" + current + "' in posizione " + position);
            return null;
        }

        private boolean atEnd() {
            return position >= text.length();
        }

        private Formula fail(String message) {
            if (error == null) {
                error = message;
            }
            return null;
        }
    }

    //endregion
}
