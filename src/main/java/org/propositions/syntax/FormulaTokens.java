package org.propositions.syntax;

/**
 * CLASSIFICATORI DI TOKEN - Predicati puri sul testo grezzo delle formule
 *
 * Distingue nomi di variabili, costanti logiche e operatori unari/binari.
 * Tutti i metodi sono privi di effetti collaterali e totali su qualsiasi stringa.
 *
 * ALFABETO SUPPORTATO:
 * • Variabili: lettera da 'p' a 'z' seguita da zero o più cifre decimali (p, q76, z0)
 * • Costanti: T (vero), F (falso)
 * • Operatore unario: ~ (negazione)
 * • Operatori binari: &amp; (congiunzione), | (disgiunzione), -&gt; (implicazione)
 */
public final class FormulaTokens {

    //region SIMBOLI DELL'ALFABETO

    public static final String TRUE = "T";
    public static final String FALSE = "F";
    public static final String NOT = "~";
    public static final String AND = "&";
    public static final String OR = "|";
    public static final String IMPLIES = "->";

    /** Segnaposto del primo operando nei template di sostituzione operatori */
    public static final String FIRST_PLACEHOLDER = "p";

    /** Segnaposto del secondo operando nei template di sostituzione operatori */
    public static final String SECOND_PLACEHOLDER = "q";

    //endregion

    /**
     * Previene istanziazione - classe utility
     */
    private FormulaTokens() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region PREDICATI DI CLASSIFICAZIONE

    /**
     * Verifica se la stringa è il nome di una variabile proposizionale.
     *
     * @param token stringa da classificare
     * @return true se il primo carattere è in ['p','z'] e i restanti sono cifre decimali
     */
    public static boolean isVariable(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        if (!isVariableStart(token.charAt(0))) {
            return false;
        }
        for (int i = 1; i < token.length(); i++) {
            if (!isDigit(token.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Verifica se la stringa è una costante logica (T oppure F).
     */
    public static boolean isConstant(String token) {
        return TRUE.equals(token) || FALSE.equals(token);
    }

    /**
     * Verifica se la stringa è l'operatore unario di negazione.
     */
    public static boolean isUnaryOperator(String token) {
        return NOT.equals(token);
    }

    /**
     * Verifica se la stringa è uno degli operatori binari attivi.
     * L'insieme è chiuso: solo &amp;, | e -&gt; sono riconosciuti.
     */
    public static boolean isBinaryOperator(String token) {
        return AND.equals(token) || OR.equals(token) || IMPLIES.equals(token);
    }

    //endregion

    //region PREDICATI SUI CARATTERI

    /**
     * Primo carattere ammesso per un nome di variabile.
     */
    static boolean isVariableStart(char c) {
        return c >= 'p' && c <= 'z';
    }

    /**
     * Cifra decimale ASCII (esclude cifre Unicode non latine).
     */
    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    //endregion
}
