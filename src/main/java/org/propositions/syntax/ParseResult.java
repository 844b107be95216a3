package org.propositions.syntax;

/**
 * Esito del parsing di un prefisso di testo.
 *
 * In caso di successo contiene la formula riconosciuta e il suffisso non consumato;
 * in caso di fallimento contiene soltanto un messaggio descrittivo.
 */
public final class ParseResult {

    /** Formula riconosciuta, null se fallimento */
    private final Formula formula;

    /** Suffisso non consumato, null se fallimento */
    private final String remainder;

    /** Messaggio d'errore, null se successo */
    private final String error;

    private ParseResult(Formula formula, String remainder, String error) {
        this.formula = formula;
        this.remainder = remainder;
        this.error = error;
    }

    //region FACTORY METHODS

    /**
     * @param formula formula riconosciuta (non null)
     * @param remainder suffisso non consumato (non null, eventualmente vuoto)
     * @throws IllegalArgumentException se parametri null
     */
    public static ParseResult success(Formula formula, String remainder) {
        if (formula == null || remainder == null) {
            throw new IllegalArgumentException("Successo richiede formula e suffisso non null");
        }
        return new ParseResult(formula, remainder, null);
    }

    /**
     * @param error messaggio descrittivo del fallimento (non null)
     * @throws IllegalArgumentException se messaggio null
     */
    public static ParseResult failure(String error) {
        if (error == null) {
            throw new IllegalArgumentException("Fallimento richiede un messaggio d'errore");
        }
        return new ParseResult(null, null, error);
    }

    //endregion

    //region ACCESSO

    public boolean isSuccess() {
        return formula != null;
    }

    /**
     * Successo con consumo completo dell'input.
     */
    public boolean isComplete() {
        return isSuccess() && remainder.isEmpty();
    }

    public Formula getFormula() {
        return formula;
    }

    public String getRemainder() {
        return remainder;
    }

    public String getError() {
        return error;
    }

    //endregion

    @Override
    public String toString() {
        return isSuccess()
                ? "ParseResult{formula=" + formula + ", remainder='" + remainder + "'}"
                : "ParseResult{error='" + error + "'}";
    }
}
