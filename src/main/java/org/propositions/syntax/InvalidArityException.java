package org.propositions.syntax;

/**
 * Segnala la costruzione di un nodo {@link Formula} il cui numero di figli non
 * corrisponde all'arità del simbolo radice.
 *
 * Si tratta di un errore di programmazione del chiamante, non di un input malformato.
 */
public class InvalidArityException extends IllegalArgumentException {

    private final String root;
    private final int expectedChildren;
    private final int actualChildren;

    public InvalidArityException(String root, int expectedChildren, int actualChildren) {
        super("Arità non valida per il simbolo '" + root + "': attesi " + expectedChildren +
                " operandi, ricevuti " + actualChildren);
        this.root = root;
        this.expectedChildren = expectedChildren;
        this.actualChildren = actualChildren;
    }

    public String getRoot() {
        return root;
    }

    public int getExpectedChildren() {
        return expectedChildren;
    }

    public int getActualChildren() {
        return actualChildren;
    }
}
