package org.propositions.support;

import org.propositions.semantics.TruthTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Rendering testuale di una {@link TruthTable} come tabella markdown in stile GitHub.
 *
 * FORMATO OUTPUT:
 * <pre>
 * | p | q76 | ~(p&amp;q76) |
 * |---|-----|----------|
 * | F | F   | T        |
 * </pre>
 * Celle di un carattere (T/F), allineate a sinistra e completate a larghezza di colonna.
 */
public final class TruthTableRenderer {

    private static final String TRUE_CELL = "T";
    private static final String FALSE_CELL = "F";

    /**
     * Previene istanziazione - classe utility
     */
    private TruthTableRenderer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param table tavola da rappresentare
     * @return tabella markdown, righe separate da '\n', senza newline finale
     */
    public static String render(TruthTable table) {
        List<String> headers = new ArrayList<>(table.getVariables());
        headers.add(table.getFormula().toString());

        int[] widths = new int[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            widths[i] = Math.max(headers.get(i).length(), 1);
        }

        StringBuilder output = new StringBuilder();
        appendRow(output, headers, widths);

        output.append('\n').append('|');
        for (int width : widths) {
            output.append("-".repeat(width + 2)).append('|');
        }

        for (int row = 0; row < table.getRowCount(); row++) {
            List<String> cells = new ArrayList<>();
            for (Boolean value : table.getRow(row)) {
                cells.add(toCell(value));
            }
            output.append('\n');
            appendRow(output, cells, widths);
        }

        return output.toString();
    }

    /**
     * Rappresentazione di un valore di verità come singolo carattere.
     */
    public static String toCell(boolean value) {
        return value ? TRUE_CELL : FALSE_CELL;
    }

    private static void appendRow(StringBuilder output, List<String> cells, int[] widths) {
        output.append('|');
        for (int i = 0; i < cells.size(); i++) {
            String cell = cells.get(i);
            output.append(' ').append(cell).append(" ".repeat(widths[i] - cell.length())).append(" |");
        }
    }
}
