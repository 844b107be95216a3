package org.propositions.semantics;

import org.propositions.syntax.Formula;

import java.util.List;

/**
 * TAVOLA DI VERITÀ - Contenitore immutabile di modelli e valori di una formula
 *
 * Righe nell'ordine di {@link ModelEnumerator#allModels}, colonne = variabili
 * nell'ordine dato seguite dalla formula stessa.
 */
public final class TruthTable {

    private final Formula formula;
    private final List<String> variables;
    private final List<Model> models;
    private final List<Boolean> values;

    /**
     * @throws IllegalArgumentException se modelli e valori hanno lunghezze diverse
     */
    public TruthTable(Formula formula, List<String> variables, List<Model> models, List<Boolean> values) {
        if (formula == null || variables == null || models == null || values == null) {
            throw new IllegalArgumentException("Parametri della tavola di verità non possono essere null");
        }
        if (models.size() != values.size()) {
            throw new IllegalArgumentException("Numero di modelli (" + models.size() +
                    ") diverso dal numero di valori (" + values.size() + ")");
        }
        this.formula = formula;
        this.variables = List.copyOf(variables);
        this.models = List.copyOf(models);
        this.values = List.copyOf(values);
    }

    public Formula getFormula() {
        return formula;
    }

    public List<String> getVariables() {
        return variables;
    }

    public List<Model> getModels() {
        return models;
    }

    public List<Boolean> getValues() {
        return values;
    }

    public int getRowCount() {
        return models.size();
    }

    /**
     * Celle di una riga: valori delle variabili seguiti dal valore della formula.
     */
    public List<Boolean> getRow(int index) {
        Model model = models.get(index);
        Boolean[] row = new Boolean[variables.size() + 1];
        for (int i = 0; i < variables.size(); i++) {
            row[i] = model.get(variables.get(i));
        }
        row[variables.size()] = values.get(index);
        return List.of(row);
    }
}
