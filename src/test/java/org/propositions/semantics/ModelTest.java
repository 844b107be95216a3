package org.propositions.semantics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.propositions.syntax.Formula;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Modello")
class ModelTest {

    @Test
    @DisplayName("isModel verifica che le chiavi siano variabili")
    void testIsModel() {
        assertTrue(Model.isModel(Map.of("p", true, "q12", false)));
        assertTrue(Model.isModel(Map.of()));
        assertFalse(Model.isModel(Map.of("p", true, "T", false)));
        assertFalse(Model.isModel(Map.of("a", true)));
    }

    @Test
    @DisplayName("isModel su mappa null restituisce falso, come of la rifiuta")
    void testIsModelNull() {
        assertFalse(Model.isModel(null));
        assertThrows(IllegalArgumentException.class, () -> Model.of(null));
    }

    @Test
    @DisplayName("Chiavi non valide e valori null rifiutati")
    void testInvalidModels() {
        assertThrows(IllegalArgumentException.class, () -> Model.of(Map.of("&", true)));
        assertThrows(IllegalArgumentException.class, () -> Model.of(null));

        Map<String, Boolean> withNull = new HashMap<>();
        withNull.put("p", null);
        assertThrows(IllegalArgumentException.class, () -> Model.of(withNull));
    }

    @Test
    @DisplayName("Ordine di inserimento preservato e copia difensiva")
    void testOrderAndCopy() {
        LinkedHashMap<String, Boolean> source = new LinkedHashMap<>();
        source.put("z", true);
        source.put("p", false);
        Model model = Model.of(source);
        source.put("q", true);

        assertEquals(List.of("z", "p"), List.copyOf(model.variables()));
        assertFalse(model.get("p"));
        assertThrows(IllegalArgumentException.class, () -> model.get("q"));
        assertThrows(UnsupportedOperationException.class, () -> model.asMap().put("q", true));
    }

    @Test
    @DisplayName("Copertura delle variabili di una formula")
    void testCovers() {
        Model model = Model.of(Map.of("p", true, "q", false));
        assertTrue(model.covers(Formula.parse("(p|~q)")));
        assertTrue(model.covers(Formula.parse("T")));
        assertFalse(model.covers(Formula.parse("(p|r)")));
        assertTrue(Model.empty().covers(Formula.parse("~F")));
    }
}
