package org.propositions;

import org.propositions.infix.InfixFormulaReader;
import org.propositions.semantics.FormulaSynthesizer;
import org.propositions.semantics.ModelEnumerator;
import org.propositions.semantics.ParallelModelChecker;
import org.propositions.semantics.SemanticAnalyzer;
import org.propositions.semantics.TruthTable;
import org.propositions.support.TruthTableRenderer;
import org.propositions.syntax.Formula;
import org.propositions.syntax.FormulaParser;
import org.propositions.syntax.ParseResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MOTORE DI LOGICA PROPOSIZIONALE - Interfaccia a linea di comando
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: Formula in notazione standard, infissa o polacca, oppure tavola di verità
 * 2. PARSING: Parser a pila esplicita (standard/polacca) o grammatica ANTLR (infissa)
 * 3. ANALISI: Tautologia, contraddizione, soddisfacibilità per enumerazione esaustiva
 * 4. OUTPUT: Rappresentazioni della formula e tavola di verità in markdown
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - Analisi formula standard (-f), infissa (-i) o polacca (-p)
 * - Sintesi da tavola di verità in DNF o CNF (-synth=dnf|cnf &lt;variabili&gt; &lt;valori&gt;)
 * - Timeout configurabile per l'analisi esaustiva (-t secondi)
 * - Verifica parallela su più thread (-j thread)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    static final String HELP_PARAM = "-h";
    static final String STANDARD_PARAM = "-f";
    static final String INFIX_PARAM = "-i";
    static final String POLISH_PARAM = "-p";
    static final String SYNTH_PARAM = "-synth=";
    static final String TIMEOUT_PARAM = "-t";
    static final String THREADS_PARAM = "-j";

    /**
     * Forme normali disponibili per la sintesi
     * */
    static final String SYNTH_DNF = "dnf";
    static final String SYNTH_CNF = "cnf";

    /**
     * Configurazioni timeout e parallelismo di default e limiti
     * */
    static final int DEFAULT_TIMEOUT_SECONDS = 10;
    static final int MIN_TIMEOUT_SECONDS = 1;
    static final int DEFAULT_THREADS = 1;
    static final int MAX_THREADS = 64;

    /**
     * Oltre questo numero di variabili la tavola di verità non viene stampata
     * */
    static final int MAX_TABLE_VARIABLES = 12;

    /**
     * Nome del thread che esegue l'analisi sotto timeout
     * */
    static final String ANALYSIS_THREAD_NAME = "formula-analysis";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO MOTORE LOGICA PROPOSIZIONALE <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            CliConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE <---");
        }
    }

    /**
     * Esegue la modalità richiesta dalla configurazione.
     */
    private static void executeMainPipeline(CliConfiguration config) {
        if (config.mode == Mode.SYNTHESIS) {
            System.out.println("[I] Modalità: Sintesi " + config.synthesisForm.toUpperCase());
            System.out.println(synthesizeFromTable(config));
            return;
        }

        System.out.println("[I] Modalità: Analisi formula " + config.mode.description);
        Formula formula = readFormula(config);
        if (formula == null) {
            return;
        }

        String report = executeAnalysisWithTimeout(formula, config);
        if (report == null) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
        } else {
            System.out.println(report);
        }
    }

    /**
     * Gestisce errori critici dell'applicazione con logging completo.
     */
    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.exit(1);
    }

    /**
     * Analizza i parametri; in caso di errore mostra il messaggio e restituisce null.
     */
    private static CliConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    //endregion

    //region LETTURA E ANALISI FORMULA

    /**
     * Legge la formula nella notazione configurata.
     *
     * @return formula letta, null se il testo non è valido
     */
    static Formula readFormula(CliConfiguration config) {
        switch (config.mode) {
            case STANDARD -> {
                ParseResult result = FormulaParser.parsePrefix(config.formulaText);
                if (!result.isComplete()) {
                    String reason = result.isSuccess()
                            ? "suffisso non consumato '" + result.getRemainder() + "'"
                            : result.getError();
                    LOGGER.warning("Formula standard rifiutata: " + config.formulaText);
                    System.out.println("[E] Formula non valida: " + reason);
                    return null;
                }
                return result.getFormula();
            }
            case POLISH -> {
                ParseResult result = FormulaParser.parsePolishPrefix(config.formulaText);
                if (!result.isComplete()) {
                    LOGGER.warning("Formula polacca rifiutata: " + config.formulaText);
                    System.out.println("[E] Formula polacca non valida: " +
                            (result.isSuccess() ? "suffisso non consumato '" + result.getRemainder() + "'" : result.getError()));
                    return null;
                }
                return result.getFormula();
            }
            case INFIX -> {
                try {
                    return InfixFormulaReader.read(config.formulaText);
                } catch (IllegalArgumentException e) {
                    LOGGER.warning("Formula infissa rifiutata: " + config.formulaText);
                    System.out.println("[E] " + e.getMessage());
                    return null;
                }
            }
            default -> throw new IllegalStateException("Modalità senza formula: " + config.mode);
        }
    }

    /**
     * Esegue l'analisi esaustiva con timeout controllato tramite ExecutorService.
     * Allo scadere il worker viene interrotto: l'enumerazione dei modelli rileva
     * l'interruzione e termina. Il worker è daemon e non trattiene la JVM.
     *
     * @return report testuale o null se timeout
     */
    static String executeAnalysisWithTimeout(Formula formula, CliConfiguration config) {
        ExecutorService executor = Executors.newSingleThreadExecutor(task -> {
            Thread thread = new Thread(task, ANALYSIS_THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });

        try {
            Callable<String> analysisTask = () -> buildReport(formula, config.threads);
            Future<String> future = executor.submit(analysisTask);
            return future.get(config.timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            LOGGER.warning("Analisi di " + formula + " interrotta per timeout");
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Analisi interrotta", e);
        } catch (ExecutionException e) {
            LOGGER.log(Level.SEVERE, "Errore durante l'analisi della formula", e.getCause());
            throw new IllegalStateException("Errore nell'analisi della formula " + formula, e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Costruisce il report completo della formula.
     *
     * @param formula formula da analizzare
     * @param threads numero di worker per le verifiche esaustive (1 = sequenziale)
     */
    static String buildReport(Formula formula, int threads) {
        boolean tautology;
        boolean contradiction;
        boolean satisfiable;

        if (threads > 1) {
            try (ParallelModelChecker checker = new ParallelModelChecker(threads)) {
                tautology = checker.isTautology(formula);
                contradiction = checker.isContradiction(formula);
                satisfiable = !contradiction;
            }
        } else {
            tautology = SemanticAnalyzer.isTautology(formula);
            contradiction = SemanticAnalyzer.isContradiction(formula);
            satisfiable = !contradiction;
        }

        String table;
        if (formula.variables().size() > MAX_TABLE_VARIABLES) {
            table = " omessa (" + formula.variables().size() + " variabili, massimo " + MAX_TABLE_VARIABLES + ")";
        } else {
            TruthTable truthTable = SemanticAnalyzer.truthTable(formula);
            table = "\n" + TruthTableRenderer.render(truthTable);
        }

        return "Formula: " + formula + "\n" +
                "Polacca: " + formula.polish() + "\n" +
                "Variabili: " + formula.variables() + "\n" +
                "Operatori: " + formula.operators() + "\n" +
                "Profondità: " + formula.depth() + ", nodi: " + formula.size() + "\n" +
                "Tautologia: " + yesNo(tautology) + "\n" +
                "Contraddizione: " + yesNo(contradiction) + "\n" +
                "Soddisfacibile: " + yesNo(satisfiable) + "\n" +
                "Tavola di verità:" + table;
    }

    private static String yesNo(boolean value) {
        return value ? "sì" : "no";
    }

    //endregion

    //region SINTESI DA TAVOLA DI VERITÀ

    /**
     * Sintetizza la formula e ne verifica la tavola di verità.
     */
    static String synthesizeFromTable(CliConfiguration config) {
        Formula formula = SYNTH_CNF.equals(config.synthesisForm)
                ? FormulaSynthesizer.synthesizeCnf(config.variables, config.values)
                : FormulaSynthesizer.synthesize(config.variables, config.values);

        List<Boolean> check = SemanticAnalyzer.truthValueList(formula, ModelEnumerator.allModels(config.variables));
        if (!check.equals(config.values)) {
            throw new IllegalStateException("Formula sintetizzata non riproduce la tavola: " + formula);
        }
        return "Formula sintetizzata: " + formula;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> MOTORE LOGICA PROPOSIZIONALE <<::\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar propositions.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE:");
        System.out.println("  -f <formula>            Analizza formula in notazione standard, es. '~(p&q76)'");
        System.out.println("  -i <formula>            Analizza formula infissa con precedenze, es. 'p & q -> r'");
        System.out.println("  -p <formula>            Analizza formula in notazione polacca, es. '~&pq76'");
        System.out.println("  -synth=dnf|cnf <v> <t>  Sintetizza da tavola di verità, es. -synth=dnf p,q TTTF");
        System.out.println("  -t <secondi>            Timeout dell'analisi (min: 1, default: 10)");
        System.out.println("  -j <thread>             Thread per le verifiche esaustive (default: 1)");
        System.out.println("  -h                      Mostra questa guida\n");

        System.out.println("NOTE OPERATIVE:");
        System.out.println("  - Variabili: lettera da p a z seguita da cifre (p, q76)");
        System.out.println("  - Costanti: T, F; operatori: ~, &, |, ->");
        System.out.println("  - Notazione standard: binari sempre tra parentesi, nessuno spazio");
        System.out.println("  - Tavola di verità: valori T/F nell'ordine dei modelli (F < T, prima variabile più significativa)");
        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    enum Mode {
        STANDARD("standard"),
        INFIX("infissa"),
        POLISH("polacca"),
        SYNTHESIS("sintesi");

        final String description;

        Mode(String description) {
            this.description = description;
        }
    }

    /**
     * Configurazione validata dell'applicazione.
     */
    static final class CliConfiguration {
        final Mode mode;
        final String formulaText;
        final String synthesisForm;
        final List<String> variables;
        final List<Boolean> values;
        final int timeoutSeconds;
        final int threads;

        CliConfiguration(Mode mode, String formulaText, String synthesisForm, List<String> variables,
                         List<Boolean> values, int timeoutSeconds, int threads) {
            this.mode = mode;
            this.formulaText = formulaText;
            this.synthesisForm = synthesisForm;
            this.variables = variables;
            this.values = values;
            this.timeoutSeconds = timeoutSeconds;
            this.threads = threads;
        }
    }

    /**
     * Parser per parametri linea di comando con messaggi di errore informativi.
     */
    static final class ArgumentParser {

        /**
         * @param args parametri da linea di comando
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se parametri non validi
         */
        CliConfiguration parse(String[] args) {
            Mode mode = null;
            String formulaText = null;
            String synthesisForm = null;
            List<String> variables = null;
            List<Boolean> values = null;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            int threads = DEFAULT_THREADS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case STANDARD_PARAM, INFIX_PARAM, POLISH_PARAM -> {
                        validateExclusiveMode(mode);
                        mode = switch (args[i]) {
                            case STANDARD_PARAM -> Mode.STANDARD;
                            case INFIX_PARAM -> Mode.INFIX;
                            default -> Mode.POLISH;
                        };
                        formulaText = getNextArgument(args, ++i, "formula");
                    }
                    case TIMEOUT_PARAM -> timeoutSeconds = parseBoundedInt(
                            getNextArgument(args, ++i, "numero secondi"), MIN_TIMEOUT_SECONDS, Integer.MAX_VALUE, "timeout");
                    case THREADS_PARAM -> threads = parseBoundedInt(
                            getNextArgument(args, ++i, "numero thread"), 1, MAX_THREADS, "thread");
                    default -> {
                        if (args[i].startsWith(SYNTH_PARAM)) {
                            validateExclusiveMode(mode);
                            mode = Mode.SYNTHESIS;
                            synthesisForm = args[i].substring(SYNTH_PARAM.length());
                            if (!SYNTH_DNF.equals(synthesisForm) && !SYNTH_CNF.equals(synthesisForm)) {
                                throw new IllegalArgumentException("Forma di sintesi non supportata: " + synthesisForm +
                                        ". Supportate: " + SYNTH_DNF + ", " + SYNTH_CNF);
                            }
                            variables = parseVariables(getNextArgument(args, ++i, "lista variabili"));
                            values = parseValues(getNextArgument(args, ++i, "valori di verità"));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (mode == null) {
                throw new IllegalArgumentException("Specificare una formula con -f, -i, -p oppure una sintesi con -synth=");
            }
            if (mode == Mode.SYNTHESIS && values.size() != ModelEnumerator.modelCount(variables.size())) {
                throw new IllegalArgumentException("Attesi " + ModelEnumerator.modelCount(variables.size()) +
                        " valori per " + variables.size() + " variabili, ricevuti " + values.size());
            }

            return new CliConfiguration(mode, formulaText, synthesisForm, variables, values, timeoutSeconds, threads);
        }

        private void validateExclusiveMode(Mode current) {
            if (current != null) {
                throw new IllegalArgumentException("Le modalità -f, -i, -p e -synth= sono mutualmente esclusive");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseBoundedInt(String text, int min, int max, String name) {
            try {
                int value = Integer.parseInt(text);
                if (value < min || value > max) {
                    throw new IllegalArgumentException("Valore " + name + " fuori intervallo [" + min + ", " + max + "]: " + value);
                }
                return value;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore " + name + " non valido: " + text);
            }
        }

        /**
         * "p,q,r1" -&gt; [p, q, r1]
         */
        private List<String> parseVariables(String text) {
            List<String> variables = new ArrayList<>(Arrays.asList(text.split(",")));
            if (variables.isEmpty() || variables.contains("")) {
                throw new IllegalArgumentException("Lista variabili non valida: " + text);
            }
            // Validazione nomi e duplicati delegata all'enumeratore
            ModelEnumerator.modelAt(variables, 0);
            return variables;
        }

        /**
         * "TTFT" -&gt; [vero, vero, falso, vero]
         */
        private List<Boolean> parseValues(String text) {
            List<Boolean> values = new ArrayList<>();
            for (char c : text.toCharArray()) {
                switch (c) {
                    case 'T' -> values.add(true);
                    case 'F' -> values.add(false);
                    default -> throw new IllegalArgumentException("Valore di verità non valido '" + c + "' (usare T o F)");
                }
            }
            return values;
        }
    }

    //endregion
}
