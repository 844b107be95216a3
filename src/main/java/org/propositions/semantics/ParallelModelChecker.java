package org.propositions.semantics;

import org.propositions.proofs.InferenceRule;
import org.propositions.syntax.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * VERIFICA ESAUSTIVA PARALLELA - Distribuzione dei modelli su un pool di thread
 *
 * Le valutazioni nei singoli modelli sono indipendenti: l'intervallo di indici
 * [0, 2^n) viene diviso in blocchi contigui, ciascuno valutato da un worker.
 *
 * RIDUZIONE:
 * • Tautologia / correttezza: AND su tutti i blocchi, interruzione al primo falso
 * • Valori di verità: concatenazione dei blocchi nell'ordine dei modelli
 *
 * I risultati coincidono con quelli di {@link SemanticAnalyzer} e {@link InferenceChecker}.
 */
public class ParallelModelChecker implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ParallelModelChecker.class.getName());

    /** Blocchi per thread, per bilanciare il carico tra worker */
    private static final int CHUNKS_PER_THREAD = 4;

    private final int threads;
    private final ExecutorService executor;

    /**
     * @param threads numero di worker (&gt; 0)
     * @throws IllegalArgumentException se threads non positivo
     */
    public ParallelModelChecker(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Numero di thread deve essere positivo: " + threads);
        }
        this.threads = threads;

        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, task -> {
            Thread thread = new Thread(task, "model-checker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public int getThreads() {
        return threads;
    }

    //region OPERAZIONI PUBBLICHE

    public boolean isTautology(Formula formula) {
        return allModelsSatisfy(new ArrayList<>(formula.variables()),
                model -> Evaluator.evaluateCovered(formula, model));
    }

    public boolean isContradiction(Formula formula) {
        return isTautology(Formula.not(formula));
    }

    public boolean isSatisfiable(Formula formula) {
        return !isContradiction(formula);
    }

    public boolean isSoundInference(InferenceRule rule) {
        return allModelsSatisfy(new ArrayList<>(rule.variables()),
                model -> InferenceChecker.evaluateInference(rule, model));
    }

    /**
     * Valori di verità della formula in tutti i modelli sulle variabili date,
     * nell'ordine di {@link ModelEnumerator#allModels}.
     *
     * @param formula formula da valutare
     * @param variables variabili ordinate che coprono la formula
     */
    public List<Boolean> truthValues(Formula formula, List<String> variables) {
        List<String> ordered = ModelEnumerator.validateVariables(variables);
        if (!ordered.containsAll(formula.variables())) {
            throw new IllegalArgumentException("Le variabili " + ordered + " non coprono la formula " + formula);
        }

        List<Future<List<Boolean>>> futures = new ArrayList<>();
        for (long[] range : partition(ModelEnumerator.modelCount(ordered.size()))) {
            Callable<List<Boolean>> task = () -> {
                List<Boolean> chunk = new ArrayList<>();
                for (long index = range[0]; index < range[1]; index++) {
                    ModelEnumerator.checkForInterruption();
                    chunk.add(Evaluator.evaluateCovered(formula, ModelEnumerator.buildModel(ordered, index)));
                }
                return chunk;
            };
            futures.add(executor.submit(task));
        }

        List<Boolean> values = new ArrayList<>();
        for (Future<List<Boolean>> future : futures) {
            values.addAll(await(future));
        }
        return values;
    }

    //endregion

    //region ESECUZIONE E RIDUZIONE

    /**
     * Vero se il predicato vale in ogni modello sulle variabili date.
     */
    private boolean allModelsSatisfy(List<String> variables, Predicate<Model> condition) {
        List<String> ordered = ModelEnumerator.validateVariables(variables);
        AtomicBoolean counterexampleFound = new AtomicBoolean(false);

        List<Future<Boolean>> futures = new ArrayList<>();
        for (long[] range : partition(ModelEnumerator.modelCount(ordered.size()))) {
            Callable<Boolean> task = () -> {
                for (long index = range[0]; index < range[1] && !counterexampleFound.get(); index++) {
                    ModelEnumerator.checkForInterruption();
                    Model model = ModelEnumerator.buildModel(ordered, index);
                    if (!condition.test(model)) {
                        LOGGER.finest("Controesempio trovato: " + model);
                        counterexampleFound.set(true);
                        return false;
                    }
                }
                return true;
            };
            futures.add(executor.submit(task));
        }

        boolean result = true;
        for (Future<Boolean> future : futures) {
            if (!await(future)) {
                result = false;
                break;
            }
        }
        if (!result) {
            futures.forEach(future -> future.cancel(true));
        }
        return result;
    }

    /**
     * Divide [0, count) in blocchi contigui.
     */
    private List<long[]> partition(long count) {
        long chunks = Math.min(count, (long) threads * CHUNKS_PER_THREAD);
        long chunkSize = (count + chunks - 1) / chunks;

        List<long[]> ranges = new ArrayList<>();
        for (long start = 0; start < count; start += chunkSize) {
            ranges.add(new long[]{start, Math.min(count, start + chunkSize)});
        }
        return ranges;
    }

    private <T> T await(Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Verifica parallela interrotta", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IllegalArgumentException) {
                throw (IllegalArgumentException) e.getCause();
            }
            if (e.getCause() instanceof CancellationException) {
                throw (CancellationException) e.getCause();
            }
            LOGGER.log(Level.SEVERE, "Errore in un worker della verifica parallela", e.getCause());
            throw new IllegalStateException("Verifica parallela fallita", e.getCause());
        }
    }

    //endregion

    /**
     * Arresta il pool di worker.
     */
    @Override
    public void close() {
        executor.shutdownNow();
    }
}
