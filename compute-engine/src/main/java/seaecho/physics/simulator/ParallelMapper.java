package seaecho.physics.simulator;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Ejecuta una lista de tareas en un pool y devuelve sus resultados en el orden de entrada.
 * <p>
 * Los resultados se recogen en orden de finalización y se colocan en su posición
 * original. Ante el primer fallo se cancelan las tareas pendientes y se propaga el error
 * original: nunca se devuelve un resultado parcial.
 * <p>
 * No guarda estado entre llamadas, así que varias llamadas concurrentes pueden compartir el pool.
 */
@Slf4j
public class ParallelMapper {

    private final ExecutorService executor;

    public ParallelMapper(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "El pool de hilos no puede ser nulo.");
    }

    /**
     * @param tasks Tareas independientes.
     * @return Resultados alineados por índice con {@code tasks}.
     * @throws SweepExecutionException si alguna tarea falla o el hilo llamante es interrumpido.
     */
    public <R> List<R> map(List<? extends Callable<R>> tasks) {
        final int count = tasks.size();
        CompletionService<IndexedResult<R>> completionService = new ExecutorCompletionService<>(executor);
        List<Future<IndexedResult<R>>> futures = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            final int index = i;
            final Callable<R> task = tasks.get(i);
            futures.add(completionService.submit(() -> new IndexedResult<>(index, task.call())));
        }

        Object[] slots = new Object[count];
        boolean[] filled = new boolean[count];
        try {
            for (int received = 0; received < count; received++) {
                IndexedResult<R> result = completionService.take().get();
                slots[result.index()] = result.value();
                filled[result.index()] = true;
            }
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = (e.getCause() != null) ? e.getCause() : e;
            log.error("Fallo en un trabajador del barrido: {}", cause.toString());
            throw new SweepExecutionException("Barrido abortado por el fallo de un trabajador: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new SweepExecutionException("Barrido interrumpido.", e);
        }

        if (count > 0 && !allFilled(filled)) {
            throw new IllegalStateException("Resultados incompletos tras recoger todas las tareas.");
        }

        List<R> ordered = new ArrayList<>(count);
        for (Object slot : slots) {
            @SuppressWarnings("unchecked")
            R value = (R) slot;
            ordered.add(value);
        }
        return ordered;
    }

    private static boolean allFilled(boolean[] filled) {
        for (boolean f : filled) {
            if (!f) {
                return false;
            }
        }
        return true;
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        futures.forEach(future -> future.cancel(true));
    }
}
