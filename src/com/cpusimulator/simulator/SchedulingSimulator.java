package com.cpusimulator.simulator;

import com.cpusimulator.process.Proceso;
import com.cpusimulator.process.ProcessTable;
import com.cpusimulator.scheduling.FCFS;
import com.cpusimulator.scheduling.RoundRobin;
import com.cpusimulator.scheduling.SJF;
import com.cpusimulator.scheduling.SRTF;
import com.cpusimulator.scheduling.SchedulingAlgorithm;
import com.cpusimulator.util.InputValidator;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SchedulingSimulator
 *
 * Coordina la simulación de las cuatro disciplinas sobre la misma tabla:
 * - valida la entrada antes de ejecutar nada (un error aborta todo);
 * - ejecuta FCFS, SJF, SRTF y RR, cada uno con su propio estado;
 * - devuelve los resultados en ese orden.
 *
 * La tabla es de solo lectura, así que las ejecuciones pueden lanzarse en
 * paralelo sin cambiar el resultado.
 */
public class SchedulingSimulator {
    private final ProcessTable table;
    private final List<SchedulingAlgorithm> algorithms;
    private final EventLogger eventLogger;
    private final boolean parallel;

    /**
     * Construye el simulador con las cuatro disciplinas estándar.
     *
     * @param processes   procesos de entrada (se copian)
     * @param quantum     quantum de Round Robin
     * @param eventLogger registro de eventos
     * @param parallel    si las ejecuciones se lanzan en paralelo
     * @throws com.cpusimulator.util.InvalidInputException si la entrada no es válida
     */
    public SchedulingSimulator(List<Proceso> processes, int quantum, EventLogger eventLogger, boolean parallel) {
        InputValidator.validate(processes, quantum);
        this.table = new ProcessTable(processes);
        this.algorithms = List.of(new FCFS(), new SJF(), new SRTF(), new RoundRobin(quantum));
        this.eventLogger = eventLogger;
        this.parallel = parallel;
    }

    /**
     * Construye el simulador con una lista arbitraria de algoritmos.
     *
     * @param processes   procesos de entrada (se copian)
     * @param algorithms  algoritmos a ejecutar, en el orden de los resultados
     * @param eventLogger registro de eventos
     * @param parallel    si las ejecuciones se lanzan en paralelo
     */
    public SchedulingSimulator(List<Proceso> processes, List<SchedulingAlgorithm> algorithms,
            EventLogger eventLogger, boolean parallel) {
        InputValidator.validateProcesses(processes);
        this.table = new ProcessTable(processes);
        this.algorithms = List.copyOf(algorithms);
        this.eventLogger = eventLogger;
        this.parallel = parallel;
    }

    /**
     * Ejecuta todos los algoritmos.
     *
     * @return resultados en el orden de los algoritmos
     * @throws InterruptedException si el hilo es interrumpido esperando a las
     *                              ejecuciones paralelas
     */
    public List<ScheduleResult> runAll() throws InterruptedException {
        eventLogger.log("Simulator started: " + table.size() + " processes, "
                + algorithms.size() + " algorithms" + (parallel ? " (parallel)" : ""));
        List<ScheduleResult> results = parallel ? runParallel() : runSequential();
        eventLogger.log("Simulation complete");
        return results;
    }

    private List<ScheduleResult> runSequential() {
        List<ScheduleResult> results = new ArrayList<>();
        for (SchedulingAlgorithm algorithm : algorithms) {
            results.add(run(algorithm));
        }
        return results;
    }

    private List<ScheduleResult> runParallel() throws InterruptedException {
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(algorithms.size(),
                r -> new Thread(r, "SchedulingSimulator-Thread-" + threadCount.incrementAndGet()));
        try {
            List<Future<ScheduleResult>> futures = new ArrayList<>();
            for (SchedulingAlgorithm algorithm : algorithms) {
                futures.add(executor.submit(() -> run(algorithm)));
            }
            List<ScheduleResult> results = new ArrayList<>();
            for (Future<ScheduleResult> future : futures) {
                results.add(await(future));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static ScheduleResult await(Future<ScheduleResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("simulation failed", cause);
        }
    }

    private ScheduleResult run(SchedulingAlgorithm algorithm) {
        eventLogger.log("Running " + algorithm.getName());
        return algorithm.schedule(table, eventLogger);
    }

    public ProcessTable getTable() {
        return table;
    }

    public List<SchedulingAlgorithm> getAlgorithms() {
        return algorithms;
    }
}
