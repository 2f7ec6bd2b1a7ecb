package com.cpusimulator;

import com.cpusimulator.report.CsvReportWriter;
import com.cpusimulator.report.MetricsPrinter;
import com.cpusimulator.scheduling.SchedulingAlgorithm;
import com.cpusimulator.simulator.EventLogger;
import com.cpusimulator.simulator.ScheduleResult;
import com.cpusimulator.simulator.SchedulingSimulator;
import com.cpusimulator.util.ConfigParser;
import com.cpusimulator.util.ErrorKind;
import com.cpusimulator.util.InvalidInputException;
import com.cpusimulator.util.ProcessInput;
import com.cpusimulator.util.SimulationConfig;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Main
 *
 * Punto de entrada de consola: lee los procesos (fichero o stdin), simula
 * FCFS, SJF, SRTF y Round Robin, imprime los informes y opcionalmente exporta
 * el CSV.
 *
 * Códigos de salida: 0 correcto, 1 error de entrada/E/S, 2 uso incorrecto.
 */
public final class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private Main() {
    }

    public static void main(String[] args) {
        Reader stdin = new InputStreamReader(System.in, StandardCharsets.UTF_8);
        System.exit(run(args, stdin, System.out, System.err));
    }

    /**
     * Ejecuta el simulador con los streams indicados.
     *
     * @param args argumentos de línea de comandos
     * @param in   entrada para el modo interactivo
     * @param out  salida de informes
     * @param err  salida de errores y del log en modo verbose
     * @return código de salida
     */
    static int run(String[] args, Reader in, PrintStream out, PrintStream err) {
        SimulationConfig config;
        try {
            config = SimulationConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            err.println(SimulationConfig.USAGE);
            return EXIT_USAGE;
        }
        if (config.isHelp()) {
            out.println(SimulationConfig.USAGE);
            return EXIT_OK;
        }

        EventLogger eventLogger = new EventLogger();
        if (config.isVerbose()) {
            eventLogger.addListener(err::println);
        }

        try {
            ProcessInput input = config.getInputFile() != null
                    ? ConfigParser.parseProcessesFromFile(config.getInputFile())
                    : ConfigParser.parseInteractive(in, out);
            int quantum = resolveQuantum(config, input);

            SchedulingSimulator simulator = new SchedulingSimulator(input.getProcesses(), quantum,
                    eventLogger, config.isParallel());
            List<ScheduleResult> results = simulator.runAll();

            out.println();
            List<SchedulingAlgorithm> algorithms = simulator.getAlgorithms();
            for (int i = 0; i < results.size(); i++) {
                MetricsPrinter.print(algorithms.get(i).getName(), results.get(i), out, config.isTrace());
            }
            MetricsPrinter.printSummary(results, out);

            if (config.getCsvFile() != null) {
                CsvReportWriter.writeToFile(results, config.getCsvFile());
                out.println();
                out.println("CSV written to " + config.getCsvFile());
            }
            return EXIT_OK;
        } catch (InvalidInputException e) {
            err.println("ERROR: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            err.println("ERROR: " + e.getMessage());
            return EXIT_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("ERROR: simulation interrupted");
            return EXIT_ERROR;
        }
    }

    private static int resolveQuantum(SimulationConfig config, ProcessInput input) {
        if (config.getQuantum() != null) {
            return config.getQuantum();
        }
        if (input.getQuantum().isPresent()) {
            return input.getQuantum().getAsInt();
        }
        throw new InvalidInputException(ErrorKind.INVALID_QUANTUM,
                "no quantum given (use --quantum or a QUANTUM line)");
    }
}
