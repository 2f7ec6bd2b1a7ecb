package com.cpusimulator.util;

import com.cpusimulator.process.Proceso;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Scanner;

/**
 * ConfigParser
 *
 * Utilidades para leer definiciones de procesos.
 *
 * Formato de fichero, una entrada por línea:
 * PID ARRIVAL BURST
 * QUANTUM q   (opcional)
 *
 * Las líneas vacías y las que empiezan por '#' se ignoran.
 *
 * Formato interactivo: número de procesos, luego una terna PID ARRIVAL BURST
 * por proceso y finalmente el quantum, con prompts en la salida indicada.
 *
 * Los métodos usan try-with-resources para garantizar el cierre de streams.
 * Aquí solo se comprueba el formato; los valores los valida
 * {@link InputValidator}.
 */
public final class ConfigParser {

    private static final String QUANTUM_KEYWORD = "QUANTUM";

    private ConfigParser() {
    }

    /**
     * Parsea una lista de procesos desde un fichero.
     *
     * @param filename ruta del fichero a leer
     * @return procesos y quantum opcional
     * @throws IOException si ocurre un error de I/O o de formato
     */
    public static ProcessInput parseProcessesFromFile(String filename) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(Path.of(filename))) {
            return parse(reader);
        }
    }

    /**
     * Parsea el formato de fichero desde un reader. No cierra el reader.
     *
     * @param source texto con una entrada por línea
     * @return procesos y quantum opcional
     * @throws IOException si ocurre un error de I/O o de formato
     */
    public static ProcessInput parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
                ? (BufferedReader) source
                : new BufferedReader(source);
        List<Proceso> processes = new ArrayList<>();
        Integer quantum = null;

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] parts = line.split("\\s+");
            if (parts[0].equalsIgnoreCase(QUANTUM_KEYWORD)) {
                if (parts.length != 2) {
                    throw new ParseException("line " + lineNumber + ": expected 'QUANTUM <q>' but got '" + line + "'");
                }
                if (quantum != null) {
                    throw new ParseException("line " + lineNumber + ": quantum defined more than once");
                }
                quantum = parseInt(parts[1], "quantum", lineNumber);
                continue;
            }
            processes.add(parseProcessLine(parts, line, lineNumber));
        }
        return new ProcessInput(processes, quantum);
    }

    /**
     * Lee la definición en modo interactivo, como la versión de consola: número
     * de procesos, ternas y quantum.
     *
     * @param source  entrada (normalmente stdin)
     * @param prompts salida para los prompts (puede ser null)
     * @return procesos y quantum
     * @throws ParseException si falta un valor o no es un entero
     */
    public static ProcessInput parseInteractive(Reader source, PrintStream prompts) throws ParseException {
        Scanner scanner = new Scanner(source);
        prompt(prompts, "Number of Processes: ");
        int n = readInt(scanner, "number of processes");
        if (n <= 0) {
            throw new InvalidInputException(ErrorKind.INVALID_PROCESS_COUNT, "n=" + n);
        }

        prompt(prompts, "Enter details for each process on its own line: PID Arrival Burst\n");
        List<Proceso> processes = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            int pid = readInt(scanner, "PID");
            int arrival = readInt(scanner, "Arrival");
            int burst = readInt(scanner, "Burst");
            processes.add(new Proceso(pid, arrival, burst));
        }

        prompt(prompts, "Enter Time Quantum: ");
        int quantum = readInt(scanner, "Quantum");
        return new ProcessInput(processes, quantum);
    }

    /**
     * Parsea una línea que describe un proceso.
     *
     * @param parts      tokens de la línea
     * @param line       línea original (para mensajes)
     * @param lineNumber número de línea (1-based)
     * @return Proceso creado
     * @throws ParseException si la línea no tiene tres enteros
     */
    private static Proceso parseProcessLine(String[] parts, String line, int lineNumber) throws ParseException {
        if (parts.length != 3) {
            throw new ParseException("line " + lineNumber + ": expected 'PID ARRIVAL BURST' but got '" + line + "'");
        }
        int pid = parseInt(parts[0], "PID", lineNumber);
        int arrival = parseInt(parts[1], "arrival", lineNumber);
        int burst = parseInt(parts[2], "burst", lineNumber);
        return new Proceso(pid, arrival, burst);
    }

    private static int parseInt(String token, String label, int lineNumber) throws ParseException {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new ParseException("line " + lineNumber + ": invalid " + label + " '" + token + "'", e);
        }
    }

    private static int readInt(Scanner scanner, String label) throws ParseException {
        try {
            return scanner.nextInt();
        } catch (NoSuchElementException e) {
            // InputMismatchException es subclase
            throw new ParseException("Failed to read " + label + ".", e);
        }
    }

    private static void prompt(PrintStream prompts, String text) {
        if (prompts != null) {
            prompts.print(text);
            prompts.flush();
        }
    }
}
