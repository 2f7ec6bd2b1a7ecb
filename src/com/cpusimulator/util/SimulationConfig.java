package com.cpusimulator.util;

/**
 * SimulationConfig
 *
 * Configuración inmutable de una ejecución, construida a partir de los
 * argumentos de línea de comandos.
 *
 * Opciones:
 * --file &lt;path&gt;     fichero de procesos (si falta, entrada interactiva)
 * --quantum &lt;q&gt;     quantum de Round Robin (prevalece sobre QUANTUM del fichero)
 * --csv &lt;path&gt;      fichero CSV de salida
 * --trace            traza por tick tras cada diagrama
 * --verbose          eco del log de eventos en stderr
 * --parallel         ejecuta los cuatro algoritmos en paralelo
 * --help             muestra el uso
 */
public final class SimulationConfig {
    public static final String USAGE = String.join("\n",
            "Usage: cpu-scheduler [--file <path>] [--quantum <q>] [--csv <path>]",
            "                     [--trace] [--verbose] [--parallel] [--help]",
            "  --file <path>   process definitions (PID ARRIVAL BURST per line, optional 'QUANTUM q')",
            "                  read interactively from stdin when omitted",
            "  --quantum <q>   Round Robin time quantum, overrides the file's QUANTUM line",
            "  --csv <path>    write per-process results as CSV",
            "  --trace         print a per-tick trace after each Gantt chart",
            "  --verbose       echo simulation events to stderr",
            "  --parallel      run the four algorithms concurrently",
            "  --help          show this message");

    private final String inputFile;
    private final Integer quantum;
    private final String csvFile;
    private final boolean trace;
    private final boolean verbose;
    private final boolean parallel;
    private final boolean help;

    private SimulationConfig(Builder builder) {
        this.inputFile = builder.inputFile;
        this.quantum = builder.quantum;
        this.csvFile = builder.csvFile;
        this.trace = builder.trace;
        this.verbose = builder.verbose;
        this.parallel = builder.parallel;
        this.help = builder.help;
    }

    /**
     * Construye la configuración a partir de los argumentos.
     *
     * @param args argumentos de línea de comandos
     * @return configuración
     * @throws IllegalArgumentException si hay opciones desconocidas o sin valor
     */
    public static SimulationConfig fromArgs(String[] args) {
        Builder builder = new Builder();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--file":
                    builder.inputFile(requireValue(args, ++i, arg));
                    break;
                case "--quantum":
                    String value = requireValue(args, ++i, arg);
                    try {
                        builder.quantum(Integer.parseInt(value));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("--quantum expects an integer but got '" + value + "'", e);
                    }
                    break;
                case "--csv":
                    builder.csvFile(requireValue(args, ++i, arg));
                    break;
                case "--trace":
                    builder.trace(true);
                    break;
                case "--verbose":
                    builder.verbose(true);
                    break;
                case "--parallel":
                    builder.parallel(true);
                    break;
                case "--help":
                case "-h":
                    builder.help(true);
                    break;
                default:
                    throw new IllegalArgumentException("unknown option '" + arg + "'");
            }
        }
        return builder.build();
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    /**
     * Fichero de procesos.
     *
     * @return ruta o {@code null} para entrada interactiva
     */
    public String getInputFile() {
        return inputFile;
    }

    /**
     * Quantum indicado en la línea de comandos.
     *
     * @return quantum o {@code null} si no se indicó
     */
    public Integer getQuantum() {
        return quantum;
    }

    public String getCsvFile() {
        return csvFile;
    }

    public boolean isTrace() {
        return trace;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isParallel() {
        return parallel;
    }

    public boolean isHelp() {
        return help;
    }

    /**
     * Builder de {@link SimulationConfig}.
     */
    public static final class Builder {
        private String inputFile;
        private Integer quantum;
        private String csvFile;
        private boolean trace;
        private boolean verbose;
        private boolean parallel;
        private boolean help;

        public Builder inputFile(String inputFile) {
            this.inputFile = inputFile;
            return this;
        }

        public Builder quantum(Integer quantum) {
            this.quantum = quantum;
            return this;
        }

        public Builder csvFile(String csvFile) {
            this.csvFile = csvFile;
            return this;
        }

        public Builder trace(boolean trace) {
            this.trace = trace;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder help(boolean help) {
            this.help = help;
            return this;
        }

        public SimulationConfig build() {
            return new SimulationConfig(this);
        }
    }
}
