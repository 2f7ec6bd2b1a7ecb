package com.cpusimulator.report;

import com.cpusimulator.simulator.ProcessMetrics;
import com.cpusimulator.simulator.ScheduleResult;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CsvReportWriter
 *
 * Escribe una fila por proceso y algoritmo:
 * algorithm,pid,arrival,burst,start,end,response,waiting,turnaround
 */
public final class CsvReportWriter {
    public static final String HEADER = "algorithm,pid,arrival,burst,start,end,response,waiting,turnaround";

    private CsvReportWriter() {
    }

    /**
     * Escribe el CSV en un fichero (se sobrescribe si existe).
     *
     * @param results  resultados a exportar
     * @param filename ruta de destino
     * @throws IOException si falla la escritura
     */
    public static void writeToFile(List<ScheduleResult> results, String filename) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(Path.of(filename), StandardCharsets.UTF_8)) {
            write(results, writer);
        }
    }

    /**
     * Escribe el CSV en un writer. No lo cierra.
     *
     * @param results resultados a exportar
     * @param writer  destino
     * @throws IOException si falla la escritura
     */
    public static void write(List<ScheduleResult> results, Writer writer) throws IOException {
        writer.write(HEADER);
        writer.write('\n');
        for (ScheduleResult result : results) {
            for (ProcessMetrics p : result.getMetrics().getCompletedProcesses()) {
                writer.write(String.join(",",
                        result.getAlgorithmName(),
                        String.valueOf(p.getPid()),
                        String.valueOf(p.getArrivalTime()),
                        String.valueOf(p.getBurstTime()),
                        String.valueOf(p.getStartTime()),
                        String.valueOf(p.getEndTime()),
                        String.valueOf(p.getResponseTime()),
                        String.valueOf(p.getWaitingTime()),
                        String.valueOf(p.getTurnaroundTime())));
                writer.write('\n');
            }
        }
        writer.flush();
    }
}
