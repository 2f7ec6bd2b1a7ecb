package com.cpusimulator.report;

import com.cpusimulator.simulator.ProcessMetrics;
import com.cpusimulator.simulator.ScheduleResult;
import com.cpusimulator.simulator.SystemMetrics;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * MetricsPrinter
 *
 * Informe en texto de cada algoritmo (secuencia de despacho, Gantt, tabla por
 * proceso y medias con dos decimales) y tabla comparativa final.
 */
public final class MetricsPrinter {

    private MetricsPrinter() {
    }

    /**
     * Imprime el informe de un algoritmo.
     *
     * @param title  nombre descriptivo del algoritmo
     * @param result resultado de la ejecución
     * @param out    destino
     * @param trace  si se incluye la traza por tick
     */
    public static void print(String title, ScheduleResult result, PrintStream out, boolean trace) {
        SystemMetrics metrics = result.getMetrics();
        out.println(title + " =>");
        out.println("Dispatch sequence: " + result.getDispatchSequence().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(" ")));
        out.println(GanttPrinter.render(result.getSegments()));
        if (trace) {
            out.print(GanttPrinter.renderTrace(result.getSegments()));
        }
        out.println();

        out.println(String.format(Locale.ROOT, "%6s %8s %6s %6s %6s %9s %8s %11s",
                "PID", "Arrival", "Burst", "Start", "End", "Response", "Waiting", "Turnaround"));
        for (ProcessMetrics p : metrics.getCompletedProcesses()) {
            out.println(String.format(Locale.ROOT, "%6d %8d %6d %6d %6d %9d %8d %11d",
                    p.getPid(), p.getArrivalTime(), p.getBurstTime(), p.getStartTime(), p.getEndTime(),
                    p.getResponseTime(), p.getWaitingTime(), p.getTurnaroundTime()));
        }
        out.println();
        out.println(formatAverages(metrics));
        out.println(String.format(Locale.ROOT, "CPU Utilization      : %.2f%%", metrics.getCPUUtilization()));
        out.println("Context Switches     : " + metrics.getContextSwitches());
        out.println();
    }

    /**
     * Las tres medias con dos decimales, una por línea.
     *
     * @param metrics métricas de la ejecución
     * @return texto de las medias
     */
    public static String formatAverages(SystemMetrics metrics) {
        return String.format(Locale.ROOT,
                "Average Response Time: %.2f%nAverage Waiting Time : %.2f%nAverage Turnaround   : %.2f",
                metrics.getAverageResponseTime(),
                metrics.getAverageWaitingTime(),
                metrics.getAverageTurnaroundTime());
    }

    /**
     * Imprime la tabla comparativa de todos los algoritmos.
     *
     * @param results resultados en orden de ejecución
     * @param out     destino
     */
    public static void printSummary(List<ScheduleResult> results, PrintStream out) {
        out.println("Summary =>");
        out.println(String.format(Locale.ROOT, "%-6s %10s %10s %12s %9s %9s",
                "Algo", "Response", "Waiting", "Turnaround", "CPU %", "Switches"));
        for (ScheduleResult r : results) {
            SystemMetrics m = r.getMetrics();
            out.println(String.format(Locale.ROOT, "%-6s %10.2f %10.2f %12.2f %9.2f %9d",
                    r.getAlgorithmName(),
                    m.getAverageResponseTime(),
                    m.getAverageWaitingTime(),
                    m.getAverageTurnaroundTime(),
                    m.getCPUUtilization(),
                    m.getContextSwitches()));
        }
    }
}
