package com.cpusimulator.report;

import com.cpusimulator.simulator.Segment;
import java.util.List;

/**
 * GanttPrinter
 *
 * Representación en texto de una línea de tiempo: una barra con un bloque por
 * segmento y, debajo, los instantes de cada frontera.
 *
 * <pre>
 * | IDLE | P1 |
 * 0      5    8
 * </pre>
 */
public final class GanttPrinter {

    private GanttPrinter() {
    }

    /**
     * Dibuja el diagrama de Gantt de los segmentos.
     *
     * @param segments línea de tiempo coalescida
     * @return dos líneas (barra y tiempos) separadas por '\n'
     */
    public static String render(List<Segment> segments) {
        if (segments.isEmpty()) {
            return "(empty timeline)";
        }
        StringBuilder bar = new StringBuilder("|");
        StringBuilder times = new StringBuilder(String.valueOf(segments.get(0).getStart()));

        for (Segment s : segments) {
            String label = s.getLabel();
            String end = String.valueOf(s.getEnd());
            int width = Math.max(label.length() + 2, end.length() + 1);
            bar.append(center(label, width)).append('|');

            int boundary = bar.length() - 1;
            while (times.length() < boundary) {
                times.append(' ');
            }
            times.append(end);
        }
        return bar + "\n" + times;
    }

    /**
     * Traza por tick: qué propietario tiene la CPU en cada instante.
     *
     * @param segments línea de tiempo coalescida
     * @return una línea por tick, "t=&lt;n&gt; -&gt; &lt;label&gt;"
     */
    public static String renderTrace(List<Segment> segments) {
        StringBuilder sb = new StringBuilder();
        for (Segment s : segments) {
            for (int t = s.getStart(); t < s.getEnd(); t++) {
                sb.append("t=").append(t).append(" -> ").append(s.getLabel()).append('\n');
            }
        }
        return sb.toString();
    }

    private static String center(String text, int width) {
        int padding = width - text.length();
        int left = padding / 2;
        int right = padding - left;
        return " ".repeat(left) + text + " ".repeat(right);
    }
}
