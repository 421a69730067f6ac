package rowset.engine.cli;

import java.io.PrintStream;
import java.util.List;

import rowset.engine.exec.Row;
import rowset.engine.exec.RowSet;

/**
 * Simple ASCII table rendering of a RowSet, headers from its schema.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(RowSet rows) {
        print(rows, Integer.MAX_VALUE, System.out);
    }

    public static void print(RowSet rows, int maxRows, PrintStream out) {
        out.println(render(rows, maxRows));
    }

    public static String render(RowSet rows) {
        return render(rows, Integer.MAX_VALUE);
    }

    /** At most maxRows data rows are shown; the footer still reports the full count. */
    public static String render(RowSet rows, int maxRows) {
        if (maxRows < 0) throw new IllegalArgumentException("maxRows must not be negative: " + maxRows);
        List<String> headers = rows.columns();
        int shown = Math.min(rows.size(), maxRows);
        int[] widths = new int[headers.size()];
        for (int i = 0; i < widths.length; i++) widths[i] = headers.get(i).length();
        for (int r = 0; r < shown; r++) {
            Row row = rows.row(r);
            for (int i = 0; i < widths.length; i++) widths[i] = Math.max(widths[i], row.get(i).length());
        }
        StringBuilder sb = new StringBuilder();
        String divLine = buildDivider(widths);
        sb.append(divLine).append('\n');
        sb.append(buildLine(headers, widths)).append('\n');
        sb.append(divLine).append('\n');
        for (int r = 0; r < shown; r++) sb.append(buildLine(rows.row(r).values(), widths)).append('\n');
        if (shown > 0) sb.append(divLine).append('\n');
        if (shown < rows.size()) sb.append("... ").append(rows.size() - shown).append(" more row(s)\n");
        sb.append('(').append(rows.size()).append(" row(s))");
        return sb.toString();
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            divider.append("-".repeat(w + 2));
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildLine(List<String> cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            sb.append(' ').append(pad(cells.get(i), widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        return s + " ".repeat(width - s.length());
    }
}
