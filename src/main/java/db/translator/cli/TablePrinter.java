package db.translator.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import db.translator.exec.BackendOutcome;
import db.translator.exec.ComparisonReport;

/**
 * Simple ASCII table printer for comparison reports and result documents.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void printReport(ComparisonReport report, PrintStream out) {
        List<String> headers = List.of("backend", "status", "rows", "time_ms", "error");
        List<List<String>> rows = new ArrayList<>();
        rows.add(describe(report.relational()));
        rows.add(describe(report.document()));
        print(headers, rows, out);
        out.printf(Locale.ROOT, "total %.3f ms, row counts %s%n", report.totalNanos() / 1_000_000.0,
            report.rowCountsMatch() ? "match" : (report.bothSucceeded() ? "DIFFER" : "n/a"));
    }

    /**
     * Documents rendered under the union of their keys, first-seen order.
     */
    public static void printDocuments(List<Map<String, Object>> docs, PrintStream out) {
        if (docs == null || docs.isEmpty()) {
            out.println("(0 row(s))");
            return;
        }
        List<String> headers = new ArrayList<>();
        for (Map<String, Object> d : docs) {
            for (String k : d.keySet()) if (!headers.contains(k)) headers.add(k);
        }
        List<List<String>> rows = new ArrayList<>();
        for (Map<String, Object> d : docs) {
            List<String> r = new ArrayList<>(headers.size());
            for (String h : headers) r.add(d.containsKey(h) ? String.valueOf(d.get(h)) : "");
            rows.add(r);
        }
        print(headers, rows, out);
        out.println("(" + docs.size() + " row(s))");
    }

    private static List<String> describe(BackendOutcome o) {
        return List.of(
            o.backend(),
            o.status().name(),
            o.isOk() ? String.valueOf(o.rowCount()) : "-",
            String.format(Locale.ROOT, "%.3f", o.elapsedMillis()),
            o.error() == null ? "" : o.error());
    }

    static void print(List<String> headers, List<List<String>> rows, PrintStream out) {
        int[] widths = new int[headers.size()];
        for (int i = 0; i < widths.length; i++) widths[i] = headers.get(i).length();
        for (List<String> r : rows) {
            for (int i = 0; i < widths.length; i++) widths[i] = Math.max(widths[i], r.get(i).length());
        }
        String divLine = buildDivider(widths);
        out.println(divLine);
        out.println(buildRow(headers, widths));
        out.println(divLine);
        for (List<String> r : rows) out.println(buildRow(r, widths));
        out.println(divLine);
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            for (int k = 0; k < w + 2; k++) divider.append('-');
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildRow(List<String> cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            sb.append(' ').append(pad(cells.get(i), widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        StringBuilder sb = new StringBuilder(width);
        sb.append(s);
        for (int i = s.length(); i < width; i++) sb.append(' ');
        return sb.toString();
    }
}
