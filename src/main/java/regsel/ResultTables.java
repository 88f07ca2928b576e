package regsel;

import regsel.ml.CoefficientRow;
import regsel.ml.CriterionScore;
import regsel.ml.EmpiricalDistribution;
import regsel.ml.TransformCandidate;
import regsel.ml.TransformResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row-oriented views of analysis results. Numbers are passed through untouched so consumers can
 * recompute derived quantities from them; {@link #render} prints each double with
 * {@link Double#toString(double)}, which round-trips exactly.
 */
public final class ResultTables {

    /** Quantiles reported for resampling distributions. */
    public static final double[] QUANTILES = {0.005, 0.025, 0.05, 0.25, 0.5, 0.75, 0.95, 0.975, 0.995};

    private ResultTables() {
    }

    public static List<Map<String, Object>> coefficients(List<CoefficientRow> rows) {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (CoefficientRow r : rows) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("term", r.getTerm());
            m.put("estimate", r.getEstimate());
            m.put("stdError", r.getStandardError());
            m.put("t", r.getTStatistic());
            m.put("p", r.getPValue());
            m.put("lower", r.getLower());
            m.put("upper", r.getUpper());
            out.add(m);
        }
        return out;
    }

    public static List<Map<String, Object>> subsets(List<CriterionScore> scores) {
        List<Map<String, Object>> out = new ArrayList<>(scores.size());
        for (CriterionScore s : scores) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("size", s.size());
            m.put("terms", String.join("+", s.getNames()));
            m.put("parameters", s.getParameters());
            m.put("rss", s.getRss());
            m.put("aic", s.getAic());
            m.put("bic", s.getBic());
            m.put("adjR2", s.getAdjustedRSquared());
            m.put("cp", s.getCp());
            out.add(m);
        }
        return out;
    }

    public static List<Map<String, Object>> quantiles(EmpiricalDistribution distribution) {
        List<Map<String, Object>> out = new ArrayList<>(QUANTILES.length);
        for (double q : QUANTILES) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("quantile", q);
            m.put("value", distribution.quantile(q));
            out.add(m);
        }
        return out;
    }

    public static List<Map<String, Object>> profile(TransformResult result) {
        List<Map<String, Object>> out = new ArrayList<>(result.getProfile().size());
        for (TransformCandidate c : result.getProfile()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("parameter", c.getParameter());
            m.put("logLik", c.getLogLikelihood());
            m.put("inInterval", result.contains(c.getParameter()));
            out.add(m);
        }
        return out;
    }

    /** Fixed-width text table with a header row. */
    public static String render(List<Map<String, Object>> rows) {
        if (rows.isEmpty()) return "(no rows)\n";
        List<String> keys = new ArrayList<>(rows.get(0).keySet());
        int[] width = new int[keys.size()];
        List<String[]> cells = new ArrayList<>(rows.size());
        for (int j = 0; j < keys.size(); j++) width[j] = keys.get(j).length();
        for (Map<String, Object> row : rows) {
            String[] line = new String[keys.size()];
            for (int j = 0; j < keys.size(); j++) {
                line[j] = String.valueOf(row.get(keys.get(j)));
                width[j] = Math.max(width[j], line[j].length());
            }
            cells.add(line);
        }
        StringBuilder sb = new StringBuilder();
        appendLine(sb, keys.toArray(new String[0]), width);
        for (String[] line : cells) appendLine(sb, line, width);
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, String[] values, int[] width) {
        for (int j = 0; j < values.length; j++) {
            if (j > 0) sb.append("  ");
            sb.append(String.format("%-" + width[j] + "s", values[j]));
        }
        sb.append('\n');
    }
}
