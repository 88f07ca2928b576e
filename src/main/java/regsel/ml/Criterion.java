package regsel.ml;

import java.util.Comparator;

/**
 * Model-selection criteria. Ordering is best first; ties go to the smaller subset and then to
 * the lexicographically smaller list of column indices.
 */
public enum Criterion {

    /** n·ln(RSS/n) + 2p, smaller is better. */
    AIC {
        @Override
        public double value(CriterionScore s) {
            return s.getAic();
        }
    },
    /** n·ln(RSS/n) + ln(n)·p, smaller is better. */
    BIC {
        @Override
        public double value(CriterionScore s) {
            return s.getBic();
        }
    },
    /** 1 − (RSS/(n−p)) / (TSS/(n−1)), larger is better. */
    ADJUSTED_R2 {
        @Override
        public double value(CriterionScore s) {
            return s.getAdjustedRSquared();
        }

        @Override
        public boolean largerIsBetter() {
            return true;
        }
    },
    /** RSS/σ̂²_full + 2p − n, smaller is better. */
    CP {
        @Override
        public double value(CriterionScore s) {
            return s.getCp();
        }
    };

    public abstract double value(CriterionScore s);

    public boolean largerIsBetter() {
        return false;
    }

    /** Best first, with the deterministic tie-break. NaN scores sort last. */
    public Comparator<CriterionScore> comparator() {
        Comparator<CriterionScore> byValue = (a, b) -> {
            double va = value(a);
            double vb = value(b);
            if (Double.isNaN(va) || Double.isNaN(vb)) {
                return Boolean.compare(Double.isNaN(va), Double.isNaN(vb));
            }
            return largerIsBetter() ? Double.compare(vb, va) : Double.compare(va, vb);
        };
        return byValue
            .thenComparingInt(CriterionScore::size)
            .thenComparing(CriterionScore::compareLexically);
    }

    public static Criterion parse(String name) {
        String key = name.trim().toUpperCase().replace('-', '_');
        if (key.equals("ADJR2") || key.equals("ADJ_R2")) return ADJUSTED_R2;
        return valueOf(key);
    }
}
