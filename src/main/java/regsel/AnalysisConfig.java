package regsel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.function.Function;

/**
 * Analysis defaults. Each setting is read from an environment variable, then from a JVM system
 * property of the same name, then falls back to its built-in default.
 *
 * <pre>
 * PORT                   HTTP port of the web app (7000)
 * REGSEL_ALPHA           significance level (0.05)
 * REGSEL_REPLICATES      bootstrap / permutation replicates (1000)
 * REGSEL_SEED            seed of all random draws (20240601)
 * REGSEL_MAX_SIZE        largest subset size searched (8)
 * REGSEL_THREADS         worker threads (available processors)
 * REGSEL_RANK_TOLERANCE  relative tolerance of the rank test in the QR (1e-7)
 * </pre>
 */
public final class AnalysisConfig {

    private static final Logger logger = LogManager.getLogger(AnalysisConfig.class);

    private final int port;
    private final double alpha;
    private final int replicates;
    private final long seed;
    private final int maxSize;
    private final int threads;
    private final double rankTolerance;

    public AnalysisConfig(int port, double alpha, int replicates, long seed, int maxSize, int threads,
                          double rankTolerance) {
        if (!(alpha > 0 && alpha < 1)) throw new IllegalArgumentException("alpha must be in (0, 1): " + alpha);
        if (replicates < 1) throw new IllegalArgumentException("replicates must be >= 1: " + replicates);
        if (maxSize < 1) throw new IllegalArgumentException("maxSize must be >= 1: " + maxSize);
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1: " + threads);
        this.port = port;
        this.alpha = alpha;
        this.replicates = replicates;
        this.seed = seed;
        this.maxSize = maxSize;
        this.threads = threads;
        this.rankTolerance = rankTolerance;
    }

    public static AnalysisConfig defaults() {
        return new AnalysisConfig(7000, 0.05, 1000, 20240601L, 8,
            Runtime.getRuntime().availableProcessors(), 1e-7);
    }

    public static AnalysisConfig fromEnvironment() {
        AnalysisConfig d = defaults();
        return new AnalysisConfig(
            setting("PORT", Integer::parseInt, d.port),
            setting("REGSEL_ALPHA", Double::parseDouble, d.alpha),
            setting("REGSEL_REPLICATES", Integer::parseInt, d.replicates),
            setting("REGSEL_SEED", Long::parseLong, d.seed),
            setting("REGSEL_MAX_SIZE", Integer::parseInt, d.maxSize),
            setting("REGSEL_THREADS", Integer::parseInt, d.threads),
            setting("REGSEL_RANK_TOLERANCE", Double::parseDouble, d.rankTolerance));
    }

    private static <T> T setting(String name, Function<String, T> parser, T def) {
        String raw = System.getenv(name);
        if (raw == null || raw.isBlank()) raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) return def;
        try {
            return parser.apply(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}='{}' ({}); using {}", name, raw, e.getMessage(), def);
            return def;
        }
    }

    public int getPort() { return port; }
    public double getAlpha() { return alpha; }
    public int getReplicates() { return replicates; }
    public long getSeed() { return seed; }
    public int getMaxSize() { return maxSize; }
    public int getThreads() { return threads; }
    public double getRankTolerance() { return rankTolerance; }

    @Override
    public String toString() {
        return "AnalysisConfig{port=" + port + ", alpha=" + alpha + ", replicates=" + replicates + ", seed=" + seed
            + ", maxSize=" + maxSize + ", threads=" + threads + ", rankTolerance=" + rankTolerance + "}";
    }
}
