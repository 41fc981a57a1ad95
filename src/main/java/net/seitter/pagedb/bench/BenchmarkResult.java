package net.seitter.pagedb.bench;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import net.seitter.pagedb.buffer.BufferStatistics;
import net.seitter.pagedb.buffer.ReplacementPolicy;

import java.util.Locale;

/**
 * One run of the buffer policy benchmark: its parameters and the resulting counters.
 */
@JsonPropertyOrder({"policy", "pool", "ops", "pages", "write_frac",
        "logical_reads", "logical_writes", "phys_reads", "phys_writes", "page_hits", "page_misses"})
public class BenchmarkResult {
    private final ReplacementPolicy policy;
    private final int pool;
    private final int ops;
    private final int pages;
    private final double writeFraction;
    private final BufferStatistics statistics;

    public BenchmarkResult(ReplacementPolicy policy, int pool, int ops, int pages, double writeFraction,
                           BufferStatistics statistics) {
        this.policy = policy;
        this.pool = pool;
        this.ops = ops;
        this.pages = pages;
        this.writeFraction = writeFraction;
        this.statistics = statistics;
    }

    @JsonProperty("policy")
    public String getPolicy() {
        return policy.name();
    }

    @JsonProperty("pool")
    public int getPool() {
        return pool;
    }

    @JsonProperty("ops")
    public int getOps() {
        return ops;
    }

    @JsonProperty("pages")
    public int getPages() {
        return pages;
    }

    @JsonIgnore
    public double getWriteFraction() {
        return writeFraction;
    }

    /**
     * Gets the write fraction with two decimals, as it appears in result files.
     *
     * @return The formatted write fraction
     */
    @JsonProperty("write_frac")
    public String getWriteFractionText() {
        return String.format(Locale.ROOT, "%.2f", writeFraction);
    }

    @JsonProperty("logical_reads")
    public long getLogicalReads() {
        return statistics.getLogicalReads();
    }

    @JsonProperty("logical_writes")
    public long getLogicalWrites() {
        return statistics.getLogicalWrites();
    }

    @JsonProperty("phys_reads")
    public long getPhysicalReads() {
        return statistics.getPhysicalReads();
    }

    @JsonProperty("phys_writes")
    public long getPhysicalWrites() {
        return statistics.getPhysicalWrites();
    }

    @JsonProperty("page_hits")
    public long getPageHits() {
        return statistics.getPageHits();
    }

    @JsonProperty("page_misses")
    public long getPageMisses() {
        return statistics.getPageMisses();
    }

    @JsonIgnore
    public BufferStatistics getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return "policy=" + getPolicy()
                + ",pool=" + pool
                + ",ops=" + ops
                + ",pages=" + pages
                + ",write_frac=" + getWriteFractionText()
                + ",logical_reads=" + getLogicalReads()
                + ",logical_writes=" + getLogicalWrites()
                + ",phys_reads=" + getPhysicalReads()
                + ",phys_writes=" + getPhysicalWrites()
                + ",page_hits=" + getPageHits()
                + ",page_misses=" + getPageMisses();
    }
}
