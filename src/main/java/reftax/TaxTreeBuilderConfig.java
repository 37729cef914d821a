package reftax;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Filtering and diagnostics settings of a {@link TaxTreeBuilder} run.
 */
public class TaxTreeBuilderConfig {

	public static final int UNLIMITED = Integer.MAX_VALUE;
	public static final int DEFAULT_PROGRESS_INTERVAL = 1000;

	private int minRank = 0;
	private int maxSeqsPerLeaf = UNLIMITED;
	private final LinkedHashSet<Clade> cladesToInclude = new LinkedHashSet<Clade>();
	private final LinkedHashSet<Clade> cladesToIgnore = new LinkedHashSet<Clade>();
	private boolean verbose = false;
	private boolean debug = false;
	private int progressInterval = DEFAULT_PROGRESS_INTERVAL;

	/**
	 * @return the lineage position that must be assigned for a sequence to be included
	 */
	public int getMinRank() {
		return minRank;
	}

	public TaxTreeBuilderConfig setMinRank(int minRank) {
		if (minRank < 0) {
			throw new IllegalArgumentException("minRank must not be negative: " + minRank);
		}
		this.minRank = minRank;
		return this;
	}

	/**
	 * @return how many sequences are kept per species-level clade
	 */
	public int getMaxSeqsPerLeaf() {
		return maxSeqsPerLeaf;
	}

	public TaxTreeBuilderConfig setMaxSeqsPerLeaf(int maxSeqsPerLeaf) {
		if (maxSeqsPerLeaf < 1) {
			throw new IllegalArgumentException("maxSeqsPerLeaf must be positive: " + maxSeqsPerLeaf);
		}
		this.maxSeqsPerLeaf = maxSeqsPerLeaf;
		return this;
	}

	public Set<Clade> getCladesToInclude() {
		return Collections.unmodifiableSet(cladesToInclude);
	}

	public TaxTreeBuilderConfig includeClade(int rankLevel, String rankName) {
		cladesToInclude.add(new Clade(rankLevel, rankName));
		return this;
	}

	public Set<Clade> getCladesToIgnore() {
		return Collections.unmodifiableSet(cladesToIgnore);
	}

	public TaxTreeBuilderConfig ignoreClade(int rankLevel, String rankName) {
		cladesToIgnore.add(new Clade(rankLevel, rankName));
		return this;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public TaxTreeBuilderConfig setVerbose(boolean verbose) {
		this.verbose = verbose;
		return this;
	}

	/**
	 * @return true if a snapshot of the tree is reported before unifurcations are collapsed
	 */
	public boolean isDebug() {
		return debug;
	}

	public TaxTreeBuilderConfig setDebug(boolean debug) {
		this.debug = debug;
		return this;
	}

	public int getProgressInterval() {
		return progressInterval;
	}

	public TaxTreeBuilderConfig setProgressInterval(int progressInterval) {
		if (progressInterval < 1) {
			throw new IllegalArgumentException("progressInterval must be positive: " + progressInterval);
		}
		this.progressInterval = progressInterval;
		return this;
	}
}
