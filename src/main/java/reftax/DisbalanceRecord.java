package reftax;

/**
 * One finding of {@link Taxonomy#checkForDisbalance(boolean)}: a sequence classified deeper than the
 * standard 7-level backbone. `fixedLineage` is null unless the check ran with autofix.
 */
public class DisbalanceRecord {

	private final String seqId;
	private final String origLineage;
	private final String fixedLineage;

	public DisbalanceRecord(String seqId, String origLineage) {
		this(seqId, origLineage, null);
	}

	public DisbalanceRecord(String seqId, String origLineage, String fixedLineage) {
		this.seqId = seqId;
		this.origLineage = origLineage;
		this.fixedLineage = fixedLineage;
	}

	public String getSeqId() {
		return seqId;
	}

	public String getOrigLineage() {
		return origLineage;
	}

	public String getFixedLineage() {
		return fixedLineage;
	}

	public boolean isFixed() {
		return fixedLineage != null;
	}

	@Override
	public String toString() {
		return seqId + "\t" + origLineage + (fixedLineage != null ? "\t" + fixedLineage : "");
	}
}
