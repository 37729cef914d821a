package reftax;

/**
 * One finding of {@link Taxonomy#checkForDuplicates(boolean)}: a rank name that was first seen in
 * `origSeqId` and seen again in `newSeqId` under a different parent.
 *
 * When the check ran with autofix, `fixedLineage` holds the lineage of `newSeqId` after the
 * name was disambiguated; otherwise it is null. Audit records of altered original sequences use
 * the same id on both sides.
 */
public class DuplicateRecord {

	private final String origSeqId;
	private final String origLineage;
	private final String newSeqId;
	private final String newLineage;
	private final String fixedLineage;

	public DuplicateRecord(String origSeqId, String origLineage, String newSeqId, String newLineage) {
		this(origSeqId, origLineage, newSeqId, newLineage, null);
	}

	public DuplicateRecord(String origSeqId, String origLineage, String newSeqId, String newLineage, String fixedLineage) {
		this.origSeqId = origSeqId;
		this.origLineage = origLineage;
		this.newSeqId = newSeqId;
		this.newLineage = newLineage;
		this.fixedLineage = fixedLineage;
	}

	public String getOrigSeqId() {
		return origSeqId;
	}

	public String getOrigLineage() {
		return origLineage;
	}

	public String getNewSeqId() {
		return newSeqId;
	}

	public String getNewLineage() {
		return newLineage;
	}

	public String getFixedLineage() {
		return fixedLineage;
	}

	public boolean isFixed() {
		return fixedLineage != null;
	}

	public boolean isAuditRecord() {
		return origSeqId.equals(newSeqId);
	}

	@Override
	public String toString() {
		String s = origSeqId + "\t" + origLineage + "\t" + newSeqId + "\t" + newLineage;
		if (fixedLineage != null) {
			s += "\t" + fixedLineage;
		}
		return s;
	}
}
