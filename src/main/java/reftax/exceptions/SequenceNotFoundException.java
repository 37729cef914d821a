package reftax.exceptions;

import java.io.PrintStream;

/**
 * Thrown when a sequence identifier is not present in the taxonomy.
 */
public class SequenceNotFoundException extends Exception {

	private static final long serialVersionUID = 1L;

	private final String seqId;

	public SequenceNotFoundException(String seqId) {
		super("sequence \"" + seqId + "\" is not in the taxonomy");
		this.seqId = seqId;
	}

	public String getSeqId() {
		return seqId;
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		out.println(failedAction + " failed; unknown sequence '" + seqId + "'");
	}
}
