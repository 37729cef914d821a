package reftax.exceptions;

import java.io.PrintStream;

/**
 * Thrown by the taxonomy reader when a record does not have the expected layout.
 */
public class DataFormatException extends Exception {

	private static final long serialVersionUID = 1L;
	private String msg;

	public DataFormatException(String msg) {
		super(msg);
		this.msg = msg;
	}

	public DataFormatException(int lineNumber, String msg) {
		this("line " + lineNumber + ": " + msg);
	}

	@Override
	public String toString() {
		return "Format not recognized: " + this.msg;
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		out.println(failedAction + " failed. " + this.toString());
	}
}
