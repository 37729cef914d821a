package reftax;

import java.io.PrintStream;

/**
 * A simple sink for diagnostics emitted while reconciling a taxonomy and building its tree. A message has
 *	1. an indentation level (to denote hierarchical structure of messages)
 *	2. a label, a free-form string naming the event
 *	3. zero or more key-value pairs (the payload)
 *
 * In this base class the messages are printed in the form: prefix + sep + label + sep + key1 + sep + val1 ...
 *
 * If the JSONMessageLogger is used, the same calls write one JSON object per message.
 */
public class MessageLogger {

	protected String msgPrefix;
	protected PrintStream outStream;
	protected String sep;

	public MessageLogger(String pref) {
		this(pref, "\t|\t");
	}

	public MessageLogger(String pref, String separator) {
		this.msgPrefix = pref;
		this.outStream = System.out;
		this.sep = separator;
	}

	public void setPrintStream(PrintStream ps) {
		this.outStream = ps;
	}

	public void message(String label) {
		this.indentMessage(0, label);
	}

	public void messageStr(String label, String s, String s2) {
		this.indentMessageStr(0, label, s, s2);
	}

	public void messageInt(String label, String s, int i) {
		this.indentMessageInt(0, label, s, i);
	}

	public void messageIntIntInt(String label, String s, int i, String s2, int i2, String s3, int i3) {
		this.indentMessageIntIntInt(0, label, s, i, s2, i2, s3, i3);
	}

	public void indentMessage(int indentLevel, String label) {
		this._write_prefix();
		this._indent(indentLevel);
		this._message(indentLevel, label);
	}

	public void indentMessageStr(int indentLevel, String label, String s, String s2) {
		this._write_prefix();
		this._indent(indentLevel);
		this._messageStr(indentLevel, label, s, s2);
	}

	public void indentMessageInt(int indentLevel, String label, String s, int i) {
		this._write_prefix();
		this._indent(indentLevel);
		this._messageInt(indentLevel, label, s, i);
	}

	public void indentMessageIntIntInt(int indentLevel, String label, String s, int i, String s2, int i2, String s3, int i3) {
		this._write_prefix();
		this._indent(indentLevel);
		this._messageIntIntInt(indentLevel, label, s, i, s2, i2, s3, i3);
	}

	// no-op for streaming to std out
	public void close() {
		this.outStream.flush();
	}

	// prepend prefix (or no-op in JSON)
	protected void _write_prefix() {
		this.outStream.print(this.msgPrefix + this.sep);
	}

	// indent with spaces (or no-op in JSON)
	protected void _indent(int indentLevel) {
		for (int x = 0; x < indentLevel; ++x) {
			this.outStream.print("  ");
		}
	}

	protected void _message(int indentLevel, String label) {
		this.outStream.println(label);
	}

	protected void _messageStr(int indentLevel, String label, String s, String s2) {
		this.outStream.println(label + this.sep + s + this.sep + '"' + s2 + '"');
	}

	protected void _messageInt(int indentLevel, String label, String s, int i) {
		this.outStream.println(label + this.sep + s + this.sep + i);
	}

	protected void _messageIntIntInt(int indentLevel, String label, String s, int i, String s2, int i2, String s3, int i3) {
		this.outStream.println(label + this.sep + s + this.sep + i + this.sep + s2 + this.sep + i2 + this.sep + s3 + this.sep + i3);
	}
}
