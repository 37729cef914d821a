package reftax;

import org.json.simple.JSONObject;

/**
 * See notes in the MessageLogger base class. Every message is written as a single-line JSON object with
 * a "label" field, an "indent" field for nested messages and one field per key-value pair.
 */
public class JSONMessageLogger extends MessageLogger {

	public JSONMessageLogger(String pref) {
		super(pref);
	}

	// prefix is carried in the object
	@Override
	protected void _write_prefix() {
	}

	@Override
	protected void _indent(int indentLevel) {
	}

	@SuppressWarnings("unchecked")
	private JSONObject newMessage(int indentLevel, String label) {
		JSONObject msg = new JSONObject();
		if (this.msgPrefix != null && this.msgPrefix.length() > 0) {
			msg.put("source", this.msgPrefix);
		}
		msg.put("label", label);
		if (indentLevel > 0) {
			msg.put("indent", indentLevel);
		}
		return msg;
	}

	@Override
	protected void _message(int indentLevel, String label) {
		this.outStream.println(newMessage(indentLevel, label).toJSONString());
	}

	@Override
	@SuppressWarnings("unchecked")
	protected void _messageStr(int indentLevel, String label, String s, String s2) {
		JSONObject msg = newMessage(indentLevel, label);
		msg.put(s, s2);
		this.outStream.println(msg.toJSONString());
	}

	@Override
	@SuppressWarnings("unchecked")
	protected void _messageInt(int indentLevel, String label, String s, int i) {
		JSONObject msg = newMessage(indentLevel, label);
		msg.put(s, i);
		this.outStream.println(msg.toJSONString());
	}

	@Override
	@SuppressWarnings("unchecked")
	protected void _messageIntIntInt(int indentLevel, String label, String s, int i, String s2, int i2, String s3, int i3) {
		JSONObject msg = newMessage(indentLevel, label);
		msg.put(s, i);
		msg.put(s2, i2);
		msg.put(s3, i3);
		this.outStream.println(msg.toJSONString());
	}
}
