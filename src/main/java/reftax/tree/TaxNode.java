package reftax.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Stack;

public class TaxNode {

	public static final String ROOT_LABEL = "<<root>>";

	/*
	 * common associations
	 */
	private String name;
	private TaxNode parent;
	private ArrayList<TaxNode> children;
	private final boolean syntheticRoot;

	/*
	 * constructors
	 */
	public TaxNode(String name) {
		this(name, false);
	}

	private TaxNode(String name, boolean syntheticRoot) {
		this.name = name;
		this.parent = null;
		this.children = new ArrayList<TaxNode>();
		this.syntheticRoot = syntheticRoot;
	}

	/**
	 * @return a new synthetic root. It is distinguished from clade and sequence nodes by
	 *		{@link #isSyntheticRoot()}, not by its label.
	 */
	public static TaxNode createRoot() {
		return new TaxNode(ROOT_LABEL, true);
	}

	/*
	 * public methods
	 */

	public boolean isSyntheticRoot() {return this.syntheticRoot;}

	public List<TaxNode> getChildren() {return this.children;}

	public boolean isExternal() {return (this.children.size() < 1);}

	public boolean isInternal() {return (this.children.size() > 0);}

	public boolean isTheRoot() {return (this.parent == null);}

	public TaxNode getParent() {return this.parent;}

	public int getChildCount() {return this.children.size();}

	public void setName(String s) {this.name = s;}

	public String getName() {return this.name;}

	public boolean hasChild(TaxNode test) {return this.children.contains(test);}

	public boolean addChild(TaxNode c) {
		if (this.hasChild(c) == false) {
			this.children.add(c);
			c.parent = this;
			return true;
		} else {
			return false;
		}
	}

	/**
	 * Creates a new node named `childName` and appends it to the children of this node.
	 */
	public TaxNode addChild(String childName) {
		TaxNode c = new TaxNode(childName);
		this.addChild(c);
		return c;
	}

	public boolean removeChild(TaxNode c) {
		if (this.children.remove(c)) {
			c.parent = null;
			return true;
		}
		return false;
	}

	/**
	 * Puts `replacement` in the position of the child `c`. `replacement` is detached from its former parent.
	 */
	public boolean replaceChild(TaxNode c, TaxNode replacement) {
		int idx = this.children.indexOf(c);
		if (idx < 0) {
			return false;
		}
		if (replacement.parent != null) {
			replacement.parent.children.remove(replacement);
		}
		this.children.set(idx, replacement);
		replacement.parent = this;
		c.parent = null;
		return true;
	}

	/**
	 * @return the c-th child or throw IndexOutOfBoundsException.
	 */
	public TaxNode getChild(int c) throws IndexOutOfBoundsException {
		return this.children.get(c);
	}

	/**
	 * @return all of the tips in the subtree rooted at `this`, left to right
	 */
	public List<TaxNode> getTips() {
		ArrayList<TaxNode> tips = new ArrayList<TaxNode>();
		Stack<TaxNode> nodes = new Stack<TaxNode>();
		nodes.push(this);
		while (nodes.isEmpty() == false) {
			TaxNode jt = nodes.pop();
			for (int i = jt.getChildCount() - 1; i >= 0; i--) {
				nodes.push(jt.getChild(i));
			}
			if (jt.isExternal()) {
				tips.add(jt);
			}
		}
		return tips;
	}

	/**
	 * @return the nodes from this node's parent up to the root, nearest first
	 */
	public List<TaxNode> getAncestors() {
		ArrayList<TaxNode> ancestors = new ArrayList<TaxNode>();
		TaxNode cur = this.parent;
		while (cur != null) {
			ancestors.add(cur);
			cur = cur.parent;
		}
		return ancestors;
	}

	/**
	 * @param internalLabels should be true to write the names of internal nodes
	 * @return string with newick representation of the subtree rooted at this node (without the trailing ';')
	 */
	public String getNewick(boolean internalLabels) {
		StringBuilder sb = new StringBuilder();
		appendNewick(sb, internalLabels);
		return sb.toString();
	}

	private void appendNewick(StringBuilder sb, boolean internalLabels) {
		for (int i = 0; i < this.getChildCount(); i++) {
			sb.append(i == 0 ? '(' : ',');
			this.getChild(i).appendNewick(sb, internalLabels);
			if (i == this.getChildCount() - 1) {
				sb.append(')');
			}
		}
		if (this.name != null && (this.isExternal() || internalLabels)) {
			sb.append(newickName(this.name));
		}
	}

	/**
	 * Quotes `origName` if it contains characters that are reserved in newick; single quotes are doubled.
	 */
	public static String newickName(String origName) {
		if (origName.matches(".*[\\Q:;/[]{}(),' \\E]+.*")) {
			return "'" + origName.replace("'", "''") + "'";
		}
		return origName;
	}

	@Override
	public String toString() {
		return this.name;
	}
}
