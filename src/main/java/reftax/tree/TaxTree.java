package reftax.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * A rooted tree of {@link TaxNode}s with node lists for quick access to tips and internal nodes.
 * The lists are filled by {@link #processRoot()} and must be refreshed with it after the topology changes.
 */
public class TaxTree {
	/*
	 * private
	 */
	private TaxNode root;

	private ArrayList<TaxNode> internalNodes; // stored in preorder

	private ArrayList<TaxNode> externalNodes; // stored in preorder

	/*
	 * constructors
	 */
	public TaxTree(TaxNode root) {
		this.root = root;
		processRoot();
	}

	/**
	 * Initializes the node lists based on the current root.
	 */
	public void processRoot() {
		internalNodes = new ArrayList<TaxNode>();
		externalNodes = new ArrayList<TaxNode>();
		if (root == null) {
			return;
		}
		ArrayList<TaxNode> stack = new ArrayList<TaxNode>();
		stack.add(root);
		while (!stack.isEmpty()) {
			TaxNode node = stack.remove(stack.size() - 1);
			if (node.isExternal()) {
				externalNodes.add(node);
			} else {
				internalNodes.add(node);
			}
			for (int i = node.getChildCount() - 1; i >= 0; i--) {
				stack.add(node.getChild(i));
			}
		}
	}

	public TaxNode getRoot() {return root;}

	/**
	 * @return a leaf with the index `num` from the externalNodes or throw IndexOutOfBoundsException.
	 */
	public TaxNode getExternalNode(int num) throws IndexOutOfBoundsException {
		return externalNodes.get(num);
	}

	/**
	 * @return a leaf with name `name` or null
	 * O(N) lookup.
	 */
	public TaxNode getExternalNode(String name) {
		for (TaxNode ne : externalNodes) {
			if (ne.getName().equals(name)) {
				return ne;
			}
		}
		return null;
	}

	/**
	 * @return an internal node with the index `num` from the internalNodes or throw IndexOutOfBoundsException.
	 * Calling this with arguments in the order 0 -> internalNodeCount will be a preorder traversal
	 */
	public TaxNode getInternalNode(int num) throws IndexOutOfBoundsException {
		return internalNodes.get(num);
	}

	/**
	 * @return an internal node with name `name` or null
	 * O(N) lookup.
	 */
	public TaxNode getInternalNode(String name) {
		for (TaxNode ne : internalNodes) {
			if (ne.getName().equals(name)) {
				return ne;
			}
		}
		return null;
	}

	public List<TaxNode> getExternalNodes() {return externalNodes;}

	public List<TaxNode> getInternalNodes() {return internalNodes;}

	public int getExternalNodeCount() {return externalNodes.size();}

	public int getInternalNodeCount() {return internalNodes.size();}

	/**
	 * @return newick string of the whole tree, terminated by ';'
	 */
	public String getNewick(boolean internalLabels) {
		if (root == null) {
			return ";";
		}
		return root.getNewick(internalLabels) + ";";
	}
}
