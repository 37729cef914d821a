package reftax;

import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Stack;

import org.apache.log4j.Logger;

import reftax.tree.TaxNode;
import reftax.tree.TaxTree;

/**
 * Builds a rooted tree from a reconciled {@link Taxonomy}. Every included sequence becomes a leaf, every
 * distinct lineage key on the way from the root to a leaf becomes an internal node labelled with that key.
 *
 * The taxonomy is only read. Gaps in the lineages should be closed first, since ancestors are looked up
 * by position.
 */
public class TaxTreeBuilder {

	static Logger _LOG = Logger.getLogger(TaxTreeBuilder.class);

	/**
	 * The built tree and the ids of the sequences placed in it, in the order they were added.
	 */
	public static class Result {

		private final TaxTree tree;
		private final List<String> seqIds;

		Result(TaxTree tree, List<String> seqIds) {
			this.tree = tree;
			this.seqIds = Collections.unmodifiableList(seqIds);
		}

		public TaxTree getTree() {
			return tree;
		}

		public List<String> getSeqIds() {
			return seqIds;
		}
	}

	private final TaxTreeBuilderConfig config;
	private final Taxonomy taxonomy;
	private MessageLogger messageLogger;

	// lineage key -> clade node, for the current build
	private HashMap<String, TaxNode> treeNodes;
	private TObjectIntHashMap<String> leafCount;

	public TaxTreeBuilder(TaxTreeBuilderConfig config, Taxonomy taxonomy) {
		this.config = config;
		this.taxonomy = taxonomy;
	}

	/**
	 * @param messageLogger receives progress counters (verbose) and the unpruned tree (debug); may be null
	 */
	public void setMessageLogger(MessageLogger messageLogger) {
		this.messageLogger = messageLogger;
	}

	public Result build() {
		treeNodes = new HashMap<String, TaxNode>();
		leafCount = new TObjectIntHashMap<String>();
		TaxNode root = TaxNode.createRoot();

		int k = 0;
		ArrayList<String> seqIds = new ArrayList<String>();
		for (Map.Entry<String, String []> e : taxonomy.ranksView().entrySet()) {
			if (placeSeq(root, e.getKey(), e.getValue())) {
				seqIds.add(e.getKey());
			}
			k++;
			if (config.isVerbose() && k % config.getProgressInterval() == 0) {
				reportProgress(k, seqIds.size());
			}
		}

		_LOG.debug("Total sequences in resulting tree: " + seqIds.size());

		if (config.isDebug() && messageLogger != null) {
			messageLogger.messageStr("unpruned tree", "newick", root.getNewick(true) + ";");
		}

		int pruned = pruneUnifuNodes(root);
		_LOG.debug("Collapsed " + pruned + " unifurcating nodes");

		return new Result(new TaxTree(root), seqIds);
	}

	/**
	 * Adds `sid` as a leaf below the clade of its lowest assigned rank, unless it is filtered out or its
	 * clade has reached the leaf quota.
	 *
	 * @return true if the sequence was added
	 */
	private boolean placeSeq(TaxNode root, String sid, String [] ranks) {
		if (!isIncluded(ranks)) {
			return false;
		}

		// sequences are leafs of the tree, so they always sit below the lowest taxonomy level they have
		int parentLevel = Taxonomy.lowestAssignedRankLevel(ranks);
		String parentUid = Taxonomy.getRankUid(ranks, parentLevel);

		// the quota only applies to sequences classified down to the last level of their lineage
		if (parentLevel == ranks.length - 1 && leafCount.get(parentUid) >= config.getMaxSeqsPerLeaf()) {
			return false;
		}
		leafCount.adjustOrPutValue(parentUid, 1, 1);

		addTreeNode(root, sid, ranks, parentLevel);
		return true;
	}

	private void reportProgress(int processed, int added) {
		if (messageLogger != null) {
			messageLogger.messageIntIntInt("progress", "processed", processed, "added", added, "skipped", processed - added);
		} else {
			_LOG.info("Processed nodes: " + processed + ", added: " + added + ", skipped: " + (processed - added));
		}
	}

	/**
	 * Applies the minimum rank, inclusion list and ignore list, in that order.
	 */
	boolean isIncluded(String [] ranks) {
		int minRank = config.getMinRank();
		if (minRank >= ranks.length || Taxonomy.isEmptyRank(ranks[minRank])) {
			return false;
		}

		// check against the inclusion list; an empty list includes everything
		boolean cladeIsOk = config.getCladesToInclude().isEmpty();
		for (Clade c : config.getCladesToInclude()) {
			if (c.matches(ranks)) {
				cladeIsOk = true;
				break;
			}
		}

		// if the sequence is about to be included, check it against the ignore list
		if (cladeIsOk) {
			for (Clade c : config.getCladesToIgnore()) {
				if (c.matches(ranks)) {
					cladeIsOk = false;
					break;
				}
			}
		}
		return cladeIsOk;
	}

	private TaxNode addTreeNode(TaxNode root, String nodeId, String [] ranks, int rankLevel) {
		TaxNode parentNode = getCladeNode(root, ranks, rankLevel);
		return parentNode.addChild(nodeId);
	}

	/**
	 * @return the node of the clade at the nearest assigned level at or above `rankLevel`, creating it and
	 *		any missing ancestors
	 */
	private TaxNode getCladeNode(TaxNode root, String [] ranks, int rankLevel) {
		int level = rankLevel;
		while (level >= 0 && Taxonomy.isEmptyRank(ranks[level])) {
			level--;
		}
		if (level < 0) {
			return root;
		}
		String rankUid = Taxonomy.getRankUid(ranks, level);
		TaxNode node = treeNodes.get(rankUid);
		if (node == null) {
			TaxNode parentNode = getCladeNode(root, ranks, level - 1);
			node = parentNode.addChild(rankUid);
			treeNodes.put(rankUid, node);
		}
		return node;
	}

	/**
	 * Replaces every non-root node that has a single child by that child.
	 *
	 * @return the number of removed nodes
	 */
	static int pruneUnifuNodes(TaxNode root) {
		int pruned = 0;
		Stack<TaxNode> nodes = new Stack<TaxNode>();
		nodes.push(root);
		while (!nodes.isEmpty()) {
			TaxNode node = nodes.pop();
			for (TaxNode child : new ArrayList<TaxNode>(node.getChildren())) {
				TaxNode c = child;
				while (c.getChildCount() == 1) {
					TaxNode only = c.getChild(0);
					node.replaceChild(c, only);
					c = only;
					pruned++;
				}
				if (c.isInternal()) {
					nodes.push(c);
				}
			}
		}
		return pruned;
	}
}
