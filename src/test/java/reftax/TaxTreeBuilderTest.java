package reftax;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import reftax.tree.TaxNode;
import reftax.tree.TaxTree;

public class TaxTreeBuilderTest {

	private static final String LACHNO_CLOS = "Bacteria@@Firmicutes@@Clostridia@@Clostridiales@@Lachnospiraceae_Clostridiales";
	private static final String ROSEBURIA = "Bacteria@@Firmicutes@@Bacilli@@Lactobacillales@@Lachnospiraceae_Lactobacillales@@Roseburia";

	private Taxonomy taxonomy;

	@Before
	public void setUp() {
		taxonomy = new Taxonomy();
		taxonomy.addSeq("s1", new String [] {"Bacteria", "Firmicutes", "Clostridia", "Clostridiales", "Lachnospiraceae", "Blautia", "Blautia producta"});
		taxonomy.addSeq("s2", new String [] {"Bacteria", "Firmicutes", "Clostridia", "Clostridiales", "Lachnospiraceae", "Dorea", "Dorea longicatena"});
		taxonomy.addSeq("s3", new String [] {"Bacteria", "Firmicutes", "Bacilli", "Lactobacillales", "Lachnospiraceae", "Roseburia", "Roseburia intestinalis"});
		taxonomy.addSeq("s4", new String [] {"Bacteria", "Firmicutes", "Bacilli", "Lactobacillales", "Lachnospiraceae", "Roseburia", "Roseburia hominis"});
	}

	private static HashSet<String> tipNames(TaxNode node) {
		HashSet<String> names = new HashSet<String>();
		for (TaxNode tip : node.getTips()) {
			names.add(tip.getName());
		}
		return names;
	}

	@Test
	public void testBuildAfterDuplicateFix() throws Exception {
		assertEquals(4, taxonomy.checkForDuplicates(true).size());
		TaxTreeBuilder.Result result = new TaxTreeBuilder(new TaxTreeBuilderConfig(), taxonomy).build();
		TaxTree tree = result.getTree();

		assertEquals(Arrays.asList("s1", "s2", "s3", "s4"), result.getSeqIds());
		assertEquals(4, tree.getExternalNodeCount());

		TaxNode lachnoClos = tree.getInternalNode(LACHNO_CLOS);
		assertNotNull(lachnoClos);
		assertEquals(new HashSet<String>(Arrays.asList("s1", "s2")), tipNames(lachnoClos));

		// the Lactobacillales family has a single genus and is collapsed into it
		TaxNode roseburia = tree.getExternalNode("s3").getParent();
		assertEquals(ROSEBURIA, roseburia.getName());
		assertEquals(new HashSet<String>(Arrays.asList("s3", "s4")), tipNames(roseburia));

		assertEquals("(((s1,s2),(s3,s4)));", tree.getNewick(false));
	}

	@Test
	public void testAncestorsArePrefixesOfLineage() throws Exception {
		taxonomy.addSeq("s5", new String [] {"Bacteria", "Proteobacteria", "Gammaproteobacteria", "-"});
		taxonomy.addSeq("s6", new String [] {"Bacteria", "Proteobacteria", "-", "Enterobacteriales"});
		TaxTree tree = new TaxTreeBuilder(new TaxTreeBuilderConfig(), taxonomy).build().getTree();

		assertEquals(6, tree.getExternalNodeCount());
		for (TaxNode leaf : tree.getExternalNodes()) {
			String [] ranks = taxonomy.getSeqRanks(leaf.getName());
			HashSet<String> prefixes = new HashSet<String>();
			for (int i = 0; i < ranks.length; i++) {
				prefixes.add(Taxonomy.getRankUid(ranks, i));
			}
			int lastDepth = Integer.MAX_VALUE;
			for (TaxNode anc : leaf.getAncestors()) {
				if (anc.isSyntheticRoot()) {
					assertTrue(anc.isTheRoot());
					continue;
				}
				assertTrue(anc.getName() + " is not on the lineage of " + leaf.getName(), prefixes.contains(anc.getName()));
				int depth = Taxonomy.splitRankUid(anc.getName()).length;
				assertTrue(depth < lastDepth);
				lastDepth = depth;
			}
		}
	}

	@Test
	public void testCladesCreatedOnce() throws Exception {
		TaxTree tree = new TaxTreeBuilder(new TaxTreeBuilderConfig(), taxonomy).build().getTree();
		HashSet<String> names = new HashSet<String>();
		for (TaxNode n : tree.getInternalNodes()) {
			assertTrue(n.getName() + " appears twice", names.add(n.getName()));
		}
	}

	@Test
	public void testNoSingleChildNodesBelowRoot() throws Exception {
		TaxTree tree = new TaxTreeBuilder(new TaxTreeBuilderConfig(), taxonomy).build().getTree();
		for (TaxNode n : tree.getInternalNodes()) {
			if (!n.isTheRoot()) {
				assertTrue(n.getName(), n.getChildCount() > 1);
			}
		}
		assertTrue(tree.getRoot().isSyntheticRoot());
	}

	@Test
	public void testMinRank() throws Exception {
		taxonomy.addSeq("s5", new String [] {"Bacteria", "Firmicutes", "Clostridia", "-", "-", "-", "-"});
		taxonomy.addSeq("s6", new String [] {"Bacteria", "Firmicutes"});
		// genus position of the 7-level backbone
		TaxTreeBuilderConfig config = new TaxTreeBuilderConfig().setMinRank(5);
		TaxTreeBuilder.Result result = new TaxTreeBuilder(config, taxonomy).build();
		assertEquals(Arrays.asList("s1", "s2", "s3", "s4"), result.getSeqIds());
	}

	@Test
	public void testIncludeAndIgnoreClades() throws Exception {
		TaxTreeBuilderConfig config = new TaxTreeBuilderConfig().includeClade(2, "Clostridia").ignoreClade(5, "Dorea");
		TaxTreeBuilder builder = new TaxTreeBuilder(config, taxonomy);
		TaxTreeBuilder.Result result = builder.build();
		assertEquals(Arrays.asList("s1"), result.getSeqIds());

		TaxTree tree = result.getTree();
		assertEquals(1, tree.getExternalNodeCount());
		assertEquals(1, tree.getRoot().getChildCount());
		assertEquals("s1", tree.getRoot().getChild(0).getName());
		assertEquals("(s1);", tree.getNewick(false));
	}

	@Test
	public void testIgnoreWinsOverInclude() throws Exception {
		TaxTreeBuilderConfig config = new TaxTreeBuilderConfig().includeClade(2, "Bacilli").ignoreClade(1, "Firmicutes");
		TaxTreeBuilder builder = new TaxTreeBuilder(config, taxonomy);
		assertFalse(builder.isIncluded(taxonomy.getSeqRanks("s3")));
		assertTrue(builder.build().getSeqIds().isEmpty());
	}

	@Test
	public void testMaxSeqsPerLeaf() throws Exception {
		String [] hominis = {"Bacteria", "Firmicutes", "Bacilli", "Lactobacillales", "Lachnospiraceae", "Roseburia", "Roseburia hominis"};
		String [] order = {"Bacteria", "Firmicutes", "Bacilli", "Lactobacillales", "-", "-", "-"};
		taxonomy.addSeq("s5", hominis);
		taxonomy.addSeq("s6", hominis);
		taxonomy.addSeq("s7", order);
		taxonomy.addSeq("s8", order);
		taxonomy.addSeq("s9", order);

		TaxTreeBuilder.Result result = new TaxTreeBuilder(new TaxTreeBuilderConfig().setMaxSeqsPerLeaf(1), taxonomy).build();
		// lineages that stop above the last level are not limited
		assertEquals(Arrays.asList("s1", "s2", "s3", "s4", "s7", "s8", "s9"), result.getSeqIds());

		result = new TaxTreeBuilder(new TaxTreeBuilderConfig().setMaxSeqsPerLeaf(2), taxonomy).build();
		assertEquals(Arrays.asList("s1", "s2", "s3", "s4", "s5", "s7", "s8", "s9"), result.getSeqIds());

		result = new TaxTreeBuilder(new TaxTreeBuilderConfig(), taxonomy).build();
		assertEquals(taxonomy.seqCount(), result.getSeqIds().size());
		assertEquals(taxonomy.seqCount(), result.getTree().getExternalNodeCount());
	}

	@Test
	public void testRebuildIsIndependent() throws Exception {
		TaxTreeBuilder builder = new TaxTreeBuilder(new TaxTreeBuilderConfig().setMaxSeqsPerLeaf(1), taxonomy);
		TaxTree first = builder.build().getTree();
		TaxTree second = builder.build().getTree();
		assertEquals(first.getNewick(true), second.getNewick(true));
		assertEquals(4, second.getExternalNodeCount());
	}

	@Test
	public void testTaxonomyIsNotModified() throws Exception {
		String before = taxonomy.seqLineageStr("s1");
		new TaxTreeBuilder(new TaxTreeBuilderConfig(), taxonomy).build();
		assertEquals(before, taxonomy.seqLineageStr("s1"));
		assertEquals(4, taxonomy.seqCount());
	}

	@Test
	public void testEmptyTaxonomy() throws Exception {
		TaxTreeBuilder.Result result = new TaxTreeBuilder(new TaxTreeBuilderConfig(), new Taxonomy()).build();
		assertTrue(result.getSeqIds().isEmpty());
		assertEquals(0, result.getTree().getRoot().getChildCount());
	}

	@Test
	public void testProgressAndSnapshotMessages() throws Exception {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		MessageLogger logger = new MessageLogger("test", "|");
		logger.setPrintStream(new PrintStream(bytes));

		TaxTreeBuilderConfig config = new TaxTreeBuilderConfig().setVerbose(true).setDebug(true).setProgressInterval(2);
		TaxTreeBuilder builder = new TaxTreeBuilder(config, taxonomy);
		builder.setMessageLogger(logger);
		builder.build();
		logger.close();

		List<String> lines = Arrays.asList(bytes.toString().split("\\r?\\n"));
		assertEquals(3, lines.size());
		assertEquals("test|progress|processed|2|added|2|skipped|0", lines.get(0));
		assertEquals("test|progress|processed|4|added|4|skipped|0", lines.get(1));
		assertTrue(lines.get(2).startsWith("test|unpruned tree|newick|\""));
		// before collapsing, the single-child kingdom and family nodes are still there
		assertTrue(lines.get(2).endsWith(")Bacteria)<<root>>;\""));
	}

	@Test
	public void testPruneUnifuNodes() {
		TaxNode root = TaxNode.createRoot();
		TaxNode a = root.addChild("a");
		TaxNode b = a.addChild("b");
		b.addChild("x");
		b.addChild("y");
		TaxNode c = root.addChild("c");
		c.addChild("z");

		assertEquals(2, TaxTreeBuilder.pruneUnifuNodes(root));
		assertEquals(2, root.getChildCount());
		assertSame(b, root.getChild(0));
		assertEquals("z", root.getChild(1).getName());
		assertSame(root, b.getParent());
		assertEquals("((x,y)b,z)<<root>>", root.getNewick(true));
	}
}
