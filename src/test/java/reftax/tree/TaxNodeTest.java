package reftax.tree;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

public class TaxNodeTest {

	private TaxNode root;
	private TaxNode firmicutes;
	private TaxNode blautia;

	@Before
	public void setUp() {
		root = TaxNode.createRoot();
		firmicutes = root.addChild("Firmicutes");
		blautia = firmicutes.addChild("Blautia");
		blautia.addChild("s1");
		blautia.addChild("s2");
		firmicutes.addChild("s3");
		root.addChild("s4");
	}

	@Test
	public void testStructure() {
		assertTrue(root.isSyntheticRoot());
		assertTrue(root.isTheRoot());
		assertFalse(firmicutes.isSyntheticRoot());
		assertEquals(TaxNode.ROOT_LABEL, root.getName());
		assertSame(root, firmicutes.getParent());
		assertTrue(blautia.isInternal());
		assertTrue(blautia.getChild(0).isExternal());
		assertEquals(2, root.getChildCount());
		assertFalse(firmicutes.addChild(blautia));
	}

	@Test
	public void testTipsInOrder() {
		List<TaxNode> tips = root.getTips();
		assertEquals(4, tips.size());
		assertEquals("s1", tips.get(0).getName());
		assertEquals("s2", tips.get(1).getName());
		assertEquals("s3", tips.get(2).getName());
		assertEquals("s4", tips.get(3).getName());
	}

	@Test
	public void testAncestors() {
		List<TaxNode> ancestors = blautia.getChild(1).getAncestors();
		assertEquals(3, ancestors.size());
		assertSame(blautia, ancestors.get(0));
		assertSame(firmicutes, ancestors.get(1));
		assertSame(root, ancestors.get(2));
		assertTrue(root.getAncestors().isEmpty());
	}

	@Test
	public void testReplaceChildKeepsPosition() {
		TaxNode s3 = firmicutes.getChild(1);
		assertTrue(firmicutes.replaceChild(blautia, blautia.getChild(0)));
		assertEquals("s1", firmicutes.getChild(0).getName());
		assertSame(s3, firmicutes.getChild(1));
		assertSame(firmicutes, firmicutes.getChild(0).getParent());
		assertNull(blautia.getParent());
		assertEquals(1, blautia.getChildCount());
		assertFalse(root.replaceChild(blautia, s3));
	}

	@Test
	public void testRemoveChild() {
		TaxNode s4 = root.getChild(1);
		assertTrue(root.removeChild(s4));
		assertNull(s4.getParent());
		assertEquals(1, root.getChildCount());
		assertFalse(root.removeChild(s4));
	}

	@Test
	public void testNewick() {
		assertEquals("(((s1,s2),s3),s4)", root.getNewick(false));
		assertEquals("(((s1,s2)Blautia,s3)Firmicutes,s4)<<root>>", root.getNewick(true));
		assertEquals("(s1,s2)Blautia", blautia.getNewick(true));
	}

	@Test
	public void testNewickName() {
		assertEquals("Blautia", TaxNode.newickName("Blautia"));
		assertEquals("'Blautia producta'", TaxNode.newickName("Blautia producta"));
		assertEquals("'Clostridium_(sensu_stricto)'", TaxNode.newickName("Clostridium_(sensu_stricto)"));
		assertEquals("'Escherichia coli K-12 ''substr'''", TaxNode.newickName("Escherichia coli K-12 'substr'"));
		assertEquals("'Bacteria@@Firmicutes@@Blautia producta'", TaxNode.newickName("Bacteria@@Firmicutes@@Blautia producta"));

		blautia.getChild(0).setName("seq:1");
		assertEquals("(('seq:1',s2),s3)", firmicutes.getNewick(false));
	}
}
