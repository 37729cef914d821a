package reftax;

import static org.junit.Assert.*;

import org.junit.Test;

import reftax.constants.RankLevel;
import reftax.exceptions.UnknownTaxCodeException;

public class TaxCodeTest {

	private static final String [] BLAUTIA = {"Bacteria", "Firmicutes", "Clostridia", "Clostridiales",
			"Lachnospiraceae", "Blautia", "Blautia producta"};

	@Test
	public void testBacterialLineage() throws Exception {
		TaxCode bac = new TaxCode("bac");
		assertEquals(RankLevel.KINGDOM.level, bac.guessRankLevel(BLAUTIA, 0));
		assertEquals(RankLevel.PHYLUM.level, bac.guessRankLevel(BLAUTIA, 1));
		assertEquals(RankLevel.CLASS.level, bac.guessRankLevel(BLAUTIA, 2));
		assertEquals(RankLevel.ORDER.level, bac.guessRankLevel(BLAUTIA, 3));
		assertEquals(RankLevel.FAMILY.level, bac.guessRankLevel(BLAUTIA, 4));
		assertEquals(RankLevel.GENUS.level, bac.guessRankLevel(BLAUTIA, 5));
		assertEquals(RankLevel.SPECIES.level, bac.guessRankLevel(BLAUTIA, 6));
		assertEquals("Genus", bac.guessRankLevelName(BLAUTIA, 5));
	}

	@Test
	public void testSuffixBeatsPosition() throws Exception {
		// a suborder right below the class is recognized by its suffix, not placed at order level
		String [] ranks = {"Bacteria", "Actinobacteria", "Actinobacteria", "Corynebacterineae"};
		TaxCode bac = new TaxCode("BAC");
		assertEquals(RankLevel.SUBORDER.level, bac.guessRankLevel(ranks, 3));
	}

	@Test
	public void testUnrecognizedRootIsKingdom() throws Exception {
		String [] ranks = {"Unclassified", "Something"};
		TaxCode bac = new TaxCode("bac");
		assertEquals(RankLevel.KINGDOM.level, bac.guessRankLevel(ranks, 0));
		assertEquals(RankLevel.PHYLUM.level, bac.guessRankLevel(ranks, 1));
	}

	@Test
	public void testZoologicalLineage() throws Exception {
		String [] ranks = {"Animalia", "Chordata", "Mammalia", "Primates", "Hominidae", "Homo", "Homo sapiens"};
		TaxCode zoo = new TaxCode("zoo");
		assertEquals(1, zoo.guessRankLevel(ranks, 0));
		assertEquals(2, zoo.guessRankLevel(ranks, 1));
		assertEquals(4, zoo.guessRankLevel(ranks, 2));
		assertEquals(7, zoo.guessRankLevel(ranks, 3));
		assertEquals(12, zoo.guessRankLevel(ranks, 4));
		assertEquals(18, zoo.guessRankLevel(ranks, 5));
		assertEquals(19, zoo.guessRankLevel(ranks, 6));

		String [] ranks2 = {"Animalia", "Chordata", "Mammalia", "Primates", "Hominoidea", "Homininae", "Hominini"};
		assertEquals(RankLevel.SUPERFAMILY.level, zoo.guessRankLevel(ranks2, 4));
		assertEquals(RankLevel.SUBFAMILY.level, zoo.guessRankLevel(ranks2, 5));
		assertEquals(RankLevel.TRIBE.level, zoo.guessRankLevel(ranks2, 6));
	}

	@Test
	public void testBotanicalLineage() throws Exception {
		String [] ranks = {"Plantae", "Magnoliophyta", "Magnoliopsida", "Rosales", "Rosaceae", "Rosa", "Rosa canina"};
		TaxCode bot = new TaxCode("bot");
		int [] expected = {1, 2, 4, 7, 12, 18, 19};
		for (int i = 0; i < ranks.length; i++) {
			assertEquals(ranks[i], expected[i], bot.guessRankLevel(ranks, i));
		}
	}

	@Test
	public void testUnresolvableLevels() throws Exception {
		String [] ranks = {"Viruses", "Lambdavirus", "Escherichia phage lambda", "x", "y"};
		TaxCode vir = new TaxCode("vir");
		assertEquals(RankLevel.GENUS.level, vir.guessRankLevel(ranks, 1));
		assertEquals(RankLevel.SPECIES.level, vir.guessRankLevel(ranks, 2));
		// no standard level below species in the viral table
		assertEquals(RankLevel.UNKNOWN_LEVEL, vir.guessRankLevel(ranks, 3));
		assertEquals(RankLevel.UNKNOWN_LEVEL, vir.guessRankLevel(ranks, 4));
		assertEquals(RankLevel.UNKNOWN_NAME, vir.guessRankLevelName(ranks, 4));
	}

	@Test
	public void testNameNormalization() throws Exception {
		assertEquals("candidatussaccharibacteria", TaxCode.normalizeRankName("Candidatus_Saccharibacteria"));
		assertEquals("ruminococcaceaeucg014", TaxCode.normalizeRankName("[Ruminococcaceae] UCG-014"));
		String [] ranks = {"[Bacteria]"};
		assertEquals(1, new TaxCode("bac").guessRankLevel(ranks, 0));
	}

	@Test(expected = UnknownTaxCodeException.class)
	public void testUnknownCode() throws Exception {
		new TaxCode("fungal");
	}

	@Test
	public void testTablesAreReadOnly() throws Exception {
		TaxCode bac = new TaxCode("bac");
		try {
			bac.getRules().remove(RankLevel.ORDER.level);
			fail("rank tables should not be modifiable");
		} catch (UnsupportedOperationException e) {
			// expected
		}
		try {
			bac.getRules().get(RankLevel.ORDER.level).getSuffixes().add("xyz");
			fail("rank rules should not be modifiable");
		} catch (UnsupportedOperationException e) {
			// expected
		}
	}
}
