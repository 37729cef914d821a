package reftax;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.log4j.Logger;

import reftax.constants.RankLevel;
import reftax.exceptions.UnknownTaxCodeException;

/**
 * Rank-name recognition rules of one nomenclature code (bacterial, botanical, zoological or viral).
 *
 * For each canonical rank level the code defines a set of name suffixes and a set of exact names.
 * Levels that a code knows about but cannot recognize by name (e.g. genus) carry empty rule sets;
 * they still take part in the positional fallback of {@link #guessRankLevel(String[], int)}.
 *
 * The tables are static and read-only.
 */
public class TaxCode {

	static Logger _LOG = Logger.getLogger(TaxCode.class);

	/**
	 * Suffixes and exact names that identify one rank level.
	 */
	public static final class RankRule {

		private final Set<String> suffixes;
		private final Set<String> exactNames;

		private RankRule(String [] suffixes, String [] exactNames) {
			this.suffixes = Collections.unmodifiableSet(new LinkedHashSet<String>(Arrays.asList(suffixes)));
			this.exactNames = Collections.unmodifiableSet(new LinkedHashSet<String>(Arrays.asList(exactNames)));
		}

		public Set<String> getSuffixes() {
			return suffixes;
		}

		/**
		 * @param normName lowercased name with all non-alphanumeric characters removed
		 */
		public boolean matches(String normName) {
			if (exactNames.contains(normName)) {
				return true;
			}
			for (String suffix : suffixes) {
				if (normName.endsWith(suffix)) {
					return true;
				}
			}
			return false;
		}
	}

	private static final String [] NONE = new String[0];

	private static String [] of(String ... s) {
		return s;
	}

	private static Map<Integer, RankRule> table(Object ... levelRules) {
		TreeMap<Integer, RankRule> t = new TreeMap<Integer, RankRule>();
		for (int i = 0; i < levelRules.length; i += 3) {
			RankLevel lvl = (RankLevel) levelRules[i];
			t.put(lvl.level, new RankRule((String []) levelRules[i + 1], (String []) levelRules[i + 2]));
		}
		return Collections.unmodifiableMap(t);
	}

	public static final Map<Integer, RankRule> BAC_TAX_CODE = table(
			RankLevel.KINGDOM, NONE, of("bacteria", "archaea"),
			RankLevel.PHYLUM, NONE, NONE,
			RankLevel.CLASS, NONE, NONE,
			RankLevel.SUBCLASS, of("idae"), NONE,
			RankLevel.ORDER, of("ales"), NONE,
			RankLevel.SUBORDER, of("ineae"), NONE,
			RankLevel.FAMILY, of("aceae"), NONE,
			RankLevel.SUBFAMILY, of("oideae"), NONE,
			RankLevel.GENUS, NONE, NONE,
			RankLevel.SPECIES, NONE, NONE,
			RankLevel.SUBSPECIES, NONE, NONE,
			RankLevel.STRAIN, NONE, NONE,
			RankLevel.ISOLATE, NONE, NONE);

	public static final Map<Integer, RankRule> BOT_TAX_CODE = table(
			RankLevel.KINGDOM, NONE, of("plantae", "algae", "fungi"),
			RankLevel.PHYLUM, of("phyta", "phycota", "mycota"), NONE,
			RankLevel.SUBPHYLUM, of("phytina", "phycotina", "mycotina"), NONE,
			RankLevel.CLASS, of("opsida", "phyceae", "mycetes"), NONE,
			RankLevel.SUBCLASS, of("idae", "phycidae", "mycetidae"), NONE,
			RankLevel.SUPERORDER, of("anae"), NONE,
			RankLevel.ORDER, of("ales"), NONE,
			RankLevel.SUBORDER, of("ineae"), NONE,
			RankLevel.INFRAORDER, of("aria"), NONE,
			RankLevel.SUPERFAMILY, of("acea"), NONE,
			RankLevel.FAMILY, of("aceae"), NONE,
			RankLevel.SUBFAMILY, of("oideae"), NONE,
			RankLevel.TRIBE, of("eae"), NONE,
			RankLevel.SUBTRIBE, of("inae"), NONE,
			RankLevel.GENUS, NONE, NONE,
			RankLevel.SPECIES, NONE, NONE,
			RankLevel.SUBSPECIES, NONE, NONE,
			RankLevel.STRAIN, NONE, NONE,
			RankLevel.ISOLATE, NONE, NONE);

	public static final Map<Integer, RankRule> ZOO_TAX_CODE = table(
			RankLevel.KINGDOM, NONE, of("animalia"),
			RankLevel.PHYLUM, NONE, of("chordata", "arthropoda", "mollusca", "nematoda"),
			RankLevel.SUBPHYLUM, NONE, of("vertebrata", "myriapoda", "crustacea", "hexapoda"),
			RankLevel.CLASS, NONE, of("mammalia", "aves", "reptilia", "amphibia", "insecta"),
			RankLevel.SUBCLASS, NONE, NONE,
			RankLevel.SUPERORDER, NONE, NONE,
			RankLevel.ORDER, NONE, NONE,
			RankLevel.SUBORDER, NONE, NONE,
			RankLevel.INFRAORDER, NONE, NONE,
			RankLevel.SUPERFAMILY, of("oidea"), NONE,
			RankLevel.EPIFAMILY, of("oidae"), NONE,
			RankLevel.FAMILY, of("idae"), NONE,
			RankLevel.SUBFAMILY, of("inae"), NONE,
			RankLevel.INFRAFAMILY, of("odd"), NONE,
			RankLevel.TRIBE, of("ini"), NONE,
			RankLevel.SUBTRIBE, of("ina"), NONE,
			RankLevel.INFRATRIBE, of("ad", "iti"), NONE,
			RankLevel.GENUS, NONE, NONE,
			RankLevel.SPECIES, NONE, NONE,
			RankLevel.SUBSPECIES, NONE, NONE,
			RankLevel.STRAIN, NONE, NONE,
			RankLevel.ISOLATE, NONE, NONE);

	public static final Map<Integer, RankRule> VIR_TAX_CODE = table(
			RankLevel.KINGDOM, NONE, of("viruses"),
			RankLevel.CLASS, NONE, NONE,
			RankLevel.SUBCLASS, of("idae"), NONE,
			RankLevel.ORDER, of("virales"), NONE,
			RankLevel.FAMILY, of("viridae"), NONE,
			RankLevel.SUBFAMILY, of("virinae"), NONE,
			RankLevel.GENUS, of("virus"), NONE,
			RankLevel.SPECIES, NONE, NONE,
			RankLevel.STRAIN, NONE, NONE,
			RankLevel.ISOLATE, NONE, NONE);

	private static final Map<String, Map<Integer, RankRule>> TAX_CODE_MAP;

	static {
		HashMap<String, Map<Integer, RankRule>> m = new HashMap<String, Map<Integer, RankRule>>();
		m.put("bac", BAC_TAX_CODE);
		m.put("bot", BOT_TAX_CODE);
		m.put("zoo", ZOO_TAX_CODE);
		m.put("vir", VIR_TAX_CODE);
		TAX_CODE_MAP = Collections.unmodifiableMap(m);
	}

	private final Map<Integer, RankRule> taxCode;
	private final Integer [] sortedTaxLevels;

	/**
	 * @param taxCodeName one of "bac", "bot", "zoo", "vir" (case-insensitive)
	 * @throws UnknownTaxCodeException if the name is not a known code
	 */
	public TaxCode(String taxCodeName) {
		Map<Integer, RankRule> code = (taxCodeName == null) ? null : TAX_CODE_MAP.get(taxCodeName.toLowerCase());
		if (code == null) {
			_LOG.error("Unknown taxonomic code: " + taxCodeName);
			throw new UnknownTaxCodeException(taxCodeName);
		}
		this.taxCode = code;
		this.sortedTaxLevels = code.keySet().toArray(new Integer[code.size()]);
	}

	public Map<Integer, RankRule> getRules() {
		return taxCode;
	}

	public static Set<String> knownCodeNames() {
		return TAX_CODE_MAP.keySet();
	}

	public static String normalizeRankName(String rankName) {
		return rankName.replaceAll("[\\W_]+", "").toLowerCase();
	}

	/**
	 * Guesses the canonical level (1..22) of the rank at position `rankLevel` of `ranks`.
	 *
	 * The name itself is tried first against the code's suffixes and exact names, in ascending level
	 * order. If that fails, the position's parent is resolved and the next standard-backbone level below
	 * it is taken; the root position defaults to kingdom.
	 *
	 * @return the guessed level, or 0 if none could be determined
	 */
	public int guessRankLevel(String [] ranks, int rankLevel) {
		return guessRankLevel(ranks, rankLevel, new HashMap<Integer, Integer>());
	}

	private int guessRankLevel(String [] ranks, int rankLevel, HashMap<Integer, Integer> memo) {
		Integer known = memo.get(rankLevel);
		if (known != null) {
			return known;
		}

		String rankName = (rankLevel < ranks.length && ranks[rankLevel] != null) ? normalizeRankName(ranks[rankLevel]) : "";

		int realLevel = RankLevel.UNKNOWN_LEVEL;
		for (Integer lvl : sortedTaxLevels) {
			if (taxCode.get(lvl).matches(rankName)) {
				realLevel = lvl;
				break;
			}
		}

		if (realLevel == RankLevel.UNKNOWN_LEVEL) {
			if (rankLevel == 0) {
				realLevel = RankLevel.KINGDOM.level;
			} else {
				int parentLevel = guessRankLevel(ranks, rankLevel - 1, memo);
				if (parentLevel != RankLevel.UNKNOWN_LEVEL) {
					// positional guess: the name itself is not looked at again
					for (Integer lvl : sortedTaxLevels) {
						if (lvl > parentLevel && RankLevel.isStandard(lvl)) {
							realLevel = lvl;
							break;
						}
					}
				}
			}
		}

		memo.put(rankLevel, realLevel);
		return realLevel;
	}

	public String guessRankLevelName(String [] ranks, int rankLevel) {
		return RankLevel.rankLevelName(guessRankLevel(ranks, rankLevel));
	}
}
