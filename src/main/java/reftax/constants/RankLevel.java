package reftax.constants;

import java.util.HashMap;
import java.util.Map;

/**
 * The canonical taxonomic rank ladder. Each level carries its position in the ladder (1-based),
 * a display name and the short prefix used when labelling the standard 7-level backbone
 * (e.g. "k__Bacteria;p__Firmicutes").
 *
 * Level 0 is reserved for "unknown" and has no enum constant.
 *
 */
public enum RankLevel {

	KINGDOM (1, "Kingdom", "k__"),
	PHYLUM (2, "Phylum", "p__"),
	SUBPHYLUM (3, "Subphylum", "a__"),
	CLASS (4, "Class", "c__"),
	SUBCLASS (5, "Subclass", "d__"),
	SUPERORDER (6, "Superorder", "e__"),
	ORDER (7, "Order", "o__"),
	SUBORDER (8, "Suborder", "h__"),
	INFRAORDER (9, "Infraorder", "i__"),
	SUPERFAMILY (10, "Superfamily", "j__"),
	EPIFAMILY (11, "Epifamily", "l__"),
	FAMILY (12, "Family", "f__"),
	SUBFAMILY (13, "Subfamily", "m__"),
	INFRAFAMILY (14, "Infrafamily", "n__"),
	TRIBE (15, "Tribe", "t__"),
	SUBTRIBE (16, "Subtribe", "u__"),
	INFRATRIBE (17, "Infratribe", "v__"),
	GENUS (18, "Genus", "g__"),
	SPECIES (19, "Species", "s__"),
	SUBSPECIES (20, "Subspecies", "b__"),
	STRAIN (21, "Strain", "r__"),
	ISOLATE (22, "Isolate", "q__");

	public static final int UNKNOWN_LEVEL = 0;
	public static final String UNKNOWN_NAME = "Unknown";
	public static final String UNKNOWN_PREFIX = "?__";

	/** number of canonical levels */
	public static final int UNI_TAX_LEVELS = 22;

	/** the standard 7-level backbone: kingdom, phylum, class, order, family, genus, species */
	public static final RankLevel [] STD_RANKS = {KINGDOM, PHYLUM, CLASS, ORDER, FAMILY, GENUS, SPECIES};

	public static final String [] STD_RANK_PREFIXES = {"k__", "p__", "c__", "o__", "f__", "g__", "s__"};

	private static final Map<Integer, RankLevel> lookup = new HashMap<Integer, RankLevel>();

	static {
		for (RankLevel r : values()) {
			lookup.put(r.level, r);
		}
	}

	public final int level;
	public final String displayName;
	public final String prefix;

	RankLevel(int level, String displayName, String prefix) {
		this.level = level;
		this.displayName = displayName;
		this.prefix = prefix;
	}

	/**
	 * @return the rank level with position `level`, or null for 0 and out-of-range values
	 */
	public static RankLevel get(int level) {
		return lookup.get(level);
	}

	public boolean isStandard() {
		for (RankLevel r : STD_RANKS) {
			if (r == this) {
				return true;
			}
		}
		return false;
	}

	public static boolean isStandard(int level) {
		RankLevel r = get(level);
		return r != null && r.isStandard();
	}

	public static String rankLevelName(int level) {
		RankLevel r = get(level);
		return r == null ? UNKNOWN_NAME : r.displayName;
	}

	public static String rankLevelPrefix(int level) {
		RankLevel r = get(level);
		return r == null ? UNKNOWN_PREFIX : r.prefix;
	}
}
