package reftax;

/**
 * A (rank level, rank name) pair used to select or exclude sequences when building a tree. The rank level
 * is a position in the lineage array (0 = kingdom level).
 */
public final class Clade {

	private final int rankLevel;
	private final String rankName;

	public Clade(int rankLevel, String rankName) {
		this.rankLevel = rankLevel;
		this.rankName = rankName;
	}

	public int getRankLevel() {
		return rankLevel;
	}

	public String getRankName() {
		return rankName;
	}

	/**
	 * @return true if `ranks` has this clade's name at this clade's level
	 */
	public boolean matches(String [] ranks) {
		return rankLevel >= 0 && rankLevel < ranks.length && rankName.equals(ranks[rankLevel]);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Clade)) {
			return false;
		}
		Clade other = (Clade) o;
		return rankLevel == other.rankLevel && rankName.equals(other.rankName);
	}

	@Override
	public int hashCode() {
		return 31 * rankLevel + rankName.hashCode();
	}

	@Override
	public String toString() {
		return rankLevel + ":" + rankName;
	}
}
