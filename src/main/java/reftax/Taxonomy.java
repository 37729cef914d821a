package reftax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import reftax.constants.RankLevel;
import reftax.exceptions.SequenceNotFoundException;

/**
 * Taxonomy holds the classification of a set of sequences: for every sequence id an ordered array of
 * rank names (index 0 is the kingdom-level rank, unassigned positions hold {@link #EMPTY_RANK}), and the
 * reverse index from lineage keys to the ids classified exactly there.
 *
 * Every id is a member of exactly one rank group. Methods that rewrite rank names rebuild the reverse
 * index before they return.
 *
 * Instances are not thread safe; callers must serialize mutating calls.
 */
public class Taxonomy {

	static Logger _LOG = Logger.getLogger(Taxonomy.class);

	public static final String EMPTY_RANK = "-";
	public static final String RANK_UID_DELIM = "@@";
	public static final String LINEAGE_DELIM = ";";
	public static final String DEFAULT_MERGE_PREFIX = "__TAXCLUSTER__";

	/** depth of the standard kingdom..species backbone */
	public static final int STD_RANK_LEVELS = RankLevel.STD_RANKS.length;

	static final String RANK_NAME_INVALID_CHARS = "[](),;:'";
	static final String SEQ_ID_INVALID_CHARS = "[](),;:' ";
	static final char SUBSTITUTE_CHAR = '_';

	private final String prefix;
	private final LinkedHashMap<String, String []> seqRanksMap = new LinkedHashMap<String, String []>();
	private final HashMap<String, LinkedHashSet<String>> rankSeqsMap = new HashMap<String, LinkedHashSet<String>>();

	public Taxonomy() {
		this("");
	}

	/**
	 * @param prefix prepended to sequence ids by the taxonomy reader; lookups accept ids with or without it
	 */
	public Taxonomy(String prefix) {
		this.prefix = (prefix == null) ? "" : prefix;
	}

	/**
	 * Builds a taxonomy from an in-memory map. The rank arrays are copied.
	 */
	public Taxonomy(Map<String, String []> taxMap) {
		this("");
		for (Map.Entry<String, String []> e : taxMap.entrySet()) {
			addSeq(e.getKey(), e.getValue());
		}
	}

	/*
	 * static lineage helpers
	 */

	public static boolean isEmptyRank(String rankName) {
		return rankName == null || EMPTY_RANK.equals(rankName);
	}

	/**
	 * @return the assigned rank names of `ranks`, trimmed and joined with ";"
	 */
	public static String lineageStr(String [] ranks) {
		ArrayList<String> names = new ArrayList<String>();
		for (String r : ranks) {
			if (isEmptyRank(r)) {
				continue;
			}
			String t = r.trim();
			if (t.length() > 0 && !EMPTY_RANK.equals(t)) {
				names.add(t);
			}
		}
		return StringUtils.join(names, LINEAGE_DELIM);
	}

	/**
	 * @return index of the last assigned rank, or -1 if nothing is assigned
	 */
	public static int lowestAssignedRankLevel(String [] ranks) {
		int rankLevel = ranks.length - 1;
		while (rankLevel >= 0 && isEmptyRank(ranks[rankLevel])) {
			rankLevel--;
		}
		return rankLevel;
	}

	/**
	 * @return name of the last assigned rank, or null if nothing is assigned
	 */
	public static String lowestAssignedRank(String [] ranks) {
		int rankLevel = lowestAssignedRankLevel(ranks);
		return (rankLevel >= 0) ? ranks[rankLevel] : null;
	}

	/**
	 * @return the lineage key of the clade at the lowest assigned level of `ranks`
	 */
	public static String getRankUid(String [] ranks) {
		return getRankUid(ranks, lowestAssignedRankLevel(ranks));
	}

	/**
	 * @return ranks[0..rankLevel] joined with {@link #RANK_UID_DELIM}; empty if rankLevel is negative
	 */
	public static String getRankUid(String [] ranks, int rankLevel) {
		if (rankLevel < 0) {
			return "";
		}
		return StringUtils.join(ranks, RANK_UID_DELIM, 0, rankLevel + 1);
	}

	public static String [] splitRankUid(String rankUid) {
		return splitRankUid(rankUid, 0);
	}

	/**
	 * Inverse of {@link #getRankUid(String[])}. The result is padded with {@link #EMPTY_RANK} up to
	 * `minLevels` entries.
	 */
	public static String [] splitRankUid(String rankUid, int minLevels) {
		String [] ranks = (rankUid == null || rankUid.length() == 0)
				? new String[0]
				: StringUtils.splitByWholeSeparatorPreserveAllTokens(rankUid, RANK_UID_DELIM);
		if (ranks.length >= minLevels) {
			return ranks;
		}
		String [] padded = Arrays.copyOf(ranks, minLevels);
		Arrays.fill(padded, ranks.length, minLevels, EMPTY_RANK);
		return padded;
	}

	public static String rankUidToLineageStr(String rankUid) {
		return lineageStr(splitRankUid(rankUid));
	}

	/*
	 * lookup
	 */

	public String getPrefix() {
		return prefix;
	}

	public int seqCount() {
		return seqRanksMap.size();
	}

	public boolean containsSeq(String seqId) {
		return resolveSeqId(seqId) != null;
	}

	public Set<String> getSeqIds() {
		return Collections.unmodifiableSet(seqRanksMap.keySet());
	}

	/**
	 * @return a copy of the id -> ranks map, in load order
	 */
	public Map<String, String []> getMap() {
		return copyRanks();
	}

	/**
	 * Read-only view of the id -> ranks map for the tree builder. The rank arrays are the stored ones
	 * and must not be written to.
	 */
	Map<String, String []> ranksView() {
		return Collections.unmodifiableMap(seqRanksMap);
	}

	private LinkedHashMap<String, String []> copyRanks() {
		LinkedHashMap<String, String []> copy = new LinkedHashMap<String, String []>();
		for (Map.Entry<String, String []> e : seqRanksMap.entrySet()) {
			copy.put(e.getKey(), e.getValue().clone());
		}
		return copy;
	}

	/**
	 * @return a copy of the ranks of `seqId`
	 */
	public String [] getSeqRanks(String seqId) throws SequenceNotFoundException {
		return ranksOf(seqId).clone();
	}

	public String seqLineageStr(String seqId) throws SequenceNotFoundException {
		return lineageStr(ranksOf(seqId));
	}

	public String seqRankId(String seqId) throws SequenceNotFoundException {
		return getRankUid(ranksOf(seqId));
	}

	public Set<String> getRankUids() {
		return Collections.unmodifiableSet(rankSeqsMap.keySet());
	}

	public Set<String> getRankSeqs(String rankUid) {
		Set<String> seqs = rankSeqsMap.get(rankUid);
		if (seqs == null) {
			return Collections.emptySet();
		}
		return Collections.unmodifiableSet(seqs);
	}

	public int getRankSeqCount(String rankUid) {
		Set<String> seqs = rankSeqsMap.get(rankUid);
		return (seqs == null) ? 0 : seqs.size();
	}

	/**
	 * @return the rank names that occur in the lineage of every sequence
	 */
	public Set<String> getCommonRanks() {
		Set<String> common = null;
		for (String [] ranks : seqRanksMap.values()) {
			Set<String> curr = new HashSet<String>(Arrays.asList(ranks));
			if (common == null) {
				common = curr;
			} else {
				common.retainAll(curr);
			}
		}
		if (common == null) {
			return new HashSet<String>();
		}
		common.remove(EMPTY_RANK);
		return common;
	}

	private String resolveSeqId(String seqId) {
		if (seqRanksMap.containsKey(seqId)) {
			return seqId;
		}
		if (prefix.length() > 0 && !seqId.startsWith(prefix) && seqRanksMap.containsKey(prefix + seqId)) {
			return prefix + seqId;
		}
		return null;
	}

	private String [] ranksOf(String seqId) throws SequenceNotFoundException {
		String sid = resolveSeqId(seqId);
		if (sid == null) {
			throw new SequenceNotFoundException(seqId);
		}
		return seqRanksMap.get(sid);
	}

	/*
	 * structural changes
	 */

	/**
	 * Adds (or replaces) the classification of `seqId`. The array is copied.
	 *
	 * @throws IllegalArgumentException if the lineage is deeper than the canonical ladder or a rank
	 * 		name contains the lineage key delimiter
	 */
	public void addSeq(String seqId, String [] ranks) {
		if (ranks.length > RankLevel.UNI_TAX_LEVELS) {
			throw new IllegalArgumentException("sequence " + seqId + " has " + ranks.length
					+ " rank levels, at most " + RankLevel.UNI_TAX_LEVELS + " are supported");
		}
		for (String r : ranks) {
			if (r != null && r.contains(RANK_UID_DELIM)) {
				throw new IllegalArgumentException("rank name \"" + r + "\" of sequence " + seqId
						+ " contains the reserved delimiter " + RANK_UID_DELIM);
			}
		}
		String [] copy = ranks.clone();
		for (int i = 0; i < copy.length; i++) {
			if (copy[i] == null) {
				copy[i] = EMPTY_RANK;
			}
		}
		if (seqRanksMap.containsKey(seqId)) {
			unindex(seqId, seqRanksMap.get(seqId));
		}
		seqRanksMap.put(seqId, copy);
		index(seqId, copy);
	}

	public void removeSeq(String seqId) throws SequenceNotFoundException {
		String sid = resolveSeqId(seqId);
		if (sid == null) {
			throw new SequenceNotFoundException(seqId);
		}
		String [] ranks = seqRanksMap.remove(sid);
		unindex(sid, ranks);
	}

	/**
	 * Renames a sequence, keeping its classification and rank group.
	 *
	 * @throws IllegalArgumentException if `newSeqId` is already used by another sequence
	 */
	public void renameSeq(String oldSeqId, String newSeqId) throws SequenceNotFoundException {
		String sid = resolveSeqId(oldSeqId);
		if (sid == null) {
			throw new SequenceNotFoundException(oldSeqId);
		}
		if (sid.equals(newSeqId)) {
			return;
		}
		if (seqRanksMap.containsKey(newSeqId)) {
			throw new IllegalArgumentException("cannot rename " + sid + ": sequence " + newSeqId + " already exists");
		}
		moveSeq(sid, newSeqId);
	}

	private void moveSeq(String oldSeqId, String newSeqId) {
		String [] ranks = seqRanksMap.remove(oldSeqId);
		seqRanksMap.put(newSeqId, ranks);
		LinkedHashSet<String> group = rankSeqsMap.get(getRankUid(ranks));
		group.remove(oldSeqId);
		group.add(newSeqId);
	}

	private void index(String seqId, String [] ranks) {
		String rankUid = getRankUid(ranks);
		LinkedHashSet<String> group = rankSeqsMap.get(rankUid);
		if (group == null) {
			group = new LinkedHashSet<String>();
			rankSeqsMap.put(rankUid, group);
		}
		group.add(seqId);
	}

	private void unindex(String seqId, String [] ranks) {
		String rankUid = getRankUid(ranks);
		LinkedHashSet<String> group = rankSeqsMap.get(rankUid);
		if (group != null) {
			group.remove(seqId);
			if (group.isEmpty()) {
				rankSeqsMap.remove(rankUid);
			}
		}
	}

	private void rebuildRankIndex() {
		rankSeqsMap.clear();
		for (Map.Entry<String, String []> e : seqRanksMap.entrySet()) {
			index(e.getKey(), e.getValue());
		}
	}

	public String mergeRanks(List<String> rankUids) {
		return mergeRanks(rankUids, DEFAULT_MERGE_PREFIX);
	}

	/**
	 * Merges the rank groups `rankUids` into one. The clade name at the lowest assigned level of the first
	 * group is replaced by `namePrefix` + that name, and every sequence of every listed group is
	 * reclassified to the resulting lineage.
	 *
	 * @return the lineage key of the merged group, or null if fewer than two keys were given
	 */
	public String mergeRanks(List<String> rankUids, String namePrefix) {
		if (rankUids == null || rankUids.size() < 2) {
			return null;
		}

		String firstUid = rankUids.get(0);
		int pathLength = 0;
		LinkedHashSet<String> firstGroup = rankSeqsMap.get(firstUid);
		if (firstGroup != null && !firstGroup.isEmpty()) {
			pathLength = seqRanksMap.get(firstGroup.iterator().next()).length;
		}
		String [] firstTaxon = splitRankUid(firstUid, pathLength);
		int mergeLevel = lowestAssignedRankLevel(firstTaxon);
		if (mergeLevel < 0) {
			_LOG.warn("cannot merge rank groups into the unassigned lineage");
			return null;
		}

		ArrayList<String> allSids = new ArrayList<String>();
		for (String rankUid : rankUids) {
			LinkedHashSet<String> group = rankSeqsMap.remove(rankUid);
			if (group == null) {
				_LOG.warn("rank group \"" + rankUid + "\" not found, nothing to merge");
				continue;
			}
			allSids.addAll(group);
		}

		String [] newRanks = firstTaxon.clone();
		newRanks[mergeLevel] = namePrefix + firstTaxon[mergeLevel];
		String newRankUid = getRankUid(newRanks);

		LinkedHashSet<String> merged = rankSeqsMap.get(newRankUid);
		if (merged == null) {
			merged = new LinkedHashSet<String>();
			rankSeqsMap.put(newRankUid, merged);
		}
		for (String sid : allSids) {
			seqRanksMap.put(sid, newRanks.clone());
			merged.add(sid);
		}
		_LOG.debug("merged " + rankUids.size() + " rank groups (" + allSids.size() + " sequences) into " + newRankUid);
		return newRankUid;
	}

	/*
	 * normalization and repair passes
	 */

	private static String substitute(String s, String invalidChars) {
		return StringUtils.replaceChars(s, invalidChars, StringUtils.repeat(SUBSTITUTE_CHAR, invalidChars.length()));
	}

	/**
	 * Replaces characters that are not allowed in tree labels in all rank names. Every occurrence of a
	 * name is corrected the same way.
	 *
	 * @return the corrected names, original -> corrected
	 */
	public Map<String, String> normalizeRankNames() {
		LinkedHashMap<String, String> corrRanks = new LinkedHashMap<String, String>();
		for (String [] ranks : seqRanksMap.values()) {
			for (int i = 0; i < ranks.length; i++) {
				String corr = corrRanks.get(ranks[i]);
				if (corr != null) {
					ranks[i] = corr;
				} else {
					String newName = substitute(ranks[i], RANK_NAME_INVALID_CHARS);
					if (!newName.equals(ranks[i])) {
						corrRanks.put(ranks[i], newName);
						ranks[i] = newName;
					}
				}
			}
		}
		if (!corrRanks.isEmpty()) {
			rebuildRankIndex();
			_LOG.info("normalized " + corrRanks.size() + " rank names");
		}
		return corrRanks;
	}

	/**
	 * Replaces characters that are not allowed in tree labels in all sequence ids. If the corrected id is
	 * already taken, a numeric suffix is appended.
	 *
	 * @return the renamed ids, original -> corrected
	 */
	public Map<String, String> normalizeSeqIds() {
		LinkedHashMap<String, String> corrIds = new LinkedHashMap<String, String>();
		for (String oldSid : new ArrayList<String>(seqRanksMap.keySet())) {
			String newSid = substitute(oldSid, SEQ_ID_INVALID_CHARS);
			if (newSid.equals(oldSid)) {
				continue;
			}
			String candidate = newSid;
			int n = 2;
			while (seqRanksMap.containsKey(candidate)) {
				candidate = newSid + SUBSTITUTE_CHAR + n;
				n++;
			}
			moveSeq(oldSid, candidate);
			corrIds.put(oldSid, candidate);
		}
		if (!corrIds.isEmpty()) {
			_LOG.info("normalized " + corrIds.size() + " sequence ids");
		}
		return corrIds;
	}

	/**
	 * Fills unassigned ranks that lie between the root and the lowest assigned rank of a lineage. A gap
	 * takes the name of the nearest assigned rank below it, tagged with a per-lineage counter:
	 * "parent1_Blautia", "parent2_Blautia", ...
	 *
	 * The root position is never filled.
	 *
	 * @return the number of filled positions
	 */
	public int closeTaxonomyGaps() {
		int filled = 0;
		for (String [] ranks : seqRanksMap.values()) {
			String lastRank = null;
			int gapCount = 0;
			for (int i = ranks.length - 1; i > 0; i--) {
				if (!isEmptyRank(ranks[i])) {
					lastRank = ranks[i];
				} else if (lastRank != null) {
					gapCount++;
					ranks[i] = "parent" + gapCount + "_" + lastRank;
					filled++;
				}
			}
		}
		if (filled > 0) {
			rebuildRankIndex();
			_LOG.info("closed " + filled + " taxonomy gaps");
		}
		return filled;
	}

	/**
	 * The sequence in which a (level, name) pair was first seen, and the parent name it had there.
	 */
	private static final class FirstSighting {

		final String seqId;
		final String parent;

		FirstSighting(String seqId, String parent) {
			this.seqId = seqId;
			this.parent = parent;
		}
	}

	private static String cladeKey(int rankLevel, String name, String parent) {
		return rankLevel + RANK_UID_DELIM + parent + RANK_UID_DELIM + name;
	}

	/**
	 * Finds rank names that are used for different clades, i.e. that occur at the same rank level under
	 * two different parents.
	 *
	 * With `autofix` each colliding occurrence is renamed to name + "_" + parent name. The occurrence that
	 * was seen first is renamed once, and afterwards all other sequences that still carry a renamed
	 * (level, name, parent) get the same new name. Parents are compared by the names they had when the
	 * pass started, so renaming one level does not turn the levels below it into collisions. Besides one
	 * record per collision, one audit record is returned for every sequence altered that way.
	 */
	public List<DuplicateRecord> checkForDuplicates(boolean autofix) {
		// names as they were when the pass started; autofix renames in place
		Map<String, String []> origRanksMap = autofix ? copyRanks() : seqRanksMap;
		HashMap<String, FirstSighting> firstSeen = new HashMap<String, FirstSighting>();
		ArrayList<DuplicateRecord> dups = new ArrayList<DuplicateRecord>();
		LinkedHashSet<String> oldFixed = new LinkedHashSet<String>();
		HashMap<String, String> renamedClades = new HashMap<String, String>();

		for (Map.Entry<String, String []> e : seqRanksMap.entrySet()) {
			String sid = e.getKey();
			String [] ranks = e.getValue();
			String [] orig = origRanksMap.get(sid);
			for (int i = 1; i < orig.length; i++) {
				if (isEmptyRank(orig[i])) {
					break;
				}
				String name = orig[i];
				String parent = orig[i - 1];
				String nameAtLevel = i + RANK_UID_DELIM + name;
				FirstSighting first = firstSeen.get(nameAtLevel);
				if (first == null) {
					firstSeen.put(nameAtLevel, new FirstSighting(sid, parent));
					continue;
				}
				if (first.parent.equals(parent)) {
					continue;
				}
				String origOldLineage = lineageStr(origRanksMap.get(first.seqId));
				if (!autofix) {
					dups.add(new DuplicateRecord(first.seqId, origOldLineage, sid, lineageStr(orig)));
					continue;
				}
				String oldCladeKey = cladeKey(i, name, first.parent);
				if (!renamedClades.containsKey(oldCladeKey)) {
					String oldName = name + "_" + first.parent;
					renamedClades.put(oldCladeKey, oldName);
					seqRanksMap.get(first.seqId)[i] = oldName;
					oldFixed.add(first.seqId);
				}
				String newName = name + "_" + parent;
				renamedClades.put(cladeKey(i, name, parent), newName);
				ranks[i] = newName;
				dups.add(new DuplicateRecord(first.seqId, origOldLineage, sid, lineageStr(orig), lineageStr(ranks)));
			}
		}

		if (!autofix) {
			return dups;
		}

		// give every other member of a renamed clade the same new name
		LinkedHashSet<String> swept = new LinkedHashSet<String>();
		if (!renamedClades.isEmpty()) {
			for (Map.Entry<String, String []> e : seqRanksMap.entrySet()) {
				String [] ranks = e.getValue();
				String [] orig = origRanksMap.get(e.getKey());
				boolean changed = false;
				for (int i = 1; i < orig.length; i++) {
					if (isEmptyRank(orig[i])) {
						break;
					}
					String newName = renamedClades.get(cladeKey(i, orig[i], orig[i - 1]));
					if (newName != null && !newName.equals(ranks[i])) {
						ranks[i] = newName;
						changed = true;
					}
				}
				if (changed && !oldFixed.contains(e.getKey())) {
					swept.add(e.getKey());
				}
			}
		}

		for (String sid : oldFixed) {
			dups.add(auditRecord(sid, origRanksMap.get(sid)));
		}
		for (String sid : swept) {
			dups.add(auditRecord(sid, origRanksMap.get(sid)));
		}

		if (!dups.isEmpty()) {
			rebuildRankIndex();
			_LOG.info("fixed " + renamedClades.size() + " ambiguous rank names");
		}
		return dups;
	}

	private DuplicateRecord auditRecord(String sid, String [] origRanks) {
		String origLineage = lineageStr(origRanks);
		return new DuplicateRecord(sid, origLineage, sid, origLineage, lineageStr(seqRanksMap.get(sid)));
	}

	/**
	 * Finds lineages deeper than the standard 7-level backbone.
	 *
	 * With `autofix` interior ranks are dropped until 7 levels remain. Subclass and suborder-like names
	 * (ending in "dae" or "neae") go first, then names with no recognized suffix, and order and family-like
	 * names ("ales", "ceae") last. This is a suffix heuristic; it does not guarantee that the remaining
	 * ranks are the backbone ones.
	 */
	public List<DisbalanceRecord> checkForDisbalance(boolean autofix) {
		ArrayList<DisbalanceRecord> errs = new ArrayList<DisbalanceRecord>();
		for (Map.Entry<String, String []> e : seqRanksMap.entrySet()) {
			String sid = e.getKey();
			String [] ranks = e.getValue();
			if (ranks.length <= STD_RANK_LEVELS) {
				continue;
			}
			if (!autofix) {
				errs.add(new DisbalanceRecord(sid, lineageStr(ranks)));
				continue;
			}
			String origLineage = lineageStr(ranks);

			ArrayList<Integer> dropq = new ArrayList<Integer>();
			ArrayList<Integer> keepq = new ArrayList<Integer>();
			ArrayList<Integer> restq = new ArrayList<Integer>();
			for (int i = 1; i < ranks.length; i++) {
				if (ranks[i].endsWith("dae") || ranks[i].endsWith("neae")) {
					dropq.add(i);
				} else if (ranks[i].endsWith("ceae") || ranks[i].endsWith("ales")) {
					keepq.add(i);
				} else {
					restq.add(i);
				}
			}
			ArrayList<Integer> candidates = new ArrayList<Integer>(dropq);
			candidates.addAll(restq);
			candidates.addAll(keepq);
			HashSet<Integer> toRemove = new HashSet<Integer>(candidates.subList(0, ranks.length - STD_RANK_LEVELS));

			String [] newRanks = new String[STD_RANK_LEVELS];
			int j = 0;
			for (int i = 0; i < ranks.length; i++) {
				if (!toRemove.contains(i)) {
					newRanks[j++] = ranks[i];
				}
			}
			e.setValue(newRanks);
			errs.add(new DisbalanceRecord(sid, origLineage, lineageStr(newRanks)));
		}
		if (autofix && !errs.isEmpty()) {
			rebuildRankIndex();
			_LOG.info("rebalanced " + errs.size() + " lineages to " + STD_RANK_LEVELS + " levels");
		}
		return errs;
	}
}
