package reftax;

import java.io.File;
import java.io.IOException;
import java.io.Reader;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.LineIterator;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import reftax.constants.RankLevel;
import reftax.exceptions.DataFormatException;

/**
 * Reads a taxonomy file with rows formatted as:
 *	sequence_id\tKingdom;Phylum;Class;...\n
 *
 * Rank names are trimmed and empty names become {@link Taxonomy#EMPTY_RANK}. Blank lines are skipped.
 */
public class TaxonomyFileReader {

	static Logger _LOG = Logger.getLogger(TaxonomyFileReader.class);

	public static Taxonomy readTaxonomy(File file) throws IOException, DataFormatException {
		return readTaxonomy(file, "");
	}

	/**
	 * @param prefix prepended to every sequence id
	 */
	public static Taxonomy readTaxonomy(File file, String prefix) throws IOException, DataFormatException {
		Taxonomy taxonomy = new Taxonomy(prefix);
		readRecords(taxonomy, FileUtils.lineIterator(file, "UTF-8"));
		_LOG.info("Loaded " + taxonomy.seqCount() + " sequences from " + file.getPath());
		return taxonomy;
	}

	public static Taxonomy readTaxonomy(Reader reader, String prefix) throws IOException, DataFormatException {
		Taxonomy taxonomy = new Taxonomy(prefix);
		readRecords(taxonomy, IOUtils.lineIterator(reader));
		return taxonomy;
	}

	private static void readRecords(Taxonomy taxonomy, LineIterator it) throws IOException, DataFormatException {
		int lineNumber = 0;
		try {
			while (it.hasNext()) {
				String line = it.nextLine().trim();
				lineNumber++;
				if (line.length() == 0) {
					continue;
				}
				String [] toks = StringUtils.splitPreserveAllTokens(line, '\t');
				if (toks.length != 2) {
					throw new DataFormatException(lineNumber, "expected 2 tab-separated fields, found " + toks.length);
				}
				String sid = taxonomy.getPrefix() + toks[0].trim();
				String [] ranks = parseLineage(toks[1], lineNumber);
				if (taxonomy.containsSeq(sid)) {
					_LOG.warn("line " + lineNumber + ": duplicate sequence id " + sid + ", replacing earlier record");
				}
				taxonomy.addSeq(sid, ranks);
			}
		} finally {
			it.close();
		}
	}

	static String [] parseLineage(String lineage, int lineNumber) throws DataFormatException {
		String [] ranks = StringUtils.splitPreserveAllTokens(lineage, Taxonomy.LINEAGE_DELIM);
		if (ranks.length > RankLevel.UNI_TAX_LEVELS) {
			throw new DataFormatException(lineNumber, ranks.length + " rank levels, at most " + RankLevel.UNI_TAX_LEVELS + " are supported");
		}
		for (int i = 0; i < ranks.length; i++) {
			String rankName = ranks[i].trim();
			if (rankName.contains(Taxonomy.RANK_UID_DELIM)) {
				throw new DataFormatException(lineNumber, "rank name \"" + rankName + "\" contains reserved delimiter " + Taxonomy.RANK_UID_DELIM);
			}
			ranks[i] = (rankName.length() == 0) ? Taxonomy.EMPTY_RANK : rankName;
		}
		return ranks;
	}
}
