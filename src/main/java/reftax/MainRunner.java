package reftax;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import reftax.exceptions.DataFormatException;
import reftax.exceptions.UnknownTaxCodeException;

public class MainRunner {

	static Logger _LOG = Logger.getLogger(MainRunner.class);

	private final PrintStream out;

	public MainRunner() {
		this(System.out);
	}

	public MainRunner(PrintStream out) {
		this.out = out;
	}

	/**
	 * Normalizes names and ids and reports (or, with "autofix", repairs) ambiguous and unbalanced lineages.
	 */
	public int checkTaxonomy(String [] args) throws IOException, DataFormatException {
		if (args.length != 2 && args.length != 3) {
			out.println("arguments should be: taxFile [autofix]");
			return 1;
		}
		File taxFile = new File(args[1]);
		if (!taxFile.exists()) {
			System.err.println("Could not open the taxonomy file '" + args[1] + "'. Exiting...");
			return 1;
		}
		boolean autofix = args.length == 3 && args[2].equals("autofix");

		Taxonomy taxonomy = TaxonomyFileReader.readTaxonomy(taxFile);
		reportCorrections("renamed rank", taxonomy.normalizeRankNames());
		reportCorrections("renamed sequence", taxonomy.normalizeSeqIds());

		List<DuplicateRecord> dups = taxonomy.checkForDuplicates(autofix);
		for (DuplicateRecord d : dups) {
			out.println("duplicate\t" + d);
		}
		List<DisbalanceRecord> errs = taxonomy.checkForDisbalance(autofix);
		for (DisbalanceRecord d : errs) {
			out.println("disbalance\t" + d);
		}
		out.println("sequences: " + taxonomy.seqCount() + ", duplicate records: " + dups.size() + ", unbalanced lineages: " + errs.size());
		return 0;
	}

	/**
	 * Loads, repairs and gap-closes a taxonomy, builds its tree and writes it as newick.
	 */
	public int buildTree(String [] args) throws IOException, DataFormatException {
		if (args.length < 3 || args.length > 6) {
			out.println("arguments should be: taxFile outFile [minRank] [maxSeqsPerLeaf] [verbose|json]");
			return 1;
		}
		File taxFile = new File(args[1]);
		if (!taxFile.exists()) {
			System.err.println("Could not open the taxonomy file '" + args[1] + "'. Exiting...");
			return 1;
		}
		TaxTreeBuilderConfig config = new TaxTreeBuilderConfig();
		try {
			if (args.length > 3) {
				config.setMinRank(Integer.parseInt(args[3]));
			}
			if (args.length > 4) {
				config.setMaxSeqsPerLeaf(Integer.parseInt(args[4]));
			}
		} catch (IllegalArgumentException iae) {
			out.println("Bad numeric argument: " + iae.getMessage());
			return 1;
		}
		MessageLogger messageLogger = null;
		if (args.length > 5) {
			messageLogger = args[5].equals("json") ? new JSONMessageLogger("buildtree") : new MessageLogger("buildtree");
			messageLogger.setPrintStream(out);
			config.setVerbose(true);
		}

		Taxonomy taxonomy = TaxonomyFileReader.readTaxonomy(taxFile);
		taxonomy.normalizeRankNames();
		taxonomy.normalizeSeqIds();
		taxonomy.checkForDuplicates(true);
		taxonomy.checkForDisbalance(true);
		taxonomy.closeTaxonomyGaps();

		TaxTreeBuilder builder = new TaxTreeBuilder(config, taxonomy);
		builder.setMessageLogger(messageLogger);
		TaxTreeBuilder.Result result = builder.build();
		if (messageLogger != null) {
			messageLogger.close();
		}

		FileUtils.writeStringToFile(new File(args[2]), result.getTree().getNewick(false) + "\n", "UTF-8");
		out.println("wrote tree with " + result.getSeqIds().size() + " of " + taxonomy.seqCount() + " sequences to " + args[2]);
		return 0;
	}

	/**
	 * Prints the guessed canonical rank of one position of a ';'-separated lineage.
	 */
	public int guessRank(String [] args) {
		if (args.length != 4) {
			out.println("arguments should be: taxCode lineage rankLevel");
			return 1;
		}
		TaxCode taxCode;
		int rankLevel;
		try {
			taxCode = new TaxCode(args[1]);
			rankLevel = Integer.parseInt(args[3]);
		} catch (UnknownTaxCodeException utce) {
			out.println(utce.toString() + ". Known codes: " + StringUtils.join(TaxCode.knownCodeNames(), ", "));
			return 1;
		} catch (NumberFormatException nfe) {
			out.println("Bad rank level: " + args[3]);
			return 1;
		}
		String [] ranks = StringUtils.splitPreserveAllTokens(args[2], Taxonomy.LINEAGE_DELIM);
		if (rankLevel < 0 || rankLevel >= ranks.length) {
			out.println("rank level must be between 0 and " + (ranks.length - 1));
			return 1;
		}
		int level = taxCode.guessRankLevel(ranks, rankLevel);
		out.println(ranks[rankLevel] + "\t" + level + "\t" + taxCode.guessRankLevelName(ranks, rankLevel));
		return 0;
	}

	private void reportCorrections(String label, Map<String, String> corrections) {
		for (Map.Entry<String, String> e : corrections.entrySet()) {
			out.println(label + "\t" + e.getKey() + "\t" + e.getValue());
		}
	}

	public static void printHelp() {
		System.out.println("==========================");
		System.out.println("usage: java -jar reftax.jar command options");
		System.out.println("");
		System.out.println("commands");
		System.out.println("---------");
		System.out.println("\tchecktax <taxfile> [autofix] (report or fix ambiguous and unbalanced lineages)");
		System.out.println("\tbuildtree <taxfile> <outfile> [minrank] [maxseqsperleaf] [verbose|json] (write the taxonomy tree as newick)");
		System.out.println("\tguessrank <bac|bot|zoo|vir> <lineage> <ranklevel> (guess the canonical rank of a lineage position)");
		System.out.println("\thelp (print this message)");
	}

	/**
	 * Runs `args[0]` and returns its exit code: 0 on success, 1 for bad arguments or failed commands,
	 * 2 for an unrecognized command.
	 */
	public int run(String [] args) throws IOException {
		if (args.length < 1) {
			printHelp();
			return 1;
		}
		String command = args[0];
		if (command.equals("help") || command.equals("-h") || command.equals("--help")) {
			printHelp();
			return 0;
		}
		_LOG.debug("running command " + command);
		int cmdReturnCode = 0;
		try {
			if (command.equals("checktax")) {
				cmdReturnCode = checkTaxonomy(args);
			} else if (command.equals("buildtree")) {
				cmdReturnCode = buildTree(args);
			} else if (command.equals("guessrank")) {
				cmdReturnCode = guessRank(args);
			} else {
				System.err.println("Unrecognized command \"" + command + "\"");
				cmdReturnCode = 2;
			}
		} catch (DataFormatException dfx) {
			dfx.reportFailedAction(System.err, "Command \"" + command + "\"");
			cmdReturnCode = 1;
		}
		if (cmdReturnCode == 2) {
			printHelp();
		}
		return cmdReturnCode;
	}

	public static void main(String [] args) throws Exception {
		System.exit(new MainRunner().run(args));
	}
}
