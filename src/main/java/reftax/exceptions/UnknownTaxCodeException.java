package reftax.exceptions;

/**
 * Thrown when a nomenclature code name does not match any of the known rank tables.
 */
public class UnknownTaxCodeException extends java.lang.IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	String error;

	public UnknownTaxCodeException(String codeName) {
		super("Unknown taxonomic code: " + codeName);
		error = "Unknown taxonomic code: " + codeName;
	}

	@Override
	public String toString() {
		return error;
	}
}
