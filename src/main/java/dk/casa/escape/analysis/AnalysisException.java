package dk.casa.escape.analysis;

/** Signals that some part of a routine could not be analysed precisely. */
public class AnalysisException extends Exception {
	public AnalysisException(String message) {
		super(message);
	}

	public AnalysisException(String message, Throwable cause) {
		super(message, cause);
	}
}
