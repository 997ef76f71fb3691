package dk.casa.escape.analysis.inter;

import dk.casa.escape.analysis.AnalysisException;
import dk.casa.escape.ir.CallInstruction;

/** The callee of a call cannot be summarised, so the call is treated conservatively. */
public class UnanalyzableCallException extends AnalysisException {
	public UnanalyzableCallException(CallInstruction call, String message) {
		super("Cannot analyse " + call + ": " + message);
	}

	public UnanalyzableCallException(CallInstruction call, String message, Throwable cause) {
		super("Cannot analyse " + call + ": " + message, cause);
	}
}
