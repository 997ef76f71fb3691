package dk.casa.escape.analysis;

import dk.casa.escape.ir.CallInstruction;

/** Computes the escape effect of a call instruction. */
@FunctionalInterface
public interface CallHandler {
	void handleCall(int pc, CallInstruction call, EscapeState state);

	/** Treats every call as unresolvable */
	CallHandler CONSERVATIVE = EscapeInterpreter::escapeEverything;
}
