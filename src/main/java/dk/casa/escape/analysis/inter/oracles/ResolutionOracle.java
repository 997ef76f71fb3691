package dk.casa.escape.analysis.inter.oracles;

import dk.casa.escape.ir.CallInstruction;
import dk.casa.escape.ir.MethodIdentifier;
import dk.casa.escape.ir.Routine;

import java.util.Optional;
import java.util.Set;

@FunctionalInterface
public interface ResolutionOracle {
	/**
	 * The routines the call may dispatch to. An empty optional or an empty set means the call
	 * cannot be narrowed to a finite set of candidates.
	 */
	Optional<Set<MethodIdentifier>> resolveCandidates(Routine caller, CallInstruction call);
}
