package dk.casa.escape.analysis.inter.oracles;

import dk.casa.escape.ir.CallInstruction;
import dk.casa.escape.ir.MethodIdentifier;
import dk.casa.escape.ir.Routine;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;

/** Trusts the syntactic target of every call that goes through normal resolution. */
public class DirectCallOracle implements ResolutionOracle {
	@Override
	public Optional<Set<MethodIdentifier>> resolveCandidates(Routine caller, CallInstruction call) {
		if(call.isDynamic() || call.getTarget() == null) return Optional.empty();
		return Optional.of(Collections.singleton(call.getTarget()));
	}
}
