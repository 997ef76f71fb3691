package dk.casa.escape.analysis.inter;

import com.google.common.collect.ImmutableList;
import dk.casa.escape.analysis.Element;
import dk.casa.escape.analysis.EscapeElement;

import java.util.Collections;
import java.util.List;

/**
 * What a routine does to its arguments and to the value it returns: one element per argument
 * slot (slot 0 is the self value) and one for the returned value.
 */
public final class CallSummary implements Element<CallSummary> {
	private final ImmutableList<EscapeElement> arguments;
	private final EscapeElement returnValue;

	public CallSummary(List<EscapeElement> arguments, EscapeElement returnValue) {
		this.arguments = ImmutableList.copyOf(arguments);
		this.returnValue = returnValue;
	}

	/** The placeholder used while a recursive routine is being analysed */
	public static CallSummary bottom(int argumentCount) {
		return new CallSummary(Collections.nCopies(argumentCount, EscapeElement.NO_ESCAPE), EscapeElement.NO_ESCAPE);
	}

	public static CallSummary top(int argumentCount) {
		return new CallSummary(Collections.nCopies(argumentCount, EscapeElement.ALL_ESCAPE), EscapeElement.ALL_ESCAPE);
	}

	public ImmutableList<EscapeElement> getArguments() {
		return arguments;
	}

	public int getArgumentCount() {
		return arguments.size();
	}

	/** Element of slot {@code i}; slots past the end reuse the last one, as for a varargs tail */
	public EscapeElement getArgument(int i) {
		if(arguments.isEmpty()) return EscapeElement.ALL_ESCAPE;
		return arguments.get(Math.min(i, arguments.size() - 1));
	}

	public EscapeElement getReturnValue() {
		return returnValue;
	}

	@Override
	public CallSummary merge(CallSummary other) {
		if(equals(other)) return this;

		int n = Math.max(arguments.size(), other.arguments.size());
		ImmutableList.Builder<EscapeElement> args = ImmutableList.builder();
		for(int i = 0; i < n; i++) {
			EscapeElement a = i < arguments.size() ? arguments.get(i) : EscapeElement.NO_ESCAPE;
			EscapeElement b = i < other.arguments.size() ? other.arguments.get(i) : EscapeElement.NO_ESCAPE;
			args.add(a.merge(b));
		}
		return new CallSummary(args.build(), returnValue.merge(other.returnValue));
	}

	@Override
	public boolean equals(Object o) {
		if(o == this) return true;
		if(!(o instanceof CallSummary)) return false;
		CallSummary cs = (CallSummary) o;
		return arguments.equals(cs.arguments) && returnValue.equals(cs.returnValue);
	}

	@Override
	public int hashCode() {
		return arguments.hashCode() + 301 * returnValue.hashCode();
	}

	@Override
	public String toString() {
		return String.format("%s -> %s", arguments, returnValue);
	}
}
