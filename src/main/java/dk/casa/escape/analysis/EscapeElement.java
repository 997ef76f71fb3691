package dk.casa.escape.analysis;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * How far the referent of a value may escape the routine being analysed.
 *
 * <pre>
 *   NoEscape  ⊑  ThrownEscape, ReturnEscape  ⊑  GlobalEscape  ⊑  AllEscape
 * </pre>
 *
 * Return escape carries the set of return sites the value may leave through. Site
 * {@link #ARGUMENT_SITE} stands for "visible to the caller as an argument", the
 * {@code RETURN} instruction at program index {@code pc} is site {@code pc + 1}.
 * Global escape implies thrown escape; all escape absorbs everything.
 */
public final class EscapeElement implements Element<EscapeElement> {
	public static final int ARGUMENT_SITE = 0;

	public static final EscapeElement NO_ESCAPE = new EscapeElement(false, ImmutableSortedSet.of(), false, false);
	public static final EscapeElement THROWN_ESCAPE = new EscapeElement(true, ImmutableSortedSet.of(), false, false);
	public static final EscapeElement GLOBAL_ESCAPE = new EscapeElement(true, ImmutableSortedSet.of(), true, false);
	public static final EscapeElement ALL_ESCAPE = new EscapeElement(true, ImmutableSortedSet.of(), true, true);

	private final boolean thrown;
	private final ImmutableSortedSet<Integer> returnSites;
	private final boolean global;
	private final boolean all;

	private EscapeElement(boolean thrown, ImmutableSortedSet<Integer> returnSites, boolean global, boolean all) {
		this.thrown = thrown;
		this.returnSites = returnSites;
		this.global = global;
		this.all = all;
	}

	private static EscapeElement of(boolean thrown, ImmutableSortedSet<Integer> returnSites, boolean global, boolean all) {
		if(all) return ALL_ESCAPE;
		if(global) thrown = true;
		if(returnSites.isEmpty()) {
			if(global) return GLOBAL_ESCAPE;
			if(thrown) return THROWN_ESCAPE;
			return NO_ESCAPE;
		}
		return new EscapeElement(thrown, returnSites, global, false);
	}

	public static EscapeElement bottom() {
		return NO_ESCAPE;
	}

	public static EscapeElement top() {
		return ALL_ESCAPE;
	}

	public static EscapeElement returnEscape(Collection<Integer> sites) {
		if(sites.isEmpty()) throw new IllegalArgumentException("Return escape needs at least one site");
		return of(false, ImmutableSortedSet.copyOf(sites), false, false);
	}

	public static EscapeElement returnEscape(Integer... sites) {
		return returnEscape(Arrays.asList(sites));
	}

	/** Return escape through the {@code RETURN} instruction at {@code pc} */
	public static EscapeElement returnedAt(int pc) {
		return returnEscape(pc + 1);
	}

	/** Seed for arguments, which the caller can always observe */
	public static EscapeElement argumentEscape() {
		return returnEscape(ARGUMENT_SITE);
	}

	@Override
	public EscapeElement merge(EscapeElement other) {
		if(this == other || other == NO_ESCAPE || all) return this;
		if(this == NO_ESCAPE || other.all) return other;

		ImmutableSortedSet<Integer> sites = returnSites.containsAll(other.returnSites) ? returnSites
				: other.returnSites.containsAll(returnSites) ? other.returnSites
				: ImmutableSortedSet.copyOf(Sets.union(returnSites, other.returnSites));
		EscapeElement res = of(thrown || other.thrown, sites, global || other.global, false);
		if(res.equals(this)) return this;
		if(res.equals(other)) return other;
		return res;
	}

	@Override
	public boolean leq(EscapeElement other) {
		if(other.all) return true;
		if(all) return false;
		return (!thrown || other.thrown) && (!global || other.global) && other.returnSites.containsAll(returnSites);
	}

	/** This element without its return sites, as seen from the other side of a call boundary */
	public EscapeElement withoutReturnSites() {
		if(all || returnSites.isEmpty()) return this;
		return of(thrown, ImmutableSortedSet.of(), global, false);
	}

	/** Whether the value may leave through an actual exit point, not just by being an argument */
	public boolean isReturnedByRoutine() {
		if(all) return true;
		return returnSites.size() > (returnSites.contains(ARGUMENT_SITE) ? 1 : 0);
	}

	public ImmutableSortedSet<Integer> getReturnSites() {
		return returnSites;
	}

	public boolean isNoEscape() {
		return this == NO_ESCAPE;
	}

	public boolean hasReturnEscape() {
		return all || global || !returnSites.isEmpty();
	}

	public boolean hasThrownEscape() {
		return thrown;
	}

	public boolean hasGlobalEscape() {
		return global;
	}

	public boolean hasAllEscape() {
		return all;
	}

	@Override
	public boolean equals(Object o) {
		if(this == o) return true;
		if(!(o instanceof EscapeElement)) return false;
		EscapeElement other = (EscapeElement) o;
		return thrown == other.thrown && global == other.global && all == other.all
				&& returnSites.equals(other.returnSites);
	}

	@Override
	public int hashCode() {
		return (thrown ? 3 : 1) * (global ? 7 : 1) * (all ? 11 : 1) * (returnSites.hashCode() + 13);
	}

	@Override
	public String toString() {
		if(all) return "AllEscape";
		if(this == NO_ESCAPE) return "NoEscape";

		List<String> parts = new ArrayList<>();
		if(global) parts.add("GlobalEscape");
		else if(thrown) parts.add("ThrownEscape");
		if(!returnSites.isEmpty())
			parts.add(returnSites.stream().map(s -> s == ARGUMENT_SITE ? "arg" : String.valueOf(s))
					.collect(Collectors.joining(",", "ReturnEscape{", "}")));
		return String.join("+", parts);
	}
}
