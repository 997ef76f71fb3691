package dk.casa.escape.ir;

/**
 * Identifies a value of a routine: either an argument slot or the result of the
 * instruction at a given program-order position.
 */
public final class ValueId implements Comparable<ValueId> {
	public enum Kind { ARGUMENT, SSA }

	/** Slot of the routine's own self/closure value */
	public static final int SELF_SLOT = 0;

	public final Kind kind;
	public final int index;

	private ValueId(Kind kind, int index) {
		if(index < 0) throw new IllegalArgumentException("Negative value index: " + index);
		this.kind = kind;
		this.index = index;
	}

	public static ValueId argument(int slot) {
		return new ValueId(Kind.ARGUMENT, slot);
	}

	public static ValueId ssa(int pc) {
		return new ValueId(Kind.SSA, pc);
	}

	public static ValueId self() {
		return argument(SELF_SLOT);
	}

	public boolean isArgument() {
		return kind == Kind.ARGUMENT;
	}

	public boolean isSsa() {
		return kind == Kind.SSA;
	}

	@Override
	public int compareTo(ValueId o) {
		if(kind != o.kind) return kind.compareTo(o.kind);
		return Integer.compare(index, o.index);
	}

	@Override
	public boolean equals(Object o) {
		if(this == o) return true;
		if(!(o instanceof ValueId)) return false;
		ValueId other = (ValueId) o;
		return kind == other.kind && index == other.index;
	}

	@Override
	public int hashCode() {
		return (kind == Kind.ARGUMENT ? 1 : 31) * (index + 1);
	}

	@Override
	public String toString() {
		return (isArgument() ? "_" : "%") + index;
	}
}
