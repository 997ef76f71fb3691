package dk.casa.escape.ir;

/** A jump target used while building a routine. Bound to a basic block by {@link RoutineBuilder#mark(Label)}. */
public class Label {
	int block = -1;

	public boolean isBound() {
		return block >= 0;
	}

	public int getBlock() {
		if(!isBound()) throw new IllegalStateException("Label is not bound to a block");
		return block;
	}

	@Override
	public String toString() {
		return isBound() ? "#" + block : "#?";
	}
}
