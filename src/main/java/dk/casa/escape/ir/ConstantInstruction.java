package dk.casa.escape.ir;

import org.objectweb.asm.Type;

/** Materialises a compile-time constant, possibly a quoted heap object. */
public class ConstantInstruction extends Instruction {
	private final Object value;

	public ConstantInstruction(Object value, Type type) {
		super(Opcode.CONSTANT, type);
		this.value = value;
	}

	/** The constant, null for the "nothing" constant */
	public Object getValue() {
		return value;
	}

	@Override
	protected String describe() {
		return String.valueOf(value);
	}
}
