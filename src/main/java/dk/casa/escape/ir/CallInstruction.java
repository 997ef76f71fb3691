package dk.casa.escape.ir;

import org.objectweb.asm.Type;

import java.util.List;

/**
 * A call. Operand {@code i} is passed in argument slot {@code i} of the callee, so operand 0
 * is the callee's self value.
 */
public class CallInstruction extends Instruction {
	private final MethodIdentifier target;
	private final boolean dynamic;

	/**
	 * @param target the syntactic target, or null when the call has none
	 * @param dynamic whether the call bypasses normal method resolution
	 */
	public CallInstruction(MethodIdentifier target, boolean dynamic, Type type, List<ValueId> operands) {
		super(Opcode.CALL, type, operands);
		this.target = target;
		this.dynamic = dynamic;
	}

	public MethodIdentifier getTarget() {
		return target;
	}

	public boolean isDynamic() {
		return dynamic;
	}

	@Override
	protected String describe() {
		return (dynamic ? "dynamic " : "") + (target == null ? "?" : target.toString());
	}
}
