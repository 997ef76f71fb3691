package dk.casa.escape.ir;

import com.google.common.collect.ImmutableList;
import org.objectweb.asm.Type;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A typed instruction of the routine IR. The result of the instruction at program
 * index {@code pc} is identified by {@link ValueId#ssa(int)}.
 */
public class Instruction {
	private final Opcode opcode;
	private final Type type;
	private final ImmutableList<ValueId> operands;

	public Instruction(Opcode opcode, Type type, List<ValueId> operands) {
		this.opcode = Objects.requireNonNull(opcode);
		this.type = Objects.requireNonNull(type);
		this.operands = ImmutableList.copyOf(operands);
	}

	public Instruction(Opcode opcode, Type type, ValueId... operands) {
		this(opcode, type, ImmutableList.copyOf(operands));
	}

	public Opcode getOpcode() {
		return opcode;
	}

	/** Static type of the result, {@link Type#VOID_TYPE} when there is no meaningful result */
	public Type getType() {
		return type;
	}

	public ImmutableList<ValueId> getOperands() {
		return operands;
	}

	public ValueId getOperand(int i) {
		return operands.get(i);
	}

	protected String describe() {
		return "";
	}

	@Override
	public String toString() {
		String args = operands.stream().map(ValueId::toString).collect(Collectors.joining(", "));
		String extra = describe();
		return opcode.name().toLowerCase() + (extra.isEmpty() ? "" : " " + extra) + "(" + args + ")::" + type.getDescriptor();
	}
}
