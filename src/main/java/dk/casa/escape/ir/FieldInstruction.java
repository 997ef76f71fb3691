package dk.casa.escape.ir;

import org.objectweb.asm.Type;

import java.util.List;

/**
 * Field reads and writes and stores to global variables.
 * Operands: {@code FIELD_READ(object)}, {@code FIELD_WRITE(object, value)}, {@code GLOBAL_STORE(value)}.
 */
public class FieldInstruction extends Instruction {
	private final String field;
	private final boolean mayThrow;

	/**
	 * @param mayThrow whether the access can fail because the object is not statically known to have the field
	 */
	public FieldInstruction(Opcode opcode, String field, boolean mayThrow, Type type, List<ValueId> operands) {
		super(opcode, type, operands);
		switch(opcode) {
			case FIELD_READ:
			case FIELD_WRITE:
			case GLOBAL_STORE:
				break;
			default:
				throw new IllegalArgumentException("Not a field instruction: " + opcode);
		}
		this.field = field;
		this.mayThrow = mayThrow;
	}

	public String getField() {
		return field;
	}

	public boolean mayThrow() {
		return mayThrow;
	}

	@Override
	protected String describe() {
		return (mayThrow ? "?" : "") + field;
	}
}
