package dk.casa.escape.ir;

public enum Opcode {
	// Values
	CONSTANT,
	NEW,
	TUPLE,
	PHI,
	PI,
	CATCH,

	// Heap and globals
	FIELD_READ,
	FIELD_WRITE,
	GLOBAL_STORE,

	// Builtins
	COMPARE,
	SIZEOF,
	SELECT,
	IS_DEFINED,
	PRESERVE_BEGIN,
	PRESERVE_END,
	NOP,

	// Calls
	CALL,
	FOREIGN_CALL,
	INTRINSIC,

	// Terminators
	GOTO,
	BRANCH,
	RETURN,
	THROW;

	public boolean isTerminator() {
		switch(this) {
			case GOTO:
			case BRANCH:
			case RETURN:
			case THROW:
				return true;
			default:
				return false;
		}
	}
}
