package dk.casa.escape.analysis;

import dk.casa.escape.ir.*;
import dk.casa.escape.utils.Counter;

import java.util.List;
import java.util.Optional;

/** The escape effect of each kind of instruction. */
public class EscapeInterpreter {
	private final Routine routine;
	private final EscapeState state;
	private final CallHandler callHandler;
	private final Counter<String> statistics;

	public EscapeInterpreter(EscapeState state, CallHandler callHandler, Counter<String> statistics) {
		this.routine = state.getRoutine();
		this.state = state;
		this.callHandler = callHandler;
		this.statistics = statistics;
	}

	public void execute(int pc) {
		Instruction insn = routine.getInstruction(pc);
		ValueId result = ValueId.ssa(pc);
		List<ValueId> operands = insn.getOperands();

		switch(insn.getOpcode()) {
			case RETURN:
				state.merge(operands.get(0), EscapeElement.returnedAt(pc));
				break;

			case THROW:
				state.merge(operands.get(0), EscapeElement.THROWN_ESCAPE);
				break;

			case GLOBAL_STORE:
				state.merge(operands.get(0), EscapeElement.GLOBAL_ESCAPE);
				break;

			case FIELD_READ: {
				ValueId object = operands.get(0);
				if(((FieldInstruction) insn).mayThrow())
					state.merge(object, EscapeElement.THROWN_ESCAPE);
				// A bit-typed field cannot leak the object it was read from
				if(!state.isExempt(result))
					state.merge(object, state.get(result));
				break;
			}

			case FIELD_WRITE: {
				ValueId object = operands.get(0);
				if(((FieldInstruction) insn).mayThrow())
					state.merge(object, EscapeElement.THROWN_ESCAPE);
				state.merge(operands.get(1), state.get(object));
				break;
			}

			case NEW:
			case TUPLE:
			case PHI:
			case PI:
				// Exempt operands are skipped by the state
				EscapeElement element = state.get(result);
				for(ValueId operand : operands) state.merge(operand, element);
				break;

			case SELECT: {
				EscapeElement selected = state.get(result);
				Optional<Boolean> condition = constantCondition(operands.get(0));
				if(condition.isPresent())
					state.merge(condition.get() ? operands.get(1) : operands.get(2), selected);
				else {
					state.merge(operands.get(1), selected);
					state.merge(operands.get(2), selected);
				}
				break;
			}

			case SIZEOF:
				if(!routine.constantOf(operands.get(0)).isPresent())
					state.merge(operands.get(0), EscapeElement.THROWN_ESCAPE);
				break;

			case COMPARE:
			case IS_DEFINED:
			case CONSTANT:
			case CATCH:
			case PRESERVE_BEGIN:
			case PRESERVE_END:
			case NOP:
			case GOTO:
			case BRANCH:
				break;

			case CALL:
				callHandler.handleCall(pc, (CallInstruction) insn, state);
				break;

			default:
				statistics.add("conservative." + insn.getOpcode().name().toLowerCase());
				for(ValueId operand : operands) state.merge(operand, EscapeElement.ALL_ESCAPE);
				break;
		}
	}

	/** Whether the instruction at {@code pc} may transfer control to an exception handler */
	public boolean mayThrow(int pc) {
		Instruction insn = routine.getInstruction(pc);
		switch(insn.getOpcode()) {
			case FIELD_READ:
			case FIELD_WRITE:
				return ((FieldInstruction) insn).mayThrow();

			case SIZEOF:
				return !routine.constantOf(insn.getOperand(0)).isPresent();

			case RETURN:
			case GLOBAL_STORE:
			case NEW:
			case TUPLE:
			case PHI:
			case PI:
			case SELECT:
			case COMPARE:
			case IS_DEFINED:
			case CONSTANT:
			case CATCH:
			case PRESERVE_BEGIN:
			case PRESERVE_END:
			case NOP:
			case GOTO:
			case BRANCH:
				return false;

			default:
				return true;
		}
	}

	private Optional<Boolean> constantCondition(ValueId condition) {
		return routine.constantOf(condition)
				.map(ConstantInstruction::getValue)
				.filter(Boolean.class::isInstance)
				.map(Boolean.class::cast);
	}

	/** The fallback for calls nothing is known about: every operand and the result escape */
	public static void escapeEverything(int pc, Instruction insn, EscapeState state) {
		for(ValueId operand : insn.getOperands()) state.merge(operand, EscapeElement.ALL_ESCAPE);
		state.merge(ValueId.ssa(pc), EscapeElement.ALL_ESCAPE);
	}
}
