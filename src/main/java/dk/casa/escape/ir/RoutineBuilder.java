package dk.casa.escape.ir;

import com.google.common.collect.ImmutableList;
import org.objectweb.asm.Type;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Assembles a {@link Routine} instruction by instruction. A new basic block starts at every
 * {@link #mark(Label) marked label}, after every terminator and at the boundaries of
 * protected regions. A block that does not end in a terminator falls through to the next one.
 */
public class RoutineBuilder {
	public static final Type OBJECT = Type.getObjectType("java/lang/Object");

	private final MethodIdentifier method;
	private final List<Type> argumentTypes = new ArrayList<>();
	private final List<Instruction> instructions = new ArrayList<>();
	private final List<BlockDraft> drafts = new ArrayList<>();
	private Label currentHandler = null;

	private static class BlockDraft {
		final int start;
		Label handler;

		BlockDraft(int start, Label handler) {
			this.start = start;
			this.handler = handler;
		}
	}

	public RoutineBuilder(MethodIdentifier method, Type selfType) {
		this.method = method;
		argumentTypes.add(selfType);
		argumentTypes.addAll(Arrays.asList(method.getArgumentTypes()));
		drafts.add(new BlockDraft(0, null));
	}

	public RoutineBuilder(MethodIdentifier method) {
		this(method, method.getOwnerType());
	}

	public static RoutineBuilder create(String owner, String name, String desc) {
		return new RoutineBuilder(MethodIdentifier.of(owner, name, desc));
	}

	public MethodIdentifier getMethod() {
		return method;
	}

	public ValueId self() {
		return ValueId.self();
	}

	public ValueId argument(int slot) {
		checkArgument(slot >= 0 && slot < argumentTypes.size(), "No argument slot %s in %s", slot, method);
		return ValueId.argument(slot);
	}

	// Block structure

	private BlockDraft current() {
		return drafts.get(drafts.size() - 1);
	}

	private boolean currentIsEmpty() {
		return current().start == instructions.size();
	}

	private void startBlock() {
		if(currentIsEmpty()) current().handler = currentHandler;
		else drafts.add(new BlockDraft(instructions.size(), currentHandler));
	}

	public Label newLabel() {
		return new Label();
	}

	public void mark(Label label) {
		checkState(!label.isBound(), "Label is already bound");
		startBlock();
		label.block = drafts.size() - 1;
	}

	/** Blocks started until {@link #endTry()} send their exceptions to {@code handler} */
	public void beginTry(Label handler) {
		checkState(currentHandler == null, "Nested protected regions are not supported");
		currentHandler = handler;
		startBlock();
	}

	public void endTry() {
		checkState(currentHandler != null, "Not inside a protected region");
		currentHandler = null;
		startBlock();
	}

	// Instructions

	public ValueId add(Instruction insn) {
		if(!currentIsEmpty() && instructions.get(instructions.size() - 1).getOpcode().isTerminator())
			startBlock();
		instructions.add(insn);
		return ValueId.ssa(instructions.size() - 1);
	}

	public ValueId constant(Object value, Type type) {
		return add(new ConstantInstruction(value, type));
	}

	/** The "nothing" singleton */
	public ValueId nothing() {
		return constant(null, Type.VOID_TYPE);
	}

	public ValueId allocate(Type type, ValueId... fields) {
		return add(new Instruction(Opcode.NEW, type, fields));
	}

	public ValueId tuple(Type type, ValueId... elements) {
		return add(new Instruction(Opcode.TUPLE, type, elements));
	}

	public ValueId phi(Type type, ValueId... incoming) {
		return add(new Instruction(Opcode.PHI, type, incoming));
	}

	public ValueId pi(ValueId value, Type narrowed) {
		return add(new Instruction(Opcode.PI, narrowed, value));
	}

	public ValueId catchException(Type type) {
		return add(new Instruction(Opcode.CATCH, type));
	}

	public ValueId getField(ValueId object, String field, Type type, boolean mayThrow) {
		return add(new FieldInstruction(Opcode.FIELD_READ, field, mayThrow, type, ImmutableList.of(object)));
	}

	public void putField(ValueId object, String field, ValueId value, boolean mayThrow) {
		add(new FieldInstruction(Opcode.FIELD_WRITE, field, mayThrow, Type.VOID_TYPE, ImmutableList.of(object, value)));
	}

	public void putGlobal(String name, ValueId value) {
		add(new FieldInstruction(Opcode.GLOBAL_STORE, name, false, Type.VOID_TYPE, ImmutableList.of(value)));
	}

	public ValueId compare(ValueId a, ValueId b) {
		return add(new Instruction(Opcode.COMPARE, Type.BOOLEAN_TYPE, a, b));
	}

	public ValueId sizeOf(ValueId value) {
		return add(new Instruction(Opcode.SIZEOF, Type.INT_TYPE, value));
	}

	public ValueId select(ValueId condition, ValueId ifTrue, ValueId ifFalse, Type type) {
		return add(new Instruction(Opcode.SELECT, type, condition, ifTrue, ifFalse));
	}

	public ValueId isDefined(ValueId value) {
		return add(new Instruction(Opcode.IS_DEFINED, Type.BOOLEAN_TYPE, value));
	}

	public ValueId preserveBegin(ValueId... values) {
		return add(new Instruction(Opcode.PRESERVE_BEGIN, OBJECT, values));
	}

	public void preserveEnd(ValueId token) {
		add(new Instruction(Opcode.PRESERVE_END, Type.VOID_TYPE, token));
	}

	/** A call whose operands include the callee's self value at position 0 */
	public ValueId call(MethodIdentifier target, Type type, ValueId... operands) {
		return add(new CallInstruction(target, false, type, Arrays.asList(operands)));
	}

	/** A call that bypasses normal method resolution */
	public ValueId callDynamic(MethodIdentifier target, Type type, ValueId... operands) {
		return add(new CallInstruction(target, true, type, Arrays.asList(operands)));
	}

	public ValueId foreignCall(Type type, ValueId... operands) {
		return add(new Instruction(Opcode.FOREIGN_CALL, type, operands));
	}

	// Terminators

	public void jump(Label target) {
		add(new JumpInstruction(Opcode.GOTO, Collections.emptyList(), ImmutableList.of(target)));
	}

	public void branch(ValueId condition, Label ifTrue, Label ifFalse) {
		add(new JumpInstruction(Opcode.BRANCH, ImmutableList.of(condition), ImmutableList.of(ifTrue, ifFalse)));
	}

	public void returnValue(ValueId value) {
		add(new Instruction(Opcode.RETURN, Type.VOID_TYPE, value));
	}

	public void returnNothing() {
		returnValue(nothing());
	}

	public void throwValue(ValueId value) {
		add(new Instruction(Opcode.THROW, Type.VOID_TYPE, value));
	}

	public Routine build() {
		checkState(!instructions.isEmpty(), "Routine %s has no instructions", method);
		checkState(currentHandler == null, "Unterminated protected region");

		List<BlockDraft> blocks = new ArrayList<>(drafts);
		if(currentIsEmpty()) {
			int last = blocks.size() - 1;
			checkState(!isTarget(last), "Label bound after the last instruction");
			blocks.remove(last);
		}

		List<BasicBlock> result = new ArrayList<>();
		for(int i = 0; i < blocks.size(); i++) {
			BlockDraft draft = blocks.get(i);
			int end = i + 1 < blocks.size() ? blocks.get(i + 1).start : instructions.size();
			Instruction last = instructions.get(end - 1);

			ImmutableList<Integer> successors;
			if(last instanceof JumpInstruction) {
				ImmutableList.Builder<Integer> succ = ImmutableList.builder();
				for(Label target : ((JumpInstruction) last).getTargets()) {
					checkState(target.isBound(), "Jump to unbound label at %s", end - 1);
					succ.add(target.getBlock());
				}
				successors = succ.build();
			} else if(last.getOpcode() == Opcode.RETURN || last.getOpcode() == Opcode.THROW)
				successors = ImmutableList.of();
			else {
				checkState(i + 1 < blocks.size(), "Control falls off the end of %s", method);
				successors = ImmutableList.of(i + 1);
			}

			int handler = -1;
			if(draft.handler != null) {
				checkState(draft.handler.isBound(), "Unbound exception handler");
				handler = draft.handler.getBlock();
			}
			result.add(new BasicBlock(i, draft.start, end, successors, handler));
		}

		Routine routine = new Routine(method, argumentTypes, instructions, result);
		validate(routine);
		return routine;
	}

	private boolean isTarget(int draft) {
		for(BlockDraft other : drafts)
			if(other.handler != null && other.handler.block == draft) return true;
		for(Instruction insn : instructions)
			if(insn instanceof JumpInstruction)
				for(Label label : ((JumpInstruction) insn).getTargets())
					if(label.block == draft) return true;
		return false;
	}

	private static void validate(Routine routine) {
		for(int pc = 0; pc < routine.size(); pc++) {
			Instruction insn = routine.getInstruction(pc);
			for(ValueId operand : insn.getOperands())
				checkArgument(routine.contains(operand), "Dangling operand %s at %s", operand, pc);

			int arity = insn.getOperands().size();
			switch(insn.getOpcode()) {
				case RETURN:
				case THROW:
				case BRANCH:
				case PI:
				case FIELD_READ:
				case GLOBAL_STORE:
				case SIZEOF:
				case IS_DEFINED:
				case PRESERVE_END:
					checkArgument(arity == 1, "%s expects one operand at %s", insn.getOpcode(), pc);
					break;
				case FIELD_WRITE:
				case COMPARE:
					checkArgument(arity == 2, "%s expects two operands at %s", insn.getOpcode(), pc);
					break;
				case SELECT:
					checkArgument(arity == 3, "SELECT expects three operands at %s", pc);
					break;
				case CONSTANT:
				case CATCH:
					checkArgument(arity == 0, "%s takes no operands at %s", insn.getOpcode(), pc);
					break;
				default:
					break;
			}
		}
	}
}
