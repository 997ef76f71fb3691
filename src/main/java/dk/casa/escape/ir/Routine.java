package dk.casa.escape.ir;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import dk.casa.escape.utils.Dotable;
import org.apache.commons.math3.util.Pair;
import org.objectweb.asm.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * The body of a routine as handed over by the compiler: typed instructions in program order
 * grouped into basic blocks. Argument slot 0 holds the routine's self value.
 */
public class Routine implements Dotable {
	private final MethodIdentifier method;
	private final ImmutableList<Type> argumentTypes;
	private final ImmutableList<Instruction> instructions;
	private final ImmutableList<BasicBlock> blocks;

	private final int[] blockOf;
	private final ImmutableListMultimap<ValueId, Integer> users;

	Routine(MethodIdentifier method, List<Type> argumentTypes, List<Instruction> instructions, List<BasicBlock> blocks) {
		this.method = method;
		this.argumentTypes = ImmutableList.copyOf(argumentTypes);
		this.instructions = ImmutableList.copyOf(instructions);
		this.blocks = ImmutableList.copyOf(blocks);

		blockOf = new int[instructions.size()];
		for(BasicBlock block : blocks)
			for(int pc = block.start; pc < block.end; pc++)
				blockOf[pc] = block.index;

		ImmutableListMultimap.Builder<ValueId, Integer> usersBuilder = ImmutableListMultimap.builder();
		for(int pc = 0; pc < instructions.size(); pc++)
			for(ValueId operand : instructions.get(pc).getOperands())
				usersBuilder.put(operand, pc);
		users = usersBuilder.build();
	}

	public MethodIdentifier getMethod() {
		return method;
	}

	public ImmutableList<Type> getArgumentTypes() {
		return argumentTypes;
	}

	/** Number of argument slots, including the self slot */
	public int getArgumentCount() {
		return argumentTypes.size();
	}

	public ImmutableList<Instruction> getInstructions() {
		return instructions;
	}

	public Instruction getInstruction(int pc) {
		return instructions.get(pc);
	}

	public int size() {
		return instructions.size();
	}

	public ImmutableList<BasicBlock> getBlocks() {
		return blocks;
	}

	public BasicBlock getBlock(int index) {
		return blocks.get(index);
	}

	public BasicBlock blockOf(int pc) {
		return blocks.get(blockOf[pc]);
	}

	public boolean contains(ValueId id) {
		return id.isArgument() ? id.index < argumentTypes.size() : id.index < instructions.size();
	}

	public Type typeOf(ValueId id) {
		if(!contains(id))
			throw new IllegalArgumentException("Value " + id + " does not belong to " + method);
		return id.isArgument() ? argumentTypes.get(id.index) : instructions.get(id.index).getType();
	}

	/** Program indices of the instructions that take {@code id} as an operand */
	public ImmutableList<Integer> getUsers(ValueId id) {
		return users.get(id);
	}

	public Optional<Instruction> definitionOf(ValueId id) {
		if(!id.isSsa() || !contains(id)) return Optional.empty();
		return Optional.of(instructions.get(id.index));
	}

	/** The value of {@code id} when it is defined by a {@link Opcode#CONSTANT} instruction */
	public Optional<ConstantInstruction> constantOf(ValueId id) {
		return definitionOf(id)
				.filter(ConstantInstruction.class::isInstance)
				.map(ConstantInstruction.class::cast);
	}

	/** All exit points as pairs of the {@link Opcode#RETURN} index and the returned value */
	public List<Pair<Integer, ValueId>> getReturns() {
		List<Pair<Integer, ValueId>> res = new ArrayList<>();
		for(int pc = 0; pc < instructions.size(); pc++) {
			Instruction insn = instructions.get(pc);
			if(insn.getOpcode() == Opcode.RETURN)
				res.add(new Pair<>(pc, insn.getOperand(0)));
		}
		return res;
	}

	@Override
	public String toDot(String label) {
		return toDot(label, pc -> "");
	}

	/** Renders the CFG with an extra annotation per instruction */
	public String toDot(String label, IntFunction<String> annotate) {
		StringBuilder builder = new StringBuilder();
		builder.append("digraph cfg {\n");
		builder.append(String.format("label=\"%s\";\n", Dotable.escape(label)));
		builder.append("node [shape=box];\n\n");

		for(BasicBlock block : blocks) {
			StringBuilder text = new StringBuilder("#" + block.index + "\\l");
			for(int pc = block.start; pc < block.end; pc++) {
				String extra = annotate.apply(pc);
				text.append(Dotable.escape(String.format("%%%d = %s", pc, instructions.get(pc))));
				if(!extra.isEmpty()) text.append("  ").append(Dotable.escape(extra));
				text.append("\\l");
			}
			builder.append(block.index).append(" [label=\"").append(text).append("\"]\n");
			for(int succ : block.getSuccessors()) builder.append(block.index).append(" -> ").append(succ).append("\n");
			if(block.isProtected())
				builder.append(block.index).append(" -> ").append(block.getHandler()).append(" [style=dashed]\n");
		}

		builder.append("}\n");
		return builder.toString();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(method.toString()).append('\n');
		for(BasicBlock block : blocks) {
			sb.append(block).append('\n');
			for(int pc = block.start; pc < block.end; pc++)
				sb.append(String.format("  %%%d = %s%n", pc, instructions.get(pc)));
		}
		return sb.toString();
	}
}
