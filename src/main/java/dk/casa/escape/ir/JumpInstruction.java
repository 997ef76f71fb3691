package dk.casa.escape.ir;

import com.google.common.collect.ImmutableList;
import org.objectweb.asm.Type;

import java.util.List;
import java.util.stream.Collectors;

/** {@code GOTO} with one target or {@code BRANCH(condition)} with a true and a false target. */
public class JumpInstruction extends Instruction {
	private final ImmutableList<Label> targets;

	public JumpInstruction(Opcode opcode, List<ValueId> operands, List<Label> targets) {
		super(opcode, Type.VOID_TYPE, operands);
		if(opcode != Opcode.GOTO && opcode != Opcode.BRANCH)
			throw new IllegalArgumentException("Not a jump: " + opcode);
		this.targets = ImmutableList.copyOf(targets);
	}

	public ImmutableList<Label> getTargets() {
		return targets;
	}

	@Override
	protected String describe() {
		return targets.stream().map(Label::toString).collect(Collectors.joining(" "));
	}
}
