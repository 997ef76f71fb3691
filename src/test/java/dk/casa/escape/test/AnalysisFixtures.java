package dk.casa.escape.test;

import dk.casa.escape.analysis.EscapeResult;
import dk.casa.escape.ir.*;
import org.objectweb.asm.Type;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.fail;

/** Types and helpers shared by the escape analysis tests. */
public final class AnalysisFixtures {
	public static final Type OBJECT = Type.getObjectType("java/lang/Object");
	public static final Type STRING = Type.getObjectType("java/lang/String");
	public static final Type THROWABLE = Type.getObjectType("java/lang/Throwable");
	public static final Type REF = Type.getObjectType("test/RefValue");
	public static final Type MUTABLE_SOME = Type.getObjectType("test/MutableSome");
	public static final Type MUTABLE_CONDITION = Type.getObjectType("test/MutableCondition");
	public static final Type VECTOR = Type.getType("[Ltest/MutableCondition;");
	public static final Type TUPLE = Type.getObjectType("test/Tuple");

	private AnalysisFixtures() {}

	/** A closure {@code test/Closure.name} taking arguments of the given types and returning an object */
	public static RoutineBuilder routine(String name, Type... args) {
		return RoutineBuilder.create("test/Closure", name, Type.getMethodDescriptor(OBJECT, args));
	}

	public static RoutineBuilder routine(MethodIdentifier method) {
		return new RoutineBuilder(method);
	}

	public static MethodIdentifier method(String name, Type... args) {
		return MethodIdentifier.of("test/M", name, Type.getMethodDescriptor(OBJECT, args));
	}

	/** The callee's function object, passed as operand 0 of a call */
	public static ValueId function(RoutineBuilder b, MethodIdentifier callee) {
		return b.constant(callee, callee.getOwnerType());
	}

	public static List<ValueId> findAllocations(Routine routine, Type type) {
		List<ValueId> res = new ArrayList<>();
		for(int pc = 0; pc < routine.size(); pc++) {
			Instruction insn = routine.getInstruction(pc);
			if(insn.getOpcode() == Opcode.NEW && insn.getType().equals(type))
				res.add(ValueId.ssa(pc));
		}
		return res;
	}

	public static ValueId findAllocation(Routine routine, Type type) {
		List<ValueId> res = findAllocations(routine, type);
		if(res.isEmpty()) fail("No allocation of " + type + " in " + routine);
		return res.get(0);
	}

	/** Asserts that two results classify every value of the routine identically */
	public static void assertSameClassification(EscapeResult expected, EscapeResult actual) {
		Routine routine = expected.getRoutine();
		for(int i = 0; i < routine.getArgumentCount(); i++)
			assertEquals(expected.getArgument(i), actual.getArgument(i), "Argument " + i);
		for(int pc = 0; pc < routine.size(); pc++)
			assertEquals(expected.getSsaValue(pc), actual.getSsaValue(pc), "Value %" + pc);
	}
}
