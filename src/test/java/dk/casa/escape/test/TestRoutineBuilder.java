package dk.casa.escape.test;

import com.google.common.collect.ImmutableList;
import dk.casa.escape.ir.*;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Type;

import static dk.casa.escape.test.AnalysisFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestRoutineBuilder {
	@Test
	public void testArgumentsIncludeSelf() {
		RoutineBuilder b = routine("args", OBJECT, Type.INT_TYPE);
		b.returnNothing();
		Routine r = b.build();

		assertEquals(3, r.getArgumentCount());
		assertEquals(Type.getObjectType("test/Closure"), r.typeOf(ValueId.self()));
		assertEquals(OBJECT, r.typeOf(ValueId.argument(1)));
		assertEquals(Type.INT_TYPE, r.typeOf(ValueId.argument(2)));
	}

	@Test
	public void testBlocksAndSuccessors() {
		RoutineBuilder b = routine("blocks", Type.BOOLEAN_TYPE);
		Label ifTrue = b.newLabel(), join = b.newLabel();
		ValueId x = b.allocate(MUTABLE_SOME);
		b.branch(b.argument(1), ifTrue, join);
		b.mark(ifTrue);
		b.putGlobal("g", x);
		b.mark(join);
		b.returnValue(x);
		Routine r = b.build();

		assertEquals(3, r.getBlocks().size());
		assertEquals(ImmutableList.of(1, 2), r.getBlock(0).getSuccessors());
		// Falls through into the join block
		assertEquals(ImmutableList.of(2), r.getBlock(1).getSuccessors());
		assertTrue(r.getBlock(2).getSuccessors().isEmpty());
		assertEquals(2, r.blockOf(r.size() - 1).index);
	}

	@Test
	public void testUsersAndReturns() {
		RoutineBuilder b = routine("users", OBJECT);
		ValueId a = b.argument(1);
		ValueId t = b.tuple(TUPLE, a, a);
		b.putGlobal("g", a);
		b.returnValue(t);
		Routine r = b.build();

		assertEquals(ImmutableList.of(0, 0, 1), r.getUsers(a));
		assertEquals(1, r.getReturns().size());
		assertEquals(Integer.valueOf(2), r.getReturns().get(0).getFirst());
		assertEquals(t, r.getReturns().get(0).getSecond());
		assertFalse(r.constantOf(t).isPresent());
	}

	@Test
	public void testProtectedRegion() {
		RoutineBuilder b = routine("protected", OBJECT);
		Label handler = b.newLabel();
		b.beginTry(handler);
		b.getField(b.argument(1), "f", OBJECT, true);
		b.endTry();
		b.returnNothing();
		b.mark(handler);
		b.catchException(THROWABLE);
		b.returnNothing();
		Routine r = b.build();

		assertEquals(3, r.getBlocks().size());
		assertTrue(r.getBlock(0).isProtected());
		assertEquals(2, r.getBlock(0).getHandler());
		assertFalse(r.getBlock(1).isProtected());
	}

	@Test
	public void testFallingOffTheEndIsRejected() {
		RoutineBuilder b = routine("fall", OBJECT);
		b.allocate(MUTABLE_SOME);
		assertThrows(IllegalStateException.class, b::build);
	}

	@Test
	public void testUnboundLabelIsRejected() {
		RoutineBuilder b = routine("unbound", Type.BOOLEAN_TYPE);
		Label a = b.newLabel(), c = b.newLabel();
		b.branch(b.argument(1), a, c);
		b.mark(a);
		b.returnNothing();
		assertThrows(IllegalStateException.class, b::build);
	}

	@Test
	public void testDanglingOperandIsRejected() {
		RoutineBuilder b = routine("dangling", OBJECT);
		b.returnValue(ValueId.ssa(42));
		assertThrows(IllegalArgumentException.class, b::build);
	}

	@Test
	public void testWrongArityIsRejected() {
		RoutineBuilder b = routine("arity", OBJECT);
		b.add(new Instruction(Opcode.COMPARE, Type.BOOLEAN_TYPE, b.argument(1)));
		b.returnNothing();
		assertThrows(IllegalArgumentException.class, b::build);
	}

	@Test
	public void testToDot() {
		RoutineBuilder b = routine("dot", OBJECT);
		b.returnValue(b.argument(1));
		String dot = b.build().toDot("dot");
		assertTrue(dot.startsWith("digraph"), dot);
		assertTrue(dot.contains("return"), dot);
	}
}
