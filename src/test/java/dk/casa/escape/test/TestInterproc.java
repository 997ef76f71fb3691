package dk.casa.escape.test;

import dk.casa.escape.analysis.EscapeAnalysisConfig;
import dk.casa.escape.analysis.EscapeResult;
import dk.casa.escape.analysis.inter.*;
import dk.casa.escape.analysis.inter.oracles.DirectCallOracle;
import dk.casa.escape.analysis.inter.oracles.DispatchTableOracle;
import dk.casa.escape.analysis.inter.oracles.ResolutionOracle;
import dk.casa.escape.ir.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Type;

import java.util.Collections;
import java.util.Optional;

import static dk.casa.escape.test.AnalysisFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestInterproc {
	private static final MethodIdentifier GLOBAL_ESCAPE = method("f_global_escape", OBJECT);
	private static final MethodIdentifier NO_ESCAPE = method("f_no_escape_simple", OBJECT);
	private static final MethodIdentifier RETURN_ESCAPE = method("f_return_escape", OBJECT);
	private static final MethodIdentifier NO_RETURN_ESCAPE = method("f_no_return_escape", OBJECT);
	private static final MethodIdentifier RETURN_FIELD = method("f_return_field", OBJECT);
	private static final MethodIdentifier UNION_SPLIT = method("unionsplit", OBJECT);
	private static final MethodIdentifier UNION_NOTHING = method("unionsplit_nothing", OBJECT);
	private static final MethodIdentifier UNION_INT = method("unionsplit_int", Type.INT_TYPE);
	private static final MethodIdentifier EXPLODES = method("explodes", OBJECT);
	private static final MethodIdentifier BOOM = method("boom", OBJECT);

	private RoutineRepository repository;

	@BeforeEach
	public void setUp() {
		repository = new RoutineRepository().registerAll(
				globalEscape(), noEscape(), returnEscape(), noReturnEscape(), returnField(),
				unionNothing(), unionInt(), explodes());
	}

	private static Routine globalEscape() {
		RoutineBuilder b = routine(GLOBAL_ESCAPE);
		b.putGlobal("xx", b.argument(1));
		b.returnValue(b.argument(1));
		return b.build();
	}

	private static Routine noEscape() {
		RoutineBuilder b = routine(NO_ESCAPE);
		b.returnNothing();
		return b.build();
	}

	private static Routine returnEscape() {
		RoutineBuilder b = routine(RETURN_ESCAPE);
		b.foreignCall(Type.VOID_TYPE, b.constant("hi", STRING));
		b.returnValue(b.argument(1));
		return b.build();
	}

	private static Routine noReturnEscape() {
		RoutineBuilder b = routine(NO_RETURN_ESCAPE);
		b.foreignCall(Type.VOID_TYPE, b.constant("hi", STRING));
		b.returnValue(b.constant("hi", STRING));
		return b.build();
	}

	private static Routine returnField() {
		RoutineBuilder b = routine(RETURN_FIELD);
		b.returnValue(b.getField(b.argument(1), "x", OBJECT, false));
		return b.build();
	}

	private static Routine unionNothing() {
		RoutineBuilder b = routine(UNION_NOTHING);
		b.returnValue(b.constant("nothing", STRING));
		return b.build();
	}

	private static Routine unionInt() {
		RoutineBuilder b = routine(UNION_INT);
		ValueId sum = b.add(new Instruction(Opcode.INTRINSIC, Type.INT_TYPE, b.argument(1), b.constant(10, Type.INT_TYPE)));
		b.returnValue(sum);
		return b.build();
	}

	private static Routine explodes() {
		RoutineBuilder b = routine(EXPLODES);
		b.returnValue(b.call(BOOM, OBJECT, function(b, BOOM), b.argument(1)));
		return b.build();
	}

	/** Allocates an object, passes it to {@code callee} and optionally returns the call result */
	private static Routine caller(MethodIdentifier callee, boolean returnResult) {
		RoutineBuilder b = routine("caller_" + callee.name + (returnResult ? "_ret" : ""));
		ValueId obj = b.allocate(REF, b.constant("Hi", STRING));
		ValueId result = b.call(callee, OBJECT, function(b, callee), obj);
		if(returnResult) b.returnValue(result);
		else b.returnNothing();
		return b.build();
	}

	private InterproceduralEscapeAnalysis analysis() {
		return new InterproceduralEscapeAnalysis(repository, new DirectCallOracle(), EscapeAnalysisConfig.DEFAULT);
	}

	private static ValueId allocation(EscapeResult result) {
		return findAllocation(result.getRoutine(), REF);
	}

	@Test
	public void testGlobalEscapeInCallee() {
		EscapeResult result = analysis().analyze(caller(GLOBAL_ESCAPE, true));
		assertTrue(result.hasGlobalEscape(allocation(result)));
		assertFalse(result.hasAllEscape(allocation(result)));
	}

	@Test
	public void testNoEscapeInCallee() {
		EscapeResult result = analysis().analyze(caller(NO_ESCAPE, false));
		assertTrue(result.isNoEscape(allocation(result)));
		assertEquals(1, result.getStatistics().get("summary.computed"));
	}

	@Test
	public void testNoEscapeInCalleeButReturnedByCaller() {
		RoutineBuilder b = routine("returnsArgumentItself");
		ValueId obj = b.allocate(REF, b.constant("Hi", STRING));
		b.call(NO_ESCAPE, OBJECT, function(b, NO_ESCAPE), obj);
		b.returnValue(obj);
		EscapeResult result = analysis().analyze(b.build());

		assertTrue(result.hasReturnEscape(obj));
		assertFalse(result.hasThrownEscape(obj));
	}

	@Test
	public void testPassThroughArgumentIsReturned() {
		EscapeResult result = analysis().analyze(caller(RETURN_ESCAPE, true));
		ValueId obj = allocation(result);

		assertTrue(result.hasReturnEscape(obj));
		assertFalse(result.hasThrownEscape(obj));
	}

	@Test
	public void testPassThroughArgumentNotReturnedByCaller() {
		EscapeResult result = analysis().analyze(caller(RETURN_ESCAPE, false));
		assertTrue(result.isNoEscape(allocation(result)));
	}

	@Test
	public void testUnrelatedReturnValue() {
		EscapeResult result = analysis().analyze(caller(NO_RETURN_ESCAPE, true));
		assertTrue(result.isNoEscape(allocation(result)));
	}

	@Test
	public void testFieldOfArgumentIsTreatedAsAlias() {
		// Only the field is returned, but the object is assumed to come back as well
		EscapeResult result = analysis().analyze(caller(RETURN_FIELD, true));
		assertTrue(result.hasReturnEscape(allocation(result)));
	}

	@Test
	public void testUnresolvedCall() {
		RoutineBuilder b = routine("mayExist");
		ValueId obj = b.allocate(REF, b.constant("Hi", STRING));
		ValueId res = b.call(null, OBJECT, obj);
		b.returnNothing();
		EscapeResult result = analysis().analyze(b.build());

		assertTrue(result.hasAllEscape(obj));
		assertTrue(result.hasAllEscape(res));
		assertEquals(1, result.getStatistics().get("call.unresolved"));
	}

	@Test
	public void testDynamicCallIsNotResolved() {
		RoutineBuilder b = routine("invokelatest");
		ValueId obj = b.allocate(REF, b.constant("Hi", STRING));
		b.callDynamic(NO_ESCAPE, OBJECT, function(b, NO_ESCAPE), obj);
		b.returnNothing();
		EscapeResult result = analysis().analyze(b.build());

		assertTrue(result.hasAllEscape(obj));
	}

	@Test
	public void testMissingBody() {
		EscapeResult result = analysis().analyze(caller(method("nobody", OBJECT), false));

		assertTrue(result.hasAllEscape(allocation(result)));
		assertEquals(1, result.getStatistics().get("call.unanalyzable"));
	}

	@Test
	public void testFallbackCountedOncePerCallSite() {
		RoutineBuilder b = routine("loopingCaller", Type.BOOLEAN_TYPE);
		Label head = b.newLabel(), exit = b.newLabel();
		ValueId obj = b.allocate(REF, b.constant("Hi", STRING));
		b.mark(head);
		MethodIdentifier nobody = method("nobody", OBJECT);
		ValueId res = b.call(nobody, OBJECT, function(b, nobody), obj);
		b.putField(obj, "last", res, false);
		b.branch(b.argument(1), head, exit);
		b.mark(exit);
		b.call(null, OBJECT, obj);
		b.returnNothing();
		EscapeResult result = analysis().analyze(b.build());

		assertTrue(result.hasAllEscape(obj));
		assertEquals(1, result.getStatistics().get("call.unanalyzable"));
		assertEquals(1, result.getStatistics().get("call.unresolved"));
		assertTrue(result.getStatistics().get("solver.blockVisits") > result.getRoutine().getBlocks().size());
	}

	@Test
	public void testSummaryKeyIgnoresOperandTypes() {
		InterproceduralEscapeAnalysis analysis = analysis();
		analysis.analyze(caller(NO_ESCAPE, false));

		RoutineBuilder b = routine("passesString", STRING);
		b.call(NO_ESCAPE, OBJECT, function(b, NO_ESCAPE), b.argument(1));
		b.returnNothing();
		EscapeResult result = analysis.analyze(b.build());

		assertTrue(result.isNoEscape(ValueId.argument(1)));
		assertEquals(1, result.getStatistics().get("summary.hit"));
		assertEquals(1, analysis.getSummaryCache().size());
	}

	private static Routine unionSplitCaller() {
		RoutineBuilder b = routine("unionsplit_caller", OBJECT);
		ValueId a = b.allocate(MUTABLE_SOME, b.argument(1));
		ValueId value = b.getField(a, "value", OBJECT, false);
		b.call(UNION_SPLIT, OBJECT, function(b, UNION_SPLIT), value);
		b.returnNothing();
		return b.build();
	}

	private static ResolutionOracle unionSplitOracle() {
		return new DispatchTableOracle()
				.addCandidate(UNION_SPLIT, UNION_NOTHING)
				.addCandidate(UNION_SPLIT, UNION_INT);
	}

	@Test
	public void testUnionSplit() {
		InterproceduralEscapeAnalysis analysis = new InterproceduralEscapeAnalysis(repository, unionSplitOracle(), EscapeAnalysisConfig.DEFAULT);
		EscapeResult result = analysis.analyze(unionSplitCaller());

		assertTrue(result.isNoEscape(findAllocation(result.getRoutine(), MUTABLE_SOME)));
		assertEquals(1, result.getStatistics().get("call.split"));
		assertEquals(2, result.getStatistics().get("summary.computed"));
	}

	@Test
	public void testLargeDispatchSetIsJoined() {
		DispatchTableOracle oracle = new DispatchTableOracle();
		for(int i = 0; i < 6; i++) {
			MethodIdentifier impl = method("unionsplit_" + i, OBJECT);
			RoutineBuilder b = routine(impl);
			b.returnValue(b.constant("case " + i, STRING));
			repository.register(b.build());
			oracle.addCandidate(UNION_SPLIT, impl);
		}
		InterproceduralEscapeAnalysis analysis = new InterproceduralEscapeAnalysis(repository, oracle, EscapeAnalysisConfig.DEFAULT);
		EscapeResult result = analysis.analyze(unionSplitCaller());

		assertTrue(result.isNoEscape(findAllocation(result.getRoutine(), MUTABLE_SOME)));
		assertFalse(result.getStatistics().containsKey("call.unanalyzable"));
		assertEquals(6, result.getStatistics().get("summary.computed"));
	}

	@Test
	public void testTooManyCandidates() {
		InterproceduralEscapeAnalysis analysis = new InterproceduralEscapeAnalysis(repository, unionSplitOracle(),
				EscapeAnalysisConfig.DEFAULT.withMaxCandidates(1));
		EscapeResult result = analysis.analyze(unionSplitCaller());

		assertTrue(result.hasAllEscape(findAllocation(result.getRoutine(), MUTABLE_SOME)));
		assertTrue(result.hasAllEscape(ValueId.argument(1)));
		assertEquals(1, result.getStatistics().get("call.unanalyzable"));
	}

	@Test
	public void testCallDepthLimit() {
		InterproceduralEscapeAnalysis analysis = new InterproceduralEscapeAnalysis(repository, new DirectCallOracle(),
				EscapeAnalysisConfig.DEFAULT.withMaxCallDepth(0));
		EscapeResult result = analysis.analyze(caller(NO_ESCAPE, false));

		assertTrue(result.hasAllEscape(allocation(result)));
		assertEquals(0, analysis.getSummaryCache().size());
	}

	@Test
	public void testFailingCalleeAnalysis() {
		ResolutionOracle oracle = (caller, call) -> {
			if(BOOM.equals(call.getTarget())) throw new IllegalStateException("cannot resolve " + call.getTarget());
			return Optional.of(Collections.singleton(call.getTarget()));
		};
		InterproceduralEscapeAnalysis analysis = new InterproceduralEscapeAnalysis(repository, oracle, EscapeAnalysisConfig.DEFAULT);
		EscapeResult result = analysis.analyze(caller(EXPLODES, false));

		assertTrue(result.hasAllEscape(allocation(result)));
		assertEquals(1, result.getStatistics().get("call.unanalyzable"));
	}

	@Test
	public void testSummaryCacheIsShared() {
		InterproceduralEscapeAnalysis analysis = analysis();
		EscapeResult first = analysis.analyze(caller(GLOBAL_ESCAPE, false));
		EscapeResult second = analysis.analyze(caller(GLOBAL_ESCAPE, true));

		assertEquals(1, first.getStatistics().get("summary.computed"));
		assertEquals(1, second.getStatistics().get("summary.hit"));
		assertFalse(second.getStatistics().containsKey("summary.computed"));
		assertTrue(analysis.getSummaryCache().contains(CallSignature.of(globalEscape())));
	}

	@Test
	public void testSummarize() {
		InterproceduralEscapeAnalysis analysis = analysis();
		CallSummary summary = analysis.summarize(globalEscape());

		assertEquals(2, summary.getArgumentCount());
		assertTrue(summary.getArgument(1).hasGlobalEscape());
		assertTrue(summary.getArgument(1).isReturnedByRoutine());
		assertTrue(summary.getArgument(0).isNoEscape());
		assertSame(summary, analysis.summarize(globalEscape()));
	}

	@Test
	public void testSeededArgumentsAreNotAliases() {
		InterproceduralEscapeAnalysis analysis = new InterproceduralEscapeAnalysis(repository, new DirectCallOracle(),
				EscapeAnalysisConfig.DEFAULT.withSeedArgumentReturnEscape(true));

		EscapeResult result = analysis.analyze(caller(NO_ESCAPE, true));
		assertTrue(result.isNoEscape(allocation(result)));

		result = analysis.analyze(caller(RETURN_ESCAPE, true));
		assertTrue(result.hasReturnEscape(allocation(result)));
	}

	@Test
	public void testBitTypesShareSignatureShape() {
		CallSignature signature = CallSignature.of(unionInt());
		assertEquals(CallSignature.BIT_SHAPE, signature.shapes.get(1));
		assertEquals(UNION_INT, signature.method);
	}

	@Test
	public void testDeterministicWithFreshCaches() {
		Routine routine = caller(RETURN_FIELD, true);
		assertSameClassification(analysis().analyze(routine), analysis().analyze(routine));
	}
}
