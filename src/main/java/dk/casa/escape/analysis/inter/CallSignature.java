package dk.casa.escape.analysis.inter;

import com.google.common.collect.ImmutableList;
import dk.casa.escape.ir.BitTypes;
import dk.casa.escape.ir.MethodIdentifier;
import dk.casa.escape.ir.Routine;
import org.objectweb.asm.Type;

/**
 * Key of a cached summary: the routine plus the shape of each argument slot, where all bit
 * types collapse to {@link #BIT_SHAPE} since they never carry escape information.
 *
 * The shapes are the callee's declared slot types, not the operand types at a call site, since
 * a body is always analysed against its declared types. For one body the key is therefore just
 * the method identity; the shapes only separate bodies registered with different slot types.
 */
public final class CallSignature {
	public static final Type BIT_SHAPE = Type.VOID_TYPE;

	public final MethodIdentifier method;
	public final ImmutableList<Type> shapes;

	public CallSignature(MethodIdentifier method, ImmutableList<Type> shapes) {
		this.method = method;
		this.shapes = shapes;
	}

	public static CallSignature of(Routine routine) {
		ImmutableList.Builder<Type> shapes = ImmutableList.builder();
		for(Type type : routine.getArgumentTypes())
			shapes.add(BitTypes.isBitType(type) ? BIT_SHAPE : type);
		return new CallSignature(routine.getMethod(), shapes.build());
	}

	@Override
	public boolean equals(Object o) {
		if(this == o) return true;
		if(!(o instanceof CallSignature)) return false;
		CallSignature other = (CallSignature) o;
		return method.equals(other.method) && shapes.equals(other.shapes);
	}

	@Override
	public int hashCode() {
		return method.hashCode() * 31 + shapes.hashCode();
	}

	@Override
	public String toString() {
		return method + shapes.toString();
	}
}
