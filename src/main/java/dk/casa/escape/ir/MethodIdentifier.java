package dk.casa.escape.ir;

import org.objectweb.asm.Type;

import java.util.Objects;

/** Identity of a routine: owner class, name and ASM method descriptor. */
public class MethodIdentifier {
	public final String owner, name, desc;

	public MethodIdentifier(String owner, String name, String desc) {
		this.owner = Objects.requireNonNull(owner);
		this.name = Objects.requireNonNull(name);
		this.desc = Objects.requireNonNull(desc);
	}

	public static MethodIdentifier of(String owner, String name, String desc) {
		return new MethodIdentifier(owner, name, desc);
	}

	/** The type of the reserved self slot (slot 0) */
	public Type getOwnerType() {
		return Type.getObjectType(owner);
	}

	/** Declared argument types, not including the self slot */
	public Type[] getArgumentTypes() {
		return Type.getArgumentTypes(desc);
	}

	public Type getReturnType() {
		return Type.getReturnType(desc);
	}

	@Override
	public boolean equals(Object obj) {
		if(!(obj instanceof MethodIdentifier)) return false;
		MethodIdentifier mth = (MethodIdentifier) obj;
		return owner.equals(mth.owner) &&
				name.equals(mth.name) &&
				desc.equals(mth.desc);
	}

	@Override
	public int hashCode() {
		return owner.hashCode() + 7 * name.hashCode() + 17 * desc.hashCode();
	}

	@Override
	public String toString() {
		return owner.substring(owner.lastIndexOf('/') + 1) + "." + name + desc;
	}
}
