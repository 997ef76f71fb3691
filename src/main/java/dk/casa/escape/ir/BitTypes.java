package dk.casa.escape.ir;

import org.objectweb.asm.Type;

/** Static types that cannot hold a heap reference. */
public final class BitTypes {
	private BitTypes() {}

	public static boolean isBitType(Type type) {
		switch(type.getSort()) {
			case Type.VOID: // the singleton "nothing"
			case Type.BOOLEAN:
			case Type.CHAR:
			case Type.BYTE:
			case Type.SHORT:
			case Type.INT:
			case Type.FLOAT:
			case Type.LONG:
			case Type.DOUBLE:
				return true;
			default:
				return false;
		}
	}
}
