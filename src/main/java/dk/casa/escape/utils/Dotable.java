package dk.casa.escape.utils;

/** Something that can be rendered as a Graphviz digraph. */
public interface Dotable {
	String toDot(String label);

	static String escape(String text) {
		return text.replace("\\", "\\\\").replace("\"", "\\\"");
	}
}
