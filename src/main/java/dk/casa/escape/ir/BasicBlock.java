package dk.casa.escape.ir;

import com.google.common.collect.ImmutableList;

/** A maximal run of instructions {@code [start, end)} with a single entry. */
public class BasicBlock {
	public final int index;
	public final int start, end;
	private final ImmutableList<Integer> successors;
	private final int handler;

	public BasicBlock(int index, int start, int end, ImmutableList<Integer> successors, int handler) {
		this.index = index;
		this.start = start;
		this.end = end;
		this.successors = successors;
		this.handler = handler;
	}

	public ImmutableList<Integer> getSuccessors() {
		return successors;
	}

	/** The block that receives exceptions raised in this block, or -1 if the block is not protected */
	public int getHandler() {
		return handler;
	}

	public boolean isProtected() {
		return handler >= 0;
	}

	public boolean contains(int pc) {
		return start <= pc && pc < end;
	}

	@Override
	public String toString() {
		return String.format("#%d[%d, %d) -> %s%s", index, start, end, successors,
				isProtected() ? " catch #" + handler : "");
	}
}
