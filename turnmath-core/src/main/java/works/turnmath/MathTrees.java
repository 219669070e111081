package works.turnmath;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Whole-tree traversals. These use an explicit stack rather than recursion,
 * so pathologically deep trees can't overflow the call stack.
 */
public final class MathTrees {
	private MathTrees() { }

	/**
	 * @return the nodes of the tree rooted at {@code root}, parents before children,
	 * children in {@link MathNodeContent#children() serialization order}.
	 * A shared subtree is visited once per occurrence.
	 */
	public static Iterable<MathNode> preOrder(MathNode root) {
		return () -> new PreOrderIterator(root);
	}

	public static Stream<MathNode> stream(MathNode root) {
		return StreamSupport.stream(
			Spliterators.spliteratorUnknownSize(new PreOrderIterator(root), Spliterator.ORDERED | Spliterator.NONNULL),
			false);
	}

	public static int size(MathNode root) {
		int count = 0;
		for (MathNode ignored : preOrder(root)) {
			++count;
		}
		return count;
	}

	/**
	 * @return the number of nodes on the longest path from {@code root} to a leaf,
	 * so a single leaf has depth 1.
	 */
	public static int depth(MathNode root) {
		record Frame(MathNode node, int depth) { }
		Deque<Frame> stack = new ArrayDeque<>();
		stack.push(new Frame(root, 1));
		int max = 0;
		while (!stack.isEmpty()) {
			Frame frame = stack.pop();
			max = Math.max(max, frame.depth());
			for (MathNode child : frame.node().children()) {
				stack.push(new Frame(child, frame.depth() + 1));
			}
		}
		return max;
	}

	private static final class PreOrderIterator implements Iterator<MathNode> {
		final Deque<MathNode> stack = new ArrayDeque<>();

		PreOrderIterator(MathNode root) {
			stack.push(root);
		}

		@Override
		public boolean hasNext() {
			return !stack.isEmpty();
		}

		@Override
		public MathNode next() {
			if (stack.isEmpty()) {
				throw new NoSuchElementException();
			}
			MathNode result = stack.pop();
			List<MathNode> children = result.children();
			for (int i = children.size() - 1; i >= 0; i--) {
				stack.push(children.get(i));
			}
			return result;
		}
	}
}
