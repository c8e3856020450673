package dumb.cogplan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A logical or arithmetic formula stored as a flat node array. A node's index is its id, node 0 is the root, and
 * every other node has exactly one parent. Instances are immutable; build them with {@link Builder}.
 * <p>
 * {@link #equals(Object)} is structural: children are compared in order, names, parameters and negation exactly.
 */
public final class Tree {

    public static final Tree EMPTY = new Tree(List.of());

    private final List<Node> nodes;
    private volatile int hashCodeCache;
    private volatile boolean hashCodeCalculated = false;

    private Tree(List<Node> nodes) {
        this.nodes = nodes;
    }

    /**
     * Wraps an exchanged node array after checking that it really is a tree rooted at index 0.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Tree of(List<Node> nodes) {
        requireNonNull(nodes);
        if (nodes.isEmpty()) return EMPTY;
        var n = nodes.size();
        var parents = new int[n];
        Arrays.fill(parents, -1);
        for (var i = 0; i < n; i++) {
            var node = requireNonNull(nodes.get(i));
            if (node.id() != i)
                throw new IllegalArgumentException("Node at index " + i + " has id " + node.id());
            for (var c : node.children()) {
                if (c <= 0 || c >= n)
                    throw new IllegalArgumentException("Node " + i + " has out-of-range child " + c);
                if (parents[c] != -1)
                    throw new IllegalArgumentException("Node " + c + " has more than one parent");
                parents[c] = i;
            }
        }
        var stack = new ArrayList<Integer>();
        stack.add(0);
        var count = 0;
        while (!stack.isEmpty()) {
            int id = stack.remove(stack.size() - 1);
            count++;
            stack.addAll(nodes.get(id).children());
        }
        if (count != n)
            throw new IllegalArgumentException("Tree has " + (n - count) + " node(s) unreachable from the root");
        return new Tree(List.copyOf(nodes));
    }

    /** A single-node tree, e.g. a goal that is one predicate. */
    public static Tree of(Node leaf) {
        var b = builder();
        b.add(leaf.withChildren(List.of()));
        return b.build();
    }

    /** A fresh root of the given type with each subtree grafted beneath it, in order. */
    public static Tree of(NodeType type, Tree... children) {
        return of(Node.of(type), List.of(children));
    }

    public static Tree of(Node root, List<Tree> children) {
        var b = builder();
        var r = b.add(root.withChildren(List.of()));
        children.forEach(c -> b.graft(r, c));
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Rebuilds a tree from subtrees. AND, OR and ONE_OF wrap them under a new root; any other type expects exactly
     * one subtree and returns it unchanged. Empty input yields nothing.
     */
    public static Optional<Tree> fromSubtrees(List<Tree> subtrees, NodeType type) {
        if (subtrees.isEmpty()) return Optional.empty();
        if (type.combinator()) return Optional.of(of(Node.of(type), subtrees));
        if (subtrees.size() != 1)
            throw new IllegalArgumentException("Cannot join " + subtrees.size() + " subtrees under " + type);
        return Optional.of(subtrees.get(0));
    }

    @JsonValue
    public List<Node> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Node root() {
        if (nodes.isEmpty()) throw new IllegalStateException("Empty tree has no root");
        return nodes.get(0);
    }

    public Node node(int id) {
        return nodes.get(id);
    }

    public List<Node> children(int id) {
        return nodes.get(id).children().stream().map(nodes::get).toList();
    }

    /** Copy of the subtree rooted at {@code nodeId}, renumbered so that it becomes node 0. */
    public Tree subtree(int nodeId) {
        if (nodeId == 0) return this;
        var b = builder();
        copy(nodeId, b, -1);
        return b.build();
    }

    private void copy(int id, Builder b, int parent) {
        var n = nodes.get(id);
        var added = parent < 0 ? b.add(n.withChildren(List.of())) : b.add(parent, n.withChildren(List.of()));
        n.children().forEach(c -> copy(c, b, added));
    }

    /**
     * The maximal subgoals: each child of an AND, OR or ONE_OF root, otherwise the whole tree.
     */
    public List<Tree> subtrees() {
        if (nodes.isEmpty()) return List.of();
        var r = root();
        return r.type().combinator() ? r.children().stream().map(this::subtree).toList() : List.of(this);
    }

    /** Every subtree whose root has the given type, in pre-order. */
    public List<Tree> subtreesOfType(NodeType type) {
        var out = new ArrayList<Tree>();
        if (!nodes.isEmpty()) collectOfType(0, type, out);
        return out;
    }

    private void collectOfType(int id, NodeType type, List<Tree> out) {
        var n = nodes.get(id);
        if (n.type() == type) out.add(subtree(id));
        n.children().forEach(c -> collectOfType(c, type, out));
    }

    public List<Node> predicates() {
        return leaves(0, NodeType.PREDICATE);
    }

    public List<Node> predicates(int nodeId) {
        return leaves(nodeId, NodeType.PREDICATE);
    }

    public List<Node> functions() {
        return leaves(0, NodeType.FUNCTION);
    }

    public List<Node> functions(int nodeId) {
        return leaves(nodeId, NodeType.FUNCTION);
    }

    private List<Node> leaves(int nodeId, NodeType type) {
        var out = new ArrayList<Node>();
        if (!nodes.isEmpty()) collectLeaves(nodeId, type, out);
        return out;
    }

    private void collectLeaves(int id, NodeType type, List<Node> out) {
        var n = nodes.get(id);
        if (n.type() == type) out.add(n);
        n.children().forEach(c -> collectLeaves(c, type, out));
    }

    /**
     * The same condition with every negated predicate leaf written as NOT over the positive predicate, the form that
     * problem text reads back.
     */
    public Tree explicitNegation() {
        if (nodes.stream().noneMatch(n -> n.type() == NodeType.PREDICATE && n.negate())) return this;
        var b = builder();
        explicitNegation(0, b, -1);
        return b.build();
    }

    private void explicitNegation(int id, Builder b, int parent) {
        var n = nodes.get(id).withChildren(List.of());
        if (n.type() == NodeType.PREDICATE && n.negate()) {
            var not = parent < 0 ? b.add(Node.of(NodeType.NOT)) : b.add(parent, Node.of(NodeType.NOT));
            b.add(not, n.withNegate(false));
            return;
        }
        var added = parent < 0 ? b.add(n) : b.add(parent, n);
        nodes.get(id).children().forEach(c -> explicitNegation(c, b, added));
    }

    /** True if any predicate or function leaf names the instance. */
    public boolean mentions(String instanceName) {
        return nodes.stream()
                .filter(n -> n.type() == NodeType.PREDICATE || n.type() == NodeType.FUNCTION)
                .anyMatch(n -> n.mentions(instanceName));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tree that)) return false;
        if (nodes.size() != that.nodes.size() || hashCode() != that.hashCode()) return false;
        return nodes.isEmpty() || same(this, 0, that, 0);
    }

    private static boolean same(Tree a, int ai, Tree b, int bi) {
        var x = a.nodes.get(ai);
        var y = b.nodes.get(bi);
        if (!x.same(y) || x.children().size() != y.children().size()) return false;
        for (var i = 0; i < x.children().size(); i++) {
            if (!same(a, x.children().get(i), b, y.children().get(i))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        if (!hashCodeCalculated) {
            hashCodeCache = nodes.isEmpty() ? 0 : hash(0);
            hashCodeCalculated = true;
        }
        return hashCodeCache;
    }

    private int hash(int id) {
        var n = nodes.get(id);
        var h = n.sameHash();
        for (var c : n.children()) h = 31 * h + hash(c);
        return h;
    }

    @Override
    public String toString() {
        return print(false, false);
    }

    /**
     * PDDL text of the whole tree.
     *
     * @param lowerCaseNames lower-case predicate and function names; parameters keep their case
     * @param indent         one line per compound child, two spaces per level
     */
    public String print(boolean lowerCaseNames, boolean indent) {
        if (nodes.isEmpty()) return "";
        var sb = new StringBuilder();
        print(0, lowerCaseNames, indent ? 0 : -1, sb);
        return sb.toString();
    }

    public String print(int nodeId) {
        var sb = new StringBuilder();
        print(nodeId, false, -1, sb);
        return sb.toString();
    }

    private void print(int id, boolean lower, int depth, StringBuilder sb) {
        var n = nodes.get(id);
        switch (n.type()) {
            case PREDICATE -> sb.append(n.negate() ? "(not " + n.atom(lower) + ")" : n.atom(lower));
            case FUNCTION -> sb.append(n.atom(lower));
            case NUMBER -> sb.append(Node.format(n.value()));
            case EXPRESSION, FUNCTION_MODIFIER -> compound(requireNonNull(n.op()).symbol, n, lower, depth, sb);
            case AND, OR, NOT, UNKNOWN, ONE_OF -> compound(n.type().keyword(), n, lower, depth, sb);
        }
    }

    private void compound(String head, Node n, boolean lower, int depth, StringBuilder sb) {
        sb.append('(').append(head);
        var nested = depth >= 0 && n.children().stream().anyMatch(c -> !nodes.get(c).type().leaf());
        for (var c : n.children()) {
            if (nested) {
                sb.append('\n').append("  ".repeat(depth + 1));
                print(c, lower, depth + 1, sb);
            } else {
                sb.append(' ');
                print(c, lower, depth < 0 ? -1 : depth + 1, sb);
            }
        }
        if (nested) sb.append('\n').append("  ".repeat(depth));
        sb.append(')');
    }

    /** Appends nodes in order, assigning each the next free id. */
    public static final class Builder {
        private final List<Node> nodes = new ArrayList<>();

        private Builder() {
        }

        public int add(Node node) {
            var id = nodes.size();
            nodes.add(node.withId(id));
            return id;
        }

        /** Adds {@code node} as the last child of {@code parent}. */
        public int add(int parent, Node node) {
            var id = add(node);
            link(parent, id);
            return id;
        }

        public Builder link(int parent, int child) {
            var p = nodes.get(parent);
            var children = new ArrayList<>(p.children());
            children.add(child);
            nodes.set(parent, p.withChildren(children));
            return this;
        }

        /** Copies {@code sub} beneath {@code parent}, renumbering its nodes. Returns the id of the copied root. */
        public int graft(int parent, Tree sub) {
            if (sub.isEmpty()) throw new IllegalArgumentException("Cannot graft an empty tree");
            return graft(parent, sub, 0);
        }

        private int graft(int parent, Tree sub, int id) {
            var n = sub.node(id);
            var added = add(parent, n.withChildren(List.of()));
            n.children().forEach(c -> graft(added, sub, c));
            return added;
        }

        public Tree build() {
            return Tree.of(nodes);
        }
    }
}
