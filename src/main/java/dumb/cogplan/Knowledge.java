package dumb.cogplan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static dumb.cogplan.Log.debug;
import static dumb.cogplan.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * The current model of the world: instances, ground predicates and functions, uncertain facts and the goal.
 * <p>
 * Every mutation either commits a state that satisfies all invariants or returns {@code false} and changes nothing.
 * The class does no locking; callers sharing one instance between threads must serialize access themselves.
 */
public class Knowledge {
    private final Domain domain;
    private final ProblemCodec codec;
    private final List<Instance> instances = new ArrayList<>();
    private final List<Node> predicates = new ArrayList<>();
    private final List<Node> functions = new ArrayList<>();
    private final List<Tree> conditionals = new ArrayList<>();
    private Tree goal = Tree.EMPTY;

    public Knowledge(Domain domain) {
        this(domain, new ProblemCodec(new CogPlan.Configuration()));
    }

    public Knowledge(Domain domain, ProblemCodec codec) {
        this.domain = requireNonNull(domain);
        this.codec = requireNonNull(codec);
    }

    public Domain domain() {
        return domain;
    }

    public boolean isValidType(String type) {
        return domain.getTypes().contains(type);
    }

    public List<Instance> getInstances() {
        return List.copyOf(instances);
    }

    public Optional<Instance> getInstance(String name) {
        return instances.stream().filter(i -> i.name().equals(name)).findFirst();
    }

    public boolean existInstance(String name) {
        return getInstance(name).isPresent();
    }

    /**
     * Adds the instance, or succeeds without change if an instance of that name and type already exists.
     */
    public boolean addInstance(Instance instance) {
        if (!isValidType(instance.type())) {
            warning("Rejected instance " + instance + ": unknown type");
            return false;
        }
        var existing = getInstance(instance.name());
        if (existing.isPresent()) {
            if (!existing.get().type().equals(instance.type())) {
                warning("Rejected instance " + instance + ": already declared as " + existing.get().type());
                return false;
            }
            return true;
        }
        instances.add(instance);
        return true;
    }

    public boolean removeInstance(Instance instance) {
        return removeInstance(instance.name());
    }

    /**
     * Removes the instance and everything that refers to it: predicates and functions naming it, goal subtrees
     * mentioning it, and uncertain facts over it. ONE_OF sets only lose the alternatives naming it.
     *
     * @return whether the instance existed
     */
    public boolean removeInstance(String name) {
        var found = instances.removeIf(i -> i.name().equals(name));

        predicates.removeIf(p -> p.mentions(name));
        functions.removeIf(f -> f.mentions(name));
        removeInvalidConditionals(name);
        removeInvalidGoals(name);

        return found;
    }

    private void removeInvalidGoals(String name) {
        var subgoals = goal.subtrees();
        if (subgoals.isEmpty()) return;

        var valid = subgoals.stream().filter(s -> !s.mentions(name)).toList();
        if (valid.size() == subgoals.size()) return;

        goal = Tree.fromSubtrees(valid, goal.root().type()).orElse(Tree.EMPTY);
        debug("Goal after removing " + name + ": " + goal);
    }

    private void removeInvalidConditionals(String name) {
        var kept = new ArrayList<Tree>(conditionals.size());
        var certain = new ArrayList<Node>();
        for (var c : conditionals) {
            if (!c.mentions(name)) {
                kept.add(c);
            } else if (c.root().type() == NodeType.ONE_OF) {
                var rest = c.subtrees().stream().filter(s -> !s.mentions(name)).toList();
                if (rest.size() == 1) certain.add(rest.get(0).root());
                else if (rest.size() > 1) kept.add(Tree.of(Node.of(NodeType.ONE_OF), rest));
            }
        }
        conditionals.clear();
        conditionals.addAll(kept);
        certain.forEach(this::addPredicate);
    }

    public List<Node> getPredicates() {
        return List.copyOf(predicates);
    }

    /**
     * Looks a predicate up by its text, e.g. {@code (robot_at r2d2 kitchen)}.
     */
    public Optional<Node> getPredicate(String expr) {
        return parse(expr, true).flatMap(p -> predicates.stream().filter(p::same).findFirst());
    }

    public boolean existPredicate(Node predicate) {
        return predicates.stream().anyMatch(predicate::same);
    }

    public boolean addPredicate(Node predicate) {
        if (predicate.type() != NodeType.PREDICATE) {
            warning("Not a predicate: " + predicate);
            return false;
        }
        if (existPredicate(predicate)) return true;
        if (!isValidPredicate(predicate)) {
            warning("Rejected predicate " + predicate);
            return false;
        }
        predicates.add(leaf(predicate));
        return true;
    }

    /**
     * Removes the first equal predicate. Invalid predicates are rejected; a valid one that is not stored is a
     * successful no-op.
     */
    public boolean removePredicate(Node predicate) {
        if (!isValidPredicate(predicate)) return false;
        removeFirst(predicates, predicate);
        return true;
    }

    public List<Node> getFunctions() {
        return List.copyOf(functions);
    }

    /**
     * Looks a function up by its text, e.g. {@code (battery r2d2)}. The value in the text, if any, is ignored.
     */
    public Optional<Node> getFunction(String expr) {
        return parse(expr, false).flatMap(f -> functions.stream().filter(f::same).findFirst());
    }

    public boolean existFunction(Node function) {
        return functions.stream().anyMatch(function::same);
    }

    /** Adds the function, or replaces the value of the stored one with the same name and parameters. */
    public boolean addFunction(Node function) {
        if (function.type() != NodeType.FUNCTION) {
            warning("Not a function: " + function);
            return false;
        }
        if (!Double.isFinite(function.value())) {
            warning("Rejected function " + function + ": value is not a finite number");
            return false;
        }
        if (existFunction(function)) return updateFunction(function);
        if (!isValidFunction(function)) {
            warning("Rejected function " + function);
            return false;
        }
        functions.add(leaf(function));
        return true;
    }

    public boolean removeFunction(Node function) {
        if (!isValidFunction(function)) return false;
        removeFirst(functions, function);
        return true;
    }

    public boolean updateFunction(Node function) {
        if (!Double.isFinite(function.value())) {
            warning("Rejected update of " + function + ": value is not a finite number");
            return false;
        }
        if (!existFunction(function) || !isValidFunction(function)) return false;
        removeFirst(functions, function);
        functions.add(leaf(function));
        return true;
    }

    private static void removeFirst(List<Node> nodes, Node match) {
        for (var it = nodes.iterator(); it.hasNext(); ) {
            if (it.next().same(match)) {
                it.remove();
                return;
            }
        }
    }

    private static Node leaf(Node n) {
        return n.withId(0).withChildren(List.of());
    }

    private Optional<Node> parse(String expr, boolean predicate) {
        try {
            return Optional.of(predicate ? Node.parsePredicate(expr) : Node.parseFunction(expr));
        } catch (IllegalArgumentException e) {
            warning(e.getMessage());
            return Optional.empty();
        }
    }

    public List<Tree> getConditionals() {
        return List.copyOf(conditionals);
    }

    public boolean existConditional(Tree condition) {
        return conditionals.contains(condition);
    }

    /**
     * Stores an uncertain fact. A ONE_OF with a single alternative is certain, so that alternative is added as a
     * predicate instead.
     */
    public boolean addConditional(Tree condition) {
        if (existConditional(condition)) return true;
        if (!isValidCondition(condition)) {
            warning("Rejected conditional " + condition);
            return false;
        }
        return store(condition);
    }

    private boolean store(Tree condition) {
        if (condition.root().type() == NodeType.ONE_OF && condition.root().children().size() == 1)
            return addPredicate(condition.node(condition.root().children().get(0)));
        conditionals.add(condition);
        return true;
    }

    /**
     * Removes the first equal uncertain fact. Removing {@code (unknown P)} also drops P from every ONE_OF set; a set
     * left with one alternative becomes a certain predicate and an exhausted set disappears.
     */
    public boolean removeConditional(Tree condition) {
        if (!isValidCondition(condition)) return false;
        var index = conditionals.indexOf(condition);
        if (index < 0) return true;
        conditionals.remove(index);

        if (condition.root().type() == NodeType.UNKNOWN) {
            var resolved = condition.node(condition.root().children().get(0));
            var oneOfs = conditionals.stream().filter(c -> c.root().type() == NodeType.ONE_OF).toList();
            conditionals.removeIf(c -> c.root().type() == NodeType.ONE_OF);
            for (var oneOf : oneOfs) {
                var rest = oneOf.subtrees().stream().filter(s -> !s.root().same(resolved)).toList();
                Tree.fromSubtrees(rest, NodeType.ONE_OF).ifPresent(this::store);
            }
        }
        return true;
    }

    public Tree getGoal() {
        return goal;
    }

    /** Negated predicate leaves are stored as NOT over the positive predicate. */
    public boolean setGoal(Tree newGoal) {
        if (!isValidGoal(newGoal)) {
            warning("Rejected goal " + newGoal);
            return false;
        }
        goal = newGoal.explicitNegation();
        return true;
    }

    public boolean clearGoal() {
        goal = Tree.EMPTY;
        return true;
    }

    public boolean isGoalSatisfied(Tree g) {
        return GoalCheck.check(g, predicates, functions);
    }

    public boolean clearKnowledge() {
        instances.clear();
        predicates.clear();
        functions.clear();
        conditionals.clear();
        clearGoal();
        return true;
    }

    public boolean isValidPredicate(Node predicate) {
        return matchesSignature(predicate, domain.getPredicate(predicate.name()));
    }

    public boolean isValidFunction(Node function) {
        return matchesSignature(function, domain.getFunction(function.name()));
    }

    /**
     * Arity must match and each argument must be an existing instance whose type is the declared one or one of its
     * subtypes.
     */
    private boolean matchesSignature(Node n, Optional<Domain.Signature> signature) {
        if (signature.isEmpty() || signature.get().arity() != n.params().size()) return false;
        var declared = signature.get().params();
        for (var i = 0; i < declared.size(); i++) {
            var instance = getInstance(n.params().get(i).name());
            if (instance.isEmpty() || !declared.get(i).accepts(instance.get().type())) return false;
        }
        return true;
    }

    public boolean isValidGoal(Tree g) {
        return checkPredicateTreeTypes(g, 0);
    }

    /**
     * An uncertain fact is UNKNOWN over one predicate, ONE_OF over one or more predicates, or OR over exactly two,
     * and every predicate must be valid.
     */
    public boolean isValidCondition(Tree c) {
        if (c.isEmpty()) return false;
        var root = c.root();
        var arity = root.children().size();
        var shape = switch (root.type()) {
            case UNKNOWN -> arity == 1;
            case ONE_OF -> arity >= 1;
            case OR -> arity == 2;
            case AND, NOT, PREDICATE, FUNCTION, EXPRESSION, FUNCTION_MODIFIER, NUMBER -> false;
        };
        if (!shape || c.children(0).stream().anyMatch(n -> n.type() != NodeType.PREDICATE)) {
            warning("Malformed conditional " + c);
            return false;
        }
        return checkPredicateTreeTypes(c, 0);
    }

    public boolean checkPredicateTreeTypes(Tree tree, int nodeId) {
        if (nodeId < 0 || nodeId >= tree.size()) return false;
        var n = tree.node(nodeId);
        return switch (n.type()) {
            case AND, OR, ONE_OF, EXPRESSION, FUNCTION_MODIFIER ->
                    n.children().stream().allMatch(c -> checkPredicateTreeTypes(tree, c));
            case NOT, UNKNOWN -> {
                if (n.children().size() != 1) {
                    warning("checkPredicateTreeTypes: malformed expression [" + tree.print(nodeId) + "]");
                    yield false;
                }
                yield checkPredicateTreeTypes(tree, n.children().get(0));
            }
            case PREDICATE -> isValidPredicate(n);
            case FUNCTION -> isValidFunction(n);
            case NUMBER -> true;
        };
    }

    public String getProblem() {
        return codec.write(this);
    }

    public boolean addProblem(String problem) {
        return codec.read(problem, this);
    }
}
