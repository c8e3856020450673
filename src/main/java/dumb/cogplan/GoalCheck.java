package dumb.cogplan;

import java.util.List;

import static dumb.cogplan.Log.warning;

/**
 * Evaluates a goal tree against a set of ground predicates and functions without changing either. A predicate leaf
 * holds when the same positive fact is stored; its negate flag inverts that test. A missing function value makes the
 * enclosing comparison fail.
 */
public final class GoalCheck {
    private final List<Node> predicates;
    private final List<Node> functions;

    private GoalCheck(List<Node> predicates, List<Node> functions) {
        this.predicates = predicates;
        this.functions = functions;
    }

    /** An empty goal is trivially satisfied. A goal whose root yields a number is not a condition and fails. */
    public static boolean check(Tree goal, List<Node> predicates, List<Node> functions) {
        if (goal.isEmpty()) return true;
        var r = new GoalCheck(predicates, functions).eval(goal, 0);
        if (r.kind == Kind.NUMBER) warning("Goal is a number, not a condition: " + goal);
        return r.kind == Kind.TRUTH && r.truth;
    }

    private Eval eval(Tree t, int id) {
        var n = t.node(id);
        var children = n.children();
        return switch (n.type()) {
            case AND -> {
                var all = true;
                for (var c : children) {
                    var e = eval(t, c);
                    if (e.kind != Kind.TRUTH) yield Eval.FAIL;
                    all &= e.truth;
                }
                yield Eval.truth(all);
            }
            case OR -> {
                var any = false;
                for (var c : children) {
                    var e = eval(t, c);
                    if (e.kind != Kind.TRUTH) yield Eval.FAIL;
                    any |= e.truth;
                }
                yield Eval.truth(any);
            }
            case NOT -> {
                if (children.size() != 1) yield Eval.FAIL;
                var e = eval(t, children.get(0));
                yield e.kind == Kind.TRUTH ? Eval.truth(!e.truth) : Eval.FAIL;
            }
            case ONE_OF -> {
                var count = 0;
                for (var c : children) {
                    var e = eval(t, c);
                    if (e.kind != Kind.TRUTH) yield Eval.FAIL;
                    if (e.truth) count++;
                }
                yield Eval.truth(count == 1);
            }
            case UNKNOWN -> {
                warning("Cannot evaluate an unknown fact as a goal: " + t.print(id));
                yield Eval.FAIL;
            }
            case PREDICATE -> {
                var found = predicates.stream().anyMatch(p -> !p.negate() && p.name().equals(n.name()) && p.paramNames().equals(n.paramNames()));
                yield Eval.truth(n.negate() != found);
            }
            case FUNCTION -> functions.stream()
                    .filter(f -> f.same(n))
                    .findFirst()
                    .map(f -> Eval.number(f.value()))
                    .orElse(Eval.FAIL);
            case NUMBER -> Eval.number(n.value());
            case EXPRESSION -> expression(t, n);
            case FUNCTION_MODIFIER -> {
                if (children.size() != 2 || t.node(children.get(0)).type() != NodeType.FUNCTION) yield Eval.FAIL;
                var target = eval(t, children.get(0));
                var amount = eval(t, children.get(1));
                yield target.kind == Kind.NUMBER && amount.kind == Kind.NUMBER
                        ? Eval.number(n.op().apply(target.value, amount.value)) : Eval.FAIL;
            }
        };
    }

    private Eval expression(Tree t, Node n) {
        var op = n.op();
        var children = n.children();
        if (children.size() == 1 && op == Node.Op.SUB) {
            var e = eval(t, children.get(0));
            return e.kind == Kind.NUMBER ? Eval.number(-e.value) : Eval.FAIL;
        }
        if (children.size() != 2) return Eval.FAIL;
        var a = eval(t, children.get(0));
        var b = eval(t, children.get(1));
        if (a.kind != Kind.NUMBER || b.kind != Kind.NUMBER) return Eval.FAIL;
        return op.comparator() ? Eval.truth(op.compare(a.value, b.value)) : Eval.number(op.apply(a.value, b.value));
    }

    private enum Kind {FAIL, TRUTH, NUMBER}

    private record Eval(Kind kind, boolean truth, double value) {
        static final Eval FAIL = new Eval(Kind.FAIL, false, 0);

        static Eval truth(boolean truth) {
            return new Eval(Kind.TRUTH, truth, 0);
        }

        static Eval number(double value) {
            return new Eval(Kind.NUMBER, false, value);
        }
    }
}
