package dumb.cogplan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * One entry of a {@link Tree}'s node array. Stored predicates and functions are standalone nodes of type
 * {@link NodeType#PREDICATE} and {@link NodeType#FUNCTION}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Node(@JsonProperty("node_type") NodeType type,
                   @JsonProperty("node_id") int id,
                   @JsonProperty("children") List<Integer> children,
                   @JsonProperty("name") String name,
                   @JsonProperty("parameters") List<Param> params,
                   @JsonProperty("negate") boolean negate,
                   @JsonProperty("value") double value,
                   @JsonProperty("op") @Nullable Op op) {

    @JsonCreator
    public Node {
        requireNonNull(type);
        children = children == null ? List.of() : List.copyOf(children);
        name = name == null ? "" : name;
        params = params == null ? List.of() : List.copyOf(params);
        if (id < 0) throw new IllegalArgumentException("Negative node id: " + id);
        switch (type) {
            case EXPRESSION -> {
                if (op == null || op.modifier())
                    throw new IllegalArgumentException("Expression node needs a comparator or arithmetic op, got " + op);
            }
            case FUNCTION_MODIFIER -> {
                if (op == null || !op.modifier())
                    throw new IllegalArgumentException("Function modifier node needs a modifier op, got " + op);
            }
            case AND, OR, NOT, UNKNOWN, ONE_OF, PREDICATE, FUNCTION, NUMBER -> {
            }
        }
    }

    public static Node of(NodeType type) {
        return new Node(type, 0, List.of(), "", List.of(), false, 0, null);
    }

    public static Node predicate(String name, String... args) {
        return predicate(name, false, params(args));
    }

    public static Node predicate(String name, boolean negate, List<Param> params) {
        return new Node(NodeType.PREDICATE, 0, List.of(), name, params, negate, 0, null);
    }

    public static Node function(String name, double value, String... args) {
        return function(name, value, params(args));
    }

    public static Node function(String name, double value, List<Param> params) {
        return new Node(NodeType.FUNCTION, 0, List.of(), name, params, false, value, null);
    }

    public static Node number(double value) {
        return new Node(NodeType.NUMBER, 0, List.of(), "", List.of(), false, value, null);
    }

    public static Node expression(Op op) {
        return new Node(NodeType.EXPRESSION, 0, List.of(), "", List.of(), false, 0, op);
    }

    public static Node modifier(Op op) {
        return new Node(NodeType.FUNCTION_MODIFIER, 0, List.of(), "", List.of(), false, 0, op);
    }

    private static List<Param> params(String... args) {
        return Arrays.stream(args).map(Param::of).toList();
    }

    /**
     * Reads a single ground atom such as {@code (robot_at r2d2 kitchen)} or {@code (not (door_open d1))}.
     */
    public static Node parsePredicate(String expr) {
        var t = parseList(expr);
        var negate = false;
        if (t.is("not") && t.size() == 2 && t.get(1) instanceof Term.Lst inner) {
            negate = true;
            t = inner;
        }
        return predicate(atomName(t, expr), negate, atomParams(t, expr));
    }

    /**
     * Reads a ground function either bare, {@code (battery r2d2)}, or with its value,
     * {@code (= (battery r2d2) 40)}.
     */
    public static Node parseFunction(String expr) {
        var t = parseList(expr);
        var value = 0.0;
        if (t.is("=") && t.size() == 3 && t.get(1) instanceof Term.Lst inner) {
            if (!(t.get(2) instanceof Term.Atom v) || !v.isNumber())
                throw new IllegalArgumentException("Function value must be a number: " + expr);
            value = v.number();
            t = inner;
        }
        return function(atomName(t, expr), value, atomParams(t, expr));
    }

    private static Term.Lst parseList(String expr) {
        try {
            if (TermParser.parseSingle(expr) instanceof Term.Lst l && !l.isEmpty()) return l;
        } catch (TermParser.ParseException e) {
            throw new IllegalArgumentException("Malformed atom '" + expr + "': " + e.getMessage(), e);
        }
        throw new IllegalArgumentException("Atom must be a non-empty list: " + expr);
    }

    private static String atomName(Term.Lst t, String expr) {
        return t.op().orElseThrow(() -> new IllegalArgumentException("Atom has no name: " + expr));
    }

    private static List<Param> atomParams(Term.Lst t, String expr) {
        var params = new ArrayList<Param>(t.size() - 1);
        for (var arg : t.args()) {
            if (!(arg instanceof Term.Atom a))
                throw new IllegalArgumentException("Atom arguments must be object names: " + expr);
            params.add(Param.of(a.value()));
        }
        return params;
    }

    public Node withId(int newId) {
        return new Node(type, newId, children, name, params, negate, value, op);
    }

    public Node withChildren(List<Integer> newChildren) {
        return new Node(type, id, newChildren, name, params, negate, value, op);
    }

    public Node withValue(double newValue) {
        return new Node(type, id, children, name, params, negate, newValue, op);
    }

    public Node withNegate(boolean newNegate) {
        return new Node(type, id, children, name, params, newNegate, value, op);
    }

    @JsonIgnore
    public List<String> paramNames() {
        return params.stream().map(Param::name).toList();
    }

    public boolean mentions(String instanceName) {
        return params.stream().anyMatch(p -> p.name().equals(instanceName));
    }

    /**
     * Structural equality of this node alone, ignoring ids and children. Functions compare by key (name and
     * parameters), never by value.
     */
    public boolean same(Node o) {
        if (type != o.type) return false;
        return switch (type) {
            case PREDICATE -> name.equals(o.name) && negate == o.negate && paramNames().equals(o.paramNames());
            case FUNCTION -> name.equals(o.name) && paramNames().equals(o.paramNames());
            case NUMBER -> Double.compare(value, o.value) == 0;
            case EXPRESSION, FUNCTION_MODIFIER -> op == o.op;
            case AND, OR, NOT, UNKNOWN, ONE_OF -> true;
        };
    }

    int sameHash() {
        return switch (type) {
            case PREDICATE -> Objects.hash(type, name, negate, paramNames());
            case FUNCTION -> Objects.hash(type, name, paramNames());
            case NUMBER -> Objects.hash(type, value);
            case EXPRESSION, FUNCTION_MODIFIER -> Objects.hash(type, op);
            case AND, OR, NOT, UNKNOWN, ONE_OF -> type.hashCode();
        };
    }

    /** The atom text, {@code (name p1 p2)}, with no negation or value. */
    public String atom(boolean lowerCaseName) {
        var sb = new StringBuilder("(").append(lowerCaseName ? name.toLowerCase() : name);
        params.forEach(p -> sb.append(' ').append(p.name()));
        return sb.append(')').toString();
    }

    @Override
    public String toString() {
        return switch (type) {
            case PREDICATE -> negate ? "(not " + atom(false) + ")" : atom(false);
            case FUNCTION -> "(= " + atom(false) + " " + format(value) + ")";
            case NUMBER -> format(value);
            case EXPRESSION, FUNCTION_MODIFIER -> requireNonNull(op).symbol;
            case AND, OR, NOT, UNKNOWN, ONE_OF -> type.keyword();
        };
    }

    /** Integral values are written without a fraction. */
    public static String format(double v) {
        if (v == Math.rint(v) && !Double.isInfinite(v) && Math.abs(v) < 1e15) return Long.toString((long) v);
        return Double.toString(v);
    }

    public enum Op {
        GT(">"), GE(">="), LT("<"), LE("<="), EQ("="),
        ADD("+"), SUB("-"), MULT("*"), DIV("/"),
        ASSIGN("assign"), INCREASE("increase"), DECREASE("decrease"), SCALE_UP("scale-up"), SCALE_DOWN("scale-down");

        public final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        @JsonCreator
        public static Op of(String symbol) {
            return parse(symbol).orElseThrow(() -> new IllegalArgumentException("Unknown op: " + symbol));
        }

        public static Optional<Op> parse(String symbol) {
            return Arrays.stream(values()).filter(o -> o.symbol.equals(symbol)).findFirst();
        }

        @JsonValue
        public String symbol() {
            return symbol;
        }

        public boolean comparator() {
            return switch (this) {
                case GT, GE, LT, LE, EQ -> true;
                case ADD, SUB, MULT, DIV, ASSIGN, INCREASE, DECREASE, SCALE_UP, SCALE_DOWN -> false;
            };
        }

        public boolean modifier() {
            return switch (this) {
                case ASSIGN, INCREASE, DECREASE, SCALE_UP, SCALE_DOWN -> true;
                case GT, GE, LT, LE, EQ, ADD, SUB, MULT, DIV -> false;
            };
        }

        public boolean compare(double a, double b) {
            return switch (this) {
                case GT -> a > b;
                case GE -> a >= b;
                case LT -> a < b;
                case LE -> a <= b;
                case EQ -> a == b;
                case ADD, SUB, MULT, DIV, ASSIGN, INCREASE, DECREASE, SCALE_UP, SCALE_DOWN ->
                        throw new IllegalStateException(symbol + " is not a comparator");
            };
        }

        /** Arithmetic result, or for a modifier the new value of the modified function. */
        public double apply(double a, double b) {
            return switch (this) {
                case ADD, INCREASE -> a + b;
                case SUB, DECREASE -> a - b;
                case MULT, SCALE_UP -> a * b;
                case DIV, SCALE_DOWN -> a / b;
                case ASSIGN -> b;
                case GT, GE, LT, LE, EQ -> throw new IllegalStateException(symbol + " is a comparator");
            };
        }
    }
}
