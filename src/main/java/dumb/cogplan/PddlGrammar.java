package dumb.cogplan;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads PDDL problem files with the two contingency clauses {@code (unknown F)} and {@code (oneof F1 F2 ...)}, plus
 * the disjunctive initial fact {@code (or F1 F2)}.
 */
public class PddlGrammar implements ProblemGrammar {
    private static final Pattern DOMAIN_CLAUSE = Pattern.compile("\\(\\s*:domain\\s+([^\\s()]+)\\s*\\)", Pattern.CASE_INSENSITIVE);

    /**
     * Reads a typed name list such as {@code a b - robot c}. Names without a type are of type {@code object}.
     */
    public static List<Map.Entry<String, String>> typedList(List<Term> terms, String context) throws TermParser.ParseException {
        var out = new ArrayList<Map.Entry<String, String>>();
        var pending = new ArrayList<String>();
        for (var i = 0; i < terms.size(); i++) {
            var t = terms.get(i);
            if (t.isAtom("-")) {
                if (i + 1 >= terms.size() || !(terms.get(i + 1) instanceof Term.Atom type) || type.isAtom("-") || pending.isEmpty())
                    throw new TermParser.ParseException("Dangling '-' in typed list", context);
                pending.forEach(p -> out.add(Map.entry(p, type.value())));
                pending.clear();
                i++;
            } else if (t instanceof Term.Atom a) {
                pending.add(a.value());
            } else {
                throw new TermParser.ParseException("Expected a name in typed list", context);
            }
        }
        pending.forEach(p -> out.add(Map.entry(p, Domain.OBJECT)));
        return out;
    }

    @Override
    public Optional<String> domainName(String text) {
        var m = DOMAIN_CLAUSE.matcher(text);
        return m.find() ? Optional.of(m.group(1)).filter(s -> !s.isBlank()) : Optional.empty();
    }

    @Override
    public ParsedProblem parse(String text, Domain domain) throws TermParser.ParseException {
        var top = TermParser.parseSingle(text);
        if (!(top instanceof Term.Lst def) || !def.is("define") || def.size() < 2)
            throw new TermParser.ParseException("Problem must be a (define (problem NAME) ...) form", abbreviate(text));
        if (!(def.get(1) instanceof Term.Lst header) || !header.is("problem") || header.size() != 2 || !(header.get(1) instanceof Term.Atom problemName))
            throw new TermParser.ParseException("Missing (problem NAME) header", def.get(1).toText());

        String domainName = null;
        var objects = new ArrayList<Instance>();
        var init = new ArrayList<Tree>();
        var conditionals = new ArrayList<Tree>();
        var goal = Tree.EMPTY;

        for (var section : def.terms.subList(2, def.size())) {
            if (!(section instanceof Term.Lst s) || s.op().isEmpty())
                throw new TermParser.ParseException("Unexpected problem section", section.toText());
            switch (s.op().get()) {
                case ":domain" -> {
                    if (s.size() != 2 || !(s.get(1) instanceof Term.Atom d))
                        throw new TermParser.ParseException("Malformed :domain clause", s.toText());
                    domainName = d.value();
                }
                case ":objects" -> {
                    for (var e : typedList(s.args(), s.toText())) objects.add(new Instance(e.getKey(), e.getValue()));
                }
                case ":init" -> {
                    for (var fact : s.args()) {
                        var tree = initFact(fact, domain);
                        switch (tree.root().type()) {
                            case UNKNOWN, ONE_OF, OR -> conditionals.add(tree);
                            case PREDICATE, FUNCTION -> init.add(tree);
                            case AND, NOT, EXPRESSION, FUNCTION_MODIFIER, NUMBER ->
                                    throw new TermParser.ParseException("Unsupported initial fact", fact.toText());
                        }
                    }
                }
                case ":goal" -> {
                    if (s.size() != 2) throw new TermParser.ParseException("Goal must be a single expression", s.toText());
                    var b = Tree.builder();
                    expression(s.get(1), domain, b, -1);
                    goal = b.build();
                }
                default -> {
                }
            }
        }
        if (domainName == null) throw new TermParser.ParseException("Missing (:domain NAME) clause", abbreviate(text));
        return new ParsedProblem(problemName.value(), domainName, objects, init, conditionals, goal);
    }

    private Tree initFact(Term fact, Domain domain) throws TermParser.ParseException {
        if (!(fact instanceof Term.Lst l) || l.op().isEmpty())
            throw new TermParser.ParseException("Initial fact must be a list", fact.toText());
        switch (l.op().get()) {
            case "unknown" -> {
                if (l.size() != 2) throw new TermParser.ParseException("unknown takes one fact", l.toText());
                return Tree.of(NodeType.UNKNOWN, Tree.of(literal(l.get(1), domain, false)));
            }
            case "oneof" -> {
                if (l.size() < 2) throw new TermParser.ParseException("oneof needs at least one fact", l.toText());
                var alternatives = new ArrayList<Tree>();
                for (var alt : l.args()) alternatives.add(Tree.of(literal(alt, domain, false)));
                return Tree.of(Node.of(NodeType.ONE_OF), alternatives);
            }
            case "or" -> {
                if (l.size() != 3) throw new TermParser.ParseException("or takes exactly two facts", l.toText());
                return Tree.of(NodeType.OR, Tree.of(literal(l.get(1), domain, true)), Tree.of(literal(l.get(2), domain, true)));
            }
            case "=" -> {
                if (l.size() != 3 || !(l.get(1) instanceof Term.Lst f) || !(l.get(2) instanceof Term.Atom v) || !v.isNumber())
                    throw new TermParser.ParseException("Numeric fact must be (= (f args) NUMBER)", l.toText());
                return Tree.of(atom(f, NodeType.FUNCTION, domain).withValue(v.number()));
            }
            default -> {
                return Tree.of(literal(l, domain, true));
            }
        }
    }

    private static Node literal(Term t, Domain domain, boolean allowNegation) throws TermParser.ParseException {
        if (!(t instanceof Term.Lst l) || l.op().isEmpty())
            throw new TermParser.ParseException("Expected a fact", t.toText());
        if (l.is("not")) {
            if (!allowNegation || l.size() != 2 || !(l.get(1) instanceof Term.Lst inner))
                throw new TermParser.ParseException("Unexpected negation", l.toText());
            return atom(inner, NodeType.PREDICATE, domain).withNegate(true);
        }
        return atom(l, NodeType.PREDICATE, domain);
    }

    private static Node atom(Term.Lst l, NodeType type, Domain domain) throws TermParser.ParseException {
        var name = l.op().orElseThrow(() -> new TermParser.ParseException("Fact has no name", l.toText()));
        var signature = type == NodeType.FUNCTION ? domain.getFunction(name) : domain.getPredicate(name);
        var params = new ArrayList<Param>(l.size() - 1);
        var args = l.args();
        for (var i = 0; i < args.size(); i++) {
            if (!(args.get(i) instanceof Term.Atom a) || a.isVariable() || a.isNumber())
                throw new TermParser.ParseException("Fact arguments must be object names", l.toText());
            var declared = signature.filter(s -> s.arity() == args.size()).map(s -> s.params()).orElse(null);
            params.add(declared == null ? Param.of(a.value())
                    : new Param(a.value(), declared.get(i).type(), declared.get(i).subTypes()));
        }
        return type == NodeType.FUNCTION ? Node.function(name, 0, params) : Node.predicate(name, false, params);
    }

    private static int expression(Term t, Domain domain, Tree.Builder b, int parent) throws TermParser.ParseException {
        if (t instanceof Term.Atom a) {
            if (!a.isNumber()) throw new TermParser.ParseException("Unexpected symbol in expression", a.toText());
            return add(b, parent, Node.number(a.number()));
        }
        var l = (Term.Lst) t;
        var op = l.op().orElseThrow(() -> new TermParser.ParseException("Expression has no operator", l.toText()));
        Node head;
        switch (op) {
            case "and" -> head = Node.of(NodeType.AND);
            case "or" -> head = Node.of(NodeType.OR);
            case "oneof" -> head = Node.of(NodeType.ONE_OF);
            case "not", "unknown" -> {
                if (l.size() != 2) throw new TermParser.ParseException(op + " takes one argument", l.toText());
                head = Node.of(op.equals("not") ? NodeType.NOT : NodeType.UNKNOWN);
            }
            default -> {
                var arithmetic = Node.Op.parse(op);
                if (arithmetic.isPresent()) {
                    head = arithmetic.get().modifier() ? Node.modifier(arithmetic.get()) : Node.expression(arithmetic.get());
                } else {
                    var leafType = domain.getFunction(op).isPresent() ? NodeType.FUNCTION : NodeType.PREDICATE;
                    return add(b, parent, atom(l, leafType, domain));
                }
            }
        }
        var id = add(b, parent, head);
        for (var arg : l.args()) expression(arg, domain, b, id);
        return id;
    }

    private static int add(Tree.Builder b, int parent, Node n) {
        return parent < 0 ? b.add(n) : b.add(parent, n);
    }

    private static String abbreviate(String text) {
        return text.length() <= 60 ? text : text.substring(0, 60) + "...";
    }
}
