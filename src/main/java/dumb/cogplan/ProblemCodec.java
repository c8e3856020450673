package dumb.cogplan;

import static dumb.cogplan.Log.debug;
import static dumb.cogplan.Log.error;
import static dumb.cogplan.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Moves a {@link Knowledge} state to and from problem text.
 * <p>
 * Reading happens in two phases. The first checks the input, resolves the domain and parses the whole text; any
 * failure there returns {@code false} before anything is imported. The second imports item by item, and an item that
 * the knowledge base rejects is logged and skipped.
 */
public class ProblemCodec {
    private final CogPlan.Configuration config;
    private final ProblemGrammar grammar;

    public ProblemCodec(CogPlan.Configuration config) {
        this(config, new PddlGrammar());
    }

    public ProblemCodec(CogPlan.Configuration config, ProblemGrammar grammar) {
        this.config = requireNonNull(config);
        this.grammar = requireNonNull(grammar);
    }

    public String write(Knowledge k) {
        var lower = config.lowerCaseNames();
        var domain = k.domain();
        var sb = new StringBuilder();
        sb.append("(define (problem ").append(config.problemName()).append(")\n");
        sb.append("(:domain ").append(domain.getName()).append(")\n");

        sb.append("(:objects\n");
        for (var i : k.getInstances()) {
            if (domain.isConstant(i)) continue;
            sb.append("  ").append(i.name()).append(" - ").append(lower ? i.type().toLowerCase() : i.type()).append('\n');
        }
        sb.append(")\n");

        sb.append("(:init\n");
        for (var p : k.getPredicates())
            sb.append("  ").append(p.negate() ? "(not " + p.atom(lower) + ")" : p.atom(lower)).append('\n');
        for (var c : k.getConditionals())
            sb.append("  ").append(conditional(c, lower)).append('\n');
        for (var f : k.getFunctions())
            sb.append("  (= ").append(f.atom(lower)).append(' ').append(Node.format(f.value())).append(")\n");
        sb.append(")\n");

        var goal = k.getGoal();
        if (!goal.isEmpty()) sb.append("(:goal ").append(goal.print(lower, true)).append(")\n");
        return sb.append(")\n").toString();
    }

    private static String conditional(Tree c, boolean lower) {
        return switch (c.root().type()) {
            case UNKNOWN, ONE_OF, OR -> c.print(lower, false);
            case AND, NOT, PREDICATE, FUNCTION, EXPRESSION, FUNCTION_MODIFIER, NUMBER ->
                    throw new IllegalStateException("Not an uncertain fact: " + c);
        };
    }

    /**
     * @return {@code false} if the text was not imported at all; items rejected during import do not change the
     * result
     */
    public boolean read(String text, Knowledge k) {
        if (text == null || text.isBlank()) {
            warning("Empty problem");
            return false;
        }
        var source = TermParser.stripComments(config.lowerCaseNames() ? text.toLowerCase() : text);

        var domainName = grammar.domainName(source);
        if (domainName.isEmpty()) {
            error("Problem declares no domain");
            return false;
        }
        if (!k.domain().existDomain(domainName.get())) {
            error("Unknown domain in problem: " + domainName.get());
            return false;
        }

        ProblemGrammar.ParsedProblem parsed;
        try {
            parsed = grammar.parse(source, k.domain());
        } catch (TermParser.ParseException e) {
            error("Could not parse problem: " + e.getMessage());
            return false;
        }

        debug("Importing problem " + parsed.name());
        for (var c : k.domain().getConstants())
            if (!k.addInstance(c)) warning("Skipped constant " + c);
        for (var i : parsed.objects())
            if (!k.addInstance(i)) warning("Skipped object " + i);
        for (var fact : parsed.init()) importFact(fact, k);
        for (var c : parsed.conditionals())
            if (!k.addConditional(c)) warning("Skipped uncertain fact " + c);
        if (!parsed.goal().isEmpty() && !k.setGoal(parsed.goal()))
            warning("Goal not imported: " + parsed.goal());
        return true;
    }

    private static void importFact(Tree fact, Knowledge k) {
        var n = fact.root();
        var ok = switch (n.type()) {
            case PREDICATE -> k.addPredicate(n);
            case FUNCTION -> k.addFunction(n);
            case AND, OR, NOT, UNKNOWN, ONE_OF, EXPRESSION, FUNCTION_MODIFIER, NUMBER -> false;
        };
        if (!ok) warning("Skipped initial fact " + fact);
    }
}
