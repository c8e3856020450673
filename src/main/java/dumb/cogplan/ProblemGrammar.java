package dumb.cogplan;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Turns problem text into trees. Owns tokenizing and structure only; which tree becomes which kind of knowledge is
 * decided by {@link ProblemCodec}.
 */
public interface ProblemGrammar {

    /** The name in the {@code (:domain NAME)} clause, if there is one. */
    Optional<String> domainName(String text);

    ParsedProblem parse(String text, Domain domain) throws TermParser.ParseException;

    /**
     * @param init         ground facts, each a single PREDICATE or FUNCTION node
     * @param conditionals uncertain facts headed by UNKNOWN, ONE_OF or OR
     * @param goal         empty when the text has no goal
     */
    record ParsedProblem(String name, String domainName, List<Instance> objects, List<Tree> init,
                         List<Tree> conditionals, Tree goal) {
        public ParsedProblem {
            requireNonNull(name);
            requireNonNull(domainName);
            objects = List.copyOf(objects);
            init = List.copyOf(init);
            conditionals = List.copyOf(conditionals);
            requireNonNull(goal);
        }
    }
}
