package dumb.cogplan;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Raw s-expression read from PDDL text, before it is mapped onto a {@link Tree}.
 */
sealed public interface Term permits Term.Atom, Term.Lst {

    String toText();

    default boolean isAtom(String value) {
        return this instanceof Atom a && a.value().equals(value);
    }

    final class Lst implements Term {
        public final List<Term> terms;
        private volatile int hashCodeCache;
        private volatile boolean hashCodeCalculated = false;
        private volatile String textCache;

        public Lst(List<Term> terms) {
            this.terms = List.copyOf(terms);
        }

        public Lst(Term... terms) {
            this(List.of(terms));
        }

        public Term get(int index) {
            return terms.get(index);
        }

        public int size() {
            return terms.size();
        }

        public boolean isEmpty() {
            return terms.isEmpty();
        }

        /** Everything after the head. */
        public List<Term> args() {
            return terms.isEmpty() ? List.of() : terms.subList(1, terms.size());
        }

        public Optional<String> op() {
            return terms.isEmpty() || !(terms.get(0) instanceof Atom a) ? Optional.empty() : Optional.of(a.value());
        }

        public boolean is(String op) {
            return op().filter(op::equals).isPresent();
        }

        @Override
        public String toText() {
            if (textCache == null)
                textCache = terms.stream().map(Term::toText).collect(Collectors.joining(" ", "(", ")"));
            return textCache;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Lst that && this.hashCode() == that.hashCode() && terms.equals(that.terms));
        }

        @Override
        public int hashCode() {
            if (!hashCodeCalculated) {
                hashCodeCache = terms.hashCode();
                hashCodeCalculated = true;
            }
            return hashCodeCache;
        }

        @Override
        public String toString() {
            return "Lst" + terms;
        }
    }

    record Atom(String value) implements Term {
        private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

        public Atom {
            requireNonNull(value);
        }

        public static Atom of(String value) {
            return new Atom(value);
        }

        public boolean isNumber() {
            return NUMBER.matcher(value).matches();
        }

        public double number() {
            return Double.parseDouble(value);
        }

        /** A {@code ?name} parameter of a domain declaration. */
        public boolean isVariable() {
            return value.length() > 1 && value.charAt(0) == '?';
        }

        @Override
        public String toText() {
            return value;
        }

        @Override
        public String toString() {
            return "Atom[" + value + ']';
        }
    }
}
