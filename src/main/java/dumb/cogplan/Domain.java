package dumb.cogplan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Static knowledge about a planning domain: its types and the signatures of its predicates and functions. The
 * knowledge base only reads it.
 */
public interface Domain {
    String OBJECT = "object";

    Set<String> getTypes();

    Optional<Signature> getPredicate(String name);

    Optional<Signature> getFunction(String name);

    boolean existDomain(String name);

    /** Primary domain name, written into emitted problems. */
    String getName();

    /** The domain definition as PDDL text. */
    String getDomain();

    List<Instance> getConstants();

    default boolean isConstant(Instance instance) {
        return getConstants().contains(instance);
    }

    /**
     * @param params one entry per position; each carries the declared type and all of its subtypes
     */
    record Signature(String name, List<Param> params) {
        public Signature {
            requireNonNull(name);
            params = List.copyOf(params);
        }

        public int arity() {
            return params.size();
        }
    }

    class Basic implements Domain {
        private final String name;
        private final Set<String> names = new LinkedHashSet<>();
        private final Map<String, String> parents = new LinkedHashMap<>();
        private final Map<String, List<Param>> predicates = new LinkedHashMap<>();
        private final Map<String, List<Param>> functions = new LinkedHashMap<>();
        private final List<Instance> constants = new ArrayList<>();

        public Basic(String name) {
            this.name = requireNonNull(name).toLowerCase();
            names.add(this.name);
        }

        /**
         * Reads the {@code :types}, {@code :constants}, {@code :predicates} and {@code :functions} sections of a
         * domain file. Other sections, such as actions, are skipped.
         */
        public static Basic parse(String pddl) throws TermParser.ParseException {
            var text = TermParser.stripComments(pddl).toLowerCase();
            var top = TermParser.parseSingle(text);
            if (!(top instanceof Term.Lst def) || !def.is("define") || def.size() < 2)
                throw new TermParser.ParseException("Domain must be a (define (domain NAME) ...) form", text);
            if (!(def.get(1) instanceof Term.Lst header) || !header.is("domain") || header.size() != 2 || !(header.get(1) instanceof Term.Atom domainName))
                throw new TermParser.ParseException("Missing (domain NAME) header", def.get(1).toText());

            var d = new Basic(domainName.value());
            for (var section : def.terms.subList(2, def.size())) {
                if (!(section instanceof Term.Lst s) || s.op().isEmpty())
                    throw new TermParser.ParseException("Unexpected domain section", section.toText());
                switch (s.op().get()) {
                    case ":types" -> {
                        for (var e : PddlGrammar.typedList(s.args(), s.toText())) d.type(e.getKey(), e.getValue());
                    }
                    case ":constants" -> {
                        for (var e : PddlGrammar.typedList(s.args(), s.toText())) d.constant(e.getKey(), e.getValue());
                    }
                    case ":predicates" -> {
                        for (var decl : s.args()) {
                            var sig = signature(decl);
                            d.predicate(sig.name(), sig.params());
                        }
                    }
                    case ":functions" -> {
                        for (var decl : s.args()) {
                            if (decl instanceof Term.Atom) continue; // "- number" return types
                            var sig = signature(decl);
                            d.function(sig.name(), sig.params());
                        }
                    }
                    default -> {
                    }
                }
            }
            return d;
        }

        private static Signature signature(Term decl) throws TermParser.ParseException {
            if (!(decl instanceof Term.Lst l) || l.op().isEmpty())
                throw new TermParser.ParseException("Malformed declaration", decl.toText());
            var args = l.args();
            for (var i = 0; i < args.size(); i++) {
                if (args.get(i).isAtom("-")) i++;
                else if (!(args.get(i) instanceof Term.Atom a) || !a.isVariable())
                    throw new TermParser.ParseException("Parameters must be ?variables", l.toText());
            }
            var params = PddlGrammar.typedList(l.args(), l.toText()).stream()
                    .map(e -> Param.of(e.getKey(), e.getValue()))
                    .toList();
            return new Signature(l.op().get(), params);
        }

        public Basic alsoNamed(String otherName) {
            names.add(otherName.toLowerCase());
            return this;
        }

        public Basic type(String type) {
            return type(type, OBJECT);
        }

        public Basic type(String type, String parent) {
            if (!type.equals(OBJECT)) parents.put(type, parent);
            if (!parent.equals(OBJECT)) parents.putIfAbsent(parent, OBJECT);
            return this;
        }

        public Basic constant(String constantName, String type) {
            constants.add(new Instance(constantName, type));
            return this;
        }

        /** Declares a predicate whose parameters have the given types, named {@code ?p0}, {@code ?p1}... */
        public Basic predicate(String predicateName, String... paramTypes) {
            return predicate(predicateName, positional(paramTypes));
        }

        public Basic predicate(String predicateName, List<Param> params) {
            predicates.put(predicateName, List.copyOf(params));
            return this;
        }

        public Basic function(String functionName, String... paramTypes) {
            return function(functionName, positional(paramTypes));
        }

        public Basic function(String functionName, List<Param> params) {
            functions.put(functionName, List.copyOf(params));
            return this;
        }

        private static List<Param> positional(String... types) {
            var params = new ArrayList<Param>(types.length);
            for (var i = 0; i < types.length; i++) params.add(Param.of("?p" + i, types[i]));
            return params;
        }

        /** Every type below {@code type} in the hierarchy, excluding itself. */
        public Set<String> subTypes(String type) {
            var out = new LinkedHashSet<String>();
            for (var t : parents.keySet()) {
                var p = parents.get(t);
                var guard = 0;
                while (p != null && guard++ <= parents.size()) {
                    if (p.equals(type)) {
                        out.add(t);
                        break;
                    }
                    p = parents.get(p);
                }
            }
            return out;
        }

        @Override
        public Set<String> getTypes() {
            var types = new LinkedHashSet<String>();
            types.add(OBJECT);
            types.addAll(parents.keySet());
            return types;
        }

        @Override
        public Optional<Signature> getPredicate(String predicateName) {
            return Optional.ofNullable(predicates.get(predicateName)).map(p -> resolve(predicateName, p));
        }

        @Override
        public Optional<Signature> getFunction(String functionName) {
            return Optional.ofNullable(functions.get(functionName)).map(p -> resolve(functionName, p));
        }

        private Signature resolve(String signatureName, List<Param> params) {
            return new Signature(signatureName, params.stream()
                    .map(p -> new Param(p.name(), p.type(), List.copyOf(subTypes(p.type()))))
                    .toList());
        }

        @Override
        public boolean existDomain(String domainName) {
            return domainName != null && names.contains(domainName.toLowerCase());
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public List<Instance> getConstants() {
            return List.copyOf(constants);
        }

        @Override
        public String getDomain() {
            var sb = new StringBuilder("(define (domain ").append(name).append(")\n");
            sb.append("(:requirements :strips :typing)\n");
            sb.append("(:types\n");
            byParent(parents.entrySet()).forEach((parent, types) ->
                    sb.append("  ").append(String.join(" ", types)).append(" - ").append(parent).append('\n'));
            sb.append(")\n");
            if (!constants.isEmpty()) {
                sb.append("(:constants\n");
                constants.forEach(c -> sb.append("  ").append(c).append('\n'));
                sb.append(")\n");
            }
            declarations(sb, ":predicates", predicates);
            if (!functions.isEmpty()) declarations(sb, ":functions", functions);
            return sb.append(")\n").toString();
        }

        private static Map<String, List<String>> byParent(Collection<Map.Entry<String, String>> entries) {
            return entries.stream().collect(Collectors.groupingBy(Map.Entry::getValue, LinkedHashMap::new,
                    Collectors.mapping(Map.Entry::getKey, Collectors.toList())));
        }

        private static void declarations(StringBuilder sb, String section, Map<String, List<Param>> decls) {
            sb.append('(').append(section).append('\n');
            decls.forEach((declName, params) -> {
                sb.append("  (").append(declName);
                params.forEach(p -> sb.append(' ').append(p.name()).append(" - ").append(p.type()));
                sb.append(")\n");
            });
            sb.append(")\n");
        }
    }
}
