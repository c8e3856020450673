package dumb.cogplan;

public enum NodeType {
    AND, OR, NOT, UNKNOWN, ONE_OF, PREDICATE, FUNCTION, EXPRESSION, FUNCTION_MODIFIER, NUMBER;

    /** Node kinds whose children form an arbitrary-length, order-preserving list. */
    public boolean combinator() {
        return switch (this) {
            case AND, OR, ONE_OF -> true;
            case NOT, UNKNOWN, PREDICATE, FUNCTION, EXPRESSION, FUNCTION_MODIFIER, NUMBER -> false;
        };
    }

    public boolean leaf() {
        return switch (this) {
            case PREDICATE, FUNCTION, NUMBER -> true;
            case AND, OR, NOT, UNKNOWN, ONE_OF, EXPRESSION, FUNCTION_MODIFIER -> false;
        };
    }

    /** Keyword used in PDDL text, for the node kinds that have one. */
    public String keyword() {
        return switch (this) {
            case AND -> "and";
            case OR -> "or";
            case NOT -> "not";
            case UNKNOWN -> "unknown";
            case ONE_OF -> "oneof";
            case PREDICATE, FUNCTION, EXPRESSION, FUNCTION_MODIFIER, NUMBER -> "";
        };
    }
}
