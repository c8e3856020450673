package dumb.cogplan;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContingencyTest extends AbstractTest {

    @BeforeEach
    void addObjects() {
        patrol();
    }

    @Test
    void singleAlternativeIsCertain() {
        assertTrue(k.addConditional(oneOf("(door_open hall)")));
        assertTrue(k.getConditionals().isEmpty());
        assertTrue(k.existPredicate(Node.predicate("door_open", "hall")));
    }

    @Test
    void duplicateConditionalIsStoredOnce() {
        assertTrue(k.addConditional(unknown("(door_open kitchen)")));
        assertTrue(k.addConditional(unknown("(door_open kitchen)")));
        assertEquals(1, k.getConditionals().size());
    }

    @Test
    void malformedConditionalsAreRejected() {
        assertFalse(k.addConditional(Tree.of(NodeType.AND, fact("(door_open hall)"))));
        assertFalse(k.addConditional(Tree.of(NodeType.OR, fact("(door_open hall)"), fact("(door_open kitchen)"), fact("(door_open home)"))));
        assertFalse(k.addConditional(Tree.of(NodeType.UNKNOWN, fact("(door_open hall)"), fact("(door_open kitchen)"))));
        assertFalse(k.addConditional(unknown("(door_open garage)")), "unknown instance");
        assertFalse(k.addConditional(Tree.EMPTY));
        assertTrue(k.getConditionals().isEmpty());
    }

    @Test
    void orKeepsNegation() {
        var or = Tree.of(NodeType.OR, fact("(carrying r2d2)"), fact("(not (door_open hall))"));
        assertTrue(k.addConditional(or));
        assertTrue(k.existConditional(or));
        assertFalse(k.existConditional(Tree.of(NodeType.OR, fact("(carrying r2d2)"), fact("(door_open hall)"))));
    }

    @Test
    void resolvingAnUnknownNarrowsOneOf() {
        k.addConditional(unknown("(door_open kitchen)"));
        k.addConditional(oneOf("(door_open kitchen)", "(door_open hall)", "(door_open home)"));

        assertTrue(k.removeConditional(unknown("(door_open kitchen)")));

        assertEquals(List.of(oneOf("(door_open hall)", "(door_open home)")), k.getConditionals());
        assertTrue(k.getPredicates().isEmpty());
    }

    @Test
    void oneOfNarrowedToOneBecomesAPredicate() {
        k.addConditional(unknown("(door_open kitchen)"));
        k.addConditional(oneOf("(door_open kitchen)", "(door_open hall)"));

        assertTrue(k.removeConditional(unknown("(door_open kitchen)")));

        assertTrue(k.getConditionals().isEmpty());
        assertTrue(k.existPredicate(Node.predicate("door_open", "hall")));
    }

    @Test
    void unrelatedOneOfSurvives() {
        var carrying = Tree.of(NodeType.OR, fact("(carrying r2d2)"), fact("(door_open home)"));
        k.addConditional(unknown("(door_open kitchen)"));
        k.addConditional(oneOf("(door_open hall)", "(door_open home)"));
        k.addConditional(carrying);

        k.removeConditional(unknown("(door_open kitchen)"));

        assertEquals(2, k.getConditionals().size());
        assertTrue(k.existConditional(carrying));
        assertTrue(k.existConditional(oneOf("(door_open hall)", "(door_open home)")));
    }

    @Test
    void removingAnAbsentConditionalIsANoOp() {
        assertTrue(k.removeConditional(unknown("(door_open hall)")));
        assertFalse(k.removeConditional(unknown("(door_open garage)")));
    }

    @Test
    void removingAnInstanceNarrowsOneOf() {
        k.addConditional(oneOf("(door_open kitchen)", "(door_open hall)", "(door_open home)"));

        k.removeInstance("kitchen");
        assertEquals(List.of(oneOf("(door_open hall)", "(door_open home)")), k.getConditionals());

        k.removeInstance("hall");
        assertTrue(k.getConditionals().isEmpty());
        assertTrue(k.existPredicate(Node.predicate("door_open", "home")));
    }
}
