package dumb.cogplan;

import dumb.cogplan.TermParser.ParseException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KnowledgeTest extends AbstractTest {

    @Test
    void instancesAreIdempotentAndTyped() {
        assertTrue(k.addInstance(new Instance("r2d2", "robot")));
        assertTrue(k.addInstance(new Instance("r2d2", "robot")));
        assertEquals(1, k.getInstances().size());

        assertFalse(k.addInstance(new Instance("r2d2", "room")), "same name, other type");
        assertFalse(k.addInstance(new Instance("toaster", "appliance")), "unknown type");
        assertEquals(1, k.getInstances().size());

        assertTrue(k.existInstance("r2d2"));
        assertEquals("robot", k.getInstance("r2d2").orElseThrow().type());
    }

    @Test
    void predicatesAreCheckedAgainstSignatures() {
        patrol();
        assertTrue(k.addPredicate(Node.predicate("robot_at", "r2d2", "hall")));
        assertTrue(k.addPredicate(Node.predicate("robot_at", "r2d2", "c1")), "corridor is a location");

        assertFalse(k.addPredicate(Node.predicate("robot_at", "hall", "r2d2")), "swapped types");
        assertFalse(k.addPredicate(Node.predicate("robot_at", "r2d2")), "arity");
        assertFalse(k.addPredicate(Node.predicate("robot_at", "c3po", "hall")), "unknown instance");
        assertFalse(k.addPredicate(Node.predicate("flying", "r2d2")), "undeclared predicate");
        assertFalse(k.addPredicate(Node.function("battery", 3, "r2d2")), "not a predicate");

        assertEquals(2, k.getPredicates().size());
    }

    @Test
    void duplicatePredicateIsStoredOnce() {
        patrol();
        assertTrue(k.addPredicate(Node.predicate("door_open", "hall")));
        assertTrue(k.addPredicate(Node.parsePredicate("(door_open hall)")));
        assertEquals(1, k.getPredicates().size());
    }

    @Test
    void negatedPredicateIsDistinct() {
        patrol();
        assertTrue(k.addPredicate(Node.predicate("door_open", "hall")));
        assertTrue(k.addPredicate(Node.parsePredicate("(not (door_open hall))")));
        assertEquals(2, k.getPredicates().size());
    }

    @Test
    void removePredicate() {
        patrol();
        k.addPredicate(Node.predicate("door_open", "hall"));
        k.addPredicate(Node.predicate("door_open", "kitchen"));

        assertTrue(k.removePredicate(Node.predicate("door_open", "hall")));
        assertFalse(k.existPredicate(Node.predicate("door_open", "hall")));
        assertTrue(k.existPredicate(Node.predicate("door_open", "kitchen")));

        assertTrue(k.removePredicate(Node.predicate("door_open", "hall")), "valid but absent");
        assertFalse(k.removePredicate(Node.predicate("door_open", "garage")), "invalid");
        assertEquals(1, k.getPredicates().size());
    }

    @Test
    void lookupByText() {
        patrol();
        k.addPredicate(Node.predicate("robot_at", "r2d2", "hall"));
        k.addFunction(Node.function("battery", 40, "r2d2"));

        assertTrue(k.getPredicate("(robot_at r2d2 hall)").isPresent());
        assertTrue(k.getPredicate("(robot_at r2d2 kitchen)").isEmpty());
        assertTrue(k.getPredicate("(robot_at r2d2").isEmpty(), "malformed text is reported, not thrown");
        assertEquals(40, k.getFunction("(battery r2d2)").orElseThrow().value());
    }

    @Test
    void addingAKnownFunctionUpdatesItsValue() {
        patrol();
        assertTrue(k.addFunction(Node.function("battery", 80, "r2d2")));
        assertTrue(k.addFunction(Node.function("battery", 55, "r2d2")));

        assertEquals(1, k.getFunctions().size());
        assertEquals(55, k.getFunctions().get(0).value());
    }

    @Test
    void updateFunction() {
        patrol();
        assertFalse(k.updateFunction(Node.function("battery", 10, "r2d2")), "nothing to update");
        k.addFunction(Node.function("distance", 2.5, "hall", "c1"));
        k.addFunction(Node.function("battery", 80, "r2d2"));

        assertTrue(k.updateFunction(Node.function("distance", 3, "hall", "c1")));
        var functions = k.getFunctions();
        assertEquals("battery", functions.get(0).name());
        assertEquals(3, functions.get(1).value(), "updated value is appended");
    }

    @Test
    void removeFunction() {
        patrol();
        k.addFunction(Node.function("battery", 80, "r2d2"));
        assertTrue(k.removeFunction(Node.function("battery", 0, "r2d2")), "value is not part of identity");
        assertTrue(k.getFunctions().isEmpty());
        assertFalse(k.removeFunction(Node.function("battery", 0, "hall")));
    }

    @Test
    void goalMustBeValid() throws ParseException {
        patrol();
        assertTrue(k.setGoal(goal("(and (robot_at r2d2 kitchen) (> (battery r2d2) 20))")));
        assertFalse(k.setGoal(goal("(robot_at r2d2 garage)")));
        assertFalse(k.setGoal(goal("(and (robot_at kitchen r2d2))")));
        assertEquals(goal("(and (robot_at r2d2 kitchen) (> (battery r2d2) 20))"), k.getGoal(), "rejected goal leaves the old one");

        assertTrue(k.clearGoal());
        assertTrue(k.getGoal().isEmpty());
        assertFalse(k.setGoal(Tree.EMPTY));
    }

    @Test
    void malformedNegationIsInvalid() {
        patrol();
        var notTwice = Tree.of(NodeType.NOT, fact("(door_open hall)"), fact("(door_open kitchen)"));
        assertFalse(k.checkPredicateTreeTypes(notTwice, 0));
        assertFalse(k.checkPredicateTreeTypes(fact("(door_open hall)"), 3), "out of range");
    }

    @Test
    void removingAnInstanceCascades() throws ParseException {
        patrol();
        k.addPredicate(Node.predicate("robot_at", "r2d2", "hall"));
        k.addPredicate(Node.predicate("connected", "c1", "kitchen"));
        k.addPredicate(Node.predicate("door_open", "hall"));
        k.addFunction(Node.function("distance", 4, "c1", "kitchen"));
        k.addFunction(Node.function("battery", 80, "r2d2"));
        k.addConditional(unknown("(door_open kitchen)"));
        k.setGoal(goal("(and (robot_at r2d2 kitchen) (door_open hall))"));

        assertTrue(k.removeInstance("kitchen"));

        assertFalse(k.existInstance("kitchen"));
        assertEquals(2, k.getPredicates().size());
        assertEquals(1, k.getFunctions().size());
        assertTrue(k.getConditionals().isEmpty());
        assertEquals(goal("(and (door_open hall))"), k.getGoal());

        assertFalse(k.removeInstance("kitchen"), "already gone");
    }

    @Test
    void removingTheOnlyGoalSubjectEmptiesTheGoal() throws ParseException {
        patrol();
        k.setGoal(goal("(robot_at r2d2 kitchen)"));
        k.removeInstance(new Instance("kitchen", "room"));
        assertTrue(k.getGoal().isEmpty());
    }

    @Test
    void clearKnowledge() throws ParseException {
        patrol();
        k.addPredicate(Node.predicate("door_open", "hall"));
        k.setGoal(goal("(door_open hall)"));
        assertTrue(k.clearKnowledge());
        assertTrue(k.getInstances().isEmpty());
        assertTrue(k.getPredicates().isEmpty());
        assertTrue(k.getGoal().isEmpty());
    }

    @Test
    void nonFiniteFunctionValuesAreRejected() {
        patrol();
        assertFalse(k.addFunction(Node.function("battery", Double.NaN, "r2d2")));
        assertFalse(k.addFunction(Node.function("battery", Double.POSITIVE_INFINITY, "r2d2")));
        assertTrue(k.getFunctions().isEmpty());

        assertTrue(k.addFunction(Node.function("battery", 80, "r2d2")));
        assertFalse(k.addFunction(Node.function("battery", Double.NaN, "r2d2")));
        assertFalse(k.updateFunction(Node.function("battery", Double.NEGATIVE_INFINITY, "r2d2")));
        assertEquals(80, k.getFunctions().get(0).value());
    }

    @Test
    void negatedGoalLeavesBecomeNot() throws ParseException {
        patrol();
        assertTrue(k.setGoal(Tree.of(NodeType.AND, fact("(robot_at r2d2 hall)"), fact("(not (door_open hall))"))));
        assertEquals(goal("(and (robot_at r2d2 hall) (not (door_open hall)))"), k.getGoal());
        assertEquals(NodeType.NOT, k.getGoal().node(2).type());
    }
}
