package dumb.cogplan;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.cogplan.util.Json;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreeTest {

    private static final Tree GOAL = Tree.of(NodeType.AND,
            Tree.of(Node.predicate("robot_at", "r2d2", "kitchen")),
            Tree.of(NodeType.NOT, Tree.of(Node.predicate("door_open", "hall"))),
            Tree.of(Node.expression(Node.Op.GT), List.of(
                    Tree.of(Node.function("battery", 0, "r2d2")),
                    Tree.of(Node.number(20)))));

    @Test
    void nodesAreNumberedInOrder() {
        assertEquals(7, GOAL.size());
        assertEquals(List.of(1, 2, 4), GOAL.root().children());
        for (var i = 0; i < GOAL.size(); i++) assertEquals(i, GOAL.node(i).id());
        assertEquals(NodeType.PREDICATE, GOAL.node(3).type());
    }

    @Test
    void equalityIgnoresParamTypesAndFunctionValues() {
        var typed = Node.predicate("robot_at", false, List.of(Param.of("r2d2", "robot"), Param.of("kitchen", "room")));
        assertEquals(Tree.of(typed), Tree.of(Node.predicate("robot_at", "r2d2", "kitchen")));
        assertEquals(Tree.of(typed).hashCode(), Tree.of(Node.predicate("robot_at", "r2d2", "kitchen")).hashCode());
        assertEquals(Tree.of(Node.function("battery", 10, "r2d2")), Tree.of(Node.function("battery", 90, "r2d2")));

        assertNotEquals(Tree.of(Node.predicate("robot_at", "r2d2", "kitchen")), Tree.of(Node.predicate("robot_at", "kitchen", "r2d2")));
        assertNotEquals(Tree.of(Node.predicate("door_open", "hall")), Tree.of(Node.parsePredicate("(not (door_open hall))")));
        assertNotEquals(Tree.of(Node.number(1)), Tree.of(Node.number(2)));
        assertNotEquals(Tree.of(Node.expression(Node.Op.GT)), Tree.of(Node.expression(Node.Op.GE)));
    }

    @Test
    void childOrderMatters() {
        var a = Tree.of(NodeType.OR, Tree.of(Node.predicate("p", "a")), Tree.of(Node.predicate("q", "a")));
        var b = Tree.of(NodeType.OR, Tree.of(Node.predicate("q", "a")), Tree.of(Node.predicate("p", "a")));
        assertNotEquals(a, b);
    }

    @Test
    void subtreesAreRenumbered() {
        var subs = GOAL.subtrees();
        assertEquals(3, subs.size());
        assertEquals(Tree.of(NodeType.NOT, Tree.of(Node.predicate("door_open", "hall"))), subs.get(1));
        assertEquals(0, subs.get(2).root().id());
        assertEquals(List.of(1, 2), subs.get(2).root().children());

        var single = Tree.of(Node.predicate("door_open", "hall"));
        assertEquals(List.of(single), single.subtrees());
        assertTrue(Tree.EMPTY.subtrees().isEmpty());
    }

    @Test
    void fromSubtreesRebuilds() {
        assertEquals(GOAL, Tree.fromSubtrees(GOAL.subtrees(), NodeType.AND).orElseThrow());
        assertTrue(Tree.fromSubtrees(List.of(), NodeType.AND).isEmpty());

        var leaf = Tree.of(Node.predicate("door_open", "hall"));
        assertEquals(leaf, Tree.fromSubtrees(List.of(leaf), NodeType.PREDICATE).orElseThrow());
        assertThrows(IllegalArgumentException.class, () -> Tree.fromSubtrees(List.of(leaf, leaf), NodeType.NOT));
    }

    @Test
    void leafQueries() {
        assertEquals(2, GOAL.predicates().size());
        assertEquals(1, GOAL.functions().size());
        assertEquals(List.of(Node.predicate("door_open", "hall").withId(3)), GOAL.predicates(2));
        assertEquals(1, GOAL.subtreesOfType(NodeType.EXPRESSION).size());
        assertTrue(GOAL.mentions("hall"));
        assertFalse(GOAL.mentions("c1"));
    }

    @Test
    void rejectsMalformedArrays() {
        var p = Node.predicate("door_open", "hall");
        assertThrows(IllegalArgumentException.class, () -> Tree.of(List.of(p.withId(1))), "id mismatch");
        assertThrows(IllegalArgumentException.class, () -> Tree.of(List.of(
                Node.of(NodeType.AND).withChildren(List.of(1, 5)), p.withId(1))), "child out of range");
        assertThrows(IllegalArgumentException.class, () -> Tree.of(List.of(
                Node.of(NodeType.AND).withChildren(List.of(1, 1)), p.withId(1))), "two parents");
        assertThrows(IllegalArgumentException.class, () -> Tree.of(List.of(
                Node.of(NodeType.AND).withChildren(List.of(0)))), "cycle through root");
        assertThrows(IllegalArgumentException.class, () -> Tree.of(List.of(
                Node.of(NodeType.AND), p.withId(1))), "unreachable");
        assertThrows(IllegalArgumentException.class, () -> Node.of(NodeType.EXPRESSION));
        assertThrows(IllegalArgumentException.class, () -> Node.modifier(Node.Op.GT));
    }

    @Test
    void jsonExchange() throws JsonProcessingException {
        var json = Json.str(GOAL);
        assertTrue(json.contains("\"node_type\" : \"PREDICATE\""), json);
        assertTrue(json.contains("\"op\" : \">\""), json);

        var back = Json.obj(json, Tree.class);
        assertEquals(GOAL, back);
        assertEquals(GOAL.nodes(), back.nodes());
    }

    @Test
    void jsonWithBrokenLinksIsRejected() {
        var json = """
                [ { "node_type" : "NOT", "node_id" : 0, "children" : [ 2 ] },
                  { "node_type" : "PREDICATE", "node_id" : 1, "name" : "door_open", "parameters" : [ { "name" : "hall" } ] } ]
                """;
        assertThrows(JsonProcessingException.class, () -> Json.obj(json, Tree.class));
    }

    @Test
    void prints() {
        assertEquals("(and (robot_at r2d2 kitchen) (not (door_open hall)) (> (battery r2d2) 20))", GOAL.toString());
        assertEquals("(not (door_open hall))", GOAL.print(2));
        assertEquals("(door_open hall)", Tree.of(NodeType.NOT, Tree.of(Node.predicate("door_open", "hall"))).print(1));
        assertEquals("(not (door_open hall))", Tree.of(Node.parsePredicate("(not (door_open hall))")).toString());
        assertEquals("(DOOR_OPEN Hall)", Tree.of(Node.predicate("DOOR_OPEN", "Hall")).print(false, false));
        assertEquals("(door_open Hall)", Tree.of(Node.predicate("DOOR_OPEN", "Hall")).print(true, false));
    }

    @Test
    void explicitNegation() {
        var negated = Tree.of(Node.parsePredicate("(not (door_open hall))"));
        var not = Tree.of(NodeType.NOT, Tree.of(Node.predicate("door_open", "hall")));
        assertNotEquals(not, negated);
        assertEquals(not, negated.explicitNegation());
        assertEquals(negated.toString(), negated.explicitNegation().toString());

        var mixed = Tree.of(NodeType.OR, Tree.of(Node.predicate("p", "a")), negated);
        assertEquals(Tree.of(NodeType.OR, Tree.of(Node.predicate("p", "a")), not), mixed.explicitNegation());
        assertSame(GOAL, GOAL.explicitNegation(), "nothing to rewrite");
    }
}
