package dumb.cogplan;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.cogplan.util.Json;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CogPlanTest {

    @Test
    void configurationDefaults() throws JsonProcessingException {
        var c = CogPlan.loadConfig("{}");
        assertEquals("problem_1", c.problemName());
        assertTrue(c.lowerCaseNames());
        assertEquals(c, new CogPlan.Configuration());
    }

    @Test
    void partialConfiguration() throws JsonProcessingException {
        var c = CogPlan.loadConfig("{ \"lowerCaseNames\": false, \"unused\": 1 }");
        assertEquals("problem_1", c.problemName());
        assertFalse(c.lowerCaseNames());
    }

    @Test
    void configurationRoundTrips() throws JsonProcessingException {
        var c = new CogPlan.Configuration("patrol", false);
        assertEquals(c, CogPlan.loadConfig(Json.str(c)));
    }

    @Test
    void loadsFiles() throws Exception {
        var cog = CogPlan.load(path(AbstractTest.DOMAIN_FILE), path("cogplan.json"));
        assertEquals("patrol", cog.config.problemName());
        assertTrue(cog.knowledge.addProblem(AbstractTest.resource(AbstractTest.PROBLEM_FILE)));
        assertTrue(cog.knowledge.getProblem().startsWith("(define (problem patrol)\n(:domain robots)"));
    }

    private static Path path(String resource) throws Exception {
        return Path.of(CogPlanTest.class.getClassLoader().getResource(resource).toURI());
    }
}
