package dumb.cogplan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.cogplan.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static dumb.cogplan.Log.debug;
import static dumb.cogplan.Log.error;
import static dumb.cogplan.Log.message;

/**
 * Command-line entry: loads a domain, optionally imports a problem into a fresh knowledge base, and prints the problem
 * as the knowledge base now sees it.
 */
public class CogPlan {
    static final String DEFAULT_PROBLEM_NAME = "problem_1";
    static final boolean DEFAULT_LOWER_CASE_NAMES = true;

    public final Configuration config;
    public final Knowledge knowledge;

    public CogPlan(Domain domain, Configuration config) {
        this.config = config;
        this.knowledge = new Knowledge(domain, new ProblemCodec(config));
    }

    public static CogPlan load(Path domainFile, @Nullable Path configFile) throws IOException, TermParser.ParseException {
        var config = configFile != null ? loadConfig(Files.readString(configFile)) : new Configuration();
        debug("Configuration: " + Json.str(config));
        return new CogPlan(Domain.Basic.parse(Files.readString(domainFile)), config);
    }

    public static Configuration loadConfig(String json) throws JsonProcessingException {
        return Json.obj(json, Configuration.class);
    }

    public static void main(String[] args) {
        String domainFile = null, problemFile = null, configFile = null;

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-d", "--domain" -> domainFile = args[++i];
                    case "-p", "--problem" -> problemFile = args[++i];
                    case "-c", "--config" -> configFile = args[++i];
                    default -> Log.warning("Unknown option: " + args[i]);
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                error("Missing value for " + args[i - 1]);
                printUsageAndExit();
            }
        }
        if (domainFile == null) printUsageAndExit();

        try {
            var c = load(Path.of(domainFile), configFile != null ? Path.of(configFile) : null);
            if (problemFile != null && !c.knowledge.addProblem(Files.readString(Path.of(problemFile)))) {
                error("Problem not loaded: " + problemFile);
                System.exit(2);
            }
            System.out.println(c.knowledge.getProblem());
            var goal = c.knowledge.getGoal();
            if (!goal.isEmpty()) message("Goal satisfied: " + c.knowledge.isGoalSatisfied(goal));
        } catch (IOException | TermParser.ParseException e) {
            error("Startup failed: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void printUsageAndExit() {
        System.err.printf("Usage: java %s -d domain.pddl [-p problem.pddl] [-c config.json]%n", CogPlan.class.getName());
        System.exit(1);
    }

    public record Configuration(
            @JsonProperty("problemName") String problemName,
            @JsonProperty("lowerCaseNames") boolean lowerCaseNames
    ) {
        @JsonCreator
        public Configuration(
                @JsonProperty("problemName") String problemName,
                @JsonProperty("lowerCaseNames") Boolean lowerCaseNames
        ) {
            this(
                    problemName != null ? problemName : DEFAULT_PROBLEM_NAME,
                    lowerCaseNames != null ? lowerCaseNames : DEFAULT_LOWER_CASE_NAMES
            );
        }

        public Configuration() {
            this(DEFAULT_PROBLEM_NAME, DEFAULT_LOWER_CASE_NAMES);
        }
    }
}
