package dumb.cogplan;

import com.fasterxml.jackson.annotation.JsonProperty;

import static java.util.Objects.requireNonNull;

/** A named object of the world. The name is unique across the knowledge base. */
public record Instance(@JsonProperty("name") String name, @JsonProperty("type") String type) {
    public Instance {
        requireNonNull(name);
        requireNonNull(type);
    }

    @Override
    public String toString() {
        return name + " - " + type;
    }
}
