package dumb.cogplan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A typed parameter slot. In a ground fact the name is an instance name; in a domain signature it is the
 * variable name and {@code subTypes} lists every type assignable to {@code type}.
 */
public record Param(@JsonProperty("name") String name,
                    @JsonProperty("type") String type,
                    @JsonProperty("sub_types") List<String> subTypes) {

    @JsonCreator
    public Param {
        requireNonNull(name);
        type = type == null ? "" : type;
        subTypes = subTypes == null ? List.of() : List.copyOf(subTypes);
    }

    public static Param of(String name) {
        return new Param(name, "", List.of());
    }

    public static Param of(String name, String type) {
        return new Param(name, type, List.of());
    }

    public boolean accepts(String instanceType) {
        return type.equals(instanceType) || subTypes.contains(instanceType);
    }
}
