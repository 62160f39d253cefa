package com.smartcampus.security.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.smartcampus.security.Action;
import com.smartcampus.security.ResourceKind;
import com.smartcampus.security.Role;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads a {@link PolicyTable} from YAML.
 * <p>
 * Each entry expands to the cross product of its roles, kinds and actions, so one line can
 * grant a role full management of several kinds. {@code "*"} stands for every kind or every
 * action. Both clauses are optional: {@code same-tenant} defaults to {@code true},
 * {@code ownership} to {@code false}.
 *
 * <pre>
 * rules:
 *   - roles: [teacher]
 *     kinds: [attendance, result]
 *     actions: [read, create, update]
 *     ownership: true
 *   - roles: [super_admin]
 *     kinds: [school]
 *     actions: ["*"]
 *     same-tenant: false
 * </pre>
 */
public final class PolicyTableLoader {

    /** Classpath location of the table shipped with this library. */
    public static final String DEFAULT_POLICY_RESOURCE = "policy/default-policy.yml";

    private static final String WILDCARD = "*";

    private static final String CLASSPATH_PREFIX = "classpath:";

    private static final String FILE_PREFIX = "file:";

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private PolicyTableLoader() {
        // utility class
    }

    /**
     * Loads the default table shipped in this library.
     */
    public static PolicyTable loadDefault() {
        return loadClasspath(DEFAULT_POLICY_RESOURCE);
    }

    /**
     * Loads a table from a classpath resource.
     *
     * @throws PolicyConfigurationException if the resource is missing or invalid
     */
    public static PolicyTable loadClasspath(String resource) {
        ClassLoader loader = PolicyTableLoader.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new PolicyConfigurationException("Policy resource not found: classpath:" + resource);
            }
            return load(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new PolicyConfigurationException("Failed to read policy resource: " + resource, e);
        }
    }

    /**
     * Loads a table from a file.
     */
    public static PolicyTable loadFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new PolicyConfigurationException("Failed to read policy file: " + path, e);
        }
    }

    /**
     * Loads a table from {@code classpath:<resource>}, {@code file:<path>} or a plain path.
     *
     * @throws PolicyConfigurationException if the location is blank, missing or invalid
     */
    public static PolicyTable loadLocation(String location) {
        if (location == null || location.isBlank()) {
            throw new PolicyConfigurationException("Policy location must not be blank");
        }
        if (location.startsWith(CLASSPATH_PREFIX)) {
            return loadClasspath(location.substring(CLASSPATH_PREFIX.length()));
        }
        if (location.startsWith(FILE_PREFIX)) {
            return loadFile(Path.of(location.substring(FILE_PREFIX.length())));
        }
        return loadFile(Path.of(location));
    }

    /**
     * Parses a YAML policy document.
     *
     * @param in         the document
     * @param sourceName name used in error messages
     * @throws PolicyConfigurationException if the document is malformed, names an unknown
     *                                      role, kind or action, or violates a table constraint
     */
    public static PolicyTable load(InputStream in, String sourceName) {
        PolicyDocument document;
        try {
            document = MAPPER.readValue(in, PolicyDocument.class);
        } catch (IOException e) {
            throw new PolicyConfigurationException("Malformed policy document " + sourceName, e);
        }
        if (document == null || document.rules() == null) {
            throw new PolicyConfigurationException("Policy document " + sourceName + " has no 'rules' list");
        }

        var rules = new ArrayList<PolicyRule>();
        for (int i = 0; i < document.rules().size(); i++) {
            RuleEntry entry = document.rules().get(i);
            String where = sourceName + " rules[" + i + "]";
            List<Role> roles = parse(entry.roles(), Role::fromString, null, "role", where);
            List<ResourceKind> kinds = parse(entry.kinds(), ResourceKind::fromString,
                    ResourceKind.values(), "kind", where);
            List<Action> actions = parse(entry.actions(), Action::fromString,
                    Action.values(), "action", where);
            boolean sameTenant = entry.sameTenant() == null || entry.sameTenant();
            boolean ownership = entry.ownership() != null && entry.ownership();

            for (Role role : roles) {
                for (ResourceKind kind : kinds) {
                    for (Action action : actions) {
                        rules.add(new PolicyRule(role, kind, action, sameTenant, ownership));
                    }
                }
            }
        }
        return PolicyTable.of(rules);
    }

    private static <T> List<T> parse(
            List<String> values,
            Function<String, Optional<T>> lookup,
            T[] all,
            String label,
            String where) {
        if (values == null || values.isEmpty()) {
            throw new PolicyConfigurationException(where + ": at least one " + label + " is required");
        }
        var parsed = new ArrayList<T>();
        for (String value : values) {
            if (WILDCARD.equals(value) && all != null) {
                parsed.addAll(Arrays.asList(all));
                continue;
            }
            parsed.add(lookup.apply(value).orElseThrow(() ->
                    new PolicyConfigurationException(where + ": unknown " + label + " '" + value + "'")));
        }
        return parsed;
    }

    record PolicyDocument(@JsonProperty("rules") List<RuleEntry> rules) {}

    record RuleEntry(
            @JsonProperty("roles") List<String> roles,
            @JsonProperty("kinds") List<String> kinds,
            @JsonProperty("actions") List<String> actions,
            @JsonProperty("same-tenant") Boolean sameTenant,
            @JsonProperty("ownership") Boolean ownership) {}
}
