package com.stackforge.provider.local;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.stackforge.core.provider.ChangeSet;
import com.stackforge.core.provider.ChangeSetNotFoundException;
import com.stackforge.core.provider.ProviderException;
import com.stackforge.core.provider.StackDescription;
import com.stackforge.core.provider.StackDoesNotExistException;
import com.stackforge.core.provider.StackEvent;
import com.stackforge.core.provider.StackProvider;
import com.stackforge.core.provider.StackRequest;
import com.stackforge.core.provider.StackResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * A provider that keeps stacks as JSON files in a directory, for local runs
 * and dry runs.
 * <p>
 * Templates are YAML or JSON documents. Their {@code Outputs} become the stack
 * outputs; output values may reference parameters as {@code ${Name}}, falling
 * back to the {@code Default} declared under {@code Parameters}. The
 * {@code Resources} section lists the stack's resources. Every request
 * completes immediately.
 * <p>
 * Change sets live under {@code changesets/<stack>/} next to the stack files.
 * Executing a change set applies it and drops every change set of the stack.
 */
public class LocalStackProvider implements StackProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalStackProvider.class);
    private static final ObjectMapper TEMPLATE_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Pattern REFERENCE = Pattern.compile("\\$\\{([A-Za-z0-9_]+)}");
    private static final Pattern CHANGE_SET_NAME = Pattern.compile("[a-zA-Z][-a-zA-Z0-9]*");
    private static final String STACK_TYPE = "Stack";
    static final String NO_CHANGES_REASON =
            "The submitted information didn't contain changes. Submit different information to create a change set.";

    private final Path stateDir;
    private final ObjectMapper stateMapper;

    public LocalStackProvider(Path stateDir) {
        this.stateDir = stateDir;
        this.stateMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public synchronized void createStack(StackRequest request) {
        if (Files.exists(stateFile(request.externalName()))) {
            throw new ProviderException(ProviderException.ALREADY_EXISTS,
                    "Stack [" + request.externalName() + "] already exists");
        }
        Map<String, Object> template = parseTemplate(request.templateBody());
        Map<String, String> outputs = outputs(template, request.parameters());
        Instant now = Instant.now();
        var events = new ArrayList<StackEvent>();
        events.add(stackEvent(request.externalName(), "CREATE_IN_PROGRESS", "User Initiated", now));
        resourceTypes(template).forEach((id, type) ->
                events.add(new StackEvent(request.externalName(), id, type, "CREATE_COMPLETE", null, now)));
        events.add(stackEvent(request.externalName(), "CREATE_COMPLETE", null, now));
        write(state(request, "CREATE_COMPLETE", outputs, now, history(List.of(), events)));
        log.debug("Created local stack {}", request.externalName());
    }

    @Override
    public synchronized void updateStack(StackRequest request) {
        LocalStackState existing = read(request.externalName());
        if (unchanged(existing, request)) {
            throw new ProviderException(ProviderException.NO_UPDATES, "No updates are to be performed.");
        }
        Map<String, Object> template = parseTemplate(request.templateBody());
        Map<String, String> outputs = outputs(template, request.parameters());
        Instant now = Instant.now();
        var events = new ArrayList<StackEvent>();
        events.add(stackEvent(request.externalName(), "UPDATE_IN_PROGRESS", "User Initiated", now));
        for (ChangeSet.ResourceChange change : resourceChanges(parseTemplate(existing.templateBody()), template)) {
            String status = switch (change.action()) {
                case "Add" -> "CREATE_COMPLETE";
                case "Remove" -> "DELETE_COMPLETE";
                default -> "UPDATE_COMPLETE";
            };
            events.add(new StackEvent(request.externalName(), change.logicalResourceId(), change.resourceType(),
                    status, null, now));
        }
        events.add(stackEvent(request.externalName(), "UPDATE_COMPLETE", null, now));
        write(state(request, "UPDATE_COMPLETE", outputs, now, history(existing.events(), events)));
        log.debug("Updated local stack {}", request.externalName());
    }

    @Override
    public synchronized void deleteStack(String externalName, String roleArn) {
        try {
            Files.deleteIfExists(stateFile(externalName));
            deleteRecursively(changeSetDir(externalName));
        } catch (IOException e) {
            throw new ProviderException(ProviderException.INTERNAL_FAILURE, "Could not delete " + externalName + ": " + e.getMessage(), e);
        }
        log.debug("Deleted local stack {}", externalName);
    }

    @Override
    public synchronized void cancelUpdate(String externalName) {
        LocalStackState state = read(externalName);
        throw new ProviderException(ProviderException.VALIDATION_ERROR,
                "CancelUpdateStack cannot be called from current stack status " + state.status());
    }

    @Override
    public synchronized StackDescription describeStack(String externalName) {
        LocalStackState state = read(externalName);
        return new StackDescription(state.externalName(), state.status(), null, state.parameters(),
                state.outputs(), state.lastUpdated(), state.tags(), state.notifications(), state.roleArn());
    }

    @Override
    public synchronized Map<String, String> describeOutputs(String externalName) {
        return read(externalName).outputs();
    }

    @Override
    public synchronized String getTemplate(String externalName) {
        return read(externalName).templateBody();
    }

    @Override
    public synchronized List<StackEvent> describeEvents(String externalName) {
        return read(externalName).events();
    }

    @Override
    public synchronized List<StackResource> describeResources(String externalName) {
        LocalStackState state = read(externalName);
        var resources = new ArrayList<StackResource>();
        resourceTypes(parseTemplate(state.templateBody())).forEach((id, type) ->
                resources.add(new StackResource(id, externalName + "-" + id, type, state.status())));
        return resources;
    }

    @Override
    public synchronized void createChangeSet(String changeSetName, StackRequest request) {
        String externalName = request.externalName();
        if (!CHANGE_SET_NAME.matcher(changeSetName).matches()) {
            throw new ProviderException(ProviderException.VALIDATION_ERROR,
                    "Change set name '" + changeSetName + "' must start with a letter and contain only letters, "
                            + "digits and hyphens");
        }
        Path file = changeSetFile(externalName, changeSetName);
        if (Files.exists(file)) {
            throw new ProviderException(ProviderException.ALREADY_EXISTS,
                    "ChangeSet [" + changeSetName + "] already exists");
        }
        Map<String, Object> template = parseTemplate(request.templateBody());
        outputs(template, request.parameters());

        LocalStackState existing = Files.exists(stateFile(externalName)) ? read(externalName) : null;
        Map<String, Object> deployed = existing == null ? Map.of() : parseTemplate(existing.templateBody());
        boolean noChanges = existing != null && unchanged(existing, request);
        var changeSet = new ChangeSet(changeSetName, externalName,
                existing == null ? ChangeSet.TYPE_CREATE : ChangeSet.TYPE_UPDATE,
                noChanges ? "FAILED" : "CREATE_COMPLETE",
                noChanges ? NO_CHANGES_REASON : null,
                noChanges ? "UNAVAILABLE" : "AVAILABLE",
                resourceChanges(deployed, template), Instant.now());
        writeJson(file, new LocalChangeSet(changeSet, request), externalName);
        log.debug("Created change set {} of local stack {}", changeSetName, externalName);
    }

    @Override
    public synchronized ChangeSet describeChangeSet(String externalName, String changeSetName) {
        return readChangeSet(externalName, changeSetName).changeSet();
    }

    @Override
    public synchronized void executeChangeSet(String externalName, String changeSetName) {
        LocalChangeSet stored = readChangeSet(externalName, changeSetName);
        ChangeSet changeSet = stored.changeSet();
        if (!"AVAILABLE".equals(changeSet.executionStatus())) {
            throw new ProviderException(ProviderException.VALIDATION_ERROR, "ChangeSet [" + changeSetName
                    + "] cannot be executed in its current execution status of " + changeSet.executionStatus());
        }
        if (ChangeSet.TYPE_CREATE.equals(changeSet.changeSetType())) {
            createStack(stored.request());
        } else {
            updateStack(stored.request());
        }
        try {
            deleteRecursively(changeSetDir(externalName));
        } catch (IOException e) {
            throw new ProviderException(ProviderException.INTERNAL_FAILURE,
                    "Could not drop change sets of " + externalName + ": " + e.getMessage(), e);
        }
        log.debug("Executed change set {} of local stack {}", changeSetName, externalName);
    }

    @Override
    public synchronized void deleteChangeSet(String externalName, String changeSetName) {
        Path file = changeSetFile(externalName, changeSetName);
        try {
            if (!Files.deleteIfExists(file)) {
                throw new ChangeSetNotFoundException(externalName, changeSetName);
            }
        } catch (IOException e) {
            throw new ProviderException(ProviderException.INTERNAL_FAILURE,
                    "Could not delete change set " + changeSetName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized List<ChangeSet> listChangeSets(String externalName) {
        Path dir = changeSetDir(externalName);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(file -> file.getFileName().toString().endsWith(".json"))
                    .map(file -> readJson(file, LocalChangeSet.class).changeSet())
                    .sorted(Comparator.comparing(ChangeSet::creationTime).thenComparing(ChangeSet::name))
                    .toList();
        } catch (IOException e) {
            throw new ProviderException(ProviderException.INTERNAL_FAILURE,
                    "Could not list change sets of " + externalName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> validateTemplate(String templateBody) {
        Map<String, Object> template = parseTemplate(templateBody);
        var result = new LinkedHashMap<String, Object>();
        result.put("Description", template.getOrDefault("Description", ""));
        result.put("Parameters", List.copyOf(section(template, "Parameters").keySet()));
        result.put("Outputs", List.copyOf(section(template, "Outputs").keySet()));
        return result;
    }

    private static boolean unchanged(LocalStackState existing, StackRequest request) {
        return Objects.equals(existing.templateBody(), request.templateBody())
                && Objects.equals(existing.parameters(), request.parameters())
                && Objects.equals(existing.tags(), request.tags());
    }

    private static LocalStackState state(StackRequest request, String status, Map<String, String> outputs,
                                         Instant now, List<StackEvent> events) {
        return new LocalStackState(request.externalName(), status, request.templateBody(), request.parameters(),
                request.tags(), request.notifications(), request.roleArn(), outputs, now, events);
    }

    private static StackEvent stackEvent(String externalName, String status, String reason, Instant now) {
        return new StackEvent(externalName, externalName, STACK_TYPE, status, reason, now);
    }

    /** Prepends {@code chronological} to {@code previous}, newest first. */
    private static List<StackEvent> history(List<StackEvent> previous, List<StackEvent> chronological) {
        var events = new ArrayList<StackEvent>(chronological.size() + previous.size());
        for (int i = chronological.size() - 1; i >= 0; i--) {
            events.add(chronological.get(i));
        }
        events.addAll(previous);
        return events;
    }

    private static Map<String, String> resourceTypes(Map<String, Object> template) {
        var types = new LinkedHashMap<String, String>();
        section(template, "Resources").forEach((id, definition) -> {
            Object type = definition instanceof Map<?, ?> map ? map.get("Type") : null;
            types.put(id, type == null ? null : type.toString());
        });
        return types;
    }

    private static List<ChangeSet.ResourceChange> resourceChanges(Map<String, Object> deployed,
                                                                  Map<String, Object> generated) {
        Map<String, Object> before = section(deployed, "Resources");
        Map<String, Object> after = section(generated, "Resources");
        Map<String, String> typesBefore = resourceTypes(deployed);
        Map<String, String> typesAfter = resourceTypes(generated);
        var ids = new TreeSet<String>(before.keySet());
        ids.addAll(after.keySet());

        var changes = new ArrayList<ChangeSet.ResourceChange>();
        for (String id : ids) {
            if (!before.containsKey(id)) {
                changes.add(new ChangeSet.ResourceChange("Add", id, typesAfter.get(id)));
            } else if (!after.containsKey(id)) {
                changes.add(new ChangeSet.ResourceChange("Remove", id, typesBefore.get(id)));
            } else if (!Objects.equals(before.get(id), after.get(id))) {
                changes.add(new ChangeSet.ResourceChange("Modify", id, typesAfter.get(id)));
            }
        }
        return changes;
    }

    private Map<String, Object> parseTemplate(String body) {
        if (body == null || body.isBlank()) {
            throw new ProviderException(ProviderException.VALIDATION_ERROR, "Template body is empty");
        }
        try {
            Object parsed = TEMPLATE_MAPPER.readValue(body, Object.class);
            if (!(parsed instanceof Map<?, ?>)) {
                throw new ProviderException(ProviderException.VALIDATION_ERROR, "Template format error: not a mapping");
            }
            return TEMPLATE_MAPPER.convertValue(parsed, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.VALIDATION_ERROR,
                    "Template format error: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, String> outputs(Map<String, Object> template, Map<String, String> parameters) {
        Map<String, Object> declared = section(template, "Parameters");
        var outputs = new LinkedHashMap<String, String>();
        section(template, "Outputs").forEach((key, definition) -> {
            Object value = definition instanceof Map<?, ?> map ? map.get("Value") : definition;
            outputs.put(key, substitute(String.valueOf(value), parameters, declared));
        });
        return outputs;
    }

    private static String substitute(String value, Map<String, String> parameters, Map<String, Object> declared) {
        Matcher matcher = REFERENCE.matcher(value);
        var result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = parameters.get(name);
            if (replacement == null && declared.get(name) instanceof Map<?, ?> parameter
                    && parameter.get("Default") != null) {
                replacement = String.valueOf(parameter.get("Default"));
            }
            if (replacement == null) {
                throw new ProviderException(ProviderException.VALIDATION_ERROR,
                        "Parameters: [" + name + "] must have values");
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> template, String key) {
        Object section = template.get(key);
        return section instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private LocalStackState read(String externalName) {
        Path file = stateFile(externalName);
        if (!Files.exists(file)) {
            throw new StackDoesNotExistException(externalName);
        }
        return readJson(file, LocalStackState.class);
    }

    private LocalChangeSet readChangeSet(String externalName, String changeSetName) {
        Path file = changeSetFile(externalName, changeSetName);
        if (!Files.exists(file)) {
            throw new ChangeSetNotFoundException(externalName, changeSetName);
        }
        return readJson(file, LocalChangeSet.class);
    }

    private void write(LocalStackState state) {
        writeJson(stateFile(state.externalName()), state, state.externalName());
    }

    private <T> T readJson(Path file, Class<T> type) {
        try {
            return stateMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new ProviderException(ProviderException.INTERNAL_FAILURE, "Corrupt state file " + file + ": " + e.getMessage(), e);
        }
    }

    private void writeJson(Path file, Object value, String externalName) {
        try {
            Files.createDirectories(file.getParent());
            stateMapper.writeValue(file.toFile(), value);
        } catch (IOException e) {
            throw new ProviderException(ProviderException.INTERNAL_FAILURE, "Could not persist " + externalName
                    + ": " + e.getMessage(), e);
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }

    private Path stateFile(String externalName) {
        return stateDir.resolve(externalName + ".json");
    }

    private Path changeSetDir(String externalName) {
        return stateDir.resolve("changesets").resolve(externalName);
    }

    private Path changeSetFile(String externalName, String changeSetName) {
        if (changeSetName == null || !CHANGE_SET_NAME.matcher(changeSetName).matches()) {
            throw new ChangeSetNotFoundException(externalName, changeSetName);
        }
        return changeSetDir(externalName).resolve(changeSetName + ".json");
    }
}
