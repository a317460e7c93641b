package com.stackforge.core.project;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.stackforge.core.graph.StackGraph;
import com.stackforge.core.hooks.HookRegistry;
import com.stackforge.core.model.InvalidConfigurationException;
import com.stackforge.core.model.Stack;
import com.stackforge.core.resolver.ResolverRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads a project from disk.
 * <p>
 * Every YAML file under {@code config/} except {@code config.yaml} is a
 * stack, named by its path relative to {@code config/} without extension.
 * The {@code config.yaml} files of the stack's directory and of every
 * ancestor directory are merged beneath the stack file: nearer files win,
 * except for {@code dependencies}, which accumulate.
 * <p>
 * A single-key map whose key starts with {@code !} is a resolver, or a hook
 * when it appears under {@code hooks}:
 * <pre>
 * parameters:
 *   VpcId: {"!stack_output": "network/vpc::VpcId"}
 * </pre>
 */
public class ProjectLoader {

    private static final Logger log = LoggerFactory.getLogger(ProjectLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String GROUP_CONFIG = "config.yaml";
    private static final String TAG_PREFIX = "!";

    private final ResolverRegistry resolvers;
    private final HookRegistry hooks;
    private final Map<String, Object> defaults;

    /**
     * @param defaults attributes applied beneath all configuration files, such as the region
     */
    public ProjectLoader(ResolverRegistry resolvers, HookRegistry hooks, Map<String, Object> defaults) {
        this.resolvers = resolvers;
        this.hooks = hooks;
        this.defaults = new LinkedHashMap<>(defaults);
    }

    public Project load(Path root) {
        Path configDir = root.resolve(Project.CONFIG_DIR);
        if (!Files.isDirectory(configDir)) {
            throw new InvalidConfigurationException("No '" + Project.CONFIG_DIR + "' directory in " + root.toAbsolutePath());
        }

        var stacks = new ArrayList<Stack>();
        for (Path file : stackFiles(configDir)) {
            String name = Stack.normalizeName(configDir.relativize(file).toString());
            Map<String, Object> merged = mergedConfig(configDir, file);
            stacks.add(new Stack(name, convert(merged)));
        }
        log.debug("Loaded {} stack(s) from {}", stacks.size(), configDir);
        return new Project(root, new StackGraph(stacks));
    }

    private List<Path> stackFiles(Path configDir) {
        try (Stream<Path> files = Files.walk(configDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> {
                        String fileName = p.getFileName().toString();
                        return (fileName.endsWith(".yaml") || fileName.endsWith(".yml"))
                                && !fileName.equals(GROUP_CONFIG);
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new InvalidConfigurationException("Could not list " + configDir + ": " + e.getMessage(), e);
        }
    }

    private Map<String, Object> mergedConfig(Path configDir, Path stackFile) {
        var layers = new ArrayList<Path>();
        Path dir = stackFile.getParent();
        while (dir != null && dir.startsWith(configDir)) {
            Path group = dir.resolve(GROUP_CONFIG);
            if (Files.isRegularFile(group)) {
                layers.add(0, group);
            }
            dir = dir.equals(configDir) ? null : dir.getParent();
        }
        layers.add(stackFile);

        var merged = new LinkedHashMap<>(defaults);
        for (Path layer : layers) {
            merge(merged, read(layer));
        }
        return merged;
    }

    static void merge(Map<String, Object> target, Map<String, Object> layer) {
        for (var entry : layer.entrySet()) {
            if (Stack.DEPENDENCIES.equals(entry.getKey())) {
                var joined = new LinkedHashSet<Object>();
                if (target.get(Stack.DEPENDENCIES) instanceof List<?> existing) {
                    joined.addAll(existing);
                }
                if (entry.getValue() instanceof List<?> added) {
                    joined.addAll(added);
                } else if (entry.getValue() != null) {
                    joined.add(entry.getValue());
                }
                target.put(Stack.DEPENDENCIES, new ArrayList<>(joined));
            } else {
                target.put(entry.getKey(), entry.getValue());
            }
        }
    }

    private Map<String, Object> read(Path file) {
        try {
            String content = Files.readString(file);
            if (content.isBlank()) {
                return Map.of();
            }
            Map<String, Object> values = YAML_MAPPER.readValue(content, new TypeReference<Map<String, Object>>() {});
            return values == null ? Map.of() : values;
        } catch (IOException e) {
            throw new InvalidConfigurationException("Could not read " + file + ": " + e.getMessage(), e);
        }
    }

    private Map<String, Object> convert(Map<String, Object> attributes) {
        var converted = new LinkedHashMap<String, Object>();
        attributes.forEach((key, value) ->
                converted.put(key, Stack.HOOKS.equals(key) ? convertHooks(value) : convertValue(value)));
        return converted;
    }

    private Object convertHooks(Object value) {
        if (!(value instanceof Map<?, ?> points)) {
            return value;
        }
        var converted = new LinkedHashMap<String, Object>();
        points.forEach((point, list) -> {
            List<?> specs = list instanceof List<?> l ? l : List.of(list);
            var created = new ArrayList<>();
            for (Object spec : specs) {
                String tag = tagOf(spec);
                if (tag == null) {
                    throw new InvalidConfigurationException("Hook '" + point + "' entries must look like {\"!cmd\": ...}, got: " + spec);
                }
                created.add(hooks.create(tag, convertValue(((Map<?, ?>) spec).values().iterator().next())));
            }
            converted.put(String.valueOf(point), created);
        });
        return converted;
    }

    private Object convertValue(Object value) {
        String tag = tagOf(value);
        if (tag != null) {
            Object argument = ((Map<?, ?>) value).values().iterator().next();
            return resolvers.create(tag, convertValue(argument));
        }
        if (value instanceof Map<?, ?> map) {
            var converted = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> converted.put(String.valueOf(k), convertValue(v)));
            return converted;
        }
        if (value instanceof List<?> list) {
            var converted = new ArrayList<>(list.size());
            list.forEach(v -> converted.add(convertValue(v)));
            return converted;
        }
        return value;
    }

    private static String tagOf(Object value) {
        if (value instanceof Map<?, ?> map && map.size() == 1) {
            String key = String.valueOf(map.keySet().iterator().next());
            if (key.startsWith(TAG_PREFIX) && key.length() > 1) {
                return key.substring(1);
            }
        }
        return null;
    }
}
