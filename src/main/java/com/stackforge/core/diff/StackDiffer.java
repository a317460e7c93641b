package com.stackforge.core.diff;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Compares a stack's generated configuration and template with the deployed
 * ones, value by value.
 * <p>
 * Templates are parsed as YAML, which also covers JSON, so a template that
 * switched format but kept its content has no difference. A template that
 * does not parse is compared as plain text.
 */
public class StackDiffer {

    private static final Logger log = LoggerFactory.getLogger(StackDiffer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * @param generated         configuration built from the local definition
     * @param generatedTemplate rendered local template
     * @param deployed          configuration reported by the provider; null when the stack is not deployed
     * @param deployedTemplate  template reported by the provider; null when the stack is not deployed
     */
    public StackDiff diff(StackConfiguration generated, String generatedTemplate,
                          StackConfiguration deployed, String deployedTemplate) {
        List<Difference> configDiff = compare(
                deployed == null ? null : MAPPER.valueToTree(deployed), MAPPER.valueToTree(generated));
        List<Difference> templateDiff = compare(
                deployedTemplate == null ? null : parse(deployedTemplate), parse(generatedTemplate));
        log.debug("{} - {} configuration and {} template difference(s)", generated.name(),
                configDiff.size(), templateDiff.size());
        return new StackDiff(generated.name(), deployed != null, generated, configDiff, templateDiff);
    }

    /**
     * Lists where {@code generated} differs from {@code deployed}. Objects are
     * compared key by key and lists item by item; anything else is compared whole.
     */
    static List<Difference> compare(JsonNode deployed, JsonNode generated) {
        var differences = new ArrayList<Difference>();
        compare("", deployed, generated, differences);
        return differences;
    }

    private static void compare(String path, JsonNode deployed, JsonNode generated, List<Difference> out) {
        if (isMissing(deployed) && isMissing(generated)) {
            return;
        }
        if (isMissing(deployed)) {
            out.add(new Difference(path, Difference.Kind.ADDED, null, plain(generated)));
        } else if (isMissing(generated)) {
            out.add(new Difference(path, Difference.Kind.REMOVED, plain(deployed), null));
        } else if (deployed.isObject() && generated.isObject()) {
            var keys = new TreeSet<String>();
            deployed.fieldNames().forEachRemaining(keys::add);
            generated.fieldNames().forEachRemaining(keys::add);
            for (String key : keys) {
                compare(path.isEmpty() ? key : path + "." + key, deployed.get(key), generated.get(key), out);
            }
        } else if (deployed.isArray() && generated.isArray()) {
            int size = Math.max(deployed.size(), generated.size());
            for (int i = 0; i < size; i++) {
                compare(path + "[" + i + "]", deployed.get(i), generated.get(i), out);
            }
        } else if (!sameScalar(deployed, generated)) {
            out.add(new Difference(path, Difference.Kind.CHANGED, plain(deployed), plain(generated)));
        }
    }

    private static boolean isMissing(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /** Providers report every parameter as a string, so 3 and "3" are the same value. */
    private static boolean sameScalar(JsonNode deployed, JsonNode generated) {
        if (deployed.isValueNode() && generated.isValueNode()) {
            return deployed.asText().equals(generated.asText());
        }
        return deployed.equals(generated);
    }

    private static JsonNode parse(String template) {
        try {
            JsonNode node = MAPPER.readTree(template);
            return node == null ? TextNode.valueOf("") : node;
        } catch (JsonProcessingException e) {
            log.debug("Template is not YAML or JSON, comparing it as text: {}", e.getOriginalMessage());
            return TextNode.valueOf(template);
        }
    }

    private static Object plain(JsonNode node) {
        if (node.isValueNode()) {
            return node.isTextual() ? node.asText() : MAPPER.convertValue(node, Object.class);
        }
        return MAPPER.convertValue(node, (Class<?>) (node.isArray() ? List.class : Map.class));
    }
}
