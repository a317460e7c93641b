package com.stackforge.core.template;

import com.stackforge.core.model.Stack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Reads static template files from the project's {@code templates} directory.
 * Expects a {@code path} argument; absolute paths are used as they are.
 */
public class FileTemplateHandler implements TemplateHandler {

    public static final String TYPE = "file";

    private static final Logger log = LoggerFactory.getLogger(FileTemplateHandler.class);
    private static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".yaml", ".yml", ".json", ".template");

    private final Path templatesDir;

    public FileTemplateHandler(Path templatesDir) {
        this.templatesDir = templatesDir;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public String render(Stack stack, Map<String, Object> arguments, Map<String, Object> userData) {
        Object argument = arguments.get("path");
        if (argument == null || argument.toString().isBlank()) {
            throw new TemplateException("Stack '" + stack.name() + "': the file template handler needs a 'path'");
        }
        String relative = argument.toString();
        int dot = relative.lastIndexOf('.');
        String extension = dot < 0 ? "" : relative.substring(dot);
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            throw new TemplateException("Template " + relative + " has extension '" + extension
                    + "'; supported are " + String.join(", ", SUPPORTED_EXTENSIONS.stream().sorted().toList()));
        }

        Path file = templatesDir.resolve(relative).normalize();
        log.debug("{} - Reading template {}", stack.name(), file);
        try {
            return Files.readString(file);
        } catch (NoSuchFileException e) {
            throw new TemplateException("Template file " + file + " does not exist", e);
        } catch (IOException e) {
            throw new TemplateException("Could not read template file " + file + ": " + e.getMessage(), e);
        }
    }
}
