package com.stackforge.core.project;

import com.stackforge.core.graph.StackGraph;

import java.nio.file.Path;

/**
 * A loaded project: its root directory and the validated graph of all its stacks.
 */
public record Project(Path root, StackGraph graph) {

    public static final String CONFIG_DIR = "config";
    public static final String TEMPLATES_DIR = "templates";

    public Path configDir() {
        return root.resolve(CONFIG_DIR);
    }

    public Path templatesDir() {
        return root.resolve(TEMPLATES_DIR);
    }
}
