package com.stackforge.core.graph;

import com.stackforge.core.model.InvalidConfigurationException;

public class UnknownDependencyException extends InvalidConfigurationException {

    private final String stackName;
    private final String dependency;

    public UnknownDependencyException(String stackName, String dependency) {
        super("Stack '" + stackName + "' depends on '" + dependency + "', which is not part of the project");
        this.stackName = stackName;
        this.dependency = dependency;
    }

    public String getStackName() {
        return stackName;
    }

    public String getDependency() {
        return dependency;
    }
}
