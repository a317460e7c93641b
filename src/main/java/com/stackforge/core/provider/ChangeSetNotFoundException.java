package com.stackforge.core.provider;

public class ChangeSetNotFoundException extends ProviderException {

    public static final String CODE = "ChangeSetNotFound";

    public ChangeSetNotFoundException(String externalName, String changeSetName) {
        super(CODE, "ChangeSet [" + changeSetName + "] does not exist for stack " + externalName);
    }
}
