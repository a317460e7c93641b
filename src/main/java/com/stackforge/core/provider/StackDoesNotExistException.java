package com.stackforge.core.provider;

public class StackDoesNotExistException extends ProviderException {

    public static final String CODE = "DoesNotExist";

    private final String externalName;

    public StackDoesNotExistException(String externalName) {
        super(CODE, "Stack with id " + externalName + " does not exist");
        this.externalName = externalName;
    }

    public String getExternalName() {
        return externalName;
    }
}
