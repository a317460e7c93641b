package com.stackforge.core.resolver;

/**
 * How a resolver that failed is replaced when placeholders are enabled.
 */
public enum PlaceholderType {
    /** {@code { !tag(argument) }} */
    EXPLICIT,
    /** The explicit form with every non-alphanumeric character removed. */
    ALPHANUM,
    /** The value is treated as unset. */
    NONE;

    public Object create(Resolver resolver) {
        return switch (this) {
            case EXPLICIT -> explicit(resolver);
            case ALPHANUM -> explicit(resolver).replaceAll("[^A-Za-z0-9]", "");
            case NONE -> Resolver.NO_VALUE;
        };
    }

    private static String explicit(Resolver resolver) {
        return "{ " + resolver + " }";
    }
}
