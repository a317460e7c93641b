package com.stackforge.core.provider;

/**
 * Identifies one provider session. Any component may be null.
 */
public record ConnectionKey(String region, String profile, String iamRole) {
}
