package com.company.bookingsync.domain.enums;

/**
 * Remote platforms an integration can be connected to.
 * The code is the value stored in the {@code provider} columns.
 */
public enum Provider {
    CALENDLY("calendly"),
    FACEBOOK("facebook"),
    GOHIGHLEVEL("ghl");

    private final String code;

    Provider(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Provider fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Provider code is required");
        }
        for (Provider provider : values()) {
            if (provider.code.equalsIgnoreCase(code) || provider.name().equalsIgnoreCase(code)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + code);
    }
}
