package org.dxworks.fortframe.model;

import java.util.Locale;

public enum Permission {
    PUBLIC("public"),
    PRIVATE("private"),
    PROTECTED("protected");

    private final String name;

    Permission(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static Permission parse(String text) {
        String lower = text.trim().toLowerCase(Locale.ROOT);
        for (Permission permission : values()) {
            if (permission.name.equals(lower)) {
                return permission;
            }
        }
        throw new IllegalArgumentException("Unknown permission: " + text);
    }

    public static boolean isPermission(String text) {
        String lower = text.trim().toLowerCase(Locale.ROOT);
        return lower.equals("public") || lower.equals("private") || lower.equals("protected");
    }
}
