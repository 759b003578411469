package warden.core.model.auth;

import java.util.Locale;

/**
 * Role a principal holds within an organization.
 *
 * <p>Roles are ordered: each role includes the permissions of the roles before it.
 */
public enum OrgRole {
    VIEWER("Viewer"),
    EDITOR("Editor"),
    ADMIN("Admin");

    private final String value;

    OrgRole(String value) {
        this.value = value;
    }

    /**
     * Return the display value used in configuration and JSON.
     *
     * @return the role name, e.g. {@code Viewer}
     */
    public String value() {
        return value;
    }

    /**
     * Check whether this role grants at least the given role.
     *
     * @param other the role to compare against
     * @return true if this role is the same as or stronger than {@code other}
     */
    public boolean includes(OrgRole other) {
        return ordinal() >= other.ordinal();
    }

    /**
     * Parse a role from its display value, case-insensitively.
     *
     * @param value the role name
     * @return the matching role
     * @throws IllegalArgumentException if the value is not a known role
     */
    public static OrgRole fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role cannot be blank");
        }
        final var normalized = value.trim().toUpperCase(Locale.ROOT);
        for (final var role : values()) {
            if (role.name().equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown org role: " + value);
    }
}
