package com.ttp.trust.api;

import java.util.Objects;

/**
 * A named trust category. {@code parent} is null for a root domain.
 */
public record Domain(String id, String parent, String name) {
    /** Reserved id of the implicit root shared by every domain tree. */
    public static final String WILDCARD = "*";

    public Domain {
        Objects.requireNonNull(id, "id");
        if (id.isBlank())
            throw new IllegalArgumentException("Domain id must not be blank");
        if (name == null)
            name = id;
    }

    public static Domain root(String id, String name) {
        return new Domain(id, null, name);
    }

    public static Domain child(String id, String parent, String name) {
        return new Domain(id, parent, name);
    }
}
