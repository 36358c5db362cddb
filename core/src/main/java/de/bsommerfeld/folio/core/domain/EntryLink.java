package de.bsommerfeld.folio.core.domain;

import java.util.Objects;

/**
 * A single action attached to an {@link Entry}.
 *
 * @param label  button text shown to the user
 * @param kind   whether the link opens the detail overlay or an external target
 * @param target absolute URL for {@link LinkKind#EXTERNAL} links, {@code null}
 *               for {@link LinkKind#DETAIL}
 */
public record EntryLink(String label, LinkKind kind, String target) {

    public EntryLink {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(kind, "kind");
        if (kind == LinkKind.EXTERNAL && (target == null || target.isBlank())) {
            throw new IllegalArgumentException("External link '" + label + "' needs a target");
        }
        if (kind == LinkKind.DETAIL) {
            target = null;
        }
    }

    public static EntryLink detail(String label) {
        return new EntryLink(label, LinkKind.DETAIL, null);
    }

    public static EntryLink external(String label, String target) {
        return new EntryLink(label, LinkKind.EXTERNAL, target);
    }

    public boolean isExternal() {
        return kind == LinkKind.EXTERNAL;
    }
}
