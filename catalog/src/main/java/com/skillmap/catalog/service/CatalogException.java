package com.skillmap.catalog.service;

/**
 * Thrown when a catalog operation is rejected by a domain rule.
 *
 * Unchecked so that controllers don't have to declare it; the API layer
 * maps {@link Kind} to an HTTP status in one place.
 */
public class CatalogException extends RuntimeException {

    public enum Kind { NOT_FOUND, VALIDATION, CONFLICT }

    /** Finer-grained cause, so callers can tell e.g. a missing field from a dangling reference. */
    public enum Reason {
        ENTITY_ABSENT(Kind.NOT_FOUND),
        MISSING_FIELD(Kind.VALIDATION),
        DANGLING_REFERENCE(Kind.VALIDATION),
        INVALID_HIERARCHY(Kind.VALIDATION),
        HAS_DEPENDENTS(Kind.CONFLICT);

        private final Kind kind;

        Reason(Kind kind) { this.kind = kind; }

        public Kind kind() { return kind; }
    }

    private final Reason reason;

    public CatalogException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() { return reason; }
    public Kind   getKind()   { return reason.kind(); }

    // ------------------------------------------------------------------
    // Factories
    // ------------------------------------------------------------------

    public static CatalogException notFound(String entity) {
        return new CatalogException(Reason.ENTITY_ABSENT, entity + " not found");
    }

    public static CatalogException missingField(String field) {
        return new CatalogException(Reason.MISSING_FIELD, "Field '" + field + "' is required");
    }

    public static CatalogException danglingReference(String field) {
        return new CatalogException(Reason.DANGLING_REFERENCE, field + " not found");
    }
}
