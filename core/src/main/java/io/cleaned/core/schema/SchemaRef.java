package io.cleaned.core.schema;

import io.cleaned.core.error.SchemaDefinitionException;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle to a {@link Schema} that may not exist yet: the schema currently being built (see
 * {@link SchemaBuilder#self()}) or a sibling declared later. The supplier is consulted on first
 * use and its result is kept for good.
 *
 * <p>Thread-safe: resolution happens at most once, under a lock, and every caller observes the
 * same schema. A supplier that returns {@code null} (the target is not built yet) leaves the
 * handle unresolved so a later call can succeed. Resolving the same handle again from inside its
 * own supplier fails with {@link SchemaDefinitionException}.
 */
public final class SchemaRef {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaRef.class);

    private final String name;
    private final Supplier<Schema> supplier;
    private final Object lock = new Object();
    private volatile Schema resolved;
    private boolean resolving; // guarded by lock

    private SchemaRef(String name, Supplier<Schema> supplier, Schema resolved) {
        this.name = name;
        this.supplier = supplier;
        this.resolved = resolved;
    }

    /** A handle that is already resolved. */
    public static SchemaRef of(Schema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        return new SchemaRef(schema.name(), null, schema);
    }

    /**
     * A handle resolved on first use.
     *
     * @param name     name used in diagnostics until the schema is resolved
     * @param supplier returns the target schema, or {@code null} while it is not built yet
     */
    public static SchemaRef lazy(String name, Supplier<Schema> supplier) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(supplier, "supplier must not be null");
        return new SchemaRef(name, supplier, null);
    }

    public String name() {
        return name;
    }

    public boolean isResolved() {
        return resolved != null;
    }

    /**
     * Returns the target schema, resolving it on first call.
     *
     * @throws SchemaDefinitionException if the target is not available or resolution is re-entered
     */
    public Schema resolve() {
        Schema schema = resolved;
        if (schema != null) {
            return schema;
        }
        synchronized (lock) {
            if (resolved != null) {
                return resolved;
            }
            if (resolving) {
                throw new SchemaDefinitionException("Circular resolution of schema reference '" + name + "'", name);
            }
            resolving = true;
            try {
                schema = supplier.get();
            } finally {
                resolving = false;
            }
            if (schema == null) {
                throw new SchemaDefinitionException(
                        "Schema reference '" + name + "' cannot be resolved: the schema has not been built", name);
            }
            resolved = schema;
            LOG.debug("Schema reference resolved: ref={}, schema={}", name, schema.name());
            return schema;
        }
    }

    @Override
    public String toString() {
        return "SchemaRef[" + name + (isResolved() ? "" : ", unresolved") + "]";
    }
}
