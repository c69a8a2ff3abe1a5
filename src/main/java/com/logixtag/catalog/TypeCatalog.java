package com.logixtag.catalog;

import com.logixtag.error.TagCodecException;
import com.logixtag.types.AtomicKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves type names to atomic kinds or ordered member lists.
 * <p>
 * Atomic names (BOOL, BIT, SINT, INT, DINT, LINT, REAL, STRING) resolve intrinsically and
 * cannot be redefined. Other names are read from the project's {@link TypeDefinitionSource}
 * first and fall back to {@link BuiltinTypes}. Resolved definitions are cached; the catalog
 * is read-only once built and safe to share between threads.
 */
public final class TypeCatalog {
    private static final Logger log = LoggerFactory.getLogger(TypeCatalog.class);

    private final TypeDefinitionSource source;
    private final Map<String, TypeDefinition> resolved = new ConcurrentHashMap<>();

    public TypeCatalog(TypeDefinitionSource source) {
        this.source = Objects.requireNonNull(source, "TypeDefinitionSource cannot be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves a type name. Members of a composite are not resolved here.
     *
     * @throws TagCodecException {@code TYPE_NOT_FOUND} when no definition exists
     */
    public TypeDefinition resolve(String typeName) throws TagCodecException {
        if (typeName == null || typeName.isBlank()) {
            throw TagCodecException.typeNotFound(String.valueOf(typeName));
        }
        var kind = AtomicKind.fromTypeName(typeName);
        if (kind != null) {
            return TypeDefinition.atomic(kind.getTypeName(), kind);
        }
        var cached = resolved.get(typeName);
        if (cached != null) return cached;

        Optional<TypeDefinition> found = source.readTypeDefinition(typeName);
        if (found.isEmpty()) {
            found = BuiltinTypes.lookup(typeName);
        }
        if (found.isEmpty()) {
            throw TagCodecException.typeNotFound(typeName);
        }
        log.debug("Resolved type '{}' with {} members", typeName, found.get().getMembers().size());
        var previous = resolved.putIfAbsent(typeName, found.get());
        return previous != null ? previous : found.get();
    }

    /**
     * Atomic kind of {@code typeName}, or null when it names a composite.
     */
    public AtomicKind atomicKindOf(String typeName) throws TagCodecException {
        return resolve(typeName).getAtomicKind();
    }

    /**
     * The non-hidden members of a composite type, in declaration order.
     *
     * @throws TagCodecException {@code TYPE_NOT_FOUND} for unknown names,
     *                           {@code UNSUPPORTED_TYPE} when the name is atomic
     */
    public List<FieldDescriptor> membersOf(String typeName) throws TagCodecException {
        var definition = resolve(typeName);
        if (definition.isAtomic()) {
            throw TagCodecException.unsupportedType(typeName, "atomic types have no members");
        }
        var visible = new ArrayList<FieldDescriptor>(definition.getMembers().size());
        for (var member : definition.getMembers()) {
            if (!member.isHidden()) visible.add(member);
        }
        return visible;
    }

    /**
     * Collects composite definitions in memory; handy for tests and for callers that
     * assemble types without a project file.
     */
    public static final class Builder {
        private final Map<String, TypeDefinition> definitions = new LinkedHashMap<>();

        private Builder() {}

        public Builder composite(String name, FieldDescriptor... members) {
            return define(TypeDefinition.composite(name, members));
        }

        public Builder composite(String name, List<FieldDescriptor> members) {
            return define(TypeDefinition.composite(name, members));
        }

        public Builder define(TypeDefinition definition) {
            if (AtomicKind.fromTypeName(definition.getName()) != null) {
                throw new IllegalArgumentException("Cannot redefine atomic type " + definition.getName());
            }
            definitions.put(definition.getName(), definition);
            return this;
        }

        public TypeCatalog build() {
            var snapshot = Map.copyOf(definitions);
            return new TypeCatalog(name -> Optional.ofNullable(snapshot.get(name)));
        }
    }
}
