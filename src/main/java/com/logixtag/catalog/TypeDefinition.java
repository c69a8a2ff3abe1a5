package com.logixtag.catalog;

import com.logixtag.types.AtomicKind;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * A resolved type: either an atomic kind or an ordered list of members.
 * Member types are named, not resolved, so composite resolution stays lazy.
 */
@Value
public class TypeDefinition {
    String name;
    AtomicKind atomicKind;
    List<FieldDescriptor> members;

    private TypeDefinition(String name, AtomicKind atomicKind, List<FieldDescriptor> members) {
        this.name = Objects.requireNonNull(name, "Type name cannot be null");
        this.atomicKind = atomicKind;
        this.members = members;
    }

    public static TypeDefinition atomic(String name, AtomicKind kind) {
        return new TypeDefinition(name, Objects.requireNonNull(kind, "AtomicKind cannot be null"), List.of());
    }

    public static TypeDefinition composite(String name, List<FieldDescriptor> members) {
        return new TypeDefinition(name, null, List.copyOf(members));
    }

    public static TypeDefinition composite(String name, FieldDescriptor... members) {
        return composite(name, List.of(members));
    }

    public boolean isAtomic() {
        return atomicKind != null;
    }

    public boolean isComposite() {
        return atomicKind == null;
    }
}
