package com.logixtag.catalog;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Structured types every controller predefines. The control word holds the status bits
 * (EN, TT/CU, DN, ...) and is addressed as a whole.
 */
@UtilityClass
public class BuiltinTypes {

    public static final TypeDefinition TIMER = TypeDefinition.composite("TIMER",
            FieldDescriptor.of("Control", "DINT"),
            FieldDescriptor.of("PRE", "DINT"),
            FieldDescriptor.of("ACC", "DINT"));

    public static final TypeDefinition COUNTER = TypeDefinition.composite("COUNTER",
            FieldDescriptor.of("Control", "DINT"),
            FieldDescriptor.of("PRE", "DINT"),
            FieldDescriptor.of("ACC", "DINT"));

    private static final Map<String, TypeDefinition> BY_NAME = Map.of(
            TIMER.getName(), TIMER,
            COUNTER.getName(), COUNTER);

    public static Optional<TypeDefinition> lookup(String typeName) {
        return Optional.ofNullable(BY_NAME.get(typeName.trim().toUpperCase(Locale.ROOT)));
    }
}
