package com.logixtag.l5x;

import com.logixtag.catalog.FieldDescriptor;
import com.logixtag.catalog.TypeDefinition;
import com.logixtag.catalog.TypeDefinitionSource;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Type metadata read from an exported project or definition file.
 * <p>
 * User-defined data types become composites of their members. Each Add-On Instruction becomes
 * a composite named after the instruction, holding its parameters followed by its local tags;
 * InOut parameters and local tags carry their usage so layouts skip them.
 */
public final class L5xDocument implements TypeDefinitionSource {
    private final Map<String, TypeDefinition> dataTypes;
    private final Map<String, TypeDefinition> instructions;

    L5xDocument(Map<String, TypeDefinition> dataTypes, Map<String, TypeDefinition> instructions) {
        this.dataTypes = Map.copyOf(dataTypes);
        this.instructions = Map.copyOf(instructions);
    }

    @Override
    public Optional<TypeDefinition> readTypeDefinition(String typeName) {
        var definition = dataTypes.get(typeName);
        if (definition == null) definition = instructions.get(typeName);
        return Optional.ofNullable(definition);
    }

    public Set<String> dataTypeNames() {
        return dataTypes.keySet();
    }

    public Set<String> instructionNames() {
        return instructions.keySet();
    }

    /**
     * Parameters and local tags of an Add-On Instruction, in declaration order.
     */
    public List<FieldDescriptor> parameters(String instructionName) {
        var definition = instructions.get(instructionName);
        return definition == null ? List.of() : definition.getMembers();
    }

    /**
     * Finds a parameter, or failing that a local tag, of an Add-On Instruction by name.
     */
    public Optional<FieldDescriptor> parameter(String instructionName, String name) {
        for (var descriptor : parameters(instructionName)) {
            if (descriptor.getName().equals(name)) return Optional.of(descriptor);
        }
        return Optional.empty();
    }
}
