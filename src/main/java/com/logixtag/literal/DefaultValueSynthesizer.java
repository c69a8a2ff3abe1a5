package com.logixtag.literal;

import com.logixtag.Constants;
import com.logixtag.catalog.FieldDescriptor;
import com.logixtag.catalog.TypeCatalog;
import com.logixtag.catalog.Usage;
import com.logixtag.config.CodecOptions;
import com.logixtag.error.TagCodecException;
import com.logixtag.types.AtomicKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds the bracketed default-value literal used to initialize a new tag of a given type,
 * e.g. {@code [0,[0.00000000e+000,0.00000000e+000],2#0]}.
 * <p>
 * Composite members are rendered in declaration order. Hidden members and InOut parameters
 * are skipped; InOut parameters reference other tags and have no backing data. BOOL members
 * are packed: within one member list only the first bool of each group of 32 produces an
 * entry. Arrays repeat their element literal. Expanding a composite deeper than the configured
 * nesting limit fails rather than yielding a truncated literal.
 */
public final class DefaultValueSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(DefaultValueSynthesizer.class);

    private static final String BOOL_ZERO = "0";
    private static final String BOOL_ARRAY_ELEMENT_ZERO = "2#0";
    private static final String INTEGER_ZERO = "0";
    private static final String STRING_ZERO = "[0,'" + "$00".repeat(Constants.STRING_DATA_LENGTH) + "']";

    private final TypeCatalog catalog;
    private final CodecOptions options;

    public DefaultValueSynthesizer(TypeCatalog catalog) {
        this(catalog, CodecOptions.defaults());
    }

    public DefaultValueSynthesizer(TypeCatalog catalog, CodecOptions options) {
        this.catalog = Objects.requireNonNull(catalog, "TypeCatalog cannot be null");
        this.options = Objects.requireNonNull(options, "CodecOptions cannot be null");
    }

    public String synthesizeDefault(String typeName) throws TagCodecException {
        return synthesizeDefault(typeName, 0);
    }

    /**
     * @param depth number of composites already expanded above {@code typeName}
     * @throws TagCodecException {@code MAX_NESTING_DEPTH_EXCEEDED} when expanding {@code typeName}
     *                           would go past the nesting limit
     */
    public String synthesizeDefault(String typeName, int depth) throws TagCodecException {
        var definition = catalog.resolve(typeName);
        if (definition.isAtomic()) {
            return atomicLiteral(definition.getAtomicKind(), false);
        }
        int level = depth + 1;
        if (level > options.getMaxNestingDepth()) {
            throw TagCodecException.nestingDepthExceeded(typeName, level);
        }
        var members = catalog.membersOf(typeName);
        if (members.isEmpty()) {
            throw TagCodecException.unsupportedType(typeName, "composite has no visible members");
        }

        var sb = new StringBuilder().append('[');
        int boolCount = 0;
        for (var member : members) {
            if (member.getUsage() == Usage.IN_OUT) {
                // references to other tags, no backing data
                continue;
            }
            var memberType = catalog.resolve(member.getTypeName());
            String entry;
            if (memberType.isComposite()) {
                var element = synthesizeDefault(member.getTypeName(), level);
                entry = member.isArray() ? arrayLiteral(element, member.getArrayLength()) : element;
            } else if (member.isArray()) {
                entry = arrayLiteral(atomicLiteral(memberType.getAtomicKind(), true), member.getArrayLength());
            } else if (memberType.getAtomicKind() == AtomicKind.BOOL) {
                boolCount++;
                // later bools of a group share the first one's packed entry
                entry = (boolCount - 1) % Constants.BOOLS_PER_HOST == 0 ? BOOL_ZERO : null;
            } else {
                entry = atomicLiteral(memberType.getAtomicKind(), false);
            }
            if (entry != null) {
                if (sb.length() > 1) sb.append(',');
                sb.append(entry);
            }
        }
        var literal = sb.append(']').toString();
        log.debug("Synthesized default of '{}' at depth {}: {} chars", typeName, depth, literal.length());
        return literal;
    }

    /**
     * Default literal of a tag backing one member or parameter, honoring its array length.
     */
    public String synthesizeDefault(FieldDescriptor descriptor) throws TagCodecException {
        var definition = catalog.resolve(descriptor.getTypeName());
        if (!descriptor.isArray()) {
            return synthesizeDefault(descriptor.getTypeName(), 0);
        }
        var element = definition.isAtomic()
                ? atomicLiteral(definition.getAtomicKind(), true)
                : synthesizeDefault(descriptor.getTypeName(), 0);
        return arrayLiteral(element, descriptor.getArrayLength());
    }

    String atomicLiteral(AtomicKind kind, boolean arrayElement) {
        switch (kind) {
            case BOOL:
                return arrayElement ? BOOL_ARRAY_ELEMENT_ZERO : BOOL_ZERO;
            case SINT8:
            case INT16:
            case DINT32:
            case LINT64:
                return INTEGER_ZERO;
            case REAL32:
                return options.getRealLiteralStyle().getZero();
            case STR:
                return STRING_ZERO;
            default:
                throw new IllegalStateException("Unhandled kind " + kind);
        }
    }

    static String arrayLiteral(String element, int count) {
        var sb = new StringBuilder(2 + count * (element.length() + 1)).append('[');
        for (int i = 0; i < count; i++) {
            if (i > 0) sb.append(',');
            sb.append(element);
        }
        return sb.append(']').toString();
    }
}
