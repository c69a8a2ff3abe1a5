package com.logixtag.layout;

import com.logixtag.Constants;
import com.logixtag.catalog.FieldDescriptor;
import com.logixtag.catalog.TypeCatalog;
import com.logixtag.config.CodecOptions;
import com.logixtag.error.TagCodecException;
import com.logixtag.types.AtomicKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes where each field of a tag lives in the controller's memory image.
 * <p>
 * Fields are placed in one left-to-right sweep:
 * <ul>
 *   <li>BOOL: packed 32 to a 4-byte host word. The first bool of every group of 32
 *       (counted over the whole field list) allocates a new word at the cursor; later bools
 *       reuse the most recent word. Bit {@code (n - 1) mod 32} holds the n-th bool.</li>
 *   <li>SINT: no alignment. INT: 2-byte aligned. DINT/REAL: 4-byte aligned. LINT: 8-byte aligned.</li>
 *   <li>Composites: laid out on their own from offset 0 with a fresh bool counter, then
 *       spliced in at the cursor after aligning to their first field's alignment.
 *       Array elements follow each other with no extra padding.</li>
 *   <li>Arrays of atomics are placed as that many consecutive scalars.</li>
 * </ul>
 * Hidden fields, InOut parameters and local tags are never placed. Leaf paths must be unique.
 */
public final class LayoutAssigner {
    private static final Logger log = LoggerFactory.getLogger(LayoutAssigner.class);

    private final TypeCatalog catalog;
    private final CodecOptions options;
    private final Map<String, Layout> layoutsByType = new ConcurrentHashMap<>();

    public LayoutAssigner(TypeCatalog catalog) {
        this(catalog, CodecOptions.defaults());
    }

    public LayoutAssigner(TypeCatalog catalog, CodecOptions options) {
        this.catalog = Objects.requireNonNull(catalog, "TypeCatalog cannot be null");
        this.options = Objects.requireNonNull(options, "CodecOptions cannot be null");
    }

    /**
     * Lays out an ordered field list, e.g. the parameters of an Add-On Instruction.
     * The same input always yields an equal layout.
     */
    public Layout assign(List<FieldDescriptor> fields) throws TagCodecException {
        return finish(sweep(fields, 0));
    }

    /**
     * Layout of the members of a composite type. Computed once per type name.
     */
    public Layout layoutOf(String typeName) throws TagCodecException {
        var cached = layoutsByType.get(typeName);
        if (cached != null) return cached;
        var layout = finish(sweep(catalog.membersOf(typeName), 1));
        var previous = layoutsByType.putIfAbsent(typeName, layout);
        return previous != null ? previous : layout;
    }

    private Layout finish(Layout layout) {
        int total = layout.getTotalByteSize();
        if (options.isRoundTotalToWord()) {
            total = alignUp(total, Constants.BOOL_HOST_BYTES);
        }
        log.debug("Assigned layout of {} fields, {} bytes", layout.size(), total);
        return total == layout.getTotalByteSize() ? layout : new Layout(layout.getFields(), total);
    }

    /**
     * @param depth nesting level of the composite owning {@code fields}, 0 for a bare field list
     */
    private Layout sweep(List<FieldDescriptor> fields, int depth) throws TagCodecException {
        var sweep = new Sweep();
        for (var field : fields) {
            if (field.isHidden() || !field.getUsage().isLaidOut()) {
                continue;
            }
            var definition = catalog.resolve(field.getTypeName());
            if (definition.isAtomic()) {
                var kind = definition.getAtomicKind();
                if (!kind.isPackable()) {
                    throw TagCodecException.unsupportedType(field.getTypeName(),
                            "field '" + field.getName() + "' cannot be placed in a packed layout");
                }
                if (field.isArray()) {
                    for (int i = 0; i < field.getArrayLength(); i++) {
                        sweep.placeAtomic(field.element(i), kind);
                    }
                } else {
                    sweep.placeAtomic(field, kind);
                }
            } else {
                placeComposite(sweep, field, depth + 1);
            }
        }
        var paths = new HashSet<String>(sweep.placed.size() * 2);
        for (var leaf : sweep.placed) {
            if (!paths.add(leaf.getPath())) throw TagCodecException.duplicateField(leaf.getPath());
        }
        return new Layout(sweep.placed, sweep.cursor);
    }

    private void placeComposite(Sweep sweep, FieldDescriptor field, int depth) throws TagCodecException {
        if (depth > options.getMaxNestingDepth()) {
            throw TagCodecException.nestingDepthExceeded(field.getTypeName(), depth);
        }
        var members = catalog.membersOf(field.getTypeName());
        var sub = sweep(members, depth);
        if (sub.isEmpty()) {
            throw TagCodecException.unsupportedType(field.getTypeName(),
                    "field '" + field.getName() + "' has no placeable members");
        }
        sweep.cursor = alignUp(sweep.cursor, sub.alignment());
        int repetitions = field.isArray() ? field.getArrayLength() : 1;
        for (int i = 0; i < repetitions; i++) {
            var prefix = (field.isArray() ? field.element(i).getName() : field.getName()) + ".";
            for (var leaf : sub.getFields()) {
                sweep.placed.add(leaf.relocate(prefix, sweep.cursor));
            }
            log.debug("Placed {} '{}' at byte {} ({} bytes)", field.getTypeName(), prefix, sweep.cursor, sub.getTotalByteSize());
            sweep.cursor += sub.getTotalByteSize();
        }
    }

    static int alignUp(int offset, int alignment) {
        int remainder = offset % alignment;
        return remainder == 0 ? offset : offset + alignment - remainder;
    }

    /**
     * Cursor state of one field list.
     */
    private static final class Sweep {
        final List<PlacedField> placed = new ArrayList<>();
        int cursor;
        int boolCount;
        int boolWordOffset;

        void placeAtomic(FieldDescriptor field, AtomicKind kind) {
            if (kind == AtomicKind.BOOL) {
                boolCount++;
                int bit = (boolCount - 1) % Constants.BOOLS_PER_HOST;
                if (bit == 0) {
                    boolWordOffset = cursor;
                    cursor += Constants.BOOL_HOST_BYTES;
                }
                placed.add(new PlacedField(field.getName(), field, kind, boolWordOffset, bit, Constants.BOOL_HOST_BYTES));
                log.debug("Placed BOOL '{}' at byte {} bit {}", field.getName(), boolWordOffset, bit);
                return;
            }
            cursor = alignUp(cursor, kind.getAlignment());
            placed.add(new PlacedField(field.getName(), field, kind, cursor, -1, kind.getByteWidth()));
            log.debug("Placed {} '{}' at byte {}", kind.getTypeName(), field.getName(), cursor);
            cursor += kind.getByteWidth();
        }
    }
}
