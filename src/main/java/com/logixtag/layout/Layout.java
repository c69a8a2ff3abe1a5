package com.logixtag.layout;

import com.logixtag.error.TagCodecException;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable placement of every atomic leaf of a field list inside a tag image.
 * Layouts are computed once per type and shared freely between threads.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Layout {
    private final List<PlacedField> fields;
    private final int totalByteSize;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @Getter(lombok.AccessLevel.NONE)
    private final Object2IntOpenHashMap<String> indexByPath;

    public Layout(List<PlacedField> fields, int totalByteSize) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.totalByteSize = totalByteSize;
        this.indexByPath = new Object2IntOpenHashMap<>(fields.size());
        this.indexByPath.defaultReturnValue(-1);
        for (int i = 0; i < this.fields.size(); i++) {
            var path = this.fields.get(i).getPath();
            if (indexByPath.put(path, i) != -1) {
                throw new IllegalArgumentException("Duplicate field path in layout: " + path);
            }
        }
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Alignment a parent structure must honor before splicing this layout in:
     * the alignment of the first placed field.
     */
    public int alignment() {
        return fields.isEmpty() ? 1 : fields.get(0).getKind().getAlignment();
    }

    /**
     * @return the field at {@code path}, or null when the layout has no such field
     */
    public PlacedField findField(String path) {
        int index = indexByPath.getInt(path);
        return index < 0 ? null : fields.get(index);
    }

    /**
     * @throws TagCodecException {@code FIELD_NOT_FOUND} when the layout has no such field
     */
    public PlacedField field(String path) throws TagCodecException {
        var field = findField(path);
        if (field == null) throw TagCodecException.fieldNotFound(path);
        return field;
    }

    public boolean contains(String path) {
        return indexByPath.containsKey(path);
    }

    public List<String> paths() {
        var paths = new ArrayList<String>(fields.size());
        for (var field : fields) paths.add(field.getPath());
        return paths;
    }
}
