package com.nayem.strata.testutil;

import com.nayem.strata.model.Document;
import com.nayem.strata.model.DocumentKey;
import com.nayem.strata.model.FieldPath;
import com.nayem.strata.model.NoDocument;
import com.nayem.strata.model.SnapshotVersion;
import com.nayem.strata.model.Timestamp;
import com.nayem.strata.model.value.FieldValue;
import com.nayem.strata.model.value.FieldValues;
import com.nayem.strata.model.value.ObjectValue;
import com.nayem.strata.mutation.DeleteMutation;
import com.nayem.strata.mutation.FieldMask;
import com.nayem.strata.mutation.FieldTransform;
import com.nayem.strata.mutation.PatchMutation;
import com.nayem.strata.mutation.Precondition;
import com.nayem.strata.mutation.ServerTimestampTransform;
import com.nayem.strata.mutation.SetMutation;
import com.nayem.strata.mutation.TransformMutation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixture builders shared by the tests.
 */
public final class TestUtil {

    private TestUtil() {
    }

    public static DocumentKey key(String path) {
        return DocumentKey.fromPathString(path);
    }

    public static FieldPath field(String path) {
        return FieldPath.fromDotSeparatedPath(path);
    }

    public static SnapshotVersion version(long seconds) {
        return SnapshotVersion.of(new Timestamp(seconds, 0));
    }

    public static FieldValue wrap(Object value) {
        return FieldValues.wrap(value);
    }

    /** Builds a map from alternating keys and values. */
    public static Map<String, Object> map(Object... entries) {
        if (entries.length % 2 != 0) {
            throw new IllegalArgumentException("map() needs key/value pairs");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < entries.length; i += 2) {
            result.put((String) entries[i], entries[i + 1]);
        }
        return result;
    }

    public static ObjectValue wrapObject(Map<String, Object> values) {
        return FieldValues.wrapObject(values);
    }

    public static Document doc(String key, long version, Map<String, Object> data) {
        return new Document(key(key), version(version), wrapObject(data), false);
    }

    public static Document doc(String key, long version, Map<String, Object> data, boolean hasLocalMutations) {
        return new Document(key(key), version(version), wrapObject(data), hasLocalMutations);
    }

    public static NoDocument deletedDoc(String key, long version) {
        return new NoDocument(key(key), version(version));
    }

    public static SetMutation setMutation(String key, Map<String, Object> values) {
        return new SetMutation(key(key), wrapObject(values), Precondition.NONE);
    }

    /**
     * Builds a patch the way a client does: every top-level key (dotted keys allowed)
     * goes into the mask, and the precondition is exists(true).
     */
    public static PatchMutation patchMutation(String key, Map<String, Object> values) {
        ObjectValue data = ObjectValue.EMPTY;
        List<FieldPath> mask = new ArrayList<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            FieldPath path = field(entry.getKey());
            mask.add(path);
            data = data.set(path, wrap(entry.getValue()));
        }
        return new PatchMutation(key(key), data, FieldMask.of(mask), Precondition.exists(true));
    }

    public static PatchMutation patchMutation(String key, Map<String, Object> values, List<FieldPath> mask) {
        return new PatchMutation(key(key), wrapObject(values), FieldMask.of(mask), Precondition.exists(true));
    }

    public static TransformMutation serverTimestampMutation(String key, String... fields) {
        List<FieldTransform> transforms = new ArrayList<>();
        for (String f : fields) {
            transforms.add(new FieldTransform(field(f), ServerTimestampTransform.INSTANCE));
        }
        return new TransformMutation(key(key), transforms);
    }

    public static DeleteMutation deleteMutation(String key) {
        return new DeleteMutation(key(key), Precondition.NONE);
    }
}
