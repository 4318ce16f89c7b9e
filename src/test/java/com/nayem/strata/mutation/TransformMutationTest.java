package com.nayem.strata.mutation;

import com.nayem.strata.model.Document;
import com.nayem.strata.model.MaybeDocument;
import com.nayem.strata.model.NoDocument;
import com.nayem.strata.model.Timestamp;
import com.nayem.strata.model.value.FieldValue;
import com.nayem.strata.model.value.IntegerValue;
import com.nayem.strata.model.value.ServerTimestampValue;
import com.nayem.strata.model.value.TimestampValue;
import com.nayem.strata.util.InvariantViolationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.nayem.strata.testutil.TestUtil.deletedDoc;
import static com.nayem.strata.testutil.TestUtil.doc;
import static com.nayem.strata.testutil.TestUtil.field;
import static com.nayem.strata.testutil.TestUtil.key;
import static com.nayem.strata.testutil.TestUtil.map;
import static com.nayem.strata.testutil.TestUtil.serverTimestampMutation;
import static com.nayem.strata.testutil.TestUtil.version;
import static com.nayem.strata.testutil.TestUtil.wrap;
import static com.nayem.strata.testutil.TestUtil.wrapObject;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TransformMutationTest {

    private static final Timestamp WRITE_TIME = new Timestamp(1_700_000_000, 0);
    private static final Timestamp COMMIT_TIME = new Timestamp(1_700_000_005, 0);

    @Test
    void preconditionIsAlwaysExists() {
        TransformMutation transform = serverTimestampMutation("collection/key", "foo");

        assertEquals(Precondition.exists(true), transform.getPrecondition());
        assertEquals(MutationType.TRANSFORM, transform.getType());
    }

    @Test
    void localServerTimestampKeepsPreviousValueFromBaseDocument() {
        Document base = doc("collection/key", 3, map("foo", map("bar", "bar-value"), "baz", "baz-value"));
        // The view already carries an earlier write of the same batch.
        Document view = doc("collection/key", 3, map("foo", map("bar", "set-in-batch"), "baz", "baz-value"), true);
        TransformMutation transform = serverTimestampMutation("collection/key", "foo.bar");

        Document result = (Document) transform.applyToLocalView(view, base, WRITE_TIME);

        assertEquals(version(3), result.getVersion());
        assertThat(result.hasLocalMutations()).isTrue();
        assertEquals(new ServerTimestampValue(WRITE_TIME, wrap("bar-value")), result.field(field("foo.bar")));
        assertEquals(wrap("baz-value"), result.field(field("baz")));
    }

    @Test
    void localServerTimestampHasNoPreviousValueWithoutBaseDocument() {
        Document view = doc("collection/key", 0, map("foo", "x"), true);
        TransformMutation transform = serverTimestampMutation("collection/key", "created");

        Document result = (Document) transform.applyToLocalView(view, null, WRITE_TIME);

        assertEquals(new ServerTimestampValue(WRITE_TIME, null), result.field(field("created")));
        assertEquals(wrap("x"), result.field(field("foo")));
    }

    @Test
    void localOnMissingDocumentIsNoOp() {
        TransformMutation transform = serverTimestampMutation("collection/key", "foo");
        NoDocument deleted = deletedDoc("collection/key", 3);

        assertNull(transform.applyToLocalView(null, null, WRITE_TIME));
        assertSame(deleted, transform.applyToLocalView(deleted, deleted, WRITE_TIME));
    }

    @Test
    void remoteWritesTransformResultsInOrderAndKeepsVersion() {
        Document base = doc("collection/key", 3, map("foo", map("bar", "bar-value"), "baz", "baz-value"));
        TransformMutation transform = serverTimestampMutation("collection/key", "foo.bar", "created");
        MutationResult result = new MutationResult(version(4),
                List.of(TimestampValue.of(COMMIT_TIME), TimestampValue.of(WRITE_TIME)));

        MaybeDocument remote = transform.applyToRemoteDocument(base, result);

        assertEquals(new Document(key("collection/key"), version(3),
                wrapObject(map("foo", map("bar", COMMIT_TIME), "baz", "baz-value", "created", WRITE_TIME)),
                false), remote);
    }

    @Test
    void remoteOnMissingDocumentIsNoOp() {
        TransformMutation transform = serverTimestampMutation("collection/key", "foo");
        MutationResult result = new MutationResult(version(4), List.of(TimestampValue.of(COMMIT_TIME)));
        NoDocument deleted = deletedDoc("collection/key", 3);

        assertNull(transform.applyToRemoteDocument(null, result));
        assertSame(deleted, transform.applyToRemoteDocument(deleted, result));
    }

    @Test
    void remoteWithoutTransformResultsIsFatal() {
        TransformMutation transform = serverTimestampMutation("collection/key", "foo");

        assertThrows(InvariantViolationException.class,
                () -> transform.applyToRemoteDocument(null, MutationResult.of(version(4))));
    }

    @Test
    void remoteWithWrongNumberOfTransformResultsIsFatal() {
        TransformMutation transform = serverTimestampMutation("collection/key", "foo", "bar");
        Document base = doc("collection/key", 3, map());
        MutationResult result = new MutationResult(version(4), List.of(TimestampValue.of(COMMIT_TIME)));

        InvariantViolationException e = assertThrows(InvariantViolationException.class,
                () -> transform.applyToRemoteDocument(base, result));
        assertThat(e.getMessage()).contains("length mismatch");
    }

    @Test
    void unknownTransformIsFatalOnBothPaths() {
        TransformOperation unknown = new TransformOperation() {
        };
        TransformMutation transform = new TransformMutation(key("collection/key"),
                List.of(new FieldTransform(field("foo"), unknown)));
        Document base = doc("collection/key", 3, map());

        assertThrows(InvariantViolationException.class, () -> transform.applyToLocalView(base, base, WRITE_TIME));
        assertThrows(InvariantViolationException.class, () -> transform.applyToRemoteDocument(base,
                new MutationResult(version(4), List.of(IntegerValue.of(1)))));
    }

    @Test
    void customTransformsPlugInWithoutChangingMutations() {
        TransformOperation increment = mock(TransformOperation.class);
        Document base = doc("collection/key", 3, map("count", 41L));
        when(increment.applyToLocalView(wrap(41L), WRITE_TIME)).thenReturn(wrap(42L));
        when(increment.applyToRemoteDocument(any(), any())).thenAnswer(inv -> inv.getArgument(1));
        TransformMutation transform = new TransformMutation(key("collection/key"),
                List.of(new FieldTransform(field("count"), increment)));

        Document local = (Document) transform.applyToLocalView(base, base, WRITE_TIME);
        Document remote = (Document) transform.applyToRemoteDocument(base,
                new MutationResult(version(4), List.of(wrap(50L))));

        assertEquals(wrap(42L), local.field(field("count")));
        assertEquals(wrap(50L), remote.field(field("count")));
        verify(increment).applyToRemoteDocument(wrap(41L), wrap(50L));
    }

    @Test
    void transformResultsMustNotContainNulls() {
        List<FieldValue> withNull = Arrays.asList(TimestampValue.of(COMMIT_TIME), null);

        assertThrows(NullPointerException.class, () -> new MutationResult(version(4), withNull));
    }
}
