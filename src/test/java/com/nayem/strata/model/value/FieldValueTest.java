package com.nayem.strata.model.value;

import com.nayem.strata.model.Timestamp;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.nayem.strata.testutil.TestUtil.map;
import static com.nayem.strata.testutil.TestUtil.wrap;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FieldValueTest {

    private static final Timestamp WRITE_TIME = new Timestamp(1_700_000_000, 0);

    @Test
    void wrapsPlainJavaValues() {
        assertThat(wrap(null)).isEqualTo(NullValue.INSTANCE);
        assertThat(wrap(true)).isEqualTo(BooleanValue.TRUE);
        assertThat(wrap(3)).isEqualTo(IntegerValue.of(3));
        assertThat(wrap(1.5)).isEqualTo(DoubleValue.of(1.5));
        assertThat(wrap("s")).isEqualTo(StringValue.of("s"));
        assertThat(wrap(Instant.ofEpochSecond(10))).isEqualTo(TimestampValue.of(new Timestamp(10, 0)));
        assertThat(wrap(List.of(1L, "a"))).isEqualTo(ArrayValue.of(List.of(IntegerValue.of(1), StringValue.of("a"))));
    }

    @Test
    void rejectsUnsupportedTypes() {
        assertThrows(IllegalArgumentException.class, () -> wrap(new Object()));
        assertThrows(IllegalArgumentException.class, () -> FieldValues.wrapObject(Map.of(1, "a")));
    }

    @Test
    void integerAndDoubleCompareNumericallyButAreNotEqual() {
        assertThat(IntegerValue.of(1)).isNotEqualTo(DoubleValue.of(1.0));
        assertThat(IntegerValue.of(1).compareTo(DoubleValue.of(1.0))).isZero();
        assertOrdered(IntegerValue.of(1), DoubleValue.of(1.5));
        assertOrdered(DoubleValue.NaN, IntegerValue.of(Long.MIN_VALUE));
        assertThat(DoubleValue.of(Double.NaN)).isEqualTo(DoubleValue.NaN);
    }

    @Test
    void ordersAcrossTypes() {
        assertOrdered(NullValue.INSTANCE, BooleanValue.FALSE);
        assertOrdered(BooleanValue.TRUE, IntegerValue.of(0));
        assertOrdered(IntegerValue.of(100), TimestampValue.of(WRITE_TIME));
        assertOrdered(TimestampValue.of(WRITE_TIME), StringValue.of(""));
        assertOrdered(StringValue.of("z"), ArrayValue.of(List.of()));
        assertOrdered(ArrayValue.of(List.of()), ObjectValue.EMPTY);
    }

    @Test
    void serverTimestampsSortAfterResolvedTimestamps() {
        ServerTimestampValue pending = new ServerTimestampValue(new Timestamp(1, 0), null);
        TimestampValue resolved = TimestampValue.of(new Timestamp(2_000_000_000, 0));

        assertOrdered(resolved, pending);
        assertOrdered(pending, new ServerTimestampValue(new Timestamp(2, 0), null));
    }

    @Test
    void serverTimestampReadsPerBehavior() {
        ServerTimestampValue value = new ServerTimestampValue(WRITE_TIME, StringValue.of("before"));

        assertNull(value.value(ServerTimestampBehavior.NONE));
        assertNull(value.value());
        assertThat(value.value(ServerTimestampBehavior.ESTIMATE)).isEqualTo(WRITE_TIME);
        assertThat(value.value(ServerTimestampBehavior.PREVIOUS)).isEqualTo("before");
    }

    @Test
    void previousBehaviorResolvesThroughNestedServerTimestamps() {
        ServerTimestampValue first = new ServerTimestampValue(new Timestamp(1, 0), IntegerValue.of(7));
        ServerTimestampValue second = new ServerTimestampValue(new Timestamp(2, 0), first);

        assertThat(second.value(ServerTimestampBehavior.PREVIOUS)).isEqualTo(7L);
        assertNull(new ServerTimestampValue(WRITE_TIME, null).value(ServerTimestampBehavior.PREVIOUS));
    }

    @Test
    void objectValueConvertsToPlainMap() {
        ObjectValue value = FieldValues.wrapObject(
                map("a", map("b", 1L), "ts", new ServerTimestampValue(WRITE_TIME, null)));

        Map<String, Object> plain = value.value(ServerTimestampBehavior.ESTIMATE);

        assertThat(plain).containsEntry("a", Map.of("b", 1L)).containsEntry("ts", WRITE_TIME);
    }

    private static void assertOrdered(FieldValue smaller, FieldValue larger) {
        assertThat(smaller.compareTo(larger)).isNegative();
        assertThat(larger.compareTo(smaller)).isPositive();
    }
}
