package gov.llnl.sina.datastore.hbase;

import java.util.Arrays;
import java.util.List;

import org.apache.hadoop.hbase.util.Bytes;
import org.apache.hadoop.hbase.util.Order;
import org.apache.hadoop.hbase.util.OrderedBytes;
import org.apache.hadoop.hbase.util.PositionedByteRange;
import org.apache.hadoop.hbase.util.SimplePositionedMutableByteRange;

import com.google.common.collect.ImmutableList;

/**
 * Order-preserving row keys made of a sequence of strings, doubles and integers.
 * <p>
 * Each component is encoded with {@link OrderedBytes} in ascending order, so that the byte-wise
 * order of two keys matches the component-wise order of their values. Strings are terminated by
 * a zero byte and therefore cannot contain the {@code \u0000} character.
 * </p>
 */
final class RowKeys {

    private static final int FLOAT64_LENGTH = 9;

    private static final int INT32_LENGTH = 5;

    /**
     * Encodes the supplied components into a row key.
     *
     * @param components
     *            the components, each a {@code String}, a {@code Double} or an {@code Integer}
     * @return the row key
     */
    static byte[] key(final Object... components) {
        int length = 0;
        for (final Object component : components) {
            length += encodedLength(component);
        }
        final PositionedByteRange range = new SimplePositionedMutableByteRange(length);
        for (final Object component : components) {
            if (component instanceof String) {
                final String string = (String) component;
                if (string.indexOf('\u0000') >= 0) {
                    throw new IllegalArgumentException("Unsupported NUL character in " + string);
                }
                OrderedBytes.encodeString(range, string, Order.ASCENDING);
            } else if (component instanceof Double) {
                OrderedBytes.encodeFloat64(range, (Double) component, Order.ASCENDING);
            } else {
                OrderedBytes.encodeInt32(range, (Integer) component, Order.ASCENDING);
            }
        }
        return range.getBytes();
    }

    private static int encodedLength(final Object component) {
        if (component instanceof String) {
            return Bytes.toBytes((String) component).length + 2;
        } else if (component instanceof Double) {
            return FLOAT64_LENGTH;
        } else if (component instanceof Integer) {
            return INT32_LENGTH;
        }
        throw new IllegalArgumentException("Unsupported key component " + component);
    }

    /**
     * Returns the prefix shared by the keys whose components start with the components
     * specified, the last of which is a string to be matched as a prefix of the corresponding
     * key component.
     */
    static byte[] stringPrefix(final Object... components) {
        final byte[] key = key(components);
        return Arrays.copyOf(key, key.length - 1); // drop terminator
    }

    /**
     * Returns the smallest row key greater than every key starting with the prefix specified,
     * or an empty array if no such key exists.
     */
    static byte[] stopRowForPrefix(final byte[] prefix) {
        for (int i = prefix.length - 1; i >= 0; --i) {
            if (prefix[i] != (byte) 0xFF) {
                final byte[] stop = Arrays.copyOf(prefix, i + 1);
                ++stop[i];
                return stop;
            }
        }
        return new byte[0];
    }

    /**
     * Decodes all the components of a row key.
     *
     * @param key
     *            the row key
     * @return the decoded strings, doubles and integers
     */
    static List<Object> decode(final byte[] key) {
        final PositionedByteRange range = new SimplePositionedMutableByteRange(key);
        final ImmutableList.Builder<Object> builder = ImmutableList.builder();
        while (range.getRemaining() > 0) {
            if (OrderedBytes.isText(range)) {
                builder.add(OrderedBytes.decodeString(range));
            } else if (OrderedBytes.isFixedFloat64(range)) {
                builder.add(OrderedBytes.decodeFloat64(range));
            } else if (OrderedBytes.isFixedInt32(range)) {
                builder.add(OrderedBytes.decodeInt32(range));
            } else {
                throw new IllegalArgumentException("Cannot decode key "
                        + Bytes.toStringBinary(key) + " at position " + range.getPosition());
            }
        }
        return builder.build();
    }

    private RowKeys() {
    }

}
