package com.flowhouse.query;

import com.google.common.net.InetAddresses;

import java.math.BigInteger;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ClickHouse column types a breakdown value may have, each with its text rendering.
 *
 * The kind is chosen from the type name the driver reports for the column, so a
 * value is always rendered the way its declared type demands rather than by
 * whatever Java class the driver happened to map it to.
 */
public enum ColumnKind {
    UINT8,
    UINT16,
    UINT32,
    UINT64,
    STRING,
    IPV4,
    IPV6;

    private static final Pattern WRAPPER = Pattern.compile("^(?:Nullable|LowCardinality)\\((.*)\\)$");

    /**
     * Determine the kind of a result column from its declared ClickHouse type.
     *
     * @param column column label, for error reporting
     * @param typeName type name as reported by the driver, e.g. {@code LowCardinality(Nullable(String))}
     * @throws UnsupportedColumnTypeException if the type has no rendering
     */
    public static ColumnKind fromTypeName(String column, String typeName) {
        if (typeName == null) {
            throw new UnsupportedColumnTypeException(column, "<unknown>");
        }

        String type = typeName.trim();
        Matcher matcher = WRAPPER.matcher(type);
        while (matcher.matches()) {
            type = matcher.group(1).trim();
            matcher = WRAPPER.matcher(type);
        }

        if (type.startsWith("FixedString(")) {
            return STRING;
        }

        return switch (type) {
            case "UInt8" -> UINT8;
            case "UInt16" -> UINT16;
            case "UInt32" -> UINT32;
            case "UInt64" -> UINT64;
            case "String" -> STRING;
            case "IPv4" -> IPV4;
            case "IPv6" -> IPV6;
            default -> throw new UnsupportedColumnTypeException(column, typeName);
        };
    }

    /**
     * Render a column value as it appears in a series key.
     *
     * @param value value as returned by {@link java.sql.ResultSet#getObject(int)}
     * @return text form; empty for SQL NULL
     */
    public String render(Object value) {
        if (value == null) {
            return "";
        }

        return switch (this) {
            case UINT8, UINT16, UINT32, UINT64 -> renderUnsigned(value);
            case STRING -> renderString(value);
            case IPV4, IPV6 -> renderAddress(value);
        };
    }

    private String renderUnsigned(Object value) {
        if (value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Number) {
            long n = ((Number) value).longValue();
            return this == UINT64 ? Long.toUnsignedString(n) : Long.toString(n);
        }
        if (value instanceof String) {
            return (String) value;
        }
        throw new QueryExecutionException(String.format("Cannot render %s as %s", value.getClass().getName(), this));
    }

    private static String renderString(Object value) {
        if (value instanceof byte[]) {
            String s = new String((byte[]) value, StandardCharsets.UTF_8);
            int end = s.length();
            while (end > 0 && s.charAt(end - 1) == '\0') {
                end--;
            }
            return s.substring(0, end);
        }
        return value.toString();
    }

    private String renderAddress(Object value) {
        try {
            InetAddress address;
            if (value instanceof InetAddress) {
                address = (InetAddress) value;
            } else if (value instanceof byte[]) {
                address = InetAddress.getByAddress((byte[]) value);
            } else if (value instanceof String) {
                address = InetAddresses.forString((String) value);
            } else {
                throw new QueryExecutionException(String.format("Cannot render %s as %s", value.getClass().getName(), this));
            }
            // Re-reading the raw bytes turns IPv4-mapped IPv6 addresses into plain IPv4
            return InetAddresses.toAddrString(InetAddress.getByAddress(address.getAddress()));
        } catch (UnknownHostException | IllegalArgumentException e) {
            throw new QueryExecutionException(String.format("Invalid %s value: %s", this, value), null, e);
        }
    }
}
