/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with this
 * work for additional information regarding copyright ownership. The ASF
 * licenses this file to You under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package org.graphbulk.serializer;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.graphbulk.exception.UnsupportedTypeException;
import org.graphbulk.type.PropertyType;
import org.graphbulk.type.define.DataType;
import org.apache.hugegraph.util.E;

/**
 * Maps property values to (type tag, cell text) and back.
 *
 * Scalars are written as decimal numbers, lowercase booleans or raw text.
 * Arrays join their elements with {@link #ARRAY_DELIMITER}; an element that
 * is empty or contains the delimiter or a quote is wrapped in double quotes
 * with inner quotes doubled. An empty array is written as a lone delimiter,
 * an empty cell always means the value is absent.
 */
public final class TypeCodec {

    public static final char ARRAY_DELIMITER = ';';
    public static final char QUOTE = '"';

    private static final String EMPTY_ARRAY = String.valueOf(ARRAY_DELIMITER);

    private TypeCodec() {
    }

    /**
     * @return the scalar data type of a value, or null if it isn't a
     *         supported scalar
     */
    public static DataType scalarType(Object value) {
        if (value instanceof Boolean) {
            return DataType.BOOLEAN;
        }
        if (value instanceof Byte || value instanceof Short ||
            value instanceof Integer || value instanceof Long) {
            return DataType.INT;
        }
        if (value instanceof Float || value instanceof Double) {
            return DataType.FLOAT;
        }
        if (value instanceof String || value instanceof Character ||
            value instanceof Enum) {
            return DataType.STRING;
        }
        return null;
    }

    public static boolean isSequence(Object value) {
        return value instanceof Collection ||
               (value != null && value.getClass().isArray());
    }

    /**
     * @return the elements of a collection or array in iteration order
     */
    public static List<Object> elements(Object value) {
        E.checkArgument(isSequence(value),
                        "Expect a collection or an array, but got %s",
                        value == null ? null : value.getClass());
        if (value instanceof Collection) {
            return new ArrayList<>((Collection<?>) value);
        }
        int length = Array.getLength(value);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(Array.get(value, i));
        }
        return elements;
    }

    /**
     * Infer the type tag of a single value.
     *
     * @return null for a null value or an empty sequence, neither of which
     *         tells anything about the column type
     * @throws UnsupportedTypeException if the value is neither a supported
     *         scalar nor a sequence of one scalar type
     */
    public static PropertyType infer(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (isSequence(value)) {
            DataType elementType = elementType(key, value, elements(value));
            return elementType == null ? null : PropertyType.listOf(elementType);
        }
        DataType type = scalarType(value);
        if (type == null) {
            throw new UnsupportedTypeException(key, value, String.format(
                      "no type tag for %s", value.getClass().getName()));
        }
        return PropertyType.of(type);
    }

    private static DataType elementType(String key, Object value,
                                        List<Object> elements) {
        DataType result = null;
        for (Object element : elements) {
            if (element == null) {
                throw new UnsupportedTypeException(key, value,
                                                   "null array element");
            }
            DataType type = scalarType(element);
            if (type == null) {
                throw new UnsupportedTypeException(key, value, String.format(
                          "unsupported array element of %s",
                          element.getClass().getName()));
            }
            if (result != null && result != type) {
                throw new UnsupportedTypeException(key, value, String.format(
                          "mixed array elements of %s and %s",
                          result.string(), type.string()));
            }
            result = type;
        }
        return result;
    }

    /**
     * Encode a value as the text of a cell of the given column type.
     * Returns an empty string for null, the caller takes care of CSV
     * quoting.
     */
    public static String encode(String key, Object value, PropertyType type) {
        E.checkNotNull(type, "type");
        if (value == null) {
            return "";
        }
        if (type.isList()) {
            if (!isSequence(value)) {
                throw new UnsupportedTypeException(key, value, String.format(
                          "a scalar doesn't fit column type %s", type));
            }
            return encodeArray(key, value, type.dataType());
        }
        if (isSequence(value)) {
            if (!type.dataType().isText()) {
                throw new UnsupportedTypeException(key, value, String.format(
                          "an array doesn't fit column type %s", type));
            }
            // Arrays in a string column keep their array text
            PropertyType actual = infer(key, value);
            DataType elementType = actual == null ? DataType.STRING :
                                   actual.dataType();
            return encodeArray(key, value, elementType);
        }
        return encodeScalar(key, value, type.dataType());
    }

    private static String encodeArray(String key, Object value,
                                      DataType elementType) {
        List<Object> elements = elements(value);
        // Validates null and mixed elements
        elementType(key, value, elements);
        if (elements.isEmpty()) {
            return EMPTY_ARRAY;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append(ARRAY_DELIMITER);
            }
            String text = encodeScalar(key, elements.get(i), elementType);
            sb.append(escapeElement(text));
        }
        return sb.toString();
    }

    private static String encodeScalar(String key, Object value,
                                       DataType type) {
        DataType actual = scalarType(value);
        if (actual == null) {
            throw new UnsupportedTypeException(key, value, String.format(
                      "no type tag for %s", value.getClass().getName()));
        }
        switch (type) {
            case BOOLEAN:
            case INT:
                if (actual == type) {
                    return value.toString();
                }
                break;
            case FLOAT:
                if (actual == DataType.FLOAT) {
                    return floatText((Number) value);
                }
                if (actual == DataType.INT) {
                    return Double.toString(((Number) value).doubleValue());
                }
                break;
            case STRING:
                return scalarText(value, actual);
            default:
                throw new AssertionError(String.format(
                          "Unknown data type '%s'", type));
        }
        throw new UnsupportedTypeException(key, value, String.format(
                  "%s value doesn't fit column type %s",
                  actual.string(), type.string()));
    }

    private static String scalarText(Object value, DataType actual) {
        if (actual == DataType.FLOAT) {
            return floatText((Number) value);
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        return value.toString();
    }

    private static String floatText(Number value) {
        if (value instanceof Float) {
            return Float.toString(value.floatValue());
        }
        return Double.toString(value.doubleValue());
    }

    private static String escapeElement(String text) {
        if (!text.isEmpty() && text.indexOf(ARRAY_DELIMITER) < 0 &&
            text.indexOf(QUOTE) < 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append(QUOTE);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == QUOTE) {
                sb.append(QUOTE);
            }
            sb.append(c);
        }
        sb.append(QUOTE);
        return sb.toString();
    }

    /**
     * Decode the text of a cell.
     *
     * @return null if the text is empty, meaning the property is absent
     * @throws IllegalArgumentException if the text doesn't parse as the
     *         given type
     */
    public static Object decode(String text, PropertyType type) {
        E.checkNotNull(type, "type");
        if (text == null || text.isEmpty()) {
            return null;
        }
        if (!type.isList()) {
            return decodeScalar(text, type.dataType());
        }
        List<String> parts = splitArray(text);
        List<Object> values = new ArrayList<>(parts.size());
        for (String part : parts) {
            values.add(decodeScalar(part, type.dataType()));
        }
        return values;
    }

    public static Object decodeScalar(String text, DataType type) {
        switch (type) {
            case BOOLEAN:
                if ("true".equalsIgnoreCase(text.trim())) {
                    return Boolean.TRUE;
                }
                if ("false".equalsIgnoreCase(text.trim())) {
                    return Boolean.FALSE;
                }
                throw new IllegalArgumentException(String.format(
                          "Can't read '%s' as boolean", text));
            case INT:
                long value;
                try {
                    value = Long.parseLong(text.trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(String.format(
                              "Can't read '%s' as int", text), e);
                }
                if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                    return (int) value;
                }
                return value;
            case FLOAT:
                try {
                    return Double.parseDouble(text.trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(String.format(
                              "Can't read '%s' as float", text), e);
                }
            case STRING:
                return text;
            default:
                throw new AssertionError(String.format(
                          "Unknown data type '%s'", type));
        }
    }

    /**
     * Split array text into its elements, unquoting quoted elements.
     * An unquoted empty segment at either end is ignored, so {@code ";"}
     * is an empty array and {@code "a;b;"} has two elements.
     */
    public static List<String> splitArray(String text) {
        List<String> parts = new ArrayList<>();
        List<Boolean> quoted = new ArrayList<>();
        int length = text.length();
        int i = 0;
        while (true) {
            if (i < length && text.charAt(i) == QUOTE) {
                StringBuilder sb = new StringBuilder();
                i++;
                boolean closed = false;
                while (i < length) {
                    char c = text.charAt(i++);
                    if (c != QUOTE) {
                        sb.append(c);
                    } else if (i < length && text.charAt(i) == QUOTE) {
                        sb.append(QUOTE);
                        i++;
                    } else {
                        closed = true;
                        break;
                    }
                }
                if (!closed) {
                    throw new IllegalArgumentException(String.format(
                              "Unterminated quoted array element in '%s'",
                              text));
                }
                if (i < length && text.charAt(i) != ARRAY_DELIMITER) {
                    throw new IllegalArgumentException(String.format(
                              "Unexpected character after quoted array " +
                              "element at %s in '%s'", i, text));
                }
                parts.add(sb.toString());
                quoted.add(true);
            } else {
                int end = text.indexOf(ARRAY_DELIMITER, i);
                if (end < 0) {
                    end = length;
                }
                parts.add(text.substring(i, end));
                quoted.add(false);
                i = end;
            }
            if (i >= length) {
                break;
            }
            // Skip the delimiter
            i++;
            if (i == length) {
                parts.add("");
                quoted.add(false);
                break;
            }
        }

        int last = parts.size() - 1;
        if (last >= 0 && !quoted.get(last) && parts.get(last).isEmpty()) {
            parts.remove(last);
        }
        if (!parts.isEmpty() && !quoted.get(0) && parts.get(0).isEmpty()) {
            parts.remove(0);
        }
        return parts;
    }
}
