package pl.marcinmilkowski.constraint_kb.ingest;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed field access over fastjson2 objects.
 *
 * Missing fields yield the declared default; fields of the wrong shape fail
 * with a {@link SourceFormatException} naming the source and entry.
 */
final class JsonFields {

    private final String source;

    JsonFields(String source) {
        this.source = source;
    }

    String source() {
        return source;
    }

    SourceFormatException error(String location, String message) {
        return new SourceFormatException(source, location, message);
    }

    /** Value of the first present key, or null */
    Object first(JSONObject obj, String... keys) {
        for (String key : keys) {
            if (obj.containsKey(key) && obj.get(key) != null) {
                return obj.get(key);
            }
        }
        return null;
    }

    int requireInt(JSONObject obj, String location, String... keys) throws SourceFormatException {
        Object value = first(obj, keys);
        if (value == null) {
            throw error(location, "missing required field '" + keys[0] + "'");
        }
        return toInt(value, path(location, keys[0]));
    }

    int intOr(JSONObject obj, String location, int defaultValue, String... keys) throws SourceFormatException {
        Object value = first(obj, keys);
        return value == null ? defaultValue : toInt(value, path(location, keys[0]));
    }

    double doubleOr(JSONObject obj, String location, double defaultValue, String... keys) throws SourceFormatException {
        Object value = first(obj, keys);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw error(path(location, keys[0]), "expected a number but found '" + value + "'");
    }

    String stringOr(JSONObject obj, String defaultValue, String... keys) {
        Object value = first(obj, keys);
        return value == null ? defaultValue : value.toString();
    }

    int toInt(Object value, String location) throws SourceFormatException {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d)) {
                throw error(location, "expected an integer but found " + value);
            }
            if (d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                throw error(location, "integer out of range: " + value);
            }
            return Math.toIntExact(n.longValue());
        }
        if (value instanceof String s) {
            return parseIntKey(s, location);
        }
        throw error(location, "expected an integer but found '" + value + "'");
    }

    int parseIntKey(String key, String location) throws SourceFormatException {
        try {
            return Integer.parseInt(key.trim());
        } catch (NumberFormatException e) {
            throw new SourceFormatException(source, location, "expected an integer key but found '" + key + "'", e);
        }
    }

    JSONObject object(Object value, String location) throws SourceFormatException {
        if (value instanceof JSONObject obj) {
            return obj;
        }
        throw error(location, "expected an object but found " + describe(value));
    }

    JSONObject objectOrEmpty(JSONObject obj, String location, String... keys) throws SourceFormatException {
        Object value = first(obj, keys);
        return value == null ? new JSONObject() : object(value, path(location, keys[0]));
    }

    JSONArray array(Object value, String location) throws SourceFormatException {
        if (value instanceof JSONArray arr) {
            return arr;
        }
        throw error(location, "expected an array but found " + describe(value));
    }

    List<String> stringList(JSONObject obj, String location, String... keys) throws SourceFormatException {
        Object value = first(obj, keys);
        return value == null ? List.of() : stringList(value, path(location, keys[0]));
    }

    List<String> stringList(Object value, String location) throws SourceFormatException {
        JSONArray arr = array(value, location);
        List<String> out = new ArrayList<>(arr.size());
        for (int i = 0; i < arr.size(); i++) {
            Object item = arr.get(i);
            if (item == null) {
                throw error(location + "[" + i + "]", "null entry");
            }
            if (item instanceof JSONObject || item instanceof JSONArray) {
                throw error(location + "[" + i + "]", "expected a string but found " + describe(item));
            }
            out.add(item.toString());
        }
        return out;
    }

    Set<String> stringSet(JSONObject obj, String location, String... keys) throws SourceFormatException {
        return new LinkedHashSet<>(stringList(obj, location, keys));
    }

    Set<Integer> intSet(Object value, String location) throws SourceFormatException {
        JSONArray arr = array(value, location);
        Set<Integer> out = new LinkedHashSet<>();
        for (int i = 0; i < arr.size(); i++) {
            out.add(toInt(arr.get(i), location + "[" + i + "]"));
        }
        return out;
    }

    Map<String, Double> numberMap(JSONObject obj, String location) throws SourceFormatException {
        Map<String, Double> out = new LinkedHashMap<>();
        for (String key : obj.keySet()) {
            Object value = obj.get(key);
            if (value == null) {
                continue;
            }
            if (!(value instanceof Number n)) {
                throw error(path(location, key), "expected a number but found '" + value + "'");
            }
            out.put(key, n.doubleValue());
        }
        return out;
    }

    static String path(String location, String key) {
        return location == null || location.isEmpty() ? key : location + "." + key;
    }

    private static String describe(Object value) {
        if (value == null) return "null";
        if (value instanceof JSONObject) return "an object";
        if (value instanceof JSONArray) return "an array";
        return "'" + value + "'";
    }
}
