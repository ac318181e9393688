package com.plant.flowsheet.io;

import com.plant.flowsheet.api.ConfigurationException;
import com.plant.flowsheet.api.ParameterResolver;
import com.plant.flowsheet.api.UnknownParameterException;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves references against named parameter tables.
 *
 * A reference {@code "asm1init.KLA1"} is looked up as key {@code KLA1} in
 * table {@code asm1init}. A reference without a table prefix, or whose prefix
 * names no table, is looked up as a whole in the flat values.
 *
 * Table values must be numbers or lists of numbers; they resolve to
 * {@code Double} and {@code double[]}.
 */
public final class TableParameterResolver implements ParameterResolver {
    private final Map<String, Map<String, Object>> tables = new LinkedHashMap<>();
    private final Map<String, Object> flat = new HashMap<>();

    public TableParameterResolver() {
    }

    public TableParameterResolver(Map<String, Map<String, Object>> tables) {
        if (tables != null)
            tables.forEach(this::withTable);
    }

    public TableParameterResolver withTable(String name, Map<String, Object> values) {
        tables.put(name, new HashMap<>(values));
        return this;
    }

    public TableParameterResolver withValue(String key, Object value) {
        flat.put(key, value);
        return this;
    }

    @Override
    public Object resolve(String reference) {
        int dot = reference.indexOf('.');
        if (dot > 0) {
            Map<String, Object> table = tables.get(reference.substring(0, dot));
            String key = reference.substring(dot + 1);
            if (table != null && table.containsKey(key))
                return convert(reference, table.get(key));
        }
        if (flat.containsKey(reference))
            return convert(reference, flat.get(reference));
        throw new UnknownParameterException(reference);
    }

    private static Object convert(String reference, Object value) {
        if (value instanceof Number n)
            return n.doubleValue();
        if (value instanceof double[] arr)
            return arr.clone();
        if (value instanceof List<?> list) {
            double[] out = new double[list.size()];
            for (int i = 0; i < out.length; i++) {
                if (!(list.get(i) instanceof Number n))
                    throw new ConfigurationException(
                            "Parameter '" + reference + "' element " + i + " is not a number: " + list.get(i));
                out[i] = n.doubleValue();
            }
            return out;
        }
        throw new ConfigurationException("Parameter '" + reference + "' is neither a number nor a list of numbers");
    }
}
