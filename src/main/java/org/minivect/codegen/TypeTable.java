package org.minivect.codegen;

import org.minivect.core.CodegenException;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.io.InputStream;
import java.util.IllegalFormatException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The table mapping scalar type names to their C spelling and, for types that own a resource,
 * the statement releasing it.
 * <p>
 * The table is a YAML document:
 * <pre>
 * types:
 *   float64: { c: "double" }
 *   object:  { c: "PyObject *", dispose: "Py_CLEAR(%s);", init: "NULL" }
 * </pre>
 * In a {@code dispose} template {@code %s} stands for the variable name. {@code init} is the
 * value temporaries of the type start with, so disposal is safe before their first assignment.
 */
public class TypeTable {

    /**
     * One type of the table.
     *
     * @param name            the scalar type name used in the tree
     * @param cName           the C spelling
     * @param disposeTemplate the release statement, or null if the type owns nothing
     * @param init            the initial value of temporaries, or null for none
     */
    public record Entry(String name, String cName, String disposeTemplate, String init) {
        public boolean isDisposable() {
            return disposeTemplate != null;
        }

        public String dispose(String variable) {
            return String.format(disposeTemplate, variable);
        }
    }

    private final Map<String, Entry> entries;

    public TypeTable(Map<String, Entry> entries) {
        this.entries = new LinkedHashMap<>(entries);
    }

    /**
     * Loads a type table from the classpath.
     *
     * @param resource the resource path, e.g. {@code minivect/ctypes.yaml}
     * @return the table
     * @throws CodegenException if the resource is missing or malformed
     */
    public static TypeTable load(String resource) {
        try (InputStream in = TypeTable.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new CodegenException("Type table resource not found: " + resource);
            }
            return parse(newLoad(resource).loadFromInputStream(in), resource);
        } catch (IOException e) {
            throw new CodegenException("Cannot read type table " + resource, e);
        } catch (YamlEngineException e) {
            throw new CodegenException("Malformed type table " + resource + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a type table from YAML text.
     *
     * @param yaml  the document
     * @param label the name used in error messages
     * @return the table
     */
    public static TypeTable fromString(String yaml, String label) {
        try {
            return parse(newLoad(label).loadFromString(yaml), label);
        } catch (YamlEngineException e) {
            throw new CodegenException("Malformed type table " + label + ": " + e.getMessage(), e);
        }
    }

    private static Load newLoad(String label) {
        LoadSettings loadSettings = LoadSettings.builder()
                .setLabel(label)
                .setAllowDuplicateKeys(false)
                .build();
        return new Load(loadSettings);
    }

    private static TypeTable parse(Object document, String label) {
        if (!(document instanceof Map<?, ?> root) || !(root.get("types") instanceof Map<?, ?> types)) {
            throw new CodegenException("Type table " + label + " has no 'types' mapping");
        }
        Map<String, Entry> entries = new LinkedHashMap<>();
        for (Map.Entry<?, ?> type : types.entrySet()) {
            String name = String.valueOf(type.getKey());
            if (!(type.getValue() instanceof Map<?, ?> fields) || !(fields.get("c") instanceof String cName)) {
                throw new CodegenException("Type '" + name + "' in " + label + " needs a 'c' spelling");
            }
            String dispose = optionalString(fields, "dispose", name, label);
            if (dispose != null) {
                try {
                    String.format(dispose, "x");
                } catch (IllegalFormatException e) {
                    throw new CodegenException("Type '" + name + "' in " + label + " has a malformed 'dispose' template", e);
                }
            }
            entries.put(name, new Entry(name, cName, dispose, optionalString(fields, "init", name, label)));
        }
        return new TypeTable(entries);
    }

    private static String optionalString(Map<?, ?> fields, String key, String name, String label) {
        Object value = fields.get(key);
        if (value != null && !(value instanceof String)) {
            throw new CodegenException("Type '" + name + "' in " + label + " has a non-string '" + key + "'");
        }
        return (String) value;
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    /**
     * Returns the entry for a scalar type name.
     *
     * @throws CodegenException for an unknown name
     */
    public Entry lookup(String name) {
        Entry entry = entries.get(name);
        if (entry == null) {
            throw new CodegenException("Unknown type '" + name + "'");
        }
        return entry;
    }
}
