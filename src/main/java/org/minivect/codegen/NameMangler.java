package org.minivect.codegen;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;
import com.ibm.icu.text.Normalizer2;
import org.minivect.core.CodegenException;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps source-level identifiers to C identifiers.
 * <p>
 * Names are NFC-normalized first, so canonically equivalent spellings share one C name.
 * A plain ASCII identifier that is not a C keyword and not a reserved spelling maps to itself.
 * Anything else maps to {@code prefix + escape(name)}, where {@code _} becomes {@code __}
 * and every other non-alphanumeric code point becomes {@code _x<hex>_}. Identity results never
 * start with the prefix and escaped results always do, and the escape is decodable, so distinct
 * names never share a C name.
 */
public class NameMangler {
    private static final Set<String> C_KEYWORDS = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double",
            "else", "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long",
            "register", "restrict", "return", "short", "signed", "sizeof", "static", "struct",
            "switch", "typedef", "union", "unsigned", "void", "volatile", "while",
            "_Alignas", "_Alignof", "_Atomic", "_Bool", "_Complex", "_Generic", "_Imaginary",
            "_Noreturn", "_Static_assert", "_Thread_local");

    private final String prefix;
    private final Normalizer2 normalizer = Normalizer2.getNFCInstance();
    private final Map<String, String> cache = new HashMap<>();

    public NameMangler(String prefix) {
        if (prefix == null || prefix.isEmpty() || !isPlainIdentifier(prefix)) {
            throw new CodegenException("Invalid mangling prefix: '" + prefix + "'");
        }
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Returns the C identifier for a source-level name.
     *
     * @param name the source-level name
     * @return the C identifier, identical for identical (or canonically equivalent) input
     * @throws CodegenException if the name is not an identifier
     */
    public String mangle(String name) {
        if (name == null || name.isEmpty()) {
            throw new CodegenException("Cannot mangle an empty name");
        }
        String cached = cache.get(name);
        if (cached != null) {
            return cached;
        }
        String normalized = normalizer.normalize(name);
        checkIdentifier(name, normalized);

        String mangled;
        if (isPlainIdentifier(normalized) && !isReserved(normalized)) {
            mangled = normalized;
        } else {
            mangled = prefix + escape(normalized);
        }
        cache.put(name, mangled);
        return mangled;
    }

    private void checkIdentifier(String original, String name) {
        int i = 0;
        while (i < name.length()) {
            int cp = name.codePointAt(i);
            boolean valid = i == 0
                    ? cp == '_' || UCharacter.hasBinaryProperty(cp, UProperty.XID_START)
                    : UCharacter.hasBinaryProperty(cp, UProperty.XID_CONTINUE);
            if (!valid) {
                throw new CodegenException("Not an identifier: '" + original + "'");
            }
            i += Character.charCount(cp);
        }
    }

    private boolean isReserved(String name) {
        // Leading "__" and "_X" are reserved for the implementation in C
        return C_KEYWORDS.contains(name)
                || name.startsWith(prefix)
                || name.startsWith("__")
                || (name.length() > 1 && name.charAt(0) == '_' && Character.isUpperCase(name.charAt(1)));
    }

    private static boolean isPlainIdentifier(String name) {
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean valid = c == '_' || isAsciiLetter(c) || (i > 0 && c >= '0' && c <= '9');
            if (!valid) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAsciiLetter(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static String escape(String name) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < name.length()) {
            int cp = name.codePointAt(i);
            if (cp == '_') {
                sb.append("__");
            } else if (isAsciiLetter(cp) || (cp >= '0' && cp <= '9')) {
                sb.appendCodePoint(cp);
            } else {
                sb.append("_x").append(Integer.toHexString(cp)).append('_');
            }
            i += Character.charCount(cp);
        }
        return sb.toString();
    }
}
