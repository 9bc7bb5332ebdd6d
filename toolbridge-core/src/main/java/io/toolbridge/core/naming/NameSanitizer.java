package io.toolbridge.core.naming;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Maps a raw tool name onto the host identifier alphabet ({@code [A-Za-z0-9_]}, at most 64 characters) and
 * keeps it unique against names already handed out in the same pass.
 *
 * <p>A name that is already valid and free is returned unchanged. Over-long names keep their first
 * {@value #PREFIX_LENGTH} characters followed by {@code _} and a {@value #SUFFIX_LENGTH}-character suffix;
 * collisions are resolved the same way.
 */
public final class NameSanitizer {
    public static final int MAX_LENGTH = 64;
    public static final int SUFFIX_LENGTH = 8;
    public static final int PREFIX_LENGTH = MAX_LENGTH - SUFFIX_LENGTH - 1;

    private static final String FALLBACK_NAME = "tool";
    private static final int MAX_ATTEMPTS = 1_000;

    private final Supplier<String> suffixes;

    public NameSanitizer() {
        this(NameSanitizer::randomSuffix);
    }

    /**
     * @param suffixes source of collision and truncation suffixes; values are cleaned and cut or padded to
     *                 {@value #SUFFIX_LENGTH} characters
     */
    public NameSanitizer(Supplier<String> suffixes) {
        this.suffixes = Objects.requireNonNull(suffixes, "suffixes must not be null");
    }

    /**
     * @param assigned names already taken in this pass; read only, the caller records the returned name
     */
    public String sanitize(String rawName, Set<String> assigned) {
        Objects.requireNonNull(assigned, "assigned must not be null");
        String cleaned = replaceInvalid(rawName == null ? "" : rawName);
        if (cleaned.isEmpty()) {
            cleaned = FALLBACK_NAME;
        }
        if (cleaned.length() <= MAX_LENGTH && !assigned.contains(cleaned)) {
            return cleaned;
        }

        String prefix = cleaned.length() > PREFIX_LENGTH ? cleaned.substring(0, PREFIX_LENGTH) : cleaned;
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String candidate = prefix + "_" + nextSuffix();
            if (!assigned.contains(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not find a free name for '" + rawName + "' after " + MAX_ATTEMPTS + " attempts");
    }

    public static boolean isValid(String name) {
        return name != null
            && !name.isEmpty()
            && name.length() <= MAX_LENGTH
            && name.equals(replaceInvalid(name));
    }

    static String replaceInvalid(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            out.append(isAllowed(c) ? c : '_');
        }
        return out.toString();
    }

    private String nextSuffix() {
        String suffix = replaceInvalid(Objects.requireNonNullElse(suffixes.get(), ""));
        if (suffix.length() >= SUFFIX_LENGTH) {
            return suffix.substring(0, SUFFIX_LENGTH);
        }
        return suffix + "0".repeat(SUFFIX_LENGTH - suffix.length());
    }

    private static boolean isAllowed(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }

    private static String randomSuffix() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, SUFFIX_LENGTH);
    }
}
