package org.dxworks.cobolsim.preprocessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Run-scoped library of copybooks, keyed by normalized (upper-case) name.
 *
 * - Built either from an in-memory name to text mapping or from copybook files on disk.
 * - Files are indexed under their base name and their full file name.
 * - Duplicate names across several paths are reported and resolved deterministically.
 */
public final class CopybookLibrary {

    private static final Logger log = LoggerFactory.getLogger(CopybookLibrary.class);

    private final Map<String, String> byNormalizedName;

    private CopybookLibrary(Map<String, String> byNormalizedName) {
        this.byNormalizedName = byNormalizedName;
    }

    public static CopybookLibrary empty() {
        return new CopybookLibrary(Collections.emptyMap());
    }

    public static CopybookLibrary of(Map<String, String> copybooks) {
        Objects.requireNonNull(copybooks, "copybooks");
        Map<String, String> index = new HashMap<>();
        for (Map.Entry<String, String> e : copybooks.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            index.put(normalizeName(e.getKey()), e.getValue());
        }
        return new CopybookLibrary(Collections.unmodifiableMap(index));
    }

    /**
     * Indexes every regular file below {@code directory} whose name ends with one of the extensions.
     */
    public static CopybookLibrary fromDirectory(Path directory, List<String> extensions) throws IOException {
        if (directory == null || !Files.isDirectory(directory)) {
            return empty();
        }
        List<Path> files;
        try (Stream<Path> stream = Files.walk(directory)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(p -> hasExtension(p, extensions))
                    .collect(Collectors.toList());
        }
        return fromFiles(files);
    }

    public static CopybookLibrary fromFiles(List<Path> copybookFiles) throws IOException {
        Objects.requireNonNull(copybookFiles, "copybookFiles");

        // Track candidates by key so we can both warn about duplicates and choose a winner deterministically.
        Map<String, List<Path>> candidatesByKey = new HashMap<>();

        for (Path p : copybookFiles) {
            if (p == null) continue;
            if (!Files.isRegularFile(p)) continue;

            String fileName = p.getFileName().toString();
            candidatesByKey.computeIfAbsent(normalizeName(stripExtension(fileName)), k -> new ArrayList<>()).add(p);
            candidatesByKey.computeIfAbsent(normalizeName(fileName), k -> new ArrayList<>()).add(p);
        }

        reportDuplicates(candidatesByKey);

        Map<String, String> index = new HashMap<>();
        for (Map.Entry<String, List<Path>> e : candidatesByKey.entrySet()) {
            Path winner = pickWinner(e.getValue());
            index.put(e.getKey(), Files.readString(winner, StandardCharsets.UTF_8));
        }
        return new CopybookLibrary(Collections.unmodifiableMap(index));
    }

    public boolean contains(String name) {
        return byNormalizedName.containsKey(normalizeName(name));
    }

    public Optional<String> lookup(String name) {
        return Optional.ofNullable(byNormalizedName.get(normalizeName(name)));
    }

    /**
     * Returns a new library that also holds {@code name}; used when a host supplies a missing copybook.
     */
    public CopybookLibrary with(String name, String text) {
        Map<String, String> index = new HashMap<>(byNormalizedName);
        index.put(normalizeName(name), text);
        return new CopybookLibrary(Collections.unmodifiableMap(index));
    }

    public Set<String> names() {
        return new TreeSet<>(byNormalizedName.keySet());
    }

    private static void reportDuplicates(Map<String, List<Path>> candidatesByKey) {
        Map<String, List<Path>> dupes = new TreeMap<>();

        for (Map.Entry<String, List<Path>> e : candidatesByKey.entrySet()) {
            // Unique by absolute path
            LinkedHashMap<String, Path> unique = new LinkedHashMap<>();
            for (Path p : e.getValue()) {
                unique.put(p.toAbsolutePath().toString(), p);
            }
            if (unique.size() > 1) {
                dupes.put(e.getKey(), new ArrayList<>(unique.values()));
            }
        }

        for (Map.Entry<String, List<Path>> e : dupes.entrySet()) {
            log.warn("Duplicate copybook name {} found at {}", e.getKey(), e.getValue());
        }
    }

    private static Path pickWinner(List<Path> candidates) {
        // 1) shortest absolute path length
        // 2) lexicographically smallest absolute path
        return candidates.stream()
                .filter(Objects::nonNull)
                .min(Comparator
                        .comparingInt((Path p) -> p.toAbsolutePath().toString().length())
                        .thenComparing(p -> p.toAbsolutePath().toString()))
                .orElseThrow(() -> new IllegalArgumentException("No copybook candidates"));
    }

    static String normalizeName(String token) {
        String t = token.trim().toUpperCase(Locale.ROOT);

        if ((t.startsWith("\"") && t.endsWith("\"") && t.length() > 1)
                || (t.startsWith("'") && t.endsWith("'") && t.length() > 1)) {
            t = t.substring(1, t.length() - 1).trim();
        }

        // Remove trailing punctuation (common with naive tokenization)
        t = t.replaceAll("[.;,]+$", "");

        t = t.replace('\\', '/');
        int slash = t.lastIndexOf('/');
        if (slash >= 0 && slash + 1 < t.length()) {
            t = t.substring(slash + 1);
        }
        return t;
    }

    private static boolean hasExtension(Path p, List<String> extensions) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (name.endsWith(ext.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static String stripExtension(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        if (lastDot <= 0) return fileName;
        return fileName.substring(0, lastDot);
    }
}
