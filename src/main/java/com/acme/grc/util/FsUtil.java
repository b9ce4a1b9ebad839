package com.acme.grc.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

public final class FsUtil {
    private FsUtil() {}

    public static final long MAX_DOCUMENT_BYTES = 10L * 1024 * 1024;

    public static Map<String, Object> fileStat(String path) {
        Map<String, Object> o = new LinkedHashMap<>();
        o.put("path", path);
        if (path == null) {
            o.put("exists", false);
            o.put("reason", "not provided");
            return o;
        }
        Path p = Paths.get(path);
        o.put("exists", Files.exists(p));
        o.put("is_file", Files.isRegularFile(p));
        try { if (Files.isRegularFile(p)) o.put("size_bytes", Files.size(p)); } catch (IOException ignored) {}
        return o;
    }

    /**
     * Reads a policy document as UTF-8, replacing malformed input. Rejects directories, missing files
     * and anything above {@link #MAX_DOCUMENT_BYTES}.
     */
    public static String readDocument(Path p) throws IOException {
        if (p == null || !Files.exists(p)) throw new NoSuchFileException(String.valueOf(p));
        if (!Files.isRegularFile(p)) throw new IOException("Path is not a file: " + p);
        long size = Files.size(p);
        if (size > MAX_DOCUMENT_BYTES) {
            throw new IOException("File too large: " + size + " bytes (max: " + MAX_DOCUMENT_BYTES + ")");
        }
        return new String(Files.readAllBytes(p), StandardCharsets.UTF_8);
    }

    public static String baseName(Path p) {
        if (p == null || p.getFileName() == null) return null;
        String fn = p.getFileName().toString();
        int dot = fn.lastIndexOf('.');
        return dot > 0 ? fn.substring(0, dot) : fn;
    }
}
