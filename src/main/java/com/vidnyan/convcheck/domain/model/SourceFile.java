package com.vidnyan.convcheck.domain.model;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A text source file scanned as raw content, never parsed into a syntax tree.
 */
public record SourceFile(
    Path path,
    String content
) {

    /**
     * Read as UTF-8. Malformed bytes (e.g. Latin-1 comments) become U+FFFD instead of failing.
     */
    public static SourceFile read(Path path) throws IOException {
        return new SourceFile(path, new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    public String fileName() {
        return path.getFileName().toString();
    }

    public boolean contains(CharSequence token) {
        return content.contains(token);
    }
}
