package com.robotlang.app;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ProgramSource {

    private ProgramSource() {}

    /** Reads a program file as UTF-8 with line endings folded to {@code \n}. */
    public static String read(Path file) throws IOException {
        return normalize(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    public static String normalize(String text) {
        if (text == null) return "";
        return text
                .replace("\r\n", "\n")
                .replace("\r", "\n");
    }
}
