package com.transitlog.backend.util;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds zip archives in memory for tests.
 */
public final class ZipArchives {

    private ZipArchives() {
    }

    /**
     * @param members member name to text; names ending in / become directory entries
     */
    public static byte[] zip(Map<String, String> members) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zipOut = new ZipOutputStream(bytes)) {
            for (Map.Entry<String, String> member : members.entrySet()) {
                zipOut.putNextEntry(new ZipEntry(member.getKey()));
                if (!member.getKey().endsWith("/")) {
                    zipOut.write(member.getValue().getBytes(StandardCharsets.UTF_8));
                }
                zipOut.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }
}
