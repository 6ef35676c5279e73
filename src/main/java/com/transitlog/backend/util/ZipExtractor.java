package com.transitlog.backend.util;

import com.transitlog.backend.exception.FeedDecodeException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Decompresses members of a zip archive held in memory.
 */
public class ZipExtractor {

    // End of central directory record, all an archive without members contains
    private static final byte[] EMPTY_ARCHIVE_SIGNATURE = { 'P', 'K', 5, 6 };

    private ZipExtractor() {
    }

    /**
     * Extract members of an archive as UTF-8 text.
     *
     * <p>Directory entries and hidden files (names starting with {@code .}) are
     * skipped. A requested member that is not in the archive has no entry in the
     * result; callers must check.
     *
     * @param archive the zip archive
     * @param names   members to extract, or none to extract every member
     * @return member name to content, in archive order
     * @throws FeedDecodeException if the archive is corrupt
     */
    public static Map<String, String> unzip(byte[] archive, String... names) {
        Set<String> wanted = Arrays.stream(names).collect(Collectors.toSet());
        Map<String, String> result = new LinkedHashMap<>();
        boolean sawEntry = false;

        try (ZipInputStream zipIn = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zipIn.getNextEntry()) != null) {
                sawEntry = true;
                String name = entry.getName();
                if (entry.isDirectory() || name.startsWith(".")) {
                    continue;
                }
                if (!wanted.isEmpty() && !wanted.contains(name)) {
                    continue;
                }
                result.put(name, new String(zipIn.readAllBytes(), StandardCharsets.UTF_8));
                zipIn.closeEntry();
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new FeedDecodeException("Bad unzip: " + e.getMessage(), e);
        }

        // ZipInputStream reports garbage input as an empty archive
        if (!sawEntry && archive.length > 0 && !isEmptyArchive(archive)) {
            throw new FeedDecodeException("Bad unzip: no zip entries in " + archive.length + " bytes", null);
        }
        return result;
    }

    private static boolean isEmptyArchive(byte[] archive) {
        return archive.length >= EMPTY_ARCHIVE_SIGNATURE.length
                && Arrays.equals(Arrays.copyOf(archive, EMPTY_ARCHIVE_SIGNATURE.length), EMPTY_ARCHIVE_SIGNATURE);
    }
}
