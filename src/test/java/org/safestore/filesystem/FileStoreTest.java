package org.safestore.filesystem;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.safestore.filesystem.dto.CleanupResult;
import org.safestore.filesystem.dto.DeleteResult;
import org.safestore.filesystem.dto.FileInfo;
import org.safestore.filesystem.dto.FileMetadata;
import org.safestore.filesystem.dto.FileVersion;
import org.safestore.filesystem.dto.IndexedFile;
import org.safestore.filesystem.dto.OrganizedFile;
import org.safestore.filesystem.dto.StoreMetrics;
import org.springframework.util.unit.DataSize;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileStoreTest {

    private static final String HELLO_SHA256 = "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824";

    @TempDir
    Path baseDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private FileStoreProperties properties;
    private FileStore store;

    @BeforeEach
    void setUp() {
        properties = new FileStoreProperties();
        properties.setBaseDir(baseDir.toString());
        store = new FileStore(properties, clock);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void constructor_createsStorageLayout() {
        for (String dir : List.of("logs", "temp", "archive", "versions", "metadata")) {
            assertThat(baseDir.resolve(dir)).isDirectory();
        }
    }

    @Test
    void writeThenRead_roundTripsTextAndRecordsChecksum() {
        FileResult<FileMetadata> written = store.writeText("notes/a.txt", "hello");

        assertThat(written.success()).isTrue();
        assertThat(written.value().path()).isEqualTo("notes/a.txt");
        assertThat(written.value().sizeBytes()).isEqualTo(5);
        assertThat(written.value().sha256()).isEqualTo(HELLO_SHA256);

        FileResult<String> read = store.readText("notes/a.txt");
        assertThat(read.success()).isTrue();
        assertThat(read.value()).isEqualTo("hello");
        assertThat(read.hasWarnings()).isFalse();
    }

    @Test
    void writeText_nullContentWritesEmptyFile() throws Exception {
        FileResult<FileMetadata> written = store.writeText("empty.txt", null);

        assertThat(written.success()).isTrue();
        assertThat(Files.size(baseDir.resolve("empty.txt"))).isZero();
    }

    @Test
    void writeText_overwriteWithBackupKeepsPreviousVersion() throws Exception {
        store.writeText("notes/a.txt", "hello");
        store.writeText("notes/a.txt", "world");

        assertThat(store.readText("notes/a.txt").value()).isEqualTo("world");
        FileResult<List<FileVersion>> versions = store.listVersions("notes/a.txt");
        assertThat(versions.success()).isTrue();
        assertThat(versions.value()).hasSize(1);
        assertThat(versions.value().get(0).name()).startsWith("a.txt@");
        assertThat(versions.value().get(0).path()).startsWith("versions/notes/");
        assertThat(Files.readString(baseDir.resolve(versions.value().get(0).path()))).isEqualTo("hello");
    }

    @Test
    void writeText_withoutBackupCreatesNoVersion() {
        store.writeText("a.txt", "one");
        store.writeText("a.txt", "two", false, false);

        assertThat(store.listVersions("a.txt").value()).isEmpty();
    }

    @Test
    void writeText_appendAddsToExistingContent() {
        store.writeText("log.txt", "a");
        FileResult<FileMetadata> appended = store.writeText("log.txt", "b", true, false);

        assertThat(appended.success()).isTrue();
        assertThat(appended.value().sha256()).isEqualTo(ChecksumStore.checksum("ab"));
        assertThat(store.readText("log.txt").value()).isEqualTo("ab");
    }

    @Test
    void writeText_invalidatesCachedContent() {
        store.writeText("a.txt", "v1");
        assertThat(store.readText("a.txt").value()).isEqualTo("v1");

        store.writeText("a.txt", "v2");

        assertThat(store.readText("a.txt").value()).isEqualTo("v2");
    }

    @Test
    void writeText_leavesNoTempFilesBehind() throws Exception {
        store.writeText("docs/a.txt", "hello");

        try (var files = Files.list(baseDir.resolve("docs"))) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("a.txt");
        }
    }

    @Test
    void writeText_ontoDirectoryIsNotAFile() {
        store.createDirectory("docs");

        FileResult<FileMetadata> result = store.writeText("docs", "x");

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(FileErrorKind.NOT_A_FILE);
    }

    @Test
    void writeBinary_overLimitIsRejectedWithoutTouchingDisk() {
        properties.setMaxBinarySize(DataSize.ofKilobytes(1));
        FileStore small = new FileStore(properties, clock);

        FileResult<FileMetadata> result = small.writeBinary("big.bin", new byte[2048]);

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(FileErrorKind.SIZE_EXCEEDED);
        assertThat(baseDir.resolve("big.bin")).doesNotExist();
        small.close();
    }

    @Test
    void writeBinary_defaultLimitIsOneHundredMillionBytes() {
        assertThat(new FileStoreProperties().getMaxBinarySize().toBytes()).isEqualTo(100_000_000L);
    }

    @Test
    void writeBinary_defaultLimitRejectsHundredAndOneMillionBytes() {
        FileResult<FileMetadata> result = store.writeBinary("img.bin", new byte[101_000_000]);

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(FileErrorKind.SIZE_EXCEEDED);
        assertThat(baseDir.resolve("img.bin")).doesNotExist();
    }

    @Test
    void writeBinaryThenReadBinary_returnsSameBytes() {
        byte[] payload = {0, 1, 2, (byte) 0xff};

        assertThat(store.writeBinary("data/blob.bin", payload).success()).isTrue();
        FileResult<byte[]> read = store.readBinary("data/blob.bin");

        assertThat(read.success()).isTrue();
        assertThat(read.value()).containsExactly(payload);
    }

    @Test
    void readText_invalidUtf8IsReplacedNotRejected() {
        store.writeBinary("mixed.txt", new byte[]{(byte) 0xff, 'a'});

        FileResult<String> read = store.readText("mixed.txt");

        assertThat(read.success()).isTrue();
        assertThat(read.value()).isEqualTo("\uFFFDa");
    }

    @Test
    void readText_externalTamperingWarnsButStillReturnsContent() throws Exception {
        store.writeText("a.txt", "hello");
        Files.writeString(baseDir.resolve("a.txt"), "tampered");

        FileResult<String> read = store.readText("a.txt", false);

        assertThat(read.success()).isTrue();
        assertThat(read.value()).isEqualTo("tampered");
        assertThat(read.warnings()).hasSize(1);
        assertThat(store.metricsSnapshot().value().securityEvents()).isEqualTo(1);
    }

    @Test
    void readText_storesChecksumForFilesWrittenOutsideTheStore() throws Exception {
        Files.writeString(baseDir.resolve("external.txt"), "hello");

        assertThat(store.readText("external.txt").success()).isTrue();

        assertThat(store.getFileInfo("external.txt").value().metadata().sha256()).isEqualTo(HELLO_SHA256);
    }

    @Test
    void readText_errorKinds() {
        store.createDirectory("docs");

        assertThat(store.readText("missing.txt").errorKind()).isEqualTo(FileErrorKind.NOT_FOUND);
        assertThat(store.readText("docs").errorKind()).isEqualTo(FileErrorKind.NOT_A_FILE);
        assertThat(store.readText("../outside.txt").errorKind()).isEqualTo(FileErrorKind.ACCESS_DENIED);
    }

    @Test
    void traversal_isDeniedWithoutCreatingFilesOutsideBase() {
        FileResult<FileMetadata> result = store.writeText("../escape.txt", "x");

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(FileErrorKind.ACCESS_DENIED);
        assertThat(baseDir.getParent().resolve("escape.txt")).doesNotExist();
        assertThat(baseDir.resolve("logs/security.log")).exists();
    }

    @ParameterizedTest
    @ValueSource(strings = {"logs", "temp", "archive", "versions", "metadata"})
    void reservedAreas_areNotWritableThroughTheStore(String area) {
        store.writeText("a.txt", "hello");

        assertThat(store.writeText(area + "/x.txt", "x").errorKind()).isEqualTo(FileErrorKind.ACCESS_DENIED);
        assertThat(store.writeBinary(area + "/x.bin", new byte[]{1}).errorKind()).isEqualTo(FileErrorKind.ACCESS_DENIED);
        assertThat(store.copyFile("a.txt", area + "/a.txt").errorKind()).isEqualTo(FileErrorKind.ACCESS_DENIED);
        assertThat(store.moveFile("a.txt", area + "/a.txt").errorKind()).isEqualTo(FileErrorKind.ACCESS_DENIED);
        assertThat(store.createDirectory(area + "/sub").errorKind()).isEqualTo(FileErrorKind.ACCESS_DENIED);
        assertThat(baseDir.resolve(area + "/x.txt")).doesNotExist();
        assertThat(baseDir.resolve(area + "/a.txt")).doesNotExist();
        assertThat(baseDir.resolve("a.txt")).exists();
    }

    @Test
    void securityLog_cannotBeOverwrittenOrDeleted() throws Exception {
        store.readText("../outside.txt");
        Path securityLog = baseDir.resolve("logs/security.log");
        long sizeBefore = Files.size(securityLog);

        assertThat(store.writeText("logs/security.log", "").errorKind()).isEqualTo(FileErrorKind.ACCESS_DENIED);
        assertThat(store.deleteFile("logs/security.log", false).errorKind()).isEqualTo(FileErrorKind.ACCESS_DENIED);
        assertThat(store.readText("logs/security.log").errorKind()).isEqualTo(FileErrorKind.ACCESS_DENIED);

        assertThat(Files.size(securityLog)).isGreaterThan(sizeBefore);
        assertThat(store.metricsSnapshot().value().securityEvents()).isEqualTo(4);
    }

    @Test
    void versionSnapshots_cannotBeDeletedThroughTheStore() {
        store.writeText("notes/a.txt", "v1");
        store.writeText("notes/a.txt", "v2");
        String versionPath = store.listVersions("notes/a.txt").value().get(0).path();

        FileResult<DeleteResult> deleted = store.deleteFile(versionPath, false);

        assertThat(deleted.errorKind()).isEqualTo(FileErrorKind.ACCESS_DENIED);
        assertThat(store.listVersions("notes/a.txt").value()).hasSize(1);
    }

    @Test
    void listDirectory_rootHidesReservedAreas() {
        store.writeText("notes/a.txt", "a");

        FileResult<List<FileMetadata>> result = store.listDirectory("", true, null);

        assertThat(result.value()).extracting(FileMetadata::name).containsExactly("notes");
    }

    @Test
    void listDirectory_filtersByPatternAndPutsFilesFirst() {
        store.writeText("reports/2024-report.txt", "r");
        store.writeText("reports/2024-data.csv", "d");
        store.writeText("reports/notes.txt", "n");
        store.createDirectory("reports/2024-archive");

        FileResult<List<FileMetadata>> result = store.listDirectory("reports", true, "^2024");

        assertThat(result.success()).isTrue();
        assertThat(result.value()).extracting(FileMetadata::name)
                .containsExactly("2024-data.csv", "2024-report.txt", "2024-archive");
        assertThat(result.value().get(2).directory()).isTrue();
    }

    @Test
    void listDirectory_skipsHiddenEntriesButKeepsWhitelisted() throws Exception {
        store.createDirectory("docs");
        Files.writeString(baseDir.resolve("docs/.secret"), "s");
        Files.writeString(baseDir.resolve("docs/.gitkeep"), "");
        store.writeText("docs/a.txt", "a");
        store.createDirectory("docs/sub");

        FileResult<List<FileMetadata>> result = store.listDirectory("docs", false, null);

        assertThat(result.value()).extracting(FileMetadata::name).containsExactly(".gitkeep", "a.txt");
    }

    @Test
    void listDirectory_errorKinds() {
        store.writeText("a.txt", "a");

        assertThat(store.listDirectory("missing", true, null).errorKind()).isEqualTo(FileErrorKind.NOT_FOUND);
        assertThat(store.listDirectory("a.txt", true, null).errorKind()).isEqualTo(FileErrorKind.NOT_A_DIRECTORY);
        assertThat(store.listDirectory("", true, "[unclosed").errorKind()).isEqualTo(FileErrorKind.INVALID_ARGUMENT);
    }

    @Test
    void createDirectory_isIdempotent() {
        FileResult<FileMetadata> first = store.createDirectory("a/b/c");
        FileResult<FileMetadata> second = store.createDirectory("a/b/c");

        assertThat(first.success()).isTrue();
        assertThat(second.success()).isTrue();
        assertThat(second.value().directory()).isTrue();
        assertThat(baseDir.resolve("a/b/c")).isDirectory();
    }

    @Test
    void createDirectory_rejectsExistingFileAndBadPermissions() {
        store.writeText("a.txt", "a");

        assertThat(store.createDirectory("a.txt").errorKind()).isEqualTo(FileErrorKind.NOT_A_DIRECTORY);
        assertThat(store.createDirectory("dir", "rwx").errorKind()).isEqualTo(FileErrorKind.INVALID_ARGUMENT);
    }

    @Test
    void deleteFile_archiveKeepsRecoverableCopy() throws Exception {
        store.writeText("docs/a.txt", "hello");

        FileResult<DeleteResult> deleted = store.deleteFile("docs/a.txt");

        assertThat(deleted.success()).isTrue();
        assertThat(deleted.value().archived()).isTrue();
        assertThat(deleted.value().archivePath()).isEqualTo("archive/docs/a.txt@20260101T000000");
        assertThat(baseDir.resolve("docs/a.txt")).doesNotExist();
        assertThat(Files.readString(baseDir.resolve(deleted.value().archivePath()))).isEqualTo("hello");
        assertThat(store.readText("docs/a.txt").errorKind()).isEqualTo(FileErrorKind.NOT_FOUND);
    }

    @Test
    void deleteFile_permanentRemovesFileAndChecksum() {
        store.writeText("a.txt", "hello");

        FileResult<DeleteResult> deleted = store.deleteFile("a.txt", false);

        assertThat(deleted.success()).isTrue();
        assertThat(deleted.value().archived()).isFalse();
        assertThat(deleted.value().archivePath()).isNull();
        assertThat(baseDir.resolve("a.txt")).doesNotExist();
        assertThat(store.metricsSnapshot().value().checksumEntries()).isZero();
    }

    @Test
    void deleteFile_missingIsNotFound() {
        assertThat(store.deleteFile("missing.txt").errorKind()).isEqualTo(FileErrorKind.NOT_FOUND);
    }

    @Test
    void moveFile_carriesChecksumAndCreatesParents() {
        store.writeText("a.txt", "hello");

        FileResult<FileMetadata> moved = store.moveFile("a.txt", "deep/nested/b.txt");

        assertThat(moved.success()).isTrue();
        assertThat(moved.value().path()).isEqualTo("deep/nested/b.txt");
        assertThat(moved.value().sha256()).isEqualTo(HELLO_SHA256);
        assertThat(baseDir.resolve("a.txt")).doesNotExist();
        assertThat(store.readText("deep/nested/b.txt").value()).isEqualTo("hello");
        assertThat(store.readText("a.txt").errorKind()).isEqualTo(FileErrorKind.NOT_FOUND);
    }

    @Test
    void moveFile_overExistingDestinationSnapshotsItFirst() throws Exception {
        store.writeText("a.txt", "new");
        store.writeText("b.txt", "old");

        assertThat(store.moveFile("a.txt", "b.txt").success()).isTrue();

        List<FileVersion> versions = store.listVersions("b.txt").value();
        assertThat(versions).hasSize(1);
        assertThat(Files.readString(baseDir.resolve(versions.get(0).path()))).isEqualTo("old");
        assertThat(store.readText("b.txt").value()).isEqualTo("new");
    }

    @Test
    void copyFile_duplicatesContentAndChecksum() {
        store.writeText("a.txt", "hello");

        FileResult<FileMetadata> copied = store.copyFile("a.txt", "copies/a.txt");

        assertThat(copied.success()).isTrue();
        assertThat(copied.value().sha256()).isEqualTo(HELLO_SHA256);
        assertThat(store.readText("a.txt").value()).isEqualTo("hello");
        assertThat(store.readText("copies/a.txt").value()).isEqualTo("hello");
    }

    @Test
    void transfer_rejectsSamePathDirectoryTargetAndEscapes() {
        store.writeText("a.txt", "hello");
        store.createDirectory("dir");

        assertThat(store.moveFile("a.txt", "a.txt").errorKind()).isEqualTo(FileErrorKind.INVALID_ARGUMENT);
        assertThat(store.copyFile("a.txt", "dir").errorKind()).isEqualTo(FileErrorKind.NOT_A_FILE);
        assertThat(store.moveFile("a.txt", "../a.txt").errorKind()).isEqualTo(FileErrorKind.ACCESS_DENIED);
        assertThat(store.moveFile("missing.txt", "b.txt").errorKind()).isEqualTo(FileErrorKind.NOT_FOUND);
        assertThat(baseDir.resolve("a.txt")).exists();
    }

    @Test
    void getFileInfo_reportsAccessAndCacheState() {
        store.writeText("a.txt", "hello");
        store.readText("a.txt");
        clock.advance(Duration.ofSeconds(30));
        store.readText("a.txt");

        FileInfo info = store.getFileInfo("a.txt").value();

        assertThat(info.metadata().sizeBytes()).isEqualTo(5);
        assertThat(info.metadata().mimeType()).isEqualTo("text/plain");
        assertThat(info.humanSize()).isEqualTo("5 B");
        assertThat(info.cached()).isTrue();
        assertThat(info.accessCount()).isEqualTo(2);
        assertThat(info.lastAccessedAt()).isEqualTo(Instant.parse("2026-01-01T00:00:30Z"));
    }

    @Test
    void moveFile_overwriteResetsDestinationAccessHistory() {
        store.writeText("a.txt", "new");
        store.writeText("b.txt", "old");
        store.readText("b.txt");
        store.readText("b.txt");

        store.moveFile("a.txt", "b.txt");

        FileInfo info = store.getFileInfo("b.txt").value();
        assertThat(info.accessCount()).isZero();
        assertThat(info.lastAccessedAt()).isNull();
        assertThat(info.cached()).isFalse();
    }

    @Test
    void writeText_overwriteKeepsPosixPermissions() throws Exception {
        assumeTrue(baseDir.getFileSystem().supportedFileAttributeViews().contains("posix"));
        store.writeText("shared.txt", "v1");
        Path file = baseDir.resolve("shared.txt");
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-rw-r--"));

        FileResult<FileMetadata> written = store.writeText("shared.txt", "v2");

        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(file))).isEqualTo("rw-rw-r--");
        assertThat(written.value().permissions()).isEqualTo("rw-rw-r--");
    }

    @Test
    void getFileInfo_cacheEntryExpiresAfterTtl() {
        store.writeText("a.txt", "hello");
        store.readText("a.txt");

        clock.advance(Duration.ofMinutes(6));

        assertThat(store.getFileInfo("a.txt").value().cached()).isFalse();
    }

    @Test
    void getFileInfo_missingIsNotFound() {
        assertThat(store.getFileInfo("missing").errorKind()).isEqualTo(FileErrorKind.NOT_FOUND);
    }

    @Test
    void searchFiles_matchesNameCaseInsensitivelyAndSkipsHidden() throws Exception {
        store.writeText("docs/report.txt", "1");
        store.writeText("docs/Report-2.md", "2");
        store.writeText("docs/other.txt", "3");
        Files.createDirectories(baseDir.resolve("docs/.cache"));
        Files.writeString(baseDir.resolve("docs/.cache/report.txt"), "hidden");
        Files.writeString(baseDir.resolve("docs/.report.txt"), "hidden");

        FileResult<List<FileMetadata>> all = store.searchFiles("REPORT", "docs", null);
        FileResult<List<FileMetadata>> txtOnly = store.searchFiles("report", "docs", List.of(".TXT"));

        assertThat(all.value()).extracting(FileMetadata::path)
                .containsExactly("docs/Report-2.md", "docs/report.txt");
        assertThat(txtOnly.value()).extracting(FileMetadata::path).containsExactly("docs/report.txt");
    }

    @Test
    void searchFiles_fromRootSkipsArchivedAndVersionedCopies() {
        store.writeText("notes/a.txt", "v1");
        store.writeText("notes/a.txt", "v2");
        store.writeText("notes/b.txt", "b");
        store.deleteFile("notes/b.txt");

        FileResult<List<FileMetadata>> result = store.searchFiles(".txt", "", null);

        assertThat(result.value()).extracting(FileMetadata::path).containsExactly("notes/a.txt");
    }

    @Test
    void searchFiles_errorKinds() {
        assertThat(store.searchFiles(null, "", null).errorKind()).isEqualTo(FileErrorKind.INVALID_ARGUMENT);
        assertThat(store.searchFiles("x", "missing", null).errorKind()).isEqualTo(FileErrorKind.NOT_FOUND);
        assertThat(store.searchFiles("x", "../", null).errorKind()).isEqualTo(FileErrorKind.ACCESS_DENIED);
    }

    @Test
    void organizeFile_placesFileByExtensionCategory() {
        FileResult<OrganizedFile> code = store.organizeFile("script.py", "print(1)");
        FileResult<OrganizedFile> data = store.organizeFile("uploads/table.CSV", "a,b");
        FileResult<OrganizedFile> other = store.organizeFile("README", "readme");

        assertThat(code.value().category()).isEqualTo("code");
        assertThat(code.value().path()).isEqualTo("code/script.py");
        assertThat(code.value().sha256()).isEqualTo(ChecksumStore.checksum("print(1)"));
        assertThat(data.value().path()).isEqualTo("data/table.CSV");
        assertThat(other.value().category()).isEqualTo("other");
        assertThat(store.readText("other/README").value()).isEqualTo("readme");
    }

    @Test
    void organizeFile_indexesPathAndContentSnippet() {
        store.organizeFile("meeting.md", "Quarterly budget review");
        store.organizeFile("script.py", "print('hello')");

        FileResult<List<IndexedFile>> byContent = store.searchIndex("BUDGET");
        FileResult<List<IndexedFile>> byPath = store.searchIndex("code/");

        assertThat(byContent.value()).extracting(IndexedFile::path).containsExactly("documentation/meeting.md");
        assertThat(byContent.value().get(0).originalName()).isEqualTo("meeting.md");
        assertThat(byContent.value().get(0).uploadedAt()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
        assertThat(byPath.value()).extracting(IndexedFile::path).containsExactly("code/script.py");
        assertThat(store.metricsSnapshot().value().indexEntries()).isEqualTo(2);
    }

    @Test
    void organizeFile_fullIndexStillStoresFileWithWarning() {
        properties.setIndexMaxEntries(1);
        FileStore small = new FileStore(properties, clock);
        try {
            FileResult<OrganizedFile> first = small.organizeFile("a.txt", "a");
            FileResult<OrganizedFile> second = small.organizeFile("b.txt", "b");

            assertThat(first.value().indexed()).isTrue();
            assertThat(second.success()).isTrue();
            assertThat(second.value().indexed()).isFalse();
            assertThat(second.warnings()).hasSize(1);
            assertThat(small.readText("documentation/b.txt").value()).isEqualTo("b");
            assertThat(small.searchIndex("b.txt").value()).isEmpty();
        } finally {
            small.close();
        }
    }

    @Test
    void searchIndex_followsDeleteAndMove() {
        store.organizeFile("notes.txt", "alpha");
        store.organizeFile("todo.txt", "beta");

        store.moveFile("documentation/notes.txt", "archive-old/notes.txt");
        store.deleteFile("documentation/todo.txt");

        assertThat(store.searchIndex("alpha").value()).extracting(IndexedFile::path)
                .containsExactly("archive-old/notes.txt");
        assertThat(store.searchIndex("beta").value()).isEmpty();
        assertThat(store.searchIndex(" ").errorKind()).isEqualTo(FileErrorKind.INVALID_ARGUMENT);
        assertThat(store.searchIndex("alpha", 0).errorKind()).isEqualTo(FileErrorKind.INVALID_ARGUMENT);
    }

    @Test
    void organizeFile_blankNameIsInvalid() {
        assertThat(store.organizeFile("  ", "x").errorKind()).isEqualTo(FileErrorKind.INVALID_ARGUMENT);
    }

    @Test
    void cleanupArchive_removesEntriesOlderThanRetention() {
        store.writeText("a.txt", "hello");
        store.deleteFile("a.txt");

        assertThat(store.cleanupArchive().value().removedFiles()).isZero();

        clock.advance(Duration.ofDays(31));
        FileResult<CleanupResult> cleaned = store.cleanupArchive();

        assertThat(cleaned.success()).isTrue();
        assertThat(cleaned.value().area()).isEqualTo("archive");
        assertThat(cleaned.value().removedFiles()).isEqualTo(1);
        assertThat(cleaned.value().freedBytes()).isEqualTo(5);
    }

    @Test
    void cleanupVersions_removesSnapshotsOlderThanRetention() {
        store.writeText("a.txt", "v1");
        store.writeText("a.txt", "v2");
        clock.advance(Duration.ofDays(31));

        FileResult<CleanupResult> cleaned = store.cleanupVersions();

        assertThat(cleaned.value().removedFiles()).isEqualTo(1);
        assertThat(store.listVersions("a.txt").value()).isEmpty();
    }

    @Test
    void cleanup_negativeRetentionIsInvalid() {
        assertThat(store.cleanupArchive(Duration.ofDays(-1)).errorKind()).isEqualTo(FileErrorKind.INVALID_ARGUMENT);
        assertThat(store.cleanupVersions(null).errorKind()).isEqualTo(FileErrorKind.INVALID_ARGUMENT);
    }

    @Test
    void cleanupTempFiles_removesOnlyStaleWriteLeftovers() throws Exception {
        store.createDirectory("docs");
        Path stale = baseDir.resolve("docs/" + AtomicFiles.TEMP_PREFIX + "1" + AtomicFiles.TEMP_SUFFIX);
        Path fresh = baseDir.resolve("docs/" + AtomicFiles.TEMP_PREFIX + "2" + AtomicFiles.TEMP_SUFFIX);
        Path unrelated = baseDir.resolve("docs/notes.tmp");
        for (Path p : List.of(stale, fresh, unrelated)) {
            Files.writeString(p, "x");
        }
        Files.setLastModifiedTime(stale, FileTime.from(clock.instant().minus(Duration.ofHours(2))));
        Files.setLastModifiedTime(fresh, FileTime.from(clock.instant()));
        Files.setLastModifiedTime(unrelated, FileTime.from(clock.instant().minus(Duration.ofHours(2))));

        FileResult<CleanupResult> cleaned = store.cleanupTempFiles();

        assertThat(cleaned.value().removedFiles()).isEqualTo(1);
        assertThat(stale).doesNotExist();
        assertThat(fresh).exists();
        assertThat(unrelated).exists();
    }

    @Test
    void metricsSnapshot_countsOperationsAndErrors() {
        store.writeText("a.txt", "hello");
        store.readText("a.txt");
        store.readText("a.txt");
        store.readText("missing.txt");

        StoreMetrics metrics = store.metricsSnapshot().value();

        assertThat(metrics.operations().get("write").count()).isEqualTo(1);
        assertThat(metrics.operations().get("read").count()).isEqualTo(3);
        assertThat(metrics.operations().get("read").errors()).isEqualTo(1);
        assertThat(metrics.cacheSize()).isEqualTo(1);
        assertThat(metrics.cacheCapacity()).isEqualTo(100);
        assertThat(metrics.cacheHits()).isEqualTo(1);
        assertThat(metrics.checksumEntries()).isEqualTo(1);
    }

    @Test
    void close_persistsChecksumsForNextInstance() throws Exception {
        store.writeText("a.txt", "hello");

        store.close();
        store.close();

        assertThat(baseDir.resolve("metadata/checksums.json")).exists();
        Files.writeString(baseDir.resolve("a.txt"), "tampered");
        FileStore reopened = new FileStore(properties, clock);
        try {
            FileResult<String> read = reopened.readText("a.txt");
            assertThat(read.success()).isTrue();
            assertThat(read.hasWarnings()).isTrue();
        } finally {
            reopened.close();
        }
    }

    @Test
    void flush_writesChecksumTableImmediately() throws Exception {
        store.writeText("a.txt", "hello");

        FileResult<Integer> flushed = store.flush();

        assertThat(flushed.value()).isEqualTo(1);
        assertThat(Files.readString(baseDir.resolve("metadata/checksums.json"), StandardCharsets.UTF_8))
                .contains(HELLO_SHA256);
    }
}
