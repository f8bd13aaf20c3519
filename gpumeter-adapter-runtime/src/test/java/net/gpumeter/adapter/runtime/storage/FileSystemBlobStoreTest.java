package net.gpumeter.adapter.runtime.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemBlobStoreTest {

    @TempDir
    Path root;

    private FileSystemBlobStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemBlobStore(root);
    }

    @Test
    void blobs_live_under_jobs_directory() throws Exception {
        store.write("j1", "input/train.py", bytes("print(1)"));

        assertThat(root.resolve("jobs/j1/input/train.py")).hasContent("print(1)");
        assertThat(store.read("j1", "input/train.py")).isEqualTo(bytes("print(1)"));
    }

    @Test
    void write_replaces_existing_content() throws Exception {
        store.write("j1", "logs/output.log", bytes("first"));
        store.write("j1", "logs/output.log", bytes("second"));

        assertThat(new String(store.read("j1", "logs/output.log"), StandardCharsets.UTF_8)).isEqualTo("second");
        assertThat(store.list("j1", "logs")).containsExactly("logs/output.log");
    }

    @Test
    void list_filters_by_prefix() throws Exception {
        store.write("j1", "input/a.py", bytes("a"));
        store.write("j1", "output/model/weights.bin", bytes("w"));
        store.write("j1", "output/metrics.json", bytes("{}"));

        assertThat(store.list("j1", "output")).containsExactly("output/metrics.json", "output/model/weights.bin");
        assertThat(store.list("j1", "")).hasSize(3);
        assertThat(store.list("j2", "output")).isEmpty();
    }

    @Test
    void mount_directories_are_created_on_demand() throws Exception {
        Path in = store.inputDir("j1");
        Path out = store.outputDir("j1");

        assertThat(in).isDirectory().endsWith(Path.of("j1", "input"));
        assertThat(out).isDirectory().endsWith(Path.of("j1", "output"));
    }

    @Test
    void paths_outside_the_job_directory_are_rejected() {
        assertThatThrownBy(() -> store.write("j1", "../j2/input/x", bytes("x")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.write("j1", "/etc/passwd", bytes("x")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.read("../etc", "passwd"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(Files.exists(root.resolve("jobs/j2"))).isFalse();
    }

    @Test
    void reading_a_missing_blob_fails() {
        assertThatThrownBy(() -> store.read("j1", "output/none.bin")).isInstanceOf(NoSuchFileException.class);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
