package org.tapline.fs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

class MemoryFileSystemTest {

    private MemoryFileSystem fs;

    @BeforeEach
    void setUp() {
        fs = new MemoryFileSystem();
    }

    @Test
    @Tag("unit")
    void testWriteFile_RequiresParentDirectory() {
        assertThatThrownBy(() -> fs.writeFile("/out/a.js", bytes("a")))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    @Tag("unit")
    void testMkdirp_CreatesAllParents() throws IOException {
        fs.mkdirp("/out/nested/deep");
        fs.writeFile("/out/nested/deep/a.js", bytes("a"));

        assertThat(fs.isDirectory("/out")).isTrue();
        assertThat(fs.isDirectory("/out/nested")).isTrue();
        assertThat(new String(fs.readFile("/out/nested/deep/a.js"), StandardCharsets.UTF_8)).isEqualTo("a");
        assertThat(fs.listFiles()).containsExactly("/out/nested/deep/a.js");
    }

    @Test
    @Tag("unit")
    void testMkdirp_ExistingFileInTheWay() throws IOException {
        fs.writeFile("/file", bytes("x"));

        assertThatThrownBy(() -> fs.mkdirp("/file/sub")).isInstanceOf(IOException.class);
    }

    @Test
    @Tag("unit")
    void testStat_ModificationTimeAdvancesOnWrite() throws IOException {
        fs.writeFile("/a", bytes("1"));
        long first = fs.stat("/a");
        fs.writeFile("/a", bytes("2"));

        assertThat(fs.stat("/a")).isGreaterThan(first);
        assertThatThrownBy(() -> fs.stat("/missing")).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    @Tag("unit")
    void testJoin_NormalizesSegments() {
        assertThat(fs.join("/out", "js/../css/./a.css")).isEqualTo("/out/css/a.css");
        assertThat(fs.join("/out", "/abs/b")).isEqualTo("/abs/b");
        assertThat(fs.join("/out", "win\\style.css")).isEqualTo("/out/win/style.css");
    }

    @Test
    @Tag("unit")
    void testRelativePathRejected() {
        assertThatThrownBy(() -> fs.exists("relative/path")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void testReadFile_ReturnsCopy() throws IOException {
        fs.writeFile("/a", bytes("abc"));
        byte[] content = fs.readFile("/a");
        content[0] = 'z';

        assertThat(new String(fs.readFile("/a"), StandardCharsets.UTF_8)).isEqualTo("abc");
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
