package com.onthegomap.tilefetch.util;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileUtilsTest {

  @TempDir
  Path tmpDir;

  @Test
  void testSize() throws IOException {
    Path file = tmpDir.resolve("file");
    assertEquals(0, FileUtils.size(file));
    Files.write(file, new byte[]{1, 2, 3});
    assertEquals(3, FileUtils.size(file));
  }

  @Test
  void testDeleteArchiveRemovesJournal() throws IOException {
    Path archive = tmpDir.resolve("out.mbtiles");
    Path journal = tmpDir.resolve("out.mbtiles-journal");
    Files.write(archive, new byte[]{1});
    Files.write(journal, new byte[]{1});
    FileUtils.deleteArchive(archive);
    assertFalse(Files.exists(archive));
    assertFalse(Files.exists(journal));
    // missing files are fine
    FileUtils.deleteArchive(archive);
  }

  @Test
  void testCreateParentDirectories() {
    Path nested = tmpDir.resolve("a").resolve("b").resolve("out.mbtiles");
    FileUtils.createParentDirectories(nested);
    assertTrue(Files.isDirectory(nested.getParent()));
    assertFalse(Files.exists(nested));
  }
}
