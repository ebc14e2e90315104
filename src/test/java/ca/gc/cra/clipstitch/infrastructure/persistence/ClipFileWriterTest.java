package ca.gc.cra.clipstitch.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.clipstitch.domain.media.Clip;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ClipFileWriterTest {
  @TempDir Path tempDir;

  @Test
  void writesClipsByNameInOrder() throws IOException {
    List<Path> written = new ClipFileWriter(false).writeClips(tempDir, List.of(
        new Clip("clip_01", new byte[] {1, 2}),
        new Clip("clip_02", new byte[] {3})));

    assertEquals(List.of(tempDir.resolve("clip_01.mp4"), tempDir.resolve("clip_02.mp4")), written);
    assertArrayEquals(new byte[] {1, 2}, Files.readAllBytes(written.get(0)));
    assertArrayEquals(new byte[] {3}, Files.readAllBytes(written.get(1)));
  }

  @Test
  void refusesToReplaceExistingFilesUnlessAllowed() throws IOException {
    Path target = tempDir.resolve("joined.mp4");
    Files.write(target, new byte[] {9});

    assertThrows(IOException.class, () -> new ClipFileWriter(false).write(target, new byte[] {1}));
    assertArrayEquals(new byte[] {9}, Files.readAllBytes(target));

    new ClipFileWriter(true).write(target, new byte[] {1});
    assertArrayEquals(new byte[] {1}, Files.readAllBytes(target));
  }

  @Test
  void leavesNoTemporaryFilesBehind() throws IOException {
    new ClipFileWriter(false).write(tempDir.resolve("clip_01.mp4"), new byte[] {4});

    try (Stream<Path> files = Files.list(tempDir)) {
      assertEquals(List.of(tempDir.resolve("clip_01.mp4")), files.toList());
    }
  }
}
