package ca.gc.cra.clipstitch.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.clipstitch.infrastructure.mp4.Mp4Fixtures;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProbeCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsTrackLayout() throws IOException {
    Path input = Files.write(tempDir.resolve("talk.mp4"), Mp4Fixtures.audioVideo(2));

    ExitCode code = ProbeCli.run(new String[] {"in=" + input});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains(" Tracks   : 2"));
    assertTrue(text.contains("#1 VIDEO"));
    assertTrue(text.contains("timescale=90000 samples=60"));
    assertTrue(text.contains("320x240"));
    assertTrue(text.contains("#2 AUDIO"));
  }

  @Test
  void missingInReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, ProbeCli.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: probe"));
  }

  @Test
  void garbageReturnsMediaError() throws IOException {
    Path input = Files.writeString(tempDir.resolve("x.mp4"), "plain text", StandardCharsets.UTF_8);
    assertEquals(ExitCode.MEDIA_ERROR, ProbeCli.run(new String[] {"in=" + input}));
  }
}
