package ca.gc.cra.netmap.infrastructure.parse;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Loads the sample dumps under {@code /dumps} on the test classpath. */
final class Dumps {
  static final Instant AT = Instant.parse("2024-05-01T12:00:00Z");

  private Dumps() {}

  static Path path(String name) {
    URL url = Dumps.class.getResource("/dumps/" + name);
    if (url == null) {
      throw new IllegalStateException("missing test dump " + name);
    }
    try {
      return Path.of(url.toURI());
    } catch (URISyntaxException ex) {
      throw new IllegalStateException(ex);
    }
  }

  static List<String> lines(String name) {
    try {
      return Files.readAllLines(path(name), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  static DumpInput input(String name, String source) {
    return new DumpInput(name, lines(name), AT, Optional.ofNullable(source));
  }
}
