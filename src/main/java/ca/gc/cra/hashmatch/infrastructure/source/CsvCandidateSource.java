package ca.gc.cra.hashmatch.infrastructure.source;

import ca.gc.cra.hashmatch.application.port.CandidateSource;
import java.io.IOException;
import java.io.PushbackReader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads candidates from the first column of a delimited text file.
 * <p><strong>Parsing:</strong> a field may be double-quoted, in which case delimiters and line breaks inside the
 * quotes are literal and {@code ""} is an escaped quote; text following the closing quote is appended to the field.
 * {@code \r\n} and {@code \r} end a record like {@code \n}. Values are trimmed; empty lines and blank first
 * fields are skipped and counted as invalid.</p>
 * <p><strong>Thread-safety:</strong> stateless between {@link #read()} calls.</p>
 *
 * @since 0.1.0
 */
public final class CsvCandidateSource implements CandidateSource {
  private static final Logger log = LoggerFactory.getLogger(CsvCandidateSource.class);
  private static final char QUOTE = '"';
  private static final int EOF = -1;

  private final Path path;
  private final Charset charset;
  private final char delimiter;

  /**
   * Creates a source over {@code path}.
   *
   * @param path input file
   * @param charset file encoding
   * @param delimiter field delimiter; must not be a double quote or line break
   */
  public CsvCandidateSource(Path path, Charset charset, char delimiter) {
    this.path = Objects.requireNonNull(path, "path");
    this.charset = Objects.requireNonNull(charset, "charset");
    if (delimiter == QUOTE || delimiter == '\n' || delimiter == '\r') {
      throw new IllegalArgumentException("delimiter must not be a quote or line break");
    }
    this.delimiter = delimiter;
  }

  /**
   * Reads every record of the file.
   *
   * @return candidates with record statistics
   * @throws IOException if the file is missing, unreadable or not valid in the configured encoding
   */
  @Override
  public CandidateBatch read() throws IOException {
    List<String> candidates = new ArrayList<>();
    long total = 0;
    long invalid = 0;
    try (PushbackReader reader = new PushbackReader(Files.newBufferedReader(path, charset))) {
      String field;
      while ((field = nextFirstField(reader)) != null) {
        total++;
        String value = field.strip();
        if (value.isEmpty()) {
          invalid++;
          log.debug("Empty record {}", total);
          continue;
        }
        candidates.add(value);
      }
    }
    log.debug("Read {} records from {} ({} invalid)", total, path, invalid);
    return new CandidateBatch(candidates, total, candidates.size(), invalid);
  }

  /**
   * Consumes one record and returns its first field, or {@code null} at end of input. A line break inside a
   * quoted field belongs to the field; an unterminated quote runs to end of input.
   */
  String nextFirstField(PushbackReader reader) throws IOException {
    int c = reader.read();
    if (c == EOF) {
      return null;
    }
    StringBuilder first = new StringBuilder();
    int fieldIndex = 0;
    FieldState state = FieldState.START;
    while (c != EOF) {
      if (c == '\r') {
        int next = reader.read();
        if (next != '\n' && next != EOF) {
          reader.unread(next);
        }
        c = '\n';
      }
      if (c == '\n' && state != FieldState.QUOTED) {
        break;
      }
      switch (state) {
        case START, UNQUOTED -> {
          if (c == delimiter) {
            fieldIndex++;
            state = FieldState.START;
          } else if (c == QUOTE && state == FieldState.START) {
            state = FieldState.QUOTED;
          } else {
            append(first, fieldIndex, c);
            state = FieldState.UNQUOTED;
          }
        }
        case QUOTED -> {
          if (c == QUOTE) {
            state = FieldState.QUOTE_IN_QUOTED;
          } else {
            append(first, fieldIndex, c);
          }
        }
        case QUOTE_IN_QUOTED -> {
          if (c == QUOTE) {
            append(first, fieldIndex, c);
            state = FieldState.QUOTED;
          } else if (c == delimiter) {
            fieldIndex++;
            state = FieldState.START;
          } else {
            // text after a closing quote joins the field
            append(first, fieldIndex, c);
            state = FieldState.UNQUOTED;
          }
        }
        default -> throw new IllegalStateException("Unknown field state " + state);
      }
      c = reader.read();
    }
    return first.toString();
  }

  private static void append(StringBuilder first, int fieldIndex, int c) {
    if (fieldIndex == 0) {
      first.append((char) c);
    }
  }

  private enum FieldState {
    START,
    UNQUOTED,
    QUOTED,
    QUOTE_IN_QUOTED
  }

  @Override
  public String toString() {
    return "CsvCandidateSource[" + path + "]";
  }
}
