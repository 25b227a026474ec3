package com.codeheadsystems.warden.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audit store backed by a JSON-lines file, one {@link AuditEntry} per line. The file is only
 * ever appended to, so it can be copied off the machine and re-verified offline.
 * <p>
 * Several stores, in this process or others, may share one file. Each append holds an OS lock on
 * the file and re-reads the tail when another writer has appended since, so the chain stays
 * linear. Lines that no longer decode are returned as incomplete entries rather than failing the
 * read.
 */
public class FileAuditStore implements AuditStore {

  private static final Logger log = LoggerFactory.getLogger(FileAuditStore.class);

  // The OS lock is held per JVM, so stores in this JVM must queue on a shared lock first.
  private static final ConcurrentMap<Path, ReentrantLock> PROCESS_LOCKS = new ConcurrentHashMap<>();

  private final Path path;
  private final ObjectMapper objectMapper;
  private final ReentrantLock lock;
  private AuditEntry last;
  private long knownSize;

  /**
   * Instantiates a new File audit store, creating the file's directory if needed.
   *
   * @param path the log file
   */
  public FileAuditStore(Path path) {
    this(path, new ObjectMapper());
  }

  /**
   * Instantiates a new File audit store.
   *
   * @param path         the log file
   * @param objectMapper the object mapper
   */
  public FileAuditStore(Path path, ObjectMapper objectMapper) {
    this.path = path;
    this.objectMapper = objectMapper;
    this.lock = PROCESS_LOCKS.computeIfAbsent(path.toAbsolutePath().normalize(), p -> new ReentrantLock());
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
    } catch (IOException e) {
      throw new AuditStoreException("Unable to create audit directory for " + path, e);
    }
    int existing = refreshTail();
    log.info("FileAuditStore({}): {} existing entries", path, existing);
  }

  @Override
  public void append(AuditEntry entry) {
    appendNext(previous -> entry);
  }

  @Override
  public synchronized AuditEntry appendNext(Function<Optional<AuditEntry>, AuditEntry> next) {
    lock.lock();
    try (FileChannel channel = FileChannel.open(path,
        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
         FileLock ignored = channel.lock()) {
      if (channel.size() != knownSize) {
        log.debug("appendNext(): {} changed since last read, reloading tail", path);
        refreshTail();
      }
      AuditEntry entry = next.apply(Optional.ofNullable(last));
      ByteBuffer line = ByteBuffer.wrap(
          (objectMapper.writeValueAsString(AuditLine.of(entry)) + "\n").getBytes(StandardCharsets.UTF_8));
      while (line.hasRemaining()) {
        channel.write(line);
      }
      channel.force(true);
      last = entry;
      knownSize = channel.size();
      return entry;
    } catch (IOException e) {
      throw new AuditStoreException("Unable to append to audit log " + path, e);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public synchronized Optional<AuditEntry> last() {
    if (currentSize() != knownSize) {
      refreshTail();
    }
    return Optional.ofNullable(last);
  }

  @Override
  public synchronized List<AuditEntry> entries() {
    if (!Files.exists(path)) {
      return List.of();
    }
    List<AuditEntry> entries = new ArrayList<>();
    try {
      int lineNumber = 0;
      for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        entries.add(decode(line, lineNumber, entries.size()));
      }
    } catch (IOException e) {
      throw new AuditStoreException("Unable to read audit log " + path, e);
    }
    return entries;
  }

  public Path path() {
    return path;
  }

  private AuditEntry decode(String line, int lineNumber, int position) {
    try {
      return objectMapper.readValue(line, AuditLine.class).toEntry();
    } catch (JsonProcessingException e) {
      log.warn("Unreadable audit entry at line {} of {}", lineNumber, path);
      return AuditEntry.unreadable(position);
    }
  }

  private int refreshTail() {
    List<AuditEntry> existing = entries();
    last = existing.isEmpty() ? null : existing.get(existing.size() - 1);
    knownSize = currentSize();
    return existing.size();
  }

  private long currentSize() {
    try {
      return Files.exists(path) ? Files.size(path) : 0L;
    } catch (IOException e) {
      throw new AuditStoreException("Unable to read audit log " + path, e);
    }
  }

  /**
   * On-disk shape of an entry; the timestamp is kept as its ISO-8601 text.
   */
  record AuditLine(long index, String timestamp, String eventType, String subject, String result,
                   String prevHash, String entryHmac) {

    static AuditLine of(AuditEntry entry) {
      return new AuditLine(entry.index(), entry.timestamp().toString(), entry.eventType().name(),
          entry.subject(), entry.result(), entry.prevHash(), entry.entryHmac());
    }

    // Values that do not decode become null, which fails chain verification at this entry.
    AuditEntry toEntry() {
      return new AuditEntry(index, parseTimestamp(timestamp), parseEventType(eventType),
          subject, result, prevHash, entryHmac);
    }

    private static Instant parseTimestamp(String text) {
      if (text == null) {
        return null;
      }
      try {
        return Instant.parse(text);
      } catch (DateTimeParseException e) {
        log.debug("parseTimestamp({}): not an instant", text, e);
        return null;
      }
    }

    private static AuditEventType parseEventType(String name) {
      if (name == null) {
        return null;
      }
      try {
        return AuditEventType.valueOf(name);
      } catch (IllegalArgumentException e) {
        log.debug("parseEventType({}): unknown", name, e);
        return null;
      }
    }
  }
}
