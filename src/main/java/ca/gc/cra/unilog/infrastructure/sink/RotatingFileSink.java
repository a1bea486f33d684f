package ca.gc.cra.unilog.infrastructure.sink;

import ca.gc.cra.unilog.application.port.ClockPort;
import ca.gc.cra.unilog.application.port.LogSink;
import ca.gc.cra.unilog.application.port.MetricsPort;
import ca.gc.cra.unilog.config.RotationPolicy;
import ca.gc.cra.unilog.domain.log.LogConfigurationException;
import ca.gc.cra.unilog.util.PathUtils;
import ca.gc.cra.unilog.validation.Paths;
import ca.gc.cra.unilog.validation.Strings;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Append-only log file that rotates to timestamped backups.
 * <p><strong>Role:</strong> File adapter behind {@link LogSink}; one instance per primary or error file.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append lines, tracking the file size from the size found on open.</li>
 *   <li>After a write that pushes the size past {@link RotationPolicy#maxSizeBytes()}, or once
 *   {@link RotationPolicy#rotateInterval()} has elapsed, move the file to
 *   {@code <base>-<yyyyMMdd-HHmmss>-<NNNN><ext>} (UTC) and reopen a fresh file.</li>
 *   <li>Gzip rotated files when {@link RotationPolicy#compress()} is set.</li>
 *   <li>Delete backups beyond {@link RotationPolicy#maxBackups()} or older than
 *   {@link RotationPolicy#maxBackupAge()}.</li>
 *   <li>Keep a rotation failure that follows a successful write out of {@link #append(byte[])}: it is counted
 *   and logged, and the next append reopens the active file if needed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Every public method is {@code synchronized}; no write can land between the
 * close and the reopen of a rotation.</p>
 * <p><strong>Observability:</strong> Metrics {@code sink.rotations}, {@code sink.rotation.failures},
 * {@code sink.bytes.written}.</p>
 *
 * @since 0.1.0
 */
public final class RotatingFileSink implements LogSink {
  private static final Logger log = LoggerFactory.getLogger(RotatingFileSink.class);
  private static final DateTimeFormatter BACKUP_TS =
      DateTimeFormatter.ofPattern("uuuuMMdd-HHmmss").withZone(ZoneOffset.UTC);
  private static final String GZIP_SUFFIX = ".gz";

  private final Path directory;
  private final Path path;
  private final String baseName;
  private final String extension;
  private final Pattern backupPattern;
  private final RotationPolicy policy;
  private final ClockPort clock;
  private final MetricsPort metrics;

  private OutputStream out;
  private long size;
  private Instant openedAt;
  private int sequence;

  /**
   * Opens a sink with the system clock and no metrics.
   *
   * @param directory log directory; created when absent
   * @param fileName active file name
   * @param policy rotation thresholds
   * @throws LogConfigurationException when the directory or file cannot be used
   */
  public RotatingFileSink(Path directory, String fileName, RotationPolicy policy) {
    this(directory, fileName, policy, ClockPort.SYSTEM, MetricsPort.NO_OP);
  }

  /**
   * Opens a sink, appending to {@code directory/fileName} when it already exists.
   *
   * @param directory log directory; created when absent
   * @param fileName active file name
   * @param policy rotation thresholds
   * @param clock source for backup timestamps, interval checks, and backup ages
   * @param metrics metrics adapter; {@code null} means no metrics
   * @throws LogConfigurationException when the directory or file cannot be used
   */
  public RotatingFileSink(
      Path directory, String fileName, RotationPolicy policy, ClockPort clock, MetricsPort metrics) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    try {
      Strings.requireSafeName("fileName", fileName);
      this.directory = Paths.prepareWritableDir(directory);
    } catch (IllegalArgumentException ex) {
      throw new LogConfigurationException("Cannot use log directory " + directory + ": " + ex.getMessage(), ex);
    }
    this.path = this.directory.resolve(fileName);
    this.baseName = PathUtils.baseName(fileName);
    this.extension = PathUtils.extension(fileName);
    this.backupPattern = Pattern.compile(
        Pattern.quote(baseName) + "-\\d{8}-\\d{6}-\\d{4,}" + Pattern.quote(extension) + "(\\.gz)?");
    try {
      open();
    } catch (IOException ex) {
      throw new LogConfigurationException("Cannot open log file " + path, ex);
    }
  }

  @Override
  public synchronized void append(byte[] line) throws IOException {
    Objects.requireNonNull(line, "line");
    if (out == null) {
      open();
    }
    out.write(line);
    size += line.length;
    metrics.observe("sink.bytes.written", line.length);
    if (shouldRotate()) {
      try {
        rotate();
      } catch (IOException ex) {
        log.warn("Rotation of {} failed after a successful write; line kept", path, ex);
      }
    }
  }

  @Override
  public synchronized boolean rotateIfNeeded() throws IOException {
    if (!shouldRotate()) {
      return false;
    }
    rotate();
    return true;
  }

  @Override
  public synchronized void flush() throws IOException {
    if (out != null) {
      out.flush();
    }
  }

  @Override
  public Path path() {
    return path;
  }

  /**
   * Returns the size of the active file as tracked by this sink.
   *
   * @return bytes in the active file
   */
  public synchronized long size() {
    return size;
  }

  /**
   * Lists the rotated backups of this sink, newest first.
   *
   * @return backup paths, compressed ones included
   * @throws IOException if the directory cannot be listed
   */
  public synchronized List<Path> backups() throws IOException {
    try (Stream<Path> stream = Files.list(directory)) {
      return stream
          .filter(p -> PathUtils.fileName(p).map(name -> backupPattern.matcher(name).matches()).orElse(false))
          .sorted(Comparator.comparing((Path p) -> PathUtils.fileName(p).orElse("")).reversed())
          .collect(Collectors.toList());
    }
  }

  /**
   * Closes the active file. A later {@link #append(byte[])} reopens it.
   *
   * @throws IOException if closing fails
   */
  @Override
  public synchronized void close() throws IOException {
    closeStream();
  }

  private boolean shouldRotate() {
    if (policy.maxSizeBytes() > 0 && size > policy.maxSizeBytes()) {
      return true;
    }
    return !policy.rotateInterval().isZero()
        && size > 0
        && !clock.now().isBefore(openedAt.plus(policy.rotateInterval()));
  }

  private void rotate() throws IOException {
    IOException failure = null;
    Path backup = null;
    try {
      closeStream();
      backup = nextBackupPath();
      Files.move(path, backup);
      if (policy.compress()) {
        backup = compress(backup);
      }
      prune();
    } catch (IOException ex) {
      failure = ex;
    }
    try {
      open();
    } catch (IOException ex) {
      if (failure == null) {
        failure = ex;
      } else {
        failure.addSuppressed(ex);
      }
    }
    if (failure != null) {
      metrics.increment("sink.rotation.failures");
      throw failure;
    }
    metrics.increment("sink.rotations");
    log.debug("Rotated {} to {}", path, backup);
  }

  private void open() throws IOException {
    out = Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    size = Files.size(path);
    openedAt = clock.now();
  }

  private void closeStream() throws IOException {
    if (out == null) {
      return;
    }
    try {
      out.flush();
    } finally {
      out.close();
      out = null;
    }
  }

  private Path nextBackupPath() {
    String stamp = BACKUP_TS.format(clock.now());
    while (true) {
      String name = String.format(Locale.ROOT, "%s-%s-%04d%s", baseName, stamp, sequence++, extension);
      Path candidate = directory.resolve(name);
      if (!Files.exists(candidate) && !Files.exists(directory.resolve(name + GZIP_SUFFIX))) {
        return candidate;
      }
    }
  }

  private static Path compress(Path backup) throws IOException {
    Path gz = backup.resolveSibling(backup.getFileName() + GZIP_SUFFIX);
    try (InputStream in = Files.newInputStream(backup);
        OutputStream gzOut = new GZIPOutputStream(Files.newOutputStream(gz, StandardOpenOption.CREATE_NEW))) {
      in.transferTo(gzOut);
    } catch (IOException ex) {
      try {
        Files.deleteIfExists(gz);
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
      }
      throw ex;
    }
    Files.delete(backup);
    return gz;
  }

  private void prune() throws IOException {
    int maxBackups = policy.maxBackups();
    boolean ageLimited = !policy.maxBackupAge().isZero();
    if (maxBackups == 0 && !ageLimited) {
      return;
    }
    Instant cutoff = clock.now().minus(policy.maxBackupAge());
    List<Path> backups = backups();
    for (int i = 0; i < backups.size(); i++) {
      Path backup = backups.get(i);
      boolean overCount = maxBackups > 0 && i >= maxBackups;
      if (overCount || (ageLimited && Files.getLastModifiedTime(backup).toInstant().isBefore(cutoff))) {
        Files.deleteIfExists(backup);
        log.debug("Pruned log backup {}", backup);
      }
    }
  }
}
