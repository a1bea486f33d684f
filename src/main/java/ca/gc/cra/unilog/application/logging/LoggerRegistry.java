package ca.gc.cra.unilog.application.logging;

import ca.gc.cra.unilog.application.port.StructuredLoggerFactory;
import ca.gc.cra.unilog.application.util.OnceCell;
import ca.gc.cra.unilog.config.LoggerConfig;
import ca.gc.cra.unilog.domain.log.ErrorMirrorNames;
import ca.gc.cra.unilog.domain.log.LogConfigurationException;
import ca.gc.cra.unilog.domain.log.LoggerNotInitializedException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Name-to-logger registry with a distinguished default slot.
 * <p><strong>Role:</strong> Entry point callers use to obtain a {@link StructuredLogger}; construction is delegated
 * to a {@link StructuredLoggerFactory}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Construct each named logger at most once; later initializations return the first instance.</li>
 *   <li>Keep every file path owned by a single logger.</li>
 *   <li>Resolve lookups to the named logger, then the default, then fail with
 *   {@link LoggerNotInitializedException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All methods are safe for concurrent use. Racing first initializations of one
 * name share a single construction attempt and observe its result or its exception.</p>
 *
 * @since 0.1.0
 */
public final class LoggerRegistry implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LoggerRegistry.class);
  private static final String DEFAULT_OWNER = "<default>";

  private final StructuredLoggerFactory factory;
  private final ConcurrentHashMap<String, OnceCell<StructuredLogger>> named = new ConcurrentHashMap<>();
  private final OnceCell<StructuredLogger> defaultLogger = new OnceCell<>();
  private final Map<Path, String> claimedPaths = new ConcurrentHashMap<>();

  /**
   * Creates an empty registry.
   *
   * @param factory builds loggers from their configuration
   */
  public LoggerRegistry(StructuredLoggerFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Initializes (once) the logger {@code name} writing {@code <name>.log} under {@code directory}.
   *
   * @param name logger name
   * @param level level text; unrecognized values fall back to {@code info}
   * @param directory log directory
   * @return the registered logger; the first instance when already initialized, without checking the arguments
   * @throws LogConfigurationException when construction fails
   * @throws IllegalArgumentException when {@code name} is blank or unsafe as a file name
   */
  public StructuredLogger initializeNamed(String name, String level, Path directory) {
    if (name != null) {
      OnceCell<StructuredLogger> existing = named.get(name);
      if (existing != null) {
        Optional<StructuredLogger> logger = existing.get();
        if (logger.isPresent()) {
          return logger.get();
        }
      }
    }
    return initializeNamed(LoggerConfig.named(name, level, directory));
  }

  /**
   * Initializes (once) the named logger described by {@code config}.
   *
   * @param config configuration; must carry a name
   * @return the registered logger; the first instance when already initialized, whatever {@code config} says
   * @throws LogConfigurationException when construction fails; the name stays uninitialized
   */
  public StructuredLogger initializeNamed(LoggerConfig config) {
    Objects.requireNonNull(config, "config");
    if (!config.isNamed()) {
      throw new IllegalArgumentException("initializeNamed requires a named configuration");
    }
    OnceCell<StructuredLogger> cell = named.computeIfAbsent(config.name(), key -> new OnceCell<>());
    return cell.getOrInit(() -> construct(config.name(), config));
  }

  /**
   * Initializes (once) the anonymous default logger writing {@value LoggerConfig#DEFAULT_FILE_NAME}.
   *
   * @param level level text; unrecognized values fall back to {@code info}
   * @param directory log directory
   * @return the default logger
   * @throws LogConfigurationException when construction fails
   */
  public StructuredLogger initializeDefault(String level, Path directory) {
    return initializeDefault(LoggerConfig.anonymous(level, directory));
  }

  /**
   * Initializes (once) the default logger.
   *
   * @param config configuration; a name, when present, is written to every line
   * @return the default logger; the first instance when already initialized
   * @throws LogConfigurationException when construction fails; the slot stays empty
   */
  public StructuredLogger initializeDefault(LoggerConfig config) {
    Objects.requireNonNull(config, "config");
    return defaultLogger.getOrInit(() -> construct(DEFAULT_OWNER, config));
  }

  /**
   * Returns the named logger, falling back to the default logger.
   *
   * @param name logger name
   * @return logger
   * @throws LoggerNotInitializedException when neither exists
   */
  public StructuredLogger lookup(String name) {
    return find(name).orElseThrow(() -> new LoggerNotInitializedException(name));
  }

  /**
   * Returns the named logger, falling back to the default logger, without throwing.
   *
   * @param name logger name; {@code null} resolves to the default logger
   * @return logger, or empty when neither exists
   */
  public Optional<StructuredLogger> find(String name) {
    if (name != null) {
      OnceCell<StructuredLogger> cell = named.get(name);
      if (cell != null) {
        Optional<StructuredLogger> logger = cell.get();
        if (logger.isPresent()) {
          return logger;
        }
      }
    }
    return defaultLogger.get();
  }

  /**
   * Returns the named logger, the default logger, or {@link StructuredLogger#noOp()}.
   *
   * @param name logger name
   * @return logger; never {@code null}
   */
  public StructuredLogger lookupOrNoOp(String name) {
    return find(name).orElseGet(StructuredLogger::noOp);
  }

  /**
   * Returns the names of successfully initialized loggers.
   *
   * @return sorted snapshot of names
   */
  public Set<String> names() {
    Set<String> result = new TreeSet<>();
    named.forEach((name, cell) -> {
      if (cell.isInitialized()) {
        result.add(name);
      }
    });
    return Collections.unmodifiableSet(result);
  }

  /**
   * Returns whether the default logger is initialized.
   *
   * @return {@code true} once {@link #initializeDefault(LoggerConfig)} succeeded
   */
  public boolean hasDefault() {
    return defaultLogger.isInitialized();
  }

  /**
   * Closes every constructed logger. Loggers stay registered; their sinks reopen on the next write.
   *
   * @throws IOException the first close failure; later loggers are still closed
   */
  @Override
  public void close() throws IOException {
    List<StructuredLogger> loggers = new ArrayList<>();
    named.values().forEach(cell -> cell.get().ifPresent(loggers::add));
    defaultLogger.get().ifPresent(loggers::add);
    IOException failure = null;
    for (StructuredLogger logger : loggers) {
      try {
        logger.close();
      } catch (IOException ex) {
        log.warn("Failed to close logger {}", logger.name().orElse(DEFAULT_OWNER), ex);
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  private StructuredLogger construct(String owner, LoggerConfig config) {
    List<Path> claims = claim(owner, config);
    try {
      StructuredLogger logger = factory.create(config);
      log.debug("Initialized logger {} at {} (level {})", owner, config.primaryPath(), config.minimumLevel());
      return logger;
    } catch (RuntimeException ex) {
      claims.forEach(path -> claimedPaths.remove(path, owner));
      throw ex;
    }
  }

  private List<Path> claim(String owner, LoggerConfig config) {
    List<Path> paths = new ArrayList<>();
    paths.add(config.primaryPath());
    if (config.errorSplit()) {
      paths.add(config.directory().resolve(ErrorMirrorNames.deriveErrorFileName(config.fileName())));
    }
    List<Path> claimed = new ArrayList<>();
    for (Path path : paths) {
      String holder = claimedPaths.putIfAbsent(path, owner);
      if (holder != null && !holder.equals(owner)) {
        claimed.forEach(done -> claimedPaths.remove(done, owner));
        throw new LogConfigurationException(
            "Log file " + path + " for logger " + owner + " is already used by logger " + holder);
      }
      claimed.add(path);
    }
    return claimed;
  }
}
