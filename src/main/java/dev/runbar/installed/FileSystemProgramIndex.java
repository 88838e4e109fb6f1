package dev.runbar.installed;

import dev.runbar.search.LexicalMatching;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * {@link ProgramIndex} backed by a scan of the configured application directories.
 *
 * <p>Recognises macOS {@code *.app} bundles (name = bundle name without the extension) and
 * freedesktop {@code *.desktop} entries of type {@code Application} (name and description from the
 * {@code Name} and {@code Comment} keys; {@code NoDisplay=true} entries are skipped).
 *
 * <p>The scan is cached. The first scan runs on the refresh executor once the application is
 * ready, or on the first query if that comes earlier. After {@code
 * runbar.installed.refresh-interval} a query still answers from the cached scan and queues one
 * background rescan; queries never wait on a rescan once a scan exists.
 */
@Component
public class FileSystemProgramIndex implements ProgramIndex {

  private static final Logger log = LoggerFactory.getLogger(FileSystemProgramIndex.class);

  private static final String BUNDLE_SUFFIX = ".app";
  private static final String DESKTOP_SUFFIX = ".desktop";
  private static final String DESKTOP_GROUP = "[Desktop Entry]";

  private final InstalledProperties properties;
  private final Clock clock;
  private final Executor refreshExecutor;
  private final Object scanLock = new Object();
  private final AtomicBoolean refreshPending = new AtomicBoolean();
  private volatile @Nullable Snapshot snapshot;

  public FileSystemProgramIndex(
      InstalledProperties properties,
      Clock clock,
      @Qualifier("programIndexRefreshExecutor") Executor refreshExecutor) {
    this.properties = properties;
    this.clock = clock;
    this.refreshExecutor = refreshExecutor;
  }

  @Override
  public List<ProgramRecord> query(String wildcardPattern, int limit) {
    List<ProgramRecord> matches = new ArrayList<>();
    for (ProgramRecord program : programs()) {
      if (matches.size() >= limit) {
        break;
      }
      if (LexicalMatching.matchesWildcard(wildcardPattern, program.name())) {
        matches.add(program);
      }
    }
    return matches;
  }

  /** Queues the first scan so it is ready before the launcher is used. */
  @EventListener(ApplicationReadyEvent.class)
  public void warmUp() {
    scheduleRefresh();
  }

  List<ProgramRecord> programs() {
    Snapshot current = snapshot;
    if (current == null) {
      return initialSnapshot().programs();
    }
    if (current.isStale(clock.instant(), properties)) {
      scheduleRefresh();
    }
    return current.programs();
  }

  private Snapshot initialSnapshot() {
    synchronized (scanLock) {
      Snapshot current = snapshot;
      return current != null ? current : rescan();
    }
  }

  private void scheduleRefresh() {
    if (!refreshPending.compareAndSet(false, true)) {
      return;
    }
    try {
      refreshExecutor.execute(
          () -> {
            try {
              synchronized (scanLock) {
                rescan();
              }
            } finally {
              refreshPending.set(false);
            }
          });
    } catch (RejectedExecutionException e) {
      refreshPending.set(false);
      log.warn("Program index refresh rejected, keeping the previous scan", e);
    }
  }

  // caller holds scanLock
  private Snapshot rescan() {
    Instant startedAt = clock.instant();
    Snapshot fresh = new Snapshot(scan(), startedAt);
    snapshot = fresh;
    log.info(
        "Program index refreshed with {} programs from {} roots",
        fresh.programs().size(),
        properties.getRoots().size());
    return fresh;
  }

  private List<ProgramRecord> scan() {
    List<ProgramRecord> programs = new ArrayList<>();
    for (Path root : properties.getRoots()) {
      if (!Files.isDirectory(root)) {
        log.debug("Skipping missing application root {}", root);
        continue;
      }
      ScanVisitor visitor = new ScanVisitor(programs);
      try {
        Files.walkFileTree(
            root, EnumSet.noneOf(FileVisitOption.class), properties.getMaxDepth(), visitor);
      } catch (IOException e) {
        log.warn("Failed to scan application root {}", root, e);
      }
      if (visitor.unreadable > 0) {
        log.warn("Skipped {} unreadable paths under {}", visitor.unreadable, root);
      }
    }
    return List.copyOf(programs);
  }

  /**
   * Reads a freedesktop launcher entry.
   *
   * @return the program, or null when the entry is hidden, not an application or unreadable
   */
  static @Nullable ProgramRecord readDesktopEntry(Path file) {
    List<String> lines;
    try {
      lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.debug("Cannot read desktop entry {}: {}", file, e.getMessage());
      return null;
    }
    boolean inEntryGroup = false;
    String name = null;
    String comment = null;
    String type = null;
    boolean hidden = false;
    for (String raw : lines) {
      String line = raw.strip();
      if (line.startsWith("[")) {
        inEntryGroup = line.equals(DESKTOP_GROUP);
        continue;
      }
      int eq = line.indexOf('=');
      if (!inEntryGroup || line.startsWith("#") || eq <= 0) {
        continue;
      }
      String key = line.substring(0, eq).strip();
      String value = line.substring(eq + 1).strip();
      switch (key) {
        case "Name" -> name = value;
        case "Comment" -> comment = value;
        case "Type" -> type = value;
        case "NoDisplay", "Hidden" -> hidden |= value.equalsIgnoreCase("true");
        default -> {
          // localized and action keys are not indexed
        }
      }
    }
    if (hidden || name == null || name.isBlank() || (type != null && !type.equals("Application"))) {
      return null;
    }
    return new ProgramRecord(
        name, file.toString(), null, comment == null || comment.isEmpty() ? null : comment);
  }

  private record Snapshot(List<ProgramRecord> programs, Instant scannedAt) {

    boolean isStale(Instant now, InstalledProperties properties) {
      return !now.isBefore(scannedAt.plus(properties.getRefreshInterval()));
    }
  }

  private static final class ScanVisitor extends SimpleFileVisitor<Path> {

    private final List<ProgramRecord> programs;
    private int unreadable;

    ScanVisitor(List<ProgramRecord> programs) {
      this.programs = programs;
    }

    @Override
    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
      String filename = filename(dir);
      if (filename.toLowerCase(Locale.ROOT).endsWith(BUNDLE_SUFFIX)) {
        String name = filename.substring(0, filename.length() - BUNDLE_SUFFIX.length());
        if (!name.isBlank()) {
          programs.add(new ProgramRecord(name, dir.toString(), null, null));
        }
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
      String filename = filename(file);
      if (attrs.isDirectory() && filename.toLowerCase(Locale.ROOT).endsWith(BUNDLE_SUFFIX)) {
        // bundle reached at the depth limit
        String name = filename.substring(0, filename.length() - BUNDLE_SUFFIX.length());
        if (!name.isBlank()) {
          programs.add(new ProgramRecord(name, file.toString(), null, null));
        }
      } else if (attrs.isRegularFile() && filename.endsWith(DESKTOP_SUFFIX)) {
        ProgramRecord program = readDesktopEntry(file);
        if (program != null) {
          programs.add(program);
        }
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFileFailed(Path file, IOException exc) {
      unreadable++;
      log.debug("Cannot visit {}: {}", file, exc.getMessage());
      return FileVisitResult.CONTINUE;
    }

    private static String filename(Path path) {
      Path name = path.getFileName();
      return name == null ? "" : name.toString();
    }
  }
}
