package com.notelinker.engine.service.document;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.dto.document.VaultDocument;
import com.notelinker.engine.exception.ContentException;

import lombok.extern.slf4j.Slf4j;

/** {@link DocumentStore} over a directory of Markdown files. */
@Slf4j
@Component
public class FileSystemDocumentStore implements DocumentStore {

  private final FrontMatterParser frontMatterParser;
  private final Path root;

  @Autowired
  public FileSystemDocumentStore(
      ApplicationProperties properties, FrontMatterParser frontMatterParser) {
    this(Paths.get(properties.getVault().getRoot()), frontMatterParser);
  }

  FileSystemDocumentStore(Path root, FrontMatterParser frontMatterParser) {
    this.root = root.toAbsolutePath().normalize();
    this.frontMatterParser = frontMatterParser;
  }

  @Override
  public List<VaultDocument> scan(
      String scanPath, List<String> excludedFolders, List<String> excludedPatterns) {
    Path start = scanPath == null || scanPath.isBlank() ? root : resolve(scanPath);
    if (!Files.isDirectory(start)) {
      log.warn("Scan path {} is not a directory", start);
      return Collections.emptyList();
    }

    List<String> folders = normaliseFolders(excludedFolders);
    List<Pattern> patterns = compilePatterns(excludedPatterns);

    try (Stream<Path> files = Files.walk(start)) {
      List<VaultDocument> documents =
          files
              .filter(Files::isRegularFile)
              .map(this::relativePath)
              .filter(path -> path.toLowerCase().endsWith(".md"))
              .filter(path -> !isHidden(path))
              .filter(path -> !isExcluded(path, folders, patterns))
              .sorted()
              .map(this::toDocument)
              .collect(Collectors.toList());
      log.info("Scanned {} notes under {}", documents.size(), start);
      return documents;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to scan " + start, e);
    }
  }

  @Override
  public Optional<VaultDocument> find(String path) {
    Path file = resolve(path);
    return Files.isRegularFile(file)
        ? Optional.of(toDocument(relativePath(file)))
        : Optional.empty();
  }

  @Override
  public String read(VaultDocument document) {
    try {
      return Files.readString(resolve(document.getPath()), UTF_8);
    } catch (CharacterCodingException e) {
      throw new ContentException(
          "Failed to decode " + document.getPath() + " as UTF-8",
          document.getPath(),
          "not valid UTF-8");
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + document.getPath(), e);
    }
  }

  @Override
  public void write(VaultDocument document, String text) {
    Path target = resolve(document.getPath());
    Path temp = target.resolveSibling(target.getFileName() + ".linker-tmp");
    try {
      Files.writeString(temp, text, UTF_8);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.debug("Wrote {}", document.getPath());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + document.getPath(), e);
    }
  }

  @Override
  public String extractHashableBody(String text) {
    String body = frontMatterParser.parse(text).getBody();
    int marker = body.indexOf(HASH_BOUNDARY);
    return (marker >= 0 ? body.substring(0, marker) : body).trim();
  }

  private Path resolve(String relative) {
    Path resolved = root.resolve(relative).normalize();
    if (!resolved.startsWith(root)) {
      throw new IllegalArgumentException("Path escapes the vault: " + relative);
    }
    return resolved;
  }

  private String relativePath(Path file) {
    return root.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
  }

  private VaultDocument toDocument(String path) {
    Instant modifiedAt = null;
    try {
      modifiedAt = Files.getLastModifiedTime(resolve(path)).toInstant();
    } catch (IOException e) {
      log.debug("No modification time for {}: {}", path, e.getMessage());
    }
    return VaultDocument.builder()
        .path(path)
        .title(VaultDocument.titleOf(path))
        .modifiedAt(modifiedAt)
        .build();
  }

  private static boolean isHidden(String path) {
    for (String segment : path.split("/")) {
      if (segment.startsWith(".")) {
        return true;
      }
    }
    return false;
  }

  private static boolean isExcluded(String path, List<String> folders, List<Pattern> patterns) {
    for (String folder : folders) {
      if (path.startsWith(folder + "/")) {
        return true;
      }
    }
    for (Pattern pattern : patterns) {
      if (pattern.matcher(path).find()) {
        return true;
      }
    }
    return false;
  }

  private static List<String> normaliseFolders(List<String> excludedFolders) {
    List<String> folders = new ArrayList<>();
    if (excludedFolders != null) {
      for (String folder : excludedFolders) {
        String trimmed = folder.trim().replace('\\', '/');
        while (trimmed.endsWith("/")) {
          trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (!trimmed.isEmpty()) {
          folders.add(trimmed);
        }
      }
    }
    return folders;
  }

  /** {@code *} matches any run of characters; everything else is literal. */
  static List<Pattern> compilePatterns(List<String> excludedPatterns) {
    List<Pattern> patterns = new ArrayList<>();
    if (excludedPatterns == null) {
      return patterns;
    }
    for (String glob : excludedPatterns) {
      String trimmed = glob.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      String regex =
          Stream.of(trimmed.split("\\*", -1)).map(Pattern::quote).collect(Collectors.joining(".*"));
      patterns.add(Pattern.compile(regex));
    }
    return patterns;
  }
}
