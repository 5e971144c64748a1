package com.notelinker.engine.service.document;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.notelinker.engine.dto.document.ParsedNote;
import com.notelinker.engine.exception.ContentException;

import lombok.extern.slf4j.Slf4j;

/** Reads and rewrites the YAML front matter block at the top of a note. */
@Slf4j
@Component
public class FrontMatterParser {

  public static final String NOTE_ID_KEY = "note_id";
  public static final String TAGS_KEY = "tags";

  private static final Pattern FRONT_MATTER =
      Pattern.compile("\\A---\\r?\\n([\\s\\S]*?)\\r?\\n---(\\r?\\n|\\z)");
  private static final TypeReference<LinkedHashMap<String, Object>> YAML_MAP =
      new TypeReference<>() {};

  private final YAMLMapper yamlMapper;

  public FrontMatterParser() {
    this.yamlMapper =
        new YAMLMapper(
            YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .build());
  }

  public ParsedNote parse(String text) {
    Matcher matcher = FRONT_MATTER.matcher(text);
    if (!matcher.find()) {
      return new ParsedNote(new LinkedHashMap<>(), text, false, false);
    }
    String yaml = matcher.group(1);
    Map<String, Object> values = new LinkedHashMap<>();
    if (!yaml.isBlank()) {
      try {
        LinkedHashMap<String, Object> parsed = yamlMapper.readValue(yaml, YAML_MAP);
        if (parsed != null) {
          values = parsed;
        }
      } catch (JsonProcessingException e) {
        log.warn("Unreadable front matter: {}", e.getOriginalMessage());
        return new ParsedNote(new LinkedHashMap<>(), text.substring(matcher.end()), true, true);
      }
    }
    return new ParsedNote(values, text.substring(matcher.end()), true, false);
  }

  public String render(Map<String, Object> frontMatter, String body) {
    if (frontMatter.isEmpty()) {
      return body;
    }
    try {
      return "---\n" + yamlMapper.writeValueAsString(frontMatter) + "---\n" + body;
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialise front matter", e);
    }
  }

  public String getNoteId(String text) {
    Object id = parse(text).getFrontMatter().get(NOTE_ID_KEY);
    return id == null || id.toString().isBlank() ? null : id.toString();
  }

  /**
   * Returns the text with a {@code note_id} in its front matter, generating a UUID when missing.
   * The returned text is identical to the input when an id already exists.
   */
  public String ensureNoteId(String text) {
    if (getNoteId(text) != null) {
      return text;
    }
    ParsedNote note = parse(text);
    if (note.isMalformed()) {
      throw new ContentException("Front matter is not valid YAML", null, "malformed front matter");
    }
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(NOTE_ID_KEY, UUID.randomUUID().toString());
    values.putAll(note.getFrontMatter());
    return render(values, note.getBody());
  }

  public List<String> getTags(String text) {
    Object tags = parse(text).getFrontMatter().get(TAGS_KEY);
    List<String> result = new ArrayList<>();
    if (tags instanceof Collection) {
      for (Object tag : (Collection<?>) tags) {
        result.add(String.valueOf(tag));
      }
    } else if (tags != null && !tags.toString().isBlank()) {
      for (String tag : tags.toString().split(",")) {
        if (!tag.isBlank()) {
          result.add(tag.trim());
        }
      }
    }
    return result;
  }

  public String withTags(String text, List<String> tags) {
    ParsedNote note = parse(text);
    if (note.isMalformed()) {
      throw new ContentException("Front matter is not valid YAML", null, "malformed front matter");
    }
    Map<String, Object> values = new LinkedHashMap<>(note.getFrontMatter());
    values.put(TAGS_KEY, new ArrayList<>(tags));
    return render(values, note.getBody());
  }
}
