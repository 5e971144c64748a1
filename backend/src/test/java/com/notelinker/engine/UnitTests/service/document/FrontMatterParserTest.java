package com.notelinker.engine.service.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.notelinker.engine.dto.document.ParsedNote;
import com.notelinker.engine.exception.ContentException;

@DisplayName("FrontMatterParser Tests")
class FrontMatterParserTest {

  private final FrontMatterParser parser = new FrontMatterParser();

  @Nested
  @DisplayName("Parsing")
  class Parsing {

    @Test
    @DisplayName("Should split front matter from the body")
    void shouldParseFrontMatter() {
      ParsedNote note = parser.parse("---\nnote_id: abc\ntitle: Hello\n---\n# Body\n");

      assertThat(note.isHasFrontMatter()).isTrue();
      assertThat(note.isMalformed()).isFalse();
      assertThat(note.getFrontMatter()).containsEntry("note_id", "abc");
      assertThat(note.getBody()).isEqualTo("# Body\n");
    }

    @Test
    @DisplayName("Should treat text without a leading fence as all body")
    void shouldHandleMissingFrontMatter() {
      ParsedNote note = parser.parse("# Title\n---\nnot: yaml\n---\n");

      assertThat(note.isHasFrontMatter()).isFalse();
      assertThat(note.getFrontMatter()).isEmpty();
      assertThat(note.getBody()).startsWith("# Title");
    }

    @Test
    @DisplayName("Should accept Windows line endings")
    void shouldHandleCrLf() {
      assertThat(parser.getNoteId("---\r\nnote_id: win\r\n---\r\nBody")).isEqualTo("win");
    }

    @Test
    @DisplayName("Should flag invalid YAML as malformed instead of failing")
    void shouldFlagMalformedYaml() {
      ParsedNote note = parser.parse("---\ntags: [unclosed\n---\nBody");

      assertThat(note.isMalformed()).isTrue();
      assertThat(note.getFrontMatter()).isEmpty();
      assertThat(note.getBody()).isEqualTo("Body");
    }
  }

  @Nested
  @DisplayName("Note ids")
  class NoteIds {

    @Test
    @DisplayName("Should leave text with an id untouched")
    void shouldKeepExistingId() {
      String text = "---\nnote_id: fixed\n---\nBody";

      assertThat(parser.ensureNoteId(text)).isSameAs(text);
    }

    @Test
    @DisplayName("Should add a generated id and keep other keys and the body")
    void shouldGenerateId() {
      String updated = parser.ensureNoteId("---\naliases: [x]\n---\nBody text");

      String id = parser.getNoteId(updated);
      assertThat(id).matches("[0-9a-f-]{36}");
      assertThat(parser.parse(updated).getFrontMatter()).containsKey("aliases");
      assertThat(parser.parse(updated).getBody()).isEqualTo("Body text");
      assertThat(parser.ensureNoteId(updated)).isEqualTo(updated);
    }

    @Test
    @DisplayName("Should add front matter to a plain note")
    void shouldCreateFrontMatter() {
      String updated = parser.ensureNoteId("Plain body");

      assertThat(updated).startsWith("---\nnote_id: ");
      assertThat(updated).endsWith("---\nPlain body");
    }

    @Test
    @DisplayName("Should refuse to rewrite malformed front matter")
    void shouldRejectMalformedFrontMatter() {
      assertThatThrownBy(() -> parser.ensureNoteId("---\n: : bad: [\n---\nBody"))
          .isInstanceOf(ContentException.class);
    }
  }

  @Nested
  @DisplayName("Tags")
  class Tags {

    @Test
    @DisplayName("Should read list and comma-separated tags")
    void shouldReadTags() {
      assertThat(parser.getTags("---\ntags:\n- one\n- two\n---\n")).containsExactly("one", "two");
      assertThat(parser.getTags("---\ntags: one, two ,\n---\n")).containsExactly("one", "two");
      assertThat(parser.getTags("No front matter")).isEmpty();
    }

    @Test
    @DisplayName("Should replace tags while keeping the id and body")
    void shouldReplaceTags() {
      String updated =
          parser.withTags("---\nnote_id: n1\ntags: [old]\n---\nBody", List.of("new", "tags"));

      assertThat(parser.getTags(updated)).containsExactly("new", "tags");
      assertThat(parser.getNoteId(updated)).isEqualTo("n1");
      assertThat(parser.parse(updated).getBody()).isEqualTo("Body");
    }

    @Test
    @DisplayName("Should refuse to write tags into malformed front matter")
    void shouldRejectMalformedTagsWrite() {
      assertThatThrownBy(() -> parser.withTags("---\ntags: [x\n---\nBody", List.of("a")))
          .isInstanceOf(ContentException.class);
    }
  }
}
