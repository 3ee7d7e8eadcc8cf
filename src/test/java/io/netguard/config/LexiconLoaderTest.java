package io.netguard.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netguard.application.classify.Lexicon;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LexiconLoaderTest {

  @TempDir Path tempDir;

  @Test
  void bundledLexiconCoversEnglishAndIndonesian() throws IOException {
    Lexicon lexicon = LexiconLoader.loadDefault();

    assertTrue(lexicon.languages().containsAll(Set.of("en", "id")));
    assertTrue(lexicon.isKeyword("casino"));
    assertTrue(lexicon.isKeyword("togel"));
    assertTrue(lexicon.isKeyword("judi_online"));
    assertTrue(lexicon.isStopword("yang"));
    assertFalse(lexicon.isKeyword("bonus"));
  }

  @Test
  void loadsLanguagesFromFile() throws IOException {
    Path file = tempDir.resolve("lexicon.yaml");
    Files.writeString(file, """
        en:
          keywords: [Casino, "live dealer"]
          stopwords: [the]
        th:
          keywords: [pananbon]
        """);

    Lexicon lexicon = LexiconLoader.load(file);

    assertEquals(Set.of("en", "th"), lexicon.languages());
    assertEquals(Set.of("casino", "live dealer"), lexicon.keywords("EN"));
    assertTrue(lexicon.isKeyword("live_dealer"));
    assertTrue(lexicon.isKeyword("pananbon"));
    assertTrue(lexicon.isStopword("the"));
  }

  @Test
  void emptyDocumentIsEmptyLexicon() {
    Lexicon lexicon = LexiconLoader.parse(new StringReader(""), "inline");

    assertTrue(lexicon.languages().isEmpty());
  }

  @Test
  void nonListKeywordsAreRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> LexiconLoader.parse(new StringReader("en:\n  keywords: casino\n"), "inline"));

    assertTrue(ex.getMessage().contains("inline.en.keywords"));
  }

  @Test
  void nestedEntriesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> LexiconLoader.parse(new StringReader("en:\n  keywords:\n    - {a: b}\n"), "inline"));
  }
}
