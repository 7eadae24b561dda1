package io.ariasnap.parser;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class SnapshotExtractorTest {

  @Test
  void stripsNarrativeBeforeList() {
    String input =
        "Page URL: https://example.com\n"
            + "Title: Example Domain\n"
            + "\n"
            + "- Page title: Example Domain\n"
            + "  - heading \"Example Domain\" [ref=e1]\n"
            + "  - paragraph \"This domain is for use in illustrative examples\" [ref=e2]";
    String expected =
        "- Page title: Example Domain\n"
            + "  - heading \"Example Domain\" [ref=e1]\n"
            + "  - paragraph \"This domain is for use in illustrative examples\" [ref=e2]";
    assertEquals(expected, SnapshotExtractor.extract(input));
  }

  @Test
  void extractsYamlFence() {
    String input = "```yaml\n- button \"Submit\" [ref=e1]\n- link \"Home\" [ref=e2]\n```";
    assertEquals(
        "- button \"Submit\" [ref=e1]\n- link \"Home\" [ref=e2]", SnapshotExtractor.extract(input));
  }

  @Test
  void extractsFenceAfterNarrative() {
    String input =
        "Page URL: https://example.com\n\n```yml\n- button \"Submit\" [ref=e1]\n```\n"
            + "Trailing notes";
    assertEquals("- button \"Submit\" [ref=e1]", SnapshotExtractor.extract(input));
  }

  @Test
  void extractsUnlabelledFence() {
    String input = "```\n- button \"Submit\" [ref=e1]\n- link \"Home\" [ref=e2]\n```";
    assertEquals(
        "- button \"Submit\" [ref=e1]\n- link \"Home\" [ref=e2]", SnapshotExtractor.extract(input));
  }

  @Test
  void extractsFenceWithInfoAttributes() {
    String input = "Snapshot:\n```yaml title=page.yaml\n- button \"Submit\" [ref=e1]\n```";
    assertEquals("- button \"Submit\" [ref=e1]", SnapshotExtractor.extract(input));
  }

  @Test
  void longerFenceClosesOnlyOnMatchingRun() {
    String input =
        "Notes\n````yaml\n- button \"A\" [ref=e1]\n```\n- link \"B\" [ref=e2]\n"
            + "`````\nAfter";
    assertEquals(
        "- button \"A\" [ref=e1]\n```\n- link \"B\" [ref=e2]", SnapshotExtractor.extract(input));
  }

  @Test
  void tildeFenceClosesWithLongerRun() {
    String input = "Intro\n~~~ yml\n- button \"Ok\"\n~~~~\nTail";
    assertEquals("- button \"Ok\"", SnapshotExtractor.extract(input));
  }

  @Test
  void closingFenceMatchesCharacterAndLength() {
    assertTrue(SnapshotExtractor.closes("```", "```"));
    assertTrue(SnapshotExtractor.closes("  `````  ", "````"));
    assertFalse(SnapshotExtractor.closes("```", "````"));
    assertFalse(SnapshotExtractor.closes("~~~", "```"));
    assertFalse(SnapshotExtractor.closes("``` yaml", "```"));
  }

  @Test
  void ignoresFenceWithOtherLanguage() {
    String input = "```json\n{\"a\": 1}\n```\n- button \"Ok\"";
    assertEquals("- button \"Ok\"", SnapshotExtractor.extract(input));
  }

  @Test
  void plainListIsUnchanged() {
    String input = "- Page title: Example\n  - heading \"Example\" [ref=e1]";
    assertSame(input, SnapshotExtractor.extract(input));
  }

  @Test
  void stopsAtFirstUnindentedProse() {
    String input = "Intro\n- button \"A\"\n  - text: inner\n\n- link \"B\"\nFooter line";
    assertEquals(
        "- button \"A\"\n  - text: inner\n\n- link \"B\"", SnapshotExtractor.extract(input));
  }

  @Test
  void emptyInputStaysEmpty() {
    assertEquals("", SnapshotExtractor.extract(""));
  }

  @Test
  void textWithoutListIsReturnedUnchanged() {
    String input = "Just some random text\nNo ARIA snapshot here";
    assertEquals(input, SnapshotExtractor.extract(input));
  }
}
