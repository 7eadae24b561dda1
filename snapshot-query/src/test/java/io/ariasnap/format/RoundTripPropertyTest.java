package io.ariasnap.format;

import static org.junit.jupiter.api.Assertions.*;

import io.ariasnap.Fixtures;
import io.ariasnap.SnapshotGenerators;
import io.ariasnap.parser.AriaChild;
import io.ariasnap.parser.AriaName;
import io.ariasnap.parser.AriaNode;
import io.ariasnap.parser.AriaSnapshotParser;
import io.ariasnap.parser.AriaSnapshotSerializer;
import io.ariasnap.parser.AriaText;
import io.ariasnap.parser.ParseResult;
import java.util.List;
import net.jqwik.api.*;

/** parse, serialize, format as YAML and parse again: the tree must come back unchanged. */
@PropertyDefaults(tries = 200)
class RoundTripPropertyTest {

  @Provide
  Arbitrary<List<AriaChild>> forests() {
    return SnapshotGenerators.forests(2);
  }

  @Property
  void renderedTreeParsesWithoutErrors(@ForAll("forests") List<AriaChild> tree) {
    ParseResult parsed = AriaSnapshotParser.parse(SnapshotGenerators.render(tree));

    assertEquals(List.of(), parsed.errorMessages());
    assertEquals(tree, parsed.tree());
  }

  @Property
  void formattedYamlParsesBackToSameTree(@ForAll("forests") List<AriaChild> tree) {
    List<AriaChild> first = AriaSnapshotParser.parse(SnapshotGenerators.render(tree)).tree();

    String yaml = OutputFormatter.format(AriaSnapshotSerializer.toData(first), OutputFormat.YAML);
    ParseResult second = AriaSnapshotParser.parse(yaml);

    assertEquals(List.of(), second.errorMessages(), yaml);
    assertEquals(first, second.tree(), yaml);
  }

  @Example
  void fixtureSurvivesRoundTrip() {
    for (String name : List.of("google.yaml", "example_domain.yaml")) {
      List<AriaChild> first = AriaSnapshotParser.parse(Fixtures.read(name)).tree();
      String yaml = OutputFormatter.format(AriaSnapshotSerializer.toData(first), "yaml");

      assertEquals(first, AriaSnapshotParser.parse(yaml).tree(), name);
    }
  }

  @Example
  void yamlSensitiveValuesSurviveRoundTrip() {
    for (String value : SnapshotGenerators.YAML_SENSITIVE) {
      AriaNode.Builder node =
          AriaNode.builder("button")
              .name(AriaName.literal(value))
              .prop("data-x", value)
              .child(new AriaText(value));
      AriaNode img = AriaNode.builder("img").name(AriaName.pattern(value)).build();
      List<AriaChild> tree = List.<AriaChild>of(node.build(), img);

      String yaml = OutputFormatter.format(AriaSnapshotSerializer.toData(tree), OutputFormat.YAML);
      ParseResult parsed = AriaSnapshotParser.parse(yaml);

      assertEquals(List.of(), parsed.errorMessages(), yaml);
      assertEquals(tree, parsed.tree(), yaml);
    }
  }

  @Example
  void inlinePropsWithNumberShapesKeepTheirText() {
    String snapshot = "- button [data-a=0x1F] [data-b=1e3] [data-c=.inf] [data-d=.NaN]\n";
    List<AriaChild> first = AriaSnapshotParser.parse(snapshot).tree();

    String yaml = OutputFormatter.format(AriaSnapshotSerializer.toData(first), OutputFormat.YAML);
    AriaNode node = (AriaNode) AriaSnapshotParser.parse(yaml).tree().get(0);

    assertEquals("0x1F", node.props().get("data-a"));
    assertEquals("1e3", node.props().get("data-b"));
    assertEquals(".inf", node.props().get("data-c"));
    assertEquals(".NaN", node.props().get("data-d"));
  }

  @Example
  void rootLevelTextEntriesSurviveRoundTrip() {
    List<AriaChild> first = AriaSnapshotParser.parse("- text: hello\n- text: 1e3\n").tree();
    assertEquals(List.of(new AriaText("hello"), new AriaText("1e3")), first);

    String yaml = OutputFormatter.format(AriaSnapshotSerializer.toData(first), OutputFormat.YAML);
    ParseResult second = AriaSnapshotParser.parse(yaml);

    assertEquals(List.of(), second.errorMessages(), yaml);
    assertEquals(first, second.tree(), yaml);
  }
}
