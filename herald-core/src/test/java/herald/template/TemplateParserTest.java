package herald.template;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemplateParserTest {

  private static String render(String text, Map<String, String> vars) {
    return TemplateParser.parse(text).render(vars);
  }

  @Test
  void substitutesVariables() {
    assertEquals("Disk on db-1", render("{{alert_type}} on {{ host }}",
        Map.of("alert_type", "Disk", "host", "db-1")));
  }

  @Test
  void dotPrefixedNamesAreAccepted() {
    assertEquals("v1.2", render("v{{.version}}", Map.of("version", "1.2")));
  }

  @Test
  void missingVariableRendersEmpty() {
    assertEquals("Message: ", render("Message: {{message}}", Map.of()));
  }

  @Test
  void nullValueRendersLikeMissing() {
    Map<String, String> vars = new HashMap<>();
    vars.put("host", null);

    assertEquals("[]", render("[{{host}}]", vars));
    assertEquals("[]", render("[{{host | upper | trim}}]", vars));
    assertEquals("n/a", render("{{host | default \"n/a\"}}", vars));
    assertEquals("none", render("{{#if host}}some{{else}}none{{/if}}", vars));
  }

  @Test
  void textWithoutTagsIsUnchanged() {
    assertEquals("plain } text { here", render("plain } text { here", Map.of()));
  }

  @Test
  void filtersApplyLeftToRight() {
    assertEquals("UNKNOWN", render("{{system | default \"unknown\" | upper}}", Map.of()));
    assertEquals("db", render("{{system | default \"unknown\" | lower}}", Map.of("system", "DB")));
    assertEquals("Rolled Back", render("{{status | title}}", Map.of("status", "rolled back")));
    assertEquals("x", render("{{v | trim}}", Map.of("v", "  x ")));
  }

  @Test
  void defaultArgumentMayContainPipes() {
    assertEquals("a | b", render("{{v | default \"a | b\"}}", Map.of()));
  }

  @Test
  void conditionalBlocks() {
    String text = "{{#if details}}Details: {{details}}{{else}}No details{{/if}}";

    assertEquals("Details: slow", render(text, Map.of("details", "slow")));
    assertEquals("No details", render(text, Map.of()));
    assertEquals("No details", render(text, Map.of("details", "false")));
    assertEquals("No details", render(text, Map.of("details", "0")));
  }

  @Test
  void unlessBlocksAndNesting() {
    String text = "{{#unless quiet}}loud{{#if extra}}+{{extra}}{{/if}}{{/unless}}";

    assertEquals("loud+x", render(text, Map.of("extra", "x")));
    assertEquals("", render(text, Map.of("quiet", "yes")));
  }

  @Test
  void commentsRenderNothing() {
    assertEquals("ab", render("a{{! ignored }}b", Map.of()));
  }

  @Test
  void syntaxErrorsReportOffset() {
    TemplateSyntaxException unclosed = assertThrows(TemplateSyntaxException.class,
        () -> TemplateParser.parse("Hello {{name"));
    assertEquals(6, unclosed.offset());
    assertTrue(unclosed.getMessage().endsWith("at offset 6"));
  }

  @Test
  void rejectsMalformedTemplates() {
    assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse("{{#if a}}open"));
    assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse("{{/if}}"));
    assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse("{{#if a}}x{{/unless}}"));
    assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse("{{else}}"));
    assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse("{{#each items}}{{/each}}"));
    assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse("{{#if a b}}{{/if}}"));
    assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse("{{name | shout}}"));
    assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse("{{name | default}}"));
    assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse("{{name | upper \"x\"}}"));
    assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse("{{name | default \"x}}"));
    assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse("{{1abc}}"));
    assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse("{{}}"));
  }

  @Test
  void renderingIsDeterministic() {
    CompiledTemplate compiled = TemplateParser.parse("{{a}}-{{b | default \"z\"}}");
    Map<String, String> vars = Map.of("a", "x");

    assertEquals(compiled.render(vars), compiled.render(vars));
  }
}
