package herald.template;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses template text into a {@link CompiledTemplate}.
 *
 * <p>Supported tags:
 * <ul>
 *   <li>{@code {{name}}}, optionally written {@code {{.name}}}</li>
 *   <li>{@code {{name | default "x" | upper}}}; filters {@code default}, {@code upper},
 *       {@code lower}, {@code title}, {@code trim}</li>
 *   <li>{@code {{#if name}}...{{else}}...{{/if}}} and {@code {{#unless name}}...{{/unless}}}</li>
 *   <li>{@code {{! comment }}}</li>
 * </ul>
 */
public final class TemplateParser {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_.\\-]*");
  private static final Set<String> FILTERS = Set.of("default", "upper", "lower", "title", "trim");

  private TemplateParser() {
  }

  /**
   * @throws TemplateSyntaxException if the text is not a valid template
   */
  public static CompiledTemplate parse(String text) {
    Deque<Block> open = new ArrayDeque<>();
    List<CompiledTemplate.Node> root = new ArrayList<>();
    int pos = 0;
    while (pos < text.length()) {
      int start = text.indexOf("{{", pos);
      if (start < 0) {
        current(open, root).add(new CompiledTemplate.Text(text.substring(pos)));
        break;
      }
      if (start > pos) {
        current(open, root).add(new CompiledTemplate.Text(text.substring(pos, start)));
      }
      int end = text.indexOf("}}", start + 2);
      if (end < 0) {
        throw new TemplateSyntaxException("Unclosed tag", start);
      }
      String tag = text.substring(start + 2, end).trim();
      handleTag(tag, start, open, root);
      pos = end + 2;
    }
    if (!open.isEmpty()) {
      Block block = open.peek();
      throw new TemplateSyntaxException("Unclosed {{#" + block.keyword + "}} block", block.offset);
    }
    return new CompiledTemplate(root);
  }

  private static void handleTag(String tag, int offset, Deque<Block> open,
      List<CompiledTemplate.Node> root) {
    if (tag.startsWith("!")) {
      return;
    }
    if (tag.startsWith("#")) {
      String[] parts = tag.substring(1).trim().split("\\s+");
      String keyword = parts[0];
      if (!keyword.equals("if") && !keyword.equals("unless")) {
        throw new TemplateSyntaxException("Unknown block: #" + keyword, offset);
      }
      if (parts.length != 2) {
        throw new TemplateSyntaxException("#" + keyword + " takes exactly one variable", offset);
      }
      open.push(new Block(keyword, identifier(parts[1], offset), offset));
      return;
    }
    if (tag.equals("else")) {
      Block block = open.peek();
      if (block == null || block.inElse) {
        throw new TemplateSyntaxException("Unexpected {{else}}", offset);
      }
      block.inElse = true;
      return;
    }
    if (tag.startsWith("/")) {
      String keyword = tag.substring(1).trim();
      Block block = open.poll();
      if (block == null || !block.keyword.equals(keyword)) {
        throw new TemplateSyntaxException("Unexpected {{/" + keyword + "}}", offset);
      }
      current(open, root).add(new CompiledTemplate.Conditional(block.variable,
          block.keyword.equals("unless"), block.then, block.otherwise));
      return;
    }
    current(open, root).add(variable(tag, offset));
  }

  private static CompiledTemplate.Variable variable(String expression, int offset) {
    List<String> stages = splitPipeline(expression, offset);
    String name = identifier(stages.get(0).trim(), offset);
    List<CompiledTemplate.Filter> filters = new ArrayList<>();
    for (int i = 1; i < stages.size(); i++) {
      filters.add(filter(stages.get(i).trim(), offset));
    }
    return new CompiledTemplate.Variable(name, filters);
  }

  private static CompiledTemplate.Filter filter(String stage, int offset) {
    int space = stage.indexOf(' ');
    String name = space < 0 ? stage : stage.substring(0, space);
    String rest = space < 0 ? "" : stage.substring(space + 1).trim();
    if (!FILTERS.contains(name)) {
      throw new TemplateSyntaxException("Unknown filter: " + name, offset);
    }
    if (name.equals("default")) {
      if (rest.length() < 2 || rest.charAt(0) != '"' || rest.charAt(rest.length() - 1) != '"') {
        throw new TemplateSyntaxException("default expects a quoted argument", offset);
      }
      return new CompiledTemplate.Filter(name, unescape(rest.substring(1, rest.length() - 1)));
    }
    if (!rest.isEmpty()) {
      throw new TemplateSyntaxException("Filter " + name + " takes no argument", offset);
    }
    return new CompiledTemplate.Filter(name, null);
  }

  private static List<String> splitPipeline(String expression, int offset) {
    List<String> stages = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean quoted = false;
    for (int i = 0; i < expression.length(); i++) {
      char c = expression.charAt(i);
      if (c == '\\' && quoted && i + 1 < expression.length()) {
        current.append(c).append(expression.charAt(++i));
      } else if (c == '"') {
        quoted = !quoted;
        current.append(c);
      } else if (c == '|' && !quoted) {
        stages.add(current.toString());
        current.setLength(0);
      } else {
        current.append(c);
      }
    }
    if (quoted) {
      throw new TemplateSyntaxException("Unterminated string", offset);
    }
    stages.add(current.toString());
    return stages;
  }

  private static String identifier(String raw, int offset) {
    String name = raw.startsWith(".") ? raw.substring(1) : raw;
    if (!IDENTIFIER.matcher(name).matches()) {
      throw new TemplateSyntaxException("Invalid variable name: '" + raw + "'", offset);
    }
    return name;
  }

  private static String unescape(String value) {
    return value.replace("\\\"", "\"").replace("\\\\", "\\");
  }

  private static List<CompiledTemplate.Node> current(Deque<Block> open, List<CompiledTemplate.Node> root) {
    Block block = open.peek();
    if (block == null) {
      return root;
    }
    return block.inElse ? block.otherwise : block.then;
  }

  private static final class Block {
    final String keyword;
    final String variable;
    final int offset;
    final List<CompiledTemplate.Node> then = new ArrayList<>();
    final List<CompiledTemplate.Node> otherwise = new ArrayList<>();
    boolean inElse;

    Block(String keyword, String variable, int offset) {
      this.keyword = keyword;
      this.variable = variable;
      this.offset = offset;
    }
  }
}
