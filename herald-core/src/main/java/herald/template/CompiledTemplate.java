package herald.template;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed template, safe to share between threads and render many times.
 *
 * @see TemplateParser#parse(String)
 */
public final class CompiledTemplate {
  private final List<Node> nodes;

  CompiledTemplate(List<Node> nodes) {
    this.nodes = List.copyOf(nodes);
  }

  /**
   * Renders against {@code variables}. Missing variables render as the empty string.
   */
  public String render(Map<String, String> variables) {
    StringBuilder out = new StringBuilder();
    renderAll(nodes, variables, out);
    return out.toString();
  }

  private static void renderAll(List<Node> nodes, Map<String, String> variables, StringBuilder out) {
    for (Node node : nodes) {
      if (node instanceof Text text) {
        out.append(text.value());
      } else if (node instanceof Variable variable) {
        String value = Objects.requireNonNullElse(variables.get(variable.name()), "");
        for (Filter filter : variable.filters()) {
          value = filter.apply(value);
        }
        out.append(value);
      } else if (node instanceof Conditional cond) {
        boolean truthy = isTruthy(variables.get(cond.name()));
        renderAll(truthy != cond.negated() ? cond.then() : cond.otherwise(), variables, out);
      }
    }
  }

  static boolean isTruthy(String value) {
    return value != null && !value.isEmpty() && !"false".equalsIgnoreCase(value) && !"0".equals(value);
  }

  sealed interface Node permits Text, Variable, Conditional {
  }

  record Text(String value) implements Node {
  }

  record Variable(String name, List<Filter> filters) implements Node {
  }

  record Conditional(String name, boolean negated, List<Node> then, List<Node> otherwise) implements Node {
  }

  /** A pipeline step such as {@code default "x"} or {@code upper}. */
  record Filter(String name, String argument) {
    String apply(String value) {
      return switch (name) {
        case "default" -> value.isEmpty() ? argument : value;
        case "upper" -> value.toUpperCase(Locale.ROOT);
        case "lower" -> value.toLowerCase(Locale.ROOT);
        case "trim" -> value.trim();
        case "title" -> titleCase(value);
        default -> throw new IllegalStateException("Unknown filter: " + name);
      };
    }

    private static String titleCase(String value) {
      StringBuilder sb = new StringBuilder(value.length());
      boolean startOfWord = true;
      for (int i = 0; i < value.length(); i++) {
        char c = value.charAt(i);
        if (Character.isWhitespace(c) || c == '-' || c == '_') {
          startOfWord = true;
          sb.append(c);
        } else if (startOfWord) {
          sb.append(Character.toUpperCase(c));
          startOfWord = false;
        } else {
          sb.append(Character.toLowerCase(c));
        }
      }
      return sb.toString();
    }
  }
}
