package herald.template;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A stored, named title/body template with default variables.
 *
 * @param id            database id, {@code null} until stored
 * @param name          unique name
 * @param titleTemplate title text with {@code {{...}}} tags
 * @param bodyTemplate  body text with {@code {{...}}} tags
 * @param variables     default variable values, overridden by callers
 * @param description   free text
 * @param createdAt     set when stored
 * @param updatedAt     set when stored or updated; part of the parse cache key
 */
public record Template(
    Long id,
    String name,
    String titleTemplate,
    String bodyTemplate,
    Map<String, String> variables,
    String description,
    Instant createdAt,
    Instant updatedAt) {

  public Template {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("name cannot be blank");
    }
    titleTemplate = titleTemplate == null ? "" : titleTemplate;
    bodyTemplate = bodyTemplate == null ? "" : bodyTemplate;
    variables = variables == null || variables.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    description = description == null ? "" : description;
  }

  /** Creates an unsaved template. */
  public static Template of(String name, String titleTemplate, String bodyTemplate,
      Map<String, String> variables, String description) {
    return new Template(null, name, titleTemplate, bodyTemplate, variables, description, null, null);
  }

  Template stored(Long newId, Instant created, Instant updated) {
    return new Template(newId, name, titleTemplate, bodyTemplate, variables, description, created, updated);
  }
}
