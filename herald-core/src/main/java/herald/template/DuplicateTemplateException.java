package herald.template;

/**
 * Thrown by {@link TemplateEngine#add} when a template with the same name already exists.
 */
public class DuplicateTemplateException extends TemplateException {
  public DuplicateTemplateException(String templateName) {
    super("Template already exists: " + templateName);
  }
}
