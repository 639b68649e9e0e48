package herald.template;

public class TemplateNotFoundException extends TemplateException {
  private final String templateName;

  public TemplateNotFoundException(String templateName) {
    super("Template not found: " + templateName);
    this.templateName = templateName;
  }

  public String templateName() {
    return templateName;
  }
}
