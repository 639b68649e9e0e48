package herald.template;

/**
 * Thrown when template text cannot be parsed: unclosed tags, unbalanced {@code #if} blocks,
 * unknown filters or malformed filter arguments.
 */
public class TemplateSyntaxException extends TemplateException {
  private final int offset;

  public TemplateSyntaxException(String message, int offset) {
    super(message + " at offset " + offset);
    this.offset = offset;
  }

  /** Character offset in the template text where the problem was found. */
  public int offset() {
    return offset;
  }
}
