package herald.template;

/**
 * Output of {@link TemplateEngine#render}.
 *
 * @param title rendered title
 * @param body  rendered body
 */
public record RenderedTemplate(String title, String body) {
}
