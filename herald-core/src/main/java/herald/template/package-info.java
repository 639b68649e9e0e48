/**
 * Named title/body templates with a small mustache-like syntax.
 *
 * <pre>
 * Alert: {{alert_type | default "Unknown" | upper}}
 * {{#if details}}Details: {{details}}{{else}}No details{{/if}}
 * </pre>
 *
 * @see herald.template.TemplateEngine
 * @see herald.template.TemplateParser
 */
package herald.template;
