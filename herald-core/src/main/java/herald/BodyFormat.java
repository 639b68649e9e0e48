package herald;

/**
 * Markup of a notification body. Endpoints that cannot render a format deliver it as text.
 */
public enum BodyFormat {
  TEXT,
  HTML,
  MARKDOWN
}
