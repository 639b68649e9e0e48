package herald.template;

import herald.spi.ConnectionProvider;
import herald.spi.TemplateStore;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stores named templates and renders them.
 *
 * <p>Rendering merges the template's default variables with the caller's (caller wins; a
 * {@code null} caller value counts as absent) and then
 * adds the system variables {@code timestamp} (RFC 3339), {@code date} ({@code yyyy-MM-dd}) and
 * {@code time} ({@code HH:mm:ss}) taken from the engine's clock in its zone. System variables
 * are applied last and cannot be overridden.
 *
 * <p>Parsed templates are cached per name and {@code updatedAt}, so an update through any
 * engine sharing the same table is picked up on the next render.
 */
public final class TemplateEngine {
  private static final Logger logger = Logger.getLogger(TemplateEngine.class.getName());

  public static final String TIMESTAMP = "timestamp";
  public static final String DATE = "date";
  public static final String TIME = "time";

  private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
  private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

  private final ConnectionProvider connectionProvider;
  private final TemplateStore store;
  private final Clock clock;
  private final ZoneId zone;
  private final Map<String, CachedTemplate> cache = new ConcurrentHashMap<>();

  private TemplateEngine(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.templateStore, "templateStore");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.zone = builder.zone != null ? builder.zone : ZoneOffset.UTC;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Renders the stored template {@code name}.
   *
   * @throws TemplateNotFoundException if no such template exists
   * @throws TemplateSyntaxException   if the stored text does not parse
   */
  public RenderedTemplate render(String name, Map<String, String> variables) {
    Template template = get(name).orElseThrow(() -> new TemplateNotFoundException(name));
    return render(template, variables);
  }

  /**
   * Renders {@code template} without looking it up.
   *
   * @throws TemplateSyntaxException if the template does not parse
   */
  public RenderedTemplate render(Template template, Map<String, String> variables) {
    CachedTemplate compiled = compiled(template);
    Map<String, String> merged = new LinkedHashMap<>(template.variables());
    if (variables != null) {
      variables.forEach((key, value) -> {
        if (value != null) {
          merged.put(key, value);
        }
      });
    }
    merged.putAll(systemVariables());
    return new RenderedTemplate(compiled.title.render(merged), compiled.body.render(merged));
  }

  /**
   * Parses title and body without rendering.
   *
   * @throws TemplateSyntaxException if either does not parse
   */
  public void validate(Template template) {
    TemplateParser.parse(template.titleTemplate());
    TemplateParser.parse(template.bodyTemplate());
  }

  /**
   * Stores a new template.
   *
   * @return the stored template with id and timestamps
   * @throws DuplicateTemplateException if the name is taken
   * @throws TemplateSyntaxException    if the template does not parse
   */
  public Template add(Template template) {
    validate(template);
    return connectionProvider.execute("add template " + template.name(), conn -> {
      if (store.findByName(conn, template.name()).isPresent()) {
        throw new DuplicateTemplateException(template.name());
      }
      Instant now = now();
      return store.insert(conn, template.stored(null, now, now));
    });
  }

  public Optional<Template> get(String name) {
    Objects.requireNonNull(name, "name");
    return connectionProvider.execute("load template " + name, conn -> store.findByName(conn, name));
  }

  /** All templates, ordered by name. */
  public List<Template> list() {
    return connectionProvider.execute("list templates", store::findAll);
  }

  /**
   * Replaces title, body, variables and description of an existing template.
   *
   * @throws TemplateNotFoundException if no template has that name
   * @throws TemplateSyntaxException   if the new text does not parse
   */
  public Template update(Template template) {
    validate(template);
    Template updated = connectionProvider.execute("update template " + template.name(), conn -> {
      Template existing = store.findByName(conn, template.name())
          .orElseThrow(() -> new TemplateNotFoundException(template.name()));
      Template next = template.stored(existing.id(), existing.createdAt(), now());
      if (store.update(conn, next) == 0) {
        throw new TemplateNotFoundException(template.name());
      }
      return next;
    });
    cache.remove(template.name());
    return updated;
  }

  /**
   * @throws TemplateNotFoundException if no template has that name
   */
  public void delete(String name) {
    int deleted = connectionProvider.execute("delete template " + name, conn -> store.delete(conn, name));
    cache.remove(name);
    if (deleted == 0) {
      throw new TemplateNotFoundException(name);
    }
  }

  /**
   * Stores each of {@link DefaultTemplates#all()} that does not exist yet.
   *
   * @return number of templates installed
   */
  public int installDefaults() {
    int installed = 0;
    for (Template template : DefaultTemplates.all()) {
      if (get(template.name()).isPresent()) {
        continue;
      }
      add(template);
      installed++;
    }
    if (installed > 0) {
      logger.log(Level.INFO, "Installed {0} default templates", installed);
    }
    return installed;
  }

  Map<String, String> systemVariables() {
    ZonedDateTime now = clock.instant().truncatedTo(ChronoUnit.SECONDS).atZone(zone);
    return Map.of(
        TIMESTAMP, DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(now),
        DATE, DATE_FORMAT.format(now),
        TIME, TIME_FORMAT.format(now));
  }

  private CachedTemplate compiled(Template template) {
    if (template.updatedAt() == null) {
      return compile(template);
    }
    CachedTemplate cached = cache.get(template.name());
    if (cached != null && cached.matches(template)) {
      return cached;
    }
    CachedTemplate fresh = compile(template);
    cache.put(template.name(), fresh);
    return fresh;
  }

  private static CachedTemplate compile(Template template) {
    return new CachedTemplate(template.updatedAt(), template.titleTemplate(), template.bodyTemplate(),
        TemplateParser.parse(template.titleTemplate()), TemplateParser.parse(template.bodyTemplate()));
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  private record CachedTemplate(Instant updatedAt, String titleText, String bodyText,
      CompiledTemplate title, CompiledTemplate body) {
    boolean matches(Template template) {
      return updatedAt.equals(template.updatedAt())
          && titleText.equals(template.titleTemplate())
          && bodyText.equals(template.bodyTemplate());
    }
  }

  /**
   * Builder for {@link TemplateEngine}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private TemplateStore templateStore;
    private Clock clock;
    private ZoneId zone;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder templateStore(TemplateStore templateStore) {
      this.templateStore = templateStore;
      return this;
    }

    /** Source of the system variables. Optional; defaults to the UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Zone for {@code date}, {@code time} and {@code timestamp}. Optional; defaults to UTC. */
    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    public TemplateEngine build() {
      return new TemplateEngine(this);
    }
  }
}
