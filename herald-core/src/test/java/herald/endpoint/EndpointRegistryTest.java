package herald.endpoint;

import herald.testing.FakeEndpoint;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EndpointRegistryTest {
  private final List<FakeEndpoint.Delivery> log = FakeEndpoint.newLog();

  private EndpointRegistry registry() {
    return EndpointRegistry.builder()
        .register(FakeEndpoint.accepting("json", log), "json", "jsons")
        .alias("webhook", "json")
        .register(FakeEndpoint.accepting("slack", log), "slack")
        .build();
  }

  @Test
  void resolvesRegisteredSchemesAndAliases() {
    EndpointRegistry registry = registry();

    assertEquals("json", registry.resolve("json://example.com").serviceId());
    assertEquals("json", registry.resolve("jsons://example.com").serviceId());
    assertEquals("json", registry.resolve("webhook://example.com").serviceId());
    assertEquals("slack", registry.resolve("slack://team").serviceId());
    assertEquals(Set.of("json", "jsons", "webhook", "slack"), registry.schemes());
  }

  @Test
  void unknownSchemeIsRejected() {
    UnknownSchemeException e = assertThrows(UnknownSchemeException.class,
        () -> registry().resolve("ftp://example.com"));

    assertEquals("ftp", e.scheme());
  }

  @Test
  void schemesAreCaseSensitive() {
    assertFalse(registry().supports("JSON"));
    assertThrows(UnknownSchemeException.class, () -> registry().resolve("JSON://example.com"));
  }

  @Test
  void endpointRejectionSurfacesAsInvalidUrl() {
    assertThrows(InvalidEndpointUrlException.class, () -> registry().validate("json://"));
  }

  @Test
  void validateAllStopsAtFirstBadUrl() {
    assertThrows(UnknownSchemeException.class,
        () -> registry().validateAll(List.of("json://a", "nope://b", "json://")));
  }

  @Test
  void resolveLenientSkipsBadUrlsAndKeepsOrder() {
    List<String> rejected = new ArrayList<>();

    List<EndpointRegistry.Resolved> resolved = registry().resolveLenient(
        List.of("slack://one", "nope://user:pw@x", "json://two", "json://", "not a url"),
        (url, e) -> rejected.add(url));

    assertEquals(List.of("one", "two"), resolved.stream().map(r -> r.url().host()).toList());
    assertEquals(3, rejected.size());
    assertTrue(rejected.stream().noneMatch(u -> u.contains("pw")));
  }

  @Test
  void duplicateRegistrationIsRejected() {
    EndpointRegistry.Builder builder = EndpointRegistry.builder()
        .register(FakeEndpoint.accepting("json", log), "json");

    assertThrows(IllegalArgumentException.class,
        () -> builder.register(FakeEndpoint.accepting("other", log), "json"));
    assertThrows(IllegalArgumentException.class, () -> builder.alias("x", "missing"));
    assertThrows(IllegalArgumentException.class, () -> builder.register(FakeEndpoint.accepting("x", log)));
  }

  @Test
  void eachResolveCreatesAFreshEndpoint() {
    EndpointRegistry registry = registry();

    assertNotSame(registry.resolve("json://a"), registry.resolve("json://a"));
  }
}
