package io.hookbox.model;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A registered third-party endpoint and the event names it receives.
 *
 * <p>Instances are immutable. Event names are de-duplicated preserving first
 * occurrence; custom headers keep insertion order. Create via {@link #builder()}
 * or copy with {@link #toBuilder()}.
 */
public final class WebhookSubscription {
  public static final int DEFAULT_RETRY_BUDGET = 5;

  private final String id;
  private final String name;
  private final String targetUrl;
  private final String secret;
  private final List<String> events;
  private final boolean enabled;
  private final int retryBudget;
  private final Map<String, String> headers;
  private final String tenantId;
  private final Instant createdAt;

  private WebhookSubscription(Builder builder) {
    this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
    this.name = builder.name;
    this.targetUrl = requireNonBlank(builder.targetUrl, "targetUrl");
    this.secret = requireNonBlank(builder.secret, "secret");
    if (builder.retryBudget < 1) {
      throw new IllegalArgumentException("retryBudget must be >= 1");
    }
    URI uri = URI.create(targetUrl);
    if (uri.getScheme() == null
        || !(uri.getScheme().equalsIgnoreCase("http") || uri.getScheme().equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("targetUrl must be an http(s) URL: " + targetUrl);
    }
    LinkedHashSet<String> distinct = new LinkedHashSet<>();
    for (String event : builder.events) {
      distinct.add(requireNonBlank(event, "event name"));
    }
    this.events = Collections.unmodifiableList(new ArrayList<>(distinct));
    this.enabled = builder.enabled;
    this.retryBudget = builder.retryBudget;
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    this.tenantId = builder.tenantId;
    this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .id(id)
        .name(name)
        .targetUrl(targetUrl)
        .secret(secret)
        .events(events)
        .enabled(enabled)
        .retryBudget(retryBudget)
        .headers(headers)
        .tenantId(tenantId)
        .createdAt(createdAt);
  }

  public String id() {
    return id;
  }

  public String name() {
    return name;
  }

  public String targetUrl() {
    return targetUrl;
  }

  public String secret() {
    return secret;
  }

  public List<String> events() {
    return events;
  }

  public boolean enabled() {
    return enabled;
  }

  public int retryBudget() {
    return retryBudget;
  }

  public Map<String, String> headers() {
    return headers;
  }

  public String tenantId() {
    return tenantId;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public boolean subscribesTo(String eventName) {
    return events.contains(eventName);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof WebhookSubscription)) return false;
    WebhookSubscription that = (WebhookSubscription) o;
    return enabled == that.enabled
        && retryBudget == that.retryBudget
        && id.equals(that.id)
        && Objects.equals(name, that.name)
        && targetUrl.equals(that.targetUrl)
        && secret.equals(that.secret)
        && events.equals(that.events)
        && headers.equals(that.headers)
        && Objects.equals(tenantId, that.tenantId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, targetUrl, events, enabled, retryBudget);
  }

  // Secret is never printed
  @Override
  public String toString() {
    return "WebhookSubscription{id=" + id
        + ", name=" + name
        + ", targetUrl=" + targetUrl
        + ", events=" + events
        + ", enabled=" + enabled
        + ", retryBudget=" + retryBudget
        + ", tenantId=" + tenantId + "}";
  }

  private static String requireNonBlank(String value, String field) {
    Objects.requireNonNull(value, field);
    if (value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
    return value;
  }

  /** Builder for {@link WebhookSubscription}. */
  public static final class Builder {
    private String id;
    private String name;
    private String targetUrl;
    private String secret;
    private final List<String> events = new ArrayList<>();
    private boolean enabled = true;
    private int retryBudget = DEFAULT_RETRY_BUDGET;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private String tenantId;
    private Instant createdAt;

    private Builder() {
    }

    /** Optional. A random UUID is assigned when absent. */
    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /** <b>Required.</b> Absolute http or https URL. */
    public Builder targetUrl(String targetUrl) {
      this.targetUrl = targetUrl;
      return this;
    }

    /** <b>Required.</b> HMAC key shared with the receiver. */
    public Builder secret(String secret) {
      this.secret = secret;
      return this;
    }

    public Builder event(String eventName) {
      this.events.add(eventName);
      return this;
    }

    public Builder events(List<String> eventNames) {
      this.events.clear();
      this.events.addAll(Objects.requireNonNull(eventNames, "eventNames"));
      return this;
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /** Optional. Total attempts before dead-lettering; defaults to 5, must be &ge; 1. */
    public Builder retryBudget(int retryBudget) {
      this.retryBudget = retryBudget;
      return this;
    }

    public Builder header(String name, String value) {
      this.headers.put(Objects.requireNonNull(name, "header name"), Objects.requireNonNull(value, "header value"));
      return this;
    }

    public Builder headers(Map<String, String> headers) {
      this.headers.clear();
      if (headers != null) {
        headers.forEach(this::header);
      }
      return this;
    }

    public Builder tenantId(String tenantId) {
      this.tenantId = tenantId;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    /**
     * @throws NullPointerException     if {@code targetUrl} or {@code secret} is null
     * @throws IllegalArgumentException if a required value is blank, the URL is not
     *                                  http(s), or {@code retryBudget < 1}
     */
    public WebhookSubscription build() {
      return new WebhookSubscription(this);
    }
  }
}
