package io.agentbus.router;

/**
 * Per-route settings for {@link EventRouter#addRoute}.
 *
 * <p>Defaults: priority {@code 0}, no filter, no transform, retry enabled, and the router's
 * default max retries.
 */
public final class RouteOptions {
  static final int USE_ROUTER_DEFAULT = -1;

  private final int priority;
  private final EventFilter filter;
  private final EventTransformer transform;
  private final boolean retry;
  private final int maxRetries;

  private RouteOptions(Builder builder) {
    if (builder.maxRetries < USE_ROUTER_DEFAULT) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    this.priority = builder.priority;
    this.filter = builder.filter;
    this.transform = builder.transform;
    this.retry = builder.retry;
    this.maxRetries = builder.maxRetries;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static RouteOptions defaults() {
    return builder().build();
  }

  /**
   * Higher values are scheduled first when router workers are saturated.
   */
  public int priority() {
    return priority;
  }

  public EventFilter filter() {
    return filter;
  }

  public EventTransformer transform() {
    return transform;
  }

  public boolean retry() {
    return retry;
  }

  /**
   * Returns the configured max retries, or {@code -1} when the router default applies.
   */
  public int maxRetries() {
    return maxRetries;
  }

  RouteOptions withResolvedMaxRetries(int routerDefault) {
    if (maxRetries != USE_ROUTER_DEFAULT) {
      return this;
    }
    return new Builder()
        .priority(priority)
        .filter(filter)
        .transform(transform)
        .retry(retry)
        .maxRetries(routerDefault)
        .build();
  }

  public static final class Builder {
    private int priority;
    private EventFilter filter;
    private EventTransformer transform;
    private boolean retry = true;
    private int maxRetries = USE_ROUTER_DEFAULT;

    private Builder() {
    }

    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    public Builder filter(EventFilter filter) {
      this.filter = filter;
      return this;
    }

    public Builder transform(EventTransformer transform) {
      this.transform = transform;
      return this;
    }

    /**
     * Optional. Defaults to {@code true}. When disabled, a failed delivery is dead-lettered
     * immediately.
     */
    public Builder retry(boolean retry) {
      this.retry = retry;
      return this;
    }

    /**
     * Optional. Defaults to the router's {@code defaultMaxRetries}. Must be &ge; 0.
     */
    public Builder maxRetries(int maxRetries) {
      if (maxRetries < 0) {
        throw new IllegalArgumentException("maxRetries must be >= 0");
      }
      this.maxRetries = maxRetries;
      return this;
    }

    public RouteOptions build() {
      return new RouteOptions(this);
    }
  }
}
