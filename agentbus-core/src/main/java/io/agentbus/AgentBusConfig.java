package io.agentbus;

import java.util.Properties;

/**
 * Settings for an {@link AgentBus}. Setters return {@code this}; values are validated by the
 * component builders when the bus is built.
 *
 * <p>{@link #fromProperties(Properties)} reads the keys below; missing keys keep their defaults
 * and unknown keys are ignored.
 *
 * <pre>
 * agentbus.namespace                          agentbus
 * agentbus.bus.persistEvents                  true
 * agentbus.bus.maxStoredEvents                1000
 * agentbus.router.workers                     4
 * agentbus.router.baseDelayMs                 1000
 * agentbus.router.maxRetries                  3
 * agentbus.router.deadLetterPrefix            dlq
 * agentbus.router.deadLetterCapacity          1000
 * agentbus.registry.maxConcurrentActions      10
 * agentbus.registry.historyLimit              1000
 * agentbus.registry.rollbackLimit             1000
 * agentbus.registry.publishOutcomes           true
 * agentbus.maintenance.enabled                true
 * agentbus.maintenance.intervalSeconds        3600
 * agentbus.maintenance.maxAgeSeconds          86400
 * </pre>
 */
public final class AgentBusConfig {
  public static final String PREFIX = "agentbus.";

  private String namespace = "agentbus";
  private boolean persistEvents = true;
  private int maxStoredEvents = 1000;

  private int routerWorkers = 4;
  private long retryBaseDelayMs = 1000L;
  private int maxRetries = 3;
  private String deadLetterPrefix = "dlq";
  private int deadLetterCapacity = 1000;

  private int maxConcurrentActions = 10;
  private int historyLimit = 1000;
  private int rollbackLimit = 1000;
  private boolean publishOutcomes = true;

  private boolean maintenanceEnabled = true;
  private long maintenanceIntervalSeconds = 3600L;
  private long maintenanceMaxAgeSeconds = 86400L;

  /**
   * Builds a config from {@code agentbus.*} properties.
   *
   * @throws IllegalArgumentException if a numeric or boolean value is malformed
   */
  public static AgentBusConfig fromProperties(Properties properties) {
    AgentBusConfig config = new AgentBusConfig();
    String namespace = properties.getProperty(PREFIX + "namespace");
    if (namespace != null) {
      config.setNamespace(namespace.trim());
    }
    config.setPersistEvents(bool(properties, "bus.persistEvents", config.persistEvents));
    config.setMaxStoredEvents(integer(properties, "bus.maxStoredEvents", config.maxStoredEvents));
    config.setRouterWorkers(integer(properties, "router.workers", config.routerWorkers));
    config.setRetryBaseDelayMs(longValue(properties, "router.baseDelayMs", config.retryBaseDelayMs));
    config.setMaxRetries(integer(properties, "router.maxRetries", config.maxRetries));
    String prefix = properties.getProperty(PREFIX + "router.deadLetterPrefix");
    if (prefix != null) {
      config.setDeadLetterPrefix(prefix.trim());
    }
    config.setDeadLetterCapacity(
        integer(properties, "router.deadLetterCapacity", config.deadLetterCapacity));
    config.setMaxConcurrentActions(
        integer(properties, "registry.maxConcurrentActions", config.maxConcurrentActions));
    config.setHistoryLimit(integer(properties, "registry.historyLimit", config.historyLimit));
    config.setRollbackLimit(integer(properties, "registry.rollbackLimit", config.rollbackLimit));
    config.setPublishOutcomes(bool(properties, "registry.publishOutcomes", config.publishOutcomes));
    config.setMaintenanceEnabled(
        bool(properties, "maintenance.enabled", config.maintenanceEnabled));
    config.setMaintenanceIntervalSeconds(
        longValue(properties, "maintenance.intervalSeconds", config.maintenanceIntervalSeconds));
    config.setMaintenanceMaxAgeSeconds(
        longValue(properties, "maintenance.maxAgeSeconds", config.maintenanceMaxAgeSeconds));
    return config;
  }

  private static int integer(Properties properties, String key, int defaultValue) {
    String value = properties.getProperty(PREFIX + key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + value, e);
    }
  }

  private static long longValue(Properties properties, String key, long defaultValue) {
    String value = properties.getProperty(PREFIX + key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number for " + PREFIX + key + ": " + value, e);
    }
  }

  private static boolean bool(Properties properties, String key, boolean defaultValue) {
    String value = properties.getProperty(PREFIX + key);
    if (value == null) {
      return defaultValue;
    }
    String trimmed = value.trim();
    if ("true".equalsIgnoreCase(trimmed)) {
      return true;
    }
    if ("false".equalsIgnoreCase(trimmed)) {
      return false;
    }
    throw new IllegalArgumentException("Invalid boolean for " + PREFIX + key + ": " + value);
  }

  public String getNamespace() {
    return namespace;
  }

  public AgentBusConfig setNamespace(String namespace) {
    this.namespace = namespace;
    return this;
  }

  public boolean isPersistEvents() {
    return persistEvents;
  }

  public AgentBusConfig setPersistEvents(boolean persistEvents) {
    this.persistEvents = persistEvents;
    return this;
  }

  public int getMaxStoredEvents() {
    return maxStoredEvents;
  }

  public AgentBusConfig setMaxStoredEvents(int maxStoredEvents) {
    this.maxStoredEvents = maxStoredEvents;
    return this;
  }

  public int getRouterWorkers() {
    return routerWorkers;
  }

  public AgentBusConfig setRouterWorkers(int routerWorkers) {
    this.routerWorkers = routerWorkers;
    return this;
  }

  public long getRetryBaseDelayMs() {
    return retryBaseDelayMs;
  }

  public AgentBusConfig setRetryBaseDelayMs(long retryBaseDelayMs) {
    this.retryBaseDelayMs = retryBaseDelayMs;
    return this;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public AgentBusConfig setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
    return this;
  }

  public String getDeadLetterPrefix() {
    return deadLetterPrefix;
  }

  public AgentBusConfig setDeadLetterPrefix(String deadLetterPrefix) {
    this.deadLetterPrefix = deadLetterPrefix;
    return this;
  }

  public int getDeadLetterCapacity() {
    return deadLetterCapacity;
  }

  public AgentBusConfig setDeadLetterCapacity(int deadLetterCapacity) {
    this.deadLetterCapacity = deadLetterCapacity;
    return this;
  }

  public int getMaxConcurrentActions() {
    return maxConcurrentActions;
  }

  public AgentBusConfig setMaxConcurrentActions(int maxConcurrentActions) {
    this.maxConcurrentActions = maxConcurrentActions;
    return this;
  }

  public int getHistoryLimit() {
    return historyLimit;
  }

  public AgentBusConfig setHistoryLimit(int historyLimit) {
    this.historyLimit = historyLimit;
    return this;
  }

  public int getRollbackLimit() {
    return rollbackLimit;
  }

  public AgentBusConfig setRollbackLimit(int rollbackLimit) {
    this.rollbackLimit = rollbackLimit;
    return this;
  }

  public boolean isPublishOutcomes() {
    return publishOutcomes;
  }

  public AgentBusConfig setPublishOutcomes(boolean publishOutcomes) {
    this.publishOutcomes = publishOutcomes;
    return this;
  }

  public boolean isMaintenanceEnabled() {
    return maintenanceEnabled;
  }

  public AgentBusConfig setMaintenanceEnabled(boolean maintenanceEnabled) {
    this.maintenanceEnabled = maintenanceEnabled;
    return this;
  }

  public long getMaintenanceIntervalSeconds() {
    return maintenanceIntervalSeconds;
  }

  public AgentBusConfig setMaintenanceIntervalSeconds(long maintenanceIntervalSeconds) {
    this.maintenanceIntervalSeconds = maintenanceIntervalSeconds;
    return this;
  }

  public long getMaintenanceMaxAgeSeconds() {
    return maintenanceMaxAgeSeconds;
  }

  public AgentBusConfig setMaintenanceMaxAgeSeconds(long maintenanceMaxAgeSeconds) {
    this.maintenanceMaxAgeSeconds = maintenanceMaxAgeSeconds;
    return this;
  }
}
