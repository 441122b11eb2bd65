package dev.granary.source;

/**
 * Published after a reload changed the configuration set.
 *
 * @param sourceCount number of configurations now loaded
 */
public record SourceConfigsReloadedEvent(int sourceCount) {}
