package org.springaicommunity.clabot;

/**
 * A repository label the bot manages.
 *
 * @param name label name
 * @param color hex color without the leading '#'
 * @param description label description
 */
public record LabelDefinition(String name, String color, String description) {
}
