package br.acquasys.infrastructure.telegram;

/**
 * Text message received through {@code getUpdates}. {@code text} may be null for non-text updates.
 */
public record TelegramUpdate(long updateId, String chatId, String text, String fromName) {
}
