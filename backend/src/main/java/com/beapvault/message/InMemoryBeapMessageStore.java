package com.beapvault.message;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBeapMessageStore implements BeapMessageStore {

    private final ConcurrentHashMap<String, BeapMessage> messages = new ConcurrentHashMap<>();

    @Override
    public Optional<BeapMessage> getMessageById(String messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    @Override
    public void save(BeapMessage message) {
        messages.put(message.id(), message);
    }

    @Override
    public void moveToFolder(String messageId, BeapFolder folder) {
        if (messages.computeIfPresent(messageId, (id, m) -> m.withFolder(folder)) == null) {
            throw new MessageNotFoundException(messageId);
        }
    }

    @Override
    public void updateMessageStatus(String messageId, String status) {
        if (messages.computeIfPresent(messageId, (id, m) -> m.withStatus(status)) == null) {
            throw new MessageNotFoundException(messageId);
        }
    }
}
