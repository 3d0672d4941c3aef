package com.beapvault.message;

import java.util.Optional;

/**
 * Where messages live. The vault core only needs lookup, folder moves and status
 * updates; {@link #save} is used by import.
 */
public interface BeapMessageStore {

    Optional<BeapMessage> getMessageById(String messageId);

    void save(BeapMessage message);

    /** @throws MessageNotFoundException if the message does not exist */
    void moveToFolder(String messageId, BeapFolder folder);

    /** @throws MessageNotFoundException if the message does not exist */
    void updateMessageStatus(String messageId, String status);
}
