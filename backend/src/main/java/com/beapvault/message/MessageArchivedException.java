package com.beapvault.message;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/** The message is archived and its stored state is frozen. */
@ResponseStatus(HttpStatus.CONFLICT)
public class MessageArchivedException extends RuntimeException {

    public MessageArchivedException(String messageId) {
        super("Message is archived: " + messageId);
    }
}
