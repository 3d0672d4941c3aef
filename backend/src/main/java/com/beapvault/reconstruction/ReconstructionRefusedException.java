package com.beapvault.reconstruction;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Reconstruction was not allowed to start: the message is not accepted or the
 * bundled tools are not verified. No tool has run when this is thrown.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class ReconstructionRefusedException extends RuntimeException {

    public ReconstructionRefusedException(String message) {
        super(message);
    }
}
