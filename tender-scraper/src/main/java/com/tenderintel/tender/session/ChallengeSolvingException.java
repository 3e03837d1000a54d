package com.tenderintel.tender.session;

public class ChallengeSolvingException extends RuntimeException {

    public ChallengeSolvingException(String message) {
        super(message);
    }

    public ChallengeSolvingException(String message, Throwable cause) {
        super(message, cause);
    }
}
