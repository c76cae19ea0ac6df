package com.example.ingestion.service.queue;

/**
 * Recognises Redis error replies inside Spring's translated exceptions.
 */
final class RedisErrors {

    private RedisErrors() {
    }

    static boolean isBusyGroup(Throwable error) {
        return hasReply(error, "BUSYGROUP");
    }

    static boolean isNoGroup(Throwable error) {
        return hasReply(error, "NOGROUP");
    }

    private static boolean hasReply(Throwable error, String code) {
        var current = error;
        while (current != null) {
            var message = current.getMessage();
            if (message != null && message.contains(code)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
