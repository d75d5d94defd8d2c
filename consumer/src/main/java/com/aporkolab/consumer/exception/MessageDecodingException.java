package com.aporkolab.consumer.exception;

public class MessageDecodingException extends ConsumerException {

    public static final String CODE = "MESSAGE_DECODING_FAILED";

    public MessageDecodingException(Class<?> targetType, Throwable cause) {
        super(CODE, String.format("Failed to decode message body as %s: %s",
                targetType.getSimpleName(), cause.getMessage()), cause);
        with("targetType", targetType.getName());
    }
}
