package com.xammer.cloudaudit.exception;

public class MalformedArnException extends IllegalArgumentException {

    public MalformedArnException(String arn) {
        super("Malformed ARN: '" + arn + "' (expected arn:partition:service:region:account:resource)");
    }
}
