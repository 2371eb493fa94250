package com.phillippitts.resumeguard.service.retry;

import com.phillippitts.resumeguard.config.properties.RecoveryProperties;
import com.phillippitts.resumeguard.exception.OperationTimeoutException;
import com.phillippitts.resumeguard.exception.SessionExpiredException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps a failure to an {@link ErrorKind}.
 *
 * <p>The exception type decides first, anywhere in the cause chain. Otherwise the messages of the
 * chain are matched, case-insensitively, against the configured auth and then network signatures.
 */
@Component
public class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 10;

    private final List<String> authSignatures;
    private final List<String> networkSignatures;

    public ErrorClassifier(RecoveryProperties props) {
        this.authSignatures = lowerCase(props.getRetry().getAuthSignatures());
        this.networkSignatures = lowerCase(props.getRetry().getNetworkSignatures());
    }

    public ErrorKind classify(Throwable error) {
        if (error == null) {
            return ErrorKind.GENERIC;
        }
        StringBuilder messages = new StringBuilder();
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof SessionExpiredException) {
                return ErrorKind.AUTH;
            }
            if (current instanceof OperationTimeoutException || current instanceof TimeoutException) {
                return ErrorKind.TIMEOUT;
            }
            if (current instanceof IOException) {
                return ErrorKind.NETWORK;
            }
            if (current.getMessage() != null) {
                messages.append(current.getMessage()).append('\n');
            }
            current = current.getCause();
        }

        String text = messages.toString().toLowerCase(Locale.ROOT);
        if (containsAny(text, authSignatures)) {
            return ErrorKind.AUTH;
        }
        if (containsAny(text, networkSignatures)) {
            return ErrorKind.NETWORK;
        }
        return ErrorKind.GENERIC;
    }

    private static boolean containsAny(String text, List<String> signatures) {
        for (String s : signatures) {
            if (!s.isEmpty() && text.contains(s)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> lowerCase(List<String> values) {
        return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).toList();
    }
}
